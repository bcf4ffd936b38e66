package com.libragraph.workqueue.core.dao;

import com.libragraph.workqueue.core.queue.WorkItemStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

/** Binds {@link WorkItemStatus} as its SMALLINT id. */
public class WorkItemStatusArgumentFactory extends AbstractArgumentFactory<WorkItemStatus> {

    public WorkItemStatusArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(WorkItemStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
