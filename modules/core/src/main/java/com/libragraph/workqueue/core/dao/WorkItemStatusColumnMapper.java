package com.libragraph.workqueue.core.dao;

import com.libragraph.workqueue.core.queue.WorkItemStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class WorkItemStatusColumnMapper implements ColumnMapper<WorkItemStatus> {

    @Override
    public WorkItemStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return WorkItemStatus.fromId(r.getShort(columnNumber));
    }
}
