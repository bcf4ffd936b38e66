package com.libragraph.workqueue.core.dao;

import com.libragraph.workqueue.core.queue.WorkItemStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record StatusCount(
        @ColumnName("status") WorkItemStatus status,
        @ColumnName("count") long count
) {}
