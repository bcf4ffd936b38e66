package com.libragraph.workqueue.core.queue;

import com.fasterxml.jackson.annotation.JsonRawValue;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * One row of the {@code work_item} table.
 * <p>
 * {@code payload} and {@code result} hold JSON text and are rendered verbatim
 * when the record is serialized.
 */
public record WorkItem(
        @ColumnName("id") long id,
        @ColumnName("payload") @JsonRawValue String payload,
        @ColumnName("status") WorkItemStatus status,
        @ColumnName("owner") String owner,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt,
        @ColumnName("result") @JsonRawValue String result,
        @ColumnName("error") String error,
        @ColumnName("error_category") String errorCategory,
        @ColumnName("claim_generation") int claimGeneration,
        @ColumnName("reclaim_count") int reclaimCount,
        @ColumnName("reset_reason") String resetReason,
        @ColumnName("claimed_at") Instant claimedAt,
        @ColumnName("finished_at") Instant finishedAt
) {

    public boolean isOwnedBy(String workerId) {
        return status == WorkItemStatus.PROCESSING && owner != null && owner.equals(workerId);
    }
}
