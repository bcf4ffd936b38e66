package com.libragraph.workqueue.core.dao;

import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(WorkItemStatusColumnMapper.class)
@RegisterArgumentFactory(WorkItemStatusArgumentFactory.class)
@RegisterConstructorMapper(WorkItem.class)
@RegisterConstructorMapper(StatusCount.class)
public interface WorkItemDao {

    @SqlUpdate("INSERT INTO work_item (payload, status) VALUES (CAST(:payload AS jsonb), :status)")
    @GetGeneratedKeys("id")
    long insert(@Bind("payload") String payload, @Bind("status") WorkItemStatus status);

    @SqlQuery("SELECT * FROM work_item WHERE id = :id")
    Optional<WorkItem> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM work_item " +
            "WHERE (CAST(:status AS smallint) IS NULL OR status = :status) " +
            "ORDER BY created_at, id LIMIT :limit")
    List<WorkItem> list(@Bind("status") WorkItemStatus status, @Bind("limit") int limit);

    @SqlQuery("SELECT status, COUNT(*) AS count FROM work_item GROUP BY status")
    List<StatusCount> countByStatus();

    /**
     * Conditional write: matches only while the row still has {@code expected} status
     * and, when given, the expected owner and claim generation. The owner is always
     * cleared since {@code next} is never PROCESSING here.
     */
    @SqlQuery("UPDATE work_item SET status = :next, owner = NULL, updated_at = now(), " +
            "result = CAST(:result AS jsonb), error = :error, error_category = :errorCategory, " +
            "finished_at = CASE WHEN :terminal THEN now() ELSE finished_at END " +
            "WHERE id = :id AND status = :expected " +
            "AND (CAST(:expectedOwner AS text) IS NULL OR owner = :expectedOwner) " +
            "AND (CAST(:expectedGeneration AS integer) IS NULL OR claim_generation = :expectedGeneration) " +
            "RETURNING *")
    Optional<WorkItem> updateStatus(@Bind("id") long id,
                                    @Bind("expected") WorkItemStatus expected,
                                    @Bind("next") WorkItemStatus next,
                                    @Bind("terminal") boolean terminal,
                                    @Bind("expectedOwner") String expectedOwner,
                                    @Bind("expectedGeneration") Integer expectedGeneration,
                                    @Bind("result") String result,
                                    @Bind("error") String error,
                                    @Bind("errorCategory") String errorCategory);

    /**
     * Claims the oldest pending item in one statement. The CTE locks the candidate
     * row with SKIP LOCKED, so concurrent claimants move on to the next-oldest row
     * instead of waiting.
     */
    @SqlQuery("""
            WITH candidate AS (
                SELECT id
                FROM work_item
                WHERE status = :pending
                ORDER BY created_at, id
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            UPDATE work_item w
            SET status = :processing,
                owner = :workerId,
                updated_at = now(),
                claimed_at = now(),
                claim_generation = w.claim_generation + 1
            FROM candidate
            WHERE w.id = candidate.id
            RETURNING w.*
            """)
    Optional<WorkItem> claimNext(@Bind("workerId") String workerId,
                                 @Bind("pending") WorkItemStatus pending,
                                 @Bind("processing") WorkItemStatus processing);

    /**
     * Returns stale PROCESSING rows to PENDING. The predicate is re-checked per row at
     * write time, so a row that reached a terminal state meanwhile is left alone.
     */
    @SqlQuery("UPDATE work_item SET status = :pending, owner = NULL, updated_at = now(), " +
            "reset_reason = :reason, reclaim_count = reclaim_count + 1 " +
            "WHERE status = :processing AND updated_at < now() - :timeout " +
            "RETURNING *")
    List<WorkItem> reclaimStale(@Bind("timeout") Duration timeout,
                                @Bind("reason") String reason,
                                @Bind("pending") WorkItemStatus pending,
                                @Bind("processing") WorkItemStatus processing);
}
