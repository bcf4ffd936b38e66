package com.libragraph.workqueue.core.queue;

import com.libragraph.workqueue.core.dao.StatusCount;
import com.libragraph.workqueue.core.dao.WorkItemDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.ConnectionException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jboss.logging.Logger;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed {@link WorkItemStore}. Each operation is a single statement
 * executed in auto-commit mode; no lock outlives the statement.
 */
@ApplicationScoped
public class JdbiWorkItemStore implements WorkItemStore {

    private static final Logger log = Logger.getLogger(JdbiWorkItemStore.class);

    @Inject
    Jdbi jdbi;

    public JdbiWorkItemStore() {
    }

    public JdbiWorkItemStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public long insert(String payloadJson) {
        long id = guard("insert", () -> jdbi.withExtension(WorkItemDao.class,
                dao -> dao.insert(payloadJson, WorkItemStatus.PENDING)));
        log.debugf("Work item created: id=%d", id);
        return id;
    }

    @Override
    public Optional<WorkItem> get(long id) {
        return guard("get", () -> jdbi.withExtension(WorkItemDao.class, dao -> dao.findById(id)));
    }

    @Override
    public WorkItem updateStatus(long id, WorkItemStatus expected, WorkItemStatus next, StatusUpdate fields) {
        WorkItemStore.checkTransition(expected, next);
        StatusUpdate f = fields != null ? fields : StatusUpdate.none();

        Optional<WorkItem> written = guard("updateStatus", () -> jdbi.withExtension(WorkItemDao.class,
                dao -> dao.updateStatus(id, expected, next, next.isTerminal(),
                        f.expectedOwner(), f.expectedGeneration(),
                        next == WorkItemStatus.COMPLETED ? f.result() : null,
                        next == WorkItemStatus.FAILED ? f.error() : null,
                        next == WorkItemStatus.FAILED ? f.errorCategory() : null)));

        if (written.isPresent()) {
            log.debugf("Work item %d: %s -> %s", id, expected, next);
            return written.get();
        }

        // Nothing matched: tell a missing row apart from a lost precondition
        WorkItem current = get(id).orElseThrow(() -> new WorkItemNotFoundException(id));
        throw new WorkItemConflictException(id, expected, current.status(), current.owner());
    }

    @Override
    public Optional<WorkItem> claimNext(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        Optional<WorkItem> claimed = guard("claimNext", () -> jdbi.withExtension(WorkItemDao.class,
                dao -> dao.claimNext(workerId, WorkItemStatus.PENDING, WorkItemStatus.PROCESSING)));
        claimed.ifPresent(item -> log.debugf("Work item %d claimed by %s (generation %d)",
                (Object) item.id(), workerId, item.claimGeneration()));
        return claimed;
    }

    @Override
    public List<WorkItem> reclaimStale(Duration timeout, String reason) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        return guard("reclaimStale", () -> jdbi.withExtension(WorkItemDao.class,
                dao -> dao.reclaimStale(timeout, reason, WorkItemStatus.PENDING, WorkItemStatus.PROCESSING)));
    }

    @Override
    public List<WorkItem> list(WorkItemStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return guard("list", () -> jdbi.withExtension(WorkItemDao.class, dao -> dao.list(status, limit)));
    }

    @Override
    public Map<WorkItemStatus, Long> countByStatus() {
        List<StatusCount> rows = guard("countByStatus",
                () -> jdbi.withExtension(WorkItemDao.class, WorkItemDao::countByStatus));
        Map<WorkItemStatus, Long> counts = new EnumMap<>(WorkItemStatus.class);
        for (WorkItemStatus s : WorkItemStatus.values()) {
            counts.put(s, 0L);
        }
        for (StatusCount row : rows) {
            counts.put(row.status(), row.count());
        }
        return counts;
    }

    private <T> T guard(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (JdbiException e) {
            if (isUnavailable(e)) {
                throw new StoreUnavailableException("Work item store unavailable during " + operation, e);
            }
            throw e;
        }
    }

    /**
     * Connection failures, SQLSTATE class 08 (connection exception) and
     * 57P01..57P03 (server shutting down / not accepting connections).
     */
    static boolean isUnavailable(Throwable t) {
        if (t instanceof ConnectionException) {
            return true;
        }
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SQLTransientConnectionException) {
                return true;
            }
            if (c instanceof SQLException sql && sql.getSQLState() != null) {
                String state = sql.getSQLState();
                if (state.startsWith("08") || state.startsWith("57P0")) {
                    return true;
                }
            }
        }
        return false;
    }
}
