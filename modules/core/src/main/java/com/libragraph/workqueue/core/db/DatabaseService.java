package com.libragraph.workqueue.core.db;

import com.libragraph.workqueue.core.dao.DatabaseDao;
import com.libragraph.workqueue.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

/**
 * Root infrastructure service: verifies PostgreSQL connectivity at boot. The worker
 * pool declares a dependency on it and will not start while it is down.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    @Inject
    Jdbi jdbi;

    private String pgVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() {
        pgVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion);
        log.infof("Connected to: %s", pgVersion);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /**
     * Executes SELECT 1. Calls {@link #fail} on error; a successful ping while
     * FAILED restarts the service.
     */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            if (state() == State.FAILED) {
                log.info("Database reachable again, restarting service");
                start();
            }
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    public String pgVersion() {
        return pgVersion;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
