package com.libragraph.workqueue.core.health;

import com.libragraph.workqueue.core.db.DatabaseService;
import com.libragraph.workqueue.core.queue.WorkItemStatus;
import com.libragraph.workqueue.core.queue.WorkItemStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.util.Map;

@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Inject
    WorkItemStore store;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("database");
        try {
            if (!databaseService.ping()) {
                return builder.down().withData("state", databaseService.state().name()).build();
            }
            builder.up().withData("version", String.valueOf(databaseService.pgVersion()));
            Map<WorkItemStatus, Long> counts = store.countByStatus();
            counts.forEach((status, count) -> builder.withData(status.label(), count));
            return builder.build();
        } catch (Exception e) {
            return builder.down().withData("error", String.valueOf(e.getMessage())).build();
        }
    }
}
