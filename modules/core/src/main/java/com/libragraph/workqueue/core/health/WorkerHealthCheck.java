package com.libragraph.workqueue.core.health;

import com.libragraph.workqueue.core.service.ManagedService;
import com.libragraph.workqueue.core.worker.WorkerLoop;
import com.libragraph.workqueue.core.worker.WorkerService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;

import java.util.List;

/** Down when the pool failed or a started loop thread has exited. */
@Liveness
@ApplicationScoped
public class WorkerHealthCheck implements HealthCheck {

    @Inject
    WorkerService workerService;

    @Override
    public HealthCheckResponse call() {
        List<WorkerLoop> loops = workerService.loops();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("workers")
                .withData("enabled", workerService.isEnabled())
                .withData("state", workerService.state().name())
                .withData("loops", loops.size());

        boolean up = workerService.state() != ManagedService.State.FAILED;
        for (WorkerLoop loop : loops) {
            builder.withData(loop.workerId(), loop.isRunning() ? loop.phase().name() : "STOPPED");
            if (!loop.isRunning() && workerService.isRunning()) {
                up = false;
            }
        }
        return builder.status(up).build();
    }
}
