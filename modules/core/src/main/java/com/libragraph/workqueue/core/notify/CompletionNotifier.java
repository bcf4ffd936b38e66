package com.libragraph.workqueue.core.notify;

import com.libragraph.workqueue.core.event.WorkItemFinishedEvent;
import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemStatus;
import com.libragraph.workqueue.core.worker.ExecutionError;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.ObservesAsync;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.jboss.logging.Logger;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Best-effort HTTP callbacks after an item reaches a terminal state, plus an alert
 * push for failures in a critical category.
 * <p>
 * Runs on the event executor. A failed delivery is logged and dropped; the store is
 * never touched from here.
 */
@ApplicationScoped
public class CompletionNotifier {

    private static final Logger log = Logger.getLogger(CompletionNotifier.class);

    @ConfigProperty(name = "workqueue.notifier.callback-url")
    Optional<String> callbackUrl;

    @ConfigProperty(name = "workqueue.notifier.path", defaultValue = "/api/webhooks/work-items")
    String path;

    @ConfigProperty(name = "workqueue.notifier.timeout", defaultValue = "10s")
    Duration timeout;

    @ConfigProperty(name = "workqueue.notifier.alert-path", defaultValue = "/api/webhooks/alerts")
    String alertPath;

    @ConfigProperty(name = "workqueue.notifier.alert-timeout", defaultValue = "5s")
    Duration alertTimeout;

    private WebhookClient completionClient;
    private WebhookClient alertClient;

    @PostConstruct
    void init() {
        Optional<String> base = callbackUrl.filter(s -> !s.isBlank());
        if (base.isEmpty()) {
            log.debug("No completion callback configured");
            return;
        }
        URI completionTarget = resolve(base.get(), path);
        URI alertTarget = resolve(base.get(), alertPath);
        completionClient = build(completionTarget, timeout);
        alertClient = build(alertTarget, alertTimeout);
        log.infof("Completion callbacks enabled: %s (alerts: %s)", completionTarget, alertTarget);
    }

    void onFinished(@ObservesAsync WorkItemFinishedEvent event) {
        WorkItem item = event.item();
        send(item, event.workerId());
        if (item.status() == WorkItemStatus.FAILED && ExecutionError.isCritical(item.errorCategory())) {
            alert(item, event.workerId());
        }
    }

    /**
     * Sends one completion notification.
     *
     * @return true when the callback answered with a 2xx status
     */
    public boolean send(WorkItem item, String workerId) {
        if (completionClient == null) {
            log.debugf("Skipping completion callback for work item %d: no callback URL", item.id());
            return false;
        }
        CompletionNotification notification = CompletionNotification.of(item, workerId);
        return deliver("Completion callback", item,
                () -> completionClient.postCompletion(WebhookClient.SOURCE, notification));
    }

    /**
     * Pushes a critical-error alert for a failed item.
     *
     * @return true when the alert endpoint answered with a 2xx status
     */
    public boolean alert(WorkItem item, String workerId) {
        if (alertClient == null) {
            log.debugf("Skipping critical alert for work item %d: no callback URL", item.id());
            return false;
        }
        CriticalAlert alert = CriticalAlert.of(item, workerId);
        return deliver("Critical alert", item, () -> alertClient.postAlert(WebhookClient.SOURCE, alert));
    }

    public boolean isConfigured() {
        return completionClient != null;
    }

    private boolean deliver(String what, WorkItem item, Supplier<Response> call) {
        try (Response response = call.get()) {
            if (response.getStatusInfo().getFamily() != Response.Status.Family.SUCCESSFUL) {
                log.warnf("%s for work item %d answered %d", what, item.id(), response.getStatus());
                return false;
            }
            log.debugf("%s for work item %d answered %d", what, item.id(), response.getStatus());
            return true;
        } catch (RuntimeException e) {
            log.warnf("%s for work item %d (%s) failed: %s", what, item.id(), item.status().label(), e.getMessage());
            return false;
        }
    }

    private static WebhookClient build(URI target, Duration timeout) {
        return RestClientBuilder.newBuilder()
                .baseUri(target)
                .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .followRedirects(false)
                .build(WebhookClient.class);
    }

    private static URI resolve(String base, String path) {
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create(trimmed + suffix);
    }
}
