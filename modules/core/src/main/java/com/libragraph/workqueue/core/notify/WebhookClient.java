package com.libragraph.workqueue.core.notify;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Outbound webhooks, built programmatically once per target URL. Each instance is used
 * for one of the two methods.
 */
public interface WebhookClient {

    String SOURCE_HEADER = "X-Webhook-Source";
    String SOURCE = "workqueue-worker";

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    Response postCompletion(@HeaderParam(SOURCE_HEADER) String source, CompletionNotification notification);

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    Response postAlert(@HeaderParam(SOURCE_HEADER) String source, CriticalAlert alert);
}
