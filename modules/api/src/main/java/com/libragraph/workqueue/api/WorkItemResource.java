package com.libragraph.workqueue.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.workqueue.core.event.WorkItemEvents;
import com.libragraph.workqueue.core.queue.WorkItem;
import com.libragraph.workqueue.core.queue.WorkItemNotFoundException;
import com.libragraph.workqueue.core.queue.WorkItemStatus;
import com.libragraph.workqueue.core.queue.WorkItemStore;
import com.libragraph.workqueue.core.worker.ExecutionError;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.jboss.logging.Logger;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP access to the work item store: producers create items, operators inspect them,
 * and remote workers claim and report through the same conditional writes the
 * in-process loop uses.
 */
@Path("/api/work-items")
@Produces(MediaType.APPLICATION_JSON)
public class WorkItemResource {

    private static final Logger log = Logger.getLogger(WorkItemResource.class);

    static final int MAX_LIMIT = 500;

    @Inject
    WorkItemStore store;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    WorkItemEvents events;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response create(JsonNode payload, @Context UriInfo uriInfo) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must be a JSON document");
        }
        long id = store.insert(toJson(payload));
        log.debugf("Created work item %d", id);
        URI location = uriInfo.getAbsolutePathBuilder().path(Long.toString(id)).build();
        return Response.created(location).entity(Map.of("id", id)).build();
    }

    @GET
    @Path("/{id}")
    public WorkItem get(@PathParam("id") long id) {
        return store.get(id).orElseThrow(() -> new WorkItemNotFoundException(id));
    }

    @GET
    public List<WorkItem> list(@QueryParam("status") String status,
                               @QueryParam("limit") @DefaultValue("50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        WorkItemStatus filter = status == null || status.isBlank() ? null : WorkItemStatus.fromLabel(status);
        return store.list(filter, limit);
    }

    @GET
    @Path("/stats")
    public Map<String, Long> stats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<WorkItemStatus, Long> e : store.countByStatus().entrySet()) {
            stats.put(e.getKey().label(), e.getValue());
            total += e.getValue();
        }
        stats.put("total", total);
        return stats;
    }

    @POST
    @Path("/claim")
    public Response claim(@QueryParam("workerId") String workerId) {
        return store.claimNext(workerId)
                .map(item -> Response.ok(item).build())
                .orElseGet(() -> Response.noContent().build());
    }

    @POST
    @Path("/{id}/complete")
    @Consumes(MediaType.APPLICATION_JSON)
    public WorkItem complete(@PathParam("id") long id, CompleteRequest request) {
        requireFence(request == null ? null : request.workerId(), request == null ? null : request.claimGeneration());
        String result = request.result() == null || request.result().isNull() ? null : toJson(request.result());
        WorkItem completed = store.complete(id, request.workerId(), request.claimGeneration(), result);
        events.finished(completed, request.workerId());
        return completed;
    }

    @POST
    @Path("/{id}/fail")
    @Consumes(MediaType.APPLICATION_JSON)
    public WorkItem fail(@PathParam("id") long id, FailRequest request) {
        requireFence(request == null ? null : request.workerId(), request == null ? null : request.claimGeneration());
        ExecutionError error = ExecutionError.of(request.error());
        String category = request.errorCategory() != null && !request.errorCategory().isBlank()
                ? request.errorCategory()
                : error.category();
        WorkItem failed = store.fail(id, request.workerId(), request.claimGeneration(), error.message(), category);
        events.finished(failed, request.workerId());
        return failed;
    }

    private static void requireFence(String workerId, Integer claimGeneration) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (claimGeneration == null) {
            throw new IllegalArgumentException("claimGeneration is required");
        }
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable JSON: " + e.getOriginalMessage(), e);
        }
    }
}
