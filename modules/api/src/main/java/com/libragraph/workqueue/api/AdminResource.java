package com.libragraph.workqueue.api;

import com.libragraph.workqueue.core.recovery.StaleClaimReclaimer;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

@Path("/api/admin")
@Produces(MediaType.APPLICATION_JSON)
public class AdminResource {

    @Inject
    StaleClaimReclaimer reclaimer;

    /** Runs one reclaim sweep now. {@code timeout} is ISO-8601, e.g. {@code PT30M}. */
    @POST
    @Path("/reclaim")
    public Map<String, Object> reclaim(@QueryParam("timeout") String timeout) {
        Duration effective = timeout == null || timeout.isBlank() ? reclaimer.timeout() : parse(timeout);
        int reclaimed = reclaimer.reclaim(effective);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reclaimed", reclaimed);
        body.put("timeout", effective.toString());
        return body;
    }

    private static Duration parse(String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("timeout must be an ISO-8601 duration: " + value, e);
        }
    }
}
