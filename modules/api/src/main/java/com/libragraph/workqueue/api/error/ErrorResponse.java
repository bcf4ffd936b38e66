package com.libragraph.workqueue.api.error;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

public record ErrorResponse(String error) {

    static Response of(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message))
                .build();
    }
}
