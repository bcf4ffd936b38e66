package com.libragraph.workqueue.api.error;

import com.libragraph.workqueue.core.queue.IllegalStateTransitionException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class IllegalTransitionExceptionMapper implements ExceptionMapper<IllegalStateTransitionException> {

    @Override
    public Response toResponse(IllegalStateTransitionException e) {
        return ErrorResponse.of(Response.Status.BAD_REQUEST, e.getMessage());
    }
}
