package com.libragraph.workqueue.api.error;

import com.libragraph.workqueue.core.queue.WorkItemConflictException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class ConflictExceptionMapper implements ExceptionMapper<WorkItemConflictException> {

    @Override
    public Response toResponse(WorkItemConflictException e) {
        return ErrorResponse.of(Response.Status.CONFLICT, e.getMessage());
    }
}
