package com.libragraph.workqueue.api.error;

import com.libragraph.workqueue.core.queue.WorkItemNotFoundException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class NotFoundExceptionMapper implements ExceptionMapper<WorkItemNotFoundException> {

    @Override
    public Response toResponse(WorkItemNotFoundException e) {
        return ErrorResponse.of(Response.Status.NOT_FOUND, e.getMessage());
    }
}
