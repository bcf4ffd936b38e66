package com.libragraph.workqueue.api.error;

import com.libragraph.workqueue.core.queue.StoreUnavailableException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class StoreUnavailableExceptionMapper implements ExceptionMapper<StoreUnavailableException> {

    private static final Logger log = Logger.getLogger(StoreUnavailableExceptionMapper.class);

    @Override
    public Response toResponse(StoreUnavailableException e) {
        log.warnf("Request failed, store unavailable: %s", e.getMessage());
        return ErrorResponse.of(Response.Status.SERVICE_UNAVAILABLE, e.getMessage());
    }
}
