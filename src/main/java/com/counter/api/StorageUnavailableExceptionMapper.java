package com.counter.api;

import com.counter.cluster.StorageUnavailableException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/** Anahtarın düğümüne ulaşılamadığında 503 döner; bayat değer uydurulmaz. */
@Provider
public class StorageUnavailableExceptionMapper implements ExceptionMapper<StorageUnavailableException> {

    private static final Logger LOG = Logger.getLogger(StorageUnavailableExceptionMapper.class);

    @Override
    public Response toResponse(StorageUnavailableException exception) {
        LOG.debugf("Storage unavailable on node %s: %s", exception.nodeId(), exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .type(MediaType.APPLICATION_JSON)
                .entity(new CounterResource.ErrorResponse("error", exception.getMessage()))
                .build();
    }
}
