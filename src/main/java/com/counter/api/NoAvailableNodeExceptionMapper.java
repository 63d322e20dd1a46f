package com.counter.api;

import com.counter.cluster.NoAvailableNodeException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class NoAvailableNodeExceptionMapper implements ExceptionMapper<NoAvailableNodeException> {

    private static final Logger LOG = Logger.getLogger(NoAvailableNodeExceptionMapper.class);

    @Override
    public Response toResponse(NoAvailableNodeException exception) {
        LOG.error("No storage node available", exception);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(new CounterResource.ErrorResponse("error", exception.getMessage()))
                .build();
    }
}
