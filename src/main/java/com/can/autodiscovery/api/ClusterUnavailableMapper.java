package com.can.autodiscovery.api;

import com.can.autodiscovery.membership.ClusterConnectionException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Yapılandırma uç noktasına ulaşılamadığında 503 döner.
 */
@Provider
public class ClusterUnavailableMapper implements ExceptionMapper<ClusterConnectionException> {

    private static final Logger LOG = Logger.getLogger(ClusterUnavailableMapper.class);

    @Override
    public Response toResponse(ClusterConnectionException exception) {
        LOG.warnf("Cluster endpoint unavailable: %s", exception.getMessage());
        return error(Response.Status.SERVICE_UNAVAILABLE, exception.getMessage());
    }

    static Response error(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new CacheResource.ErrorResponse(message))
                .build();
    }
}
