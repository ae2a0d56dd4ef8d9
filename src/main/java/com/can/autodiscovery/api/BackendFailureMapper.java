package com.can.autodiscovery.api;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Düğüm iletişim hataları ve geçersiz küme yapılandırması gibi arka uç
 * hatalarını 502 olarak döner.
 */
@Provider
public class BackendFailureMapper implements ExceptionMapper<IllegalStateException> {

    private static final Logger LOG = Logger.getLogger(BackendFailureMapper.class);

    @Override
    public Response toResponse(IllegalStateException exception) {
        LOG.warnf("Cache backend failure: %s", exception.getMessage());
        return ClusterUnavailableMapper.error(Response.Status.BAD_GATEWAY, exception.getMessage());
    }
}
