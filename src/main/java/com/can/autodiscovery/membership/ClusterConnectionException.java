package com.can.autodiscovery.membership;

import com.can.autodiscovery.cluster.ConfigurationEndpoint;

import java.util.Objects;

/**
 * Yapılandırma uç noktasına ulaşılamadığında keşfi tetikleyen işleme
 * fırlatılan hatadır. Uç nokta bilgisini ve asıl bağlantı hatasını taşır.
 */
public class ClusterConnectionException extends RuntimeException
{
    private final transient ConfigurationEndpoint endpoint;

    public ClusterConnectionException(ConfigurationEndpoint endpoint, Throwable cause)
    {
        super("Cannot connect to cluster " + endpoint + " (" + describe(cause) + ")", cause);
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public ConfigurationEndpoint endpoint()
    {
        return endpoint;
    }

    private static String describe(Throwable cause)
    {
        if (cause == null) {
            return "unknown cause";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
