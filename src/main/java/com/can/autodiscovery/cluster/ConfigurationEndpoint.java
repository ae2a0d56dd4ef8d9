package com.can.autodiscovery.cluster;

import com.can.autodiscovery.core.CacheConfigurationException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Kümenin güncel düğüm listesini sunan tek ve sabit yapılandırma uç noktasıdır.
 * Her istemci örneği tam olarak bir uç nokta ile çalışır; sunucu tanımı
 * ayrıştırılırken birden fazla adres veya {@code host:port} dışındaki biçimler
 * reddedilir.
 */
public record ConfigurationEndpoint(String host, int port)
{
    public ConfigurationEndpoint
    {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new CacheConfigurationException("Configuration endpoint host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new CacheConfigurationException("Configuration endpoint port out of range: " + port);
        }
    }

    /**
     * Virgül veya noktalı virgülle ayrılmış sunucu tanımını ayrıştırır.
     */
    public static ConfigurationEndpoint parse(String servers)
    {
        if (servers == null || servers.isBlank()) {
            throw new CacheConfigurationException("A configuration endpoint must be provided");
        }
        List<String> entries = Arrays.stream(servers.split("[;,]"))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
        return of(entries);
    }

    public static ConfigurationEndpoint of(List<String> servers)
    {
        Objects.requireNonNull(servers, "servers");
        if (servers.size() != 1) {
            throw new CacheConfigurationException(
                    "Cluster cache should be configured with only one server (configuration endpoint)");
        }
        String server = servers.get(0).trim();
        String[] parts = server.split(":", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new CacheConfigurationException("Server configuration should be in format host:port, got: " + server);
        }
        int port;
        try {
            port = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new CacheConfigurationException("Server port must be numeric, got: " + server, e);
        }
        return new ConfigurationEndpoint(parts[0].trim(), port);
    }

    @Override
    public String toString()
    {
        return host + ':' + port;
    }
}
