package com.can.autodiscovery.cluster;

import java.util.Objects;

/**
 * Yapılandırma uç noktasının bildirdiği tek bir önbellek düğümü. Uç nokta her
 * düğümü {@code host|ip|port} üçlüsü olarak döner; bağlantı kurulurken IP adresi
 * varsa o, yoksa host adı kullanılır.
 */
public record CacheNode(String hostname, String ip, int port)
{
    public CacheNode
    {
        hostname = hostname == null ? "" : hostname;
        ip = ip == null ? "" : ip;
        if (hostname.isEmpty() && ip.isEmpty()) {
            throw new IllegalArgumentException("Cache node needs a hostname or an ip address");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Cache node port out of range: " + port);
        }
    }

    public static CacheNode of(String host, int port)
    {
        return new CacheNode(Objects.requireNonNull(host, "host"), "", port);
    }

    public String address()
    {
        return ip.isEmpty() ? hostname : ip;
    }

    public String id()
    {
        return address() + ':' + port;
    }

    @Override
    public String toString()
    {
        return hostname + '|' + ip + '|' + port;
    }
}
