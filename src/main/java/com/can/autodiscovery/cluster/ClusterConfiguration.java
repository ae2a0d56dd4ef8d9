package com.can.autodiscovery.cluster;

import java.util.List;
import java.util.Objects;

/**
 * Tek bir keşif çağrısının sonucu: uç noktanın bildirdiği yapılandırma sürümü
 * ve sıralı, değiştirilemez düğüm listesi. Bir sonraki keşif bu nesneyi
 * birleştirmeden, bütünüyle değiştirir.
 */
public record ClusterConfiguration(long version, List<CacheNode> nodes)
{
    public static final ClusterConfiguration EMPTY = new ClusterConfiguration(0L, List.of());

    public ClusterConfiguration
    {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
    }

    /**
     * Küme yapılandırmasını desteklemeyen bir uç noktanın kendisini tek düğüm
     * olarak kabul eden yapılandırma.
     */
    public static ClusterConfiguration singleNode(ConfigurationEndpoint endpoint)
    {
        return new ClusterConfiguration(1L, List.of(CacheNode.of(endpoint.host(), endpoint.port())));
    }

    public boolean isEmpty()
    {
        return nodes.isEmpty();
    }
}
