package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.CacheNode;

import java.util.List;

/**
 * Bir düğüm listesi ve istemci ayarlarından yeni bir {@link MemcachedClient}
 * kurar. Ayarlar yalnızca kurulum anında uygulanır.
 */
@FunctionalInterface
public interface MemcachedClientFactory
{
    MemcachedClient create(List<CacheNode> nodes, ClientBehaviors behaviors);
}
