package com.can.autodiscovery.support;

import com.can.autodiscovery.client.MemcachedClient;
import com.can.autodiscovery.client.NodeCommunicationException;
import com.can.autodiscovery.cluster.CacheNode;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bellekte çalışan istemci sahtesi. Erişilemez olarak işaretlenen düğümlerden
 * birine sahip olduğunda her işlem {@link NodeCommunicationException} ile
 * başarısız olur; düğüm listesi boşsa gerçek istemci gibi davranır.
 */
public final class FakeMemcachedClient implements MemcachedClient {

    private final List<CacheNode> nodes;
    private final Map<String, String> store;
    private final Set<String> deadNodes;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger operations = new AtomicInteger();

    FakeMemcachedClient(List<CacheNode> nodes, Map<String, String> store, Set<String> deadNodes) {
        this.nodes = List.copyOf(nodes);
        this.store = store;
        this.deadNodes = deadNodes;
    }

    @Override
    public String get(String key) {
        check();
        return store.get(key);
    }

    @Override
    public Map<String, String> getMany(Collection<String> keys) {
        check();
        Map<String, String> result = new LinkedHashMap<>();
        for (String key : keys) {
            String value = store.get(key);
            if (value != null) {
                result.put(key, value);
            }
        }
        return result;
    }

    @Override
    public boolean set(String key, String value, Duration ttl) {
        check();
        store.put(key, value);
        return true;
    }

    @Override
    public boolean setMany(Map<String, String> entries, Duration ttl) {
        check();
        store.putAll(entries);
        return true;
    }

    @Override
    public boolean delete(String key) {
        check();
        return store.remove(key) != null;
    }

    @Override
    public List<CacheNode> nodes() {
        return nodes;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int operations() {
        return operations.get();
    }

    private void check() {
        operations.incrementAndGet();
        if (closed.get()) {
            throw new NodeCommunicationException("Client is closed");
        }
        if (nodes.isEmpty()) {
            throw new NodeCommunicationException("No cache nodes available");
        }
        for (CacheNode node : nodes) {
            if (deadNodes.contains(node.id())) {
                throw new NodeCommunicationException("Connection refused: " + node.id());
            }
        }
    }

    static Set<String> newDeadSet() {
        return ConcurrentHashMap.newKeySet();
    }
}
