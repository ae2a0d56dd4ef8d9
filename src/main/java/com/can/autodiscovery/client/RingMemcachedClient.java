package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.CacheNode;
import com.can.autodiscovery.cluster.ConsistentHashRing;
import com.can.autodiscovery.codec.Codec;
import com.can.autodiscovery.codec.StringCodec;
import com.can.autodiscovery.constants.MemcachedProtocol;
import io.vertx.core.net.NetClient;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kurulduğu düğüm listesini tutarlı hash halkasına yerleştirip her anahtarı
 * sahibi olan düğüme yönlendiren istemci. Çoklu okumalar düğüm başına tek bir
 * {@code get k1 k2 ...} komutuna gruplanır. Düğüm listesi boşsa her işlem
 * {@link NodeCommunicationException} ile başarısız olur.
 */
public final class RingMemcachedClient implements MemcachedClient
{
    private static final Logger LOG = Logger.getLogger(RingMemcachedClient.class);

    private final List<CacheNode> nodes;
    private final List<MemcachedNode> members = new ArrayList<>();
    private final ConsistentHashRing<MemcachedNode> ring;
    private final NetClient netClient;
    private final Codec<String> keyCodec = StringCodec.UTF8;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean();

    RingMemcachedClient(List<CacheNode> nodes, ClientBehaviors behaviors, NetClient netClient, Clock clock)
    {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        this.netClient = Objects.requireNonNull(netClient, "netClient");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ring = new ConsistentHashRing<>(behaviors.hash(), behaviors.virtualNodes());
        for (CacheNode node : this.nodes) {
            MemcachedNode member = new MemcachedNode(node, netClient, behaviors);
            members.add(member);
            ring.addNode(member, keyCodec.encode(node.id()));
        }
    }

    @Override
    public String get(String key)
    {
        validateKey(key);
        return nodeFor(key).get(List.of(key)).get(key);
    }

    @Override
    public Map<String, String> getMany(Collection<String> keys)
    {
        Objects.requireNonNull(keys, "keys");
        if (keys.isEmpty()) {
            return Map.of();
        }
        Map<MemcachedNode, List<String>> byNode = new LinkedHashMap<>();
        for (String key : keys) {
            validateKey(key);
            byNode.computeIfAbsent(nodeFor(key), n -> new ArrayList<>()).add(key);
        }
        Map<String, String> values = new LinkedHashMap<>();
        byNode.forEach((node, nodeKeys) -> values.putAll(node.get(nodeKeys)));
        return values;
    }

    @Override
    public boolean set(String key, String value, Duration ttl)
    {
        validateKey(key);
        Objects.requireNonNull(value, "value");
        return nodeFor(key).set(key, value, expiration(ttl));
    }

    @Override
    public boolean setMany(Map<String, String> entries, Duration ttl)
    {
        Objects.requireNonNull(entries, "entries");
        boolean allStored = true;
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (!set(entry.getKey(), entry.getValue(), ttl)) {
                allStored = false;
            }
        }
        return allStored;
    }

    @Override
    public boolean delete(String key)
    {
        validateKey(key);
        return nodeFor(key).delete(key);
    }

    @Override
    public List<CacheNode> nodes()
    {
        return nodes;
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        members.forEach(MemcachedNode::close);
        netClient.close().onFailure(e -> LOG.debugf(e, "Failed to close net client for nodes %s", nodes));
        LOG.debugf("Closed memcached client for nodes %s", nodes);
    }

    private MemcachedNode nodeFor(String key)
    {
        MemcachedNode node = ring.nodeFor(keyCodec.encode(key));
        if (node == null) {
            throw new NodeCommunicationException("No cache nodes available");
        }
        return node;
    }

    long expiration(Duration ttl)
    {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return 0L;
        }
        long seconds = ttl.getSeconds() + (ttl.getNano() > 0 ? 1 : 0);
        if (seconds <= MemcachedProtocol.MAX_RELATIVE_EXPIRATION_SECONDS) {
            return seconds;
        }
        return clock.instant().getEpochSecond() + seconds;
    }

    static void validateKey(String key)
    {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
        if (StringCodec.UTF8.encode(key).length > MemcachedProtocol.MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Cache key longer than " + MemcachedProtocol.MAX_KEY_LENGTH + " bytes");
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c <= ' ' || c == 0x7f) {
                throw new IllegalArgumentException("Cache key contains whitespace or control characters: " + key);
            }
        }
    }
}
