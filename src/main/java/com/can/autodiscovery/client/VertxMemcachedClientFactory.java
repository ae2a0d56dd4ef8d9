package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.CacheNode;
import io.vertx.core.Vertx;
import io.vertx.core.net.NetClientOptions;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Her istemci için ayarlara göre yapılandırılmış ayrı bir Vert.x
 * {@code NetClient} açarak {@link RingMemcachedClient} kurar.
 */
public final class VertxMemcachedClientFactory implements MemcachedClientFactory
{
    private final Vertx vertx;
    private final Clock clock;

    public VertxMemcachedClientFactory(Vertx vertx)
    {
        this(vertx, Clock.systemUTC());
    }

    public VertxMemcachedClientFactory(Vertx vertx, Clock clock)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MemcachedClient create(List<CacheNode> nodes, ClientBehaviors behaviors)
    {
        NetClientOptions options = new NetClientOptions()
                .setConnectTimeout(behaviors.connectTimeoutMillis())
                .setTcpNoDelay(behaviors.tcpNoDelay())
                .setReuseAddress(true);
        return new RingMemcachedClient(nodes, behaviors, vertx.createNetClient(options), clock);
    }
}
