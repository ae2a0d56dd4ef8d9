package com.can.autodiscovery.core;

import com.can.autodiscovery.client.ClientBehaviors;
import com.can.autodiscovery.client.ClientCache;
import com.can.autodiscovery.client.ClientScope;
import com.can.autodiscovery.client.MemcachedClient;
import com.can.autodiscovery.client.MemcachedClientFactory;
import com.can.autodiscovery.cluster.ConfigurationEndpoint;
import com.can.autodiscovery.discovery.ClusterDiscoverer;
import com.can.autodiscovery.membership.MembershipCache;
import com.can.autodiscovery.metric.Counter;
import com.can.autodiscovery.metric.MetricsRegistry;
import com.can.autodiscovery.metric.Timer;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Yapılandırma uç noktasından keşfedilen memcached kümesi üzerinde çalışan,
 * kendini onaran önbellek. Her işlem güncel üyelikle kurulmuş istemci üzerinde
 * yürütülür; işlem herhangi bir çalışma zamanı hatasıyla biterse önce üyelik
 * önbelleği, ardından istemci önbelleği geçersiz kılınır ve aynı hata çağırana
 * iletilir. Sonraki işlem kümeyi yeniden keşfeder. Çağrı içinde yeniden deneme
 * yapılmaz.
 *
 * <p>Örnek oluşturmak ağ trafiği üretmez, ilk keşif ilk işlemde yapılır.
 */
public final class AutoDiscoveryCache implements CacheBackend, AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(AutoDiscoveryCache.class);

    private final MembershipCache membership;
    private final ClientCache clients;

    private final Counter hits, misses, failures;
    private final Timer tGet, tGetMany, tSet, tSetMany, tDelete;

    private AutoDiscoveryCache(MembershipCache membership, ClientCache clients, MetricsRegistry metrics)
    {
        this.membership = membership;
        this.clients = clients;
        if (metrics != null) {
            this.hits = metrics.counter("cache_hits");
            this.misses = metrics.counter("cache_misses");
            this.failures = metrics.counter("cache_operation_failures");
            this.tGet = metrics.timer("cache_get");
            this.tGetMany = metrics.timer("cache_get_many");
            this.tSet = metrics.timer("cache_set");
            this.tSetMany = metrics.timer("cache_set_many");
            this.tDelete = metrics.timer("cache_delete");
        } else {
            this.hits = this.misses = this.failures = null;
            this.tGet = this.tGetMany = this.tSet = this.tSetMany = this.tDelete = null;
        }
    }

    public static Builder builder(String servers)
    {
        return new Builder(ConfigurationEndpoint.parse(servers));
    }

    public static Builder builder(List<String> servers)
    {
        return new Builder(ConfigurationEndpoint.of(servers));
    }

    @Override
    public Optional<String> get(String key)
    {
        String value = withSelfHealing("get", tGet, client -> client.get(key));
        if (value == null) {
            if (misses != null) misses.inc();
            return Optional.empty();
        }
        if (hits != null) hits.inc();
        return Optional.of(value);
    }

    @Override
    public Map<String, String> getMany(Collection<String> keys)
    {
        Objects.requireNonNull(keys, "keys");
        return withSelfHealing("getMany", tGetMany, client -> client.getMany(keys));
    }

    @Override
    public boolean set(String key, String value, Duration ttl)
    {
        Objects.requireNonNull(value, "value");
        return withSelfHealing("set", tSet, client -> client.set(key, value, ttl));
    }

    @Override
    public boolean setMany(Map<String, String> entries, Duration ttl)
    {
        Objects.requireNonNull(entries, "entries");
        return withSelfHealing("setMany", tSetMany, client -> client.setMany(entries, ttl));
    }

    @Override
    public boolean delete(String key)
    {
        return withSelfHealing("delete", tDelete, client -> client.delete(key));
    }

    /**
     * Üyelik ve istemci önbelleklerini birlikte boşaltır. Sıra önemlidir:
     * istemci, üyelik yenilenmeden yeniden kurulmamalıdır. Arada başka bir
     * thread'in yeni nesille kurduğu istemci bırakılmaz.
     */
    public void invalidate()
    {
        long generation = membership.invalidate();
        clients.invalidateBefore(generation);
    }

    public boolean isWarm()
    {
        return membership.isPopulated() && clients.isPopulated();
    }

    public ConfigurationEndpoint endpoint()
    {
        return membership.endpoint();
    }

    @Override
    public void close()
    {
        clients.close();
    }

    private <T> T withSelfHealing(String operation, Timer timer, Function<MemcachedClient, T> call)
    {
        long start = System.nanoTime();
        try {
            return call.apply(clients.getClient());
        } catch (RuntimeException e) {
            if (failures != null) failures.inc();
            LOG.debugf(e, "Cache operation %s failed against %s, invalidating cluster membership",
                    operation, membership.endpoint());
            invalidate();
            throw e;
        } finally {
            if (timer != null) timer.recordSince(start);
        }
    }

    public static final class Builder
    {
        private final ConfigurationEndpoint endpoint;
        private Optional<Duration> discoveryTimeout = Optional.empty();
        private boolean ignoreClusterErrors;
        private ClientScope clientScope = ClientScope.SHARED;
        private ClientBehaviors behaviors = ClientBehaviors.DEFAULTS;
        private ClusterDiscoverer discoverer;
        private MemcachedClientFactory clientFactory;
        private Consumer<MemcachedClient> retirement = MemcachedClient::close;
        private MetricsRegistry metrics;

        private Builder(ConfigurationEndpoint endpoint) { this.endpoint = endpoint; }

        public Builder discoveryTimeout(Duration timeout) { this.discoveryTimeout = Optional.ofNullable(timeout); return this; }
        public Builder discoveryTimeout(Optional<Duration> timeout) { this.discoveryTimeout = Objects.requireNonNull(timeout); return this; }
        public Builder ignoreClusterErrors(boolean ignore) { this.ignoreClusterErrors = ignore; return this; }
        public Builder clientScope(ClientScope scope) { this.clientScope = Objects.requireNonNull(scope); return this; }
        public Builder behaviors(ClientBehaviors b) { this.behaviors = Objects.requireNonNull(b); return this; }
        public Builder behaviors(Map<String, String> options) { this.behaviors = ClientBehaviors.fromMap(options); return this; }
        public Builder discoverer(ClusterDiscoverer d) { this.discoverer = d; return this; }
        public Builder clientFactory(MemcachedClientFactory f) { this.clientFactory = f; return this; }
        public Builder retirement(Consumer<MemcachedClient> r) { this.retirement = Objects.requireNonNull(r); return this; }
        public Builder metrics(MetricsRegistry m) { this.metrics = m; return this; }

        public AutoDiscoveryCache build()
        {
            if (discoverer == null) {
                throw new CacheConfigurationException("A cluster discoverer must be configured");
            }
            if (clientFactory == null) {
                throw new CacheConfigurationException("A memcached client factory must be configured");
            }
            MembershipCache membership = new MembershipCache(discoverer, endpoint, discoveryTimeout,
                    ignoreClusterErrors, metrics);
            ClientCache clients = new ClientCache(membership, clientFactory, behaviors,
                    clientScope.createStorage(), retirement, metrics);
            return new AutoDiscoveryCache(membership, clients, metrics);
        }
    }
}
