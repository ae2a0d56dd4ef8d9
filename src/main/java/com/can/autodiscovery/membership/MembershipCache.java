package com.can.autodiscovery.membership;

import com.can.autodiscovery.cluster.CacheNode;
import com.can.autodiscovery.cluster.ClusterConfiguration;
import com.can.autodiscovery.cluster.ConfigurationEndpoint;
import com.can.autodiscovery.discovery.ClusterDiscoverer;
import com.can.autodiscovery.metric.Counter;
import com.can.autodiscovery.metric.MetricsRegistry;
import com.can.autodiscovery.metric.Timer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * En son keşfedilen küme yapılandırmasını bellekte tutar. Yapılandırma ilk
 * ihtiyaçta keşfedilir, süre sınırı olmadan yalnızca açık bir geçersiz kılma
 * sinyaliyle silinir ve bir sonraki talepte yeniden keşfedilir. Keşif hataları
 * önbelleğe alınmaz.
 *
 * <p>Her geçersiz kılma bir nesil sayacını artırır; istemci önbelleği kendi
 * tuttuğu istemcinin hangi nesle ait olduğunu bu sayaçla karşılaştırarak eski
 * üyelikle kurulmuş istemcileri ayıklar. Keşif örnek üzerinde
 * serileştirilmiştir, aynı anda en fazla bir keşif çağrısı yürür.
 */
public final class MembershipCache
{
    private static final Logger LOG = Logger.getLogger(MembershipCache.class);

    private final ClusterDiscoverer discoverer;
    private final ConfigurationEndpoint endpoint;
    private final Optional<Duration> discoveryTimeout;
    private final boolean ignoreClusterErrors;
    private final AtomicLong generation = new AtomicLong();
    private volatile ClusterConfiguration cached;

    private final Counter discoveries, discoveryFailures, invalidations;
    private final Timer tDiscovery;

    public MembershipCache(ClusterDiscoverer discoverer,
                           ConfigurationEndpoint endpoint,
                           Optional<Duration> discoveryTimeout,
                           boolean ignoreClusterErrors,
                           MetricsRegistry metrics)
    {
        this.discoverer = Objects.requireNonNull(discoverer, "discoverer");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.discoveryTimeout = Objects.requireNonNull(discoveryTimeout, "discoveryTimeout");
        this.ignoreClusterErrors = ignoreClusterErrors;
        if (metrics != null) {
            this.discoveries = metrics.counter("membership_discoveries");
            this.discoveryFailures = metrics.counter("membership_discovery_failures");
            this.invalidations = metrics.counter("membership_invalidations");
            this.tDiscovery = metrics.timer("membership_discovery");
        } else {
            this.discoveries = this.discoveryFailures = this.invalidations = null;
            this.tDiscovery = null;
        }
    }

    public List<CacheNode> getNodes()
    {
        return current().nodes();
    }

    /**
     * Önbellekteki yapılandırmayı, yoksa yeni keşfedileni, güncel nesil
     * numarasıyla birlikte döndürür.
     */
    public synchronized Membership current()
    {
        long observed = generation.get();
        ClusterConfiguration configuration = cached;
        if (configuration == null) {
            configuration = discover();
            // keşif sürerken gelen geçersiz kılma sonucu bayatlatır
            if (generation.get() == observed) {
                cached = configuration;
            }
        }
        return new Membership(configuration, observed);
    }

    /**
     * Saklanan listeyi bırakır ve yeni nesli döndürür.
     */
    public long invalidate()
    {
        if (cached != null && invalidations != null) {
            invalidations.inc();
        }
        cached = null;
        return generation.incrementAndGet();
    }

    public boolean isPopulated()
    {
        return cached != null;
    }

    public long generation()
    {
        return generation.get();
    }

    public ConfigurationEndpoint endpoint()
    {
        return endpoint;
    }

    private ClusterConfiguration discover()
    {
        long start = System.nanoTime();
        if (discoveries != null) {
            discoveries.inc();
        }
        try {
            ClusterConfiguration configuration = discoverer.discover(endpoint, discoveryTimeout, ignoreClusterErrors);
            LOG.infof("Discovered %d cache node(s) through %s (config version %d)",
                    configuration.nodes().size(), endpoint, configuration.version());
            return configuration;
        } catch (IOException e) {
            if (discoveryFailures != null) {
                discoveryFailures.inc();
            }
            throw new ClusterConnectionException(endpoint, e);
        } finally {
            if (tDiscovery != null) {
                tDiscovery.record(System.nanoTime() - start);
            }
        }
    }

    /**
     * Belirli bir nesle ait değiştirilemez üyelik görüntüsü.
     */
    public record Membership(ClusterConfiguration configuration, long generation)
    {
        public List<CacheNode> nodes()
        {
            return configuration.nodes();
        }
    }
}
