package com.can.autodiscovery.config;

import com.can.autodiscovery.client.ClientScope;
import com.can.autodiscovery.client.DelayedClientCloser;
import com.can.autodiscovery.client.MemcachedClientFactory;
import com.can.autodiscovery.client.VertxMemcachedClientFactory;
import com.can.autodiscovery.core.AutoDiscoveryCache;
import com.can.autodiscovery.discovery.ClusterDiscoverer;
import com.can.autodiscovery.discovery.ConfigEndpointDiscoverer;
import com.can.autodiscovery.metric.MetricsRegistry;
import io.vertx.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * Kendini onaran önbelleği ve onu oluşturan keşif, istemci fabrikası ve metrik
 * bean'lerini {@link AppProperties} değerleriyle üretir. Vert.x örneği
 * Quarkus tarafından sağlanır.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public ClusterDiscoverer clusterDiscoverer(Vertx vertx) {
        return new ConfigEndpointDiscoverer(vertx);
    }

    @Produces
    @Singleton
    public MemcachedClientFactory memcachedClientFactory(Vertx vertx) {
        return new VertxMemcachedClientFactory(vertx);
    }

    @Produces
    @Singleton
    public AutoDiscoveryCache autoDiscoveryCache(
            Vertx vertx,
            ClusterDiscoverer discoverer,
            MemcachedClientFactory clientFactory,
            MetricsRegistry metrics
    ) {
        var cluster = properties.cluster();
        AutoDiscoveryCache cache = AutoDiscoveryCache.builder(cluster.endpoint())
                .discoveryTimeout(cluster.discoveryTimeout())
                .ignoreClusterErrors(cluster.ignoreClusterErrors())
                .clientScope(ClientScope.fromConfig(cluster.clientScope()))
                .behaviors(cluster.behaviors())
                .discoverer(discoverer)
                .clientFactory(clientFactory)
                .retirement(new DelayedClientCloser(vertx, cluster.retiredClientCloseDelay()))
                .metrics(metrics)
                .build();
        LOG.infof("Auto discovery cache configured for endpoint %s", cache.endpoint());
        return cache;
    }

    void disposeAutoDiscoveryCache(@Disposes AutoDiscoveryCache cache) {
        cache.close();
    }
}
