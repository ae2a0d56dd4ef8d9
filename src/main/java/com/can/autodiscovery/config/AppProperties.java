package com.can.autodiscovery.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * olarak sunar. Küme grubu yapılandırma uç noktasını, keşif süresini, hata
 * politikasını ve alttaki memcached istemcisine aktarılan davranış ayarlarını
 * taşır.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Metrics metrics();
    Cluster cluster();

    interface Metrics {
        @WithDefault("60")
        long reportIntervalSeconds();
    }

    interface Cluster {
        /** Yapılandırma uç noktası, {@code host:port}. */
        String endpoint();

        Optional<Duration> discoveryTimeout();

        @WithDefault("false")
        boolean ignoreClusterErrors();

        @WithDefault("shared")
        String clientScope();

        @WithDefault("5S")
        Duration retiredClientCloseDelay();

        Map<String, String> behaviors();
    }
}
