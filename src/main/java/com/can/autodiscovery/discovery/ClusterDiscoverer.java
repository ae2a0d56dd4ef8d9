package com.can.autodiscovery.discovery;

import com.can.autodiscovery.cluster.ClusterConfiguration;
import com.can.autodiscovery.cluster.ConfigurationEndpoint;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Yapılandırma uç noktasına kısa ömürlü bir bağlantı açıp kümenin güncel düğüm
 * listesini öğrenen bileşenin sözleşmesidir. Uygulamalar tekrar denemez; bir
 * sonraki denemeye çağıran taraf karar verir.
 */
public interface ClusterDiscoverer
{
    /**
     * @param endpoint     sorgulanacak yapılandırma uç noktası
     * @param timeout      bağlantı ve yanıt için üst sınır; boşsa taşıma katmanının varsayılanı
     * @param ignoreErrors uç nokta ulaşılamaz ya da küme yapılandırması sunmuyorsa hata
     *                     yerine daraltılmış bir yapılandırma döndürülür
     * @throws IOException uç nokta çözümlenemediğinde, bağlantı reddedildiğinde veya süre aşıldığında
     * @throws InvalidClusterConfigException yanıt yapısal olarak geçersiz olduğunda
     */
    ClusterConfiguration discover(ConfigurationEndpoint endpoint, Optional<Duration> timeout, boolean ignoreErrors)
            throws IOException;
}
