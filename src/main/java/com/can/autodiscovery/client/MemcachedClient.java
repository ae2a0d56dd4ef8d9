package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.CacheNode;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Belirli bir düğüm listesine bağlı olarak kurulmuş anahtar-değer istemcisi.
 * Kurulduğu düğüm listesi ve ayarları ömrü boyunca değişmez; üyelik değiştiğinde
 * yeniden kullanılmaz, yerine yenisi kurulur.
 */
public interface MemcachedClient extends AutoCloseable
{
    /**
     * @return anahtarın değeri, yoksa {@code null}
     */
    String get(String key);

    /**
     * @return bulunan anahtarlar ve değerleri; bulunmayan anahtarlar haritada yer almaz
     */
    Map<String, String> getMany(Collection<String> keys);

    /**
     * @param ttl {@code null}, sıfır veya negatifse değer süresiz saklanır
     */
    boolean set(String key, String value, Duration ttl);

    /**
     * @return tüm girdiler saklandıysa {@code true}
     */
    boolean setMany(Map<String, String> entries, Duration ttl);

    boolean delete(String key);

    List<CacheNode> nodes();

    @Override
    void close();
}
