package com.can.autodiscovery.core;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Uygulamanın önbellekle konuştuğu genel sözleşme. {@code ttl} değeri
 * {@code null}, sıfır ya da negatifse kayıt süresiz saklanır.
 */
public interface CacheBackend
{
    Optional<String> get(String key);

    Map<String, String> getMany(Collection<String> keys);

    boolean set(String key, String value, Duration ttl);

    default boolean set(String key, String value)
    {
        return set(key, value, null);
    }

    boolean setMany(Map<String, String> entries, Duration ttl);

    default boolean setMany(Map<String, String> entries)
    {
        return setMany(entries, null);
    }

    boolean delete(String key);
}
