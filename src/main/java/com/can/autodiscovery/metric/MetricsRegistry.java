package com.can.autodiscovery.metric;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sayaç ve zamanlayıcıların isimle tutulduğu merkezi kayıt. Bileşenler
 * metriklerini ilk talepte oluşturur, aynı isim her zaman aynı nesneyi döndürür.
 */
public final class MetricsRegistry {
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }
    public Timer timer(String name) { return timers.computeIfAbsent(name, Timer::new); }

    public Map<String, Counter> counters(){ return Collections.unmodifiableMap(counters); }
    public Map<String, Timer> timers(){ return Collections.unmodifiableMap(timers); }
}
