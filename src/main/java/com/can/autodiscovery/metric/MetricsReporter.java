package com.can.autodiscovery.metric;

import com.can.autodiscovery.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kayıttaki sayaç ve zamanlayıcıları Vert.x periyodik zamanlayıcısıyla belirli
 * aralıklarla log'a yazar. Aralık sıfır veya negatifse raporlama başlamaz.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, AppProperties properties, Vertx vertx) {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx) {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
    }

    @PostConstruct
    void init() {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds) {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        timerId = vertx.setPeriodic(TimeUnit.SECONDS.toMillis(intervalSeconds), id -> dump());
    }

    public boolean isRunning() {
        return running.get();
    }

    void dump() {
        if (!LOG.isInfoEnabled()) {
            return;
        }
        StringBuilder report = new StringBuilder("metrics:");
        registry.counters().values().forEach(counter ->
                report.append(String.format(Locale.ROOT, "%n  counter %s = %d", counter.name(), counter.get())));
        registry.timers().values().forEach(timer -> {
            var sample = timer.snapshot();
            report.append(String.format(Locale.ROOT,
                    "%n  timer %s count=%d avg=%.2fµs p50=%.2fµs p95=%.2fµs min=%.2fµs max=%.2fµs",
                    sample.name(),
                    sample.count(),
                    sample.avgNs() / 1_000.0,
                    sample.p50Ns() / 1_000.0,
                    sample.p95Ns() / 1_000.0,
                    sample.minNs() / 1_000.0,
                    sample.maxNs() / 1_000.0));
        });
        LOG.info(report);
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
