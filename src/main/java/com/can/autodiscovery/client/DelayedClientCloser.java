package com.can.autodiscovery.client;

import io.vertx.core.Vertx;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Emekliye ayrılan istemcileri, üzerlerinde hâlâ yürüyen işlemler bitsin diye
 * bir bekleme süresinden sonra Vert.x zamanlayıcısıyla kapatır.
 */
public final class DelayedClientCloser implements Consumer<MemcachedClient>
{
    private final Vertx vertx;
    private final Duration delay;

    public DelayedClientCloser(Vertx vertx, Duration delay)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    @Override
    public void accept(MemcachedClient client)
    {
        long millis = delay.toMillis();
        if (millis <= 0L) {
            client.close();
            return;
        }
        vertx.setTimer(millis, id -> client.close());
    }
}
