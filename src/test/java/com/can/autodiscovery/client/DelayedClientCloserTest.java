package com.can.autodiscovery.client;

import com.can.autodiscovery.support.FakeClientFactory;
import com.can.autodiscovery.support.FakeMemcachedClient;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DelayedClientCloserTest
{
    private Vertx vertx;
    private FakeClientFactory factory;

    @BeforeEach
    void setup()
    {
        vertx = Vertx.vertx();
        factory = new FakeClientFactory();
    }

    @AfterEach
    void tearDown() throws Exception
    {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private FakeMemcachedClient newClient()
    {
        factory.create(List.of(), ClientBehaviors.DEFAULTS);
        return factory.last();
    }

    // Bu test sıfır gecikmede istemcinin hemen kapatıldığını doğrular.
    @Test
    void zero_delay_closes_immediately()
    {
        FakeMemcachedClient client = newClient();
        new DelayedClientCloser(vertx, Duration.ZERO).accept(client);
        assertTrue(client.isClosed());
    }

    // Bu test gecikme süresince istemcinin açık kaldığını ve sonra kapatıldığını gösterir.
    @Test
    void closes_after_delay() throws Exception
    {
        FakeMemcachedClient client = newClient();
        new DelayedClientCloser(vertx, Duration.ofMillis(200)).accept(client);
        assertFalse(client.isClosed());

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!client.isClosed() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(client.isClosed());
    }
}
