package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.CacheNode;
import com.can.autodiscovery.cluster.HashAlgorithm;
import com.can.autodiscovery.support.EmbeddedMemcachedServer;
import com.can.autodiscovery.support.EmbeddedMemcachedServer.Mode;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MemcachedClientTest
{
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private Vertx vertx;
    private VertxMemcachedClientFactory factory;
    private EmbeddedMemcachedServer first;
    private EmbeddedMemcachedServer second;
    private final List<MemcachedClient> clients = new ArrayList<>();

    @BeforeEach
    void setup() throws IOException
    {
        vertx = Vertx.vertx();
        factory = new VertxMemcachedClientFactory(vertx, Clock.fixed(NOW, ZoneOffset.UTC));
        first = EmbeddedMemcachedServer.started(Mode.NOT_CLUSTER);
        second = EmbeddedMemcachedServer.started(Mode.NOT_CLUSTER);
    }

    @AfterEach
    void tearDown() throws Exception
    {
        clients.forEach(MemcachedClient::close);
        first.close();
        second.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private MemcachedClient client(EmbeddedMemcachedServer... servers)
    {
        List<CacheNode> nodes = new ArrayList<>();
        for (EmbeddedMemcachedServer server : servers) {
            nodes.add(new CacheNode("localhost", "127.0.0.1", server.port()));
        }
        MemcachedClient client = factory.create(nodes, ClientBehaviors.DEFAULTS);
        clients.add(client);
        return client;
    }

    @Nested
    class Commands
    {
        // Bu test set, get ve delete komutlarının sunucuyla uçtan uca çalıştığını doğrular.
        @Test
        void set_get_delete_round_trip()
        {
            MemcachedClient client = client(first);

            assertNull(client.get("greeting"));
            assertTrue(client.set("greeting", "merhaba dünya", null));
            assertEquals("merhaba dünya", client.get("greeting"));
            assertEquals("merhaba dünya", first.value("greeting"));
            assertTrue(client.delete("greeting"));
            assertFalse(client.delete("greeting"));
            assertNull(client.get("greeting"));
        }

        // Bu test birden fazla anahtarın tek çağrıda okunduğunu ve eksiklerin atlandığını gösterir.
        @Test
        void get_many_returns_only_hits()
        {
            MemcachedClient client = client(first);
            Map<String, String> entries = new LinkedHashMap<>();
            entries.put("a", "1");
            entries.put("b", "2");
            assertTrue(client.setMany(entries, null));

            Map<String, String> values = client.getMany(List.of("a", "missing", "b"));

            assertEquals(Map.of("a", "1", "b", "2"), values);
            assertTrue(client.getMany(List.of()).isEmpty());
        }

        // Bu test boş değerlerin ve çok satırlı değerlerin korunduğunu doğrular.
        @Test
        void preserves_empty_and_multiline_values()
        {
            MemcachedClient client = client(first);
            client.set("empty", "", null);
            client.set("lines", "one\r\ntwo", null);
            assertEquals("", client.get("empty"));
            assertEquals("one\r\ntwo", client.get("lines"));
        }

        // Bu test bağlantıların havuzda tekrar kullanıldığını gösterir.
        @Test
        void reuses_pooled_connections()
        {
            MemcachedClient client = client(first);
            for (int i = 0; i < 20; i++) {
                client.set("k" + i, "v" + i, null);
            }
            assertEquals(1L, first.connections());
        }

        // Bu test hata alan bağlantının havuza dönmeyip yenisiyle değiştirildiğini doğrular.
        @Test
        void failed_command_replaces_connection()
        {
            MemcachedClient client = client(first);
            assertTrue(client.set("k", "v", null));
            first.failDataCommandsWith("SERVER_ERROR busy");
            assertThrows(NodeCommunicationException.class, () -> client.get("k"));
            first.failDataCommandsWith(null);
            assertEquals("v", client.get("k"));
            assertEquals(2L, first.connections());
        }

        // Bu test eşzamanlı çağrıların düğüm başına bağlantı sınırını aşmadığını gösterir.
        @Test
        void concurrent_callers_share_bounded_pool() throws Exception
        {
            ClientBehaviors twoConnections = new ClientBehaviors(1_000, 2_500L, 2, 160, true, HashAlgorithm.FNV1A_32);
            MemcachedClient client = factory.create(
                    List.of(new CacheNode("localhost", "127.0.0.1", first.port())), twoConnections);
            clients.add(client);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < 40; i++) {
                    String key = "k" + i;
                    results.add(pool.submit(() -> client.set(key, "v", null)));
                }
                for (Future<Boolean> result : results) {
                    assertTrue(result.get(10, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
            assertTrue(first.connections() <= 2, "connections: " + first.connections());
        }
    }

    @Nested
    class Routing
    {
        // Bu test anahtarların düğümlere dağıtıldığını ve çoklu okumanın tüm düğümlerden topladığını doğrular.
        @Test
        void distributes_keys_over_nodes()
        {
            MemcachedClient client = client(first, second);
            Map<String, String> entries = new LinkedHashMap<>();
            for (int i = 0; i < 50; i++) {
                entries.put("key-" + i, "value-" + i);
            }
            assertTrue(client.setMany(entries, null));

            int onFirst = 0;
            int onSecond = 0;
            for (String key : entries.keySet()) {
                boolean a = first.value(key) != null;
                boolean b = second.value(key) != null;
                assertTrue(a ^ b, "key stored on exactly one node: " + key);
                if (a) onFirst++; else onSecond++;
            }
            assertTrue(onFirst > 0 && onSecond > 0);
            assertEquals(entries, client.getMany(entries.keySet()));
            assertEquals(2, client.nodes().size());
        }

        // Bu test boş düğüm listesinde işlemlerin hata verdiğini gösterir.
        @Test
        void empty_node_list_fails_every_operation()
        {
            MemcachedClient client = client();
            NodeCommunicationException ex = assertThrows(NodeCommunicationException.class, () -> client.get("k"));
            assertEquals("No cache nodes available", ex.getMessage());
            assertThrows(NodeCommunicationException.class, () -> client.set("k", "v", null));
            assertThrows(NodeCommunicationException.class, () -> client.delete("k"));
        }
    }

    @Nested
    class Expiration
    {
        // Bu test süre değerlerinin memcached exptime alanına çevrildiğini doğrular.
        @Test
        void converts_ttl_to_exptime()
        {
            MemcachedClient client = client(first);
            client.set("forever", "v", null);
            client.set("zero", "v", Duration.ZERO);
            client.set("minute", "v", Duration.ofSeconds(60));
            client.set("fraction", "v", Duration.ofMillis(1500));
            client.set("long", "v", Duration.ofDays(31));

            assertEquals(0L, first.exptime("forever"));
            assertEquals(0L, first.exptime("zero"));
            assertEquals(60L, first.exptime("minute"));
            assertEquals(2L, first.exptime("fraction"));
            assertEquals(NOW.getEpochSecond() + Duration.ofDays(31).getSeconds(), first.exptime("long"));
        }

        // Bu test 30 günlük sınırın göreli olarak gönderildiğini gösterir.
        @Test
        void thirty_days_is_still_relative()
        {
            RingMemcachedClient client = (RingMemcachedClient) client(first);
            assertEquals(Duration.ofDays(30).getSeconds(), client.expiration(Duration.ofDays(30)));
            assertEquals(0L, client.expiration(Duration.ofSeconds(-5)));
        }
    }

    @Nested
    class Failures
    {
        // Bu test geçersiz anahtarların ağ çağrısı yapılmadan reddedildiğini doğrular.
        @Test
        void rejects_invalid_keys()
        {
            MemcachedClient client = client(first);
            assertThrows(IllegalArgumentException.class, () -> client.get(""));
            assertThrows(IllegalArgumentException.class, () -> client.get("with space"));
            assertThrows(IllegalArgumentException.class, () -> client.set("tab\tkey", "v", null));
            assertThrows(IllegalArgumentException.class, () -> client.delete("x".repeat(251)));
            assertEquals(0L, first.dataCommands());
        }

        // Bu test sunucu hata satırlarının NodeCommunicationException olarak yüzeye çıktığını gösterir.
        @Test
        void server_errors_surface_as_communication_failures()
        {
            MemcachedClient client = client(first);
            first.failDataCommandsWith("SERVER_ERROR out of memory");
            NodeCommunicationException ex = assertThrows(NodeCommunicationException.class,
                    () -> client.set("k", "v", null));
            assertTrue(ex.getCause().getMessage().contains("SERVER_ERROR"));
            first.failDataCommandsWith(null);
            assertTrue(client.set("k", "v", null));
        }

        // Bu test ulaşılamayan düğümde işlemin hata verdiğini doğrular.
        @Test
        void unreachable_node_fails()
        {
            int port;
            try (ServerSocket socket = new ServerSocket(0)) {
                port = socket.getLocalPort();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            MemcachedClient client = factory.create(List.of(new CacheNode("", "127.0.0.1", port)),
                    ClientBehaviors.DEFAULTS);
            clients.add(client);
            assertThrows(NodeCommunicationException.class, () -> client.get("k"));
        }

        // Bu test kapatılan istemcinin işlem kabul etmediğini gösterir.
        @Test
        void closed_client_rejects_operations()
        {
            MemcachedClient client = client(first);
            client.set("k", "v", null);
            client.close();
            client.close();
            assertThrows(NodeCommunicationException.class, () -> client.get("k"));
        }

        // Bu test event loop thread'inde engelleyici çağrının reddedildiğini doğrular.
        @Test
        void rejects_event_loop_callers() throws Exception
        {
            MemcachedClient client = client(first);
            CompletableFuture<Throwable> failure = new CompletableFuture<>();
            vertx.runOnContext(v -> {
                try {
                    client.get("k");
                    failure.complete(null);
                } catch (Throwable t) {
                    failure.complete(t);
                }
            });
            assertInstanceOf(IllegalStateException.class, failure.get(5, TimeUnit.SECONDS));
        }
    }
}
