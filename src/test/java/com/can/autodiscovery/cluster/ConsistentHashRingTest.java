package com.can.autodiscovery.cluster;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsistentHashRingTest
{
    private ConsistentHashRing<String> ring;

    @BeforeEach
    void setup()
    {
        ring = new ConsistentHashRing<>(HashAlgorithm.FNV1A_32, 160);
    }

    @Nested
    class Routing
    {
        // Bu test boş halkada sahip düğümün null döndüğünü doğrular.
        @Test
        void empty_ring_has_no_owner()
        {
            assertTrue(ring.isEmpty());
            assertNull(ring.nodeFor(bytes("key")));
        }

        // Bu test tek düğümlü halkada tüm anahtarların aynı düğüme gittiğini gösterir.
        @Test
        void single_node_owns_every_key()
        {
            ring.addNode("A", bytes("10.0.0.1:11211"));
            for (int i = 0; i < 100; i++) {
                assertEquals("A", ring.nodeFor(bytes("key-" + i)));
            }
        }

        // Bu test aynı anahtarın her zaman aynı düğüme yönlendirildiğini doğrular.
        @Test
        void routing_is_deterministic()
        {
            ring.addNode("A", bytes("10.0.0.1:11211"));
            ring.addNode("B", bytes("10.0.0.2:11211"));
            ring.addNode("C", bytes("10.0.0.3:11211"));

            ConsistentHashRing<String> other = new ConsistentHashRing<>(HashAlgorithm.FNV1A_32, 160);
            other.addNode("C", bytes("10.0.0.3:11211"));
            other.addNode("A", bytes("10.0.0.1:11211"));
            other.addNode("B", bytes("10.0.0.2:11211"));

            for (int i = 0; i < 200; i++) {
                assertEquals(ring.nodeFor(bytes("key-" + i)), other.nodeFor(bytes("key-" + i)));
            }
        }

        // Bu test anahtarların düğümler arasında dağıldığını gösterir.
        @Test
        void keys_spread_over_nodes()
        {
            ring.addNode("A", bytes("10.0.0.1:11211"));
            ring.addNode("B", bytes("10.0.0.2:11211"));
            ring.addNode("C", bytes("10.0.0.3:11211"));

            Map<String, Integer> counts = new HashMap<>();
            for (int i = 0; i < 3000; i++) {
                counts.merge(ring.nodeFor(bytes("key-" + i)), 1, Integer::sum);
            }
            assertEquals(3, counts.size());
            counts.values().forEach(count -> assertTrue(count > 300, "unbalanced ring: " + counts));
        }

        // Bu test bir düğüm eklendiğinde yalnızca anahtarların bir kısmının yer değiştirdiğini doğrular.
        @Test
        void adding_node_moves_only_part_of_the_keys()
        {
            ring.addNode("A", bytes("10.0.0.1:11211"));
            ring.addNode("B", bytes("10.0.0.2:11211"));
            Map<String, String> before = new HashMap<>();
            for (int i = 0; i < 1000; i++) {
                before.put("key-" + i, ring.nodeFor(bytes("key-" + i)));
            }
            ring.addNode("C", bytes("10.0.0.3:11211"));
            int moved = 0;
            for (var entry : before.entrySet()) {
                String now = ring.nodeFor(bytes(entry.getKey()));
                if (!now.equals(entry.getValue())) {
                    assertEquals("C", now);
                    moved++;
                }
            }
            assertTrue(moved > 0 && moved < 700, "moved=" + moved);
        }

        // Bu test düğüm listesinin tekrarsız döndüğünü gösterir.
        @Test
        void nodes_are_unique()
        {
            ring.addNode("A", bytes("a"));
            ring.addNode("B", bytes("b"));
            List<String> nodes = ring.nodes();
            assertEquals(2, nodes.size());
            assertTrue(nodes.containsAll(List.of("A", "B")));
        }
    }

    @Nested
    class HashFunctions
    {
        // Bu test FNV-1a 32 bit referans değerlerini doğrular.
        @Test
        void fnv1a_reference_vectors()
        {
            assertEquals(0x811c9dc5, HashAlgorithm.FNV1A_32.hash(new byte[0]));
            assertEquals(0xe40c292c, HashAlgorithm.FNV1A_32.hash(bytes("a")));
        }

        // Bu test CRC32 referans değerini doğrular.
        @Test
        void crc32_reference_vector()
        {
            assertEquals(0xCBF43926, HashAlgorithm.CRC32.hash(bytes("123456789")));
        }

        // Bu test yapılandırma adlarının algoritmalara çevrildiğini gösterir.
        @Test
        void resolves_algorithm_names()
        {
            assertEquals(HashAlgorithm.FNV1A_32, HashAlgorithm.fromConfig(null));
            assertEquals(HashAlgorithm.FNV1A_32, HashAlgorithm.fromConfig("fnv1a-32"));
            assertEquals(HashAlgorithm.CRC32, HashAlgorithm.fromConfig("crc32"));
            assertThrows(IllegalArgumentException.class, () -> HashAlgorithm.fromConfig("md5"));
        }
    }

    private static byte[] bytes(String value)
    {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
