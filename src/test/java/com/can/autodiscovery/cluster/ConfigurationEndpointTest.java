package com.can.autodiscovery.cluster;

import com.can.autodiscovery.core.CacheConfigurationException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationEndpointTest
{
    @Nested
    class Parsing
    {
        // Bu test tek bir host:port tanımının ayrıştırıldığını doğrular.
        @Test
        void parses_single_server()
        {
            ConfigurationEndpoint endpoint = ConfigurationEndpoint.parse("cfg.example.cache.amazonaws.com:11211");
            assertEquals("cfg.example.cache.amazonaws.com", endpoint.host());
            assertEquals(11211, endpoint.port());
            assertEquals("cfg.example.cache.amazonaws.com:11211", endpoint.toString());
        }

        // Bu test sondaki ayırıcı ve boşlukların yok sayıldığını gösterir.
        @Test
        void ignores_trailing_separator_and_whitespace()
        {
            assertEquals(new ConfigurationEndpoint("localhost", 11211), ConfigurationEndpoint.parse("  localhost:11211 ; "));
        }

        // Bu test liste biçimindeki tek elemanlı tanımın kabul edildiğini doğrular.
        @Test
        void accepts_single_element_list()
        {
            assertEquals(new ConfigurationEndpoint("h", 1), ConfigurationEndpoint.of(List.of("h:1")));
        }
    }

    @Nested
    class Rejection
    {
        // Bu test birden fazla sunucu verildiğinde yapılandırma hatası fırlatıldığını doğrular.
        @Test
        void rejects_more_than_one_server()
        {
            CacheConfigurationException ex = assertThrows(CacheConfigurationException.class,
                    () -> ConfigurationEndpoint.parse("h1:11211;h2:11211"));
            assertTrue(ex.getMessage().contains("only one server"));
            assertThrows(CacheConfigurationException.class,
                    () -> ConfigurationEndpoint.of(List.of("h1:11211", "h2:11211")));
        }

        // Bu test hiç sunucu verilmediğinde hata fırlatıldığını gösterir.
        @Test
        void rejects_missing_server()
        {
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse(" "));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse(";"));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.of(List.of()));
        }

        // Bu test host:port dışındaki biçimlerin reddedildiğini doğrular.
        @Test
        void rejects_malformed_server()
        {
            CacheConfigurationException ex = assertThrows(CacheConfigurationException.class,
                    () -> ConfigurationEndpoint.parse("localhost"));
            assertTrue(ex.getMessage().contains("host:port"));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse("a:b:c"));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse(":11211"));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse("localhost:"));
        }

        // Bu test sayısal olmayan ve aralık dışı portların reddedildiğini gösterir.
        @Test
        void rejects_invalid_port()
        {
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse("localhost:abc"));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse("localhost:0"));
            assertThrows(CacheConfigurationException.class, () -> ConfigurationEndpoint.parse("localhost:70000"));
        }
    }
}
