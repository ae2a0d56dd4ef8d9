package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.HashAlgorithm;
import com.can.autodiscovery.core.CacheConfigurationException;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Alttaki istemciye kurulum anında bir kez uygulanan bağlantı ve protokol
 * ayarlarıdır. Yapılandırmadan gelen düz anahtar/değer haritası tek bir kanonik
 * biçime çözülür; tanınmayan anahtarlar veya geçersiz değerler yapılandırma
 * hatasıdır.
 *
 * <ul>
 *   <li>{@code connect-timeout-millis} – düğüme bağlanma süre sınırı</li>
 *   <li>{@code request-timeout-millis} – tek bir komutun yanıt süre sınırı</li>
 *   <li>{@code max-connections-per-node} – düğüm başına havuzdaki en fazla bağlantı</li>
 *   <li>{@code virtual-nodes} – hash halkasında düğüm başına nokta sayısı</li>
 *   <li>{@code tcp-no-delay} – Nagle algoritmasının kapatılması</li>
 *   <li>{@code hash} – {@code fnv1a-32} veya {@code crc32}</li>
 * </ul>
 */
public record ClientBehaviors(int connectTimeoutMillis,
                              long requestTimeoutMillis,
                              int maxConnectionsPerNode,
                              int virtualNodes,
                              boolean tcpNoDelay,
                              HashAlgorithm hash)
{
    public static final ClientBehaviors DEFAULTS =
            new ClientBehaviors(1_000, 2_500L, 4, 160, true, HashAlgorithm.FNV1A_32);

    public ClientBehaviors
    {
        Objects.requireNonNull(hash, "hash");
        if (connectTimeoutMillis <= 0) {
            throw new CacheConfigurationException("connect-timeout-millis must be positive");
        }
        if (requestTimeoutMillis <= 0) {
            throw new CacheConfigurationException("request-timeout-millis must be positive");
        }
        if (maxConnectionsPerNode <= 0) {
            throw new CacheConfigurationException("max-connections-per-node must be positive");
        }
        if (virtualNodes <= 0) {
            throw new CacheConfigurationException("virtual-nodes must be positive");
        }
    }

    public static ClientBehaviors fromMap(Map<String, String> options)
    {
        if (options == null || options.isEmpty()) {
            return DEFAULTS;
        }
        int connectTimeout = DEFAULTS.connectTimeoutMillis;
        long requestTimeout = DEFAULTS.requestTimeoutMillis;
        int maxConnections = DEFAULTS.maxConnectionsPerNode;
        int vnodes = DEFAULTS.virtualNodes;
        boolean noDelay = DEFAULTS.tcpNoDelay;
        HashAlgorithm hash = DEFAULTS.hash;

        for (Map.Entry<String, String> option : options.entrySet()) {
            String key = option.getKey().trim().toLowerCase(Locale.ROOT).replace('_', '-');
            String value = option.getValue() == null ? "" : option.getValue().trim();
            switch (key) {
                case "connect-timeout-millis" -> connectTimeout = (int) parseLong(key, value);
                case "request-timeout-millis" -> requestTimeout = parseLong(key, value);
                case "max-connections-per-node" -> maxConnections = (int) parseLong(key, value);
                case "virtual-nodes" -> vnodes = (int) parseLong(key, value);
                case "tcp-no-delay" -> noDelay = parseBoolean(key, value);
                case "hash" -> hash = parseHash(value);
                default -> throw new CacheConfigurationException("Unknown client behavior: " + option.getKey());
            }
        }
        return new ClientBehaviors(connectTimeout, requestTimeout, maxConnections, vnodes, noDelay, hash);
    }

    private static long parseLong(String key, String value)
    {
        try {
            long parsed = Long.parseLong(value);
            // daraltmadan önce; aksi halde büyük negatif değerler pozitife sarar
            if (parsed <= 0L) {
                throw new CacheConfigurationException("Client behavior " + key + " must be positive, got: " + value);
            }
            if (parsed > Integer.MAX_VALUE && !"request-timeout-millis".equals(key)) {
                throw new CacheConfigurationException("Client behavior " + key + " is too large: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new CacheConfigurationException("Client behavior " + key + " must be numeric, got: " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value)
    {
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new CacheConfigurationException("Client behavior " + key + " must be a boolean, got: " + value);
    }

    private static HashAlgorithm parseHash(String value)
    {
        try {
            return HashAlgorithm.fromConfig(value);
        } catch (IllegalArgumentException e) {
            throw new CacheConfigurationException(e.getMessage(), e);
        }
    }
}
