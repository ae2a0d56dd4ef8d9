package com.can.autodiscovery.discovery;

import com.can.autodiscovery.cluster.CacheNode;
import com.can.autodiscovery.cluster.ClusterConfiguration;
import com.can.autodiscovery.constants.MemcachedProtocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Yapılandırma uç noktasının metin yanıtlarını çözümler. Satır sonları ve
 * düğümler arasındaki boşluk farklılıklarına toleranslıdır, yapısal olarak
 * bozuk yanıtlarda ise {@link InvalidClusterConfigException} fırlatır.
 *
 * <pre>
 * CONFIG cluster 0 147
 * 12
 * node1.example|10.0.0.1|11211 node2.example|10.0.0.2|11211
 *
 * END
 * </pre>
 */
public final class ClusterConfigParser
{
    private static final int[] CONFIG_COMMAND_SINCE = {1, 4, 14};

    private ClusterConfigParser()
    {
    }

    /**
     * {@code VERSION x.y.z} yanıtından motorun {@code config get cluster}
     * komutunu destekleyip desteklemediğini belirler.
     */
    public static boolean supportsConfigCommand(String versionResponse)
    {
        String line = firstLine(versionResponse);
        if (!line.startsWith(MemcachedProtocol.VERSION_PREFIX)) {
            throw new InvalidClusterConfigException("Unexpected response to version command: " + line);
        }
        int[] version = parseVersion(line.substring(MemcachedProtocol.VERSION_PREFIX.length()).trim());
        for (int i = 0; i < CONFIG_COMMAND_SINCE.length; i++) {
            int part = i < version.length ? version[i] : 0;
            if (part != CONFIG_COMMAND_SINCE[i]) {
                return part > CONFIG_COMMAND_SINCE[i];
            }
        }
        return true;
    }

    /**
     * Yanıtın son satırı bir sonlandırıcı olduğunda {@code true} döner.
     */
    public static boolean isComplete(String response)
    {
        if (response == null || !response.endsWith("\n")) {
            return false;
        }
        String[] lines = response.split("\\r?\\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            return isErrorLine(line) || MemcachedProtocol.END.equals(line);
        }
        return false;
    }

    public static boolean isErrorLine(String line)
    {
        String trimmed = line.trim();
        return MemcachedProtocol.ERROR.equals(trimmed)
                || trimmed.startsWith(MemcachedProtocol.CLIENT_ERROR)
                || trimmed.startsWith(MemcachedProtocol.SERVER_ERROR);
    }

    public static ClusterConfiguration parse(String response)
    {
        if (response == null) {
            throw new InvalidClusterConfigException("Empty cluster configuration response");
        }
        List<String> lines = new ArrayList<>();
        for (String raw : response.split("\\r?\\n")) {
            String line = raw.trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        if (lines.isEmpty()) {
            throw new InvalidClusterConfigException("Empty cluster configuration response");
        }
        String header = lines.get(0);
        if (isErrorLine(header)) {
            throw new InvalidClusterConfigException("Configuration endpoint returned an error: " + header);
        }
        if (!header.startsWith(MemcachedProtocol.CONFIG + " ") && !header.startsWith(MemcachedProtocol.VALUE + " ")) {
            throw new InvalidClusterConfigException("Unexpected cluster configuration header: " + header);
        }
        if (!MemcachedProtocol.END.equals(lines.get(lines.size() - 1))) {
            throw new InvalidClusterConfigException("Cluster configuration response is not terminated by END");
        }
        if (lines.size() < 4) {
            throw new InvalidClusterConfigException("Cluster configuration response has no node list");
        }

        long version;
        try {
            version = Long.parseLong(lines.get(1));
        } catch (NumberFormatException e) {
            throw new InvalidClusterConfigException("Invalid cluster configuration version: " + lines.get(1), e);
        }

        List<CacheNode> nodes = new ArrayList<>();
        for (String line : lines.subList(2, lines.size() - 1)) {
            for (String tuple : line.split("\\s+")) {
                nodes.add(parseNode(tuple));
            }
        }
        return new ClusterConfiguration(version, nodes);
    }

    static CacheNode parseNode(String tuple)
    {
        String[] fields = tuple.split("\\|", -1);
        if (fields.length != 3) {
            throw new InvalidClusterConfigException("Invalid node entry, expected host|ip|port: " + tuple);
        }
        int port;
        try {
            port = Integer.parseInt(fields[2].trim());
        } catch (NumberFormatException e) {
            throw new InvalidClusterConfigException("Invalid port in node entry: " + tuple, e);
        }
        try {
            return new CacheNode(fields[0].trim(), fields[1].trim(), port);
        } catch (IllegalArgumentException e) {
            throw new InvalidClusterConfigException("Invalid node entry " + tuple + ": " + e.getMessage(), e);
        }
    }

    private static int[] parseVersion(String text)
    {
        // "1.6.17" veya "1.4.14-ms" gibi değerlerde sayısal olmayan son ek atılır
        String[] parts = text.split("\\.");
        int[] version = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String digits = parts[i].replaceFirst("\\D.*$", "");
            if (digits.isEmpty()) {
                if (i == 0) {
                    throw new InvalidClusterConfigException("Unparseable engine version: " + text);
                }
                return Arrays.copyOf(version, i);
            }
            version[i] = Integer.parseInt(digits);
        }
        return version;
    }

    private static String firstLine(String response)
    {
        if (response == null) {
            return "";
        }
        int newline = response.indexOf('\n');
        String line = newline >= 0 ? response.substring(0, newline) : response;
        return line.trim();
    }
}
