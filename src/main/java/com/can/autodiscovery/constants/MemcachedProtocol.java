package com.can.autodiscovery.constants;

public interface MemcachedProtocol
{
    // Line terminator of the text protocol.
    String CRLF = "\r\n";

    // Commands issued against cache nodes.
    String SET = "set";
    String GET = "get";
    String DELETE = "delete";
    String VERSION = "version";

    // Cluster discovery commands. Engines before 1.4.14 only expose the configuration under a reserved key.
    String CONFIG_GET_CLUSTER = "config get cluster";
    String LEGACY_CLUSTER_KEY = "AmazonElastiCache:cluster";

    // Response headers.
    String CONFIG = "CONFIG";
    String VALUE = "VALUE";
    String VERSION_PREFIX = "VERSION ";

    // Response terminators and status lines.
    String END = "END";
    String STORED = "STORED";
    String NOT_STORED = "NOT_STORED";
    String EXISTS = "EXISTS";
    String DELETED = "DELETED";
    String NOT_FOUND = "NOT_FOUND";

    // Error responses.
    String ERROR = "ERROR";
    String CLIENT_ERROR = "CLIENT_ERROR";
    String SERVER_ERROR = "SERVER_ERROR";

    // Keys longer than this are rejected by memcached.
    int MAX_KEY_LENGTH = 250;

    // Expiration times above this many seconds are interpreted as absolute unix time.
    long MAX_RELATIVE_EXPIRATION_SECONDS = 60L * 60L * 24L * 30L;
}
