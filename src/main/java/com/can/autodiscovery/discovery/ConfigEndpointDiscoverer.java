package com.can.autodiscovery.discovery;

import com.can.autodiscovery.cluster.ClusterConfiguration;
import com.can.autodiscovery.cluster.ConfigurationEndpoint;
import com.can.autodiscovery.constants.MemcachedProtocol;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import io.vertx.core.net.NetSocket;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Yapılandırma uç noktasıyla memcached metin protokolü üzerinden konuşan keşif
 * istemcisidir. Her çağrıda Vert.x {@link NetClient} ile kısa ömürlü bir bağlantı
 * açar, önce motor sürümünü sorar; 1.4.14 ve sonrası için
 * {@code config get cluster}, daha eski motorlar için ayrılmış
 * {@code AmazonElastiCache:cluster} anahtarını okur ve bağlantıyı kapatır.
 *
 * <p>{@code ignoreErrors} açıkken iki durum hata yerine daraltılmış bir
 * yapılandırmaya dönüşür: uç nokta ulaşılamıyorsa boş üyelik döner, uç nokta
 * küme yapılandırması sunmayan sıradan bir memcached ise uç noktanın kendisi
 * tek düğüm kabul edilir. Yapısal olarak bozuk yanıtlar her zaman hata verir.
 */
public final class ConfigEndpointDiscoverer implements ClusterDiscoverer
{
    private static final Logger LOG = Logger.getLogger(ConfigEndpointDiscoverer.class);

    private final Vertx vertx;

    public ConfigEndpointDiscoverer(Vertx vertx)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
    }

    @Override
    public ClusterConfiguration discover(ConfigurationEndpoint endpoint, Optional<Duration> timeout, boolean ignoreErrors)
            throws IOException
    {
        Objects.requireNonNull(endpoint, "endpoint");
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Cluster discovery must not block an event loop thread");
        }
        long timeoutMillis = timeoutMillis(timeout);
        NetClientOptions options = new NetClientOptions()
                .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                .setTcpNoDelay(true);
        NetClient netClient = vertx.createNetClient(options);
        try {
            return exchange(netClient, endpoint, timeoutMillis, ignoreErrors);
        } catch (IOException e) {
            if (!ignoreErrors) {
                throw e;
            }
            LOG.warnf(e, "Configuration endpoint %s is unreachable, continuing with an empty cluster membership",
                    endpoint);
            return ClusterConfiguration.EMPTY;
        } finally {
            netClient.close();
        }
    }

    private ClusterConfiguration exchange(NetClient netClient, ConfigurationEndpoint endpoint, long timeoutMillis,
                                          boolean ignoreErrors) throws IOException
    {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        NetSocket socket = await(netClient.connect(endpoint.port(), endpoint.host())
                .toCompletionStage().toCompletableFuture(), deadline, "connect", endpoint);
        try {
            ResponseCollector collector = new ResponseCollector(socket);
            String versionResponse = collector.request(MemcachedProtocol.VERSION,
                    response -> response.indexOf('\n') >= 0, deadline, endpoint);
            boolean configCommand = ClusterConfigParser.supportsConfigCommand(versionResponse);
            String command = configCommand
                    ? MemcachedProtocol.CONFIG_GET_CLUSTER
                    : MemcachedProtocol.GET + ' ' + MemcachedProtocol.LEGACY_CLUSTER_KEY;
            String response = collector.request(command, ClusterConfigParser::isComplete, deadline, endpoint);

            if (isPlainMemcached(response, configCommand)) {
                if (!ignoreErrors) {
                    throw new InvalidClusterConfigException(
                            "Configuration endpoint " + endpoint + " does not provide a cluster configuration");
                }
                LOG.infof("Endpoint %s does not provide a cluster configuration, using it as the only node", endpoint);
                return ClusterConfiguration.singleNode(endpoint);
            }

            ClusterConfiguration configuration = ClusterConfigParser.parse(response);
            LOG.debugf("Configuration endpoint %s reported %d node(s), config version %d",
                    endpoint, configuration.nodes().size(), configuration.version());
            return configuration;
        } finally {
            socket.close();
        }
    }

    private static boolean isPlainMemcached(String response, boolean configCommand)
    {
        String trimmed = response.trim();
        if (MemcachedProtocol.ERROR.equals(trimmed)) {
            return true;
        }
        // eski motorlarda ayrılmış anahtar yoksa yanıt yalnızca END olur
        return !configCommand && MemcachedProtocol.END.equals(trimmed);
    }

    private static long timeoutMillis(Optional<Duration> timeout)
    {
        return timeout
                .filter(value -> !value.isNegative() && !value.isZero())
                .map(value -> Math.max(1L, value.toMillis()))
                .orElse((long) NetClientOptions.DEFAULT_CONNECT_TIMEOUT);
    }

    private static <T> T await(CompletableFuture<T> future, long deadlineNanos, String action,
                               ConfigurationEndpoint endpoint) throws IOException
    {
        try {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0L) {
                throw new TimeoutException();
            }
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new SocketTimeoutException("Timed out during " + action + " with configuration endpoint " + endpoint);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during " + action + " with configuration endpoint " + endpoint);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to " + action + " with configuration endpoint " + endpoint, cause);
        }
    }

    /**
     * Tek bir soketin gelen baytlarını biriktirip o anda beklenen yanıt
     * tamamlandığında bekleyen isteği sonuçlandırır.
     */
    private static final class ResponseCollector
    {
        private final NetSocket socket;
        private Buffer received = Buffer.buffer();
        private CompletableFuture<String> pending;
        private Predicate<String> completion;

        private ResponseCollector(NetSocket socket)
        {
            this.socket = socket;
            socket.handler(this::onData);
            socket.exceptionHandler(this::onFailure);
            socket.closeHandler(v -> onFailure(new IOException("Connection closed by configuration endpoint")));
        }

        String request(String command, Predicate<String> completion, long deadlineNanos,
                       ConfigurationEndpoint endpoint) throws IOException
        {
            CompletableFuture<String> future = new CompletableFuture<>();
            synchronized (this) {
                this.pending = future;
                this.completion = completion;
                this.received = Buffer.buffer();
            }
            socket.write(command + MemcachedProtocol.CRLF).onFailure(this::onFailure);
            return await(future, deadlineNanos, command, endpoint);
        }

        private synchronized void onData(Buffer chunk)
        {
            received.appendBuffer(chunk);
            if (pending == null) {
                return;
            }
            String text = received.toString(StandardCharsets.UTF_8);
            if (completion.test(text)) {
                CompletableFuture<String> done = pending;
                pending = null;
                received = Buffer.buffer();
                done.complete(text);
            }
        }

        private synchronized void onFailure(Throwable cause)
        {
            if (pending != null) {
                CompletableFuture<String> failed = pending;
                pending = null;
                failed.completeExceptionally(cause);
            }
        }
    }
}
