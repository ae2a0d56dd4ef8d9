package com.can.autodiscovery.client;

import com.can.autodiscovery.cluster.CacheNode;
import com.can.autodiscovery.codec.StringCodec;
import com.can.autodiscovery.constants.MemcachedProtocol;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetSocket;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tek bir önbellek düğümüne memcached metin protokolüyle konuşan vekildir.
 * Vert.x {@link NetClient} üzerinden açılan bağlantılar düğüm başına sınırlı bir
 * havuzda tutulur ve komutlar arasında yeniden kullanılır. Çağrılar bloklayıcıdır;
 * her komut yapılandırılan istek süre sınırıyla beklenir ve hata alan bağlantı
 * havuza geri dönmek yerine kapatılır.
 */
public final class MemcachedNode implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MemcachedNode.class);

    private final CacheNode node;
    private final String host;
    private final int port;
    private final NetClient netClient;
    private final long connectTimeoutMillis;
    private final long requestTimeoutMillis;
    private final long requestTimeoutNanos;
    private final int maxPoolSize;
    private final BlockingQueue<PooledConnection> pool;
    private final Set<PooledConnection> allConnections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public MemcachedNode(CacheNode node, NetClient netClient, ClientBehaviors behaviors)
    {
        this.node = Objects.requireNonNull(node, "node");
        this.host = node.address();
        this.port = node.port();
        this.netClient = Objects.requireNonNull(netClient, "netClient");
        this.connectTimeoutMillis = behaviors.connectTimeoutMillis();
        this.requestTimeoutMillis = behaviors.requestTimeoutMillis();
        this.requestTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(requestTimeoutMillis);
        this.maxPoolSize = behaviors.maxConnectionsPerNode();
        this.pool = new LinkedBlockingQueue<>(maxPoolSize);
    }

    public Map<String, String> get(Collection<String> keys)
    {
        StringBuilder command = new StringBuilder(MemcachedProtocol.GET);
        for (String key : keys) {
            command.append(' ').append(key);
        }
        command.append(MemcachedProtocol.CRLF);
        return execute(Buffer.buffer(command.toString()), new RetrievalResponseParser());
    }

    public boolean set(String key, String value, long exptime)
    {
        byte[] valueBytes = StringCodec.UTF8.encode(value);
        Buffer request = Buffer.buffer(MemcachedProtocol.SET + ' ' + key + " 0 " + exptime + ' '
                        + valueBytes.length + MemcachedProtocol.CRLF)
                .appendBytes(valueBytes)
                .appendString(MemcachedProtocol.CRLF);
        return execute(request, new StatusResponseParser(MemcachedProtocol.STORED,
                Set.of(MemcachedProtocol.NOT_STORED, MemcachedProtocol.EXISTS, MemcachedProtocol.NOT_FOUND)));
    }

    public boolean delete(String key)
    {
        Buffer request = Buffer.buffer(MemcachedProtocol.DELETE + ' ' + key + MemcachedProtocol.CRLF);
        return execute(request,
                new StatusResponseParser(MemcachedProtocol.DELETED, Set.of(MemcachedProtocol.NOT_FOUND)));
    }

    public CacheNode node()
    {
        return node;
    }

    public String id()
    {
        return node.id();
    }

    int openConnections()
    {
        return openConnections.get();
    }

    /**
     * Havuzdan bir bağlantı alır, komutu gönderip yanıtı bekler. Başarılı
     * yanıttan sonra bağlantı havuza döner; her hata bağlantıyı kapatır çünkü
     * akışın hangi noktada kaldığı bilinemez.
     */
    private <T> T execute(Buffer request, ResponseParser<T> parser)
    {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking memcached call attempted on an event loop thread");
        }
        PooledConnection connection;
        try {
            connection = acquireConnection();
        } catch (IOException e) {
            throw communicationError("Failed to acquire connection", e);
        }

        boolean reusable = false;
        try {
            T result = await(send(connection, request, parser));
            reusable = true;
            return result;
        } finally {
            if (reusable) {
                release(connection);
            } else {
                discard(connection);
            }
        }
    }

    private <T> T await(Future<T> response)
    {
        try {
            return response.toCompletionStage().toCompletableFuture()
                    .get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw communicationError("Request timed out", e);
        } catch (ExecutionException e) {
            throw communicationError("Command failed", e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw communicationError("Interrupted while waiting for response", e);
        }
    }

    private NodeCommunicationException communicationError(String message, Throwable cause)
    {
        LOG.debugf(cause, "%s on memcached node %s", message, id());
        return new NodeCommunicationException(message + " on memcached node " + host + ':' + port, cause);
    }

    private PooledConnection acquireConnection() throws IOException
    {
        long deadline = System.nanoTime() + requestTimeoutNanos;
        while (!closed.get()) {
            PooledConnection idle = pool.poll();
            if (idle == null) {
                if (reserveSlot()) {
                    return openReserved();
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    throw new IOException("Timeout acquiring pooled connection");
                }
                try {
                    idle = pool.poll(remaining, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while waiting for pooled connection", e);
                }
            }
            if (idle != null && !idle.closed) {
                return idle;
            }
        }
        throw new IOException("Memcached node is closed");
    }

    private boolean reserveSlot()
    {
        return openConnections.getAndUpdate(n -> n < maxPoolSize ? n + 1 : n) < maxPoolSize;
    }

    private PooledConnection openReserved() throws IOException
    {
        NetSocket socket;
        try {
            socket = netClient.connect(port, host).toCompletionStage().toCompletableFuture()
                    .get(connectTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            openConnections.decrementAndGet();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting", e);
        } catch (ExecutionException e) {
            openConnections.decrementAndGet();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw cause instanceof IOException io ? io : new IOException("Failed to open connection", cause);
        } catch (TimeoutException e) {
            openConnections.decrementAndGet();
            throw new IOException("Connection timed out", e);
        }

        PooledConnection connection = new PooledConnection(socket);
        allConnections.add(connection);
        socket.pause();
        socket.closeHandler(v -> {
            connection.closed = true;
            pool.remove(connection);
            allConnections.remove(connection);
            openConnections.decrementAndGet();
            Promise<?> pending = connection.pending;
            if (pending != null) {
                pending.tryFail(new IOException("Connection closed"));
            }
        });
        LOG.debugf("Opened connection to memcached node %s", id());
        return connection;
    }

    private void release(PooledConnection connection)
    {
        if (closed.get() || connection.closed || !pool.offer(connection)) {
            discard(connection);
        }
    }

    private void discard(PooledConnection connection)
    {
        pool.remove(connection);
        allConnections.remove(connection);
        if (!connection.closed) {
            connection.closed = true;
            connection.socket.close().onFailure(e ->
                    LOG.debugf(e, "Failed to close socket for memcached node %s", id()));
        }
    }

    private <T> Future<T> send(PooledConnection connection, Buffer request, ResponseParser<T> parser)
    {
        Promise<T> promise = Promise.promise();
        NetSocket socket = connection.socket;
        connection.pending = promise;
        socket.handler(buffer -> {
            try {
                parser.handle(buffer);
                if (parser.completed()) {
                    promise.tryComplete(parser.result());
                }
            } catch (IOException | RuntimeException e) {
                promise.tryFail(e);
            }
        });
        socket.exceptionHandler(promise::tryFail);
        socket.resume();
        socket.write(request).onFailure(promise::tryFail);
        return promise.future().onComplete(ar -> {
            connection.pending = null;
            // havuzda beklerken gelen veri bir sonraki komutun ayrıştırıcısına karışmasın
            socket.pause();
            socket.handler(null);
            socket.exceptionHandler(null);
        });
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (PooledConnection connection : allConnections.toArray(new PooledConnection[0])) {
            discard(connection);
        }
    }

    private static boolean isErrorLine(String line)
    {
        return MemcachedProtocol.ERROR.equals(line)
                || line.startsWith(MemcachedProtocol.CLIENT_ERROR)
                || line.startsWith(MemcachedProtocol.SERVER_ERROR);
    }

    private abstract static class ResponseParser<T>
    {
        protected final LineBufferReader reader = new LineBufferReader();
        protected boolean complete;
        protected T result;

        void handle(Buffer buffer) throws IOException
        {
            reader.append(buffer);
            parse();
        }

        protected abstract void parse() throws IOException;

        boolean completed()
        {
            return complete;
        }

        T result()
        {
            return result;
        }
    }

    /**
     * Tek satırlık durum yanıtlarını ({@code STORED}, {@code DELETED} ...)
     * boolean sonuca çevirir.
     */
    private static final class StatusResponseParser extends ResponseParser<Boolean>
    {
        private final String success;
        private final Set<String> failures;

        private StatusResponseParser(String success, Set<String> failures)
        {
            this.success = success;
            this.failures = failures;
        }

        @Override
        protected void parse() throws IOException
        {
            String line = reader.readLine();
            if (line == null) {
                return;
            }
            if (success.equals(line)) {
                result = Boolean.TRUE;
            } else if (failures.contains(line)) {
                result = Boolean.FALSE;
            } else if (isErrorLine(line)) {
                throw new IOException("Server replied " + line);
            } else {
                throw new IOException("unexpected response: " + line);
            }
            complete = true;
        }
    }

    private static final class RetrievalResponseParser extends ResponseParser<Map<String, String>>
    {
        private final Map<String, String> values = new LinkedHashMap<>();
        private String pendingKey;
        private int pendingLength;

        @Override
        protected void parse() throws IOException
        {
            while (!complete) {
                if (pendingKey == null) {
                    String line = reader.readLine();
                    if (line == null) {
                        return;
                    }
                    if (MemcachedProtocol.END.equals(line)) {
                        result = values;
                        complete = true;
                        return;
                    }
                    if (isErrorLine(line)) {
                        throw new IOException("Server replied " + line);
                    }
                    String[] parts = line.split(" ");
                    if (parts.length < 4 || !MemcachedProtocol.VALUE.equals(parts[0])) {
                        throw new IOException("unexpected response to get: " + line);
                    }
                    try {
                        pendingLength = Integer.parseInt(parts[3]);
                    } catch (NumberFormatException e) {
                        throw new IOException("invalid value length: " + line, e);
                    }
                    if (pendingLength < 0) {
                        throw new IOException("negative value length");
                    }
                    pendingKey = parts[1];
                } else {
                    if (!reader.has(pendingLength + 2)) {
                        return;
                    }
                    byte[] data = reader.readBytes(pendingLength);
                    byte[] terminator = reader.readBytes(2);
                    if (terminator[0] != '\r' || terminator[1] != '\n') {
                        throw new IOException("missing CRLF after data block");
                    }
                    values.put(pendingKey, StringCodec.UTF8.decode(data));
                    pendingKey = null;
                }
            }
        }
    }

    private static final class LineBufferReader
    {
        private final Buffer buffer = Buffer.buffer();
        private int readIndex;

        void append(Buffer chunk)
        {
            buffer.appendBuffer(chunk);
        }

        boolean has(int bytes)
        {
            return buffer.length() - readIndex >= bytes;
        }

        /**
         * CRLF ile biten bir sonraki satırı sonlandırıcı olmadan döndürür;
         * satır henüz tamamlanmadıysa {@code null}.
         */
        String readLine()
        {
            for (int i = readIndex; i < buffer.length(); i++) {
                if (buffer.getByte(i) == '\n') {
                    int end = i > readIndex && buffer.getByte(i - 1) == '\r' ? i - 1 : i;
                    String line = buffer.getString(readIndex, end, StandardCharsets.UTF_8.name());
                    readIndex = i + 1;
                    return line;
                }
            }
            return null;
        }

        byte[] readBytes(int length)
        {
            byte[] data = buffer.getBytes(readIndex, readIndex + length);
            readIndex += length;
            return data;
        }
    }

    private static final class PooledConnection
    {
        final NetSocket socket;
        volatile boolean closed;
        volatile Promise<?> pending;

        private PooledConnection(NetSocket socket)
        {
            this.socket = socket;
        }
    }
}
