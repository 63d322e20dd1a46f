package com.counter.cluster.remote;

import com.counter.cluster.StorageNode;
import com.counter.cluster.StorageNodeException;
import com.counter.constants.RespProtocol;
import io.vertx.core.Context;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import io.vertx.core.net.NetSocket;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bir Redis sunucusuna RESP2 protokolüyle TCP üzerinden bağlanarak
 * {@link StorageNode} sözleşmesini uygulayan depolama düğümüdür. Artırma
 * {@code INCRBY}, okuma {@code GET}, sıfırlama {@code DEL}, canlılık yoklaması
 * ise {@code PING} ile yapılır. Vert.x {@link NetClient} üzerinden açılan
 * bağlantılar havuzlanarak yeniden kullanılır; her istek bağlantı ve yanıt
 * zaman aşımıyla sınırlıdır. Parola ya da veritabanı numarası verilmişse yeni
 * açılan her bağlantıda önce {@code AUTH}/{@code SELECT} gönderilir.
 */
public final class RedisStorageNode implements StorageNode
{
    private static final Logger LOG = Logger.getLogger(RedisStorageNode.class);

    private final String id;
    private final String host;
    private final int port;
    private final String password;
    private final int database;
    private final long connectTimeoutMillis;
    private final long requestTimeoutMillis;
    private final long requestTimeoutNanos;
    private final NetClient netClient;
    private final int maxPoolSize;
    private final BlockingQueue<PooledConnection> pool;
    private final Set<PooledConnection> allConnections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger openConnections = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public RedisStorageNode(String id, String host, int port, String password, int database,
                            int connectTimeoutMillis, long requestTimeoutMillis, Vertx vertx)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.password = password == null || password.isEmpty() ? null : password;
        this.database = database;
        this.connectTimeoutMillis = Math.max(100L, connectTimeoutMillis);
        this.requestTimeoutMillis = Math.max(1L, requestTimeoutMillis);
        this.requestTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(this.requestTimeoutMillis);
        this.maxPoolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
        this.pool = new LinkedBlockingQueue<>(maxPoolSize);

        NetClientOptions options = new NetClientOptions()
                .setConnectTimeout((int) Math.min(Integer.MAX_VALUE, this.connectTimeoutMillis))
                .setTcpNoDelay(true)
                .setTcpKeepAlive(true);
        this.netClient = Objects.requireNonNull(vertx, "vertx").createNetClient(options);
    }

    @Override
    public long incrementBy(String key, long delta)
    {
        RespReply reply = execute(encode(RespProtocol.CMD_INCRBY, key, Long.toString(delta)));
        return reply.requireInteger(RespProtocol.CMD_INCRBY);
    }

    @Override
    public Long get(String key)
    {
        RespReply reply = execute(encode(RespProtocol.CMD_GET, key));
        String text = reply.requireBulk(RespProtocol.CMD_GET);
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new StorageNodeException("Non-numeric value stored under " + key + " on node " + id, e);
        }
    }

    @Override
    public boolean delete(String key)
    {
        RespReply reply = execute(encode(RespProtocol.CMD_DEL, key));
        return reply.requireInteger(RespProtocol.CMD_DEL) > 0;
    }

    @Override
    public void ping()
    {
        RespReply reply = execute(encode(RespProtocol.CMD_PING));
        reply.requireSimple(RespProtocol.CMD_PING);
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public String address()
    {
        return "redis://" + host + ':' + port + (database >= 0 ? "/" + database : "");
    }

    private RespReply execute(Buffer request)
    {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking storage call issued from an event loop thread");
        }
        if (closed.get()) {
            throw new StorageNodeException("Storage node " + id + " is closed");
        }

        try (ConnectionLease lease = new ConnectionLease(acquireConnection())) {
            CompletableFuture<RespReply> future;
            try {
                future = send(lease.connection(), request);
            } catch (RuntimeException e) {
                lease.discard(e);
                throw communicationError("Command dispatch failed", e);
            }
            return awaitResult(future, lease);
        } catch (IOException e) {
            throw communicationError("Failed to acquire connection", e);
        }
    }

    private RespReply awaitResult(CompletableFuture<RespReply> future, ConnectionLease lease)
    {
        try {
            RespReply reply = future.get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
            if (reply.isError()) {
                throw new StorageNodeException("Node " + id + " rejected command: " + reply.text());
            }
            return reply;
        } catch (TimeoutException e) {
            lease.discard(e);
            throw communicationError("Request to node timed out", e);
        } catch (CancellationException e) {
            lease.discard(e);
            throw communicationError("Request to node was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            lease.discard(cause);
            throw communicationError("Command failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lease.discard(e);
            throw communicationError("Interrupted while waiting for response", e);
        }
    }

    private StorageNodeException communicationError(String message, Throwable cause)
    {
        return new StorageNodeException(message + " from node " + id + " at " + host + ':' + port, cause);
    }

    private PooledConnection acquireConnection() throws IOException
    {
        long startTime = System.nanoTime();
        while (true) {
            if (closed.get()) {
                throw new IOException("Storage node is closed");
            }
            PooledConnection pooled = pool.poll();
            if (pooled != null) {
                if (!pooled.closed) {
                    return pooled;
                }
                continue;
            }

            int current = openConnections.get();
            if (current < maxPoolSize) {
                if (openConnections.compareAndSet(current, current + 1)) {
                    return createConnection();
                }
                continue;
            }

            long remaining = requestTimeoutNanos - (System.nanoTime() - startTime);
            if (remaining <= 0L) {
                throw new IOException("Timeout acquiring pooled connection");
            }
            try {
                pooled = pool.poll(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining)), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for pooled connection", e);
            }
            if (pooled == null) {
                throw new IOException("Timeout acquiring pooled connection");
            }
            if (!pooled.closed) {
                return pooled;
            }
        }
    }

    private PooledConnection createConnection() throws IOException
    {
        CompletableFuture<NetSocket> future = new CompletableFuture<>();
        netClient.connect(port, host, ar -> {
            if (ar.succeeded()) {
                if (!future.complete(ar.result())) {
                    ar.result().close();
                }
            } else {
                future.completeExceptionally(ar.cause());
            }
        });

        NetSocket socket;
        try {
            socket = future.get(connectTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            openConnections.decrementAndGet();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting", e);
        } catch (ExecutionException e) {
            openConnections.decrementAndGet();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to open connection", cause);
        } catch (TimeoutException e) {
            openConnections.decrementAndGet();
            future.cancel(true);
            throw new IOException("Connection timed out", e);
        }

        PooledConnection connection = new PooledConnection(socket);
        allConnections.add(connection);
        socket.pause();
        socket.closeHandler(v -> {
            connection.closed = true;
            pool.remove(connection);
            allConnections.remove(connection);
            Promise<?> pending = connection.clearInFlight();
            if (pending != null) {
                pending.tryFail(new IOException("Connection closed"));
            }
            forget(connection);
        });

        try {
            handshake(connection);
        } catch (IOException | RuntimeException e) {
            discard(connection);
            throw e instanceof IOException io ? io : new IOException("Handshake failed", e);
        }
        return connection;
    }

    private void handshake(PooledConnection connection) throws IOException
    {
        if (password != null) {
            awaitHandshake(connection, encode(RespProtocol.CMD_AUTH, password), RespProtocol.CMD_AUTH);
        }
        if (database >= 0) {
            awaitHandshake(connection, encode(RespProtocol.CMD_SELECT, Integer.toString(database)),
                    RespProtocol.CMD_SELECT);
        }
    }

    private void awaitHandshake(PooledConnection connection, Buffer request, String command) throws IOException
    {
        RespReply reply;
        try {
            reply = send(connection, request).get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted during " + command, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException(command + " failed", e);
        }
        if (reply.isError()) {
            throw new IOException(command + " rejected: " + reply.text());
        }
    }

    private void release(PooledConnection connection)
    {
        connection.clearInFlight();
        if (closed.get() || connection.closed) {
            discard(connection);
            return;
        }
        connection.socket.pause();
        if (!pool.offer(connection)) {
            discard(connection);
        }
    }

    private void forget(PooledConnection connection)
    {
        if (connection.counted.compareAndSet(true, false)) {
            openConnections.decrementAndGet();
        }
    }

    private void discard(PooledConnection connection)
    {
        connection.clearInFlight();
        pool.remove(connection);
        allConnections.remove(connection);
        forget(connection);
        if (!connection.closed) {
            connection.closed = true;
            try {
                connection.socket.close();
            } catch (Exception e) {
                if (LOG.isDebugEnabled()) {
                    LOG.debugf(e, "Failed to close socket for storage node %s at %s:%d", id, host, port);
                }
            }
        }
    }

    private CompletableFuture<RespReply> send(PooledConnection connection, Buffer request)
    {
        Promise<RespReply> promise = Promise.promise();
        if (!connection.register(promise)) {
            promise.fail(new IllegalStateException("Connection already in use"));
            return promise.future().toCompletionStage().toCompletableFuture();
        }

        ReplyParser parser = new ReplyParser();
        NetSocket socket = connection.socket;
        socket.handler(buffer -> {
            try {
                parser.handle(buffer);
                if (parser.completed()) {
                    promise.tryComplete(parser.result());
                }
            } catch (Exception e) {
                promise.tryFail(e);
            }
        });
        socket.exceptionHandler(promise::tryFail);
        socket.resume();
        socket.write(request, ar -> {
            if (ar.failed()) {
                promise.tryFail(ar.cause());
            }
        });
        promise.future().onComplete(ar -> {
            connection.clear(promise);
            socket.handler(null);
            socket.exceptionHandler(null);
        });
        return promise.future().toCompletionStage().toCompletableFuture();
    }

    static Buffer encode(String... args)
    {
        Buffer out = Buffer.buffer();
        out.appendByte(RespProtocol.ARRAY).appendString(Integer.toString(args.length)).appendByte(RespProtocol.CR)
                .appendByte(RespProtocol.LF);
        for (String arg : args) {
            byte[] bytes = arg.getBytes(StandardCharsets.UTF_8);
            out.appendByte(RespProtocol.BULK_STRING).appendString(Integer.toString(bytes.length))
                    .appendByte(RespProtocol.CR).appendByte(RespProtocol.LF)
                    .appendBytes(bytes)
                    .appendByte(RespProtocol.CR).appendByte(RespProtocol.LF);
        }
        return out;
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        PooledConnection pooled;
        while ((pooled = pool.poll()) != null) {
            discard(pooled);
        }
        for (PooledConnection connection : allConnections.toArray(new PooledConnection[0])) {
            discard(connection);
        }
        try {
            netClient.close().toCompletionStage().toCompletableFuture().get(connectTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOG.debugf(e, "Failed to close net client for storage node %s at %s:%d", id, host, port);
        }
    }

    @Override
    public String toString()
    {
        return "RedisStorageNode{" + id + '}';
    }

    private final class ConnectionLease implements AutoCloseable
    {
        private PooledConnection connection;
        private boolean discard;

        private ConnectionLease(PooledConnection connection)
        {
            this.connection = Objects.requireNonNull(connection, "connection");
        }

        private PooledConnection connection()
        {
            if (connection == null) {
                throw new IllegalStateException("Connection lease is closed");
            }
            return connection;
        }

        private void discard(Throwable cause)
        {
            discard = true;
            if (cause != null && LOG.isDebugEnabled()) {
                LOG.debugf(cause, "Discarding connection to storage node %s at %s:%d", id, host, port);
            }
        }

        @Override
        public void close()
        {
            if (connection == null) {
                return;
            }
            PooledConnection pooled = connection;
            connection = null;
            if (discard) {
                RedisStorageNode.this.discard(pooled);
            } else {
                RedisStorageNode.this.release(pooled);
            }
        }
    }

    private static final class PooledConnection
    {
        final NetSocket socket;
        private final AtomicReference<Promise<?>> inFlight = new AtomicReference<>();
        private final AtomicBoolean counted = new AtomicBoolean(true);
        volatile boolean closed;

        private PooledConnection(NetSocket socket)
        {
            this.socket = socket;
        }

        boolean register(Promise<?> promise)
        {
            return inFlight.compareAndSet(null, promise);
        }

        void clear(Promise<?> promise)
        {
            inFlight.compareAndSet(promise, null);
        }

        Promise<?> clearInFlight()
        {
            return inFlight.getAndSet(null);
        }
    }
}
