package dev.wsrpc.client.transport;

import dev.wsrpc.transport.ArgumentConversion;
import dev.wsrpc.transport.InvocationEnvelope;
import dev.wsrpc.transport.MessageFormatException;
import dev.wsrpc.transport.MessageFormatter;
import dev.wsrpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the RPC protocol over a JDK {@link WebSocket}. Replies carry no correlation id,
 * so calls of the same method are matched to replies in the order they were sent; the server
 * answers the requests of one connection strictly in order.
 */
public class RpcClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RpcClient.class);

    private final URI uri;
    private final RpcClientOptions options;
    private final MessageFormatter formatter;
    private final Map<String, Deque<PendingCall<?>>> pending = new ConcurrentHashMap<>();
    private final Map<String, Consumer<List<Object>>> listeners = new ConcurrentHashMap<>();
    private final Object sendLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CompletableFuture<Integer> closeFuture = new CompletableFuture<>();
    private final Listener listener = new Listener();

    private volatile WebSocket webSocket;
    private ScheduledExecutorService keepAlive;

    public RpcClient(URI uri, RpcClientOptions options) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.options = Objects.requireNonNull(options, "options");
        this.formatter = options.formatter();
    }

    public static RpcClient connect(URI uri, RpcClientOptions options) throws IOException {
        RpcClient client = new RpcClient(uri, options);
        client.connect();
        return client;
    }

    public void connect() throws IOException {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(options.connectTimeout())
            .build();
        WebSocket.Builder builder = httpClient.newWebSocketBuilder()
            .connectTimeout(options.connectTimeout());
        if (options.hasCredentials()) {
            String token = options.username() + ":" + options.password();
            builder.header("Authorization",
                "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
        }
        try {
            builder.buildAsync(uri, listener).get(options.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + uri, e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to connect to " + uri, e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to " + uri, e);
        }
        LOGGER.info("Connected to {}", uri);
        startKeepAlive();
    }

    /**
     * Calls a method that replies with a value. The future fails with an {@link IOException} when
     * the request cannot be sent or the connection closes first, and with a
     * {@link TimeoutException} when no reply arrives within the request timeout. The reply that
     * arrives after a timeout is discarded.
     */
    public <T> CompletableFuture<T> invoke(String method, Class<T> resultType, Object... arguments) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(resultType, "resultType");
        PendingCall<T> call = new PendingCall<>(method, resultType, new CompletableFuture<>());
        Deque<PendingCall<?>> queue = pending.computeIfAbsent(key(method), k -> new ArrayDeque<>());
        synchronized (sendLock) {
            synchronized (queue) {
                queue.addLast(call);
            }
            try {
                sendNow(InvocationEnvelope.request(method, arguments));
            } catch (IOException e) {
                synchronized (queue) {
                    queue.remove(call);
                }
                call.future().completeExceptionally(e);
                return call.future();
            }
        }
        // a timed-out call keeps its place in the queue so that its late reply is not taken by the next call
        call.future().orTimeout(options.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return call.future();
    }

    /**
     * Calls a void method; the server sends no reply.
     */
    public void notify(String method, Object... arguments) throws IOException {
        Objects.requireNonNull(method, "method");
        synchronized (sendLock) {
            sendNow(InvocationEnvelope.request(method, arguments));
        }
    }

    /**
     * Registers the handler of server pushes to {@code method}; replaces any previous handler.
     */
    public void on(String method, Consumer<List<Object>> handler) {
        listeners.put(key(method), Objects.requireNonNull(handler, "handler"));
    }

    public boolean isOpen() {
        WebSocket socket = webSocket;
        return socket != null && !closed.get() && !socket.isOutputClosed();
    }

    /**
     * Completes with the close code once the connection has ended.
     */
    public CompletableFuture<Integer> closeFuture() {
        return closeFuture;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopKeepAlive();
        WebSocket socket = webSocket;
        if (socket != null && !socket.isOutputClosed()) {
            try {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                    .get(options.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                socket.abort();
            } catch (ExecutionException | TimeoutException e) {
                LOGGER.debug("Close handshake with {} failed, aborting", uri, e);
                socket.abort();
            }
        }
        failPending(new IOException("Client closed"));
        LOGGER.info("Disconnected from {}", uri);
    }

    WebSocket.Listener listener() {
        return listener;
    }

    private void sendNow(InvocationEnvelope message) throws IOException {
        WebSocket socket = webSocket;
        if (socket == null || closed.get()) {
            throw new IOException("Not connected to " + uri);
        }
        String text;
        try {
            text = formatter.formatMessage(message);
        } catch (MessageFormatException e) {
            throw new IOException("Failed to format call of " + message.method(), e);
        }
        Wire.tx(uri.toString(), message);
        try {
            // the JDK socket allows one outstanding send at a time
            socket.sendText(text, true).get(options.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending " + message.method(), e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to send " + message.method(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Timed out sending " + message.method(), e);
        }
    }

    private void handleMessage(String text) {
        InvocationEnvelope message;
        try {
            message = formatter.resolveMessage(text);
        } catch (MessageFormatException e) {
            LOGGER.warn("Dropping unreadable message from {}: {}", uri, Wire.truncate(text, 200), e);
            return;
        }
        Wire.rx(uri.toString(), message);
        if (message.isResponse()) {
            completeCall(message);
        } else {
            dispatchPush(message);
        }
    }

    private void completeCall(InvocationEnvelope reply) {
        Deque<PendingCall<?>> queue = pending.get(key(reply.method()));
        PendingCall<?> call = null;
        if (queue != null) {
            synchronized (queue) {
                call = queue.pollFirst();
            }
        }
        if (call == null) {
            LOGGER.warn("Reply to {} without a pending call", reply.method());
            return;
        }
        if (call.future().isDone()) {
            LOGGER.debug("Discarding late reply to {}", reply.method());
            return;
        }
        call.complete(formatter, reply.result());
    }

    private void dispatchPush(InvocationEnvelope push) {
        Consumer<List<Object>> handler = listeners.get(key(push.method()));
        if (handler == null) {
            LOGGER.debug("No handler for pushed method {}", push.method());
            return;
        }
        try {
            handler.accept(push.arguments());
        } catch (RuntimeException e) {
            LOGGER.warn("Handler of pushed method {} failed", push.method(), e);
        }
    }

    private void startKeepAlive() {
        if (!options.keepAliveEnabled()) {
            return;
        }
        keepAlive = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rpc-client-keepalive");
            t.setDaemon(true);
            return t;
        });
        long period = options.keepAliveInterval().toMillis();
        keepAlive.scheduleAtFixedRate(this::sendKeepAlive, period, period, TimeUnit.MILLISECONDS);
    }

    private void sendKeepAlive() {
        if (!isOpen()) {
            return;
        }
        try {
            notify(options.keepAliveMethod());
        } catch (IOException e) {
            LOGGER.warn("Keep-alive to {} failed", uri, e);
        }
    }

    private void stopKeepAlive() {
        if (keepAlive != null) {
            keepAlive.shutdownNow();
        }
    }

    private void connectionEnded(int statusCode, Throwable error) {
        closed.set(true);
        stopKeepAlive();
        failPending(error != null ? new IOException("Connection to " + uri + " failed", error)
            : new IOException("Connection to " + uri + " closed with status " + statusCode));
        closeFuture.complete(statusCode);
    }

    private void failPending(IOException cause) {
        for (Deque<PendingCall<?>> queue : pending.values()) {
            List<PendingCall<?>> calls;
            synchronized (queue) {
                calls = new ArrayList<>(queue);
                queue.clear();
            }
            for (PendingCall<?> call : calls) {
                call.future().completeExceptionally(cause);
            }
        }
    }

    private static String key(String method) {
        return method.toLowerCase(Locale.ROOT);
    }

    private record PendingCall<T>(String method, Class<T> resultType, CompletableFuture<T> future) {

        @SuppressWarnings("unchecked")
        void complete(MessageFormatter formatter, Object result) {
            ArgumentConversion conversion = formatter.convertArgument(result, resultType);
            if (conversion.isSuccess()) {
                future.complete((T) conversion.value());
            } else {
                future.completeExceptionally(new IOException(
                    "Reply to " + method + " is not a " + resultType.getSimpleName(), conversion.failure()));
            }
        }
    }

    private final class Listener implements WebSocket.Listener {

        private final StringBuilder text = new StringBuilder();
        private int binaryLength;

        @Override
        public void onOpen(WebSocket socket) {
            webSocket = socket;
            socket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket socket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                handleMessage(message);
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket socket, ByteBuffer data, boolean last) {
            binaryLength += data.remaining();
            if (last) {
                Wire.binary(uri.toString(), "RX", binaryLength);
                binaryLength = 0;
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket socket, int statusCode, String reason) {
            LOGGER.info("Connection to {} closed by server with status {} {}", uri, statusCode, reason);
            connectionEnded(statusCode, null);
            return null;
        }

        @Override
        public void onError(WebSocket socket, Throwable error) {
            LOGGER.error("Transport error on connection to {}", uri, error);
            connectionEnded(-1, error);
        }
    }
}
