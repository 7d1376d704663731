package dev.wsrpc.transport;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the per-connection RPC endpoint. A subclass exposes its methods through a
 * {@link MethodTable} and may override the notification hooks; one instance serves exactly one
 * connection.
 *
 * <p>{@link #accept(ConnectionHandler, AcceptContext)} registers the handler, starts the heartbeat
 * and runs the receive loop on the calling thread until the connection ends. Inbound messages are
 * processed strictly in arrival order. Writes, whether replies or pushes from other threads, are
 * serialized per connection. Teardown runs exactly once, whichever of the receive loop, the
 * heartbeat timer or an explicit close gets there first.
 *
 * @param <H> the concrete handler type
 */
public abstract class ConnectionHandler<H extends ConnectionHandler<H>> implements ClientProxy, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionHandler.class);

    private final String connectionId = UUID.randomUUID().toString();
    private final MethodTable<H> methods;
    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicBoolean accepted = new AtomicBoolean();
    private final AtomicBoolean tornDown = new AtomicBoolean();
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.OPEN);

    private volatile AcceptContext context;
    private volatile MessageCodec codec;
    private volatile HeartbeatMonitor heartbeat;
    private MethodDispatcher<H> dispatcher;

    protected ConnectionHandler(MethodTable<H> methods) {
        this.methods = Objects.requireNonNull(methods, "methods");
    }

    /**
     * Serves the connection described by {@code context} until it ends. Never throws; failures are
     * logged and reported through the notification hooks.
     */
    public static <H extends ConnectionHandler<H>> void accept(H handler, AcceptContext context) {
        ConnectionHandler<H> connection = handler;
        connection.run(context);
    }

    private void run(AcceptContext acceptContext) {
        if (!accepted.compareAndSet(false, true)) {
            LOGGER.error("Handler for connection {} was already accepted, ignoring second socket", connectionId);
            return;
        }
        ConnectionOptions options = acceptContext.options();
        this.codec = MessageCodec.of(options);
        this.dispatcher = new MethodDispatcher<>(methods, options.formatter(), options.invocationTimeout());
        this.heartbeat = new HeartbeatMonitor(connectionId, options.heartbeatInterval(),
            options.heartbeatTryTimes(), acceptContext.clock(), this::onHeartbeatTimeout);
        this.context = acceptContext;

        try {
            heartbeat.start(acceptContext.heartbeatScheduler());
            acceptContext.clients().add(connectionId, this);
            LOGGER.info("Accepted connection {} ({})", connectionId, getClass().getSimpleName());
            notifyHook("onConnected", this::onConnected);
            receiveLoop(acceptContext.socket(), options);
        } catch (IOException e) {
            if (tornDown.get() || disposed.get()) {
                LOGGER.debug("Receive loop of connection {} ended after close", connectionId, e);
            } else {
                LOGGER.error("Transport failure on connection {}", connectionId, e);
            }
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure on connection {}", connectionId, e);
        } finally {
            teardown();
        }
    }

    private void receiveLoop(RpcSocket socket, ConnectionOptions options) throws IOException {
        byte[] buffer = new byte[options.receiveBufferSize()];
        FrameReassembler pending = new FrameReassembler(buffer.length);

        SocketFrame frame = socket.receive(buffer);
        while (!frame.isClose()) {
            pending.append(buffer, frame.count(), frame.endOfMessage());
            if (pending.isComplete()) {
                byte[] reply = handleMessage(frame.type(), pending.extract());
                if (reply != null) {
                    write(reply, frame.type());
                }
            }
            frame = socket.receive(buffer);
        }

        CloseStatus status = frame.closeStatus();
        if (status != null) {
            state.compareAndSet(LifecycleState.OPEN, LifecycleState.CLOSING);
            LOGGER.info("Connection {} closed by peer with status {}", connectionId, status);
            sendLock.lock();
            try {
                socket.close(status);
            } finally {
                sendLock.unlock();
            }
        }
    }

    /**
     * Processes one complete inbound message and returns the encoded reply, if any.
     */
    private byte[] handleMessage(FrameType type, byte[] payload) {
        heartbeat.touch();

        if (type == FrameType.BINARY) {
            Wire.binary(connectionId, "RX", payload.length);
            notifyHook("onBinaryReceived", () -> onBinaryReceived(payload));
            return null;
        }

        String content = codec.decodeText(payload);
        notifyHook("onTextReceived", () -> onTextReceived(content));

        InvocationEnvelope request;
        try {
            request = codec.decode(content);
        } catch (MessageFormatException e) {
            LOGGER.warn("Dropping unresolvable message on connection {}: {}", connectionId,
                Wire.truncate(content, 200), e);
            notifyHook("onResolveError", () -> onResolveError(content, e));
            return null;
        }
        Wire.rx(connectionId, request);

        DispatchOutcome outcome = dispatcher.dispatch(self(), connectionId, request);
        if (outcome.isFailure()) {
            InvocationException failure = outcome.failure();
            LOGGER.warn("Invocation of {} failed on connection {}", request.method(), connectionId, failure);
            notifyHook("onInvokeError", () -> onInvokeError(request, failure));
        }

        InvocationEnvelope reply = outcome.reply();
        if (reply == null) {
            return null;
        }
        try {
            byte[] encoded = codec.encode(reply);
            Wire.tx(connectionId, reply);
            return encoded;
        } catch (MessageFormatException e) {
            InvocationException failure = new InvocationException(connectionId,
                "Failed to encode result of " + request.method(), e);
            LOGGER.warn("Dropping reply to {} on connection {}", request.method(), connectionId, e);
            notifyHook("onInvokeError", () -> onInvokeError(reply, failure));
            return null;
        }
    }

    /**
     * Calls {@code method} on the client of this connection. A failed write is reported through
     * {@link #onInvokeError} and never thrown.
     */
    @Override
    public void send(String method, Object... arguments) {
        InvocationEnvelope message = InvocationEnvelope.request(method, arguments);
        try {
            MessageCodec messageCodec = codec;
            if (messageCodec == null) {
                throw new IOException("Connection " + connectionId + " has not been accepted");
            }
            byte[] payload = messageCodec.encode(message);
            Wire.tx(connectionId, message);
            write(payload, FrameType.TEXT);
        } catch (IOException e) {
            InvocationException failure = new InvocationException(connectionId,
                "Failed to invoke client method " + method, e);
            LOGGER.warn("Push of {} to connection {} failed", method, connectionId, e);
            notifyHook("onInvokeError", () -> onInvokeError(message, failure));
        }
    }

    /**
     * Sends raw bytes as one binary message.
     */
    public void sendBinary(byte[] payload) throws IOException {
        Objects.requireNonNull(payload, "payload");
        Wire.binary(connectionId, "TX", payload.length);
        write(payload, FrameType.BINARY);
    }

    private void write(byte[] payload, FrameType type) throws IOException {
        AcceptContext acceptContext = context;
        if (acceptContext == null) {
            throw new IOException("Connection " + connectionId + " has not been accepted");
        }
        RpcSocket socket = acceptContext.socket();
        sendLock.lock();
        try {
            if (!socket.isOpen()) {
                throw new IOException("Connection " + connectionId + " is closed");
            }
            socket.send(payload, type, true);
        } finally {
            sendLock.unlock();
        }
    }

    private void onHeartbeatTimeout() {
        state.compareAndSet(LifecycleState.OPEN, LifecycleState.CLOSING);
        RpcSocket socket = context.socket();
        if (!socket.isOpen()) {
            teardown();
            return;
        }
        sendLock.lock();
        try {
            socket.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOGGER.warn("Failed to close idle connection {}, releasing it", connectionId, e);
            teardown();
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Deregisters the connection, fires {@link #onDisconnected()} and releases the socket. Runs at
     * most once.
     */
    protected final void teardown() {
        if (!tornDown.compareAndSet(false, true)) {
            return;
        }
        state.set(LifecycleState.CLOSING);
        AcceptContext acceptContext = context;
        if (acceptContext != null) {
            acceptContext.clients().remove(connectionId);
            acceptContext.groups().removeFromAll(connectionId);
        }
        LOGGER.info("Connection {} disconnected", connectionId);
        notifyHook("onDisconnected", this::onDisconnected);
        close();
        state.set(LifecycleState.CLOSED);
    }

    /**
     * Releases the socket and stops the heartbeat. Idempotent; does not fire notifications.
     */
    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        HeartbeatMonitor monitor = heartbeat;
        if (monitor != null) {
            monitor.close();
        }
        AcceptContext acceptContext = context;
        if (acceptContext != null) {
            try {
                acceptContext.socket().close();
            } catch (IOException e) {
                LOGGER.debug("Error releasing socket of connection {}", connectionId, e);
            }
        }
    }

    private void notifyHook(String hook, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOGGER.warn("{} hook of connection {} threw", hook, connectionId, e);
        }
    }

    @SuppressWarnings("unchecked")
    private H self() {
        return (H) this;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public LifecycleState state() {
        return state.get();
    }

    public Instant lastActivity() {
        HeartbeatMonitor monitor = heartbeat;
        return monitor == null ? null : monitor.lastActivity();
    }

    /**
     * Connections served by the same endpoint, for pushes to other clients.
     */
    protected ClientManager clients() {
        return requireContext().clients();
    }

    protected GroupManager groups() {
        return requireContext().groups();
    }

    private AcceptContext requireContext() {
        AcceptContext acceptContext = context;
        if (acceptContext == null) {
            throw new IllegalStateException("Connection " + connectionId + " has not been accepted");
        }
        return acceptContext;
    }

    protected void onConnected() {
    }

    protected void onDisconnected() {
    }

    protected void onTextReceived(String content) {
    }

    protected void onBinaryReceived(byte[] payload) {
    }

    protected void onResolveError(String content, Exception exception) {
    }

    protected void onInvokeError(InvocationEnvelope message, InvocationException exception) {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + connectionId + ", " + state.get() + "]";
    }
}
