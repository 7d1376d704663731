package dev.wsrpc.transport;

import java.io.IOException;

/**
 * Message-oriented bidirectional socket owned by exactly one {@link ConnectionHandler}.
 */
public interface RpcSocket extends AutoCloseable {

    /**
     * Blocks until data or a close arrives and copies at most {@code buffer.length} bytes of the
     * current message into {@code buffer}.
     *
     * @throws IOException when the transport fails or is already closed
     */
    SocketFrame receive(byte[] buffer) throws IOException;

    /**
     * Writes one frame. {@code type} is {@link FrameType#TEXT} or {@link FrameType#BINARY}.
     */
    void send(byte[] payload, FrameType type, boolean endOfMessage) throws IOException;

    /**
     * Starts the close handshake with the given status.
     */
    void close(CloseStatus status) throws IOException;

    boolean isOpen();

    /**
     * Releases the socket without a handshake. Idempotent.
     */
    @Override
    void close() throws IOException;
}
