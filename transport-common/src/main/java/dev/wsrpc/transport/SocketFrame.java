package dev.wsrpc.transport;

import java.util.Objects;

/**
 * Result of one {@link RpcSocket#receive} call: {@code count} bytes were copied into the caller's
 * buffer. A close frame carries the peer's {@link CloseStatus} when one was sent.
 */
public record SocketFrame(FrameType type, int count, boolean endOfMessage, CloseStatus closeStatus) {

    public SocketFrame {
        Objects.requireNonNull(type, "type");
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
    }

    public static SocketFrame text(int count, boolean endOfMessage) {
        return new SocketFrame(FrameType.TEXT, count, endOfMessage, null);
    }

    public static SocketFrame binary(int count, boolean endOfMessage) {
        return new SocketFrame(FrameType.BINARY, count, endOfMessage, null);
    }

    public static SocketFrame close(CloseStatus status) {
        return new SocketFrame(FrameType.CLOSE, 0, true, status);
    }

    public boolean isClose() {
        return type == FrameType.CLOSE;
    }
}
