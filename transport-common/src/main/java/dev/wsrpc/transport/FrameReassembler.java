package dev.wsrpc.transport;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Accumulates the chunks of one logical message until the transport marks its end. Message
 * boundaries come from the transport's end-of-message flag only. Not thread-safe; owned by the
 * receive loop of a single connection.
 */
public final class FrameReassembler {

    private final ByteArrayOutputStream pending;
    private boolean complete;

    public FrameReassembler() {
        this(256);
    }

    public FrameReassembler(int initialCapacity) {
        this.pending = new ByteArrayOutputStream(initialCapacity);
    }

    public void append(byte[] chunk, int count, boolean endOfMessage) {
        Objects.requireNonNull(chunk, "chunk");
        if (count < 0 || count > chunk.length) {
            throw new IndexOutOfBoundsException("count " + count + " outside chunk of length " + chunk.length);
        }
        if (complete) {
            throw new IllegalStateException("Previous message has not been extracted");
        }
        pending.write(chunk, 0, count);
        complete = endOfMessage;
    }

    public boolean isComplete() {
        return complete;
    }

    public int size() {
        return pending.size();
    }

    /**
     * Returns the complete message and resets to empty.
     */
    public byte[] extract() {
        if (!complete) {
            throw new IllegalStateException("Message is not complete, " + pending.size() + " bytes pending");
        }
        byte[] message = pending.toByteArray();
        reset();
        return message;
    }

    public void reset() {
        pending.reset();
        complete = false;
    }
}
