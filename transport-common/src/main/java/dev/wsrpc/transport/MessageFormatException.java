package dev.wsrpc.transport;

import java.io.IOException;

/**
 * Thrown when inbound text cannot be resolved into an {@link InvocationEnvelope}.
 */
public class MessageFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String content;

    public MessageFormatException(String message, String content, Throwable cause) {
        super(message, cause);
        this.content = content;
    }

    /**
     * Raw text that failed to resolve.
     */
    public String getContent() {
        return content;
    }
}
