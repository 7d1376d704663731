package dev.wsrpc.transport;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Turns envelopes into frame payloads and back, using the connection's text encoding and
 * structured-data formatter.
 */
public final class MessageCodec {

    private final Charset charset;
    private final MessageFormatter formatter;

    public MessageCodec(Charset charset, MessageFormatter formatter) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public static MessageCodec of(ConnectionOptions options) {
        return new MessageCodec(options.charset(), options.formatter());
    }

    public byte[] encode(InvocationEnvelope envelope) throws MessageFormatException {
        return formatter.formatMessage(envelope).getBytes(charset);
    }

    public String decodeText(byte[] payload) {
        return new String(payload, charset);
    }

    public InvocationEnvelope decode(String content) throws MessageFormatException {
        return formatter.resolveMessage(content);
    }

    public InvocationEnvelope decode(byte[] payload) throws MessageFormatException {
        return decode(decodeText(payload));
    }

    public Charset charset() {
        return charset;
    }

    public MessageFormatter formatter() {
        return formatter;
    }
}
