package dev.wsrpc.transport;

import java.lang.reflect.Type;

/**
 * Structured-data format used to put {@link InvocationEnvelope}s on the wire.
 */
public interface MessageFormatter {

    String formatMessage(InvocationEnvelope envelope) throws MessageFormatException;

    InvocationEnvelope resolveMessage(String content) throws MessageFormatException;

    /**
     * Converts a decoded, loosely typed argument to the declared parameter type. Implementations
     * never throw; a failed conversion is reported through {@link ArgumentConversion#failure}.
     */
    ArgumentConversion convertArgument(Object value, Type targetType);
}
