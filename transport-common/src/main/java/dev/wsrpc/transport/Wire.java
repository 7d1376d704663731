package dev.wsrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs envelope traffic in one format on the {@code WIRE} logger so that client and server logs
 * look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String connectionId, InvocationEnvelope envelope) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX conn={} method={} return={} args={}",
                connectionId,
                envelope.method(),
                envelope.isReturn(),
                truncate(String.valueOf(envelope.arguments()), 200));
        }
    }

    public static void tx(String connectionId, InvocationEnvelope envelope) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX conn={} method={} return={} args={}",
                connectionId,
                envelope.method(),
                envelope.isReturn(),
                truncate(String.valueOf(envelope.arguments()), 200));
        }
    }

    public static void binary(String connectionId, String direction, int length) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("{} conn={} binary={} bytes", direction, connectionId, length);
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
