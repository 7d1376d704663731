package dev.wsrpc.transport;

/**
 * Target of a server-initiated call: one client, a group, or every connected client.
 */
@FunctionalInterface
public interface ClientProxy {

    ClientProxy NONE = (method, arguments) -> { };

    /**
     * Pushes a request envelope for {@code method}. Delivery failures are reported to the
     * owning connection and never thrown to the caller.
     */
    void send(String method, Object... arguments);
}
