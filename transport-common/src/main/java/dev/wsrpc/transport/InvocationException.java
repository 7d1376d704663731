package dev.wsrpc.transport;

/**
 * Failure while resolving, binding or invoking a method on behalf of a connection, or while
 * pushing a call to it.
 */
public class InvocationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String connectionId;

    public InvocationException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
