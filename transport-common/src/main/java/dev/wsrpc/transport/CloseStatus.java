package dev.wsrpc.transport;

/**
 * WebSocket close code and reason (RFC 6455 section 7.4).
 */
public record CloseStatus(int code, String reason) {

    public static final CloseStatus NORMAL = new CloseStatus(1000, "");
    public static final CloseStatus GOING_AWAY = new CloseStatus(1001, "going away");
    public static final CloseStatus SERVER_ERROR = new CloseStatus(1011, "");

    public CloseStatus {
        if (code < 1000 || code > 4999) {
            throw new IllegalArgumentException("Invalid close code: " + code);
        }
        reason = reason == null ? "" : reason;
    }
}
