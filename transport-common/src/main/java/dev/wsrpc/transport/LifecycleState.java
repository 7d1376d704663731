package dev.wsrpc.transport;

public enum LifecycleState {
    /** Accepted and receiving. */
    OPEN,
    /** Close handshake in flight or heartbeat timeout detected. */
    CLOSING,
    /** Socket released, registry entry removed, disconnect notification fired. */
    CLOSED
}
