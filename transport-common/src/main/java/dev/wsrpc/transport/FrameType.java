package dev.wsrpc.transport;

public enum FrameType {
    TEXT,
    BINARY,
    CLOSE
}
