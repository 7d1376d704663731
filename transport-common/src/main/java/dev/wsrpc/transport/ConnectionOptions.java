package dev.wsrpc.transport;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-connection configuration snapshot, supplied at accept time.
 */
public final class ConnectionOptions {

    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 4 * 1024;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_HEARTBEAT_TRY_TIMES = 3;
    public static final Duration DEFAULT_INVOCATION_TIMEOUT = Duration.ofSeconds(30);

    private final int receiveBufferSize;
    private final Charset charset;
    private final MessageFormatter formatter;
    private final Duration heartbeatInterval;
    private final int heartbeatTryTimes;
    private final Duration invocationTimeout;

    private ConnectionOptions(Builder builder) {
        this.receiveBufferSize = builder.receiveBufferSize;
        this.charset = builder.charset;
        this.formatter = builder.formatter != null ? builder.formatter : new JacksonMessageFormatter();
        this.heartbeatInterval = builder.heartbeatInterval;
        this.heartbeatTryTimes = builder.heartbeatTryTimes;
        this.invocationTimeout = builder.invocationTimeout;
    }

    public static ConnectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int receiveBufferSize() {
        return receiveBufferSize;
    }

    public Charset charset() {
        return charset;
    }

    public MessageFormatter formatter() {
        return formatter;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Number of consecutive heartbeat intervals without inbound traffic tolerated before the
     * connection is closed.
     */
    public int heartbeatTryTimes() {
        return heartbeatTryTimes;
    }

    public Duration invocationTimeout() {
        return invocationTimeout;
    }

    @Override
    public String toString() {
        return "ConnectionOptions{receiveBufferSize=" + receiveBufferSize
            + ", charset=" + charset
            + ", formatter=" + formatter.getClass().getSimpleName()
            + ", heartbeatInterval=" + heartbeatInterval
            + ", heartbeatTryTimes=" + heartbeatTryTimes
            + ", invocationTimeout=" + invocationTimeout + '}';
    }

    public static final class Builder {

        private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;
        private Charset charset = StandardCharsets.UTF_8;
        private MessageFormatter formatter;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private int heartbeatTryTimes = DEFAULT_HEARTBEAT_TRY_TIMES;
        private Duration invocationTimeout = DEFAULT_INVOCATION_TIMEOUT;

        private Builder() {
        }

        public Builder receiveBufferSize(int receiveBufferSize) {
            if (receiveBufferSize <= 0) {
                throw new IllegalArgumentException("receiveBufferSize must be positive: " + receiveBufferSize);
            }
            this.receiveBufferSize = receiveBufferSize;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder formatter(MessageFormatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
            if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
                throw new IllegalArgumentException("heartbeatInterval must be positive: " + heartbeatInterval);
            }
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder heartbeatTryTimes(int heartbeatTryTimes) {
            if (heartbeatTryTimes <= 0) {
                throw new IllegalArgumentException("heartbeatTryTimes must be positive: " + heartbeatTryTimes);
            }
            this.heartbeatTryTimes = heartbeatTryTimes;
            return this;
        }

        public Builder invocationTimeout(Duration invocationTimeout) {
            Objects.requireNonNull(invocationTimeout, "invocationTimeout");
            if (invocationTimeout.isNegative() || invocationTimeout.isZero()) {
                throw new IllegalArgumentException("invocationTimeout must be positive: " + invocationTimeout);
            }
            this.invocationTimeout = invocationTimeout;
            return this;
        }

        public ConnectionOptions build() {
            return new ConnectionOptions(this);
        }
    }
}
