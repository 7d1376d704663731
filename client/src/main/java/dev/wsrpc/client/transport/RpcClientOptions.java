package dev.wsrpc.client.transport;

import dev.wsrpc.transport.JacksonMessageFormatter;
import dev.wsrpc.transport.MessageFormatter;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings of an {@link RpcClient}. A {@code null} keep-alive interval disables keep-alive calls.
 */
public final class RpcClientOptions {

    public static final String DEFAULT_KEEP_ALIVE_METHOD = "Heartbeat";
    public static final Duration DEFAULT_KEEP_ALIVE_INTERVAL = Duration.ofSeconds(20);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final MessageFormatter formatter;
    private final String keepAliveMethod;
    private final Duration keepAliveInterval;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final String username;
    private final String password;

    private RpcClientOptions(Builder builder) {
        this.formatter = builder.formatter != null ? builder.formatter : new JacksonMessageFormatter();
        this.keepAliveMethod = builder.keepAliveMethod;
        this.keepAliveInterval = builder.keepAliveInterval;
        this.requestTimeout = builder.requestTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.username = builder.username;
        this.password = builder.password;
    }

    public static RpcClientOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MessageFormatter formatter() {
        return formatter;
    }

    public String keepAliveMethod() {
        return keepAliveMethod;
    }

    public Duration keepAliveInterval() {
        return keepAliveInterval;
    }

    public boolean keepAliveEnabled() {
        return keepAliveInterval != null;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public boolean hasCredentials() {
        return username != null;
    }

    public static final class Builder {

        private MessageFormatter formatter;
        private String keepAliveMethod = DEFAULT_KEEP_ALIVE_METHOD;
        private Duration keepAliveInterval = DEFAULT_KEEP_ALIVE_INTERVAL;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private String username;
        private String password;

        private Builder() {
        }

        public Builder formatter(MessageFormatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        public Builder keepAliveMethod(String keepAliveMethod) {
            this.keepAliveMethod = Objects.requireNonNull(keepAliveMethod, "keepAliveMethod");
            return this;
        }

        public Builder keepAliveInterval(Duration keepAliveInterval) {
            if (keepAliveInterval != null && (keepAliveInterval.isNegative() || keepAliveInterval.isZero())) {
                throw new IllegalArgumentException("keepAliveInterval must be positive: " + keepAliveInterval);
            }
            this.keepAliveInterval = keepAliveInterval;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = positive(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * HTTP Basic credentials sent with the handshake.
         */
        public Builder credentials(String username, String password) {
            this.username = Objects.requireNonNull(username, "username");
            this.password = Objects.requireNonNull(password, "password");
            return this;
        }

        public RpcClientOptions build() {
            return new RpcClientOptions(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
