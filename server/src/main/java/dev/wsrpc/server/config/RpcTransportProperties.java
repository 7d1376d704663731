package dev.wsrpc.server.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.wsrpc.transport.ConnectionOptions;
import dev.wsrpc.transport.MessageFormatter;

/**
 * Configuration properties of the WebSocket RPC endpoint: where it is mapped, how inbound frames
 * are buffered and decoded, and how long idle connections and slow invocations are tolerated.
 */
@ConfigurationProperties(prefix = "wsrpc.transport")
public class RpcTransportProperties {

	/**
	 * HTTP path the WebSocket endpoint is mapped to. Defaults to {@code /rpc}.
	 */
	private String endpoint = "/rpc";

	/**
	 * Size in bytes of the per-connection receive buffer.
	 */
	private int receiveBufferSize = ConnectionOptions.DEFAULT_RECEIVE_BUFFER_SIZE;

	/**
	 * Text encoding of the frames.
	 */
	private Charset charset = StandardCharsets.UTF_8;

	/**
	 * Period of the idle check.
	 */
	private Duration heartbeatInterval = ConnectionOptions.DEFAULT_HEARTBEAT_INTERVAL;

	/**
	 * Number of silent heartbeat intervals tolerated before a connection is closed.
	 */
	private int heartbeatTryTimes = ConnectionOptions.DEFAULT_HEARTBEAT_TRY_TIMES;

	/**
	 * Upper bound for awaiting the result of an asynchronous method.
	 */
	private Duration invocationTimeout = ConnectionOptions.DEFAULT_INVOCATION_TIMEOUT;

	/**
	 * Origins accepted during the handshake.
	 */
	private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

	/**
	 * Threads of the scheduler shared by all heartbeat checks.
	 */
	private int schedulerThreads = 2;

	/**
	 * Retrieve the configured endpoint path.
	 * @return the HTTP path of the WebSocket endpoint
	 */
	public String getEndpoint() {
		return endpoint;
	}

	/**
	 * Update the endpoint path.
	 * @param endpoint the new HTTP path
	 */
	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public int getReceiveBufferSize() {
		return receiveBufferSize;
	}

	public void setReceiveBufferSize(int receiveBufferSize) {
		this.receiveBufferSize = receiveBufferSize;
	}

	public Charset getCharset() {
		return charset;
	}

	public void setCharset(Charset charset) {
		this.charset = Objects.requireNonNullElse(charset, StandardCharsets.UTF_8);
	}

	public Duration getHeartbeatInterval() {
		return heartbeatInterval;
	}

	public void setHeartbeatInterval(Duration heartbeatInterval) {
		this.heartbeatInterval = heartbeatInterval;
	}

	public int getHeartbeatTryTimes() {
		return heartbeatTryTimes;
	}

	public void setHeartbeatTryTimes(int heartbeatTryTimes) {
		this.heartbeatTryTimes = heartbeatTryTimes;
	}

	public Duration getInvocationTimeout() {
		return invocationTimeout;
	}

	public void setInvocationTimeout(Duration invocationTimeout) {
		this.invocationTimeout = invocationTimeout;
	}

	/**
	 * Retrieve the origins accepted during the WebSocket handshake.
	 * @return allowed origin patterns, {@code *} for any
	 */
	public List<String> getAllowedOrigins() {
		return allowedOrigins;
	}

	public void setAllowedOrigins(List<String> allowedOrigins) {
		this.allowedOrigins = allowedOrigins;
	}

	public int getSchedulerThreads() {
		return schedulerThreads;
	}

	public void setSchedulerThreads(int schedulerThreads) {
		this.schedulerThreads = schedulerThreads;
	}

	/**
	 * Build the per-connection configuration snapshot from these properties.
	 * @param formatter structured-data formatter shared by all connections
	 * @return validated connection options
	 * @throws IllegalArgumentException when a property is out of range
	 */
	public ConnectionOptions toConnectionOptions(MessageFormatter formatter) {
		return ConnectionOptions.builder()
			.receiveBufferSize(this.receiveBufferSize)
			.charset(this.charset)
			.formatter(formatter)
			.heartbeatInterval(this.heartbeatInterval)
			.heartbeatTryTimes(this.heartbeatTryTimes)
			.invocationTimeout(this.invocationTimeout)
			.build();
	}

}
