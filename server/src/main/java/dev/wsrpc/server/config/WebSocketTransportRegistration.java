package dev.wsrpc.server.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import dev.wsrpc.server.transport.WebSocketRpcEndpoint;

/**
 * Registers the RPC endpoint with the servlet container.
 */
@Configuration
@EnableWebSocket
public class WebSocketTransportRegistration implements WebSocketConfigurer {

	private final WebSocketRpcEndpoint<?> endpoint;

	private final RpcTransportProperties transportProperties;

	public WebSocketTransportRegistration(WebSocketRpcEndpoint<?> endpoint, RpcTransportProperties transportProperties) {
		this.endpoint = endpoint;
		this.transportProperties = transportProperties;
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(this.endpoint, this.transportProperties.getEndpoint())
			.setAllowedOriginPatterns(this.transportProperties.getAllowedOrigins().toArray(String[]::new));
	}

}
