package dev.wsrpc.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials required for the WebSocket handshake. With {@code enabled=false} the endpoint is
 * open to anonymous clients.
 */
@ConfigurationProperties("wsrpc.security")
public record RpcSecurityProperties(Boolean enabled, String username, String password) {

	public RpcSecurityProperties {
		enabled = enabled == null || enabled;
		username = username == null || username.isBlank() ? "wsrpc" : username;
		password = password == null || password.isBlank() ? "change-me" : password;
	}

	/**
	 * Whether HTTP Basic authentication is enforced on the handshake.
	 * @return {@code true} unless explicitly disabled
	 */
	public boolean isEnabled() {
		return enabled;
	}

}
