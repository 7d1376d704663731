package dev.wsrpc.server.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Basic HTTP authentication on the WebSocket handshake.
 */
@Configuration
@EnableConfigurationProperties(RpcSecurityProperties.class)
public class SecurityConfig {

	private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

	@Bean
	public UserDetailsService userDetailsService(RpcSecurityProperties securityProperties) {
		UserDetails user = User.withUsername(securityProperties.username())
			.password("{noop}" + securityProperties.password())
			.roles("RPC_CLIENT")
			.build();
		return new InMemoryUserDetailsManager(user);
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http, RpcSecurityProperties securityProperties)
			throws Exception {
		http.csrf(AbstractHttpConfigurer::disable);
		if (securityProperties.isEnabled()) {
			http.authorizeHttpRequests(registry -> registry.anyRequest().authenticated());
			http.httpBasic(Customizer.withDefaults());
		}
		else {
			logger.warn("Handshake authentication is disabled, the RPC endpoint accepts anonymous clients");
			http.authorizeHttpRequests(registry -> registry.anyRequest().permitAll());
		}
		return http.build();
	}

}
