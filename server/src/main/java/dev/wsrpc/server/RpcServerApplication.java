package dev.wsrpc.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import dev.wsrpc.server.config.RpcTransportProperties;

/**
 * Entry point of the WebSocket RPC server.
 */
@SpringBootApplication
@EnableConfigurationProperties(RpcTransportProperties.class)
public class RpcServerApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(RpcServerApplication.class, args);
	}

}
