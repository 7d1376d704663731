package dev.wsrpc.server.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.wsrpc.server.hub.ChatHub;
import dev.wsrpc.server.transport.HandlerFactory;
import dev.wsrpc.server.transport.WebSocketRpcEndpoint;
import dev.wsrpc.transport.ClientManager;
import dev.wsrpc.transport.ConnectionOptions;
import dev.wsrpc.transport.GroupManager;
import dev.wsrpc.transport.JacksonMessageFormatter;
import dev.wsrpc.transport.MessageFormatter;

/**
 * Wires the RPC engine: shared registries, the heartbeat scheduler, the executor running the
 * receive loops and the endpoint serving {@link ChatHub} connections.
 */
@Configuration
public class RpcServerConfig {

	@Bean
	public MessageFormatter rpcMessageFormatter() {
		return new JacksonMessageFormatter();
	}

	@Bean
	public ConnectionOptions connectionOptions(RpcTransportProperties transportProperties,
			MessageFormatter rpcMessageFormatter) {
		return transportProperties.toConnectionOptions(rpcMessageFormatter);
	}

	@Bean
	public ClientManager clientManager() {
		return new ClientManager();
	}

	@Bean
	public GroupManager groupManager(ClientManager clientManager) {
		return new GroupManager(clientManager);
	}

	@Bean(destroyMethod = "shutdownNow")
	public ScheduledExecutorService heartbeatScheduler(RpcTransportProperties transportProperties) {
		return Executors.newScheduledThreadPool(transportProperties.getSchedulerThreads(),
				daemonThreads("wsrpc-heartbeat-"));
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService connectionExecutor() {
		return Executors.newCachedThreadPool(daemonThreads("wsrpc-connection-"));
	}

	@Bean
	public HandlerFactory<ChatHub> chatHubFactory() {
		return ChatHub::new;
	}

	@Bean
	public WebSocketRpcEndpoint<ChatHub> rpcEndpoint(HandlerFactory<ChatHub> chatHubFactory,
			ConnectionOptions connectionOptions, ClientManager clientManager, GroupManager groupManager,
			ScheduledExecutorService heartbeatScheduler, ExecutorService connectionExecutor) {
		return new WebSocketRpcEndpoint<>(chatHubFactory, connectionOptions, clientManager, groupManager,
				heartbeatScheduler, connectionExecutor);
	}

	private static ThreadFactory daemonThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
