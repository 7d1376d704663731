package dev.wsrpc.server.transport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import dev.wsrpc.transport.AcceptContext;
import dev.wsrpc.transport.ClientManager;
import dev.wsrpc.transport.ConnectionHandler;
import dev.wsrpc.transport.ConnectionOptions;
import dev.wsrpc.transport.GroupManager;

/**
 * Spring {@link org.springframework.web.socket.WebSocketHandler} that hosts one
 * {@link ConnectionHandler} per WebSocket session. Each connection runs its receive loop on a
 * worker thread of the connection executor; Spring callbacks only feed the connection's
 * {@link SessionSocket}. Stopping the endpoint closes every live connection before the web server
 * goes down.
 * @param <H> the handler type served on this endpoint
 */
public class WebSocketRpcEndpoint<H extends ConnectionHandler<H>> extends AbstractWebSocketHandler
		implements SmartLifecycle {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketRpcEndpoint.class);

	private final HandlerFactory<H> handlerFactory;

	private final ConnectionOptions options;

	private final ClientManager clients;

	private final GroupManager groups;

	private final ScheduledExecutorService heartbeatScheduler;

	private final ExecutorService connectionExecutor;

	private final ConcurrentHashMap<String, ActiveConnection<H>> connections = new ConcurrentHashMap<>();

	private volatile boolean running = true;

	/**
	 * Create an endpoint serving handlers produced by {@code handlerFactory}.
	 * @param handlerFactory creates one handler per accepted session
	 * @param options per-connection configuration snapshot
	 * @param clients registry of live connections shared with the handlers
	 * @param groups group registry shared with the handlers
	 * @param heartbeatScheduler scheduler running the heartbeat checks
	 * @param connectionExecutor executor running one receive loop per connection
	 */
	public WebSocketRpcEndpoint(HandlerFactory<H> handlerFactory, ConnectionOptions options, ClientManager clients,
			GroupManager groups, ScheduledExecutorService heartbeatScheduler, ExecutorService connectionExecutor) {
		this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory");
		this.options = Objects.requireNonNull(options, "options");
		this.clients = Objects.requireNonNull(clients, "clients");
		this.groups = Objects.requireNonNull(groups, "groups");
		this.heartbeatScheduler = Objects.requireNonNull(heartbeatScheduler, "heartbeatScheduler");
		this.connectionExecutor = Objects.requireNonNull(connectionExecutor, "connectionExecutor");
		logger.info("Initialized WebSocket RPC endpoint with {}", options);
	}

	@Override
	public boolean supportsPartialMessages() {
		return true;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession session) throws IOException {
		logger.info("WebSocket connection established: {}", session.getId());
		if (!this.running) {
			session.close(CloseStatus.SERVICE_RESTARTED);
			return;
		}
		SessionSocket socket = new SessionSocket(session, this.options.charset());
		H handler = this.handlerFactory.create();
		ActiveConnection<H> connection = new ActiveConnection<>(socket, handler);
		this.connections.put(session.getId(), connection);
		AcceptContext context = new AcceptContext(socket, this.options, this.clients, this.groups,
				this.heartbeatScheduler);
		try {
			this.connectionExecutor.execute(() -> serve(session.getId(), handler, context));
		}
		catch (RejectedExecutionException ex) {
			logger.warn("Connection executor rejected WebSocket {}", session.getId(), ex);
			this.connections.remove(session.getId());
			session.close(CloseStatus.SERVICE_OVERLOAD);
		}
	}

	private void serve(String sessionId, H handler, AcceptContext context) {
		try {
			ConnectionHandler.accept(handler, context);
		}
		finally {
			this.connections.remove(sessionId);
		}
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		ActiveConnection<H> connection = this.connections.get(session.getId());
		if (connection == null) {
			logger.warn("Text message on unknown WebSocket {}", session.getId());
			return;
		}
		connection.socket().offerText(message.getPayload(), message.isLast());
	}

	@Override
	protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
		ActiveConnection<H> connection = this.connections.get(session.getId());
		if (connection == null) {
			logger.warn("Binary message on unknown WebSocket {}", session.getId());
			return;
		}
		connection.socket().offerBinary(message.getPayload(), message.isLast());
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", session.getId(), exception);
		ActiveConnection<H> connection = this.connections.get(session.getId());
		if (connection != null) {
			connection.socket().offerFailure(exception);
		}
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", session.getId(), status);
		ActiveConnection<H> connection = this.connections.get(session.getId());
		if (connection != null) {
			connection.socket().offerClose(status);
		}
	}

	/**
	 * Number of connections currently being served.
	 * @return live connection count
	 */
	public int getConnectionCount() {
		return this.connections.size();
	}

	@Override
	public void start() {
		this.running = true;
	}

	@Override
	public boolean isRunning() {
		return this.running;
	}

	/**
	 * Close every live connection with {@code 1001 going away} and stop accepting new ones.
	 */
	@Override
	public void stop() {
		this.running = false;
		logger.info("Closing WebSocket RPC endpoint ({} live connections)", this.connections.size());
		for (ActiveConnection<H> connection : new ArrayList<>(this.connections.values())) {
			try {
				connection.socket().close(dev.wsrpc.transport.CloseStatus.GOING_AWAY);
			}
			catch (IOException ex) {
				logger.warn("Failed to close WebSocket {}", connection.socket().getId(), ex);
			}
			finally {
				connection.handler().close();
			}
		}
	}

	private record ActiveConnection<H extends ConnectionHandler<H>>(SessionSocket socket, H handler) {
	}

}
