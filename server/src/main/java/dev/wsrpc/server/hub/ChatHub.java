package dev.wsrpc.server.hub;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.wsrpc.transport.ConnectionHandler;
import dev.wsrpc.transport.InvocationEnvelope;
import dev.wsrpc.transport.InvocationException;
import dev.wsrpc.transport.MethodTable;
import reactor.core.publisher.Mono;

/**
 * Demo hub exposed by the server: request/response helpers plus group chat. Every push to a
 * client is a call of its {@value #RECEIVE} method with the sender id and the text.
 */
public class ChatHub extends ConnectionHandler<ChatHub> {

	private static final Logger logger = LoggerFactory.getLogger(ChatHub.class);

	/**
	 * Client-side method that receives chat pushes.
	 */
	public static final String RECEIVE = "Receive";

	/**
	 * Sender id used for messages generated by the server itself.
	 */
	public static final String SYSTEM = "system";

	static final MethodTable<ChatHub> METHODS = MethodTable.builder(ChatHub.class)
		.returning("Echo", String.class, (hub, args) -> hub.echo((String) args[0]), String.class)
		.returning("Add", int.class, (hub, args) -> hub.add((Integer) args[0], (Integer) args[1]), int.class,
				int.class)
		.returning("Whoami", String.class, (hub, args) -> hub.getConnectionId())
		.returning("Delay", String.class, (hub, args) -> hub.delay((String) args[0], (Long) args[1]), String.class,
				long.class)
		.action("Notify", (hub, args) -> hub.notify((String) args[0]), String.class)
		.action("Heartbeat", (hub, args) -> {
		})
		.action("JoinGroup", (hub, args) -> hub.joinGroup((String) args[0]), String.class)
		.action("LeaveGroup", (hub, args) -> hub.leaveGroup((String) args[0]), String.class)
		.action("SendToGroup", (hub, args) -> hub.sendToGroup((String) args[0], (String) args[1]), String.class,
				String.class)
		.action("Broadcast", (hub, args) -> hub.broadcast((String) args[0]), String.class)
		.build();

	public ChatHub() {
		super(METHODS);
	}

	String echo(String value) {
		return value;
	}

	int add(int left, int right) {
		return Math.addExact(left, right);
	}

	Mono<String> delay(String value, long millis) {
		if (millis < 0) {
			throw new IllegalArgumentException("delay must not be negative: " + millis);
		}
		return Mono.delay(Duration.ofMillis(millis)).thenReturn(value);
	}

	void notify(String message) {
		logger.info("Notification from {}: {}", getConnectionId(), message);
	}

	void joinGroup(String group) {
		groups().add(getConnectionId(), group);
		groups().groupExcept(group, getConnectionId()).send(RECEIVE, SYSTEM, getConnectionId() + " joined " + group);
	}

	void leaveGroup(String group) {
		groups().remove(getConnectionId(), group);
		groups().group(group).send(RECEIVE, SYSTEM, getConnectionId() + " left " + group);
	}

	void sendToGroup(String group, String message) {
		if (!groups().members(group).contains(getConnectionId())) {
			throw new IllegalStateException(getConnectionId() + " is not a member of " + group);
		}
		groups().group(group).send(RECEIVE, getConnectionId(), message);
	}

	void broadcast(String message) {
		clients().allExcept(getConnectionId()).send(RECEIVE, getConnectionId(), message);
	}

	@Override
	protected void onConnected() {
		logger.info("Chat client {} connected ({} online)", getConnectionId(), clients().size());
	}

	@Override
	protected void onDisconnected() {
		logger.info("Chat client {} disconnected", getConnectionId());
	}

	@Override
	protected void onResolveError(String content, Exception exception) {
		logger.debug("Ignoring unreadable message from {}", getConnectionId());
	}

	@Override
	protected void onInvokeError(InvocationEnvelope message, InvocationException exception) {
		logger.debug("Call of {} on {} failed: {}", message.method(), getConnectionId(), exception.getMessage());
	}

}
