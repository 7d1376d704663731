package dev.wsrpc.server.hub;

import static dev.wsrpc.server.RecordingSession.await;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;

import dev.wsrpc.server.RecordingSession;
import dev.wsrpc.server.transport.WebSocketRpcEndpoint;
import dev.wsrpc.transport.ClientManager;
import dev.wsrpc.transport.ConnectionOptions;
import dev.wsrpc.transport.GroupManager;

class ChatHubTest {

	private ScheduledExecutorService scheduler;

	private ExecutorService executor;

	private ClientManager clients;

	private GroupManager groups;

	private WebSocketRpcEndpoint<ChatHub> endpoint;

	@BeforeEach
	void setUp() {
		this.scheduler = Executors.newSingleThreadScheduledExecutor();
		this.executor = Executors.newCachedThreadPool();
		this.clients = new ClientManager();
		this.groups = new GroupManager(this.clients);
		this.endpoint = new WebSocketRpcEndpoint<>(ChatHub::new, ConnectionOptions.defaults(), this.clients,
				this.groups, this.scheduler, this.executor);
	}

	@AfterEach
	void tearDown() {
		this.endpoint.stop();
		this.scheduler.shutdownNow();
		this.executor.shutdownNow();
	}

	@Test
	void addReturnsSum() throws Exception {
		Peer alice = connect("a");

		call(alice, "{\"method\":\"Add\",\"isReturn\":0,\"arguments\":[2,3]}");
		await(() -> !alice.recorder().texts.isEmpty());

		assertThat(alice.recorder().texts).containsExactly("{\"method\":\"Add\",\"isReturn\":1,\"arguments\":[5]}");
	}

	@Test
	void overflowRepliesWithDefaultValue() throws Exception {
		Peer alice = connect("a");

		call(alice, "{\"method\":\"Add\",\"isReturn\":0,\"arguments\":[2147483647,1]}");
		await(() -> !alice.recorder().texts.isEmpty());

		assertThat(alice.recorder().texts).containsExactly("{\"method\":\"Add\",\"isReturn\":1,\"arguments\":[0]}");
	}

	@Test
	void delayRepliesAfterTheAsyncResultCompletes() throws Exception {
		Peer alice = connect("a");

		call(alice, "{\"method\":\"Delay\",\"isReturn\":0,\"arguments\":[\"done\",20]}");
		await(() -> !alice.recorder().texts.isEmpty());

		assertThat(alice.recorder().texts).containsExactly("{\"method\":\"Delay\",\"isReturn\":1,\"arguments\":[\"done\"]}");
	}

	@Test
	void voidMethodsSendNoReply() throws Exception {
		Peer alice = connect("a");

		call(alice, "{\"method\":\"Heartbeat\",\"isReturn\":0,\"arguments\":[]}");
		call(alice, "{\"method\":\"Notify\",\"isReturn\":0,\"arguments\":[\"hello\"]}");
		call(alice, "{\"method\":\"Echo\",\"isReturn\":0,\"arguments\":[\"marker\"]}");
		await(() -> !alice.recorder().texts.isEmpty());

		assertThat(alice.recorder().texts).containsExactly("{\"method\":\"Echo\",\"isReturn\":1,\"arguments\":[\"marker\"]}");
	}

	@Test
	void groupMessagesReachMembersOnly() throws Exception {
		Peer alice = connect("a");
		Peer bob = connect("b");
		Peer carol = connect("c");

		call(alice, "{\"method\":\"JoinGroup\",\"isReturn\":0,\"arguments\":[\"room\"]}");
		await(() -> this.groups.members("room").size() == 1);
		call(bob, "{\"method\":\"JoinGroup\",\"isReturn\":0,\"arguments\":[\"room\"]}");
		await(() -> alice.recorder().texts.size() == 1);
		call(bob, "{\"method\":\"SendToGroup\",\"isReturn\":0,\"arguments\":[\"room\",\"hi all\"]}");
		await(() -> alice.recorder().texts.size() == 2 && bob.recorder().texts.size() == 1);

		String bobId = bob.id();
		assertThat(alice.recorder().texts).containsExactly(
				"{\"method\":\"Receive\",\"isReturn\":0,\"arguments\":[\"system\",\"" + bobId + " joined room\"]}",
				"{\"method\":\"Receive\",\"isReturn\":0,\"arguments\":[\"" + bobId + "\",\"hi all\"]}");
		assertThat(bob.recorder().texts).containsExactly(
				"{\"method\":\"Receive\",\"isReturn\":0,\"arguments\":[\"" + bobId + "\",\"hi all\"]}");
		assertThat(carol.recorder().texts).isEmpty();
	}

	@Test
	void broadcastSkipsTheSender() throws Exception {
		Peer alice = connect("a");
		Peer bob = connect("b");

		call(alice, "{\"method\":\"Broadcast\",\"isReturn\":0,\"arguments\":[\"news\"]}");
		await(() -> bob.recorder().texts.size() == 1);

		assertThat(bob.recorder().texts.get(0)).endsWith("\"news\"]}");
		assertThat(alice.recorder().texts).isEmpty();
	}

	@Test
	void whoamiReturnsTheConnectionId() throws Exception {
		Peer alice = connect("a");

		call(alice, "{\"method\":\"whoami\",\"isReturn\":0,\"arguments\":[]}");
		await(() -> !alice.recorder().texts.isEmpty());

		assertThat(alice.recorder().texts)
			.containsExactly("{\"method\":\"whoami\",\"isReturn\":1,\"arguments\":[\"" + alice.id() + "\"]}");
	}

	@Test
	void sendingToForeignGroupIsRejected() throws Exception {
		Peer alice = connect("a");
		Peer bob = connect("b");
		call(bob, "{\"method\":\"JoinGroup\",\"isReturn\":0,\"arguments\":[\"room\"]}");
		await(() -> this.groups.members("room").size() == 1);

		call(alice, "{\"method\":\"SendToGroup\",\"isReturn\":0,\"arguments\":[\"room\",\"sneaky\"]}");
		call(alice, "{\"method\":\"Echo\",\"isReturn\":0,\"arguments\":[\"marker\"]}");
		await(() -> !alice.recorder().texts.isEmpty());

		assertThat(bob.recorder().texts).isEmpty();
	}

	private Peer connect(String sessionId) throws Exception {
		RecordingSession recorder = new RecordingSession(sessionId);
		Set<String> before = this.clients.connectionIds();
		this.endpoint.afterConnectionEstablished(recorder.session);
		await(() -> this.clients.size() == before.size() + 1);
		Set<String> added = new HashSet<>(this.clients.connectionIds());
		added.removeAll(before);
		return new Peer(recorder, added.iterator().next());
	}

	private void call(Peer peer, String json) throws Exception {
		this.endpoint.handleMessage(peer.recorder().session, new TextMessage(json));
	}

	private record Peer(RecordingSession recorder, String id) {
	}

}
