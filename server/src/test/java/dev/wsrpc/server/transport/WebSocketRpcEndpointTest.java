package dev.wsrpc.server.transport;

import static dev.wsrpc.server.RecordingSession.await;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import dev.wsrpc.server.RecordingSession;
import dev.wsrpc.server.hub.ChatHub;
import dev.wsrpc.transport.ClientManager;
import dev.wsrpc.transport.ConnectionOptions;
import dev.wsrpc.transport.GroupManager;

class WebSocketRpcEndpointTest {

	private ScheduledExecutorService scheduler;

	private ExecutorService executor;

	private ClientManager clients;

	private WebSocketRpcEndpoint<ChatHub> endpoint;

	@BeforeEach
	void setUp() {
		this.scheduler = Executors.newSingleThreadScheduledExecutor();
		this.executor = Executors.newCachedThreadPool();
		this.clients = new ClientManager();
		this.endpoint = endpoint(ConnectionOptions.defaults());
	}

	@AfterEach
	void tearDown() {
		this.endpoint.stop();
		this.scheduler.shutdownNow();
		this.executor.shutdownNow();
	}

	@Test
	void servesOneHandlerPerSession() throws Exception {
		RecordingSession first = new RecordingSession("s1");
		RecordingSession second = new RecordingSession("s2");

		this.endpoint.afterConnectionEstablished(first.session);
		this.endpoint.afterConnectionEstablished(second.session);
		await(() -> this.clients.size() == 2);

		assertThat(this.endpoint.getConnectionCount()).isEqualTo(2);
	}

	@Test
	void partialMessagesAreReassembled() throws Exception {
		RecordingSession recorder = new RecordingSession("s1");
		this.endpoint.afterConnectionEstablished(recorder.session);

		this.endpoint.handleMessage(recorder.session, new TextMessage("{\"method\":\"Echo\",", false));
		this.endpoint.handleMessage(recorder.session, new TextMessage("\"isReturn\":0,\"arguments\":[\"hi\"]}", true));
		await(() -> !recorder.texts.isEmpty());

		assertThat(recorder.texts).containsExactly("{\"method\":\"Echo\",\"isReturn\":1,\"arguments\":[\"hi\"]}");
	}

	@Test
	void binaryMessagesGetNoReply() throws Exception {
		RecordingSession recorder = new RecordingSession("s1");
		this.endpoint.afterConnectionEstablished(recorder.session);

		this.endpoint.handleMessage(recorder.session, new BinaryMessage(new byte[] { 1, 2 }));
		this.endpoint.handleMessage(recorder.session,
				new TextMessage("{\"method\":\"Echo\",\"isReturn\":0,\"arguments\":[\"after\"]}"));
		await(() -> !recorder.texts.isEmpty());

		assertThat(recorder.texts).containsExactly("{\"method\":\"Echo\",\"isReturn\":1,\"arguments\":[\"after\"]}");
		assertThat(recorder.binaries).isEmpty();
	}

	@Test
	void closedSessionIsDeregistered() throws Exception {
		RecordingSession recorder = new RecordingSession("s1");
		this.endpoint.afterConnectionEstablished(recorder.session);
		await(() -> this.clients.size() == 1);

		this.endpoint.afterConnectionClosed(recorder.session, CloseStatus.NORMAL);
		await(() -> this.endpoint.getConnectionCount() == 0);

		assertThat(this.clients.size()).isZero();
	}

	@Test
	void transportErrorEndsTheConnection() throws Exception {
		RecordingSession recorder = new RecordingSession("s1");
		this.endpoint.afterConnectionEstablished(recorder.session);
		await(() -> this.clients.size() == 1);

		this.endpoint.handleTransportError(recorder.session, new IllegalStateException("reset"));
		await(() -> this.endpoint.getConnectionCount() == 0);

		assertThat(this.clients.size()).isZero();
	}

	@Test
	void idleSessionIsClosedByHeartbeat() throws Exception {
		this.endpoint = endpoint(ConnectionOptions.builder()
			.heartbeatInterval(Duration.ofMillis(30))
			.heartbeatTryTimes(2)
			.build());
		RecordingSession recorder = new RecordingSession("s1");
		this.endpoint.afterConnectionEstablished(recorder.session);

		await(() -> !recorder.closes.isEmpty());
		assertThat(recorder.closes.get(0).getCode()).isEqualTo(1000);

		this.endpoint.afterConnectionClosed(recorder.session, CloseStatus.NORMAL);
		await(() -> this.clients.size() == 0);
	}

	@Test
	void stopClosesLiveSessionsAsGoingAway() throws Exception {
		RecordingSession recorder = new RecordingSession("s1");
		this.endpoint.afterConnectionEstablished(recorder.session);
		await(() -> this.clients.size() == 1);

		this.endpoint.stop();
		await(() -> this.clients.size() == 0);

		assertThat(recorder.closes).extracting(CloseStatus::getCode).containsExactly(1001);
		assertThat(this.endpoint.isRunning()).isFalse();

		RecordingSession late = new RecordingSession("s2");
		this.endpoint.afterConnectionEstablished(late.session);
		assertThat(late.closes).containsExactly(CloseStatus.SERVICE_RESTARTED);
	}

	private WebSocketRpcEndpoint<ChatHub> endpoint(ConnectionOptions options) {
		return new WebSocketRpcEndpoint<>(ChatHub::new, options, this.clients, new GroupManager(this.clients),
				this.scheduler, this.executor);
	}

}
