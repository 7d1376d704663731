package dev.wsrpc.server;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Mocked {@link WebSocketSession} that records what the server sends and how it closes.
 */
public final class RecordingSession {

	public final WebSocketSession session = mock(WebSocketSession.class);

	public final List<String> texts = new CopyOnWriteArrayList<>();

	public final List<byte[]> binaries = new CopyOnWriteArrayList<>();

	public final List<CloseStatus> closes = new CopyOnWriteArrayList<>();

	private final AtomicBoolean open = new AtomicBoolean(true);

	public RecordingSession(String id) {
		try {
			when(this.session.getId()).thenReturn(id);
			when(this.session.isOpen()).thenAnswer(invocation -> this.open.get());
			doAnswer(invocation -> {
				WebSocketMessage<?> message = invocation.getArgument(0);
				if (message instanceof TextMessage) {
					this.texts.add(((TextMessage) message).getPayload());
				}
				else if (message instanceof BinaryMessage) {
					byte[] bytes = new byte[((BinaryMessage) message).getPayloadLength()];
					((BinaryMessage) message).getPayload().duplicate().get(bytes);
					this.binaries.add(bytes);
				}
				return null;
			}).when(this.session).sendMessage(any());
			doAnswer(invocation -> {
				this.open.set(false);
				this.closes.add(invocation.getArgument(0));
				return null;
			}).when(this.session).close(any(CloseStatus.class));
			doAnswer(invocation -> {
				this.open.set(false);
				this.closes.add(CloseStatus.NORMAL);
				return null;
			}).when(this.session).close();
		}
		catch (IOException ex) {
			throw new IllegalStateException(ex);
		}
	}

	public boolean isOpen() {
		return this.open.get();
	}

	public static void await(BooleanSupplier condition) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				throw new AssertionError("Condition not met within 5s");
			}
			Thread.sleep(5);
		}
	}

}
