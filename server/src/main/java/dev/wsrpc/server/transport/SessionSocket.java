package dev.wsrpc.server.transport;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import dev.wsrpc.transport.CloseStatus;
import dev.wsrpc.transport.FrameType;
import dev.wsrpc.transport.RpcSocket;
import dev.wsrpc.transport.SocketFrame;

/**
 * {@link RpcSocket} over a Spring {@link WebSocketSession}. Spring pushes inbound messages on
 * container threads; they are queued here and handed out to the blocking receive loop of the
 * connection in arrival order.
 */
public class SessionSocket implements RpcSocket {

	private static final Logger logger = LoggerFactory.getLogger(SessionSocket.class);

	private static final Inbound RELEASED = new Inbound(FrameType.CLOSE, new byte[0], true, null, null);

	private final WebSocketSession session;

	private final Charset charset;

	private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();

	private Inbound current;

	private int offset;

	private volatile boolean closeReceived;

	private volatile boolean released;

	/**
	 * Wrap a session whose text frames use the given encoding.
	 * @param session the underlying Spring WebSocket session
	 * @param charset encoding used to convert text frames to and from bytes
	 */
	public SessionSocket(WebSocketSession session, Charset charset) {
		this.session = Objects.requireNonNull(session, "session");
		this.charset = Objects.requireNonNull(charset, "charset");
	}

	/**
	 * Queue a (possibly partial) text message received from the peer.
	 * @param payload the text of this fragment
	 * @param last {@code true} when this fragment ends the message
	 */
	public void offerText(String payload, boolean last) {
		this.inbound.add(new Inbound(FrameType.TEXT, payload.getBytes(this.charset), last, null, null));
	}

	/**
	 * Queue a (possibly partial) binary message received from the peer.
	 * @param payload the bytes of this fragment
	 * @param last {@code true} when this fragment ends the message
	 */
	public void offerBinary(ByteBuffer payload, boolean last) {
		ByteBuffer source = payload.duplicate();
		byte[] bytes = new byte[source.remaining()];
		source.get(bytes);
		this.inbound.add(new Inbound(FrameType.BINARY, bytes, last, null, null));
	}

	/**
	 * Queue the end of the connection as reported by Spring.
	 * @param status the close status the session ended with
	 */
	public void offerClose(org.springframework.web.socket.CloseStatus status) {
		this.closeReceived = true;
		this.inbound.add(new Inbound(FrameType.CLOSE, new byte[0], true, toCloseStatus(status), null));
	}

	/**
	 * Make the next receive fail with the given transport error.
	 * @param failure the error reported by the container
	 */
	public void offerFailure(Throwable failure) {
		this.inbound.add(new Inbound(FrameType.CLOSE, new byte[0], true, null, failure));
	}

	@Override
	public SocketFrame receive(byte[] buffer) throws IOException {
		if (this.current == null) {
			try {
				this.current = this.inbound.take();
			}
			catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new IOException("Interrupted while waiting for WebSocket " + this.session.getId(), ex);
			}
			this.offset = 0;
		}
		Inbound frame = this.current;
		// a close or failure queued before the release is still handed out
		if (frame == RELEASED || (this.released && frame.type() != FrameType.CLOSE)) {
			this.current = null;
			throw new IOException("WebSocket " + this.session.getId() + " has been released");
		}
		if (frame.failure() != null) {
			this.current = null;
			throw new IOException("Transport error on WebSocket " + this.session.getId(), frame.failure());
		}
		if (frame.type() == FrameType.CLOSE) {
			this.current = null;
			return SocketFrame.close(frame.status());
		}
		int count = Math.min(buffer.length, frame.payload().length - this.offset);
		System.arraycopy(frame.payload(), this.offset, buffer, 0, count);
		this.offset += count;
		boolean drained = this.offset >= frame.payload().length;
		if (drained) {
			this.current = null;
		}
		return new SocketFrame(frame.type(), count, drained && frame.last(), null);
	}

	@Override
	public void send(byte[] payload, FrameType type, boolean endOfMessage) throws IOException {
		switch (type) {
			case TEXT -> this.session.sendMessage(new TextMessage(new String(payload, this.charset), endOfMessage));
			case BINARY -> this.session.sendMessage(new BinaryMessage(ByteBuffer.wrap(payload), endOfMessage));
			default -> throw new IllegalArgumentException("Cannot send frame of type " + type);
		}
	}

	@Override
	public void close(CloseStatus status) throws IOException {
		if (!this.session.isOpen()) {
			logger.debug("WebSocket {} already closed, not sending {}", this.session.getId(), status);
			return;
		}
		this.session.close(toSpringStatus(status));
	}

	@Override
	public boolean isOpen() {
		return !this.released && !this.closeReceived && this.session.isOpen();
	}

	@Override
	public void close() throws IOException {
		if (this.released) {
			return;
		}
		this.released = true;
		this.inbound.add(RELEASED);
		if (this.session.isOpen()) {
			this.session.close(org.springframework.web.socket.CloseStatus.NORMAL);
		}
	}

	/**
	 * Identifier of the underlying Spring session.
	 * @return the session id
	 */
	public String getId() {
		return this.session.getId();
	}

	private static org.springframework.web.socket.CloseStatus toSpringStatus(CloseStatus status) {
		if (status.reason().isEmpty()) {
			return new org.springframework.web.socket.CloseStatus(status.code());
		}
		return new org.springframework.web.socket.CloseStatus(status.code(), status.reason());
	}

	private static CloseStatus toCloseStatus(org.springframework.web.socket.CloseStatus status) {
		if (status == null || status.getCode() < 1000 || status.getCode() > 4999) {
			return null;
		}
		return new CloseStatus(status.getCode(), status.getReason());
	}

	private record Inbound(FrameType type, byte[] payload, boolean last, CloseStatus status, Throwable failure) {
	}

}
