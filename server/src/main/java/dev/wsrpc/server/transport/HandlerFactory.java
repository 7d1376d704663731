package dev.wsrpc.server.transport;

import dev.wsrpc.transport.ConnectionHandler;

/**
 * Creates the handler that serves one new connection.
 * @param <H> the handler type
 */
@FunctionalInterface
public interface HandlerFactory<H extends ConnectionHandler<H>> {

	/**
	 * Create a fresh, not yet accepted handler.
	 * @return the handler for the next connection
	 */
	H create();

}
