package dev.wsrpc.transport;

/**
 * Calls one registered method on a handler instance with already converted arguments. The result
 * may be a {@link java.util.concurrent.CompletionStage} or a Reactive Streams publisher, in which
 * case the dispatcher awaits it.
 */
@FunctionalInterface
public interface MethodInvoker<H> {

    Object invoke(H handler, Object[] arguments) throws Exception;
}
