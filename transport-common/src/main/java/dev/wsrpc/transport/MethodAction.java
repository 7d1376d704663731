package dev.wsrpc.transport;

/**
 * Void counterpart of {@link MethodInvoker}.
 */
@FunctionalInterface
public interface MethodAction<H> {

    void invoke(H handler, Object[] arguments) throws Exception;
}
