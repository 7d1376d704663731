package dev.wsrpc.transport;

import java.util.Collection;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends to every proxy supplied at call time, so membership changes between creating the proxy
 * and calling it are honored.
 */
final class BroadcastProxy implements ClientProxy {

    private static final Logger LOGGER = LoggerFactory.getLogger(BroadcastProxy.class);

    private final String description;
    private final Supplier<Collection<ClientProxy>> targets;

    BroadcastProxy(String description, Supplier<Collection<ClientProxy>> targets) {
        this.description = description;
        this.targets = targets;
    }

    @Override
    public void send(String method, Object... arguments) {
        Collection<ClientProxy> resolved = targets.get();
        LOGGER.debug("Pushing {} to {} ({} connection(s))", method, description, resolved.size());
        for (ClientProxy target : resolved) {
            try {
                target.send(method, arguments);
            } catch (RuntimeException e) {
                LOGGER.warn("Push of {} to a member of {} failed", method, description, e);
            }
        }
    }

    @Override
    public String toString() {
        return "BroadcastProxy[" + description + "]";
    }
}
