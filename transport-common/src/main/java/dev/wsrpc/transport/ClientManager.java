package dev.wsrpc.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live connections of one endpoint, keyed by connection id. Shared by all connections of that
 * endpoint and safe for concurrent use.
 */
public final class ClientManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientManager.class);

    private final ConcurrentMap<String, ClientProxy> clients = new ConcurrentHashMap<>();

    public void add(String connectionId, ClientProxy client) {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(client, "client");
        clients.put(connectionId, client);
    }

    public boolean remove(String connectionId) {
        return connectionId != null && clients.remove(connectionId) != null;
    }

    public boolean contains(String connectionId) {
        return connectionId != null && clients.containsKey(connectionId);
    }

    /**
     * Proxy of a single connection; unknown ids yield a proxy that drops every call.
     */
    public ClientProxy client(String connectionId) {
        ClientProxy client = connectionId == null ? null : clients.get(connectionId);
        if (client == null) {
            LOGGER.debug("No live connection {}, push will be dropped", connectionId);
            return ClientProxy.NONE;
        }
        return client;
    }

    public ClientProxy clients(Collection<String> connectionIds) {
        List<String> ids = List.copyOf(connectionIds);
        return new BroadcastProxy("clients " + ids, () -> lookup(ids));
    }

    public ClientProxy all() {
        return new BroadcastProxy("all clients", () -> new ArrayList<>(clients.values()));
    }

    public ClientProxy allExcept(String... excludedIds) {
        Set<String> excluded = new HashSet<>(Arrays.asList(excludedIds));
        return new BroadcastProxy("all clients except " + excluded, () -> {
            List<ClientProxy> targets = new ArrayList<>();
            clients.forEach((id, client) -> {
                if (!excluded.contains(id)) {
                    targets.add(client);
                }
            });
            return targets;
        });
    }

    public Set<String> connectionIds() {
        return Set.copyOf(clients.keySet());
    }

    public int size() {
        return clients.size();
    }

    List<ClientProxy> lookup(Collection<String> connectionIds) {
        List<ClientProxy> targets = new ArrayList<>(connectionIds.size());
        for (String id : connectionIds) {
            ClientProxy client = clients.get(id);
            if (client != null) {
                targets.add(client);
            }
        }
        return targets;
    }
}
