package dev.wsrpc.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named groups of connections, used to route pushes. Membership is a concurrent multi-map;
 * a group disappears once its last member leaves.
 */
public final class GroupManager {

    private final ClientManager clients;
    private final ConcurrentMap<String, Set<String>> groups = new ConcurrentHashMap<>();

    public GroupManager(ClientManager clients) {
        this.clients = Objects.requireNonNull(clients, "clients");
    }

    public void add(String connectionId, String groupName) {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(groupName, "groupName");
        groups.compute(groupName, (name, members) -> {
            Set<String> updated = members != null ? members : ConcurrentHashMap.newKeySet();
            updated.add(connectionId);
            return updated;
        });
    }

    public void remove(String connectionId, String groupName) {
        if (connectionId == null || groupName == null) {
            return;
        }
        groups.computeIfPresent(groupName, (name, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    public void removeFromAll(String connectionId) {
        for (String groupName : List.copyOf(groups.keySet())) {
            remove(connectionId, groupName);
        }
    }

    public ClientProxy group(String groupName) {
        return new BroadcastProxy("group " + groupName, () -> clients.lookup(members(groupName)));
    }

    public ClientProxy groupExcept(String groupName, String... excludedIds) {
        Set<String> excluded = new HashSet<>(Arrays.asList(excludedIds));
        return new BroadcastProxy("group " + groupName + " except " + excluded, () -> {
            Set<String> members = new HashSet<>(members(groupName));
            members.removeAll(excluded);
            return clients.lookup(members);
        });
    }

    public Set<String> members(String groupName) {
        Set<String> members = groupName == null ? null : groups.get(groupName);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public Set<String> groupsOf(String connectionId) {
        List<String> names = new ArrayList<>();
        groups.forEach((name, members) -> {
            if (members.contains(connectionId)) {
                names.add(name);
            }
        });
        return Set.copyOf(names);
    }

    public Set<String> groupNames() {
        return Set.copyOf(groups.keySet());
    }
}
