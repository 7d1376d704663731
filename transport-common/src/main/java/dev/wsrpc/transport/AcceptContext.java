package dev.wsrpc.transport;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Everything a {@link ConnectionHandler} needs when a socket is accepted: the socket it will own,
 * the configuration snapshot, the shared client and group registries and the scheduler that runs
 * heartbeat checks.
 */
public record AcceptContext(
    RpcSocket socket,
    ConnectionOptions options,
    ClientManager clients,
    GroupManager groups,
    ScheduledExecutorService heartbeatScheduler,
    Clock clock
) {

    public AcceptContext {
        Objects.requireNonNull(socket, "socket");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(clients, "clients");
        Objects.requireNonNull(groups, "groups");
        Objects.requireNonNull(heartbeatScheduler, "heartbeatScheduler");
        Objects.requireNonNull(clock, "clock");
    }

    public AcceptContext(RpcSocket socket, ConnectionOptions options, ClientManager clients, GroupManager groups,
            ScheduledExecutorService heartbeatScheduler) {
        this(socket, options, clients, groups, heartbeatScheduler, Clock.systemUTC());
    }
}
