package dev.wsrpc.transport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic liveness check for one connection. Any complete inbound message counts as a beat;
 * once no beat has been seen for {@code interval * tryTimes} the timeout callback runs on every
 * tick until the connection is closed.
 */
public final class HeartbeatMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final String connectionId;
    private final Duration interval;
    private final Duration tolerance;
    private final Clock clock;
    private final Runnable onTimeout;

    private volatile Instant lastActivity;
    private volatile ScheduledFuture<?> task;
    private volatile boolean closed;

    public HeartbeatMonitor(String connectionId, Duration interval, int tryTimes, Clock clock, Runnable onTimeout) {
        this.connectionId = connectionId;
        this.interval = Objects.requireNonNull(interval, "interval");
        if (tryTimes <= 0) {
            throw new IllegalArgumentException("tryTimes must be positive: " + tryTimes);
        }
        this.tolerance = interval.multipliedBy(tryTimes);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onTimeout = Objects.requireNonNull(onTimeout, "onTimeout");
        this.lastActivity = clock.instant();
    }

    public synchronized void start(ScheduledExecutorService scheduler) {
        if (closed || task != null) {
            return;
        }
        long period = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::check, period, period, TimeUnit.MILLISECONDS);
    }

    public void touch() {
        lastActivity = clock.instant();
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public Duration idleTime() {
        return Duration.between(lastActivity, clock.instant());
    }

    public boolean isExpired() {
        return idleTime().compareTo(tolerance) >= 0;
    }

    /**
     * One timer tick. Returns {@code true} when the timeout callback was fired.
     */
    public boolean check() {
        if (closed || !isExpired()) {
            return false;
        }
        LOGGER.info("Heartbeat timeout on connection {} after {} idle", connectionId, idleTime());
        try {
            onTimeout.run();
        } catch (RuntimeException e) {
            // an exception escaping a fixed-rate task would cancel it silently
            LOGGER.warn("Heartbeat timeout handling failed on connection {}", connectionId, e);
        }
        return true;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }
}
