package dev.wsrpc.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class HeartbeatMonitorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final AtomicInteger timeouts = new AtomicInteger();

    @Test
    void closesAfterToleranceWindowWithoutTraffic() {
        HeartbeatMonitor monitor = new HeartbeatMonitor("c1", Duration.ofSeconds(1), 3, clock, timeouts::incrementAndGet);

        clock.advance(Duration.ofSeconds(1));
        assertThat(monitor.check()).isFalse();
        clock.advance(Duration.ofSeconds(1));
        assertThat(monitor.check()).isFalse();
        clock.advance(Duration.ofSeconds(1));
        assertThat(monitor.check()).isTrue();

        assertThat(timeouts).hasValue(1);
    }

    @Test
    void trafficEveryHalfIntervalKeepsConnectionAlive() {
        HeartbeatMonitor monitor = new HeartbeatMonitor("c1", Duration.ofSeconds(1), 3, clock, timeouts::incrementAndGet);

        for (int i = 0; i < 100; i++) {
            clock.advance(Duration.ofMillis(500));
            monitor.touch();
            if (i % 2 == 1) {
                assertThat(monitor.check()).isFalse();
            }
        }

        assertThat(timeouts).hasValue(0);
    }

    @Test
    void stopsFiringOnceClosed() {
        HeartbeatMonitor monitor = new HeartbeatMonitor("c1", Duration.ofSeconds(1), 1, clock, timeouts::incrementAndGet);
        clock.advance(Duration.ofSeconds(5));

        monitor.close();
        monitor.close();

        assertThat(monitor.check()).isFalse();
        assertThat(timeouts).hasValue(0);
    }

    @Test
    void callbackFailureDoesNotEscape() {
        HeartbeatMonitor monitor = new HeartbeatMonitor("c1", Duration.ofSeconds(1), 1, clock, () -> {
            throw new IllegalStateException("boom");
        });
        clock.advance(Duration.ofSeconds(1));

        assertThat(monitor.check()).isTrue();
    }

    @Test
    void scheduledChecksRunOnTheTimer() throws Exception {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        CountDownLatch fired = new CountDownLatch(1);
        try (HeartbeatMonitor monitor = new HeartbeatMonitor("c1", Duration.ofMillis(20), 2,
                java.time.Clock.systemUTC(), fired::countDown)) {
            monitor.start(scheduler);

            assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveTolerance() {
        assertThatThrownBy(() -> new HeartbeatMonitor("c1", Duration.ofSeconds(1), 0, clock, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
