package dev.wsrpc.transport;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class WireTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("WIRE");
    private final ListAppender<ILoggingEvent> events = new ListAppender<>();
    private Level previous;

    @BeforeEach
    void setUp() {
        previous = logger.getLevel();
        logger.setLevel(Level.INFO);
        events.start();
        logger.addAppender(events);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(events);
        logger.setLevel(previous);
    }

    @Test
    void trafficIsLoggedAtInfo() {
        Wire.rx("c1", InvocationEnvelope.request("Echo", "hi"));
        Wire.tx("c1", InvocationEnvelope.response("Echo", "hi"));
        Wire.binary("c1", "RX", 3);

        assertThat(events.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly(
            "RX conn=c1 method=Echo return=0 args=[hi]",
            "TX conn=c1 method=Echo return=1 args=[hi]",
            "RX conn=c1 binary=3 bytes");
        assertThat(events.list).allMatch(event -> event.getLevel() == Level.INFO);
    }

    @Test
    void longArgumentsAreTruncated() {
        Wire.rx("c1", InvocationEnvelope.request("Echo", "x".repeat(300)));

        assertThat(events.list.get(0).getFormattedMessage()).endsWith("...").hasSizeLessThan(260);
    }

    @Test
    void truncateKeepsShortValues() {
        assertThat(Wire.truncate("abc", 200)).isEqualTo("abc");
        assertThat(Wire.truncate(null, 200)).isNull();
        assertThat(Wire.truncate("abcdef", 3)).isEqualTo("abc...");
    }
}
