package com.questrail.kernel.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Slf4jKernelObservabilitySinkTest
 * -----------------------------------------------------------------------------
 * Captures what the production sink logs, and at which level.
 */
class Slf4jKernelObservabilitySinkTest {

    private final Slf4jKernelObservabilitySink sink = new Slf4jKernelObservabilitySink();
    private Logger logger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jKernelObservabilitySink.class);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    private ILoggingEvent only() {
        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        return events.get(0);
    }

    @Test
    void allowedRequestsAreDebugAndOthersInfo() {
        sink.onContractDecision(new ContractDecisionEvent(Instant.EPOCH, "w1", "r1", "allow", List.of()));
        assertEquals(Level.DEBUG, only().getLevel());

        appender.list.clear();
        sink.onContractDecision(new ContractDecisionEvent(Instant.EPOCH, "w1", "r2", "defer", List.of("focus_lock")));
        ILoggingEvent e = only();
        assertEquals(Level.INFO, e.getLevel());
        assertTrue(e.getFormattedMessage().contains("focus_lock"));
    }

    @Test
    void degradedStoreIsAWarning() {
        sink.onStoreEvent(new StoreObservabilityEvent(Instant.EPOCH, "degraded", "durability disabled"));
        assertEquals(Level.WARN, only().getLevel());
    }

    @Test
    void errorsCarryTheirCause() {
        sink.onError(new KernelErrorEvent(Instant.EPOCH, "listener failed", new IllegalStateException("boom")));

        ILoggingEvent e = only();
        assertEquals(Level.ERROR, e.getLevel());
        assertNotNull(e.getThrowableProxy());
        assertEquals("boom", e.getThrowableProxy().getMessage());
    }

    @Test
    void compactionTransitionsAreInfo() {
        sink.onCompactionTransition(new CompactionTransitionEvent(Instant.EPOCH, "w1", "suspected", "confirmed",
                0.8, "sustained_confidence"));
        assertTrue(only().getFormattedMessage().contains("suspected -> confirmed"));
    }
}
