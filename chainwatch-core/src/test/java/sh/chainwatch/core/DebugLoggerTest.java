// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.chainwatch.debug");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        ChainwatchDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logRpc("nor this");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void channelsAreIndependent() {
        ChainwatchDebug.setSubscriptionLogging(true);

        DebugLogger.logRpc("rpc line");
        DebugLogger.logSubscription("watch %s", "started");

        assertEquals(1, appender.list.size());
        assertEquals("watch started", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void sanitizesEndpointCredentials() {
        ChainwatchDebug.setEnabled(true);

        DebugLogger.log("connecting to wss://mainnet.infura.io/ws/v3/0123456789abcdef0123456789abcdef");

        String message = appender.list.get(0).getFormattedMessage();
        assertFalse(message.contains("0123456789abcdef0123456789abcdef"));
        assertTrue(message.contains("[REDACTED]"));
    }
}
