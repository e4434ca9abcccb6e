package org.ftlbuffer.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.ftlbuffer.junit.extensions.logging.LogLevel.ERROR;
import static org.ftlbuffer.junit.extensions.logging.LogLevel.WARN;

/**
 * Tests the isolation between tests for LogWatchExtension.
 * <p>
 * Each test method logs different messages with different levels.
 * Events and rules of one test must not leak into the next.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionIsolationTest {

    private static final Logger logger = LoggerFactory.getLogger(LogWatchExtensionIsolationTest.class);

    /**
     * Expects an ERROR log with a specific message.
     */
    @Test
    @ExpectLog(level = ERROR,
               loggerPattern = "org.ftlbuffer.junit.extensions.logging.LogWatchExtensionIsolationTest",
               messagePattern = "Unexpected error resolving message 'a'")
    void test1_ExpectsSpecificError() {
        logger.info("Resolving message 'a'");
        logger.error("Unexpected error resolving message '{}'", "a");
    }

    /**
     * Expects a WARN log and must not see the ERROR of test1.
     */
    @Test
    @ExpectLog(level = WARN, messagePattern = "Message 'b' not found")
    void test2_ExpectsSpecificWarning() {
        logger.info("Looking up 'b'");
        logger.warn("Message '{}' not found", "b");
    }

    /**
     * Allows a WARN; an ERROR leaking from test1 would fail it.
     */
    @Test
    @AllowLog(level = WARN, messagePattern = "Syntax error in .* at line \\d+: .*")
    void test3_AllowsWarningButNotError() {
        logger.warn("Syntax error in {} at line {}: {}", "main.ftl", 3, "Expected '}'");
    }

    /**
     * Counts occurrences; counts must be reset between tests.
     */
    @Test
    @ExpectLog(level = WARN, messagePattern = "Invalid message ID: empty or null", occurrences = 3)
    void test4_ExpectsMultipleOccurrences() {
        for (int i = 0; i < 3; i++) {
            logger.warn("Invalid message ID: empty or null");
        }
    }

    /**
     * No logs at WARN or above; warnings of test4 must not leak.
     */
    @Test
    void test5_ExpectsNoWarningsOrErrors() {
        logger.info("Only info here");
        logger.debug("And debug");
    }

    @Test
    @FailOnLog(disabled = true)
    void test6_DisabledWatchIgnoresWarnings() {
        logger.warn("Not checked while the watch is disabled");
    }

    @Test
    @FailOnLog(level = ERROR)
    void test7_RaisedThresholdIgnoresWarnings() {
        logger.warn("Below the ERROR threshold");
    }
}
