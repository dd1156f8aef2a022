package com.sievesql.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all tests: logs the start and end of every test and
 * offers step logging helpers.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String currentTest;
    private long startNanos;

    @BeforeEach
    void logTestStart(TestInfo info) {
        currentTest = info.getDisplayName();
        startNanos = System.nanoTime();
        logger.info("Starting test: {}", currentTest);
    }

    @AfterEach
    void logTestEnd() {
        logger.info("Finished test: {} ({} ms)", currentTest, (System.nanoTime() - startNanos) / 1_000_000);
    }

    /**
     * Logs a step of the test (Given/When/Then).
     */
    protected void logStep(String step) {
        logger.info("  {}", step);
    }

    /**
     * Logs a labeled value produced by the test.
     */
    protected void logData(String label, Object value) {
        logger.info("  {}: {}", label, value);
    }
}
