package com.chaineditor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppLoggerTest {

    @Test
    void uninitializedLoggerIsConsoleOnlyAtInfo() {
        AppLogger logger = AppLogger.get();

        assertNotNull(logger);
        assertSame(logger, AppLogger.get());
        assertFalse(logger.isEnabled(AppLogger.Level.DEBUG));
        assertTrue(logger.isEnabled(AppLogger.Level.INFO));
        assertTrue(logger.isEnabled(AppLogger.Level.ERROR));
    }

    @Test
    void loggingWithoutFileDoesNotThrow() {
        AppLogger logger = AppLogger.get();
        assertDoesNotThrow(() -> {
            logger.debug("hidden");
            logger.warn("visible");
            logger.error("failed", new IllegalStateException("boom"));
            logger.console("banner");
        });
    }
}
