package org.pxdforge.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String SAMPLE_LOGGER = "org.pxdforge.sample";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(SAMPLE_LOGGER).setLevel(null);
    }

    @Test
    void configure_appliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"" + SAMPLE_LOGGER + "\" = DEBUG } }"));

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(SAMPLE_LOGGER).getLevel());
    }

    @Test
    void configure_leavesLevelsAloneWithoutLoggingSection() {
        LoggingConfigurator.configure(ConfigFactory.parseString("other = 1"));

        assertEquals(rootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
