package org.ember.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contains unit tests for the {@link LoggingConfigurator}.
 */
public class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.ember.script.runtime").setLevel(null);
        context.getLogger("org.ember.script.frontend").setLevel(null);
        LoggingConfigurator.reset();
    }

    /**
     * Verifies that the root level and a per-logger level are both applied.
     */
    @Test
    @Tag("unit")
    void testSetsDefaultAndSpecificLevels() {
        // Arrange
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.ember.script.runtime" = "DEBUG"
              }
            }
            """);

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.ember.script.runtime").getLevel());
    }

    /**
     * Verifies that only the first call takes effect.
     */
    @Test
    @Tag("unit")
    void testConfigureIsIdempotent() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"TRACE\""));

        // Assert
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    @Tag("unit")
    void testUnknownLevelIsIgnored() {
        // Arrange
        final Config config = ConfigFactory.parseString("""
            logging.levels {
              "org.ember.script.frontend" = "LOUD"
            }
            """);

        // Act & Assert
        assertDoesNotThrow(() -> LoggingConfigurator.configure(config));
        assertNull(context.getLogger("org.ember.script.frontend").getLevel());
    }

    @Test
    @Tag("unit")
    void testMissingLoggingSectionKeepsDefaults() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Assert
        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
