package org.caseview.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import org.caseview.reader.SqliteCaseReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URL;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class LoggingConfigurationTest {

    private LoggerContext context;

    @BeforeEach
    void setUp() throws Exception {
        final URL config = LoggingConfigurationTest.class.getResource("/logback.xml");
        assertNotNull(config, "logback.xml must be on the classpath");
        context = new LoggerContext();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(config);
    }

    @AfterEach
    void tearDown() {
        context.stop();
    }

    @Test
    void bundledConfig_readerLogger_shouldEmitOpenSummary() {
        assertTrue(context.getLogger(SqliteCaseReader.class).isInfoEnabled());
        assertEquals(Level.INFO, context.getLogger("org.caseview").getLevel());
    }

    @Test
    void bundledConfig_thirdPartyLoggers_shouldStayAtWarn() {
        assertEquals(Level.WARN, context.getLogger("org.sqlite").getEffectiveLevel());
    }
}
