package com.docgraph.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LogSetupTest {

    @Test
    void levelOf_acceptsSlf4jAndJulNames() {
        assertThat(LogSetup.levelOf("debug")).isEqualTo(Level.FINE);
        assertThat(LogSetup.levelOf("WARN")).isEqualTo(Level.WARNING);
        assertThat(LogSetup.levelOf("SEVERE")).isEqualTo(Level.SEVERE);
        assertThat(LogSetup.levelOf("nonsense")).isEqualTo(Level.INFO);
        assertThat(LogSetup.levelOf(null)).isEqualTo(Level.INFO);
    }

    @Test
    void filters_splitEventsFromHumanLines() {
        LogRecord event = new LogRecord(Level.INFO, "{\"ts\":\"2026-01-01T00:00:00Z\",\"event\":\"crawl-start\"}");
        LogRecord human = new LogRecord(Level.INFO, "Crawl start: framework=x");

        assertThat(LogSetup.EVENTS_ONLY.isLoggable(event)).isTrue();
        assertThat(LogSetup.EVENTS_ONLY.isLoggable(human)).isFalse();
        assertThat(LogSetup.HUMAN_ONLY.isLoggable(human)).isTrue();
        assertThat(LogSetup.HUMAN_ONLY.isLoggable(event)).isFalse();
    }

    @Test
    void lineFormatter_shortLoggerNameAndStack() {
        LogRecord r = new LogRecord(Level.WARNING, "Page failed: {0}");
        r.setParameters(new Object[]{"https://ex.com/x"});
        r.setLoggerName("com.docgraph.core.crawler.TraversalEngine");
        r.setThrown(new IllegalStateException("boom"));

        String s = new LogSetup.LineFormatter().format(r);
        assertThat(s).contains("WARNING", "TraversalEngine - Page failed: https://ex.com/x",
                "java.lang.IllegalStateException: boom");
        assertThat(s).doesNotContain("com.docgraph.core.crawler.TraversalEngine -");
    }
}
