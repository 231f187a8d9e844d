package dev.melt.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeFormatTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private static Instant ago(Duration d) {
        return NOW.minus(d);
    }

    @Test
    void relativeUsesLargestUnit() {
        assertEquals("just now", TimeFormat.relative(ago(Duration.ofSeconds(30)), NOW));
        assertEquals("1 min ago", TimeFormat.relative(ago(Duration.ofSeconds(90)), NOW));
        assertEquals("5 hours ago", TimeFormat.relative(ago(Duration.ofHours(5)), NOW));
        assertEquals("1 day ago", TimeFormat.relative(ago(Duration.ofHours(30)), NOW));
        assertEquals("2 weeks ago", TimeFormat.relative(ago(Duration.ofDays(15)), NOW));
        assertEquals("3 months ago", TimeFormat.relative(ago(Duration.ofDays(95)), NOW));
        assertEquals("2 years ago", TimeFormat.relative(ago(Duration.ofDays(800)), NOW));
        assertEquals("just now", TimeFormat.relative(NOW.plusSeconds(600), NOW));
    }

    @Test
    void relativeFromEpochSeconds() {
        assertEquals("1 hour ago", TimeFormat.relative(NOW.getEpochSecond() - 3600, NOW));
    }

    @Test
    void shortForm() {
        assertEquals("now", TimeFormat.relativeShort(ago(Duration.ofSeconds(5)), NOW));
        assertEquals("15m ago", TimeFormat.relativeShort(ago(Duration.ofMinutes(15)), NOW));
        assertEquals("2h ago", TimeFormat.relativeShort(ago(Duration.ofHours(2)), NOW));
        assertEquals("3d ago", TimeFormat.relativeShort(ago(Duration.ofDays(3)), NOW));
        assertEquals("2w ago", TimeFormat.relativeShort(ago(Duration.ofDays(14)), NOW));
        var old = TimeFormat.relativeShort(ago(Duration.ofDays(120)), NOW);
        assertTrue(old.matches("[A-Z][a-z]{2} \\d{2}"), old);
    }
}
