package io.mcg.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {
    @Test
    void bareNumbersAreSeconds() {
        assertEquals(Duration.ofSeconds(120), Durations.parse(120).get());
        assertEquals(Duration.ofMillis(1500), Durations.parse(1.5).get());
        assertEquals(Duration.ofSeconds(45), Durations.parse("45").get());
    }

    @Test
    void parsesSuffixes() {
        assertEquals(Duration.ofMillis(250), Durations.parse("250ms").get());
        assertEquals(Duration.ofSeconds(30), Durations.parse("30s").get());
        assertEquals(Duration.ofMinutes(2), Durations.parse("2m").get());
        assertEquals(Duration.ofHours(1), Durations.parse("1h").get());
        assertEquals(Duration.ofDays(1), Durations.parse("1d").get());
    }

    @Test
    void missingValuesAreEmpty() {
        assertTrue(Durations.parse(null).isEmpty());
        assertTrue(Durations.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse(-5));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("-5s"));
    }
}
