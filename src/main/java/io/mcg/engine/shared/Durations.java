package io.mcg.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses timeout values found in job definitions and settings files. Bare numbers are seconds
 * (the unit job definitions use); strings may carry a {@code ms}, {@code s}, {@code m}, {@code h}
 * or {@code d} suffix.
 */
public final class Durations {
    private Durations() {}

    public static Optional<Duration> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            return Optional.of(ofSeconds(number.doubleValue()));
        }
        String trimmed = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        long multiplier;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 1L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else if (trimmed.endsWith("d")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 86_400_000L;
        } else {
            multiplier = 1_000L;
        }
        double value;
        try {
            value = Double.parseDouble(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.round(value * multiplier)));
    }

    private static Duration ofSeconds(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1_000d));
    }
}
