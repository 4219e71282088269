package io.mcg.engine.config;

import io.mcg.engine.shared.EngineException;
import java.util.List;

/**
 * Unknown job, unknown method or malformed definition. Always carries the valid alternatives
 * when there are any, so callers can correct the request instead of guessing.
 */
public final class ConfigurationException extends EngineException {
    private final List<String> alternatives;

    public ConfigurationException(String message) {
        this(message, List.of());
    }

    public ConfigurationException(String message, List<String> alternatives) {
        super("configuration", withAlternatives(message, alternatives));
        this.alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration", message, cause);
        this.alternatives = List.of();
    }

    public List<String> alternatives() {
        return alternatives;
    }

    private static String withAlternatives(String message, List<String> alternatives) {
        if (alternatives == null || alternatives.isEmpty()) {
            return message;
        }
        return message + ". Available: " + alternatives;
    }
}
