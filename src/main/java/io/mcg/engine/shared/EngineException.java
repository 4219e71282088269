package io.mcg.engine.shared;

/**
 * Base type for every failure the engine surfaces to callers. The {@code code} is stable and
 * suitable for machine handling; the message is for humans.
 */
public class EngineException extends RuntimeException {
    private final String code;

    public EngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public EngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
