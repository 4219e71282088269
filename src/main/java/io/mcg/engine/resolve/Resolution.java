package io.mcg.engine.resolve;

/**
 * Outcome of method resolution. {@code detail} names the rule or phrase that decided, when one
 * did.
 */
public record Resolution(String method, Step step, String detail) {
    public enum Step {
        EXPLICIT,
        RULE,
        UNDERSTANDING,
        FIRST_DECLARED
    }

    @Override
    public String toString() {
        return switch (step) {
            case RULE -> method + " (rule '" + detail + "')";
            case UNDERSTANDING -> method + " (phrase '" + detail + "')";
            case EXPLICIT -> method + " (explicit)";
            case FIRST_DECLARED -> method + " (first declared)";
        };
    }
}
