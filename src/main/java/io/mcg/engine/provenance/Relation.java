package io.mcg.engine.provenance;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of provenance facts recorded in the ledger.
 */
public enum Relation {
    USES,
    PRODUCES,
    DERIVES,
    CONFIGURES,
    LOGS;

    public static Relation fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Edge relation is required");
        }
        try {
            return Relation.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown edge relation: " + value + " (expected one of " + List.of(values()) + ")");
        }
    }
}
