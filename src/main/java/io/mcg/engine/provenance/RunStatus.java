package io.mcg.engine.provenance;

import java.util.Locale;

public enum RunStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return QUEUED;
        }
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
