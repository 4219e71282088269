package io.mcg.engine.provenance;

import io.mcg.engine.shared.EngineException;

/**
 * Raised when the ledger cannot be read or durably written. The store state visible to readers
 * is unchanged when this is thrown from a mutation.
 */
public final class LedgerException extends EngineException {
    public LedgerException(String message) {
        super("ledger", message, null);
    }

    public LedgerException(String message, Throwable cause) {
        super("ledger", message, cause);
    }
}
