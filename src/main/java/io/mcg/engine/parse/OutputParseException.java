package io.mcg.engine.parse;

import io.mcg.engine.shared.EngineException;
import java.util.List;

/** Raised under the {@code fail} policy when any bound output file did not parse. */
public final class OutputParseException extends EngineException {
    private final List<ParseError> errors;

    public OutputParseException(List<ParseError> errors) {
        super("parse", "Failed to parse " + errors.size() + " output file(s): " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<ParseError> errors() {
        return errors;
    }
}
