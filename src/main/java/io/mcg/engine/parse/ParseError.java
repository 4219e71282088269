package io.mcg.engine.parse;

/** Why one output file could not be parsed. */
public record ParseError(String file, String parser, String message) {
    @Override
    public String toString() {
        return file + " [" + parser + "]: " + message;
    }
}
