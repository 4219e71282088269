package io.mcg.engine.config;

/** Output file parsers. */
public enum ParserKind implements DefinitionTag {
    JSON("json"),
    REGEX("regex"),
    COLUMNAR("columnar"),
    CSV("csv");

    private final String wireName;

    ParserKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
