package io.mcg.engine.config;

public enum GeneratorKind implements DefinitionTag {
    TEMPLATE("template"),
    DATA_FILE("data_file");

    private final String wireName;

    GeneratorKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
