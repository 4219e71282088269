package io.mcg.engine.config;

public enum BuilderKind implements DefinitionTag {
    PARAMETER_TRANSFORM("parameter_transform"),
    COMPUTED_VALUE("computed_value");

    private final String wireName;

    BuilderKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
