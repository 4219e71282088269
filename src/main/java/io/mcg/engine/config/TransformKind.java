package io.mcg.engine.config;

public enum TransformKind implements DefinitionTag {
    LIST_TO_STRING("list_to_string"),
    UNIT_CONVERSION("unit_conversion"),
    STEPS_CALCULATION("steps_calculation");

    private final String wireName;

    TransformKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
