package io.mcg.engine.config;

/** Formula library available to computed context values. */
public enum ComputationKind implements DefinitionTag {
    SCALED_STEPS("scaled_steps"),
    VECTOR_COMPONENT("vector_component");

    private final String wireName;

    ComputationKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
