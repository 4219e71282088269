package io.mcg.engine.config;

/** Predicates a method resolution rule can declare. */
public enum ConditionKind implements DefinitionTag {
    REQUIRES_ANY("requires_any"),
    REQUIRES_ALL("requires_all"),
    PATTERNS("patterns");

    private final String wireName;

    ConditionKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
