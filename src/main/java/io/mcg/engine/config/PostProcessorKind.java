package io.mcg.engine.config;

public enum PostProcessorKind implements DefinitionTag {
    ARRAY_INDEXING("array_indexing");

    private final String wireName;

    PostProcessorKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
