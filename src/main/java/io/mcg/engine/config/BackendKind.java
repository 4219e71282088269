package io.mcg.engine.config;

/** Launch mechanisms, in the order they are preferred when a definition does not pick one. */
public enum BackendKind implements DefinitionTag {
    LOCAL("local"),
    DOCKER("docker"),
    HPC("hpc");

    private final String wireName;

    BackendKind(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
