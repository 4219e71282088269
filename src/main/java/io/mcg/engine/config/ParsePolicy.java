package io.mcg.engine.config;

/** What to do with an output file that fails to parse: skip it, or fail the run. */
public enum ParsePolicy implements DefinitionTag {
    IGNORE("ignore"),
    FAIL("fail");

    private final String wireName;

    ParsePolicy(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
