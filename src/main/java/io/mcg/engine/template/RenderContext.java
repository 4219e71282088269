package io.mcg.engine.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Read-only value map templates are rendered against. */
public final class RenderContext {
    private final Map<String, Object> values;

    public RenderContext(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Resolves {@code a.b.c} by walking nested maps. A key that literally contains dots wins over
     * the nested walk.
     */
    public Optional<Object> lookup(String path) {
        if (values.containsKey(path)) {
            return Optional.ofNullable(values.get(path));
        }
        String[] segments = path.split("\\.");
        Object current = values;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    public boolean resolves(String path) {
        if (values.containsKey(path)) {
            return true;
        }
        Object current = values;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return false;
            }
            current = map.get(segment);
        }
        return true;
    }
}
