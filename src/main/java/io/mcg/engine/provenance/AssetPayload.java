package io.mcg.engine.provenance;

import java.util.List;
import java.util.Map;

/**
 * Payload carried by an {@link Asset}. Variants are keyed by {@link AssetKind}: structured kinds
 * expose typed views and schema validation, free-form kinds are an open bag. Every variant keeps
 * the exact field map it was created from, which is what gets hashed and persisted.
 */
public interface AssetPayload {
    AssetKind kind();

    Map<String, Object> fields();

    /** Schema violations for this payload; empty when valid. */
    List<String> validate();

    default Object get(String key) {
        return fields().get(key);
    }
}
