package io.mcg.engine.provenance;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Open payload used by Params, Results and Artifact assets.
 */
public record FreeFormPayload(AssetKind kind, Map<String, Object> fields) implements AssetPayload {
    public FreeFormPayload {
        Objects.requireNonNull(kind, "kind");
        fields = Payloads.freeze(fields);
    }

    @Override
    public List<String> validate() {
        return List.of();
    }
}
