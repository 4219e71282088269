package io.mcg.engine.provenance;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The closed set of asset kinds. Each kind owns its id prefix and knows which payload variant
 * represents it.
 */
public enum AssetKind {
    SYSTEM("System", "S"),
    METHOD("Method", "M"),
    PARAMS("Params", "P"),
    RESULTS("Results", "R"),
    ARTIFACT("Artifact", "A");

    private final String wireName;
    private final String prefix;

    AssetKind(String wireName, String prefix) {
        this.wireName = wireName;
        this.prefix = prefix;
    }

    public String wireName() {
        return wireName;
    }

    public String prefix() {
        return prefix;
    }

    /** Context key under which payloads of this kind are exposed to templates. */
    public String contextKey() {
        return wireName.toLowerCase(Locale.ROOT);
    }

    public AssetPayload payload(Map<String, Object> fields) {
        return switch (this) {
            case SYSTEM -> new StructurePayload(fields);
            case METHOD -> new MethodPayload(fields);
            default -> new FreeFormPayload(this, fields);
        };
    }

    public static AssetKind fromWire(String value) {
        if (value != null) {
            for (AssetKind kind : values()) {
                if (kind.wireName.equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown asset kind: " + value + " (expected one of " + wireNames() + ")");
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(AssetKind::wireName).collect(Collectors.toList());
    }
}
