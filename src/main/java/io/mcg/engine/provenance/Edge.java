package io.mcg.engine.provenance;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable provenance fact linking two asset or run identifiers.
 */
public record Edge(String fromId, String toId, Relation relation, String timestamp) {
    public Edge {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Edge of(String fromId, String toId, Relation relation, Instant at) {
        return new Edge(fromId, toId, relation, at.toString());
    }

    public boolean touches(String id) {
        return fromId.equals(id) || toId.equals(id);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("from", fromId);
        wire.put("to", toId);
        wire.put("rel", relation.name());
        wire.put("t", timestamp);
        return wire;
    }

    public static Edge fromWire(Map<String, Object> wire) {
        Objects.requireNonNull(wire, "wire");
        for (String key : new String[] {"from", "to", "rel", "t"}) {
            if (wire.get(key) == null) {
                throw new IllegalArgumentException("Edge is missing '" + key + "': " + wire);
            }
        }
        return new Edge(
            wire.get("from").toString(),
            wire.get("to").toString(),
            Relation.fromWire(wire.get("rel").toString()),
            wire.get("t").toString()
        );
    }
}
