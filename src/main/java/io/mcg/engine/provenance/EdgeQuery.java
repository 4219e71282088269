package io.mcg.engine.provenance;

import java.util.Optional;

/**
 * Ledger filter. Absent fields do not constrain; {@code runId} matches either endpoint.
 */
public record EdgeQuery(Optional<String> fromId, Optional<String> toId, Optional<String> runId) {
    public static final EdgeQuery ALL = new EdgeQuery(Optional.empty(), Optional.empty(), Optional.empty());

    public EdgeQuery {
        fromId = fromId == null ? Optional.empty() : fromId.filter(value -> !value.isBlank());
        toId = toId == null ? Optional.empty() : toId.filter(value -> !value.isBlank());
        runId = runId == null ? Optional.empty() : runId.filter(value -> !value.isBlank());
    }

    public static EdgeQuery from(String id) {
        return new EdgeQuery(Optional.ofNullable(id), Optional.empty(), Optional.empty());
    }

    public static EdgeQuery to(String id) {
        return new EdgeQuery(Optional.empty(), Optional.ofNullable(id), Optional.empty());
    }

    public static EdgeQuery touching(String runId) {
        return new EdgeQuery(Optional.empty(), Optional.empty(), Optional.ofNullable(runId));
    }

    public boolean matches(Edge edge) {
        if (fromId.isPresent() && !fromId.get().equals(edge.fromId())) {
            return false;
        }
        if (toId.isPresent() && !toId.get().equals(edge.toId())) {
            return false;
        }
        return runId.isEmpty() || edge.touches(runId.get());
    }
}
