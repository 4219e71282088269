package io.mcg.engine.provenance;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the ledger slice of one run as readable lines, in ledger order:
 *
 * <pre>
 * S1a2b3c [System] --USES--> run_0f3e...
 * run_0f3e... --PRODUCES--> R9c8d7e [Results]
 * </pre>
 */
public final class LineageTrace {
    private LineageTrace() {}

    public static List<String> describe(ProvenanceStore store, String runId) {
        List<String> lines = new ArrayList<>();
        for (Edge edge : store.query(EdgeQuery.touching(runId))) {
            lines.add(label(store, edge.fromId()) + " --" + edge.relation() + "--> " + label(store, edge.toId()));
        }
        return lines;
    }

    public static String render(ProvenanceStore store, String runId) {
        return String.join(System.lineSeparator(), describe(store, runId));
    }

    private static String label(ProvenanceStore store, String id) {
        return store.get(id)
            .map(asset -> id + " [" + asset.kind().wireName() + "]")
            .orElse(id);
    }
}
