package io.mcg.engine.materialize;

import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.Edge;
import java.util.ArrayList;
import java.util.List;

/** Assets and lineage edges produced by one successful run, ready to be stored. */
public record MaterializedRun(Asset results, List<Asset> auxiliary, Asset log, List<Edge> edges) {
    public MaterializedRun {
        auxiliary = List.copyOf(auxiliary);
        edges = List.copyOf(edges);
    }

    /** Results first, then auxiliary assets, then the log artifact. */
    public List<Asset> assets() {
        List<Asset> assets = new ArrayList<>();
        assets.add(results);
        assets.addAll(auxiliary);
        assets.add(log);
        return assets;
    }
}
