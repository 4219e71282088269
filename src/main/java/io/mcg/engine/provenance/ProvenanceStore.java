package io.mcg.engine.provenance;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Asset registry plus append-only edge ledger. Every mutating call is durable before it
 * returns; edges are never edited, reordered or removed.
 */
public interface ProvenanceStore {
    String put(Asset asset);

    /** Stores several assets in one durable write. */
    List<String> putAll(Collection<Asset> assets);

    Optional<Asset> get(String id);

    /** Assets for the given ids in request order; unknown ids are skipped. */
    List<Asset> getMany(List<String> ids);

    /** Appends a batch atomically and returns the number of edges appended. */
    int append(List<Edge> edges);

    /** Matching edges in ledger order. */
    List<Edge> query(EdgeQuery query);

    default List<Edge> edges() {
        return query(EdgeQuery.ALL);
    }
}
