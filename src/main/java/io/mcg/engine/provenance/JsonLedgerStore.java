package io.mcg.engine.provenance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provenance store persisted as one JSON document:
 *
 * <pre>
 * {"assets": {id: AssetDict}, "edges": [{"from", "to", "rel", "t"}]}
 * </pre>
 *
 * <p>Each mutation rewrites the whole document into a sibling temporary file and moves it over
 * the ledger, so a failed write never leaves a half-patched file behind. Writers are serialized;
 * readers work on the last published snapshot and never block.
 */
public final class JsonLedgerStore implements ProvenanceStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonLedgerStore.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Path ledgerPath;
    private volatile Snapshot snapshot;

    private JsonLedgerStore(Path ledgerPath, Snapshot initial) {
        this.ledgerPath = ledgerPath;
        this.snapshot = initial;
    }

    /** Memory-only store; nothing survives the process. */
    public static JsonLedgerStore inMemory() {
        return new JsonLedgerStore(null, Snapshot.EMPTY);
    }

    /** Opens (or starts) the ledger at {@code path}, replaying its current content. */
    public static JsonLedgerStore open(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        Snapshot initial = Files.isRegularFile(normalized) ? readSnapshot(normalized) : Snapshot.EMPTY;
        LOG.debug("Opened ledger {} ({} assets, {} edges)", normalized, initial.assets().size(), initial.edges().size());
        return new JsonLedgerStore(normalized, initial);
    }

    public Optional<Path> ledgerPath() {
        return Optional.ofNullable(ledgerPath);
    }

    @Override
    public String put(Asset asset) {
        putAll(List.of(asset));
        return asset.id();
    }

    @Override
    public synchronized List<String> putAll(Collection<Asset> assets) {
        if (assets == null || assets.isEmpty()) {
            return List.of();
        }
        Snapshot current = snapshot;
        Map<String, Asset> next = new LinkedHashMap<>(current.assets());
        List<String> ids = new ArrayList<>(assets.size());
        for (Asset asset : assets) {
            next.put(asset.id(), asset);
            ids.add(asset.id());
        }
        publish(new Snapshot(Collections.unmodifiableMap(next), current.edges()));
        return ids;
    }

    @Override
    public Optional<Asset> get(String id) {
        return Optional.ofNullable(id == null ? null : snapshot.assets().get(id));
    }

    @Override
    public List<Asset> getMany(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Map<String, Asset> assets = snapshot.assets();
        List<Asset> found = new ArrayList<>();
        for (String id : ids) {
            Asset asset = assets.get(id);
            if (asset != null) {
                found.add(asset);
            }
        }
        return found;
    }

    @Override
    public synchronized int append(List<Edge> edges) {
        if (edges == null || edges.isEmpty()) {
            return 0;
        }
        Snapshot current = snapshot;
        List<Edge> next = new ArrayList<>(current.edges().size() + edges.size());
        next.addAll(current.edges());
        next.addAll(edges);
        publish(new Snapshot(current.assets(), Collections.unmodifiableList(next)));
        return edges.size();
    }

    @Override
    public List<Edge> query(EdgeQuery query) {
        EdgeQuery filter = query == null ? EdgeQuery.ALL : query;
        List<Edge> matches = new ArrayList<>();
        for (Edge edge : snapshot.edges()) {
            if (filter.matches(edge)) {
                matches.add(edge);
            }
        }
        return matches;
    }

    private void publish(Snapshot next) {
        if (ledgerPath != null) {
            write(ledgerPath, next);
        }
        snapshot = next;
    }

    private static void write(Path target, Snapshot data) {
        Map<String, Object> document = new LinkedHashMap<>();
        Map<String, Object> assets = new LinkedHashMap<>();
        for (Map.Entry<String, Asset> entry : data.assets().entrySet()) {
            assets.put(entry.getKey(), entry.getValue().toWire());
        }
        List<Object> edges = new ArrayList<>(data.edges().size());
        for (Edge edge : data.edges()) {
            edges.add(edge.toWire());
        }
        document.put("assets", assets);
        document.put("edges", edges);

        Path temp = null;
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            WRITER.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new LedgerException("Failed to write ledger " + target + ": " + ex.getMessage(), ex);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOG.warn("Could not remove temporary ledger file {}: {}", temp, ex.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private static Snapshot readSnapshot(Path path) {
        Map<String, Object> document;
        try {
            document = JSON.readValue(path.toFile(), MAP_REF);
        } catch (IOException ex) {
            throw new LedgerException("Failed to read ledger " + path + ": " + ex.getMessage(), ex);
        }
        Map<String, Asset> assets = new LinkedHashMap<>();
        if (document.get("assets") instanceof Map<?, ?> rawAssets) {
            for (Map.Entry<?, ?> entry : rawAssets.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?> wire) {
                    assets.put(String.valueOf(entry.getKey()), Asset.fromWire((Map<String, Object>) wire));
                }
            }
        }
        List<Edge> edges = new ArrayList<>();
        if (document.get("edges") instanceof List<?> rawEdges) {
            for (Object item : rawEdges) {
                if (item instanceof Map<?, ?> wire) {
                    edges.add(Edge.fromWire((Map<String, Object>) wire));
                }
            }
        }
        return new Snapshot(Collections.unmodifiableMap(assets), Collections.unmodifiableList(edges));
    }

    private record Snapshot(Map<String, Asset> assets, List<Edge> edges) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), List.of());
    }
}
