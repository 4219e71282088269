package io.mcg.engine.provenance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.support.EngineTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLedgerStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void putAndGet() {
        JsonLedgerStore store = JsonLedgerStore.inMemory();
        Asset params = EngineTestSupport.params(Map.of("T", 300));
        assertEquals(params.id(), store.put(params));
        assertEquals(params, store.get(params.id()).get());
        assertTrue(store.get("P000000").isEmpty());
    }

    @Test
    void reopenedAssetsEqualTheirInMemoryOriginals() {
        Path ledger = tempDir.resolve("ledger.json");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("steps", 5_000L);
        payload.put("seed", 9_000_000_000L);
        payload.put("dt", 0.5f);
        payload.put("mesh", List.of(4L, 4L, 4L));
        Asset params = EngineTestSupport.params(payload);
        JsonLedgerStore.open(ledger).put(params);

        Asset reloaded = JsonLedgerStore.open(ledger).get(params.id()).get();
        assertEquals(params, reloaded);
        assertEquals(5_000, reloaded.fields().get("steps"));
        assertEquals(9_000_000_000L, reloaded.fields().get("seed"));
    }

    @Test
    void getManyKeepsRequestOrderAndSkipsUnknownIds() {
        JsonLedgerStore store = JsonLedgerStore.inMemory();
        Asset a = EngineTestSupport.params(Map.of("T", 100));
        Asset b = EngineTestSupport.params(Map.of("T", 200));
        store.putAll(List.of(a, b));

        List<Asset> found = store.getMany(List.of(b.id(), "missing", a.id()));
        assertEquals(List.of(b, a), found);
    }

    @Test
    void queriesFilterInLedgerOrder() {
        JsonLedgerStore store = JsonLedgerStore.inMemory();
        Edge uses = Edge.of("S1", "run_1", Relation.USES, T0);
        Edge produces = Edge.of("run_1", "R1", Relation.PRODUCES, T0);
        Edge other = Edge.of("S1", "run_2", Relation.USES, T0);
        Edge logs = Edge.of("run_1", "A1", Relation.LOGS, T0);
        assertEquals(2, store.append(List.of(uses, produces)));
        assertEquals(2, store.append(List.of(other, logs)));

        assertEquals(List.of(uses, produces, logs), store.query(EdgeQuery.touching("run_1")));
        assertEquals(List.of(uses, other), store.query(EdgeQuery.from("S1")));
        assertEquals(List.of(produces), store.query(EdgeQuery.to("R1")));
        assertEquals(List.of(uses), store.query(new EdgeQuery(
            java.util.Optional.of("S1"), java.util.Optional.empty(), java.util.Optional.of("run_1"))));
        assertEquals(4, store.edges().size());
        assertEquals(0, store.append(List.of()));
    }

    @Test
    void reopeningReplaysTheSameGraph() {
        Path ledger = tempDir.resolve("data").resolve("ledger.json");
        JsonLedgerStore store = JsonLedgerStore.open(ledger);
        Asset system = EngineTestSupport.silicon();
        Asset results = Asset.create(AssetKind.RESULTS, Map.of("energy_eV", -10.84), Map.of("energy_eV", "eV"));
        store.putAll(List.of(system, results));
        store.append(List.of(
            Edge.of(system.id(), "run_abc", Relation.USES, T0),
            Edge.of("run_abc", results.id(), Relation.PRODUCES, T0)));

        assertTrue(Files.isRegularFile(ledger));
        JsonLedgerStore reopened = JsonLedgerStore.open(ledger);
        assertEquals(store.edges(), reopened.edges());
        assertEquals(results, reopened.get(results.id()).get());
        assertEquals(system.id(), reopened.get(system.id()).get().id());
        assertTrue(reopened.get(system.id()).get().isContentAddressed());
    }

    @Test
    void writesLeaveNoTemporaryFiles() throws Exception {
        Path ledger = tempDir.resolve("ledger.json");
        JsonLedgerStore store = JsonLedgerStore.open(ledger);
        store.put(EngineTestSupport.params(Map.of("T", 300)));
        store.append(List.of(Edge.of("P1", "run_1", Relation.CONFIGURES, T0)));

        List<String> names;
        try (Stream<Path> files = Files.list(tempDir)) {
            names = files.map(path -> path.getFileName().toString()).collect(Collectors.toList());
        }
        assertEquals(List.of("ledger.json"), names);
    }

    @Test
    void corruptLedgerFailsToOpen() throws Exception {
        Path ledger = tempDir.resolve("ledger.json");
        Files.writeString(ledger, "{not json");
        LedgerException error = assertThrows(LedgerException.class, () -> JsonLedgerStore.open(ledger));
        assertEquals("ledger", error.code());
    }

    @Test
    void lineageListsEdgesOfOneRun() {
        JsonLedgerStore store = JsonLedgerStore.inMemory();
        Asset system = EngineTestSupport.silicon();
        store.put(system);
        store.append(List.of(
            Edge.of(system.id(), "run_1", Relation.USES, T0),
            Edge.of("run_1", "R123456", Relation.PRODUCES, T0)));

        List<String> lines = LineageTrace.describe(store, "run_1");
        assertEquals(List.of(
            system.id() + " [System] --USES--> run_1",
            "run_1 --PRODUCES--> R123456"), lines);
    }
}
