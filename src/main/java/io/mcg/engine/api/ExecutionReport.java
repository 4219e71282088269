package io.mcg.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.AssetKind;
import io.mcg.engine.provenance.Edge;
import io.mcg.engine.provenance.Run;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/** What one run wrote to the ledger, plus the run in its final state. */
public record ExecutionReport(List<Asset> assets, List<Edge> edges, Run run) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ExecutionReport {
        assets = List.copyOf(assets);
        edges = List.copyOf(edges);
    }

    public List<Asset> assetsOfKind(AssetKind kind) {
        return assets.stream().filter(asset -> asset.kind() == kind).collect(Collectors.toList());
    }

    public Optional<Asset> results() {
        return assets.stream().filter(asset -> asset.kind() == AssetKind.RESULTS).findFirst();
    }

    public Map<String, Object> toSerializableMap() {
        List<Map<String, Object>> assetWire = new ArrayList<>();
        for (Asset asset : assets) {
            assetWire.add(asset.toWire());
        }
        List<Map<String, Object>> edgeWire = new ArrayList<>();
        for (Edge edge : edges) {
            edgeWire.add(edge.toWire());
        }
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("assets", assetWire);
        serializable.put("edges", edgeWire);
        serializable.put("run", run.toWire());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize execution report: " + ex.getOriginalMessage(), ex);
        }
    }
}
