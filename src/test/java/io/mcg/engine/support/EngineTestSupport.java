package io.mcg.engine.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.JobDefinitionParser;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.AssetKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared fixtures: the checked-in job definitions, inline definitions written as JSON text and a
 * small silicon structure.
 */
public final class EngineTestSupport {
    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static final ObjectMapper JSON = new ObjectMapper();

    private EngineTestSupport() {}

    public static Path jobsDirectory() {
        return Path.of("src", "test", "resources", "jobs").toAbsolutePath();
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    /** Parses an inline definition; single quotes stand in for double quotes to keep tests readable. */
    public static JobDefinition definition(String key, String json) {
        return JobDefinitionParser.parse(key, document(json));
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> document(String json) {
        try {
            return JSON.readValue(json.replace('\'', '"'), LinkedHashMap.class);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static Asset silicon() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("formula", "Si2");
        payload.put("atoms", List.of(
            Map.of("el", "Si", "pos", List.of(0.0, 0.0, 0.0)),
            Map.of("el", "Si", "pos", List.of(1.3575, 1.3575, 1.3575))));
        payload.put("lattice", List.of(
            List.of(0.0, 2.715, 2.715),
            List.of(2.715, 0.0, 2.715),
            List.of(2.715, 2.715, 0.0)));
        payload.put("pbc", List.of(true, true, true));
        return Asset.create(AssetKind.SYSTEM, payload);
    }

    public static Asset params(Map<String, Object> values) {
        return Asset.create(AssetKind.PARAMS, values);
    }
}
