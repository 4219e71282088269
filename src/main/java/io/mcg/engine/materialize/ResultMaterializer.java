package io.mcg.engine.materialize;

import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.exec.Backends;
import io.mcg.engine.exec.ExecutionResult;
import io.mcg.engine.parse.ParsedResults;
import io.mcg.engine.provenance.ArtifactStore;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.AssetIds;
import io.mcg.engine.provenance.AssetKind;
import io.mcg.engine.provenance.Edge;
import io.mcg.engine.provenance.Relation;
import io.mcg.engine.provenance.Run;
import io.mcg.engine.provenance.Units;
import io.mcg.engine.resolve.MethodResolver;
import io.mcg.engine.template.RenderContext;
import io.mcg.engine.template.TemplateRenderer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a finished run into ledger content: the Results asset, auxiliary assets declared by
 * {@code result_assets}, the log artifact and the lineage edges between them.
 *
 * <p>With an {@link ArtifactStore} the log text is written to {@code mcg://logs/<run id>.txt} and
 * the artifact carries its {@code uri} and {@code hash}; the text stays inline in the payload only
 * while it is short. Without a store the text is always inline.
 */
public final class ResultMaterializer {
    public static final String LOG_MEDIA_TYPE = "text/plain";

    private static final Set<String> CONTROL_PARAMS = Set.of(MethodResolver.METHOD_PARAM, Backends.MODE_PARAM);
    public static final String LOG_BUCKET = "logs";
    static final int INLINE_LOG_CHARS = 4_096;

    private static final int OUTPUT_TAIL_CHARS = 2_000;

    private final JobDefinition definition;
    private final Optional<ArtifactStore> artifacts;

    public ResultMaterializer(JobDefinition definition) {
        this(definition, Optional.empty());
    }

    public ResultMaterializer(JobDefinition definition, Optional<ArtifactStore> artifacts) {
        this.definition = definition;
        this.artifacts = artifacts == null ? Optional.empty() : artifacts;
    }

    public MaterializedRun materialize(Run run, String method, List<Asset> inputs, Map<String, Object> params,
                                       ParsedResults parsed, ExecutionResult execution, Instant now) {
        Map<String, Object> given = params == null ? Map.of() : params;
        Asset results = resultsAsset(method, given, parsed.fields());
        List<Asset> auxiliary = auxiliaryAssets(given, parsed.fields());
        Asset log = logArtifact(run, method, given, parsed.fields(), execution, now);

        List<Edge> edges = new ArrayList<>();
        for (Asset input : inputs) {
            Relation relation = input.kind() == AssetKind.SYSTEM ? Relation.USES : Relation.CONFIGURES;
            edges.add(Edge.of(input.id(), run.id(), relation, now));
        }
        edges.add(Edge.of(run.id(), results.id(), Relation.PRODUCES, now));
        edges.add(Edge.of(run.id(), log.id(), Relation.LOGS, now));
        for (Asset asset : auxiliary) {
            edges.add(Edge.of(results.id(), asset.id(), Relation.DERIVES, now));
        }
        return new MaterializedRun(results, auxiliary, log, edges);
    }

    Asset resultsAsset(String method, Map<String, Object> params, Map<String, Object> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("method", method);
        payload.put("runner", definition.name());
        payload.putAll(fields);
        for (var entry : params.entrySet()) {
            if (!CONTROL_PARAMS.contains(entry.getKey())) {
                payload.put(entry.getKey(), entry.getValue());
            }
        }
        return Asset.create(AssetKind.RESULTS, payload, units(payload, fields));
    }

    /** Declared units for parsed fields first, then units inferred from field name suffixes. */
    Map<String, String> units(Map<String, Object> payload, Map<String, Object> fields) {
        Map<String, String> units = new LinkedHashMap<>();
        for (String field : fields.keySet()) {
            String declared = definition.units().get(field);
            if (declared != null) {
                units.put(field, declared);
            }
        }
        for (String field : payload.keySet()) {
            if (!units.containsKey(field)) {
                Units.inferFromName(field).ifPresent(unit -> units.put(field, unit));
            }
        }
        return units;
    }

    List<Asset> auxiliaryAssets(Map<String, Object> params, Map<String, Object> fields) {
        List<Asset> assets = new ArrayList<>();
        for (JobDefinition.ResultAssetRule rule : definition.resultAssets()) {
            if (!fields.keySet().containsAll(rule.requiresData())) {
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            for (var mapping : rule.payload().entrySet()) {
                String source = mapping.getValue();
                if (fields.containsKey(source)) {
                    payload.put(mapping.getKey(), fields.get(source));
                } else if (params.containsKey(source)) {
                    payload.put(mapping.getKey(), params.get(source));
                }
            }
            if (!payload.isEmpty()) {
                assets.add(Asset.create(rule.kind(), payload));
            }
        }
        return assets;
    }

    Asset logArtifact(Run run, String method, Map<String, Object> params, Map<String, Object> fields,
                      ExecutionResult execution, Instant now) {
        StringBuilder text = new StringBuilder(logText(method, params, fields, now));
        if (execution != null) {
            appendTail(text, "stdout", execution.stdout());
            appendTail(text, "stderr", execution.stderr());
        }
        String content = text.toString();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("run_id", run.id());
        payload.put("media_type", LOG_MEDIA_TYPE);
        if (artifacts.isEmpty()) {
            payload.put("content", content);
            return Asset.create(AssetKind.ARTIFACT, payload).withLocation(null, AssetIds.sha256Hex(content));
        }
        String uri = ArtifactStore.uri(LOG_BUCKET, run.id() + ".txt");
        String hash = artifacts.get().write(uri, content);
        payload.put("kind", "log");
        payload.put("uri", uri);
        if (content.length() <= INLINE_LOG_CHARS) {
            payload.put("content", content);
        }
        return Asset.create(AssetKind.ARTIFACT, payload).withLocation(uri, hash);
    }

    private String logText(String method, Map<String, Object> params, Map<String, Object> fields, Instant now) {
        Optional<String> template = definition.logTemplate();
        if (template.isPresent()) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("config_name", definition.name());
            values.put("method", method);
            values.put("timestamp", now.toString());
            values.put("params", params);
            values.put("results", fields);
            return TemplateRenderer.substitute(template.get(), new RenderContext(values));
        }
        StringBuilder log = new StringBuilder();
        log.append("Run completed: ").append(definition.name()).append(" - ").append(method).append('\n');
        log.append("Timestamp: ").append(now).append("\n\n");
        log.append("Parameters:\n");
        for (var entry : params.entrySet()) {
            log.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        log.append("\nResults:\n");
        for (var entry : fields.entrySet()) {
            log.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return log.toString();
    }

    private static void appendTail(StringBuilder text, String label, String output) {
        if (output == null || output.isBlank()) {
            return;
        }
        String tail = output.length() <= OUTPUT_TAIL_CHARS ? output : output.substring(output.length() - OUTPUT_TAIL_CHARS);
        text.append('\n').append(label).append(":\n").append(tail);
        if (!tail.endsWith("\n")) {
            text.append('\n');
        }
    }
}
