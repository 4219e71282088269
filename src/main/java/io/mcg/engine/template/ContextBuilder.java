package io.mcg.engine.template;

import io.mcg.engine.config.ContextBuilderSpec;
import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.MethodSpec;
import io.mcg.engine.provenance.Asset;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the render context in layers. A layer only adds keys that earlier layers left absent:
 * fixed values, caller parameters, aliases, method defaults, input asset payloads, then the
 * declared context builders in order.
 */
public final class ContextBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ContextBuilder.class);

    public static final String TIMESTAMP = "timestamp";
    public static final String SEED = "seed";
    public static final int FIXED_SEED = 12345;

    private ContextBuilder() {}

    public static RenderContext build(JobDefinition definition, MethodSpec method, List<Asset> inputs,
                                      Map<String, Object> params, Instant now) {
        Map<String, Object> given = params == null ? Map.of() : params;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(TIMESTAMP, now.toString());
        context.put(SEED, FIXED_SEED);

        for (var entry : given.entrySet()) {
            context.putIfAbsent(entry.getKey(), entry.getValue());
        }
        for (var entry : definition.parameterMapping().entrySet()) {
            for (String alias : entry.getValue()) {
                if (given.containsKey(alias)) {
                    context.putIfAbsent(entry.getKey(), given.get(alias));
                    break;
                }
            }
        }
        for (var entry : method.parameterDefaults().entrySet()) {
            context.putIfAbsent(entry.getKey(), entry.getValue());
        }
        for (var entry : assetsByContextKey(inputs).entrySet()) {
            context.putIfAbsent(entry.getKey(), entry.getValue().fields());
        }
        for (ContextBuilderSpec builder : definition.contextBuilders()) {
            if (context.containsKey(builder.name())) {
                continue;
            }
            Optional<Object> value = evaluate(builder, context);
            if (value.isPresent()) {
                context.put(builder.name(), value.get());
            } else {
                LOG.debug("Context builder '{}' produced no value", builder.name());
            }
        }
        return new RenderContext(context);
    }

    /**
     * Checks that every {@code needs} entry of the method is satisfied by a parameter, by one of
     * its aliases or by an input asset of that kind.
     */
    public static void requireNeeds(JobDefinition definition, MethodSpec method, List<Asset> inputs,
                                    Map<String, Object> params) {
        Map<String, Object> given = params == null ? Map.of() : params;
        Map<String, Asset> assets = assetsByContextKey(inputs);
        List<String> missing = new ArrayList<>();
        for (String need : method.needs()) {
            if (given.containsKey(need) || assets.containsKey(need)) {
                continue;
            }
            boolean aliased = false;
            for (String alias : definition.parameterMapping().getOrDefault(need, List.of())) {
                if (given.containsKey(alias)) {
                    aliased = true;
                    break;
                }
            }
            if (!aliased) {
                missing.add(need);
            }
        }
        if (!missing.isEmpty()) {
            throw new TemplateException("Required input missing for method '" + method.name() + "': " + missing
                + " (parameters " + given.keySet() + ", assets " + assets.keySet() + ")");
        }
    }

    /** Input assets keyed by lower-case kind name; a later asset of the same kind replaces an earlier one. */
    public static Map<String, Asset> assetsByContextKey(List<Asset> inputs) {
        Map<String, Asset> assets = new LinkedHashMap<>();
        if (inputs != null) {
            for (Asset asset : inputs) {
                assets.put(asset.kind().contextKey(), asset);
            }
        }
        return assets;
    }

    static Optional<Object> evaluate(ContextBuilderSpec builder, Map<String, Object> context) {
        String source = builder.source().orElse(builder.name());
        Optional<Object> value = switch (builder.kind()) {
            case PARAMETER_TRANSFORM -> context.containsKey(source)
                ? Transforms.apply(builder.transform().orElseThrow(), context.get(source))
                : Optional.empty();
            case COMPUTED_VALUE -> Transforms.compute(builder.computation().orElseThrow(), context);
        };
        return value.isPresent() ? value : builder.fallback();
    }
}
