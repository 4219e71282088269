package io.mcg.engine.resolve;

import io.mcg.engine.config.ConfigurationException;
import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.ResolutionRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the method a run executes. The first step that yields a method wins: an explicit
 * {@code method} parameter, then the structural rules in declaration order, then understood
 * phrases, then the first declared method.
 */
public final class MethodResolver {
    public static final String METHOD_PARAM = "method";

    private MethodResolver() {}

    public static String resolve(JobDefinition definition, Map<String, Object> params) {
        return resolveWithReason(definition, params).method();
    }

    public static Resolution resolveWithReason(JobDefinition definition, Map<String, Object> params) {
        List<String> methods = definition.methodNames();
        if (methods.isEmpty()) {
            throw new ConfigurationException("Job '" + definition.name() + "' declares no methods");
        }
        Map<String, Object> safeParams = params == null ? Map.of() : params;

        Object explicit = safeParams.get(METHOD_PARAM);
        if (explicit != null) {
            String requested = explicit.toString();
            if (!methods.contains(requested)) {
                throw new ConfigurationException("Unknown method '" + requested + "' for job '" + definition.name() + "'", methods);
            }
            return new Resolution(requested, Resolution.Step.EXPLICIT, requested);
        }

        for (ResolutionRule rule : definition.rules()) {
            if (rule.matches(safeParams)) {
                return new Resolution(rule.method(), Resolution.Step.RULE, rule.name());
            }
        }

        if (!definition.understands().isEmpty()) {
            String haystack = valuesText(safeParams);
            for (JobDefinition.Understanding understanding : definition.understands()) {
                for (String keyword : understanding.keywords()) {
                    if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                        return new Resolution(understanding.method(), Resolution.Step.UNDERSTANDING, understanding.phrase());
                    }
                }
            }
        }

        return new Resolution(methods.get(0), Resolution.Step.FIRST_DECLARED, null);
    }

    private static String valuesText(Map<String, Object> params) {
        List<String> parts = new ArrayList<>();
        for (Object value : params.values()) {
            parts.add(String.valueOf(value));
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }
}
