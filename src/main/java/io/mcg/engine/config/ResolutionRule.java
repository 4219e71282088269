package io.mcg.engine.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Structural method-selection rule. Conditions are checked in a fixed order whatever their
 * declaration order: a satisfied {@code requires_any} fires the rule; otherwise a declared
 * {@code requires_all} decides alone; otherwise {@code patterns} decides. A rule without
 * conditions never fires.
 */
public record ResolutionRule(String name, List<Condition> conditions, String method) {
    public ResolutionRule {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean matches(Map<String, Object> params) {
        if (condition(ConditionKind.REQUIRES_ANY).map(any -> any.test(params)).orElse(false)) {
            return true;
        }
        Optional<Condition> all = condition(ConditionKind.REQUIRES_ALL);
        if (all.isPresent()) {
            return all.get().test(params);
        }
        return condition(ConditionKind.PATTERNS).map(patterns -> patterns.test(params)).orElse(false);
    }

    private Optional<Condition> condition(ConditionKind kind) {
        return conditions.stream().filter(condition -> condition.kind() == kind).findFirst();
    }

    public record Condition(ConditionKind kind, List<String> keys, Map<String, Pattern> patterns) {
        public Condition {
            keys = keys == null ? List.of() : List.copyOf(keys);
            patterns = patterns == null ? Map.of() : Map.copyOf(patterns);
        }

        public boolean test(Map<String, Object> params) {
            return switch (kind) {
                case REQUIRES_ANY -> keys.stream().anyMatch(params::containsKey);
                case REQUIRES_ALL -> params.keySet().containsAll(keys);
                case PATTERNS -> patterns.entrySet().stream().anyMatch(entry -> params.containsKey(entry.getKey())
                    && entry.getValue().matcher(String.valueOf(params.get(entry.getKey()))).find());
            };
        }
    }
}
