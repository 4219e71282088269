package io.mcg.engine.config;

import io.mcg.engine.provenance.AssetKind;
import io.mcg.engine.shared.Durations;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns a parsed definition document (plain maps, lists and scalars, whatever the source format
 * was) into a {@link JobDefinition}. Every tag and every cross reference is checked here, so a
 * definition that loads is one the engine can run.
 */
public final class JobDefinitionParser {
    /** Default array indexing placeholder: {@code ${name[k]}}. */
    public static final Pattern DEFAULT_ARRAY_INDEX = Pattern.compile("\\$\\{(\\w+)\\[(\\d+)\\]\\}");

    private static final Pattern SCALED_FORMULA = Pattern.compile("^\\s*(\\w+)\\s*\\*\\s*([\\d.]+)\\s*/\\s*(\\w+)\\s*$");
    private static final Pattern INDEX_FORMULA = Pattern.compile("^\\s*(\\w+)\\s*\\[\\s*(\\d+)\\s*\\]\\s*$");
    private static final Set<String> BACKEND_COMMON_KEYS = Set.of("executable", "command_template", "environment", "timeout");

    private final String key;
    private final Path source;
    private final String where;

    private JobDefinitionParser(String key, Path source) {
        this.key = key;
        this.source = source;
        this.where = source == null ? key : source.getFileName().toString();
    }

    public static JobDefinition parse(String key, Map<String, Object> document) {
        return parse(key, document, null);
    }

    public static JobDefinition parse(String key, Map<String, Object> document, Path source) {
        if (key == null || key.isBlank()) {
            throw new ConfigurationException("Job definition key must not be blank");
        }
        if (document == null) {
            throw new ConfigurationException(key + ": empty job definition");
        }
        return new JobDefinitionParser(key, source).read(document);
    }

    private JobDefinition read(Map<String, Object> document) {
        var builder = JobDefinition.builder(key)
            .name(text(document.get("name"), "name"))
            .description(text(document.get("description"), "description"))
            .source(source);

        Object rawMethods = document.get("methods");
        if (rawMethods == null) {
            throw new ConfigurationException(where + ": 'methods' is required");
        }
        Map<String, Object> methods = table(rawMethods, "methods");
        if (methods.isEmpty()) {
            throw new ConfigurationException(where + ": at least one method must be declared");
        }
        Set<String> generatorNames = table(document.get("generators"), "generators").keySet();
        for (var entry : methods.entrySet()) {
            MethodSpec method = method(entry.getKey(), table(entry.getValue(), "methods." + entry.getKey()));
            for (MethodSpec.FileSpec file : method.files().values()) {
                if (file.generator().isPresent() && !generatorNames.contains(file.generator().get())) {
                    throw new ConfigurationException(where + ": methods." + method.name() + ".files." + file.key()
                        + " references unknown generator '" + file.generator().get() + "'", new ArrayList<>(generatorNames));
                }
            }
            builder.method(method);
        }
        List<String> methodNames = new ArrayList<>(methods.keySet());

        for (var entry : table(document.get("method_resolution"), "method_resolution").entrySet()) {
            builder.rule(rule(entry.getKey(), table(entry.getValue(), "method_resolution." + entry.getKey()), methodNames));
        }
        for (var entry : table(document.get("understands"), "understands").entrySet()) {
            var spec = table(entry.getValue(), "understands." + entry.getKey());
            String method = Optional.ofNullable(text(spec.get("method"), "understands." + entry.getKey() + ".method"))
                .orElse(entry.getKey());
            requireMethod(method, methodNames, "understands." + entry.getKey());
            builder.understands(new JobDefinition.Understanding(entry.getKey(), strings(spec.get("keywords")), method));
        }
        for (var entry : table(document.get("parameter_mapping"), "parameter_mapping").entrySet()) {
            builder.alias(entry.getKey(), strings(entry.getValue()));
        }
        for (var entry : table(document.get("context_builders"), "context_builders").entrySet()) {
            builder.contextBuilder(contextBuilder(entry.getKey(), table(entry.getValue(), "context_builders." + entry.getKey())));
        }
        for (var entry : table(document.get("generators"), "generators").entrySet()) {
            var spec = table(entry.getValue(), "generators." + entry.getKey());
            var kind = DefinitionTag.parse(GeneratorKind.class, spec.get("type"), where + ": generators." + entry.getKey() + ".type");
            builder.generator(new JobDefinition.GeneratorSpec(entry.getKey(), kind, Optional.ofNullable(block(spec.get("template"))).orElse("")));
        }
        var syntax = table(document.get("template_syntax"), "template_syntax");
        for (var entry : table(syntax.get("escape_sequences"), "template_syntax.escape_sequences").entrySet()) {
            builder.escapeSequence(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
        }
        int index = 0;
        for (Object raw : list(document.get("template_post_processors"))) {
            builder.postProcessor(postProcessor(table(raw, "template_post_processors[" + index + "]"), index));
            index++;
        }
        readExecution(builder, table(document.get("execution"), "execution"));
        for (String glob : strings(document.get("expected_outputs"))) {
            builder.expectedOutput(glob);
        }
        Map<String, Object> parsers = table(document.get("parsers"), "parsers");
        for (var entry : parsers.entrySet()) {
            builder.parser(parser(entry.getKey(), table(entry.getValue(), "parsers." + entry.getKey())));
        }
        readOutputParsing(builder, table(document.get("output_parsing"), "output_parsing"), parsers.keySet());
        for (var entry : table(document.get("default_results"), "default_results").entrySet()) {
            builder.defaultResult(entry.getKey(), entry.getValue());
        }
        for (var entry : table(document.get("result_assets"), "result_assets").entrySet()) {
            builder.resultAsset(resultAsset(entry.getKey(), table(entry.getValue(), "result_assets." + entry.getKey())));
        }
        var format = table(table(document.get("results"), "results").get("format"), "results.format");
        for (var entry : format.entrySet()) {
            var fieldFormat = table(entry.getValue(), "results.format." + entry.getKey());
            String unit = text(fieldFormat.get("unit"), "results.format." + entry.getKey() + ".unit");
            if (unit != null && !unit.isBlank()) {
                builder.unit(entry.getKey(), unit);
            }
        }
        builder.logTemplate(block(document.get("log_template")));
        return builder.build();
    }

    private MethodSpec method(String name, Map<String, Object> spec) {
        String path = "methods." + name;
        Map<String, MethodSpec.FileSpec> files = new LinkedHashMap<>();
        for (var entry : table(spec.get("files"), path + ".files").entrySet()) {
            var file = table(entry.getValue(), path + ".files." + entry.getKey());
            String fileName = Optional.ofNullable(text(file.get("name"), path + ".files." + entry.getKey() + ".name")).orElse(entry.getKey());
            files.put(entry.getKey(), new MethodSpec.FileSpec(entry.getKey(), fileName,
                Optional.ofNullable(block(file.get("content"))),
                Optional.ofNullable(text(file.get("generator"), path + ".files." + entry.getKey() + ".generator"))));
        }
        List<MethodSpec.OutputSpec> outputs = new ArrayList<>();
        for (Object raw : list(spec.get("outputs"))) {
            if (raw instanceof Map<?, ?>) {
                var output = table(raw, path + ".outputs");
                String outputName = Optional.ofNullable(text(output.get("name"), path + ".outputs.name")).orElse("unknown");
                outputs.add(new MethodSpec.OutputSpec(outputName,
                    Optional.ofNullable(text(output.get("file"), path + ".outputs.file")).orElse(outputName + ".dat"),
                    Optional.ofNullable(text(output.get("type"), path + ".outputs.type")).orElse("data")));
            } else if (raw != null) {
                outputs.add(new MethodSpec.OutputSpec(raw.toString(), raw + ".dat", "data"));
            }
        }
        var execution = table(spec.get("execution"), path + ".execution");
        Object script = spec.containsKey("script") ? spec.get("script") : spec.get("script_template");
        return new MethodSpec(
            name,
            Optional.ofNullable(block(spec.get("input_template"))),
            Optional.ofNullable(text(spec.get("template_file"), path + ".template_file")),
            text(spec.get("input_file"), path + ".input_file"),
            Optional.ofNullable(block(script)).filter(value -> !value.isBlank()),
            files,
            strings(spec.get("needs")),
            table(spec.get("parameter_defaults"), path + ".parameter_defaults"),
            outputs,
            duration(execution.get("timeout"), path + ".execution.timeout"),
            execution.get("mode") == null
                ? Optional.empty()
                : Optional.of(DefinitionTag.parse(BackendKind.class, execution.get("mode"), where + ": " + path + ".execution.mode"))
        );
    }

    private ResolutionRule rule(String name, Map<String, Object> spec, List<String> methodNames) {
        String path = "method_resolution." + name;
        List<ResolutionRule.Condition> conditions = new ArrayList<>();
        for (var entry : table(spec.get("condition"), path + ".condition").entrySet()) {
            var kind = DefinitionTag.parse(ConditionKind.class, entry.getKey(), where + ": " + path + ".condition");
            if (kind == ConditionKind.PATTERNS) {
                Map<String, Pattern> patterns = new LinkedHashMap<>();
                for (var pattern : table(entry.getValue(), path + ".condition.patterns").entrySet()) {
                    patterns.put(pattern.getKey(), regex(pattern.getValue(), path + ".condition.patterns." + pattern.getKey()));
                }
                conditions.add(new ResolutionRule.Condition(kind, List.of(), patterns));
            } else {
                conditions.add(new ResolutionRule.Condition(kind, strings(entry.getValue()), Map.of()));
            }
        }
        String method = Optional.ofNullable(text(spec.get("method"), path + ".method")).orElse(name);
        requireMethod(method, methodNames, path);
        return new ResolutionRule(name, conditions, method);
    }

    private ContextBuilderSpec contextBuilder(String name, Map<String, Object> spec) {
        String path = "context_builders." + name;
        var kind = DefinitionTag.parse(BuilderKind.class, spec.get("type"), where + ": " + path + ".type");
        if (kind == BuilderKind.PARAMETER_TRANSFORM) {
            String sourceKey = text(spec.get("source"), path + ".source");
            if (sourceKey == null || sourceKey.isBlank()) {
                throw new ConfigurationException(where + ": " + path + ".source is required");
            }
            var transformSpec = table(spec.get("transform"), path + ".transform");
            var transformKind = DefinitionTag.parse(TransformKind.class, transformSpec.get("type"), where + ": " + path + ".transform.type");
            var transform = new ContextBuilderSpec.Transform(
                transformKind,
                Optional.ofNullable(text(transformSpec.get("separator"), path + ".transform.separator")).orElse(" "),
                number(transformSpec.get("factor"), 1.0, path + ".transform.factor"),
                number(transformSpec.get("multiplier"), 1000.0, path + ".transform.multiplier"),
                number(transformSpec.get("timestep"), 1.0, path + ".transform.timestep"));
            return ContextBuilderSpec.transform(name, sourceKey, transform, spec.get("default"));
        }
        var computationSpec = table(spec.get("computation"), path + ".computation");
        Object fallback = spec.containsKey("default") ? spec.get("default") : computationSpec.get("default");
        Object type = computationSpec.get("type");
        if (type != null && "formula".equalsIgnoreCase(type.toString().trim())) {
            return ContextBuilderSpec.computed(name, formula(computationSpec.get("formula"), path), fallback);
        }
        var computationKind = DefinitionTag.parse(ComputationKind.class, type, where + ": " + path + ".computation.type");
        String sourceKey = text(computationSpec.get("source"), path + ".computation.source");
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new ConfigurationException(where + ": " + path + ".computation.source is required");
        }
        if (computationKind == ComputationKind.SCALED_STEPS) {
            String timestep = Optional.ofNullable(text(computationSpec.get("timestep"), path + ".computation.timestep")).orElse("timestep_fs");
            return ContextBuilderSpec.computed(name,
                ContextBuilderSpec.Computation.scaledSteps(sourceKey, number(computationSpec.get("scale"), 1000.0, path + ".computation.scale"), timestep),
                fallback);
        }
        int index = (int) number(computationSpec.get("index"), 0, path + ".computation.index");
        if (index < 0) {
            throw new ConfigurationException(where + ": " + path + ".computation.index must not be negative");
        }
        return ContextBuilderSpec.computed(name, ContextBuilderSpec.Computation.vectorComponent(sourceKey, index), fallback);
    }

    private ContextBuilderSpec.Computation formula(Object raw, String path) {
        String formula = raw == null ? "" : raw.toString();
        Matcher scaled = SCALED_FORMULA.matcher(formula);
        if (scaled.matches()) {
            return ContextBuilderSpec.Computation.scaledSteps(scaled.group(1), Double.parseDouble(scaled.group(2)), scaled.group(3));
        }
        Matcher indexed = INDEX_FORMULA.matcher(formula);
        if (indexed.matches()) {
            return ContextBuilderSpec.Computation.vectorComponent(indexed.group(1), Integer.parseInt(indexed.group(2)));
        }
        throw new ConfigurationException(where + ": " + path + ".computation.formula '" + formula
            + "' is not supported", List.of("<source> * <scale> / <timestep>", "<source>[<index>]"));
    }

    private JobDefinition.PostProcessor postProcessor(Map<String, Object> spec, int index) {
        String path = "template_post_processors[" + index + "]";
        var kind = DefinitionTag.parse(PostProcessorKind.class, spec.get("type"), where + ": " + path + ".type");
        Pattern pattern = spec.get("pattern") == null ? DEFAULT_ARRAY_INDEX : regex(spec.get("pattern"), path + ".pattern");
        if (pattern.matcher("").groupCount() < 2) {
            throw new ConfigurationException(where + ": " + path + ".pattern needs a name group and an index group");
        }
        return new JobDefinition.PostProcessor(kind, pattern);
    }

    private void readExecution(JobDefinition.Builder builder, Map<String, Object> execution) {
        if (execution.get("mode") != null) {
            builder.defaultMode(DefinitionTag.parse(BackendKind.class, execution.get("mode"), where + ": execution.mode"));
        }
        for (BackendKind kind : BackendKind.values()) {
            Object raw = execution.get(kind.wireName());
            if (raw == null) {
                continue;
            }
            String path = "execution." + kind.wireName();
            var spec = table(raw, path);
            Map<String, String> environment = new LinkedHashMap<>();
            for (var entry : table(spec.get("environment"), path + ".environment").entrySet()) {
                environment.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
            }
            Map<String, Object> settings = new LinkedHashMap<>();
            for (var entry : spec.entrySet()) {
                if (!BACKEND_COMMON_KEYS.contains(entry.getKey())) {
                    settings.put(entry.getKey(), entry.getValue());
                }
            }
            builder.backend(new BackendSpec(kind,
                text(spec.get("executable"), path + ".executable"),
                text(spec.get("command_template"), path + ".command_template"),
                environment,
                duration(spec.get("timeout"), path + ".timeout"),
                settings));
        }
    }

    private ParserSpec parser(String name, Map<String, Object> spec) {
        String path = "parsers." + name;
        var kind = DefinitionTag.parse(ParserKind.class, spec.get("type"), where + ": " + path + ".type");
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        Object rawPatterns = spec.get("patterns");
        if (rawPatterns instanceof Map<?, ?>) {
            for (var entry : table(rawPatterns, path + ".patterns").entrySet()) {
                patterns.put(entry.getKey(), regex(entry.getValue(), path + ".patterns." + entry.getKey()));
            }
        } else {
            List<String> declared = strings(rawPatterns);
            for (int i = 0; i < declared.size(); i++) {
                patterns.put("matches_" + i, regex(declared.get(i), path + ".patterns[" + i + "]"));
            }
        }
        if (kind == ParserKind.REGEX && patterns.isEmpty()) {
            throw new ConfigurationException(where + ": " + path + " declares no patterns");
        }
        int skipLines = (int) number(spec.get("skip_lines"), 0, path + ".skip_lines");
        if (skipLines < 0) {
            throw new ConfigurationException(where + ": " + path + ".skip_lines must not be negative");
        }
        String delimiter = Optional.ofNullable(text(spec.get("delimiter"), path + ".delimiter")).orElse(",");
        if (delimiter.length() != 1) {
            throw new ConfigurationException(where + ": " + path + ".delimiter must be a single character");
        }
        Object header = spec.get("header");
        return new ParserSpec(name, kind, patterns, skipLines, strings(spec.get("columns")), delimiter.charAt(0),
            header == null || Boolean.parseBoolean(header.toString()));
    }

    private void readOutputParsing(JobDefinition.Builder builder, Map<String, Object> spec, Set<String> parserNames) {
        int index = 0;
        for (Object raw : list(spec.get("files"))) {
            String path = "output_parsing.files[" + index++ + "]";
            var binding = table(raw, path);
            Optional<String> pattern = Optional.ofNullable(text(binding.get("pattern"), path + ".pattern"));
            Optional<String> name = Optional.ofNullable(text(binding.get("name"), path + ".name"));
            if (pattern.isEmpty() && name.isEmpty()) {
                throw new ConfigurationException(where + ": " + path + " needs a 'pattern' or a 'name'");
            }
            String parser = Optional.ofNullable(text(binding.get("parser"), path + ".parser")).orElse(ParserKind.JSON.wireName());
            if (!parserNames.contains(parser) && !isParserKind(parser)) {
                List<String> known = new ArrayList<>(parserNames);
                known.addAll(DefinitionTag.wireNames(ParserKind.class));
                throw new ConfigurationException(where + ": " + path + " references unknown parser '" + parser + "'", known);
            }
            builder.fileBinding(new JobDefinition.FileBinding(pattern, name, parser));
        }
        if (spec.get("policy") != null) {
            builder.parsePolicy(DefinitionTag.parse(ParsePolicy.class, spec.get("policy"), where + ": output_parsing.policy"));
        }
    }

    private JobDefinition.ResultAssetRule resultAsset(String name, Map<String, Object> spec) {
        String path = "result_assets." + name;
        AssetKind kind;
        try {
            kind = AssetKind.fromWire(String.valueOf(spec.get("type")));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(where + ": " + path + ".type: unsupported value '" + spec.get("type") + "'",
                AssetKind.wireNames());
        }
        var conditions = table(spec.get("conditions"), path + ".conditions");
        Map<String, String> payload = new LinkedHashMap<>();
        for (var entry : table(spec.get("payload"), path + ".payload").entrySet()) {
            payload.put(entry.getKey(), entry.getValue() == null ? entry.getKey() : entry.getValue().toString());
        }
        return new JobDefinition.ResultAssetRule(name, kind, strings(conditions.get("requires_data")), payload);
    }

    private void requireMethod(String method, List<String> methodNames, String path) {
        if (!methodNames.contains(method)) {
            throw new ConfigurationException(where + ": " + path + " references unknown method '" + method + "'", methodNames);
        }
    }

    private static boolean isParserKind(String name) {
        for (ParserKind kind : ParserKind.values()) {
            if (kind.wireName().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private Pattern regex(Object raw, String path) {
        if (raw == null) {
            throw new ConfigurationException(where + ": " + path + " is empty");
        }
        try {
            return Pattern.compile(raw.toString());
        } catch (PatternSyntaxException ex) {
            throw new ConfigurationException(where + ": " + path + " is not a valid regular expression: " + ex.getDescription(), ex);
        }
    }

    private Optional<Duration> duration(Object raw, String path) {
        try {
            return Durations.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(where + ": " + path + ": " + ex.getMessage(), ex);
        }
    }

    private double number(Object raw, double fallback, String path) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(where + ": " + path + " must be a number, got '" + raw + "'", ex);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> table(Object raw, String path) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConfigurationException(where + ": " + path + " must be an object");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (var entry : ((Map<Object, Object>) map).entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }

    private String text(Object raw, String path) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> || raw instanceof List<?>) {
            throw new ConfigurationException(where + ": " + path + " must be a string");
        }
        return raw.toString();
    }

    /** Text that may be written as one string or as a list of lines. */
    private static String block(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof List<?> lines) {
            List<String> parts = new ArrayList<>();
            for (Object line : lines) {
                parts.add(line == null ? "" : line.toString());
            }
            return String.join("\n", parts);
        }
        return raw.toString();
    }

    private static List<Object> list(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof List<?> items) {
            return new ArrayList<>(items);
        }
        return List.of(raw);
    }

    private static List<String> strings(Object raw) {
        List<String> values = new ArrayList<>();
        for (Object item : list(raw)) {
            if (item != null) {
                values.add(item.toString());
            }
        }
        return values;
    }
}
