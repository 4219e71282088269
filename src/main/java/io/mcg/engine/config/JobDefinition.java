package io.mcg.engine.config;

import io.mcg.engine.provenance.AssetKind;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable, typed form of one job definition document: the methods a tool supports, how to pick
 * one, how to render its inputs, where to run it and how to read its outputs.
 */
public record JobDefinition(
    String key,
    String name,
    String description,
    Optional<Path> source,
    Map<String, MethodSpec> methods,
    List<ResolutionRule> rules,
    List<Understanding> understands,
    Map<String, List<String>> parameterMapping,
    List<ContextBuilderSpec> contextBuilders,
    Map<String, GeneratorSpec> generators,
    Map<String, String> escapeSequences,
    List<PostProcessor> postProcessors,
    Optional<BackendKind> defaultMode,
    Map<BackendKind, BackendSpec> backends,
    List<String> expectedOutputs,
    Map<String, ParserSpec> parsers,
    List<FileBinding> fileBindings,
    Optional<ParsePolicy> parsePolicy,
    Map<String, Object> defaultResults,
    List<ResultAssetRule> resultAssets,
    Map<String, String> units,
    Optional<String> logTemplate
) {
    public static final List<String> DEFAULT_EXPECTED_OUTPUTS = List.of("*.dat", "*.txt", "*.json", "*.out", "*.log");

    public JobDefinition {
        Objects.requireNonNull(key, "key");
        name = name == null || name.isBlank() ? key : name;
        description = description == null ? "" : description;
        source = source == null ? Optional.empty() : source;
        methods = freeze(methods);
        rules = rules == null ? List.of() : List.copyOf(rules);
        understands = understands == null ? List.of() : List.copyOf(understands);
        parameterMapping = freeze(parameterMapping);
        contextBuilders = contextBuilders == null ? List.of() : List.copyOf(contextBuilders);
        generators = freeze(generators);
        escapeSequences = freeze(escapeSequences);
        postProcessors = postProcessors == null ? List.of() : List.copyOf(postProcessors);
        defaultMode = defaultMode == null ? Optional.empty() : defaultMode;
        backends = freeze(backends);
        expectedOutputs = expectedOutputs == null || expectedOutputs.isEmpty() ? DEFAULT_EXPECTED_OUTPUTS : List.copyOf(expectedOutputs);
        parsers = freeze(parsers);
        fileBindings = fileBindings == null ? List.of() : List.copyOf(fileBindings);
        parsePolicy = parsePolicy == null ? Optional.empty() : parsePolicy;
        defaultResults = freeze(defaultResults);
        resultAssets = resultAssets == null ? List.of() : List.copyOf(resultAssets);
        units = freeze(units);
        logTemplate = logTemplate == null ? Optional.empty() : logTemplate;
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public List<String> methodNames() {
        return new ArrayList<>(methods.keySet());
    }

    public Optional<MethodSpec> method(String methodName) {
        return Optional.ofNullable(methodName == null ? null : methods.get(methodName));
    }

    /** Directory relative template files resolve against. */
    public Optional<Path> baseDirectory() {
        return source.map(Path::toAbsolutePath).map(Path::getParent);
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> map) {
        return map == null || map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /** Phrase-level hint: any keyword found in the parameter values selects {@code method}. */
    public record Understanding(String phrase, List<String> keywords, String method) {
        public Understanding {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }

    public record GeneratorSpec(String name, GeneratorKind kind, String template) {}

    /** Post-substitution rewrite; {@code pattern} has the array name as group 1 and the index as group 2. */
    public record PostProcessor(PostProcessorKind kind, Pattern pattern) {}

    /** Binds output files to a parser by glob {@code pattern} or exact file {@code name}. */
    public record FileBinding(Optional<String> pattern, Optional<String> name, String parser) {}

    /**
     * Auxiliary asset emitted next to the Results asset when all {@code requiresData} fields were
     * parsed. {@code payload} maps target keys to source keys looked up in results, then params.
     */
    public record ResultAssetRule(String name, AssetKind kind, List<String> requiresData, Map<String, String> payload) {
        public ResultAssetRule {
            requiresData = requiresData == null ? List.of() : List.copyOf(requiresData);
            payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
    }

    public static final class Builder {
        private final String key;
        private String name;
        private String description;
        private Path source;
        private final Map<String, MethodSpec> methods = new LinkedHashMap<>();
        private final List<ResolutionRule> rules = new ArrayList<>();
        private final List<Understanding> understands = new ArrayList<>();
        private final Map<String, List<String>> parameterMapping = new LinkedHashMap<>();
        private final List<ContextBuilderSpec> contextBuilders = new ArrayList<>();
        private final Map<String, GeneratorSpec> generators = new LinkedHashMap<>();
        private final Map<String, String> escapeSequences = new LinkedHashMap<>();
        private final List<PostProcessor> postProcessors = new ArrayList<>();
        private BackendKind defaultMode;
        private final Map<BackendKind, BackendSpec> backends = new LinkedHashMap<>();
        private final List<String> expectedOutputs = new ArrayList<>();
        private final Map<String, ParserSpec> parsers = new LinkedHashMap<>();
        private final List<FileBinding> fileBindings = new ArrayList<>();
        private ParsePolicy parsePolicy;
        private final Map<String, Object> defaultResults = new LinkedHashMap<>();
        private final List<ResultAssetRule> resultAssets = new ArrayList<>();
        private final Map<String, String> units = new LinkedHashMap<>();
        private String logTemplate;

        private Builder(String key) {
            this.key = key;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder method(MethodSpec method) {
            this.methods.put(method.name(), method);
            return this;
        }

        public Builder rule(ResolutionRule rule) {
            this.rules.add(rule);
            return this;
        }

        public Builder understands(Understanding understanding) {
            this.understands.add(understanding);
            return this;
        }

        public Builder alias(String canonical, List<String> aliases) {
            this.parameterMapping.put(canonical, List.copyOf(aliases));
            return this;
        }

        public Builder contextBuilder(ContextBuilderSpec builder) {
            this.contextBuilders.add(builder);
            return this;
        }

        public Builder generator(GeneratorSpec generator) {
            this.generators.put(generator.name(), generator);
            return this;
        }

        public Builder escapeSequence(String from, String to) {
            this.escapeSequences.put(from, to);
            return this;
        }

        public Builder postProcessor(PostProcessor processor) {
            this.postProcessors.add(processor);
            return this;
        }

        public Builder defaultMode(BackendKind mode) {
            this.defaultMode = mode;
            return this;
        }

        public Builder backend(BackendSpec backend) {
            this.backends.put(backend.kind(), backend);
            return this;
        }

        public Builder expectedOutput(String glob) {
            this.expectedOutputs.add(glob);
            return this;
        }

        public Builder parser(ParserSpec parser) {
            this.parsers.put(parser.name(), parser);
            return this;
        }

        public Builder fileBinding(FileBinding binding) {
            this.fileBindings.add(binding);
            return this;
        }

        public Builder parsePolicy(ParsePolicy policy) {
            this.parsePolicy = policy;
            return this;
        }

        public Builder defaultResult(String field, Object value) {
            this.defaultResults.put(field, value);
            return this;
        }

        public Builder resultAsset(ResultAssetRule rule) {
            this.resultAssets.add(rule);
            return this;
        }

        public Builder unit(String field, String unit) {
            this.units.put(field, unit);
            return this;
        }

        public Builder logTemplate(String template) {
            this.logTemplate = template;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(
                key,
                name,
                description,
                Optional.ofNullable(source),
                methods,
                rules,
                understands,
                parameterMapping,
                contextBuilders,
                generators,
                escapeSequences,
                postProcessors,
                Optional.ofNullable(defaultMode),
                backends,
                expectedOutputs,
                parsers,
                fileBindings,
                Optional.ofNullable(parsePolicy),
                defaultResults,
                resultAssets,
                units,
                Optional.ofNullable(logTemplate)
            );
        }
    }
}
