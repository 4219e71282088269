package io.mcg.engine.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One named mode of operation of a job: what to render, what it needs and how long it may run.
 */
public record MethodSpec(
    String name,
    Optional<String> inputTemplate,
    Optional<String> templateFile,
    String inputFile,
    Optional<String> script,
    Map<String, FileSpec> files,
    List<String> needs,
    Map<String, Object> parameterDefaults,
    List<OutputSpec> outputs,
    Optional<Duration> timeout,
    Optional<BackendKind> mode
) {
    public static final String DEFAULT_INPUT_FILE = "input.in";
    public static final String SCRIPT_FILE = "job.sh";

    public MethodSpec {
        Objects.requireNonNull(name, "name");
        inputTemplate = inputTemplate == null ? Optional.empty() : inputTemplate;
        templateFile = templateFile == null ? Optional.empty() : templateFile;
        inputFile = inputFile == null || inputFile.isBlank() ? DEFAULT_INPUT_FILE : inputFile;
        script = script == null ? Optional.empty() : script;
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        needs = needs == null ? List.of() : List.copyOf(needs);
        parameterDefaults = parameterDefaults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameterDefaults));
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        timeout = timeout == null ? Optional.empty() : timeout;
        mode = mode == null ? Optional.empty() : mode;
    }

    public static MethodSpec named(String name) {
        return new MethodSpec(name, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasInputTemplate() {
        return inputTemplate.isPresent() || templateFile.isPresent();
    }

    /** Extra file rendered next to the main input: inline {@code content} or a named generator. */
    public record FileSpec(String key, String name, Optional<String> content, Optional<String> generator) {}

    /** Declared output file of a method; parsed with the parser named by {@code type} when one resolves. */
    public record OutputSpec(String name, String file, String type) {}
}
