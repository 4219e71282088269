package io.mcg.engine.parse;

import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.MethodSpec;
import io.mcg.engine.config.ParsePolicy;
import io.mcg.engine.config.ParserKind;
import io.mcg.engine.config.ParserSpec;
import io.mcg.engine.exec.OutputCollector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds output files to parsers and merges what they extract, in file order. A file is parsed
 * only when an {@code output_parsing} rule or one of the method's declared {@code outputs} binds
 * it; everything else is ignored. Under the {@code ignore} policy failed files are logged and
 * skipped; under {@code fail} any failure aborts with {@link OutputParseException}.
 */
public final class ResultCollector {
    private static final Logger LOG = LoggerFactory.getLogger(ResultCollector.class);

    private final JobDefinition definition;
    private final List<MethodSpec.OutputSpec> outputs;
    private final ParsePolicy policy;

    public ResultCollector(JobDefinition definition, ParsePolicy defaultPolicy) {
        this(definition, null, defaultPolicy);
    }

    public ResultCollector(JobDefinition definition, MethodSpec method, ParsePolicy defaultPolicy) {
        this.definition = definition;
        this.outputs = method == null ? List.of() : method.outputs();
        this.policy = definition.parsePolicy().orElse(defaultPolicy == null ? ParsePolicy.IGNORE : defaultPolicy);
    }

    public ParsePolicy policy() {
        return policy;
    }

    /** Expected-output globs plus every file pattern or name the parsing rules and method outputs bind. */
    public static List<String> discoveryGlobs(JobDefinition definition, MethodSpec method) {
        LinkedHashSet<String> globs = new LinkedHashSet<>(definition.expectedOutputs());
        for (JobDefinition.FileBinding binding : definition.fileBindings()) {
            binding.pattern().ifPresent(globs::add);
            binding.name().ifPresent(globs::add);
        }
        if (method != null) {
            for (MethodSpec.OutputSpec output : method.outputs()) {
                globs.add(output.file());
            }
        }
        return new ArrayList<>(globs);
    }

    public ParsedResults collect(List<Path> files) {
        Map<String, Object> fields = new LinkedHashMap<>();
        List<ParseOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            Optional<ParserSpec> spec = parserFor(file);
            if (spec.isEmpty()) {
                LOG.debug("No parser bound to {}", file.getFileName());
                continue;
            }
            ParseOutcome outcome = OutputParser.forKind(spec.get().kind()).parse(file, spec.get());
            outcomes.add(outcome);
            if (outcome.isSuccess()) {
                fields.putAll(outcome.fields());
            } else {
                LOG.warn("Skipping unparsable output {}", outcome.error().get());
            }
        }
        List<ParseError> errors = new ArrayList<>();
        for (ParseOutcome outcome : outcomes) {
            outcome.error().ifPresent(errors::add);
        }
        if (policy == ParsePolicy.FAIL && !errors.isEmpty()) {
            throw new OutputParseException(errors);
        }
        boolean defaulted = false;
        if (fields.isEmpty() && !definition.defaultResults().isEmpty()) {
            fields.putAll(definition.defaultResults());
            defaulted = true;
        }
        return new ParsedResults(fields, outcomes, defaulted);
    }

    Optional<ParserSpec> parserFor(Path file) {
        String fileName = file.getFileName().toString();
        for (JobDefinition.FileBinding binding : definition.fileBindings()) {
            boolean bound = binding.name().map(fileName::equals).orElse(false)
                || binding.pattern().map(glob -> OutputCollector.matches(glob, file)).orElse(false);
            if (bound) {
                return Optional.of(lookup(binding.parser())
                    .orElseThrow(() -> new IllegalStateException("Parser '" + binding.parser() + "' is not declared")));
            }
        }
        for (MethodSpec.OutputSpec output : outputs) {
            if (output.file().equals(fileName)) {
                Optional<ParserSpec> spec = lookup(output.type());
                if (spec.isPresent()) {
                    return spec;
                }
                LOG.debug("Output '{}' has type '{}', which names no parser", output.name(), output.type());
            }
        }
        return Optional.empty();
    }

    /** A parser declared under {@code parsers}, else the default parser of a kind with that name. */
    private Optional<ParserSpec> lookup(String parserName) {
        ParserSpec declared = definition.parsers().get(parserName);
        if (declared != null) {
            return Optional.of(declared);
        }
        for (ParserKind kind : ParserKind.values()) {
            if (kind.wireName().equalsIgnoreCase(parserName)) {
                return Optional.of(ParserSpec.of(kind));
            }
        }
        return Optional.empty();
    }
}
