package io.mcg.engine.template;

import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.MethodSpec;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.AssetKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a definition's templates against a {@link RenderContext} and writes the method's
 * input files into a work directory.
 *
 * <p>Substitution is safe: {@code $name}, {@code ${name}} and {@code ${a.b}} are replaced when
 * the context resolves them and left verbatim otherwise; {@code $$} renders a literal {@code $}.
 */
public final class TemplateRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(TemplateRenderer.class);

    private static final Pattern PLACEHOLDER = Pattern.compile(
        "\\$(?:(\\$)|([_A-Za-z][_A-Za-z0-9]*)|\\{([_A-Za-z][_A-Za-z0-9]*(?:\\.[_A-Za-z0-9]+)*)\\})");

    private final JobDefinition definition;

    public TemplateRenderer(JobDefinition definition) {
        this.definition = definition;
    }

    public String render(String template, RenderContext context) {
        String text = template == null ? "" : template;
        for (var escape : definition.escapeSequences().entrySet()) {
            text = text.replace(escape.getKey(), escape.getValue());
        }
        text = substitute(text, context);
        for (JobDefinition.PostProcessor processor : definition.postProcessors()) {
            text = switch (processor.kind()) {
                case ARRAY_INDEXING -> indexArrays(text, processor.pattern(), context);
            };
        }
        return text;
    }

    public static String substitute(String template, RenderContext context) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String replacement;
            if (matcher.group(1) != null) {
                replacement = "$";
            } else {
                String key = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
                replacement = context.resolves(key) ? stringify(context.lookup(key).orElse(null)) : matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String indexArrays(String text, Pattern pattern, RenderContext context) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = matcher.group();
            Object value = context.get(matcher.group(1));
            if (value instanceof List<?> items) {
                try {
                    int index = Integer.parseInt(matcher.group(2));
                    if (index >= 0 && index < items.size()) {
                        replacement = stringify(items.get(index));
                    }
                } catch (NumberFormatException ex) {
                    LOG.debug("Ignoring non-numeric index in '{}'", matcher.group());
                }
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * Writes the method's main input, its extra files and its script into {@code workDir}. A method
     * without an input template gets no input file.
     */
    public RenderedFiles renderFiles(MethodSpec method, RenderContext context, List<Asset> inputs, Path workDir) {
        Optional<Path> input = Optional.empty();
        if (method.hasInputTemplate()) {
            String template = method.inputTemplate().isPresent()
                ? method.inputTemplate().get()
                : readTemplateFile(method.templateFile().get());
            input = Optional.of(write(workDir, method.inputFile(), render(template, context)));
        }
        Map<String, Path> files = new LinkedHashMap<>();
        for (MethodSpec.FileSpec file : method.files().values()) {
            String content;
            if (file.content().isPresent()) {
                content = render(file.content().get(), context);
            } else if (file.generator().isPresent()) {
                content = generate(file.generator().get(), context, inputs);
            } else {
                content = "";
            }
            files.put(file.key(), write(workDir, file.name(), content));
        }
        Optional<Path> script = method.script().map(body -> write(workDir, MethodSpec.SCRIPT_FILE, render(body, context)));
        RenderedFiles rendered = new RenderedFiles(input, files, script);
        LOG.debug("Rendered {} file(s) for method '{}' into {}", rendered.count(), method.name(), workDir);
        return rendered;
    }

    private String generate(String generatorName, RenderContext context, List<Asset> inputs) {
        JobDefinition.GeneratorSpec generator = definition.generators().get(generatorName);
        if (generator == null) {
            throw new TemplateException("Unknown generator '" + generatorName + "'");
        }
        return switch (generator.kind()) {
            case TEMPLATE -> render(generator.template(), context);
            case DATA_FILE -> fillFromStructure(generator.template(), inputs);
        };
    }

    /** Data files take {@code {field}} placeholders filled from the input structure's payload. */
    private static String fillFromStructure(String template, List<Asset> inputs) {
        Asset structure = ContextBuilder.assetsByContextKey(inputs).get(AssetKind.SYSTEM.contextKey());
        if (structure == null) {
            return template;
        }
        String text = template;
        for (var field : structure.fields().entrySet()) {
            text = text.replace("{" + field.getKey() + "}", stringify(field.getValue()));
        }
        return text;
    }

    private String readTemplateFile(String name) {
        Path path = Path.of(name);
        if (!path.isAbsolute()) {
            path = definition.baseDirectory().map(dir -> dir.resolve(name)).orElse(path.toAbsolutePath());
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new TemplateException("Template file not readable: " + path, ex);
        }
    }

    private static Path write(Path workDir, String fileName, String content) {
        Path target = workDir.resolve(fileName).normalize();
        if (!target.startsWith(workDir.normalize())) {
            throw new TemplateException("File '" + fileName + "' would be written outside the work directory");
        }
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            return Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new TemplateException("Failed to write " + target, ex);
        }
    }
}
