package io.mcg.engine.exec;

import io.mcg.engine.config.BackendKind;
import io.mcg.engine.config.BackendSpec;
import io.mcg.engine.config.ConfigurationException;
import io.mcg.engine.config.DefinitionTag;
import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.MethodSpec;
import io.mcg.engine.template.RenderedFiles;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Backend selection, timeout precedence and command rendering. */
public final class Backends {
    public static final String MODE_PARAM = "execution_mode";

    private Backends() {}

    public static ExecutionBackend create(BackendKind kind, ProcessRunner runner) {
        return switch (kind) {
            case LOCAL -> new LocalBackend(runner);
            case DOCKER -> new ContainerBackend(runner);
            case HPC -> new BatchQueueBackend(runner);
        };
    }

    /**
     * The {@code execution_mode} parameter wins, then the method's mode, then the definition's
     * mode, then the first declared backend in the order local, docker, hpc.
     */
    public static BackendKind select(JobDefinition definition, MethodSpec method, Map<String, Object> params) {
        Object requested = params == null ? null : params.get(MODE_PARAM);
        if (requested != null) {
            return DefinitionTag.parse(BackendKind.class, requested, MODE_PARAM);
        }
        if (method.mode().isPresent()) {
            return method.mode().get();
        }
        if (definition.defaultMode().isPresent()) {
            return definition.defaultMode().get();
        }
        for (BackendKind kind : BackendKind.values()) {
            if (definition.backends().containsKey(kind)) {
                return kind;
            }
        }
        return BackendKind.LOCAL;
    }

    /** Declared settings for {@code kind}; an undeclared local backend runs {@code echo}. */
    public static BackendSpec spec(JobDefinition definition, BackendKind kind) {
        BackendSpec declared = definition.backends().get(kind);
        if (declared != null) {
            return declared;
        }
        if (kind == BackendKind.LOCAL) {
            return BackendSpec.local(null);
        }
        List<String> available = new ArrayList<>();
        for (BackendKind candidate : definition.backends().keySet()) {
            available.add(candidate.wireName());
        }
        throw new ConfigurationException("Job '" + definition.name() + "' has no '" + kind.wireName()
            + "' execution settings", available);
    }

    public static Duration timeout(MethodSpec method, BackendSpec backend, Duration engineDefault) {
        return method.timeout().or(backend::timeout).orElse(engineDefault);
    }

    /**
     * A rendered script runs as {@code sh job.sh}; otherwise the backend's command template is
     * filled with {@code {executable}}, {@code {input_file}}, {@code {work_dir}} and any scalar
     * backend setting.
     */
    public static String command(BackendSpec backend, MethodSpec method, RenderedFiles files, String workDir) {
        if (files.script().isPresent()) {
            return "sh " + files.script().get().getFileName();
        }
        String inputFile = files.inputFile().map(Path::getFileName).map(Path::toString).orElse(method.inputFile());
        String command = backend.commandTemplate()
            .replace("{executable}", backend.executable())
            .replace("{input_file}", inputFile)
            .replace("{work_dir}", workDir);
        for (var entry : backend.settings().entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                command = command.replace("{" + entry.getKey() + "}", value.toString());
            }
        }
        return command;
    }
}
