package io.mcg.engine.exec;

import io.mcg.engine.config.BackendKind;
import java.nio.file.Path;

/** Launch mechanism for rendered commands. Implementations block until the tool has finished. */
public interface ExecutionBackend {
    BackendKind kind();

    /**
     * Runs the request's command and returns its captured output.
     *
     * @throws ExecutionFailedException if the command cannot start, exits non-zero or times out
     */
    ExecutionResult execute(ExecutionRequest request);

    /** How the tool itself sees the work directory; substituted for {@code {work_dir}}. */
    default String visibleWorkDir(Path workDir) {
        return workDir.toAbsolutePath().toString();
    }
}
