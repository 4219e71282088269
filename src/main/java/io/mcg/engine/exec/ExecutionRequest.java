package io.mcg.engine.exec;

import io.mcg.engine.config.BackendSpec;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * One launch of an external tool. {@code command} is already rendered and runs through the
 * platform shell with {@code workDir} as its working directory.
 */
public record ExecutionRequest(String runId, String jobName, String method, BackendSpec backend, Path workDir,
                               String command, Duration timeout) {
    public ExecutionRequest {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(workDir, "workDir");
        Objects.requireNonNull(command, "command");
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
