package io.mcg.engine.exec;

import java.time.Duration;

/** Captured outcome of a finished launch. */
public record ExecutionResult(int exitCode, String stdout, String stderr, Duration elapsed) {
    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
