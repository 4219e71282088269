package io.mcg.engine.exec;

import io.mcg.engine.config.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs the command directly on this machine, inside the run's work directory. */
public final class LocalBackend implements ExecutionBackend {
    private static final Logger LOG = LoggerFactory.getLogger(LocalBackend.class);

    private final ProcessRunner runner;

    public LocalBackend(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.LOCAL;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        LOG.info("Executing locally: {}", request.command());
        return runner.run(ProcessRunner.shell(request.command()), request.workDir(),
            request.backend().environment(), request.timeout());
    }
}
