package io.mcg.engine.exec;

import io.mcg.engine.config.BackendKind;
import io.mcg.engine.config.ConfigurationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the command in a throw-away container with the work directory mounted at
 * {@value #CONTAINER_WORK_DIR}. Settings: {@code image} (required), {@code runtime}
 * (default {@code docker}) and extra run {@code options}.
 */
public final class ContainerBackend implements ExecutionBackend {
    private static final Logger LOG = LoggerFactory.getLogger(ContainerBackend.class);

    public static final String CONTAINER_WORK_DIR = "/work";

    private final ProcessRunner runner;

    public ContainerBackend(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.DOCKER;
    }

    @Override
    public String visibleWorkDir(Path workDir) {
        return CONTAINER_WORK_DIR;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        List<String> argv = buildCommand(request);
        LOG.info("Executing in container: {}", String.join(" ", argv));
        // the runtime client runs on the host; the declared environment goes to the container via -e
        return runner.run(argv, request.workDir(), Map.of(), request.timeout());
    }

    public List<String> buildCommand(ExecutionRequest request) {
        var backend = request.backend();
        String image = backend.setting("image")
            .orElseThrow(() -> new ConfigurationException("execution.docker.image is required for job '" + request.jobName() + "'"));
        List<String> argv = new ArrayList<>();
        argv.add(backend.setting("runtime", "docker"));
        argv.add("run");
        argv.add("--rm");
        argv.add("-v");
        argv.add(request.workDir().toAbsolutePath() + ":" + CONTAINER_WORK_DIR);
        argv.add("-w");
        argv.add(CONTAINER_WORK_DIR);
        for (var entry : backend.environment().entrySet()) {
            argv.add("-e");
            argv.add(entry.getKey() + "=" + entry.getValue());
        }
        argv.addAll(backend.listSetting("options"));
        argv.add(image);
        argv.add("/bin/sh");
        argv.add("-c");
        argv.add(request.command());
        return argv;
    }
}
