package io.mcg.engine.exec;

import io.mcg.engine.config.BackendKind;
import io.mcg.engine.config.BackendSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits the command to a Slurm-style batch queue. The job script carries {@code #SBATCH}
 * directives built from the backend settings ({@code account}, {@code partition}, {@code time},
 * {@code nodes}, {@code tasks_per_node}) and is submitted with {@code --wait}, so the call returns
 * only once the job has left the queue. When the wait runs past the timeout the queued job is
 * cancelled with {@code cancel_command} (default {@code scancel}), by id when the submit output
 * reported one and by job name otherwise.
 */
public final class BatchQueueBackend implements ExecutionBackend {
    private static final Logger LOG = LoggerFactory.getLogger(BatchQueueBackend.class);

    public static final String SCRIPT_FILE = "job.sbatch";
    public static final String JOB_OUTPUT = "slurm.out";
    public static final String JOB_ERROR = "slurm.err";

    private static final Pattern SUBMITTED = Pattern.compile("Submitted batch job (\\d+)");
    private static final Duration CANCEL_TIMEOUT = Duration.ofSeconds(30);

    private final ProcessRunner runner;

    public BatchQueueBackend(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.HPC;
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        Path script = request.workDir().resolve(SCRIPT_FILE);
        try {
            Files.writeString(script, buildScript(request), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw ExecutionFailedException.launchFailed(SCRIPT_FILE, ex);
        }
        List<String> argv = buildCommand(request);
        LOG.info("Submitting batch job: {}", String.join(" ", argv));
        ExecutionResult submitted;
        try {
            submitted = runner.run(argv, request.workDir(), Map.of(), request.timeout());
        } catch (ExecutionFailedException ex) {
            if (ex.isTimedOut()) {
                cancel(request, ex.stdout());
            }
            throw ex;
        }
        String jobOut = readIfPresent(request.workDir().resolve(JOB_OUTPUT));
        String jobErr = readIfPresent(request.workDir().resolve(JOB_ERROR));
        return new ExecutionResult(submitted.exitCode(), submitted.stdout() + jobOut, submitted.stderr() + jobErr,
            submitted.elapsed());
    }

    public List<String> buildCommand(ExecutionRequest request) {
        String submit = request.backend().setting("submit_command", "sbatch");
        List<String> argv = new ArrayList<>(Arrays.asList(submit.trim().split("\\s+")));
        argv.add("--wait");
        argv.add(SCRIPT_FILE);
        return argv;
    }

    public List<String> buildCancelCommand(ExecutionRequest request, String submitOutput) {
        String cancel = request.backend().setting("cancel_command", "scancel");
        List<String> argv = new ArrayList<>(Arrays.asList(cancel.trim().split("\\s+")));
        Optional<String> jobId = jobId(submitOutput);
        if (jobId.isPresent()) {
            argv.add(jobId.get());
        } else {
            argv.add("--name=" + jobName(request));
        }
        return argv;
    }

    static Optional<String> jobId(String submitOutput) {
        Matcher matcher = SUBMITTED.matcher(submitOutput == null ? "" : submitOutput);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private void cancel(ExecutionRequest request, String submitOutput) {
        List<String> argv = buildCancelCommand(request, submitOutput);
        LOG.warn("Batch job of run {} timed out, cancelling: {}", request.runId(), String.join(" ", argv));
        try {
            runner.run(argv, request.workDir(), Map.of(), CANCEL_TIMEOUT);
        } catch (ExecutionFailedException ex) {
            LOG.warn("Could not cancel batch job of run {}: {}", request.runId(), ex.getMessage());
        }
    }

    private static String jobName(ExecutionRequest request) {
        return request.backend().setting("job_name", "mcg-" + request.runId());
    }

    public String buildScript(ExecutionRequest request) {
        BackendSpec backend = request.backend();
        Path workDir = request.workDir().toAbsolutePath();
        StringBuilder script = new StringBuilder();
        script.append("#!/bin/bash -l\n");
        script.append("#SBATCH --job-name=").append(jobName(request)).append('\n');
        script.append("#SBATCH --nodes=").append(backend.setting("nodes", "1")).append('\n');
        script.append("#SBATCH --ntasks-per-node=").append(backend.setting("tasks_per_node", "1")).append('\n');
        backend.setting("account").ifPresent(account -> script.append("#SBATCH --account=").append(account).append('\n'));
        backend.setting("partition").ifPresent(partition -> script.append("#SBATCH --partition=").append(partition).append('\n'));
        // minutes; may exceed 59
        String time = backend.setting("time")
            .orElse(String.valueOf((long) Math.ceil(request.timeout().toSeconds() / 60.0)));
        script.append("#SBATCH --time=").append(time).append('\n');
        script.append("#SBATCH --output=").append(workDir.resolve(JOB_OUTPUT)).append('\n');
        script.append("#SBATCH --error=").append(workDir.resolve(JOB_ERROR)).append('\n');
        script.append('\n');
        script.append("cd ").append(quote(workDir.toString())).append('\n');
        for (var entry : backend.environment().entrySet()) {
            script.append("export ").append(entry.getKey()).append('=').append(quote(entry.getValue())).append('\n');
        }
        script.append(request.command()).append('\n');
        return script.toString();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private static String readIfPresent(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOG.warn("Could not read batch job output {}: {}", file, ex.getMessage());
            return "";
        }
    }
}
