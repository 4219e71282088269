package io.mcg.engine.exec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one external command to completion. Both output streams are drained on their own
 * threads so a chatty tool cannot block on a full pipe; on timeout the whole process tree is
 * killed.
 */
public final class ProcessRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long DRAIN_GRACE_MILLIS = 2_000L;

    public ExecutionResult run(List<String> argv, Path workDir, Map<String, String> environment, Duration timeout) {
        String display = String.join(" ", argv);
        ProcessBuilder builder = new ProcessBuilder(argv).directory(workDir.toFile());
        if (environment != null) {
            builder.environment().putAll(environment);
        }
        long started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw ExecutionFailedException.launchFailed(display, ex);
        }
        LOG.debug("Started pid {} in {}: {}", process.pid(), workDir, display);
        Future<String> stdout = drain(process.getInputStream(), "stdout-" + process.pid());
        Future<String> stderr = drain(process.getErrorStream(), "stderr-" + process.pid());
        try {
            process.getOutputStream().close();
        } catch (IOException ex) {
            LOG.debug("Could not close stdin of pid {}: {}", process.pid(), ex.getMessage());
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            killTree(process);
            Thread.currentThread().interrupt();
            throw ExecutionFailedException.interrupted(display, ex);
        }
        if (!finished) {
            killTree(process);
            throw ExecutionFailedException.timedOut(display, timeout.toMillis(), collect(stdout), collect(stderr));
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        String out = collect(stdout);
        String err = collect(stderr);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw ExecutionFailedException.nonZeroExit(display, exitCode, err);
        }
        return new ExecutionResult(exitCode, out, err, elapsed);
    }

    /** Command line that runs {@code command} through the platform shell. */
    public static List<String> shell(String command) {
        List<String> argv = new ArrayList<>();
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            argv.add("cmd.exe");
            argv.add("/C");
        } else {
            argv.add("/bin/sh");
            argv.add("-c");
        }
        argv.add(command);
        return argv;
    }

    static String tail(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }

    private static void killTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static Future<String> drain(InputStream in, String name) {
        FutureTask<String> task = new FutureTask<>(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        });
        Thread thread = new Thread(task, "mcg-" + name);
        thread.setDaemon(true);
        thread.start();
        return task;
    }

    private static String collect(Future<String> stream) {
        try {
            return stream.get(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException ex) {
            LOG.debug("Output stream not fully collected: {}", ex.toString());
            stream.cancel(true);
            return "";
        }
    }
}
