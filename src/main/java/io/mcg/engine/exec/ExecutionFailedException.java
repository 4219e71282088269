package io.mcg.engine.exec;

import io.mcg.engine.shared.EngineException;
import java.util.Optional;

/** The external tool could not be started, exited non-zero or ran past its timeout. */
public final class ExecutionFailedException extends EngineException {
    private final Integer exitCode;
    private final String stdout;
    private final String stderr;
    private final boolean timedOut;

    private ExecutionFailedException(String message, Integer exitCode, String stdout, String stderr, boolean timedOut,
                                     Throwable cause) {
        super("execution", message, cause);
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
        this.timedOut = timedOut;
    }

    public static ExecutionFailedException nonZeroExit(String command, int exitCode, String stderr) {
        String detail = stderr == null || stderr.isBlank() ? "" : ": " + ProcessRunner.tail(stderr.strip(), 500);
        return new ExecutionFailedException("Command exited with code " + exitCode + " (" + command + ")" + detail,
            exitCode, "", stderr, false, null);
    }

    /** {@code stdout} and {@code stderr} hold whatever the command wrote before it was killed. */
    public static ExecutionFailedException timedOut(String command, long timeoutMillis, String stdout, String stderr) {
        return new ExecutionFailedException("Command timed out after " + timeoutMillis + " ms (" + command + ")",
            null, stdout, stderr, true, null);
    }

    public static ExecutionFailedException launchFailed(String command, Throwable cause) {
        return new ExecutionFailedException("Failed to start command (" + command + "): " + cause.getMessage(),
            null, "", "", false, cause);
    }

    public static ExecutionFailedException interrupted(String command, InterruptedException cause) {
        return new ExecutionFailedException("Interrupted while waiting for command (" + command + ")",
            null, "", "", false, cause);
    }

    public Optional<Integer> exitCode() {
        return Optional.ofNullable(exitCode);
    }

    public String stdout() {
        return stdout;
    }

    public String stderr() {
        return stderr;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
