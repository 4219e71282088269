package io.mcg.engine.provenance;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One execution attempt of a job. Unlike assets, runs are mutable: the engine moves them through
 * {@code queued -> running -> done|error}, each step at most once.
 */
public final class Run {
    private final String id;
    private final String kind;
    private RunStatus status;
    private String runnerVersion;
    private String startedAt;
    private String endedAt;
    private String errorMessage;

    public Run(String id, String kind) {
        this(id, kind, RunStatus.QUEUED, null, null, null, null);
    }

    private Run(String id, String kind, RunStatus status, String runnerVersion, String startedAt, String endedAt, String errorMessage) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = Objects.requireNonNull(status, "status");
        this.runnerVersion = runnerVersion;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.errorMessage = errorMessage;
    }

    public static Run queued(String kind) {
        return new Run(AssetIds.runId(), kind);
    }

    public String id() {
        return id;
    }

    public String kind() {
        return kind;
    }

    public synchronized RunStatus status() {
        return status;
    }

    public synchronized Optional<String> startedAt() {
        return Optional.ofNullable(startedAt);
    }

    public synchronized Optional<String> endedAt() {
        return Optional.ofNullable(endedAt);
    }

    public synchronized Optional<String> runnerVersion() {
        return Optional.ofNullable(runnerVersion);
    }

    public synchronized Optional<String> errorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public synchronized void setRunnerVersion(String version) {
        this.runnerVersion = version;
    }

    public synchronized void markRunning(Instant at) {
        transition(RunStatus.QUEUED, RunStatus.RUNNING);
        this.startedAt = at.toString();
    }

    public synchronized void markDone(Instant at) {
        transition(RunStatus.RUNNING, RunStatus.DONE);
        this.endedAt = at.toString();
    }

    public synchronized void markError(Instant at, String message) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " already finished with status " + status.wireName());
        }
        this.status = RunStatus.ERROR;
        this.endedAt = at.toString();
        this.errorMessage = message;
    }

    private void transition(RunStatus expected, RunStatus next) {
        if (status != expected) {
            throw new IllegalStateException(
                "Run " + id + " cannot move to " + next.wireName() + " from " + status.wireName()
            );
        }
        this.status = next;
    }

    public synchronized Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("id", id);
        wire.put("kind", kind);
        wire.put("status", status.wireName());
        if (runnerVersion != null) {
            wire.put("runner_version", runnerVersion);
        }
        if (startedAt != null) {
            wire.put("started_at", startedAt);
        }
        if (endedAt != null) {
            wire.put("ended_at", endedAt);
        }
        if (errorMessage != null) {
            wire.put("error", errorMessage);
        }
        return wire;
    }

    public static Run fromWire(Map<String, Object> wire) {
        return new Run(
            String.valueOf(wire.get("id")),
            String.valueOf(wire.get("kind")),
            RunStatus.fromWire(wire.get("status") == null ? null : wire.get("status").toString()),
            stringOrNull(wire.get("runner_version")),
            stringOrNull(wire.get("started_at")),
            stringOrNull(wire.get("ended_at")),
            stringOrNull(wire.get("error"))
        );
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return "Run[" + id + ", " + kind + ", " + status().wireName() + "]";
    }
}
