package io.mcg.engine.runtime;

import io.mcg.engine.provenance.Run;
import java.util.List;
import java.util.Optional;

/** Creates runs and keeps their latest state. */
public interface RunTracker {
    Run create(String jobName);

    void update(Run run);

    Optional<Run> find(String runId);

    List<Run> runs();
}
