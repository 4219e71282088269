package io.mcg.engine.runtime;

import io.mcg.engine.provenance.Run;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Process-local run registry, in creation order. */
public final class InMemoryRunTracker implements RunTracker {
    private final Map<String, Run> runs = new LinkedHashMap<>();

    @Override
    public synchronized Run create(String jobName) {
        Run run = Run.queued(jobName);
        runs.put(run.id(), run);
        return run;
    }

    @Override
    public synchronized void update(Run run) {
        runs.put(run.id(), run);
    }

    @Override
    public synchronized Optional<Run> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<Run> runs() {
        return new ArrayList<>(runs.values());
    }
}
