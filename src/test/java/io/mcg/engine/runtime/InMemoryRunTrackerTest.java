package io.mcg.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.mcg.engine.provenance.Run;
import io.mcg.engine.provenance.RunStatus;
import io.mcg.engine.support.EngineTestSupport;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryRunTrackerTest {
    @Test
    void keepsRunsInCreationOrder() {
        InMemoryRunTracker tracker = new InMemoryRunTracker();
        Run first = tracker.create("Band Gap");
        Run second = tracker.create("Band Gap");

        assertEquals(List.of(first, second), tracker.runs());
        assertEquals(RunStatus.QUEUED, first.status());
        assertTrue(first.id().matches("run_[0-9a-f]{12}"));
    }

    @Test
    void updateTracksExternallyCreatedRuns() {
        InMemoryRunTracker tracker = new InMemoryRunTracker();
        Run run = Run.queued("Molecular Dynamics");
        run.markRunning(EngineTestSupport.NOW);
        tracker.update(run);

        assertSame(run, tracker.find(run.id()).get());
        assertEquals(RunStatus.RUNNING, tracker.find(run.id()).get().status());
        assertTrue(tracker.find("run_000000000000").isEmpty());
    }
}
