package io.mcg.engine.api;

import io.mcg.engine.config.ConfigurationException;
import io.mcg.engine.config.JobRegistry;
import io.mcg.engine.exec.ProcessRunner;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.JsonLedgerStore;
import io.mcg.engine.provenance.LineageTrace;
import io.mcg.engine.provenance.ProvenanceStore;
import io.mcg.engine.provenance.Run;
import io.mcg.engine.runtime.InMemoryRunTracker;
import io.mcg.engine.runtime.JobExecutor;
import io.mcg.engine.runtime.RunTracker;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Public entry point for embedding the engine: executes jobs from the registry and records
 * their lineage in the provenance store.
 */
public final class McgEngine {
    private final EngineConfiguration configuration;
    private final JobRegistry registry;
    private final ProvenanceStore store;
    private final RunTracker runs;
    private final JobExecutor executor;

    public McgEngine(EngineConfiguration configuration) {
        this(configuration,
            JobRegistry.load(configuration.definitionsDirectory()),
            configuration.ledgerPath().map(JsonLedgerStore::open).orElseGet(JsonLedgerStore::inMemory),
            new InMemoryRunTracker());
    }

    public McgEngine(EngineConfiguration configuration, JobRegistry registry, ProvenanceStore store, RunTracker runs) {
        this(configuration, registry, store, runs, Clock.systemUTC());
    }

    public McgEngine(EngineConfiguration configuration, JobRegistry registry, ProvenanceStore store, RunTracker runs,
                     Clock clock) {
        this.configuration = configuration;
        this.registry = registry;
        this.store = store;
        this.runs = runs;
        this.executor = new JobExecutor(configuration, registry, store, runs, new ProcessRunner(), clock);
    }

    /** Loads settings from the process environment and opens the configured ledger. */
    public static McgEngine fromSettings() {
        return fromSettings(new EngineConfigurationLoader(), null);
    }

    /**
     * Loads settings through {@code loader}, from {@code settingsFile} when given, and opens the
     * configured ledger.
     */
    public static McgEngine fromSettings(EngineConfigurationLoader loader, Path settingsFile) {
        return new McgEngine(loader.load(settingsFile));
    }

    public ExecutionReport execute(String jobName, Run run, List<Asset> inputs, Map<String, Object> params) {
        return executor.execute(jobName, run, inputs, params);
    }

    /**
     * Creates a run through the tracker, looks the input assets up in the store and executes.
     *
     * @throws ConfigurationException if any asset id is unknown
     */
    public ExecutionReport submit(String jobName, List<String> assetIds, Map<String, Object> params) {
        List<String> ids = assetIds == null ? List.of() : assetIds;
        List<Asset> inputs = store.getMany(ids);
        if (inputs.size() != ids.size()) {
            List<String> missing = new ArrayList<>();
            for (String id : ids) {
                if (store.get(id).isEmpty()) {
                    missing.add(id);
                }
            }
            throw new ConfigurationException("Unknown asset id(s): " + missing);
        }
        Run run = runs.create(registry.lookup(jobName).map(definition -> definition.name()).orElse(jobName));
        return execute(jobName, run, inputs, params);
    }

    public String lineage(String runId) {
        return LineageTrace.render(store, runId);
    }

    public Optional<Run> run(String runId) {
        return runs.find(runId);
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public ProvenanceStore store() {
        return store;
    }

    public JobRegistry registry() {
        return registry;
    }

    public RunTracker runs() {
        return runs;
    }
}
