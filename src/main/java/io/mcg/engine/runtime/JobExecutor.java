package io.mcg.engine.runtime;

import io.mcg.engine.api.EngineConfiguration;
import io.mcg.engine.api.ExecutionReport;
import io.mcg.engine.config.BackendKind;
import io.mcg.engine.config.BackendSpec;
import io.mcg.engine.config.ConfigurationException;
import io.mcg.engine.config.JobDefinition;
import io.mcg.engine.config.JobRegistry;
import io.mcg.engine.config.MethodSpec;
import io.mcg.engine.exec.Backends;
import io.mcg.engine.exec.ExecutionBackend;
import io.mcg.engine.exec.ExecutionRequest;
import io.mcg.engine.exec.ExecutionResult;
import io.mcg.engine.exec.OutputCollector;
import io.mcg.engine.exec.ProcessRunner;
import io.mcg.engine.materialize.MaterializedRun;
import io.mcg.engine.materialize.ResultMaterializer;
import io.mcg.engine.parse.ParsedResults;
import io.mcg.engine.parse.ResultCollector;
import io.mcg.engine.provenance.ArtifactStore;
import io.mcg.engine.provenance.Asset;
import io.mcg.engine.provenance.ProvenanceStore;
import io.mcg.engine.provenance.Run;
import io.mcg.engine.resolve.MethodResolver;
import io.mcg.engine.resolve.Resolution;
import io.mcg.engine.template.ContextBuilder;
import io.mcg.engine.template.RenderContext;
import io.mcg.engine.template.RenderedFiles;
import io.mcg.engine.template.TemplateRenderer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job synchronously: resolve the method, render its inputs into a fresh work directory,
 * dispatch to a backend, parse the outputs and record assets and lineage. A failure at any step
 * marks the run as errored and is rethrown; nothing is produced for a failed run.
 */
public final class JobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutor.class);

    private final EngineConfiguration configuration;
    private final JobRegistry registry;
    private final ProvenanceStore store;
    private final RunTracker tracker;
    private final ProcessRunner runner;
    private final Clock clock;
    private final Optional<ArtifactStore> artifacts;

    public JobExecutor(EngineConfiguration configuration, JobRegistry registry, ProvenanceStore store,
                       RunTracker tracker, ProcessRunner runner, Clock clock) {
        this.configuration = configuration;
        this.artifacts = configuration.artifactRoot().map(ArtifactStore::new);
        this.registry = registry;
        this.store = store;
        this.tracker = tracker;
        this.runner = runner;
        this.clock = clock;
    }

    public ExecutionReport execute(String jobName, Run run, List<Asset> inputs, Map<String, Object> params) {
        List<Asset> assets = inputs == null ? List.of() : List.copyOf(inputs);
        Map<String, Object> given = params == null ? Map.of() : params;
        try {
            run.setRunnerVersion(configuration.runnerVersion());
            run.markRunning(clock.instant());
            tracker.update(run);
            JobDefinition definition = registry.find(jobName);
            validateInputs(assets);

            Resolution resolution = MethodResolver.resolveWithReason(definition, given);
            MethodSpec method = definition.method(resolution.method()).orElseThrow();
            LOG.info("Run {}: {} method {}", run.id(), definition.name(), resolution);

            ContextBuilder.requireNeeds(definition, method, assets, given);
            RenderContext context = ContextBuilder.build(definition, method, assets, given, clock.instant());
            LOG.debug("Run {} context keys: {}", run.id(), context.values().keySet());

            MaterializedRun materialized;
            try (WorkDirectory workDir = WorkDirectory.create(configuration.workRoot(), run.id())) {
                RenderedFiles files = new TemplateRenderer(definition).renderFiles(method, context, assets, workDir.path());
                ExecutionResult execution = dispatch(run, definition, method, given, files, workDir.path());
                List<Path> outputs = OutputCollector.collect(workDir.path(),
                    ResultCollector.discoveryGlobs(definition, method), files.paths());
                ParsedResults parsed = new ResultCollector(definition, method, configuration.parsePolicy()).collect(outputs);
                if (parsed.defaulted()) {
                    LOG.info("Run {}: no parsable outputs, using default results", run.id());
                }
                materialized = new ResultMaterializer(definition, artifacts)
                    .materialize(run, method.name(), assets, given, parsed, execution, clock.instant());
            }

            store.putAll(materialized.assets());
            store.append(materialized.edges());
            run.markDone(clock.instant());
            tracker.update(run);
            LOG.info("Run {} done: results {}", run.id(), materialized.results().id());
            return new ExecutionReport(materialized.assets(), materialized.edges(), run);
        } catch (RuntimeException ex) {
            if (!run.status().isTerminal()) {
                run.markError(clock.instant(), ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
                tracker.update(run);
            }
            LOG.error("Run {} of '{}' failed: {}", run.id(), jobName, ex.getMessage());
            throw ex;
        }
    }

    private static void validateInputs(List<Asset> assets) {
        for (Asset asset : assets) {
            List<String> problems = asset.payload().validate();
            if (!problems.isEmpty()) {
                throw new ConfigurationException("Input asset " + asset.id() + " (" + asset.kind().wireName()
                    + ") is invalid: " + String.join("; ", problems));
            }
        }
    }

    private ExecutionResult dispatch(Run run, JobDefinition definition, MethodSpec method, Map<String, Object> params,
                                     RenderedFiles files, Path workDir) {
        BackendKind kind = Backends.select(definition, method, params);
        BackendSpec backendSpec = Backends.spec(definition, kind);
        ExecutionBackend backend = Backends.create(kind, runner);
        String command = Backends.command(backendSpec, method, files, backend.visibleWorkDir(workDir));
        Duration timeout = Backends.timeout(method, backendSpec, configuration.defaultTimeout());
        LOG.debug("Run {} dispatching to {} with timeout {}", run.id(), kind.wireName(), timeout);
        return backend.execute(new ExecutionRequest(run.id(), definition.name(), method.name(), backendSpec, workDir,
            command, timeout));
    }
}
