package io.mcg.engine.api;

import io.mcg.engine.config.ParsePolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of an {@link McgEngine}. Without a ledger path the provenance store lives in
 * memory only. The artifact root defaults to the ledger's directory; without either, large
 * content such as run logs stays inline in asset payloads.
 */
public record EngineConfiguration(
    Path definitionsDirectory,
    Optional<Path> ledgerPath,
    Optional<Path> artifactRoot,
    Path workRoot,
    Duration defaultTimeout,
    ParsePolicy parsePolicy,
    String runnerVersion
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_RUNNER_VERSION = "0.1.0";

    public EngineConfiguration {
        Objects.requireNonNull(definitionsDirectory, "definitionsDirectory");
        Objects.requireNonNull(ledgerPath, "ledgerPath");
        Objects.requireNonNull(artifactRoot, "artifactRoot");
        Objects.requireNonNull(workRoot, "workRoot");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(parsePolicy, "parsePolicy");
        Objects.requireNonNull(runnerVersion, "runnerVersion");
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path definitionsDirectory = Path.of("configs");
        private Optional<Path> ledgerPath = Optional.empty();
        private Optional<Path> artifactRoot = Optional.empty();
        private Path workRoot = Path.of(System.getProperty("java.io.tmpdir"), "mcg-work");
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private ParsePolicy parsePolicy = ParsePolicy.IGNORE;
        private String runnerVersion = DEFAULT_RUNNER_VERSION;

        public Builder definitionsDirectory(Path definitionsDirectory) {
            this.definitionsDirectory = definitionsDirectory;
            return this;
        }

        public Builder ledgerPath(Path ledgerPath) {
            this.ledgerPath = Optional.ofNullable(ledgerPath);
            return this;
        }

        public Builder artifactRoot(Path artifactRoot) {
            this.artifactRoot = Optional.ofNullable(artifactRoot);
            return this;
        }

        public Builder workRoot(Path workRoot) {
            this.workRoot = workRoot;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder parsePolicy(ParsePolicy parsePolicy) {
            this.parsePolicy = parsePolicy;
            return this;
        }

        public Builder runnerVersion(String runnerVersion) {
            this.runnerVersion = runnerVersion;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(
                definitionsDirectory,
                ledgerPath,
                artifactRoot.or(() -> ledgerPath.map(path -> path.toAbsolutePath().getParent())),
                workRoot,
                defaultTimeout,
                parsePolicy,
                runnerVersion
            );
        }
    }
}
