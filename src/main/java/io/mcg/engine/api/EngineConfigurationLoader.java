package io.mcg.engine.api;

import io.mcg.engine.config.ConfigurationException;
import io.mcg.engine.config.DefinitionTag;
import io.mcg.engine.config.ParsePolicy;
import io.mcg.engine.shared.Durations;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Reads engine settings from {@code mcg.toml}.
 *
 * <p>The file is taken from the explicit path when given, else {@code $MCG_CONFIG_PATH}, else the
 * working directory, else {@code ~/.mcg/mcg.toml}. Without a file the defaults apply: definitions
 * in {@code configs/}, ledger at {@code ~/.mcg/ledger.json}. {@code $MCG_STORAGE_PATH} always
 * overrides the ledger location. Artifacts such as run logs go next to the ledger unless
 * {@code storage.artifacts} names another directory. Relative paths resolve against the settings
 * file's directory.
 *
 * <pre>
 * [engine]
 * definitions = "configs"
 * work_root = "/tmp/mcg-work"
 * default_timeout = "60s"
 * parse_policy = "ignore"
 * runner_version = "0.1.0"
 *
 * [storage]
 * ledger = "data/ledger.json"
 * artifacts = "data/artifacts"
 * </pre>
 */
public final class EngineConfigurationLoader {
    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigurationLoader.class);

    public static final String FILE_NAME = "mcg.toml";
    public static final String CONFIG_PATH_ENV = "MCG_CONFIG_PATH";
    public static final String STORAGE_PATH_ENV = "MCG_STORAGE_PATH";
    public static final String LEDGER_FILE = "ledger.json";

    private final Map<String, String> environment;
    private final Path workingDirectory;
    private final Path home;

    public EngineConfigurationLoader() {
        this(System.getenv(), Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
    }

    public EngineConfigurationLoader(Map<String, String> environment, Path workingDirectory, Path home) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.workingDirectory = workingDirectory;
        this.home = home;
    }

    public EngineConfiguration load() {
        return load(null);
    }

    public EngineConfiguration load(Path explicit) {
        Optional<Path> file = locate(explicit);
        var builder = EngineConfiguration.builder()
            .definitionsDirectory(workingDirectory.resolve("configs"))
            .ledgerPath(home.resolve(".mcg").resolve(LEDGER_FILE));
        if (file.isPresent()) {
            apply(builder, file.get());
        } else {
            LOG.info("No {} found, using default engine settings", FILE_NAME);
        }
        String storage = environment.get(STORAGE_PATH_ENV);
        if (storage != null && !storage.isBlank()) {
            Path location = Path.of(storage.trim());
            builder.ledgerPath(location.toString().endsWith(".json") ? location : location.resolve(LEDGER_FILE));
        }
        return builder.build();
    }

    Optional<Path> locate(Path explicit) {
        if (explicit != null) {
            if (!Files.isRegularFile(explicit)) {
                throw new ConfigurationException("Engine settings file not found: " + explicit);
            }
            return Optional.of(explicit);
        }
        List<Path> candidates = new ArrayList<>();
        String fromEnv = environment.get(CONFIG_PATH_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            candidates.add(Path.of(fromEnv.trim()));
        }
        candidates.add(workingDirectory.resolve(FILE_NAME));
        candidates.add(home.resolve(".mcg").resolve(FILE_NAME));
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private void apply(EngineConfiguration.Builder builder, Path file) {
        TomlParseResult toml;
        try {
            toml = Toml.parse(file);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read engine settings: " + file, ex);
        }
        if (toml.hasErrors()) {
            throw new ConfigurationException(file + ": invalid TOML: " + toml.errors().get(0));
        }
        Path base = file.toAbsolutePath().getParent();
        String definitions = toml.getString("engine.definitions");
        if (definitions != null) {
            builder.definitionsDirectory(base.resolve(definitions));
        }
        String workRoot = toml.getString("engine.work_root");
        if (workRoot != null) {
            builder.workRoot(base.resolve(workRoot));
        }
        Object timeout = toml.get("engine.default_timeout");
        if (timeout != null) {
            try {
                Durations.parse(timeout).ifPresent(builder::defaultTimeout);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException(file + ": engine.default_timeout: " + ex.getMessage(), ex);
            }
        }
        String policy = toml.getString("engine.parse_policy");
        if (policy != null) {
            builder.parsePolicy(DefinitionTag.parse(ParsePolicy.class, policy, file + ": engine.parse_policy"));
        }
        String runnerVersion = toml.getString("engine.runner_version");
        if (runnerVersion != null) {
            builder.runnerVersion(runnerVersion);
        }
        String ledger = toml.getString("storage.ledger");
        if (ledger != null) {
            builder.ledgerPath(base.resolve(ledger));
        }
        String artifacts = toml.getString("storage.artifacts");
        if (artifacts != null) {
            builder.artifactRoot(base.resolve(artifacts));
        }
        LOG.info("Loaded engine settings from {}", file);
    }
}
