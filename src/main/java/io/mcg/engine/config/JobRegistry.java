package io.mcg.engine.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable snapshot of the job definitions in a directory, addressable by file stem or by the
 * declared display name. Lookups ignore case, whitespace, underscores and hyphens.
 */
public final class JobRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);

    private final Optional<Path> directory;
    private volatile Snapshot snapshot;

    private JobRegistry(Optional<Path> directory, Snapshot snapshot) {
        this.directory = directory;
        this.snapshot = snapshot;
    }

    public static JobRegistry load(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        return new JobRegistry(Optional.of(normalized), scan(normalized));
    }

    public static JobRegistry of(JobDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static JobRegistry of(List<JobDefinition> definitions) {
        return new JobRegistry(Optional.empty(), index(definitions));
    }

    /** Re-reads the directory; the previous snapshot stays in place if the new one fails to load. */
    public JobRegistry reload() {
        directory.ifPresent(dir -> snapshot = scan(dir));
        return this;
    }

    public Optional<Path> directory() {
        return directory;
    }

    public JobDefinition find(String name) {
        return lookup(name).orElseThrow(() -> new ConfigurationException(
            name == null || name.isBlank() ? "No job name given" : "Unknown job '" + name + "'", names()));
    }

    public Optional<JobDefinition> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.byKey().get(normalize(name)));
    }

    public List<JobDefinition> definitions() {
        return snapshot.definitions();
    }

    /** Display names, sorted. */
    public List<String> names() {
        return new ArrayList<>(snapshot.definitions().stream()
            .map(JobDefinition::name)
            .collect(Collectors.toCollection(TreeSet::new)));
    }

    public static String normalize(String name) {
        StringBuilder normalized = new StringBuilder(name.length());
        for (char c : name.toLowerCase(Locale.ROOT).toCharArray()) {
            if (!Character.isWhitespace(c) && c != '_' && c != '-') {
                normalized.append(c);
            }
        }
        return normalized.toString();
    }

    private static Snapshot scan(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new ConfigurationException("Job definitions directory not found: " + directory);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(DefinitionLoader::isDefinitionFile).sorted().collect(Collectors.toList());
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to list job definitions in " + directory, ex);
        }
        List<JobDefinition> definitions = new ArrayList<>();
        for (Path file : files) {
            definitions.add(DefinitionLoader.load(file));
        }
        Snapshot loaded = index(definitions);
        LOG.info("Loaded {} job definition(s) from {}", definitions.size(), directory);
        return loaded;
    }

    private static Snapshot index(List<JobDefinition> definitions) {
        Map<String, JobDefinition> byKey = new LinkedHashMap<>();
        for (JobDefinition definition : definitions) {
            for (String alias : List.of(definition.key(), definition.name())) {
                String normalized = normalize(alias);
                JobDefinition existing = byKey.putIfAbsent(normalized, definition);
                if (existing != null && existing != definition) {
                    throw new ConfigurationException("Job name '" + alias + "' is declared by both '"
                        + existing.key() + "' and '" + definition.key() + "'");
                }
            }
        }
        return new Snapshot(List.copyOf(definitions), Collections.unmodifiableMap(byKey));
    }

    private record Snapshot(List<JobDefinition> definitions, Map<String, JobDefinition> byKey) {}
}
