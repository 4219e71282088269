package io.mcg.engine.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fresh per-run scratch directory, deleted with its contents on close. */
public final class WorkDirectory implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WorkDirectory.class);

    private final Path path;

    private WorkDirectory(Path path) {
        this.path = path;
    }

    public static WorkDirectory create(Path root, String runId) {
        try {
            Files.createDirectories(root);
            return new WorkDirectory(Files.createTempDirectory(root, runId + "-"));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to create work directory under " + root, ex);
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException ex) {
            LOG.warn("Could not list work directory {} for removal: {}", path, ex.getMessage());
            return;
        }
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException ex) {
                LOG.warn("Could not remove {}: {}", entry, ex.getMessage());
            }
        }
    }
}
