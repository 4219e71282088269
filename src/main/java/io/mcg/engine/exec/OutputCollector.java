package io.mcg.engine.exec;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the regular files in a work directory that match any of the expected-output globs.
 * Files the engine rendered itself can be excluded so inputs are never read back as results.
 */
public final class OutputCollector {
    private OutputCollector() {}

    public static List<Path> collect(Path workDir, List<String> globs) {
        return collect(workDir, globs, List.of());
    }

    public static List<Path> collect(Path workDir, List<String> globs, Collection<Path> excluded) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        Set<Path> skipped = new HashSet<>();
        for (Path path : excluded) {
            skipped.add(path.toAbsolutePath().normalize());
        }
        try (Stream<Path> entries = Files.list(workDir)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> !skipped.contains(path.toAbsolutePath().normalize()))
                .filter(path -> matchesAny(matchers, path.getFileName()))
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list outputs in " + workDir, ex);
        }
    }

    public static boolean matches(String glob, Path file) {
        return FileSystems.getDefault().getPathMatcher("glob:" + glob).matches(file.getFileName());
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path name) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }
}
