package io.mcg.engine.template;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Files written into a work directory for one run, keyed as declared. */
public record RenderedFiles(Optional<Path> inputFile, Map<String, Path> files, Optional<Path> script) {
    public RenderedFiles {
        inputFile = inputFile == null ? Optional.empty() : inputFile;
        files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        script = script == null ? Optional.empty() : script;
    }

    /** Every written path: the input, the extra files, then the script. */
    public List<Path> paths() {
        List<Path> paths = new ArrayList<>();
        inputFile.ifPresent(paths::add);
        paths.addAll(files.values());
        script.ifPresent(paths::add);
        return paths;
    }

    public int count() {
        return files.size() + (inputFile.isPresent() ? 1 : 0) + (script.isPresent() ? 1 : 0);
    }
}
