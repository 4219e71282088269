package io.mcg.engine.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Execution backend section of a definition ({@code execution.local}, {@code execution.docker},
 * {@code execution.hpc}). Keys beyond the common ones stay in {@code settings} and are read by
 * the backend that understands them.
 */
public record BackendSpec(
    BackendKind kind,
    String executable,
    String commandTemplate,
    Map<String, String> environment,
    Optional<Duration> timeout,
    Map<String, Object> settings
) {
    public static final String DEFAULT_COMMAND_TEMPLATE = "{executable} {input_file}";

    public BackendSpec {
        Objects.requireNonNull(kind, "kind");
        executable = executable == null || executable.isBlank() ? "echo" : executable;
        commandTemplate = commandTemplate == null || commandTemplate.isBlank() ? DEFAULT_COMMAND_TEMPLATE : commandTemplate;
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        timeout = timeout == null ? Optional.empty() : timeout;
        settings = settings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    public static BackendSpec local(String executable) {
        return new BackendSpec(BackendKind.LOCAL, executable, null, null, null, null);
    }

    public Optional<String> setting(String key) {
        Object value = settings.get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    public String setting(String key, String fallback) {
        return setting(key).orElse(fallback);
    }

    public List<String> listSetting(String key) {
        Object value = settings.get(key);
        List<String> values = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                values.add(String.valueOf(item));
            }
        } else if (value != null && !value.toString().isBlank()) {
            values.add(value.toString());
        }
        return values;
    }
}
