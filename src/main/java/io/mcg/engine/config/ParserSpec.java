package io.mcg.engine.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Declared output parser. Regex patterns are keyed by result field; patterns declared as a plain
 * list get the keys {@code matches_0}, {@code matches_1}, ...
 */
public record ParserSpec(
    String name,
    ParserKind kind,
    Map<String, Pattern> patterns,
    int skipLines,
    List<String> columns,
    char delimiter,
    boolean header
) {
    public ParserSpec {
        Objects.requireNonNull(kind, "kind");
        patterns = patterns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (skipLines < 0) {
            throw new IllegalArgumentException("skipLines must not be negative");
        }
    }

    public static ParserSpec of(ParserKind kind) {
        return new ParserSpec(kind.wireName(), kind, Map.of(), 0, List.of(), ',', true);
    }
}
