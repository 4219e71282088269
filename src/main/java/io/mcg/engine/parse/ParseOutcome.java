package io.mcg.engine.parse;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Result of parsing one file: extracted fields, or the error that prevented it. */
public record ParseOutcome(Path file, String parser, Map<String, Object> fields, Optional<ParseError> error) {
    public ParseOutcome {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        error = error == null ? Optional.empty() : error;
    }

    public static ParseOutcome success(Path file, String parser, Map<String, Object> fields) {
        return new ParseOutcome(file, parser, fields, Optional.empty());
    }

    public static ParseOutcome failure(Path file, String parser, String message) {
        return new ParseOutcome(file, parser, Map.of(),
            Optional.of(new ParseError(file.getFileName().toString(), parser, message)));
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }
}
