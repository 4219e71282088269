package io.mcg.engine.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcg.engine.config.ParserKind;
import io.mcg.engine.config.ParserSpec;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Top-level object fields become result fields; any other JSON value lands under {@code value}. */
public final class JsonOutputParser implements OutputParser {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public ParserKind kind() {
        return ParserKind.JSON;
    }

    @Override
    public ParseOutcome parse(Path file, ParserSpec spec) {
        Object value;
        try {
            value = JSON.readValue(file.toFile(), Object.class);
        } catch (IOException ex) {
            return ParseOutcome.failure(file, spec.name(), "json parse error: " + ex.getMessage());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            for (var entry : map.entrySet()) {
                fields.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else {
            fields.put("value", value);
        }
        return ParseOutcome.success(file, spec.name(), fields);
    }
}
