package io.mcg.engine.parse;

import io.mcg.engine.config.ParserKind;
import io.mcg.engine.config.ParserSpec;
import java.nio.file.Path;

/** Extracts result fields from one output file. Implementations report failures in the outcome. */
public interface OutputParser {
    ParserKind kind();

    ParseOutcome parse(Path file, ParserSpec spec);

    static OutputParser forKind(ParserKind kind) {
        return switch (kind) {
            case JSON -> new JsonOutputParser();
            case REGEX -> new RegexOutputParser();
            case COLUMNAR -> new ColumnarOutputParser();
            case CSV -> new CsvOutputParser();
        };
    }
}
