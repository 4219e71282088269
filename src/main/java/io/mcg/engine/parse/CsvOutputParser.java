package io.mcg.engine.parse;

import io.mcg.engine.config.ParserKind;
import io.mcg.engine.config.ParserSpec;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/** Delimited text; each record becomes a map under {@code rows}, keyed by header or column index. */
public final class CsvOutputParser implements OutputParser {
    public static final String ROWS = "rows";

    @Override
    public ParserKind kind() {
        return ParserKind.CSV;
    }

    @Override
    public ParseOutcome parse(Path file, ParserSpec spec) {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
            .setDelimiter(spec.delimiter())
            .setTrim(true);
        if (spec.header()) {
            builder.setHeader().setSkipHeaderRecord(true);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, builder.build())) {
            List<String> headers = parser.getHeaderNames();
            boolean hasHeader = headers != null && !headers.isEmpty();
            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                if (hasHeader) {
                    for (String header : headers) {
                        row.put(header, record.isSet(header) ? record.get(header) : "");
                    }
                } else {
                    for (int i = 0; i < record.size(); i++) {
                        row.put(String.valueOf(i), record.get(i));
                    }
                }
                rows.add(row);
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(ROWS, rows);
            return ParseOutcome.success(file, spec.name(), fields);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            return ParseOutcome.failure(file, spec.name(), "csv parse error: " + ex.getMessage());
        }
    }
}
