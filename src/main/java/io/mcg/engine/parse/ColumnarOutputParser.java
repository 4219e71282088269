package io.mcg.engine.parse;

import io.mcg.engine.config.ParserKind;
import io.mcg.engine.config.ParserSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whitespace separated table. After {@code skip_lines}, every non-blank line becomes a row of
 * strings under {@code data}. Declared {@code columns} additionally become numeric lists, one per
 * column name, taken from the leading columns of each row.
 */
public final class ColumnarOutputParser implements OutputParser {
    public static final String DATA = "data";

    @Override
    public ParserKind kind() {
        return ParserKind.COLUMNAR;
    }

    @Override
    public ParseOutcome parse(Path file, ParserSpec spec) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return ParseOutcome.failure(file, spec.name(), "unreadable: " + ex.getMessage());
        }
        List<List<String>> rows = new ArrayList<>();
        for (int i = Math.min(spec.skipLines(), lines.size()); i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (!line.isEmpty()) {
                rows.add(Arrays.asList(line.split("\\s+")));
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(DATA, rows);
        List<String> columns = spec.columns();
        for (int c = 0; c < columns.size(); c++) {
            List<Double> values = new ArrayList<>(rows.size());
            for (int r = 0; r < rows.size(); r++) {
                List<String> row = rows.get(r);
                if (c >= row.size()) {
                    return ParseOutcome.failure(file, spec.name(), "row " + (r + 1) + " has no column '" + columns.get(c) + "'");
                }
                try {
                    values.add(Double.parseDouble(row.get(c)));
                } catch (NumberFormatException ex) {
                    return ParseOutcome.failure(file, spec.name(),
                        "row " + (r + 1) + ", column '" + columns.get(c) + "' is not numeric: " + row.get(c));
                }
            }
            fields.put(columns.get(c), values);
        }
        return ParseOutcome.success(file, spec.name(), fields);
    }
}
