package io.mcg.engine.parse;

import io.mcg.engine.config.ParserKind;
import io.mcg.engine.config.ParserSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Collects every match of each declared pattern. A match contributes the whole match when the
 * pattern has no group, the group when it has one, and the list of groups otherwise. Patterns
 * that never match produce no field.
 */
public final class RegexOutputParser implements OutputParser {
    @Override
    public ParserKind kind() {
        return ParserKind.REGEX;
    }

    @Override
    public ParseOutcome parse(Path file, ParserSpec spec) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return ParseOutcome.failure(file, spec.name(), "unreadable: " + ex.getMessage());
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (var entry : spec.patterns().entrySet()) {
            Matcher matcher = entry.getValue().matcher(content);
            List<Object> matches = new ArrayList<>();
            while (matcher.find()) {
                matches.add(extract(matcher));
            }
            if (!matches.isEmpty()) {
                fields.put(entry.getKey(), matches);
            }
        }
        return ParseOutcome.success(file, spec.name(), fields);
    }

    private static Object extract(Matcher matcher) {
        int groups = matcher.groupCount();
        if (groups == 0) {
            return matcher.group();
        }
        if (groups == 1) {
            return nullToEmpty(matcher.group(1));
        }
        List<String> values = new ArrayList<>(groups);
        for (int i = 1; i <= groups; i++) {
            values.add(nullToEmpty(matcher.group(i)));
        }
        return values;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
