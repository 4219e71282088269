package io.mcg.engine.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merged fields of one run. {@code defaulted} is set when nothing parsed and the definition's
 * default results were used instead.
 */
public record ParsedResults(Map<String, Object> fields, List<ParseOutcome> outcomes, boolean defaulted) {
    public ParsedResults {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        outcomes = List.copyOf(outcomes);
    }

    public List<ParseError> errors() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).map(outcome -> outcome.error().get())
            .collect(Collectors.toList());
    }
}
