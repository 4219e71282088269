package io.mcg.engine.provenance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copy helpers that turn caller supplied maps into read-only payload trees.
 *
 * <p>Numbers are normalized to the types JSON reading yields, so a payload compares equal after
 * a ledger round trip: integral values become {@link Integer} when they fit and {@link Long}
 * otherwise, {@link Float} becomes {@link Double} through its decimal text.
 */
final class Payloads {
    private Payloads() {}

    static Map<String, Object> freeze(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freezeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freeze(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freezeValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Number number) {
            return normalize(number);
        }
        return value;
    }

    static Number normalize(Number number) {
        if (number instanceof Long || number instanceof Short || number instanceof Byte) {
            long integral = number.longValue();
            if (integral >= Integer.MIN_VALUE && integral <= Integer.MAX_VALUE) {
                return Integer.valueOf((int) integral);
            }
            return Long.valueOf(integral);
        }
        if (number instanceof Float) {
            return Double.valueOf(number.toString());
        }
        return number;
    }
}
