package io.mcg.engine.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Enum constant that appears as a string tag inside job definitions ({@code "type": "regex"}).
 * Unknown tags are rejected while the definition loads.
 */
public interface DefinitionTag {
    String wireName();

    static <E extends Enum<E> & DefinitionTag> E parse(Class<E> type, Object raw, String where) {
        if (raw != null) {
            String value = raw.toString().trim();
            for (E constant : type.getEnumConstants()) {
                if (constant.wireName().equalsIgnoreCase(value)) {
                    return constant;
                }
            }
        }
        throw new ConfigurationException(where + ": unsupported value '" + raw + "'", wireNames(type));
    }

    static <E extends Enum<E> & DefinitionTag> List<String> wireNames(Class<E> type) {
        List<String> names = new ArrayList<>();
        for (E constant : type.getEnumConstants()) {
            names.add(constant.wireName());
        }
        return names;
    }
}
