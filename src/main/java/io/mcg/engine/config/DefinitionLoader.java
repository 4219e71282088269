package io.mcg.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads job definition documents (JSON, YAML or TOML) into plain maps and hands them to
 * {@link JobDefinitionParser}. The document key is the file name without its extension.
 */
public final class DefinitionLoader {
    public static final List<String> EXTENSIONS = List.of("json", "yaml", "yml", "toml");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DefinitionLoader() {}

    public static boolean isDefinitionFile(Path path) {
        return Files.isRegularFile(path) && EXTENSIONS.contains(extension(path));
    }

    public static JobDefinition load(Path path) {
        return JobDefinitionParser.parse(stem(path), read(path), path);
    }

    public static Map<String, Object> read(Path path) {
        String extension = extension(path);
        try {
            return switch (extension) {
                case "json" -> readJackson(JSON_MAPPER, path);
                case "yaml", "yml" -> readJackson(YAML_MAPPER, path);
                case "toml" -> readToml(path);
                default -> throw new ConfigurationException("Unsupported definition format: " + path.getFileName(), EXTENSIONS);
            };
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read job definition: " + path, ex);
        }
    }

    private static Map<String, Object> readJackson(ObjectMapper mapper, Path path) throws IOException {
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = mapper.readTree(in);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new ConfigurationException(path.getFileName() + ": empty job definition");
        }
        if (!root.isObject()) {
            throw new ConfigurationException(path.getFileName() + ": job definition must be an object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> document = (Map<String, Object>) convertNode(root);
        return document;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static Map<String, Object> readToml(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        if (result.hasErrors()) {
            List<String> errors = new ArrayList<>();
            result.errors().forEach(error -> errors.add(error.toString()));
            throw new ConfigurationException(path.getFileName() + ": invalid TOML: " + String.join("; ", errors));
        }
        return convertTable(result);
    }

    static Map<String, Object> convertTable(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : table.entrySet()) {
            map.put(entry.getKey(), convertToml(entry.getValue()));
        }
        return map;
    }

    private static Object convertToml(Object value) {
        if (value instanceof TomlTable table) {
            return convertTable(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertToml(array.get(i)));
            }
            return list;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean || value == null) {
            return value;
        }
        // dates and times
        return value.toString();
    }

    static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String extension(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
