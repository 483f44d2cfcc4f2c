package work.snakeunit.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
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

/**
 * Reads {@link ConfigFile}s in YAML ({@code .yaml}/{@code .yml}) or TOML ({@code .toml}).
 */
final class ConfigFileLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigFileLoader() {}

    static ConfigFile load(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        Map<String, Object> values;
        try {
            String raw = Files.readString(path, StandardCharsets.UTF_8);
            if (name.endsWith(".toml")) {
                values = parseToml(raw, path);
            } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                values = parseYaml(raw, path);
            } else {
                throw new IllegalArgumentException("Unsupported config file type (expected .yaml, .yml or .toml): " + path);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read config file: " + path, ex);
        }
        return toConfigFile(values, path);
    }

    private static Map<String, Object> parseYaml(String raw, Path path) throws IOException {
        JsonNode root = YAML_MAPPER.readTree(raw);
        Map<String, Object> values = new LinkedHashMap<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return values;
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Config file must contain a mapping: " + path);
        }
        var fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            values.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return values;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry -> map.put(entry.getKey(), convertNode(entry.getValue())));
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonNode item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static Map<String, Object> parseToml(String raw, Path path) {
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            throw new IllegalArgumentException(
                "Invalid TOML in config file " + path + ": " + result.errors().get(0).toString()
            );
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (String key : result.keySet()) {
            Object value = result.get(List.of(key));
            if (value instanceof TomlArray array) {
                values.put(key, array.toList());
            } else {
                values.put(key, value);
            }
        }
        return values;
    }

    private static ConfigFile toConfigFile(Map<String, Object> values, Path path) {
        for (String key : values.keySet()) {
            if (!ConfigFile.KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown key \"" + key + "\" in config file " + path);
            }
        }
        return new ConfigFile(
            scalar(values, "snakefile", path),
            scalar(values, "pipeline-dir", path),
            scalar(values, "pipeline-run-dir", path),
            scalar(values, "snakemake-log", path),
            scalar(values, "output-test-dir", path),
            scalar(values, "inst-dir", path),
            list(values, "exclude-rules", path),
            list(values, "added-files", path),
            list(values, "added-directories", path),
            list(values, "comparison-exclusions", path),
            flag(values, "include-entire-dag", path),
            list(values, "update", path)
        );
    }

    private static String scalar(Map<String, Object> values, String key, Path path) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> || value instanceof Map<?, ?>) {
            throw new IllegalArgumentException("Config key \"" + key + "\" must be a single value in " + path);
        }
        return String.valueOf(value);
    }

    private static List<String> list(Map<String, Object> values, String key, Path path) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof List<?> || item instanceof Map<?, ?>) {
                    throw new IllegalArgumentException("Config key \"" + key + "\" must be a flat list in " + path);
                }
                result.add(String.valueOf(item));
            }
        } else {
            result.add(String.valueOf(value));
        }
        return result;
    }

    private static Boolean flag(Map<String, Object> values, String key, Path path) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.valueOf(text);
        }
        throw new IllegalArgumentException("Config key \"" + key + "\" must be true or false in " + path);
    }
}
