package io.streamshub.kafkatopics.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Loads Admin client properties from a file given with {@code --command-config}.
 * Files named {@code *.yaml} or {@code *.yml} are read as YAML, anything else as
 * Java properties.
 */
@ApplicationScoped
public class AdminConfigLoader {

    private static final TypeReference<Map<String, Object>> MAPPING = new TypeReference<>() { };

    private final ObjectMapper yamlMapper;

    public AdminConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public Map<String, String> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new IOException("Configuration file not found: " + path));
        }

        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            return parseYamlFile(path);
        }

        return parsePropertiesFile(path);
    }

    private Map<String, String> parsePropertiesFile(Path path) {
        Properties props = new Properties();

        try (BufferedReader reader = Files.newBufferedReader(path)) {
            props.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load properties file: " + path, e);
        } catch (IllegalArgumentException e) {
            // thrown for a malformed unicode escape
            throw new UncheckedIOException("Failed to load properties file: " + path,
                    new IOException(e.getMessage(), e));
        }

        Map<String, String> result = new LinkedHashMap<>();
        props.stringPropertyNames()
                .forEach(key -> result.put(key, props.getProperty(key)));
        return result;
    }

    /**
     * Read a YAML mapping. Nested mappings are flattened into dotted keys and
     * sequences into comma separated values, the form Kafka list settings take.
     */
    private Map<String, String> parseYamlFile(Path path) {
        JsonNode document;

        try {
            document = yamlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load YAML file: " + path, e);
        }

        Map<String, String> result = new LinkedHashMap<>();

        if (document == null || document.isMissingNode() || document.isNull()) {
            return result;
        }

        if (!document.isObject()) {
            throw new UncheckedIOException("Failed to load YAML file: " + path,
                    new IOException("Expected a mapping of Admin client properties"));
        }

        flatten("", yamlMapper.convertValue(document, MAPPING), result);
        return result;
    }

    private void flatten(String prefix, Map<?, ?> source, Map<String, String> target) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map<?, ?> nested) {
                flatten(key + ".", nested, target);
            } else if (value instanceof Collection<?> values) {
                target.put(key, values.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else {
                target.put(key, value != null ? String.valueOf(value) : "");
            }
        }
    }
}
