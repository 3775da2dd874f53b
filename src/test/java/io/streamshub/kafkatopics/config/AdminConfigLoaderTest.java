package io.streamshub.kafkatopics.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminConfigLoaderTest {

    @TempDir
    Path tempDir;

    AdminConfigLoader loader = new AdminConfigLoader();

    @Test
    void testLoadPropertiesFile() throws IOException {
        Path file = tempDir.resolve("admin.properties");
        Files.writeString(file, """
                # connection settings
                security.protocol=SASL_SSL
                sasl.mechanism=PLAIN
                sasl.jaas.config=org.apache.kafka.common.security.plain.PlainLoginModule required username="u" password="p";
                """);

        Map<String, String> config = loader.load(file);

        assertEquals(3, config.size());
        assertEquals("SASL_SSL", config.get("security.protocol"));
        assertEquals("PLAIN", config.get("sasl.mechanism"));
        assertTrue(config.get("sasl.jaas.config").endsWith("password=\"p\";"));
    }

    @Test
    void testLoadFileWithoutExtensionAsProperties() throws IOException {
        Path file = tempDir.resolve("client.conf");
        Files.writeString(file, "request.timeout.ms=5000\n");

        assertEquals(Map.of("request.timeout.ms", "5000"), loader.load(file));
    }

    @Test
    void testLoadYamlFile() throws IOException {
        Path file = tempDir.resolve("admin.yaml");
        Files.writeString(file, """
                security.protocol: SSL
                request.timeout.ms: 5000
                ssl:
                  truststore:
                    location: /etc/kafka/truststore.jks
                  enabled.protocols:
                    - TLSv1.3
                    - TLSv1.2
                """);

        Map<String, String> config = loader.load(file);

        assertEquals("SSL", config.get("security.protocol"));
        assertEquals("5000", config.get("request.timeout.ms"));
        assertEquals("/etc/kafka/truststore.jks", config.get("ssl.truststore.location"));
        assertEquals("TLSv1.3,TLSv1.2", config.get("ssl.enabled.protocols"));
        assertEquals(4, config.size());
    }

    @Test
    void testLoadEmptyYamlFile() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertTrue(loader.load(file).isEmpty());
    }

    @Test
    void testLoadMissingFile() {
        Path file = tempDir.resolve("missing.properties");

        var e = assertThrows(UncheckedIOException.class, () -> loader.load(file));
        assertTrue(e.getCause().getMessage().contains("Configuration file not found"));
    }

    @Test
    void testLoadMalformedYamlFile() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "- just\n- a list\n");

        var e = assertThrows(UncheckedIOException.class, () -> loader.load(file));
        assertTrue(e.getMessage().startsWith("Failed to load YAML file"));
    }

    @Test
    void testLoadPropertiesFileWithMalformedEscape() throws IOException {
        Path file = tempDir.resolve("admin.properties");
        Files.writeString(file, "sasl.jaas.config=abc\\uZZZZ\n");

        var e = assertThrows(UncheckedIOException.class, () -> loader.load(file));
        assertTrue(e.getMessage().startsWith("Failed to load properties file"));
        assertTrue(e.getCause().getMessage().contains("Malformed"));
    }

    @Test
    void testLoadPropertiesFileKeepsEveryKey() throws IOException {
        Path file = tempDir.resolve("admin.properties");
        Files.writeString(file, "retries=3\nacks=all\nclient.rack=r1\n");

        assertEquals(Map.of("retries", "3", "acks", "all", "client.rack", "r1"), loader.load(file));
    }
}
