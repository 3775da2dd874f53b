package io.streamshub.kafkatopics.support;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyValueParserTest {

    @Test
    void testNullTokensGiveEmptyMap() {
        assertTrue(KeyValueParser.parse("--admin-config", null).isEmpty());
    }

    @Test
    void testPairsKeepCommandLineOrder() {
        Map<String, String> result = KeyValueParser.parse("--admin-config",
                List.of("security.protocol=SASL_SSL", "sasl.mechanism=PLAIN", "client.rack=r1"));

        assertEquals(List.of("security.protocol", "sasl.mechanism", "client.rack"), List.copyOf(result.keySet()));
        assertEquals("SASL_SSL", result.get("security.protocol"));
    }

    @Test
    void testDuplicateKeyLastWriteWins() {
        Map<String, String> result = KeyValueParser.parse("--topic-props",
                List.of("retention.ms=1", "segment.ms=2", "retention.ms=3"));

        assertEquals(Map.of("retention.ms", "3", "segment.ms", "2"), result);
        assertEquals("retention.ms", result.keySet().iterator().next());
    }

    @Test
    void testSplitsOnFirstSeparatorOnly() {
        Map<String, String> result = KeyValueParser.parse("--admin-config", List.of("a=b=c"));
        assertEquals(Map.of("a", "b=c"), result);
    }

    @ParameterizedTest
    @ValueSource(strings = { "foo", "=bar", "foo=", "=", "" })
    void testMalformedTokenRejected(String token) {
        var e = assertThrows(IllegalArgumentException.class,
                () -> KeyValueParser.parse("--topic-props", List.of("ok=1", token)));

        assertEquals("Invalid --topic-props value '" + token + "', expected key=value format", e.getMessage());
    }
}
