package io.streamshub.kafkatopics.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stages {@code key=value} command line tokens into an ordered map.
 */
public final class KeyValueParser {

    private static final char SEPARATOR = '=';

    private KeyValueParser() {
    }

    /**
     * Parse a list of {@code key=value} tokens. Each token is split on its
     * first {@code =}, so values may themselves contain {@code =}. Later
     * tokens overwrite earlier ones with the same key.
     *
     * @param option the option the tokens were given to, used in error messages
     * @param tokens the raw tokens, possibly null
     * @return the parsed pairs in command line order, empty when tokens is null
     * @throws IllegalArgumentException if a token has an empty key or value, or
     *         no {@code =} at all
     */
    public static Map<String, String> parse(String option, List<String> tokens) {
        Map<String, String> result = new LinkedHashMap<>();

        if (tokens == null) {
            return result;
        }

        for (String token : tokens) {
            int separator = token.indexOf(SEPARATOR);

            if (separator <= 0 || separator == token.length() - 1) {
                throw new IllegalArgumentException("Invalid " + option + " value '" + token
                        + "', expected key=value format");
            }

            result.put(token.substring(0, separator), token.substring(separator + 1));
        }

        return result;
    }
}
