package com.stemtutor.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.util.regex.Pattern;

/**
 * Recovers structured data from free-form model text.
 * <p>
 * Models wrap JSON in prose or markdown fences and often emit LaTeX with bare
 * backslashes ({@code \sqrt}, {@code \cdot}) that are not valid JSON escapes.
 * The decoder locates the outermost balanced object or array, doubles every
 * backslash that does not begin a recognized escape, and parses the result
 * with Jackson.
 */
public class LenientJsonDecoder {

    private static final Pattern SNAKE_CASE_KEY = Pattern.compile("\"[a-z][a-z0-9]*_[a-z0-9_]+\"\\s*:");

    private final ObjectMapper mapper;
    private final ObjectMapper snakeCaseMapper;

    public LenientJsonDecoder() {
        this.mapper = lenientMapper();
        this.snakeCaseMapper = lenientMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public <T> DecodeResult<T> decode(String text, Class<T> type) {
        if (text == null || text.isBlank()) {
            return new DecodeResult.Failure<>("Empty text for " + type.getSimpleName(), null);
        }
        String json = extractJson(text);
        if (json == null) {
            return new DecodeResult.Failure<>("No JSON object or array found for " + type.getSimpleName(), null);
        }
        String repaired = repairEscapes(json);
        // Unknown keys are ignored, so the naming style has to be picked up front.
        boolean snakeCase = SNAKE_CASE_KEY.matcher(repaired).find();
        ObjectMapper first = snakeCase ? snakeCaseMapper : mapper;
        ObjectMapper second = snakeCase ? mapper : snakeCaseMapper;
        try {
            return new DecodeResult.Success<>(first.readValue(repaired, type));
        } catch (Exception firstFailure) {
            try {
                return new DecodeResult.Success<>(second.readValue(repaired, type));
            } catch (Exception e) {
                return new DecodeResult.Failure<>(
                        "Failed to decode " + type.getSimpleName() + ": " + firstFailure.getMessage(), firstFailure);
            }
        }
    }

    /**
     * Returns the outermost balanced {@code {...}} or {@code [...]} in {@code text},
     * ignoring brackets inside string literals, or {@code null} when none is closed.
     */
    static String extractJson(String text) {
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return null;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
                default -> { }
            }
        }
        return null;
    }

    /**
     * Doubles every backslash that does not start a valid JSON escape sequence.
     */
    static String repairEscapes(String json) {
        var sb = new StringBuilder(json.length() + 16);
        int i = 0;
        while (i < json.length()) {
            char c = json.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 < json.length()) {
                char next = json.charAt(i + 1);
                if (next == '\\') {
                    sb.append("\\\\");
                    i += 2;
                    continue;
                }
                if (isSimpleEscape(next)
                        || (next == 'u' && isUnicodeEscape(json, i + 2))) {
                    sb.append(c).append(next);
                    i += 2;
                    continue;
                }
            }
            sb.append("\\\\");
            i++;
        }
        return sb.toString();
    }

    private static boolean isSimpleEscape(char c) {
        return c == '"' || c == '/' || c == 'b' || c == 'f' || c == 'n' || c == 'r' || c == 't';
    }

    private static boolean isUnicodeEscape(String s, int from) {
        if (from + 4 > s.length()) {
            return false;
        }
        for (int k = from; k < from + 4; k++) {
            if (Character.digit(s.charAt(k), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static ObjectMapper lenientMapper() {
        var mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        mapper.registerModule(new ParameterNamesModule());
        return mapper;
    }
}
