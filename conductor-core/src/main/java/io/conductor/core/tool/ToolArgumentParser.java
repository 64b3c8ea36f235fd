package io.conductor.core.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses tool arguments written by a model: a JSON object when possible, otherwise
 * {@code key: value} lines with numbers and booleans coerced.
 */
public final class ToolArgumentParser {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private final ObjectMapper mapper;

    public ToolArgumentParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Object> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            try {
                Map<String, Object> parsed = mapper.readValue(trimmed, MAP_TYPE);
                return parsed == null ? Map.of() : parsed;
            } catch (Exception ignored) {
                // not JSON; fall through to key/value lines
            }
        }
        return parseKeyValueLines(trimmed);
    }

    Map<String, Object> parseKeyValueLines(String input) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String line : input.split("\\R")) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = stripQuotes(line.substring(0, colon).trim().replaceFirst("^[{,]+", "").trim());
            String value = line.substring(colon + 1).trim().replaceFirst(",$", "").trim();
            if (!key.isEmpty()) {
                values.put(key, coerce(stripQuotes(value)));
            }
        }
        return values;
    }

    private Object coerce(String value) {
        if (INTEGER.matcher(value).matches()) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ignored) {
                return Double.parseDouble(value);
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lower) || "false".equals(lower)) {
            return Boolean.parseBoolean(lower);
        }
        return value;
    }

    private String stripQuotes(String value) {
        if (value.length() >= 2
            && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
