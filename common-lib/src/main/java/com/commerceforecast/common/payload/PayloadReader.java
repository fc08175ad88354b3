package com.commerceforecast.common.payload;

import java.util.List;
import java.util.Map;

/**
 * Null-safe navigation over JSON-shaped unit payloads.
 *
 * <p>Paths are dot-separated keys ({@code "demand_analysis.demand_score"}). A missing
 * key, a non-map intermediate or a value of the wrong type yields the supplied
 * default. Numbers may arrive as JSON numbers or numeric strings ({@code "72"},
 * {@code "72%"}). Nothing here throws on sparse data.
 */
public final class PayloadReader {

    private PayloadReader() {}

    public static Object value(Map<String, Object> payload, String path) {
        if (payload == null || path == null) return null;
        Object current = payload;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) return null;
            current = map.get(key);
            if (current == null) return null;
        }
        return current;
    }

    public static double number(Map<String, Object> payload, String path, double fallback) {
        return toDouble(value(payload, path), fallback);
    }

    public static String text(Map<String, Object> payload, String path, String fallback) {
        Object value = value(payload, path);
        if (value == null) return fallback;
        String s = String.valueOf(value);
        return s.isBlank() ? fallback : s;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Map<String, Object> payload, String path) {
        Object value = value(payload, path);
        return value instanceof List<?> l ? (List<Object>) l : List.of();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> payload, String path) {
        Object value = value(payload, path);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    /**
     * Map-typed elements of the list at {@code path}; non-map elements are skipped.
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> mapList(Map<String, Object> payload, String path) {
        return list(payload, path).stream()
            .filter(e -> e instanceof Map<?, ?>)
            .map(e -> (Map<String, Object>) e)
            .toList();
    }

    /** First map of the list at {@code path}, or an empty map. */
    public static Map<String, Object> first(Map<String, Object> payload, String path) {
        List<Map<String, Object>> entries = mapList(payload, path);
        return entries.isEmpty() ? Map.of() : entries.get(0);
    }

    public static double toDouble(Object value, double fallback) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : fallback;
        }
        if (value instanceof String s) {
            String cleaned = s.replace("%", "").replace("$", "").replace(",", "").trim();
            if (cleaned.isEmpty()) return fallback;
            try {
                double d = Double.parseDouble(cleaned);
                return Double.isFinite(d) ? d : fallback;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
