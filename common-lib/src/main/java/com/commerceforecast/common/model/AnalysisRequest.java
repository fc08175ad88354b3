package com.commerceforecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured input for one unit invocation. Immutable once built.
 */
public record AnalysisRequest(
    @JsonProperty("unit")   UnitName unit,
    @JsonProperty("fields") Map<String, Object> fields
) {
    public AnalysisRequest {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static AnalysisRequest of(UnitName unit, Map<String, Object> fields) {
        return new AnalysisRequest(unit, fields);
    }

    public boolean has(String key) {
        return fields.containsKey(key) && fields.get(key) != null;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    /** String value of {@code key}, or {@code fallback} when absent. */
    public String text(String key, String fallback) {
        Object value = fields.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }

    public double number(String key, double fallback) {
        Object value = fields.get(key);
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try { return Double.parseDouble(s.trim()); } catch (NumberFormatException e) { return fallback; }
        }
        return fallback;
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String key) {
        Object value = fields.get(key);
        return value instanceof List<?> l ? (List<Object>) l : List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        Object value = fields.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }
}
