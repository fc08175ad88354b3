package com.commerceforecast.analysis.unit;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Small text helpers shared by the unit summaries.
 */
final class SummaryFormat {

    private SummaryFormat() {}

    static String capitalize(String value) {
        if (value == null || value.isBlank() || value.equalsIgnoreCase("N/A")) return "N/A";
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    /** {@code 72.0} prints as {@code 72}, {@code 72.5} as {@code 72.5}. */
    static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    static String money(double value) {
        return String.format(Locale.ROOT, "$%,.2f", value);
    }

    static String bullets(List<Object> items, int limit) {
        if (items.isEmpty()) return "- none provided";
        return items.stream()
            .limit(limit)
            .map(item -> "- " + item)
            .collect(Collectors.joining("\n"));
    }
}
