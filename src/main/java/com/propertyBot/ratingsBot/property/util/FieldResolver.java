package com.propertyBot.ratingsBot.property.util;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Alias resolution over open-ended JSON records.
 *
 * Each logical field is read through an ordered list of candidate keys; the first key
 * holding a non-null value wins. Nothing here throws on missing or malformed data.
 */
public final class FieldResolver {

    private FieldResolver() {
    }

    /**
     * Returns the value of the first candidate key that is present with a non-null value.
     */
    public static Optional<Object> firstPresent(Map<String, ?> record, String... keys) {
        if (record == null) {
            return Optional.empty();
        }
        for (String key : keys) {
            Object value = record.get(key);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a field as display text, substituting {@code defaultValue} when every alias is absent.
     */
    public static String resolveText(Map<String, ?> record, String defaultValue, String... keys) {
        return firstPresent(record, keys)
                .map(String::valueOf)
                .orElse(defaultValue);
    }

    /**
     * Resolves a field as a number. Only the first present alias is coerced; a value that
     * cannot be coerced counts as absent.
     */
    public static OptionalDouble resolveNumber(Map<String, ?> record, String... keys) {
        return firstPresent(record, keys)
                .map(FieldResolver::coerceNumber)
                .orElse(OptionalDouble.empty());
    }

    /**
     * Coerces a JSON number or numeric string. NaN and infinities are rejected.
     */
    public static OptionalDouble coerceNumber(Object value) {
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String s) {
            String trimmed = s.strip();
            if (trimmed.isEmpty()) {
                return OptionalDouble.empty();
            }
            try {
                number = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(number) ? OptionalDouble.of(number) : OptionalDouble.empty();
    }

    /**
     * Truncates {@code text} to {@code maxCodePoints} code points, appending {@code marker}
     * only when something was cut.
     */
    public static String truncate(String text, int maxCodePoints, String marker) {
        if (text == null) {
            return "";
        }
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        int end = text.offsetByCodePoints(0, maxCodePoints);
        return text.substring(0, end) + marker;
    }
}
