package com.shoplens.backend.validation;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Type-aware value normalization used when comparing harvested and
 * reported values.
 */
public final class ValueNormalizer {

    // Currency marks, grouping separators and whitespace carried by extracted prices
    private static final Pattern NUMBER_NOISE = Pattern.compile("[\\s,¥￥円$€£₩]|JPY|KRW|USD|pt");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ValueNormalizer() {
    }

    /**
     * Parse a numeric literal after stripping formatting. Returns null when
     * the value is not a number.
     */
    public static BigDecimal toNumber(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
        }
        if (value instanceof Number) {
            try {
                return new BigDecimal(value.toString()).stripTrailingZeros();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        String cleaned = NUMBER_NOISE.matcher(value.toString()).replaceAll("");
        if (cleaned.isEmpty()) return null;
        try {
            return new BigDecimal(cleaned).stripTrailingZeros();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String toText(Object value) {
        if (value == null) return null;
        return WHITESPACE.matcher(value.toString().trim()).replaceAll(" ");
    }

    /**
     * Numbers must match exactly after normalization. A value that does not
     * parse falls back to text comparison so "N/A" vs "N/A" still matches.
     */
    public static boolean sameValue(Object harvested, Object reported, FieldCorrespondence.ValueType type) {
        if (harvested == null || reported == null) {
            return harvested == reported;
        }
        if (type == FieldCorrespondence.ValueType.NUMBER) {
            BigDecimal left = toNumber(harvested);
            BigDecimal right = toNumber(reported);
            if (left != null && right != null) {
                return left.compareTo(right) == 0;
            }
        }
        return toText(harvested).equals(toText(reported));
    }
}
