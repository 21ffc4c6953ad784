package com.qqsuccubus.telemetry.core.util;

import java.util.regex.Pattern;

/**
 * Lenient conversions for loosely-typed payload fields. Every method returns {@code null}
 * instead of throwing when a value cannot be converted.
 */
public final class Coercions {
    private Coercions() {
    }

    // Plain decimal notation only: no hex, no 'd'/'f' suffixes, no NaN/Infinity words
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Converts numbers and decimal strings to a double.
     * <p>
     * Booleans are not numbers here, same as in {@link #toLong(Object)}. Strings must be plain
     * decimal or scientific notation; {@code "1d"}, {@code "0x1p3"} and {@code "NaN"} are rejected.
     * </p>
     *
     * @param value Raw field value (may be {@code null})
     * @return Double value, or {@code null} if the value is absent or not numeric
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (!DECIMAL.matcher(text).matches()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Converts integers, integer-valued floats and their string forms to a long.
     * <p>
     * {@code 1000}, {@code 1000.0} and {@code "1000"} convert; {@code 1000.5}, {@code "abc"},
     * NaN and infinities do not.
     * </p>
     *
     * @param value Raw field value (may be {@code null})
     * @return Long value, or {@code null} if the value is not an integer
     */
    public static Long toLong(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer
            || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                // fall through to the floating-point form, e.g. "1000.0"
            }
        }
        Double asDouble = toDouble(value);
        if (asDouble == null || asDouble.isNaN() || asDouble.isInfinite()) {
            return null;
        }
        if (asDouble != Math.rint(asDouble)
            || asDouble > Long.MAX_VALUE || asDouble < Long.MIN_VALUE) {
            return null;
        }
        return asDouble.longValue();
    }

    /**
     * Same as {@link #toLong(Object)}, narrowed to an int.
     */
    public static Integer toInt(Object value) {
        Long asLong = toLong(value);
        if (asLong == null || asLong > Integer.MAX_VALUE || asLong < Integer.MIN_VALUE) {
            return null;
        }
        return asLong.intValue();
    }
}
