package com.al.obstranslator.util;

import com.al.obstranslator.exception.MalformedValueException;
import com.al.obstranslator.model.HeaderUnit;

import java.time.Duration;

/**
 * Conversions from raw header values (strings, numbers, booleans) to the
 * types of observation fields. Non-finite numbers are never accepted.
 *
 * <p>
 * FITS writers are inconsistent about quoting numbers, so numeric fields
 * accept both numbers and numeric strings. String values are trimmed.
 */
public final class HeaderValues {

    private HeaderValues() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Convert a raw value to the requested type, applying the unit first when
     * one is given.
     *
     * @param key   header key the value came from, for error reporting
     * @param raw   raw value
     * @param unit  optional unit annotation
     * @param type  target type: String, Double, Integer, Long or Duration
     * @throws MalformedValueException if the value cannot be converted
     */
    public static Object convert(String key, Object raw, HeaderUnit unit, Class<?> type) {
        if (unit != null) {
            Object converted = applyUnit(key, raw, unit);
            if (!type.isInstance(converted)) {
                throw new MalformedValueException(key, raw, type.getSimpleName());
            }
            return converted;
        }
        if (type == String.class) {
            return asString(key, raw);
        }
        if (type == Double.class) {
            return asDouble(key, raw);
        }
        if (type == Integer.class) {
            return asInt(key, raw);
        }
        if (type == Long.class) {
            return asLong(key, raw);
        }
        if (type == Duration.class) {
            return applyUnit(key, raw, HeaderUnit.SECOND);
        }
        throw new MalformedValueException(key, raw, type.getSimpleName());
    }

    // A Duration holds at most Long.MAX_VALUE nanoseconds
    private static Object applyUnit(String key, Object raw, HeaderUnit unit) {
        double value = asDouble(key, raw);
        try {
            return unit.apply(value);
        } catch (ArithmeticException e) {
            throw new MalformedValueException(key, raw, "a " + unit.getSymbol() + " value in range", e);
        }
    }

    public static String asString(String key, Object raw) {
        if (raw == null) {
            throw new MalformedValueException(key, null, "a string");
        }
        return raw instanceof String ? ((String) raw).trim() : raw.toString();
    }

    public static double asDouble(String key, Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new MalformedValueException(key, raw, "a number", e);
            }
        } else {
            throw new MalformedValueException(key, raw, "a number");
        }
        if (!Double.isFinite(value)) {
            throw new MalformedValueException(key, raw, "a finite number");
        }
        return value;
    }

    public static long asLong(String key, Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (value != Math.rint(value)) {
                throw new MalformedValueException(key, raw, "an integer");
            }
            if (value < Long.MIN_VALUE || value >= 0x1p63) {
                throw new MalformedValueException(key, raw, "a 64-bit integer");
            }
            return (long) value;
        }
        if (raw instanceof String) {
            try {
                return Long.parseLong(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new MalformedValueException(key, raw, "an integer", e);
            }
        }
        throw new MalformedValueException(key, raw, "an integer");
    }

    public static int asInt(String key, Object raw) {
        long value = asLong(key, raw);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new MalformedValueException(key, raw, "a 32-bit integer");
        }
        return (int) value;
    }
}
