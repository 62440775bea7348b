package com.al.obstranslator.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Unit annotations accepted on trivial mappings. Each unit converts a numeric
 * header value into the canonical representation of its dimension: durations
 * become {@link Duration}, angles degrees, lengths metres, temperatures
 * degrees Celsius, pressures hectopascals.
 */
public enum HeaderUnit {

    SECOND("s", Dimension.DURATION, 1_000_000_000L),
    MILLISECOND("ms", Dimension.DURATION, 1_000_000L),
    MINUTE("min", Dimension.DURATION, 60_000_000_000L),
    HOUR("h", Dimension.DURATION, 3_600_000_000_000L),
    DEGREE("deg", Dimension.ANGLE, 1.0),
    ARCMINUTE("arcmin", Dimension.ANGLE, 1.0 / 60.0),
    ARCSECOND("arcsec", Dimension.ANGLE, 1.0 / 3600.0),
    RADIAN("rad", Dimension.ANGLE, 180.0 / Math.PI),
    METRE("m", Dimension.LENGTH, 1.0),
    KILOMETRE("km", Dimension.LENGTH, 1000.0),
    CELSIUS("degC", Dimension.TEMPERATURE, 1.0),
    KELVIN("K", Dimension.TEMPERATURE, 1.0),
    HECTOPASCAL("hPa", Dimension.PRESSURE, 1.0),
    PASCAL("Pa", Dimension.PRESSURE, 0.01),
    PERCENT("%", Dimension.FRACTION, 1.0);

    public enum Dimension {
        DURATION, ANGLE, LENGTH, TEMPERATURE, PRESSURE, FRACTION
    }

    private static final double KELVIN_OFFSET = 273.15;

    private final String symbol;
    private final Dimension dimension;
    private final long nanosPerUnit;
    private final double factor;

    HeaderUnit(String symbol, Dimension dimension, long nanosPerUnit) {
        this.symbol = symbol;
        this.dimension = dimension;
        this.nanosPerUnit = nanosPerUnit;
        this.factor = 0;
    }

    HeaderUnit(String symbol, Dimension dimension, double factor) {
        this.symbol = symbol;
        this.dimension = dimension;
        this.nanosPerUnit = 0;
        this.factor = factor;
    }

    public String getSymbol() {
        return symbol;
    }

    public Dimension getDimension() {
        return dimension;
    }

    /**
     * Java type produced by {@link #apply(double)}.
     */
    public Class<?> getCanonicalType() {
        return dimension == Dimension.DURATION ? Duration.class : Double.class;
    }

    /**
     * Convert a value expressed in this unit to its canonical form.
     *
     * @throws ArithmeticException if the value is not finite or the result
     *                             does not fit a {@link Duration}
     */
    public Object apply(double value) {
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("Non-finite value " + value + " in " + symbol);
        }
        switch (dimension) {
            case DURATION:
                long nanos = BigDecimal.valueOf(value)
                        .multiply(BigDecimal.valueOf(nanosPerUnit))
                        .setScale(0, RoundingMode.HALF_UP)
                        .longValueExact();
                return Duration.ofNanos(nanos);
            case TEMPERATURE:
                return this == KELVIN ? value - KELVIN_OFFSET : value;
            default:
                return value * factor;
        }
    }

    /**
     * Look up a unit by symbol.
     *
     * @throws IllegalArgumentException for an unsupported symbol
     */
    public static HeaderUnit fromSymbol(String symbol) {
        for (HeaderUnit unit : values()) {
            if (unit.symbol.equals(symbol)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unsupported unit: " + symbol);
    }
}
