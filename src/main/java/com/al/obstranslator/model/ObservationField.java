package com.al.obstranslator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Standardized observation attributes produced by translation.
 * The declaration order is the order used when all attributes are reported.
 */
public enum ObservationField {

    EXPOSURE_ID("exposure-id", Long.class),
    VISIT_ID("visit-id", Long.class),
    OBSERVATION_COUNTER("observation-counter", Long.class),
    DETECTOR_NUM("detector-num", Integer.class),
    DETECTOR_NAME("detector-name", String.class),
    DETECTOR_SERIAL("detector-serial", String.class),
    DETECTOR_GROUP("detector-group", String.class),
    DETECTOR_EXPOSURE_ID("detector-exposure-id", Long.class),
    OBSERVATION_ID("observation-id", String.class),
    DATETIME_BEGIN("datetime-begin", Instant.class),
    DATETIME_END("datetime-end", Instant.class),
    EXPOSURE_TIME("exposure-time", Duration.class),
    DARK_TIME("dark-time", Duration.class),
    OBSERVATION_TYPE("observation-type", String.class),
    LOCATION("location", EarthLocation.class),
    TRACKING_RADEC("tracking-radec", SkyCoordinate.class),
    ALTAZ_BEGIN("altaz-begin", AltAz.class),
    BORESIGHT_ROTATION_ANGLE("boresight-rotation-angle", Double.class),
    BORESIGHT_ROTATION_COORD("boresight-rotation-coord", String.class),
    BORESIGHT_AIRMASS("boresight-airmass", Double.class),
    INSTRUMENT("instrument", String.class),
    TELESCOPE("telescope", String.class),
    PHYSICAL_FILTER("physical-filter", String.class),
    OBJECT("object", String.class),
    SCIENCE_PROGRAM("science-program", String.class),
    TEMPERATURE("temperature", Double.class),
    PRESSURE("pressure", Double.class),
    RELATIVE_HUMIDITY("relative-humidity", Double.class);

    private final String configKey;
    private final Class<?> valueType;

    ObservationField(String configKey, Class<?> valueType) {
        this.configKey = configKey;
        this.valueType = valueType;
    }

    public String getConfigKey() {
        return configKey;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * Look up a field by its configuration name. Case, '-' and '_' are ignored,
     * so {@code exposure_time}, {@code exposure-time} and {@code exposureTime}
     * all name {@link #EXPOSURE_TIME}.
     *
     * @throws IllegalArgumentException if no field has that name
     */
    public static ObservationField fromConfigKey(String name) {
        if (name != null) {
            String normalized = normalize(name);
            for (ObservationField field : values()) {
                if (normalize(field.configKey).equals(normalized)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Unknown observation field: " + name);
    }

    private static String normalize(String name) {
        return name.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
