package com.al.obstranslator.translator;

import com.al.obstranslator.dto.TranslationError;
import com.al.obstranslator.dto.TranslationResult;
import com.al.obstranslator.exception.MissingKeyException;
import com.al.obstranslator.exception.TranslationException;
import com.al.obstranslator.exception.UnmappedFieldException;
import com.al.obstranslator.model.AltAz;
import com.al.obstranslator.model.EarthLocation;
import com.al.obstranslator.model.HeaderRecord;
import com.al.obstranslator.model.ObservationField;
import com.al.obstranslator.model.SkyCoordinate;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Translates one header record into observation attributes.
 *
 * <p>
 * Each field is resolved at most once: successful values are cached for the
 * lifetime of the translator and later calls never touch the header again.
 * A failed field caches nothing and leaves other cached fields untouched,
 * so asking again repeats the failure.
 *
 * <p>
 * Not thread-safe. Create one translator per record; translators over
 * different records can run concurrently since the resolution table is
 * immutable.
 */
@Slf4j
public class ObservationTranslator {

    private final HeaderRecord header;
    private final FieldResolutionTable table;

    private final Map<ObservationField, Object> cache = new EnumMap<>(ObservationField.class);
    private final Map<ObservationField, Set<String>> provenance = new EnumMap<>(ObservationField.class);
    private final Deque<ObservationField> resolving = new ArrayDeque<>();

    public ObservationTranslator(HeaderRecord header, FieldResolutionTable table) {
        this.header = header;
        this.table = table;
    }

    public HeaderRecord getHeader() {
        return header;
    }

    /**
     * Value of a field, resolving it on first use.
     *
     * @throws UnmappedFieldException if the field has no strategy
     * @throws TranslationException   if resolution fails; the exception names
     *                                the innermost failing field
     * @throws IllegalStateException  if the field depends on itself
     */
    public Object resolve(ObservationField field) {
        if (cache.containsKey(field)) {
            return cache.get(field);
        }
        FieldStrategy strategy = table.strategyFor(field)
                .orElseThrow(() -> new UnmappedFieldException(field));
        if (resolving.contains(field)) {
            throw new IllegalStateException("Circular dependency while resolving " + field.getConfigKey()
                    + " via " + resolving);
        }

        resolving.push(field);
        try {
            Object value = strategy.resolve(field, this);
            if (!field.getValueType().isInstance(value)) {
                throw new IllegalStateException(String.format("Field %s resolved to %s, expected %s",
                        field.getConfigKey(), value == null ? "null" : value.getClass().getSimpleName(),
                        field.getValueType().getSimpleName()));
            }
            cache.put(field, value);
            log.debug("Resolved {} = {} ({})", field.getConfigKey(), value, strategy.kind());
            return value;
        } catch (TranslationException e) {
            throw e.onField(field);
        } finally {
            resolving.pop();
        }
    }

    public <T> T get(ObservationField field, Class<T> type) {
        return type.cast(resolve(field));
    }

    public boolean isResolved(ObservationField field) {
        return cache.containsKey(field);
    }

    /**
     * Read a card and attribute it to the field currently being resolved.
     *
     * @throws MissingKeyException if the card is absent
     */
    public Object useCard(String key) {
        if (!header.contains(key)) {
            throw new MissingKeyException(key);
        }
        markUsed(Collections.singletonList(key));
        return header.get(key);
    }

    /**
     * Attribute cards read on this translator's behalf (for example by a
     * capability) to the field currently being resolved.
     */
    public void markUsed(Iterable<String> keys) {
        header.markUsed(keys);
        ObservationField current = resolving.peek();
        if (current != null) {
            Set<String> fieldKeys = provenance.computeIfAbsent(current, f -> new LinkedHashSet<>());
            keys.forEach(fieldKeys::add);
        }
    }

    /**
     * Header keys read directly while resolving the given field.
     */
    public Set<String> usedKeys(ObservationField field) {
        return Collections.unmodifiableSet(provenance.getOrDefault(field, Collections.emptySet()));
    }

    public Set<ObservationField> supportedFields() {
        return table.supportedFields();
    }

    /**
     * Resolve every supported field. Failures are collected per field rather
     * than aborting the remaining fields.
     */
    public TranslationResult translateAll() {
        TranslationResult result = new TranslationResult();
        for (ObservationField field : table.supportedFields()) {
            try {
                result.getAttributes().put(field.getConfigKey(), resolve(field));
            } catch (TranslationException e) {
                log.warn("Could not translate {}: {}", field.getConfigKey(), e.getMessage());
                result.getErrors().add(TranslationError.from(field.getConfigKey(), e));
            }
        }
        result.setUsedKeys(new LinkedHashSet<>(header.usedKeys()));
        Map<String, Set<String>> byField = new LinkedHashMap<>();
        provenance.forEach((field, keys) -> byField.put(field.getConfigKey(), new LinkedHashSet<>(keys)));
        result.setProvenance(byField);
        return result;
    }

    // Typed accessors

    public long getExposureId() {
        return get(ObservationField.EXPOSURE_ID, Long.class);
    }

    public long getVisitId() {
        return get(ObservationField.VISIT_ID, Long.class);
    }

    public long getObservationCounter() {
        return get(ObservationField.OBSERVATION_COUNTER, Long.class);
    }

    public int getDetectorNum() {
        return get(ObservationField.DETECTOR_NUM, Integer.class);
    }

    public String getDetectorName() {
        return get(ObservationField.DETECTOR_NAME, String.class);
    }

    public String getDetectorSerial() {
        return get(ObservationField.DETECTOR_SERIAL, String.class);
    }

    public String getDetectorGroup() {
        return get(ObservationField.DETECTOR_GROUP, String.class);
    }

    public long getDetectorExposureId() {
        return get(ObservationField.DETECTOR_EXPOSURE_ID, Long.class);
    }

    public String getObservationId() {
        return get(ObservationField.OBSERVATION_ID, String.class);
    }

    public Instant getDatetimeBegin() {
        return get(ObservationField.DATETIME_BEGIN, Instant.class);
    }

    public Instant getDatetimeEnd() {
        return get(ObservationField.DATETIME_END, Instant.class);
    }

    public Duration getExposureTime() {
        return get(ObservationField.EXPOSURE_TIME, Duration.class);
    }

    public Duration getDarkTime() {
        return get(ObservationField.DARK_TIME, Duration.class);
    }

    public String getObservationType() {
        return get(ObservationField.OBSERVATION_TYPE, String.class);
    }

    public EarthLocation getLocation() {
        return get(ObservationField.LOCATION, EarthLocation.class);
    }

    public SkyCoordinate getTrackingRadec() {
        return get(ObservationField.TRACKING_RADEC, SkyCoordinate.class);
    }

    public AltAz getAltAzBegin() {
        return get(ObservationField.ALTAZ_BEGIN, AltAz.class);
    }

    public double getBoresightRotationAngle() {
        return get(ObservationField.BORESIGHT_ROTATION_ANGLE, Double.class);
    }

    public String getBoresightRotationCoord() {
        return get(ObservationField.BORESIGHT_ROTATION_COORD, String.class);
    }

    public double getBoresightAirmass() {
        return get(ObservationField.BORESIGHT_AIRMASS, Double.class);
    }

    public String getInstrument() {
        return get(ObservationField.INSTRUMENT, String.class);
    }

    public String getTelescope() {
        return get(ObservationField.TELESCOPE, String.class);
    }

    public String getPhysicalFilter() {
        return get(ObservationField.PHYSICAL_FILTER, String.class);
    }

    public String getObject() {
        return get(ObservationField.OBJECT, String.class);
    }

    public String getScienceProgram() {
        return get(ObservationField.SCIENCE_PROGRAM, String.class);
    }

    public double getTemperature() {
        return get(ObservationField.TEMPERATURE, Double.class);
    }

    public double getPressure() {
        return get(ObservationField.PRESSURE, Double.class);
    }

    public double getRelativeHumidity() {
        return get(ObservationField.RELATIVE_HUMIDITY, Double.class);
    }
}
