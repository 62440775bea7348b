package com.al.obstranslator.translator;

import com.al.obstranslator.capability.CapabilityResult;
import com.al.obstranslator.capability.ObservationCapabilities;
import com.al.obstranslator.device.DeviceRegistry;
import com.al.obstranslator.exception.MalformedValueException;
import com.al.obstranslator.ids.ExposureIdEncoder;
import com.al.obstranslator.model.ObservationField;
import com.al.obstranslator.util.HeaderValues;

import java.time.DateTimeException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.al.obstranslator.capability.HeaderKeys.DATE_OBS;
import static com.al.obstranslator.capability.HeaderKeys.IMAGETYP;
import static com.al.obstranslator.capability.HeaderKeys.IMAGE_TYPE_DARK;

/**
 * Derivations for fields that need more than a single card lookup.
 *
 * <p>
 * The instrument takes one exposure per visit, so visit id and observation
 * counter are the exposure id.
 */
public class HuntsmanComputedFields {

    private final ObservationCapabilities capabilities;
    private final DeviceRegistry deviceRegistry;

    public HuntsmanComputedFields(ObservationCapabilities capabilities, DeviceRegistry deviceRegistry) {
        this.capabilities = capabilities;
        this.deviceRegistry = deviceRegistry;
    }

    public Map<ObservationField, ComputedField> asMap() {
        Map<ObservationField, ComputedField> computed = new EnumMap<>(ObservationField.class);
        computed.put(ObservationField.EXPOSURE_ID, this::exposureId);
        computed.put(ObservationField.VISIT_ID, ObservationTranslator::getExposureId);
        computed.put(ObservationField.OBSERVATION_COUNTER, ObservationTranslator::getExposureId);
        computed.put(ObservationField.DETECTOR_NUM, this::detectorNum);
        computed.put(ObservationField.DETECTOR_EXPOSURE_ID, this::detectorExposureId);
        computed.put(ObservationField.OBSERVATION_ID, this::observationId);
        computed.put(ObservationField.DATETIME_BEGIN, this::datetimeBegin);
        computed.put(ObservationField.DATETIME_END, this::datetimeEnd);
        computed.put(ObservationField.DARK_TIME, this::darkTime);
        computed.put(ObservationField.OBSERVATION_TYPE,
                t -> fromCapability(t, capabilities.classifyObservationType(t.getHeader())));
        computed.put(ObservationField.LOCATION,
                t -> fromCapability(t, capabilities.locationFromHeader(t.getHeader())));
        computed.put(ObservationField.TRACKING_RADEC,
                t -> fromCapability(t, capabilities.radecFromHeader(t.getHeader())));
        computed.put(ObservationField.ALTAZ_BEGIN,
                t -> fromCapability(t, capabilities.altAzFromHeader(t.getHeader())));
        return Collections.unmodifiableMap(computed);
    }

    private Object exposureId(ObservationTranslator t) {
        return ExposureIdEncoder.exposureId(t.getDatetimeBegin());
    }

    private Object detectorNum(ObservationTranslator t) {
        return deviceRegistry.detectorNum(t.getDetectorName());
    }

    private Object detectorExposureId(ObservationTranslator t) {
        return ExposureIdEncoder.detectorExposureId(t.getDetectorNum(), t.getExposureId());
    }

    private Object observationId(ObservationTranslator t) {
        return ExposureIdEncoder.formatDetectorExposureId(t.getDetectorExposureId());
    }

    private Object datetimeBegin(ObservationTranslator t) {
        Object raw = t.useCard(DATE_OBS);
        try {
            return capabilities.parseDate(raw);
        } catch (DateTimeException e) {
            throw new MalformedValueException(DATE_OBS, raw, "an ISO-8601 date", e);
        }
    }

    private Object datetimeEnd(ObservationTranslator t) {
        return t.getDatetimeBegin().plus(t.getExposureTime());
    }

    // Only the literal dark-frame image type counts; everything else has no dark time.
    private Object darkTime(ObservationTranslator t) {
        String imageType = HeaderValues.asString(IMAGETYP, t.useCard(IMAGETYP));
        return IMAGE_TYPE_DARK.equals(imageType) ? t.getExposureTime() : Duration.ZERO;
    }

    private static Object fromCapability(ObservationTranslator t, CapabilityResult<?> result) {
        t.markUsed(result.getUsedKeys());
        return result.getValue();
    }
}
