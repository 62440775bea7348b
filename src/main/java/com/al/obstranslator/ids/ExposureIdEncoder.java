package com.al.obstranslator.ids;

import com.al.obstranslator.exception.EncodingOverflowException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Fixed-width decimal identifiers derived from the exposure start time.
 *
 * <p>
 * Exposure id layout (15 digits, UTC):
 *
 * <pre>
 * YY MM DD hh mm ss SSS
 * 21 03 04 12 30 45 678  -> 210304123045678
 * </pre>
 *
 * Sub-millisecond precision is discarded, never rounded. The detector-exposure
 * id prefixes the zero-padded exposure id with a two-digit detector number,
 * giving 17 digits.
 *
 * <p>
 * Years are stored modulo 100, so ids are ordered by time only within one
 * century. Dates after {@link #MAX_DATE} are rejected.
 *
 * <p>
 * The maximum-value queries size the registry's identifier columns and must
 * stay in lock-step with the encoders; both go through the same code path.
 */
public final class ExposureIdEncoder {

    private ExposureIdEncoder() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /** Latest timestamp that can be encoded */
    public static final Instant MAX_DATE = Instant.parse("2099-12-31T23:59:59.999Z");

    /** Largest detector number that fits the two-digit prefix */
    public static final int MAX_NUM_DETECTORS = 99;

    public static final int EXPOSURE_ID_WIDTH = 15;
    public static final int DETECTOR_EXPOSURE_ID_WIDTH = 17;

    private static final long EXPOSURE_ID_MODULUS = 1_000_000_000_000_000L;

    /**
     * Encode a start time as an exposure id.
     *
     * @param date exposure start time
     * @return the id; its zero-padded decimal form is exactly 15 digits
     * @throws EncodingOverflowException if the date is after {@link #MAX_DATE},
     *                                   before year 0, or does not compose to
     *                                   15 digits
     */
    public static long exposureId(Instant date) {
        if (date == null) {
            throw new IllegalArgumentException("Date must not be null");
        }
        Instant truncated = date.truncatedTo(ChronoUnit.MILLIS);
        if (truncated.isAfter(MAX_DATE)) {
            throw new EncodingOverflowException("date",
                    "Date " + date + " is after the maximum encodable date " + MAX_DATE);
        }
        LocalDateTime utc = LocalDateTime.ofInstant(truncated, ZoneOffset.UTC);
        if (utc.getYear() < 0) {
            throw new EncodingOverflowException("date", "Date " + date + " is before year 0");
        }

        String encoded = String.format("%02d%02d%02d%02d%02d%02d%03d",
                utc.getYear() % 100,
                utc.getMonthValue(),
                utc.getDayOfMonth(),
                utc.getHour(),
                utc.getMinute(),
                utc.getSecond(),
                utc.getNano() / 1_000_000);

        if (encoded.length() != EXPOSURE_ID_WIDTH) {
            throw new EncodingOverflowException("date", String.format(
                    "Encoded date %s has %d digits, expected %d", encoded, encoded.length(), EXPOSURE_ID_WIDTH));
        }
        return Long.parseLong(encoded);
    }

    public static long maxExposureId() {
        return exposureId(MAX_DATE);
    }

    /**
     * Combine a detector number and an exposure id.
     *
     * @param detectorNum detector number in {@code [0, 99]}
     * @param exposureId  exposure id in {@code [0, maxExposureId()]}
     * @throws EncodingOverflowException if either component is out of range
     */
    public static long detectorExposureId(int detectorNum, long exposureId) {
        if (detectorNum < 0 || detectorNum > MAX_NUM_DETECTORS) {
            throw new EncodingOverflowException("detectorNum", String.format(
                    "Detector number %d outside [0, %d]", detectorNum, MAX_NUM_DETECTORS));
        }
        if (exposureId < 0 || exposureId > maxExposureId()) {
            throw new EncodingOverflowException("exposureId", String.format(
                    "Exposure id %d outside [0, %d]", exposureId, maxExposureId()));
        }

        String encoded = String.format("%02d%s", detectorNum, formatExposureId(exposureId));
        if (encoded.length() != DETECTOR_EXPOSURE_ID_WIDTH) {
            throw new EncodingOverflowException("detectorExposureId", String.format(
                    "Encoded id %s has %d digits, expected %d", encoded, encoded.length(),
                    DETECTOR_EXPOSURE_ID_WIDTH));
        }
        return Long.parseLong(encoded);
    }

    public static long maxDetectorExposureId() {
        return detectorExposureId(MAX_NUM_DETECTORS, maxExposureId());
    }

    /**
     * Zero-padded 15-digit form of an exposure id.
     */
    public static String formatExposureId(long exposureId) {
        return String.format("%0" + EXPOSURE_ID_WIDTH + "d", exposureId);
    }

    /**
     * Zero-padded 17-digit form of a detector-exposure id.
     */
    public static String formatDetectorExposureId(long detectorExposureId) {
        return String.format("%0" + DETECTOR_EXPOSURE_ID_WIDTH + "d", detectorExposureId);
    }

    public static int decodeDetectorNum(long detectorExposureId) {
        return (int) (detectorExposureId / EXPOSURE_ID_MODULUS);
    }

    public static long decodeExposureId(long detectorExposureId) {
        return detectorExposureId % EXPOSURE_ID_MODULUS;
    }
}
