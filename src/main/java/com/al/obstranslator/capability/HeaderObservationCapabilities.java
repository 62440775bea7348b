package com.al.obstranslator.capability;

import com.al.obstranslator.exception.MalformedValueException;
import com.al.obstranslator.exception.MissingKeyException;
import com.al.obstranslator.model.AltAz;
import com.al.obstranslator.model.EarthLocation;
import com.al.obstranslator.model.HeaderRecord;
import com.al.obstranslator.model.SkyCoordinate;
import com.al.obstranslator.util.HeaderValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

import static com.al.obstranslator.capability.HeaderKeys.*;

/**
 * Reads observation type, site and pointing from the cards the camera control
 * software writes. Coordinates are taken as recorded (degrees, ICRS for the
 * mount RA/Dec); no astrometric correction is applied.
 */
@Component
@Slf4j
public class HeaderObservationCapabilities implements ObservationCapabilities {

    // yyyy-MM-ddTHH:mm:ss[.fraction][offset], no offset means UTC
    private static final DateTimeFormatter DATE_OBS_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    @Override
    public Instant parseDate(Object rawValue) {
        if (!(rawValue instanceof String)) {
            throw new DateTimeException("Date value is not a string: " + rawValue);
        }
        String text = ((String) rawValue).trim();
        try {
            TemporalAccessor parsed = DATE_OBS_FORMAT.parse(text);
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return OffsetDateTime.from(parsed).toInstant();
            }
            return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new DateTimeException("Failed to parse date: " + text, e);
        }
    }

    @Override
    public CapabilityResult<String> classifyObservationType(HeaderRecord header) {
        String imageType = HeaderValues.asString(IMAGETYP, require(header, IMAGETYP));

        switch (imageType) {
            case IMAGE_TYPE_DARK:
                double exptime = HeaderValues.asDouble(EXPTIME, require(header, EXPTIME));
                return CapabilityResult.of(exptime == 0 ? OBS_TYPE_BIAS : OBS_TYPE_DARK, IMAGETYP, EXPTIME);
            case IMAGE_TYPE_BIAS:
                return CapabilityResult.of(OBS_TYPE_BIAS, IMAGETYP);
            case IMAGE_TYPE_FLAT:
                return CapabilityResult.of(OBS_TYPE_FLAT, IMAGETYP);
            case IMAGE_TYPE_LIGHT:
                String field = HeaderValues.asString(FIELD, require(header, FIELD));
                boolean flat = field.toLowerCase(Locale.ROOT).startsWith("flat");
                return CapabilityResult.of(flat ? OBS_TYPE_FLAT : OBS_TYPE_SCIENCE, IMAGETYP, FIELD);
            default:
                log.debug("Unrecognised image type '{}'", imageType);
                throw new MalformedValueException(IMAGETYP, imageType,
                        "one of Light Frame, Dark Frame, Bias Frame, Flat Frame");
        }
    }

    @Override
    public CapabilityResult<EarthLocation> locationFromHeader(HeaderRecord header) {
        double latitude = HeaderValues.asDouble(LAT_OBS, require(header, LAT_OBS));
        double longitude = HeaderValues.asDouble(LONG_OBS, require(header, LONG_OBS));
        double height = HeaderValues.asDouble(ELEV_OBS, require(header, ELEV_OBS));
        if (latitude < -90 || latitude > 90) {
            throw new MalformedValueException(LAT_OBS, latitude, "a latitude in [-90, 90]");
        }
        return CapabilityResult.of(new EarthLocation(latitude, longitude, height), LAT_OBS, LONG_OBS, ELEV_OBS);
    }

    @Override
    public CapabilityResult<SkyCoordinate> radecFromHeader(HeaderRecord header) {
        double ra = HeaderValues.asDouble(RA_MNT, require(header, RA_MNT));
        double dec = HeaderValues.asDouble(DEC_MNT, require(header, DEC_MNT));
        if (dec < -90 || dec > 90) {
            throw new MalformedValueException(DEC_MNT, dec, "a declination in [-90, 90]");
        }
        return CapabilityResult.of(SkyCoordinate.icrs(ra, dec), RA_MNT, DEC_MNT);
    }

    @Override
    public CapabilityResult<AltAz> altAzFromHeader(HeaderRecord header) {
        double alt = HeaderValues.asDouble(ALT_MNT, require(header, ALT_MNT));
        double az = HeaderValues.asDouble(AZ_MNT, require(header, AZ_MNT));
        return CapabilityResult.of(new AltAz(alt, az), ALT_MNT, AZ_MNT);
    }

    private static Object require(HeaderRecord header, String key) {
        if (!header.contains(key)) {
            throw new MissingKeyException(key);
        }
        return header.get(key);
    }
}
