package com.al.obstranslator.capability;

import com.al.obstranslator.model.AltAz;
import com.al.obstranslator.model.EarthLocation;
import com.al.obstranslator.model.HeaderRecord;
import com.al.obstranslator.model.SkyCoordinate;

import java.time.DateTimeException;
import java.time.Instant;

/**
 * Header interpretation that needs instrument knowledge or astronomy beyond a
 * direct card lookup. Implementations must be stateless and must not modify
 * the record; they report the cards they read so the caller can record them.
 */
public interface ObservationCapabilities {

    /**
     * Parse a raw date card.
     *
     * @throws DateTimeException if the value is not a recognised date
     */
    Instant parseDate(Object rawValue);

    /**
     * Classify the exposure (science, dark, bias, flat).
     */
    CapabilityResult<String> classifyObservationType(HeaderRecord header);

    CapabilityResult<EarthLocation> locationFromHeader(HeaderRecord header);

    CapabilityResult<SkyCoordinate> radecFromHeader(HeaderRecord header);

    CapabilityResult<AltAz> altAzFromHeader(HeaderRecord header);
}
