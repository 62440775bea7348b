package com.al.obstranslator.model;

import lombok.Value;

/**
 * Geodetic position of the observatory.
 */
@Value
public class EarthLocation {
    /** Latitude in degrees, north positive */
    double latitude;
    /** Longitude in degrees, east positive */
    double longitude;
    /** Height above the reference ellipsoid in metres */
    double height;
}
