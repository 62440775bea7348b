package com.al.obstranslator.model;

import lombok.Value;

/**
 * Equatorial sky position in degrees.
 */
@Value
public class SkyCoordinate {
    double ra;
    double dec;
    String frame;

    public static SkyCoordinate icrs(double ra, double dec) {
        return new SkyCoordinate(ra, dec, "icrs");
    }
}
