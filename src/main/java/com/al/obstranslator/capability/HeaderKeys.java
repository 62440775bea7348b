package com.al.obstranslator.capability;

/**
 * Header cards written by the instrument's camera control software.
 */
public final class HeaderKeys {

    private HeaderKeys() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // Timing
    public static final String DATE_OBS = "DATE-OBS";
    public static final String EXPTIME = "EXPTIME";

    // Classification
    public static final String IMAGETYP = "IMAGETYP";
    public static final String FIELD = "FIELD";

    // Site
    public static final String LAT_OBS = "LAT-OBS";
    public static final String LONG_OBS = "LONG-OBS";
    public static final String ELEV_OBS = "ELEV-OBS";

    // Mount pointing
    public static final String RA_MNT = "RA-MNT";
    public static final String DEC_MNT = "DEC-MNT";
    public static final String ALT_MNT = "ALT-MNT";
    public static final String AZ_MNT = "AZ-MNT";

    // IMAGETYP values
    public static final String IMAGE_TYPE_DARK = "Dark Frame";
    public static final String IMAGE_TYPE_BIAS = "Bias Frame";
    public static final String IMAGE_TYPE_FLAT = "Flat Frame";
    public static final String IMAGE_TYPE_LIGHT = "Light Frame";

    // Standardized observation types
    public static final String OBS_TYPE_SCIENCE = "science";
    public static final String OBS_TYPE_DARK = "dark";
    public static final String OBS_TYPE_BIAS = "bias";
    public static final String OBS_TYPE_FLAT = "flat";
}
