package com.al.obstranslator.model;

import lombok.Value;

/**
 * Horizontal coordinates of the telescope boresight in degrees.
 */
@Value
public class AltAz {
    double alt;
    double az;
}
