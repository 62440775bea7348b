package com.al.obstranslator.exception;

import lombok.Getter;

/**
 * The detector named in the header is not one of the instrument's devices.
 */
@Getter
public class UnknownDeviceException extends TranslationException {

    private final String deviceName;

    public UnknownDeviceException(String deviceName) {
        super("UNKNOWN_DEVICE", null, "Device not found in registry: " + deviceName);
        this.deviceName = deviceName;
    }
}
