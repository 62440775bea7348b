package com.al.obstranslator.device;

import lombok.Builder;
import lombok.Value;

/**
 * One camera of the instrument with its readout characteristics.
 */
@Value
@Builder
public class DeviceDescriptor {
    String name;
    String preset;
    int width;
    int height;
    int saturation;
    double gain;
    double readNoise;
}
