package com.al.obstranslator.device;

import com.al.obstranslator.exception.UnknownDeviceException;
import com.al.obstranslator.ids.ExposureIdEncoder;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of the instrument's cameras. A camera's detector number is its
 * 1-based position in the list, so entries must only ever be appended.
 */
public class DeviceRegistry {

    private final List<DeviceDescriptor> devices;

    /**
     * @throws IllegalArgumentException if there are more devices than the
     *                                  detector number encoding can hold
     */
    public DeviceRegistry(List<DeviceDescriptor> devices) {
        Objects.requireNonNull(devices, "devices");
        if (devices.size() > ExposureIdEncoder.MAX_NUM_DETECTORS) {
            throw new IllegalArgumentException(String.format("%d devices registered, at most %d supported",
                    devices.size(), ExposureIdEncoder.MAX_NUM_DETECTORS));
        }
        this.devices = List.copyOf(devices);
    }

    public List<DeviceDescriptor> getDevices() {
        return devices;
    }

    public int size() {
        return devices.size();
    }

    /**
     * Detector number of the first device with the given name.
     *
     * @throws UnknownDeviceException if no device has that name
     */
    public int detectorNum(String name) {
        for (int i = 0; i < devices.size(); i++) {
            if (devices.get(i).getName().equals(name)) {
                return i + 1;
            }
        }
        throw new UnknownDeviceException(name);
    }
}
