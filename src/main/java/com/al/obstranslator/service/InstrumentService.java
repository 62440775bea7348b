package com.al.obstranslator.service;

import com.al.obstranslator.config.TranslatorProperties;
import com.al.obstranslator.device.DeviceDescriptor;
import com.al.obstranslator.device.DeviceRegistry;
import com.al.obstranslator.device.FilterDefinition;
import com.al.obstranslator.device.FilterRegistry;
import com.al.obstranslator.dto.InstrumentDescription;
import com.al.obstranslator.ids.ExposureIdEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Describes the instrument for registry population: identifier capacity,
 * detectors and filters.
 */
@Service
public class InstrumentService {

    private final TranslatorProperties properties;
    private final DeviceRegistry deviceRegistry;
    private final FilterRegistry filterRegistry;

    public InstrumentService(TranslatorProperties properties, DeviceRegistry deviceRegistry,
            FilterRegistry filterRegistry) {
        this.properties = properties;
        this.deviceRegistry = deviceRegistry;
        this.filterRegistry = filterRegistry;
    }

    public InstrumentDescription describe() {
        List<InstrumentDescription.Detector> detectors = new ArrayList<>();
        List<DeviceDescriptor> devices = deviceRegistry.getDevices();
        for (int i = 0; i < devices.size(); i++) {
            DeviceDescriptor device = devices.get(i);
            detectors.add(InstrumentDescription.Detector.builder()
                    .id(i + 1)
                    .name(device.getName())
                    .width(device.getWidth())
                    .height(device.getHeight())
                    .saturation(device.getSaturation())
                    .gain(device.getGain())
                    .readNoise(device.getReadNoise())
                    .build());
        }

        // One exposure per visit, so both share the exposure id space
        long exposureMax = ExposureIdEncoder.maxExposureId();
        return InstrumentDescription.builder()
                .name(properties.getInstrument().getName())
                .detectorMax(ExposureIdEncoder.MAX_NUM_DETECTORS)
                .exposureMax(exposureMax)
                .visitMax(exposureMax)
                .detectorExposureMax(ExposureIdEncoder.maxDetectorExposureId())
                .detectors(detectors)
                .filters(filterRegistry.getFilters())
                .build();
    }

    public Optional<FilterDefinition> findFilter(String name) {
        return filterRegistry.find(name);
    }
}
