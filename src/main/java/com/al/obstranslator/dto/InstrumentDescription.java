package com.al.obstranslator.dto;

import com.al.obstranslator.device.FilterDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Instrument entry used to populate the data registry: identifier bounds,
 * detectors and filters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentDescription {

    private String name;

    /**
     * Largest detector number the id encoding can hold
     */
    private int detectorMax;

    private long exposureMax;

    private long visitMax;

    private long detectorExposureMax;

    private List<Detector> detectors;

    private List<FilterDefinition> filters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Detector {
        /**
         * Detector number, 1-based position in the device list
         */
        private int id;
        private String name;
        private int width;
        private int height;
        private int saturation;
        private double gain;
        private double readNoise;
    }
}
