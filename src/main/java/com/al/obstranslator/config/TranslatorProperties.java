package com.al.obstranslator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for header translation.
 * Loaded from application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "obs-translator")
public class TranslatorProperties {

    /**
     * Field to header mappings
     */
    private Mapping mapping = new Mapping();

    /**
     * Instrument description: cameras and filters
     */
    private Instrument instrument = new Instrument();

    /**
     * Threads used for batch translation, 0 = max(4, available processors)
     */
    private int batchThreads = 0;

    @Data
    public static class Mapping {
        /**
         * Fields read directly from one header card, keyed by field name
         */
        private Map<String, TrivialEntry> trivial = new LinkedHashMap<>();

        /**
         * Fields with a fixed value, keyed by field name
         */
        private Map<String, String> constant = new LinkedHashMap<>();
    }

    @Data
    public static class TrivialEntry {
        private String key;
        private String unit;
    }

    @Data
    public static class Instrument {
        private String name = "Huntsman";

        /**
         * Shared camera characteristics, keyed by preset name
         */
        private Map<String, Device> presets = new LinkedHashMap<>();

        /**
         * Cameras in detector-number order. Only ever append.
         */
        private List<Device> devices = new ArrayList<>();

        private List<Filter> filters = new ArrayList<>();
    }

    @Data
    public static class Device {
        private String name;
        private String preset;
        private Integer width;
        private Integer height;
        private Integer saturation;
        private Double gain;
        private Double readNoise;
    }

    @Data
    public static class Filter {
        private String physicalFilter;
        private String band;
        private double lambdaEff;
        private Double lambdaMin;
        private Double lambdaMax;
        private Set<String> aliases = new HashSet<>();
    }
}
