package com.al.obstranslator.config;

import com.al.obstranslator.capability.ObservationCapabilities;
import com.al.obstranslator.device.DeviceDescriptor;
import com.al.obstranslator.device.DeviceRegistry;
import com.al.obstranslator.device.FilterDefinition;
import com.al.obstranslator.device.FilterRegistry;
import com.al.obstranslator.exception.MalformedValueException;
import com.al.obstranslator.model.HeaderUnit;
import com.al.obstranslator.model.MappingConfiguration;
import com.al.obstranslator.model.ObservationField;
import com.al.obstranslator.model.TrivialMapping;
import com.al.obstranslator.translator.FieldResolutionTable;
import com.al.obstranslator.translator.HuntsmanComputedFields;
import com.al.obstranslator.util.HeaderValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the bound properties into the immutable objects translation runs on.
 * Everything here is built once during context refresh, before any request
 * is served; invalid configuration fails startup.
 */
@Configuration
@Slf4j
public class TranslatorConfig {

    @Bean
    public MappingConfiguration mappingConfiguration(TranslatorProperties properties) {
        return toMappingConfiguration(properties.getMapping());
    }

    @Bean
    public DeviceRegistry deviceRegistry(TranslatorProperties properties) {
        DeviceRegistry registry = toDeviceRegistry(properties.getInstrument());
        log.info("Registered {} devices for instrument {}", registry.size(), properties.getInstrument().getName());
        return registry;
    }

    @Bean
    public FilterRegistry filterRegistry(TranslatorProperties properties) {
        return toFilterRegistry(properties.getInstrument());
    }

    @Bean
    public FieldResolutionTable fieldResolutionTable(MappingConfiguration mappingConfiguration,
            ObservationCapabilities capabilities, DeviceRegistry deviceRegistry) {
        HuntsmanComputedFields computed = new HuntsmanComputedFields(capabilities, deviceRegistry);
        return new FieldResolutionTable(mappingConfiguration, computed.asMap());
    }

    static MappingConfiguration toMappingConfiguration(TranslatorProperties.Mapping mapping) {
        Map<ObservationField, TrivialMapping> trivial = new EnumMap<>(ObservationField.class);
        mapping.getTrivial().forEach((name, entry) -> {
            ObservationField field = ObservationField.fromConfigKey(name);
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Trivial mapping for " + name + " has no header key");
            }
            HeaderUnit unit = entry.getUnit() == null ? null : HeaderUnit.fromSymbol(entry.getUnit());
            trivial.put(field, TrivialMapping.of(entry.getKey(), unit));
        });

        Map<ObservationField, Object> constant = new EnumMap<>(ObservationField.class);
        mapping.getConstant().forEach((name, literal) -> {
            ObservationField field = ObservationField.fromConfigKey(name);
            try {
                constant.put(field, HeaderValues.convert(name, literal, null, field.getValueType()));
            } catch (MalformedValueException e) {
                throw new IllegalArgumentException("Invalid constant for " + name + ": " + e.getMessage(), e);
            }
        });

        return new MappingConfiguration(trivial, constant);
    }

    static DeviceRegistry toDeviceRegistry(TranslatorProperties.Instrument instrument) {
        List<DeviceDescriptor> devices = new ArrayList<>();
        for (TranslatorProperties.Device device : instrument.getDevices()) {
            if (device.getName() == null || device.getName().isBlank()) {
                throw new IllegalArgumentException("Device without a name in instrument " + instrument.getName());
            }
            TranslatorProperties.Device preset = new TranslatorProperties.Device();
            if (device.getPreset() != null) {
                preset = instrument.getPresets().get(device.getPreset());
                if (preset == null) {
                    throw new IllegalArgumentException(
                            "Unknown preset " + device.getPreset() + " for device " + device.getName());
                }
            }
            devices.add(DeviceDescriptor.builder()
                    .name(device.getName())
                    .preset(device.getPreset())
                    .width(require(device.getName(), "width", device.getWidth(), preset.getWidth()))
                    .height(require(device.getName(), "height", device.getHeight(), preset.getHeight()))
                    .saturation(require(device.getName(), "saturation", device.getSaturation(),
                            preset.getSaturation()))
                    .gain(require(device.getName(), "gain", device.getGain(), preset.getGain()))
                    .readNoise(require(device.getName(), "readNoise", device.getReadNoise(),
                            preset.getReadNoise()))
                    .build());
        }
        return new DeviceRegistry(devices);
    }

    static FilterRegistry toFilterRegistry(TranslatorProperties.Instrument instrument) {
        List<FilterDefinition> filters = new ArrayList<>();
        for (TranslatorProperties.Filter filter : instrument.getFilters()) {
            if (filter.getPhysicalFilter() == null || filter.getBand() == null) {
                throw new IllegalArgumentException("Filter definitions need a physical filter and a band");
            }
            filters.add(FilterDefinition.builder()
                    .physicalFilter(filter.getPhysicalFilter())
                    .band(filter.getBand())
                    .lambdaEff(filter.getLambdaEff())
                    .lambdaMin(filter.getLambdaMin())
                    .lambdaMax(filter.getLambdaMax())
                    .aliases(filter.getAliases() == null ? List.of() : filter.getAliases())
                    .build());
        }
        return new FilterRegistry(filters);
    }

    // Device values override the preset
    private static <T> T require(String device, String property, T own, T preset) {
        T value = own != null ? own : preset;
        if (value == null) {
            throw new IllegalArgumentException("Device " + device + " has no " + property);
        }
        return value;
    }
}
