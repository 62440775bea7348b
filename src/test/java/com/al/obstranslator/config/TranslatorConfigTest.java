package com.al.obstranslator.config;

import com.al.obstranslator.device.DeviceDescriptor;
import com.al.obstranslator.device.DeviceRegistry;
import com.al.obstranslator.device.FilterRegistry;
import com.al.obstranslator.model.HeaderUnit;
import com.al.obstranslator.model.MappingConfiguration;
import com.al.obstranslator.model.ObservationField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TranslatorConfigTest {

    @Test
    public void testMapping_TrivialWithUnitAndConstants() {
        TranslatorProperties.Mapping properties = new TranslatorProperties.Mapping();
        properties.getTrivial().put("exposure-time", trivial("EXPTIME", "s"));
        properties.getTrivial().put("detector-name", trivial("CAM-ID", null));
        properties.getConstant().put("instrument", "Huntsman");
        properties.getConstant().put("boresight-rotation-angle", "0");

        MappingConfiguration mapping = TranslatorConfig.toMappingConfiguration(properties);

        assertEquals(HeaderUnit.SECOND, mapping.getTrivial().get(ObservationField.EXPOSURE_TIME).getUnit());
        assertFalse(mapping.getTrivial().get(ObservationField.DETECTOR_NAME).hasUnit());
        assertEquals("Huntsman", mapping.getConstant().get(ObservationField.INSTRUMENT));
        assertEquals(0.0, mapping.getConstant().get(ObservationField.BORESIGHT_ROTATION_ANGLE));
    }

    @Test
    public void testMapping_Invalid() {
        TranslatorProperties.Mapping unknownField = new TranslatorProperties.Mapping();
        unknownField.getTrivial().put("focus-position", trivial("FOCUS", null));

        TranslatorProperties.Mapping badUnit = new TranslatorProperties.Mapping();
        badUnit.getTrivial().put("exposure-time", trivial("EXPTIME", "lightyear"));

        TranslatorProperties.Mapping noKey = new TranslatorProperties.Mapping();
        noKey.getTrivial().put("object", trivial(" ", null));

        TranslatorProperties.Mapping badConstant = new TranslatorProperties.Mapping();
        badConstant.getConstant().put("boresight-rotation-angle", "upright");

        TranslatorProperties.Mapping conflict = new TranslatorProperties.Mapping();
        conflict.getTrivial().put("telescope", trivial("TELESCOP", null));
        conflict.getConstant().put("telescope", "Huntsman");

        for (TranslatorProperties.Mapping mapping : List.of(unknownField, badUnit, noKey, badConstant, conflict)) {
            assertThrows(IllegalArgumentException.class, () -> TranslatorConfig.toMappingConfiguration(mapping));
        }
    }

    @Test
    public void testDevices_PresetMergedWithOverrides() {
        TranslatorProperties.Instrument instrument = new TranslatorProperties.Instrument();
        TranslatorProperties.Device zwo = new TranslatorProperties.Device();
        zwo.setWidth(5496);
        zwo.setHeight(3672);
        zwo.setSaturation(4095);
        zwo.setGain(1.145);
        zwo.setReadNoise(2.4);
        instrument.getPresets().put("zwo", zwo);
        instrument.getDevices().add(device("1815420013090900", "zwo"));
        TranslatorProperties.Device testCam = device("testingcam00", "zwo");
        testCam.setWidth(100);
        testCam.setHeight(100);
        instrument.getDevices().add(testCam);

        DeviceRegistry registry = TranslatorConfig.toDeviceRegistry(instrument);

        DeviceDescriptor first = registry.getDevices().get(0);
        DeviceDescriptor second = registry.getDevices().get(1);
        assertEquals(5496, first.getWidth());
        assertEquals("zwo", first.getPreset());
        assertEquals(100, second.getWidth());
        assertEquals(100, second.getHeight());
        assertEquals(4095, second.getSaturation());
        assertEquals(2, registry.detectorNum("testingcam00"));
    }

    @Test
    public void testDevices_UnknownPresetOrMissingValue() {
        TranslatorProperties.Instrument unknownPreset = new TranslatorProperties.Instrument();
        unknownPreset.getDevices().add(device("camA", "qhy"));

        TranslatorProperties.Instrument incomplete = new TranslatorProperties.Instrument();
        TranslatorProperties.Device bare = device("camA", null);
        bare.setWidth(100);
        incomplete.getDevices().add(bare);

        assertThrows(IllegalArgumentException.class, () -> TranslatorConfig.toDeviceRegistry(unknownPreset));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> TranslatorConfig.toDeviceRegistry(incomplete));
        assertTrue(ex.getMessage().contains("height"));
    }

    @Test
    public void testFilters() {
        TranslatorProperties.Instrument instrument = new TranslatorProperties.Instrument();
        TranslatorProperties.Filter blank = new TranslatorProperties.Filter();
        blank.setPhysicalFilter("blank");
        blank.setBand("blank");
        blank.setAliases(Set.of("no_filter"));
        TranslatorProperties.Filter noAliases = new TranslatorProperties.Filter();
        noAliases.setPhysicalFilter("r_band");
        noAliases.setBand("r_band");
        noAliases.setAliases(null);
        instrument.getFilters().add(blank);
        instrument.getFilters().add(noAliases);

        FilterRegistry registry = TranslatorConfig.toFilterRegistry(instrument);

        assertEquals("blank", registry.find("no_filter").orElseThrow().getBand());
        assertTrue(registry.find("r_band").orElseThrow().getAliases().isEmpty());
    }

    @Test
    public void testFilters_BandRequired() {
        TranslatorProperties.Instrument instrument = new TranslatorProperties.Instrument();
        TranslatorProperties.Filter filter = new TranslatorProperties.Filter();
        filter.setPhysicalFilter("g_band");
        instrument.getFilters().add(filter);

        assertThrows(IllegalArgumentException.class, () -> TranslatorConfig.toFilterRegistry(instrument));
    }

    private static TranslatorProperties.TrivialEntry trivial(String key, String unit) {
        TranslatorProperties.TrivialEntry entry = new TranslatorProperties.TrivialEntry();
        entry.setKey(key);
        entry.setUnit(unit);
        return entry;
    }

    private static TranslatorProperties.Device device(String name, String preset) {
        TranslatorProperties.Device device = new TranslatorProperties.Device();
        device.setName(name);
        device.setPreset(preset);
        return device;
    }
}
