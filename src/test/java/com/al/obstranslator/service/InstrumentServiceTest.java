package com.al.obstranslator.service;

import com.al.obstranslator.config.TranslatorProperties;
import com.al.obstranslator.device.DeviceDescriptor;
import com.al.obstranslator.device.DeviceRegistry;
import com.al.obstranslator.device.FilterDefinition;
import com.al.obstranslator.device.FilterRegistry;
import com.al.obstranslator.dto.InstrumentDescription;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InstrumentServiceTest {

    @Test
    public void testDescribe() {
        DeviceRegistry devices = new DeviceRegistry(List.of(
                DeviceDescriptor.builder().name("camA").width(5496).height(3672).build(),
                DeviceDescriptor.builder().name("camB").width(100).height(100).build()));
        FilterRegistry filters = new FilterRegistry(List.of(
                FilterDefinition.builder().physicalFilter("g_band").band("g_band").lambdaEff(550).build()));
        InstrumentService service = new InstrumentService(new TranslatorProperties(), devices, filters);

        InstrumentDescription description = service.describe();

        assertEquals("Huntsman", description.getName());
        assertEquals(99, description.getDetectorMax());
        assertEquals(991231235959999L, description.getExposureMax());
        assertEquals(description.getExposureMax(), description.getVisitMax());
        assertEquals(99991231235959999L, description.getDetectorExposureMax());
        assertEquals(2, description.getDetectors().size());
        assertEquals(2, description.getDetectors().get(1).getId());
        assertEquals("camB", description.getDetectors().get(1).getName());
        assertEquals(1, description.getFilters().size());
        assertTrue(service.findFilter("g_band").isPresent());
        assertTrue(service.findFilter("i_band").isEmpty());
    }
}
