package com.al.obstranslator.service;

import com.al.obstranslator.capability.HeaderObservationCapabilities;
import com.al.obstranslator.device.DeviceDescriptor;
import com.al.obstranslator.device.DeviceRegistry;
import com.al.obstranslator.dto.TranslationResult;
import com.al.obstranslator.model.HeaderRecord;
import com.al.obstranslator.model.HeaderUnit;
import com.al.obstranslator.model.MappingConfiguration;
import com.al.obstranslator.model.ObservationField;
import com.al.obstranslator.model.TrivialMapping;
import com.al.obstranslator.translator.ComputedField;
import com.al.obstranslator.translator.FieldResolutionTable;
import com.al.obstranslator.translator.HuntsmanComputedFields;
import com.al.obstranslator.translator.ObservationTranslator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TranslationServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private TranslationService translationService;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        DeviceRegistry devices = new DeviceRegistry(List.of(DeviceDescriptor.builder().name("camA").build()));
        MappingConfiguration mapping = new MappingConfiguration(
                Map.of(ObservationField.EXPOSURE_TIME, TrivialMapping.of("EXPTIME", HeaderUnit.SECOND),
                        ObservationField.DETECTOR_NAME, TrivialMapping.of("CAM-ID")),
                Map.of(ObservationField.INSTRUMENT, "Huntsman"));
        Map<ObservationField, ComputedField> computed =
                new HuntsmanComputedFields(new HeaderObservationCapabilities(), devices).asMap();
        translationService = new TranslationService(new FieldResolutionTable(mapping, computed), meterRegistry);
    }

    @Test
    public void testTranslate_PartialResultCounted() {
        TranslationResult result = translationService.translate(Map.of(
                "DATE-OBS", "2021-03-04T12:30:45.678",
                "IMAGETYP", "Bias Frame",
                "EXPTIME", 0,
                "CAM-ID", "camA"));

        assertEquals(1210304123045678L, result.getAttributes().get("detector-exposure-id"));
        assertEquals("bias", result.getAttributes().get("observation-type"));
        assertTrue(result.hasErrors());
        assertEquals(1.0, meterRegistry.counter("obs.translation.count", "status", "partial").count());
        assertEquals(0.0, meterRegistry.counter("obs.translation.count", "status", "success").count());
        assertEquals(1, meterRegistry.timer("obs.translation.duration").count());
    }

    @Test
    public void testTranslate_FullSuccessCounted() {
        FieldResolutionTable table = new FieldResolutionTable(MappingConfiguration.empty(),
                Map.of(ObservationField.VISIT_ID, t -> 7L));
        TranslationService service = new TranslationService(table, meterRegistry);

        TranslationResult result = service.translate(Map.of("EXPTIME", 1));

        assertTrue(result.isFullSuccess());
        assertEquals(7L, result.getAttributes().get("visit-id"));
        assertEquals(1.0, meterRegistry.counter("obs.translation.count", "status", "success").count());
    }

    @Test
    public void testTranslate_EmptyHeader() {
        assertThrows(IllegalArgumentException.class, () -> translationService.translate(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> translationService.translate(null));
    }

    @Test
    public void testTranslate_UnsupportedValueType() {
        assertThrows(IllegalArgumentException.class,
                () -> translationService.translate(Map.of("COMMENT", Map.of("nested", 1))));
    }

    @Test
    public void testNewTranslator_ResolvesOnDemand() {
        ObservationTranslator translator = translationService.newTranslator(
                HeaderRecord.of(Map.of("EXPTIME", 2.5)));

        assertEquals(Duration.ofMillis(2500), translator.getExposureTime());
        assertFalse(translator.isResolved(ObservationField.INSTRUMENT));
    }
}
