package com.al.obstranslator.device;

import com.al.obstranslator.exception.UnknownDeviceException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeviceRegistryTest {

    @Test
    public void testDetectorNum_IsOneBasedPosition() {
        DeviceRegistry registry = new DeviceRegistry(List.of(device("camA"), device("camB"), device("camC")));

        assertEquals(1, registry.detectorNum("camA"));
        assertEquals(3, registry.detectorNum("camC"));
        assertEquals(3, registry.size());
    }

    @Test
    public void testDetectorNum_FirstMatchWins() {
        DeviceRegistry registry = new DeviceRegistry(List.of(device("camA"), device("camB"), device("camA")));

        assertEquals(1, registry.detectorNum("camA"));
    }

    @Test
    public void testDetectorNum_UnknownDevice() {
        DeviceRegistry registry = new DeviceRegistry(List.of(device("camA")));

        UnknownDeviceException ex = assertThrows(UnknownDeviceException.class, () -> registry.detectorNum("camZ"));
        assertEquals("camZ", ex.getDeviceName());
        assertEquals("UNKNOWN_DEVICE", ex.getErrorCode());
    }

    @Test
    public void testCapacity() {
        List<DeviceDescriptor> devices = new ArrayList<>();
        for (int i = 0; i < 99; i++) {
            devices.add(device("cam" + i));
        }
        DeviceRegistry full = new DeviceRegistry(devices);
        assertEquals(99, full.detectorNum("cam98"));

        devices.add(device("cam99"));
        assertThrows(IllegalArgumentException.class, () -> new DeviceRegistry(devices));
    }

    @Test
    public void testDevicesAreCopied() {
        List<DeviceDescriptor> devices = new ArrayList<>(List.of(device("camA")));
        DeviceRegistry registry = new DeviceRegistry(devices);
        devices.add(device("camB"));

        assertEquals(1, registry.size());
        assertThrows(UnsupportedOperationException.class, () -> registry.getDevices().add(device("camC")));
    }

    @Test
    public void testFilterRegistry_FindByNameOrAlias() {
        FilterRegistry filters = new FilterRegistry(List.of(
                FilterDefinition.builder().physicalFilter("g_band").band("g_band").lambdaEff(550).build(),
                FilterDefinition.builder().physicalFilter("blank").band("blank").lambdaEff(0)
                        .alias("no_filter").alias("blank").build()));

        assertEquals("g_band", filters.find("g_band").orElseThrow().getBand());
        assertEquals("blank", filters.find("no_filter").orElseThrow().getPhysicalFilter());
        assertTrue(filters.find("z_band").isEmpty());
    }

    @Test
    public void testFilterRegistry_DuplicatePhysicalFilter() {
        FilterDefinition g = FilterDefinition.builder().physicalFilter("g_band").band("g_band").build();

        assertThrows(IllegalArgumentException.class, () -> new FilterRegistry(List.of(g, g)));
    }

    private static DeviceDescriptor device(String name) {
        return DeviceDescriptor.builder().name(name).width(5496).height(3672).saturation(4095).gain(1.145)
                .readNoise(2.4).build();
    }
}
