package com.wangbin.plc.core.registry;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonDeviceRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsDevicesFromClasspath() {
        JsonDeviceRegistry registry = new JsonDeviceRegistry("devices-test.json");

        List<DeviceInfo> active = registry.listActiveDevices();
        assertEquals(2, active.size());

        DeviceInfo gateway = registry.findDevice(2L).orElseThrow();
        assertEquals(ProtocolType.MODBUS_RTU_OVER_TCP, gateway.getProtocolType());
        assertEquals("192.168.1.20", gateway.getHost());
        assertEquals(4001, gateway.getPort());
        assertEquals(2, gateway.getAddressConfigs().size());

        assertTrue(registry.findDevice(3L).isPresent());
        assertFalse(registry.findDevice(3L).get().isActive());
    }

    @Test
    void loadsDevicesFromFileAndReloads() throws IOException {
        Path file = tempDir.resolve("devices.json");
        Files.write(file, "[{\"id\":7,\"name\":\"欧姆龙\",\"plcType\":\"Omron CJ2M\",\"host\":\"10.0.0.7\",\"port\":9600,\"addresses\":[\"D100\"]}]"
                .getBytes(StandardCharsets.UTF_8));
        JsonDeviceRegistry registry = new JsonDeviceRegistry(file.toString());

        DeviceInfo device = registry.findDevice(7L).orElseThrow();
        assertEquals(ProtocolType.OMRON_FINS, device.getProtocolType());
        assertEquals("D100", device.getAddressConfigs().get(0).getAddress());

        Files.write(file, "[]".getBytes(StandardCharsets.UTF_8));
        registry.reload();
        assertTrue(registry.listActiveDevices().isEmpty());
    }

    @Test
    void missingFileGivesEmptyRegistry() {
        JsonDeviceRegistry registry = new JsonDeviceRegistry(tempDir.resolve("absent.json").toString());
        assertTrue(registry.listActiveDevices().isEmpty());
    }

    @Test
    void malformedFileIsConfigurationError() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.write(file, "{oops".getBytes(StandardCharsets.UTF_8));
        assertThrows(ConfigurationException.class, () -> new JsonDeviceRegistry(file.toString()));
    }

    @Test
    void invalidDeviceIsSkipped() {
        Map<String, Object> valid = new HashMap<>();
        valid.put("id", 1);
        valid.put("ip", "10.0.0.1");
        valid.put("protocol", "siemens_s7");
        valid.put("byteOrder", "abcd");
        Map<String, Object> badPort = new HashMap<>();
        badPort.put("id", 2);
        badPort.put("port", "abc");
        Map<String, Object> noId = new HashMap<>();
        noId.put("name", "无ID");

        List<DeviceInfo> devices = JsonDeviceRegistry.parseDevices(List.of(valid, badPort, noId));

        assertEquals(1, devices.size());
        DeviceInfo device = devices.get(0);
        assertEquals("PLC-1", device.getName());
        assertEquals("10.0.0.1", device.getHost());
        assertEquals(502, device.getPort());
        assertEquals(ProtocolType.SIEMENS_S7, device.getProtocolType());
        assertEquals(DataFormat.ABCD, device.getByteOrder());
        assertEquals(0, device.getRack());
        assertEquals(1, device.getSlot());
    }

    @Test
    void addressesInheritDeviceStationAndByteOrder() {
        Map<String, Object> entry = new HashMap<>();
        entry.put("address", "40001");
        entry.put("type", "float");
        Map<String, Object> modbus = new HashMap<>();
        modbus.put("id", 11);
        modbus.put("ip", "10.0.0.11");
        modbus.put("protocol", "modbus_tcp");
        modbus.put("defaultStationId", 5);
        modbus.put("byteOrder", "ABCD");
        modbus.put("addresses", List.of(entry));
        Map<String, Object> legacy = new HashMap<>();
        legacy.put("id", 12);
        legacy.put("ip", "10.0.0.12");
        legacy.put("protocol", "modbus_tcp");
        legacy.put("defaultStationId", 5);
        legacy.put("byteOrder", "BADC");
        legacy.put("addresses", List.of("40001", "40003"));

        List<DeviceInfo> devices = JsonDeviceRegistry.parseDevices(List.of(modbus, legacy));

        DeviceInfo device = devices.get(0);
        AddressConfig config = device.getAddressConfigs().get(0);
        assertEquals(5, config.resolveStationId(device.getDefaultStationId()));
        assertEquals("40001_s5", config.storageKey(true, device.getDefaultStationId()));
        assertEquals(DataFormat.ABCD, config.resolveByteOrder(device.getByteOrder()));

        DeviceInfo legacyDevice = devices.get(1);
        assertEquals(2, legacyDevice.getAddressConfigs().size());
        for (AddressConfig legacyConfig : legacyDevice.getAddressConfigs()) {
            assertEquals(5, legacyConfig.resolveStationId(legacyDevice.getDefaultStationId()));
            assertEquals(DataFormat.BADC, legacyConfig.resolveByteOrder(legacyDevice.getByteOrder()));
        }
        assertEquals("40003_s5", legacyDevice.getAddressConfigs().get(1).storageKey(true, 5));
    }

    @Test
    void statusUpdatesAreTracked() {
        JsonDeviceRegistry registry = new JsonDeviceRegistry("devices-test.json");
        registry.updateDeviceStatus(1L, true, 1234L);

        JsonDeviceRegistry.DeviceRuntime runtime = registry.getRuntime(1L).orElseThrow();
        assertTrue(runtime.isOnline());
        assertEquals(1234L, runtime.getLastCollectTime());
        assertFalse(registry.getRuntime(2L).isPresent());
    }
}
