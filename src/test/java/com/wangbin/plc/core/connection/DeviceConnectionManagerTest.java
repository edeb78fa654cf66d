package com.wangbin.plc.core.connection;

import com.wangbin.plc.common.domain.dto.DeviceStatus;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.core.collector.factory.ProtocolHandlerFactory;
import com.wangbin.plc.core.collector.protocol.base.FakeProtocolHandler;
import com.wangbin.plc.core.config.CollectorSettings;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.storage.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DeviceConnectionManagerTest {

    private DeviceConnectionManager manager() {
        ProtocolHandlerFactory factory = new ProtocolHandlerFactory(new PlcProperties());
        factory.registerHandler(ProtocolType.MODBUS_TCP, (device, c, r) -> new FakeProtocolHandler(device));
        return new DeviceConnectionManager(factory, new InMemoryTimeSeriesStore(), new BackoffPolicy());
    }

    private DeviceInfo device(long id, Integer groupId) {
        DeviceInfo device = new DeviceInfo();
        device.setId(id);
        device.setName("PLC-" + id);
        device.setProtocolType(ProtocolType.MODBUS_TCP);
        device.setHost("127.0.0.1");
        device.setPort(502);
        device.setGroupId(groupId);
        return device;
    }

    @Test
    void capConnectsHighestPriorityDevices() {
        DeviceConnectionManager manager = manager();
        List<DeviceInfo> devices = new ArrayList<>();
        devices.add(device(5, null));
        devices.add(device(4, 2));
        devices.add(device(3, 1));
        devices.add(device(2, 2));
        devices.add(device(1, null));

        manager.reload(devices, CollectorSettings.builder().maxConcurrentConnections(3).build());

        Set<Long> managed = manager.snapshot().stream()
                .map(c -> c.getDevice().getId())
                .collect(Collectors.toSet());
        assertEquals(Set.of(3L, 2L, 4L), managed);

        DeviceStatus skipped = manager.getStatus(1L).orElseThrow();
        assertFalse(skipped.isConnected());
        assertEquals("disconnected", skipped.getStatus());
        assertEquals(5, manager.getAllStatus().size());
    }

    @Test
    void reloadReplacesPreviousConnections() {
        DeviceConnectionManager manager = manager();
        manager.reload(List.of(device(1, null), device(2, null)), CollectorSettings.defaults());
        manager.snapshot().forEach(DeviceConnection::ensureConnected);
        assertEquals(2, manager.getActiveConnectionCount());

        manager.reload(List.of(device(3, null)), CollectorSettings.defaults());

        assertEquals(1, manager.size());
        assertTrue(manager.get(1L).isEmpty());
        assertTrue(manager.get(3L).isPresent());
        assertEquals(0, manager.getActiveConnectionCount());
    }
}
