package com.wangbin.plc.core.collector.protocol.base;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.common.exception.ProtocolDataException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AbstractProtocolHandlerTest {

    private static DeviceInfo device() {
        DeviceInfo device = new DeviceInfo();
        device.setId(41L);
        device.setName("PLC-41");
        device.setHost("127.0.0.1");
        device.setPort(502);
        return device;
    }

    private static List<AddressConfig> addresses(String... addresses) {
        return Arrays.stream(addresses)
                .map(address -> AddressConfig.of(address, DataType.INT16))
                .collect(Collectors.toList());
    }

    private static ScriptedProtocolHandler connected(ScriptedProtocolHandler handler) {
        handler.connect();
        assertTrue(handler.isConnected());
        return handler;
    }

    @Test
    void protocolErrorGivesNullButDeviceStaysOnline() {
        ScriptedProtocolHandler handler = connected(new ScriptedProtocolHandler(device())
                .value("40001", 12.0)
                .failing("40002", new ProtocolDataException("非法数据地址"))
                .value("40003", 7.0));

        ReadResult result = handler.readAddresses(addresses("40001", "40002", "40003"));

        assertTrue(result.isOnline());
        assertEquals(12.0, result.getValues().get("40001"));
        assertNull(result.getValues().get("40002"));
        assertTrue(result.getValues().containsKey("40002"));
        assertEquals(7.0, result.getValues().get("40003"));
        assertTrue(handler.isConnected());
    }

    @Test
    void networkErrorStopsBatchAndMarksOffline() {
        ScriptedProtocolHandler handler = connected(new ScriptedProtocolHandler(device())
                .failing("40001", new IOException("Connection reset by peer"))
                .value("40002", 1.0)
                .value("40003", 2.0));

        ReadResult result = handler.readAddresses(addresses("40001", "40002", "40003"));

        assertFalse(result.isOnline());
        assertEquals(3, result.getValues().size());
        assertEquals(0, result.getSuccessCount());
        assertEquals(List.of("40001"), handler.getReads());
        assertFalse(handler.isConnected());
        assertNotNull(handler.getLastError());
    }

    @Test
    void networkErrorAfterSuccessfulReadsKeepsEarlierValues() {
        ScriptedProtocolHandler handler = connected(new ScriptedProtocolHandler(device())
                .value("40001", 5.0)
                .failing("40002", new NetworkException("Modbus 操作超时(1000ms)", "41"))
                .value("40003", 2.0));

        ReadResult result = handler.readAddresses(addresses("40001", "40002", "40003"));

        assertEquals(5.0, result.getValues().get("40001"));
        assertNull(result.getValues().get("40002"));
        assertNull(result.getValues().get("40003"));
        assertEquals(List.of("40001", "40002"), handler.getReads());
        assertFalse(handler.isConnected());
    }

    @Test
    void unparsableStringGivesNull() {
        ScriptedProtocolHandler handler = connected(new ScriptedProtocolHandler(device())
                .text("D100", "ABC?")
                .text("D200", " 36.5 "));

        ReadResult result = handler.readAddresses(addresses("D100", "D200"));

        assertNull(result.getValues().get("D100"));
        assertEquals(36.5, result.getValues().get("D200"));
        assertTrue(result.isOnline());
        assertTrue(handler.isConnected());
    }

    @Test
    void configurationErrorGivesNullWithoutMarkingOnline() {
        ScriptedProtocolHandler handler = connected(new ScriptedProtocolHandler(device())
                .failing("X1", new ConfigurationException("无法解析地址: X1")));

        ReadResult result = handler.readAddresses(addresses("X1"));

        assertNull(result.getValues().get("X1"));
        assertFalse(result.isOnline());
        assertTrue(handler.isConnected());
    }

    @Test
    void disconnectedHandlerReturnsAllNullWithoutReading() {
        ScriptedProtocolHandler handler = new ScriptedProtocolHandler(device()).value("40001", 1.0);

        ReadResult result = handler.readAddresses(addresses("40001"));

        assertNull(result.getValues().get("40001"));
        assertTrue(handler.getReads().isEmpty());
    }

    @Test
    void connectRejectsMissingHost() {
        DeviceInfo device = device();
        device.setHost(" ");
        ScriptedProtocolHandler handler = new ScriptedProtocolHandler(device);

        assertThrows(ConfigurationException.class, handler::connect);
        assertFalse(handler.isConnected());
    }
}
