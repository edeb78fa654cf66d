package com.wangbin.plc.core.collector.protocol.modbus;

import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.protocol.modbus.domain.ModbusAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModbusAddressTest {

    @Test
    void conventionalRangesMapToRegisterTypes() {
        assertAddress("1", RegisterType.COIL, 0);
        assertAddress("9999", RegisterType.COIL, 9998);
        assertAddress("10001", RegisterType.DISCRETE_INPUT, 0);
        assertAddress("30005", RegisterType.INPUT_REGISTER, 4);
        assertAddress("40001", RegisterType.HOLDING_REGISTER, 0);
        assertAddress(" 40100 ", RegisterType.HOLDING_REGISTER, 99);
    }

    @Test
    void otherNumbersAreRawHoldingOffsets() {
        assertAddress("0", RegisterType.HOLDING_REGISTER, 0);
        assertAddress("20000", RegisterType.HOLDING_REGISTER, 20000);
        assertAddress("65535", RegisterType.HOLDING_REGISTER, 65535);
    }

    @Test
    void invalidAddressesAreRejected() {
        assertThrows(ConfigurationException.class, () -> ModbusAddress.parse("D100"));
        assertThrows(ConfigurationException.class, () -> ModbusAddress.parse(""));
        assertThrows(ConfigurationException.class, () -> ModbusAddress.parse("-1"));
        assertThrows(ConfigurationException.class, () -> ModbusAddress.parse("70000"));
    }

    private static void assertAddress(String text, RegisterType type, int offset) {
        ModbusAddress address = ModbusAddress.parse(text);
        assertEquals(type, address.getRegisterType());
        assertEquals(offset, address.getOffset());
    }
}
