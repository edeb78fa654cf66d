package com.wangbin.plc.core.collector.protocol.modbus.domain;

import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.common.exception.ConfigurationException;
import lombok.Getter;

/**
 * Modbus 地址解析结果
 * <p>
 * 1-9999 线圈，10001-19999 离散输入，30001-39999 输入寄存器，
 * 40001-49999 保持寄存器，其余数字地址直接作为保持寄存器偏移。
 */
@Getter
public class ModbusAddress {

    private final RegisterType registerType;
    private final int offset;

    public ModbusAddress(RegisterType registerType, int offset) {
        this.registerType = registerType;
        this.offset = offset;
    }

    public static ModbusAddress parse(String address) {
        if (address == null || address.trim().isEmpty()) {
            throw new ConfigurationException("Modbus地址不能为空");
        }
        int number;
        try {
            number = Integer.parseInt(address.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Modbus地址格式错误: " + address, null, address);
        }
        if (number < 0) {
            throw new ConfigurationException("Modbus地址不能为负数: " + address, null, address);
        }
        if (number >= 1 && number <= 9999) {
            return new ModbusAddress(RegisterType.COIL, number - 1);
        }
        if (number >= 10001 && number <= 19999) {
            return new ModbusAddress(RegisterType.DISCRETE_INPUT, number - 10001);
        }
        if (number >= 30001 && number <= 39999) {
            return new ModbusAddress(RegisterType.INPUT_REGISTER, number - 30001);
        }
        if (number >= 40001 && number <= 49999) {
            return new ModbusAddress(RegisterType.HOLDING_REGISTER, number - 40001);
        }
        if (number > 65535) {
            throw new ConfigurationException("Modbus地址超出范围: " + address, null, address);
        }
        return new ModbusAddress(RegisterType.HOLDING_REGISTER, number);
    }

    @Override
    public String toString() {
        return registerType.getCode() + ":" + offset;
    }
}
