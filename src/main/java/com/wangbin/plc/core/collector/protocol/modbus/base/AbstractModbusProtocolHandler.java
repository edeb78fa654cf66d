package com.wangbin.plc.core.collector.protocol.modbus.base;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.protocol.base.AbstractProtocolHandler;
import com.wangbin.plc.core.collector.protocol.base.ByteTransform;
import com.wangbin.plc.core.collector.protocol.modbus.domain.ModbusAddress;
import lombok.extern.slf4j.Slf4j;

/**
 * Modbus 处理器基类：地址解析、站号选择与数值编解码
 */
@Slf4j
public abstract class AbstractModbusProtocolHandler extends AbstractProtocolHandler {

    protected AbstractModbusProtocolHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs) {
        super(device, connectTimeoutMs, receiveTimeoutMs);
    }

    @Override
    protected Double readValue(AddressConfig config) throws Exception {
        ModbusAddress address = ModbusAddress.parse(config.getAddress());
        int unitId = config.resolveStationId(device.getDefaultStationId());
        DataType type = config.getType();

        if (address.getRegisterType().isBitType()) {
            byte[] bits = readBits(unitId, address.getRegisterType(), address.getOffset(), 1);
            if (bits == null || bits.length == 0) {
                return null;
            }
            return (bits[0] & 0x01) == 1 ? 1.0 : 0.0;
        }

        int quantity = type == DataType.STRING
                ? Math.max(1, (config.getStringLength() + 1) / 2)
                : type.getRegisterCount();
        byte[] registers = readRegisters(unitId, address.getRegisterType(), address.getOffset(), quantity);
        if (type == DataType.STRING) {
            String text = ByteTransform.decodeString(registers, 0, config.getStringLength(), false);
            return coerceString(text, config.getAddress());
        }
        DataFormat format = config.resolveByteOrder(device.getByteOrder());
        return ByteTransform.decode(registers, 0, type, format);
    }

    @Override
    protected void doWrite(String address, double value) throws Exception {
        ModbusAddress modbusAddress = ModbusAddress.parse(address);
        RegisterType registerType = modbusAddress.getRegisterType();
        if (!registerType.isWritable()) {
            throw new ConfigurationException("只读地址不允许写入: " + address + " (" + registerType.getCode() + ")",
                    device.getDeviceKey(), address);
        }
        AddressConfig config = findConfig(address);
        int unitId = config.resolveStationId(device.getDefaultStationId());
        if (registerType == RegisterType.COIL) {
            writeCoil(unitId, modbusAddress.getOffset(), value != 0);
            return;
        }
        DataType type = config.getType() == DataType.STRING ? DataType.INT16 : config.getType();
        byte[] data = ByteTransform.encode(value, type, config.resolveByteOrder(device.getByteOrder()));
        writeRegisters(unitId, modbusAddress.getOffset(), data);
    }

    /**
     * 读取线圈或离散输入，返回按位打包的字节
     */
    protected abstract byte[] readBits(int unitId, RegisterType type, int offset, int quantity) throws Exception;

    /**
     * 读取保持寄存器或输入寄存器，返回寄存器原始字节
     */
    protected abstract byte[] readRegisters(int unitId, RegisterType type, int offset, int quantity) throws Exception;

    protected abstract void writeCoil(int unitId, int offset, boolean value) throws Exception;

    protected abstract void writeRegisters(int unitId, int offset, byte[] data) throws Exception;
}
