package com.wangbin.plc.core.collector.protocol.modbus;

import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.core.collector.protocol.modbus.base.AbstractModbusProtocolHandler;
import com.wangbin.plc.core.collector.protocol.modbus.utils.RtuFrameCodec;
import com.wangbin.plc.core.connection.adapter.FrameChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * Modbus RTU over TCP 协议处理器
 * <p>
 * 一条 TCP 连接后面挂多个串口站号，站号切换时等待总线稳定后再发下一帧。
 */
@Slf4j
public class ModbusRtuOverTcpProtocolHandler extends AbstractModbusProtocolHandler {

    private final long stationSwitchDelayMs;
    private FrameChannel channel;
    private int lastStationId = -1;

    public ModbusRtuOverTcpProtocolHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs,
                                           long stationSwitchDelayMs) {
        super(device, connectTimeoutMs, receiveTimeoutMs);
        this.stationSwitchDelayMs = stationSwitchDelayMs;
    }

    @Override
    public ProtocolType getProtocolType() {
        return ProtocolType.MODBUS_RTU_OVER_TCP;
    }

    @Override
    public boolean isStationKeyed() {
        return true;
    }

    @Override
    protected void doCreateInstance() {
        channel = new FrameChannel("rtu-" + device.getDeviceKey(), device.getHost(), device.getPort());
    }

    @Override
    protected void doConnect() {
        if (channel == null) {
            doCreateInstance();
        }
        channel.connect(connectTimeoutMs);
        lastStationId = -1;
    }

    @Override
    protected void doDisconnect() {
        if (channel != null) {
            channel.close();
        }
    }

    @Override
    protected byte[] readBits(int unitId, RegisterType type, int offset, int quantity) throws InterruptedException {
        return exchange(unitId, type.getFunctionCode(),
                RtuFrameCodec.readRequest(unitId, type.getFunctionCode(), offset, quantity));
    }

    @Override
    protected byte[] readRegisters(int unitId, RegisterType type, int offset, int quantity) throws InterruptedException {
        return exchange(unitId, type.getFunctionCode(),
                RtuFrameCodec.readRequest(unitId, type.getFunctionCode(), offset, quantity));
    }

    @Override
    protected void writeCoil(int unitId, int offset, boolean value) throws InterruptedException {
        exchange(unitId, 0x05, RtuFrameCodec.writeSingleCoilRequest(unitId, offset, value));
    }

    @Override
    protected void writeRegisters(int unitId, int offset, byte[] data) throws InterruptedException {
        int functionCode = data.length == 2 ? 0x06 : 0x10;
        exchange(unitId, functionCode, RtuFrameCodec.writeRegistersRequest(unitId, offset, data));
    }

    private synchronized byte[] exchange(int unitId, int functionCode, byte[] request) throws InterruptedException {
        settleStation(unitId);
        byte[] response = channel.request(request, RtuFrameCodec.RESPONSE_LENGTH, receiveTimeoutMs);
        return RtuFrameCodec.parseResponse(response, unitId, functionCode);
    }

    /**
     * 半双工总线：站号变化时等待上一站释放总线
     */
    void settleStation(int unitId) throws InterruptedException {
        if (lastStationId != -1 && lastStationId != unitId && stationSwitchDelayMs > 0) {
            log.debug("切换站号 {} -> {}，等待{}ms", lastStationId, unitId, stationSwitchDelayMs);
            pause(stationSwitchDelayMs);
        }
        lastStationId = unitId;
    }

    protected void pause(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }
}
