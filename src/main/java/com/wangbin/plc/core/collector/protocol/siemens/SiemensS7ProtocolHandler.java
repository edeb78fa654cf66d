package com.wangbin.plc.core.collector.protocol.siemens;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.core.collector.protocol.base.AbstractProtocolHandler;
import com.wangbin.plc.core.collector.protocol.base.ByteTransform;
import com.wangbin.plc.core.connection.adapter.FrameChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * 西门子 S7 协议处理器（S7-1200/1500，默认机架0槽位1）
 */
@Slf4j
public class SiemensS7ProtocolHandler extends AbstractProtocolHandler {

    private FrameChannel channel;
    private int pduRef = 0;
    private int pduLength = 240;

    public SiemensS7ProtocolHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs) {
        super(device, connectTimeoutMs, receiveTimeoutMs);
    }

    @Override
    public ProtocolType getProtocolType() {
        return ProtocolType.SIEMENS_S7;
    }

    @Override
    protected void doCreateInstance() {
        channel = new FrameChannel("s7-" + device.getDeviceKey(), device.getHost(), device.getPort());
    }

    @Override
    protected void doConnect() {
        if (channel == null) {
            doCreateInstance();
        }
        channel.connect(connectTimeoutMs);
        byte[] confirm = channel.request(S7FrameBuilder.connectionRequest(device.getRack(), device.getSlot()),
                S7FrameBuilder.RESPONSE_LENGTH, receiveTimeoutMs);
        S7FrameBuilder.checkConnectionConfirm(confirm);
        byte[] setup = channel.request(S7FrameBuilder.setupCommunication(nextPduRef()),
                S7FrameBuilder.RESPONSE_LENGTH, receiveTimeoutMs);
        pduLength = S7FrameBuilder.parseSetupCommunication(setup);
        log.debug("S7通信建立 {}: 机架{} 槽位{} PDU长度{}", device.getName(), device.getRack(), device.getSlot(), pduLength);
    }

    @Override
    protected void doDisconnect() {
        if (channel != null) {
            channel.close();
        }
    }

    @Override
    protected Double readValue(AddressConfig config) {
        S7Address address = S7Address.parse(config.getAddress());
        DataType type = config.getType();
        int byteCount = type == DataType.STRING ? config.getStringLength() : type.getMinBytes();
        byte[] data = exchangeRead(address, byteCount);
        if (address.isBitAddress()) {
            return data.length > 0 && (data[0] & 0x01) == 1 ? 1.0 : 0.0;
        }
        if (type == DataType.STRING) {
            return coerceString(ByteTransform.decodeString(data, 0, byteCount, false), config.getAddress());
        }
        if (type == DataType.BOOL) {
            return data.length > 0 && data[0] != 0 ? 1.0 : 0.0;
        }
        return ByteTransform.decode(data, 0, type, config.resolveByteOrder(device.getByteOrder()));
    }

    @Override
    protected void doWrite(String address, double value) {
        S7Address s7Address = S7Address.parse(address);
        byte[] data;
        if (s7Address.isBitAddress()) {
            data = new byte[]{(byte) (value != 0 ? 1 : 0)};
        } else {
            AddressConfig config = findConfig(address);
            DataType type = config.getType() == DataType.STRING ? DataType.INT16 : config.getType();
            data = ByteTransform.encode(value, type, config.resolveByteOrder(device.getByteOrder()));
        }
        byte[] response;
        synchronized (this) {
            response = channel.request(S7FrameBuilder.writeRequest(nextPduRef(), s7Address, data),
                    S7FrameBuilder.RESPONSE_LENGTH, receiveTimeoutMs);
        }
        S7FrameBuilder.parseWriteResponse(response);
    }

    private synchronized byte[] exchangeRead(S7Address address, int byteCount) {
        byte[] response = channel.request(S7FrameBuilder.readRequest(nextPduRef(), address, byteCount),
                S7FrameBuilder.RESPONSE_LENGTH, receiveTimeoutMs);
        return S7FrameBuilder.parseReadResponse(response);
    }

    private synchronized int nextPduRef() {
        pduRef = (pduRef + 1) & 0xFFFF;
        return pduRef;
    }
}
