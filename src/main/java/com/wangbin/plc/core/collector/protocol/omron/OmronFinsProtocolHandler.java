package com.wangbin.plc.core.collector.protocol.omron;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.protocol.base.AbstractProtocolHandler;
import com.wangbin.plc.core.collector.protocol.base.ByteTransform;
import com.wangbin.plc.core.collector.protocol.base.NetworkErrorClassifier;
import com.wangbin.plc.core.connection.adapter.FrameChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * 欧姆龙 FINS/TCP 协议处理器（CS/CJ 系列）
 */
@Slf4j
public class OmronFinsProtocolHandler extends AbstractProtocolHandler {

    private final int readRetries;
    private final long retryDelayMs;

    private FrameChannel channel;
    private int clientNode;
    private int serverNode;
    private int sid = 0;

    public OmronFinsProtocolHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs,
                                    int readRetries, long retryDelayMs) {
        super(device, connectTimeoutMs, receiveTimeoutMs);
        this.readRetries = Math.max(0, readRetries);
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public ProtocolType getProtocolType() {
        return ProtocolType.OMRON_FINS;
    }

    @Override
    protected void doCreateInstance() {
        channel = new FrameChannel("fins-" + device.getDeviceKey(), device.getHost(), device.getPort());
    }

    @Override
    protected void doConnect() {
        if (channel == null) {
            doCreateInstance();
        }
        channel.connect(connectTimeoutMs);
        byte[] response = channel.request(FinsFrameBuilder.handshake(), FinsFrameBuilder.RESPONSE_LENGTH, receiveTimeoutMs);
        int[] nodes = FinsFrameBuilder.parseHandshake(response);
        clientNode = nodes[0];
        serverNode = nodes[1];
        log.debug("FINS握手完成 {}: 客户端节点{}, PLC节点{}", device.getName(), clientNode, serverNode);
    }

    @Override
    protected void doDisconnect() {
        if (channel != null) {
            channel.close();
        }
    }

    /**
     * 失败后按递增间隔重试，仍失败则抛出最后一次异常
     */
    @Override
    protected Double readValue(AddressConfig config) throws Exception {
        FinsAddress address = FinsAddress.parse(config.getAddress());
        Exception lastFailure = null;
        for (int attempt = 0; attempt <= readRetries; attempt++) {
            try {
                return performRead(address, config);
            } catch (ConfigurationException e) {
                throw e;
            } catch (Exception e) {
                lastFailure = e;
                if (!channel.isActive()) {
                    break;
                }
                if (attempt < readRetries) {
                    log.debug("读取失败，第{}次重试 {}: {} ({})", attempt + 1, device.getName(),
                            config.getAddress(), NetworkErrorClassifier.describe(e));
                    Thread.sleep(retryDelayMs * (attempt + 1));
                }
            }
        }
        throw lastFailure;
    }

    private Double performRead(FinsAddress address, AddressConfig config) {
        DataType type = config.getType();
        if (address.isBitAddress()) {
            byte[] data = exchange(FinsFrameBuilder.readRequest(clientNode, serverNode, nextSid(), address, 1),
                    FinsFrameBuilder.SRC_READ);
            return data.length > 0 && data[0] != 0 ? 1.0 : 0.0;
        }
        int words = type == DataType.STRING
                ? Math.max(1, (config.getStringLength() + 1) / 2)
                : type.getRegisterCount();
        byte[] data = exchange(FinsFrameBuilder.readRequest(clientNode, serverNode, nextSid(), address, words),
                FinsFrameBuilder.SRC_READ);
        if (type == DataType.STRING) {
            return coerceString(ByteTransform.decodeString(data, 0, config.getStringLength(), true),
                    config.getAddress());
        }
        return ByteTransform.decode(data, 0, type, config.resolveByteOrder(device.getByteOrder()));
    }

    @Override
    protected void doWrite(String address, double value) {
        FinsAddress finsAddress = FinsAddress.parse(address);
        byte[] data;
        if (finsAddress.isBitAddress()) {
            data = new byte[]{(byte) (value != 0 ? 1 : 0)};
        } else {
            AddressConfig config = findConfig(address);
            DataType type = config.getType() == DataType.STRING ? DataType.INT16 : config.getType();
            data = ByteTransform.encode(value, type, config.resolveByteOrder(device.getByteOrder()));
        }
        exchange(FinsFrameBuilder.writeRequest(clientNode, serverNode, nextSid(), finsAddress, data),
                FinsFrameBuilder.SRC_WRITE);
    }

    private synchronized byte[] exchange(byte[] request, int expectedSrc) {
        byte[] response = channel.request(request, FinsFrameBuilder.RESPONSE_LENGTH, receiveTimeoutMs);
        return FinsFrameBuilder.parseResponse(response, expectedSrc);
    }

    private synchronized int nextSid() {
        sid = (sid + 1) & 0xFF;
        return sid;
    }
}
