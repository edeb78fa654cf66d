package com.wangbin.plc.core.collector.protocol.modbus;

import com.digitalpetri.modbus.client.ModbusTcpClient;
import com.digitalpetri.modbus.exceptions.ModbusResponseException;
import com.digitalpetri.modbus.pdu.ReadCoilsRequest;
import com.digitalpetri.modbus.pdu.ReadDiscreteInputsRequest;
import com.digitalpetri.modbus.pdu.ReadHoldingRegistersRequest;
import com.digitalpetri.modbus.pdu.ReadInputRegistersRequest;
import com.digitalpetri.modbus.pdu.WriteMultipleRegistersRequest;
import com.digitalpetri.modbus.pdu.WriteSingleCoilRequest;
import com.digitalpetri.modbus.pdu.WriteSingleRegisterRequest;
import com.digitalpetri.modbus.tcp.client.NettyTcpClientTransport;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.common.exception.ProtocolDataException;
import com.wangbin.plc.core.collector.protocol.modbus.base.AbstractModbusProtocolHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Modbus TCP 协议处理器
 */
@Slf4j
public class ModbusTcpProtocolHandler extends AbstractModbusProtocolHandler {

    private static final long REQUEST_TIMEOUT_MARGIN_MS = 500;

    private ModbusTcpClient client;
    private Duration appliedConnectTimeout;
    private Duration appliedRequestTimeout;

    public ModbusTcpProtocolHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs) {
        super(device, connectTimeoutMs, receiveTimeoutMs);
    }

    @Override
    public ProtocolType getProtocolType() {
        return ProtocolType.MODBUS_TCP;
    }

    @Override
    protected void doCreateInstance() {
        releaseClient();
        Duration connectTimeout = Duration.ofMillis(connectTimeoutMs);
        Duration requestTimeout = requestTimeout(receiveTimeoutMs);
        NettyTcpClientTransport transport = NettyTcpClientTransport.create(cfg -> {
            cfg.hostname = device.getHost();
            cfg.port = device.getPort();
            cfg.connectTimeout = connectTimeout;
        });
        client = ModbusTcpClient.create(transport, cfg -> cfg.requestTimeout = requestTimeout);
        appliedConnectTimeout = connectTimeout;
        appliedRequestTimeout = requestTimeout;
        log.debug("Modbus TCP 客户端超时: 连接{}ms, 请求{}ms", connectTimeout.toMillis(), requestTimeout.toMillis());
    }

    /**
     * 超时变更后下次连接时重建客户端，当前连接保持到断开为止
     */
    @Override
    protected void onTimeoutsUpdated() {
        instanceCreated = false;
    }

    /**
     * 库内请求超时略长于接收超时，保证先由 await 按网络超时处理
     */
    static Duration requestTimeout(int receiveTimeoutMs) {
        return Duration.ofMillis(Math.max(receiveTimeoutMs, 0) + REQUEST_TIMEOUT_MARGIN_MS);
    }

    Duration getAppliedConnectTimeout() {
        return appliedConnectTimeout;
    }

    Duration getAppliedRequestTimeout() {
        return appliedRequestTimeout;
    }

    boolean hasClient() {
        return client != null;
    }

    private void releaseClient() {
        ModbusTcpClient previous = client;
        client = null;
        if (previous == null) {
            return;
        }
        try {
            previous.disconnect();
        } catch (Exception e) {
            log.debug("释放旧的 Modbus TCP 客户端异常: {}", device.getName(), e);
        }
    }

    @Override
    protected void doConnect() throws Exception {
        if (client == null) {
            doCreateInstance();
        }
        client.connect();
    }

    @Override
    protected void doDisconnect() throws Exception {
        try {
            if (client != null) {
                client.disconnect();
            }
        } finally {
            client = null;
            instanceCreated = false;
        }
    }

    @Override
    protected byte[] readBits(int unitId, RegisterType type, int offset, int quantity) throws Exception {
        if (type == RegisterType.COIL) {
            return await(client.readCoilsAsync(unitId, new ReadCoilsRequest(offset, quantity))).coils();
        }
        return await(client.readDiscreteInputsAsync(unitId, new ReadDiscreteInputsRequest(offset, quantity))).inputs();
    }

    @Override
    protected byte[] readRegisters(int unitId, RegisterType type, int offset, int quantity) throws Exception {
        if (type == RegisterType.INPUT_REGISTER) {
            return await(client.readInputRegistersAsync(unitId,
                    new ReadInputRegistersRequest(offset, quantity))).registers();
        }
        return await(client.readHoldingRegistersAsync(unitId,
                new ReadHoldingRegistersRequest(offset, quantity))).registers();
    }

    @Override
    protected void writeCoil(int unitId, int offset, boolean value) throws Exception {
        await(client.writeSingleCoilAsync(unitId, new WriteSingleCoilRequest(offset, value)));
    }

    @Override
    protected void writeRegisters(int unitId, int offset, byte[] data) throws Exception {
        if (data.length == 2) {
            int value = ((data[0] & 0xFF) << 8) | (data[1] & 0xFF);
            await(client.writeSingleRegisterAsync(unitId, new WriteSingleRegisterRequest(offset, value)));
            return;
        }
        await(client.writeMultipleRegistersAsync(unitId,
                new WriteMultipleRegistersRequest(offset, data.length / 2, data)));
    }

    /**
     * 阻塞等待结果，设备异常响应归为数据错误，超时归为网络错误
     */
    private <T> T await(CompletionStage<T> stage) throws Exception {
        if (client == null) {
            throw new NetworkException("Modbus TCP 客户端尚未连接", device.getDeviceKey());
        }
        try {
            return stage.toCompletableFuture().get(receiveTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new NetworkException("Modbus 操作超时(" + receiveTimeoutMs + "ms)", device.getDeviceKey(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ModbusResponseException) {
                throw new ProtocolDataException("设备返回异常响应: " + cause.getMessage(),
                        device.getDeviceKey(), null, cause);
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }
}
