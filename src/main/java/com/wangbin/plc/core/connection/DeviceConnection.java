package com.wangbin.plc.core.connection;

import com.wangbin.plc.common.domain.dto.DeviceStatus;
import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ConnectionStatus;
import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.core.collector.protocol.base.NetworkErrorClassifier;
import com.wangbin.plc.core.collector.protocol.base.ProtocolHandler;
import com.wangbin.plc.core.collector.protocol.base.ReadResult;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 单台设备的连接
 * <p>
 * 持有唯一的协议处理器会话，连接、读取与写入在同一把可重入锁下串行执行。
 * 连接失败或整批读取无响应时进入退避状态，退避窗口内跳过重连。
 */
@Slf4j
public class DeviceConnection {

    @Getter
    private final DeviceInfo device;
    private final ProtocolHandler handler;
    private final TimeSeriesStore store;
    private final BackoffPolicy backoffPolicy;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile int retryCount;
    private volatile long lastAttemptTime;
    private volatile long lastConnectTime;
    private volatile long lastCollectTime;
    private volatile String lastError;

    public DeviceConnection(DeviceInfo device, ProtocolHandler handler, TimeSeriesStore store,
                            BackoffPolicy backoffPolicy) {
        this(device, handler, store, backoffPolicy, System::currentTimeMillis);
    }

    public DeviceConnection(DeviceInfo device, ProtocolHandler handler, TimeSeriesStore store,
                            BackoffPolicy backoffPolicy, LongSupplier clock) {
        this.device = device;
        this.handler = handler;
        this.store = store;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    /**
     * 确保已连接，退避窗口内直接返回 false
     */
    public boolean ensureConnected() {
        lock.lock();
        try {
            if (handler.isConnected() && status == ConnectionStatus.CONNECTED) {
                return true;
            }
            long now = clock.getAsLong();
            if (!backoffPolicy.shouldAttempt(lastAttemptTime, now, retryCount)) {
                status = ConnectionStatus.BACKOFF;
                log.debug("设备 {} 处于退避期，跳过重连 (重试{}次, 延迟{}秒)",
                        device.getName(), retryCount, backoffPolicy.delaySeconds(retryCount));
                return false;
            }

            status = ConnectionStatus.CONNECTING;
            lastAttemptTime = now;
            try {
                handler.connect();
                status = ConnectionStatus.CONNECTED;
                retryCount = 0;
                lastError = null;
                lastConnectTime = clock.getAsLong();
                log.info("设备连接成功: {} ({}:{})", device.getName(), device.getHost(), device.getPort());
                return true;
            } catch (Exception e) {
                String message = "连接失败: " + NetworkErrorClassifier.describe(e);
                recordFailure(message, null, null);
                log.error("设备连接失败 {} (重试{}次, 下次等待{}秒): {}", device.getName(), retryCount,
                        backoffPolicy.delaySeconds(retryCount), e.getMessage());
                return false;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 读取设备全部配置地址
     */
    public ReadResult poll() {
        lock.lock();
        try {
            List<AddressConfig> configs = device.getAddressConfigs();
            if (!ensureConnected()) {
                return ReadResult.offline(configs, handler.isStationKeyed(), device.getDefaultStationId());
            }
            if (configs.isEmpty()) {
                ReadResult empty = new ReadResult();
                empty.markOnline();
                return empty;
            }

            ReadResult result;
            try {
                result = handler.readAddresses(configs);
            } catch (Exception e) {
                log.error("读取设备 {} 时发生异常", device.getName(), e);
                result = ReadResult.offline(configs, handler.isStationKeyed(), device.getDefaultStationId());
            }

            if (result.isOnline()) {
                lastCollectTime = clock.getAsLong();
            } else {
                String reason = handler.getLastError() != null ? handler.getLastError() : "设备无响应";
                recordFailure("读取失败: " + reason, null, null);
                handler.disconnect();
                log.warn("设备 {} 离线，进入退避 (重试{}次): {}", device.getName(), retryCount, reason);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写入单个地址，与采集互斥
     */
    public void write(String address, double value) {
        lock.lock();
        try {
            if (!ensureConnected()) {
                throw new NetworkException("设备未连接: " + device.getName()
                        + (lastError != null ? " (" + lastError + ")" : ""), device.getDeviceKey());
            }
            try {
                handler.writeAddress(address, value);
            } catch (NetworkException e) {
                recordFailure("写入失败: " + e.getMessage(), address, null);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    public void updateTimeouts(int connectTimeoutMs, int receiveTimeoutMs) {
        lock.lock();
        try {
            handler.updateTimeouts(connectTimeoutMs, receiveTimeoutMs);
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            handler.disconnect();
            status = ConnectionStatus.DISCONNECTED;
            log.info("设备连接已关闭: {}", device.getName());
        } finally {
            lock.unlock();
        }
    }

    public boolean isStationKeyed() {
        return handler.isStationKeyed();
    }

    public boolean isConnected() {
        return status.isConnected() && handler.isConnected();
    }

    public ConnectionStatus getConnectionStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public String getLastError() {
        return lastError;
    }

    public DeviceStatus getStatus() {
        return DeviceStatus.builder()
                .deviceId(device.getId())
                .deviceName(device.getName())
                .protocol(handler.getProtocolType().getDisplayName())
                .connected(isConnected())
                .status(status.getCode())
                .lastError(lastError)
                .retryCount(retryCount)
                .lastConnectTime(lastConnectTime > 0 ? lastConnectTime : null)
                .lastAttemptTime(lastAttemptTime > 0 ? lastAttemptTime : null)
                .lastCollectTime(lastCollectTime > 0 ? lastCollectTime : null)
                .build();
    }

    private void recordFailure(String message, String address, Integer stationId) {
        retryCount++;
        lastError = message;
        status = ConnectionStatus.BACKOFF;
        boolean stored = store.writeCommunicationError(device.getId(), device.getName(), message, "high",
                address, stationId);
        if (!stored) {
            log.warn("通讯错误未能写入时序存储: {}", device.getName());
        }
    }
}
