package com.wangbin.plc.core.connection;

import com.wangbin.plc.common.domain.dto.DeviceStatus;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ConnectionStatus;
import com.wangbin.plc.core.collector.factory.ProtocolHandlerFactory;
import com.wangbin.plc.core.collector.protocol.base.ProtocolHandler;
import com.wangbin.plc.core.config.CollectorSettings;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 设备连接管理器
 * <p>
 * 连接表只在重新加载时整体替换（写锁），采集期间读锁下遍历快照。
 */
@Slf4j
@Component
public class DeviceConnectionManager {

    private static final Comparator<DeviceInfo> PRIORITY = Comparator
            .comparingInt(DeviceInfo::getGroupOrder)
            .thenComparing(DeviceInfo::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ProtocolHandlerFactory handlerFactory;
    private final TimeSeriesStore store;
    private final BackoffPolicy backoffPolicy;
    private final ReentrantReadWriteLock mapLock = new ReentrantReadWriteLock();

    // 设备ID -> 连接
    private final Map<Long, DeviceConnection> connections = new LinkedHashMap<>();

    // 未建立连接的设备（超出连接上限或处理器创建失败）
    private final Map<Long, DeviceStatus> unconnected = new LinkedHashMap<>();

    @Autowired
    public DeviceConnectionManager(ProtocolHandlerFactory handlerFactory, TimeSeriesStore store,
                                   PlcProperties properties) {
        this(handlerFactory, store, new BackoffPolicy(properties.getBackoff().getCapSeconds()));
    }

    public DeviceConnectionManager(ProtocolHandlerFactory handlerFactory, TimeSeriesStore store,
                                   BackoffPolicy backoffPolicy) {
        this.handlerFactory = handlerFactory;
        this.store = store;
        this.backoffPolicy = backoffPolicy;
    }

    /**
     * 按分组、ID 排序后只为前 maxConcurrentConnections 台设备创建连接
     */
    public void reload(List<DeviceInfo> devices, CollectorSettings settings) {
        List<DeviceInfo> sorted = new ArrayList<>(devices);
        sorted.sort(PRIORITY);
        int cap = settings.getMaxConcurrentConnections();

        mapLock.writeLock().lock();
        try {
            closeAllLocked();
            for (int i = 0; i < sorted.size(); i++) {
                DeviceInfo device = sorted.get(i);
                if (i >= cap) {
                    unconnected.put(device.getId(), disconnectedStatus(device, "超出最大连接数限制: " + cap));
                    continue;
                }
                try {
                    ProtocolHandler handler = handlerFactory.createHandler(device, settings.getConnectTimeoutMs(),
                            settings.getReceiveTimeoutMs());
                    connections.put(device.getId(), new DeviceConnection(device, handler, store, backoffPolicy));
                } catch (Exception e) {
                    log.error("创建设备处理器失败: {} - {}", device.getName(), e.getMessage());
                    unconnected.put(device.getId(), disconnectedStatus(device, e.getMessage()));
                }
            }
            if (sorted.size() > cap) {
                log.warn("设备数量 {} 超过最大连接数 {}，{} 台设备未连接", sorted.size(), cap, sorted.size() - cap);
            }
            log.info("设备连接已重新加载: {} 台纳入采集", connections.size());
        } finally {
            mapLock.writeLock().unlock();
        }
    }

    public List<DeviceConnection> snapshot() {
        mapLock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            mapLock.readLock().unlock();
        }
    }

    public Optional<DeviceConnection> get(Long deviceId) {
        mapLock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(deviceId));
        } finally {
            mapLock.readLock().unlock();
        }
    }

    public void updateTimeouts(int connectTimeoutMs, int receiveTimeoutMs) {
        for (DeviceConnection connection : snapshot()) {
            connection.updateTimeouts(connectTimeoutMs, receiveTimeoutMs);
        }
        log.info("已更新所有连接超时: connect={}ms, receive={}ms", connectTimeoutMs, receiveTimeoutMs);
    }

    public List<DeviceStatus> getAllStatus() {
        mapLock.readLock().lock();
        try {
            List<DeviceStatus> result = new ArrayList<>();
            for (DeviceConnection connection : connections.values()) {
                result.add(connection.getStatus());
            }
            result.addAll(unconnected.values());
            return result;
        } finally {
            mapLock.readLock().unlock();
        }
    }

    public Optional<DeviceStatus> getStatus(Long deviceId) {
        mapLock.readLock().lock();
        try {
            DeviceConnection connection = connections.get(deviceId);
            if (connection != null) {
                return Optional.of(connection.getStatus());
            }
            return Optional.ofNullable(unconnected.get(deviceId));
        } finally {
            mapLock.readLock().unlock();
        }
    }

    public int getActiveConnectionCount() {
        int count = 0;
        for (DeviceConnection connection : snapshot()) {
            if (connection.isConnected()) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        mapLock.readLock().lock();
        try {
            return connections.size();
        } finally {
            mapLock.readLock().unlock();
        }
    }

    public void closeAll() {
        mapLock.writeLock().lock();
        try {
            closeAllLocked();
        } finally {
            mapLock.writeLock().unlock();
        }
    }

    private void closeAllLocked() {
        for (DeviceConnection connection : connections.values()) {
            try {
                connection.close();
            } catch (Exception e) {
                log.error("关闭设备连接失败: {}", connection.getDevice().getName(), e);
            }
        }
        connections.clear();
        unconnected.clear();
    }

    private DeviceStatus disconnectedStatus(DeviceInfo device, String reason) {
        return DeviceStatus.builder()
                .deviceId(device.getId())
                .deviceName(device.getName())
                .protocol(device.getProtocolType() != null ? device.getProtocolType().getDisplayName() : null)
                .connected(false)
                .status(ConnectionStatus.DISCONNECTED.getCode())
                .lastError(reason)
                .retryCount(0)
                .build();
    }
}
