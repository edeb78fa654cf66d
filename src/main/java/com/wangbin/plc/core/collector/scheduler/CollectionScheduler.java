package com.wangbin.plc.core.collector.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.plc.common.domain.dto.ConnectionTestRequest;
import com.wangbin.plc.common.domain.dto.ConnectionTestResult;
import com.wangbin.plc.common.domain.dto.DeviceStatus;
import com.wangbin.plc.common.domain.dto.ProtocolInfo;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.CollectOutcome;
import com.wangbin.plc.common.exception.CollectorException;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.factory.ProtocolHandlerFactory;
import com.wangbin.plc.core.collector.protocol.base.NetworkErrorClassifier;
import com.wangbin.plc.core.collector.protocol.base.ProtocolHandler;
import com.wangbin.plc.core.collector.protocol.base.ReadResult;
import com.wangbin.plc.core.collector.statistics.CollectionStatistics;
import com.wangbin.plc.core.config.CollectorSettings;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.config.SettingsValidator;
import com.wangbin.plc.core.connection.DeviceConnection;
import com.wangbin.plc.core.connection.DeviceConnectionManager;
import com.wangbin.plc.core.pipeline.DataPipeline;
import com.wangbin.plc.core.registry.DeviceRegistry;
import com.wangbin.plc.core.storage.CollectLogStore;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PLC 采集调度器
 * <p>
 * 周期触发一次全量采集，设备任务提交到有界工作线程池并行执行。
 * 同一时刻最多一个采集周期，周期运行中再次触发直接跳过并计为合并。
 */
@Slf4j
@Service
public class CollectionScheduler {

    private final DeviceRegistry registry;
    private final DeviceConnectionManager connectionManager;
    private final DataPipeline pipeline;
    private final CollectLogStore collectLogStore;
    private final TimeSeriesStore store;
    private final ProtocolHandlerFactory handlerFactory;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final PlcProperties.CollectConfig collectConfig;

    private final CollectionStatistics statistics = new CollectionStatistics();

    // 周期锁，防止两个采集周期重叠
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ThreadPoolExecutor workerPool;

    private volatile CollectorSettings settings;
    private volatile boolean running = false;
    private ScheduledFuture<?> collectFuture;
    private ScheduledFuture<?> cleanupFuture;

    @Autowired
    public CollectionScheduler(DeviceRegistry registry,
                               DeviceConnectionManager connectionManager,
                               DataPipeline pipeline,
                               CollectLogStore collectLogStore,
                               TimeSeriesStore store,
                               ProtocolHandlerFactory handlerFactory,
                               @Qualifier("taskScheduler") ThreadPoolTaskScheduler taskScheduler,
                               PlcProperties properties) {
        this.registry = registry;
        this.connectionManager = connectionManager;
        this.pipeline = pipeline;
        this.collectLogStore = collectLogStore;
        this.store = store;
        this.handlerFactory = handlerFactory;
        this.taskScheduler = taskScheduler;
        this.collectConfig = properties.getCollect();
        this.settings = SettingsValidator.requireValid(properties.toSettings());

        int workers = Math.max(1, collectConfig.getWorkerPoolSize());
        this.workerPool = new ThreadPoolExecutor(
                workers,
                workers,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("plc-collect-%d")
                        .setDaemon(true)
                        .build()
        );
    }

    @PostConstruct
    public void init() {
        if (!collectConfig.isAutoStart()) {
            log.info("采集调度器未自动启动 (plc.collect.auto-start=false)");
            return;
        }
        try {
            reloadDevices();
        } catch (Exception e) {
            log.error("加载设备失败，调度器仍按周期运行", e);
        }
        start();
    }

    @PreDestroy
    public void destroy() {
        log.info("开始停止采集调度器...");
        stop();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        connectionManager.closeAll();
        log.info("采集调度器已停止");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduleCollect();
        cleanupFuture = taskScheduler.schedule(this::cleanupExpiredData, new CronTrigger(collectConfig.getCleanupCron()));
        log.info("采集调度器已启动，采集间隔: {}秒, 工作线程: {}", settings.getCollectIntervalSeconds(),
                workerPool.getCorePoolSize());
    }

    public synchronized void stop() {
        running = false;
        if (collectFuture != null) {
            collectFuture.cancel(false);
            collectFuture = null;
        }
        if (cleanupFuture != null) {
            cleanupFuture.cancel(false);
            cleanupFuture = null;
        }
    }

    private void scheduleCollect() {
        if (collectFuture != null) {
            collectFuture.cancel(false);
        }
        collectFuture = taskScheduler.scheduleAtFixedRate(this::runCycle,
                Duration.ofSeconds(settings.getCollectIntervalSeconds()));
    }

    /**
     * 执行一个采集周期，已有周期在运行时返回 false
     */
    public boolean runCycle() {
        if (!cycleLock.tryLock()) {
            statistics.cycleCoalesced();
            log.debug("上一个采集周期仍在运行，本次触发跳过");
            return false;
        }
        long startTime = System.currentTimeMillis();
        statistics.cycleStarted(startTime);
        try {
            collectAll(startTime);
        } catch (Exception e) {
            log.error("采集周期执行异常", e);
        } finally {
            statistics.cycleCompleted(System.currentTimeMillis() - startTime);
            cycleLock.unlock();
        }
        return true;
    }

    private void collectAll(long startTime) {
        Set<Long> activeIds = new HashSet<>();
        for (DeviceInfo device : registry.listActiveDevices()) {
            activeIds.add(device.getId());
        }

        Map<DeviceConnection, Future<?>> futures = new LinkedHashMap<>();
        for (DeviceConnection connection : connectionManager.snapshot()) {
            if (!activeIds.contains(connection.getDevice().getId())) {
                continue;
            }
            futures.put(connection, workerPool.submit(() -> collectDevice(connection)));
        }
        if (futures.isEmpty()) {
            log.debug("没有需要采集的设备");
            return;
        }

        long deadline = startTime + collectConfig.getCycleTimeoutSeconds() * 1000L;
        long deviceTimeoutMs = collectConfig.getDeviceTimeoutSeconds() * 1000L;
        boolean timedOut = false;
        for (Map.Entry<DeviceConnection, Future<?>> entry : futures.entrySet()) {
            String name = entry.getKey().getDevice().getName();
            Future<?> future = entry.getValue();
            long remaining = Math.min(deviceTimeoutMs, deadline - System.currentTimeMillis());
            if (remaining <= 0) {
                future.cancel(true);
                timedOut = true;
                continue;
            }
            try {
                future.get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("设备采集超时，已放弃: {}", name);
            } catch (ExecutionException e) {
                log.error("设备采集任务异常: {}", name, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                log.warn("采集周期被中断");
                return;
            }
        }
        if (timedOut) {
            statistics.cycleTimedOut();
            log.warn("采集周期超过{}秒上限，剩余设备任务已放弃", collectConfig.getCycleTimeoutSeconds());
        }
        log.debug("采集周期完成: {} 台设备, 耗时 {}ms", futures.size(), System.currentTimeMillis() - startTime);
    }

    /**
     * 采集单台设备，异常不向外传播
     */
    void collectDevice(DeviceConnection connection) {
        DeviceInfo device = connection.getDevice();
        long start = System.currentTimeMillis();
        try {
            ReadResult result = connection.poll();
            long responseTime = System.currentTimeMillis() - start;
            long now = System.currentTimeMillis();
            if (result.isOnline()) {
                int success = result.getSuccessCount();
                int total = result.getValues().size();
                int written = pipeline.process(device, result, responseTime);
                registry.updateDeviceStatus(device.getId(), true, now);
                statistics.devicePolled(success > 0 || total == 0);
                collectLogStore.record(device.getId(),
                        success > 0 || total == 0 ? CollectOutcome.SUCCESS : CollectOutcome.FAILED,
                        "成功采集 " + success + "/" + total + " 个地址", responseTime);
                log.debug("设备 {} 采集完成: {}/{} 个地址, 写入 {} 点", device.getName(), success, total, written);
            } else {
                registry.updateDeviceStatus(device.getId(), false, now);
                statistics.devicePolled(false);
                String reason = connection.getLastError() != null ? connection.getLastError() : "设备离线";
                collectLogStore.record(device.getId(), CollectOutcome.FAILED, reason, responseTime);
            }
        } catch (Exception e) {
            statistics.devicePolled(false);
            collectLogStore.record(device.getId(), CollectOutcome.ERROR, "采集异常: " + e.getMessage(),
                    System.currentTimeMillis() - start);
            log.error("设备 {} 采集异常", device.getName(), e);
        }
    }

    /**
     * 重新读取注册表并重建全部连接
     */
    public int reloadDevices() {
        registry.reload();
        List<DeviceInfo> devices = registry.listActiveDevices();
        connectionManager.reload(devices, settings);
        return connectionManager.size();
    }

    /**
     * 应用新设置：间隔变化重排周期任务，连接上限变化重建连接，超时变化就地更新
     */
    public synchronized CollectorSettings reloadSettings(CollectorSettings newSettings) {
        SettingsValidator.requireValid(newSettings);
        CollectorSettings old = this.settings;
        this.settings = newSettings;

        if (old.getCollectIntervalSeconds() != newSettings.getCollectIntervalSeconds() && running) {
            scheduleCollect();
            log.info("采集间隔已更新: {}秒 -> {}秒", old.getCollectIntervalSeconds(),
                    newSettings.getCollectIntervalSeconds());
        }
        if (old.getMaxConcurrentConnections() != newSettings.getMaxConcurrentConnections()) {
            log.info("最大连接数已更新: {} -> {}，重新加载设备", old.getMaxConcurrentConnections(),
                    newSettings.getMaxConcurrentConnections());
            connectionManager.reload(registry.listActiveDevices(), newSettings);
        } else if (old.getConnectTimeoutMs() != newSettings.getConnectTimeoutMs()
                || old.getReceiveTimeoutMs() != newSettings.getReceiveTimeoutMs()) {
            connectionManager.updateTimeouts(newSettings.getConnectTimeoutMs(), newSettings.getReceiveTimeoutMs());
        }
        log.info("系统设置已重新加载: {}", newSettings);
        return newSettings;
    }

    /**
     * 删除保留期之前的数据，保留天数为0时不清理
     */
    public long cleanupExpiredData() {
        int days = settings.getDataRetentionDays();
        if (days <= 0) {
            log.info("数据保留天数为0，跳过清理");
            return 0;
        }
        long cutoff = System.currentTimeMillis() - days * 24L * 3600 * 1000;
        try {
            long deleted = store.deleteBefore(cutoff);
            log.info("清理{}天前的数据完成，删除 {} 条", days, deleted);
            return deleted;
        } catch (Exception e) {
            log.error("清理历史数据失败", e);
            return 0;
        }
    }

    public void writeAddress(Long deviceId, String address, double value) {
        DeviceConnection connection = connectionManager.get(deviceId)
                .orElseThrow(() -> CollectorException.deviceNotFound(String.valueOf(deviceId)));
        connection.write(address, value);
    }

    /**
     * 按请求参数临时建连再断开，不注册设备也不影响采集连接
     */
    public ConnectionTestResult testConnection(ConnectionTestRequest request) {
        DeviceInfo device = request.toDevice();
        CollectorSettings current = settings;
        int connectTimeoutMs = request.getTimeout() != null ? request.getTimeout() : current.getConnectTimeoutMs();
        int receiveTimeoutMs = request.getTimeout() != null ? request.getTimeout() : current.getReceiveTimeoutMs();
        String protocolName = device.getProtocolType().getDisplayName();
        log.info("测试连接: {}:{} 协议: {}", device.getHost(), device.getPort(), protocolName);

        long start = System.nanoTime();
        ProtocolHandler handler = null;
        ConnectionTestResult.ConnectionTestResultBuilder result = ConnectionTestResult.builder().protocol(protocolName);
        try {
            handler = handlerFactory.createHandler(device, connectTimeoutMs, receiveTimeoutMs);
            handler.connect();
            result.success(true).message(protocolName + "连接成功，设备响应正常");
        } catch (ConfigurationException e) {
            result.success(false).errorType("configuration").message("连接参数无效: " + e.getMessage());
        } catch (Exception e) {
            boolean network = NetworkErrorClassifier.isNetworkError(e);
            String reason = NetworkErrorClassifier.describe(e);
            result.success(false)
                    .errorType(network ? "network" : "protocol")
                    .message(network
                            ? String.format("无法连接到 %s:%d，请检查网络和设备状态: %s", device.getHost(), device.getPort(), reason)
                            : "TCP 已连通但协议握手失败: " + reason);
        } finally {
            if (handler != null) {
                handler.disconnect();
            }
        }
        ConnectionTestResult outcome = result.elapsedMs(Duration.ofNanos(System.nanoTime() - start).toMillis()).build();
        log.info("连接测试结束 {}:{}: {} ({}ms)", device.getHost(), device.getPort(),
                outcome.isSuccess() ? "成功" : outcome.getMessage(), outcome.getElapsedMs());
        return outcome;
    }

    public DeviceStatus getStatus(Long deviceId) {
        return connectionManager.getStatus(deviceId)
                .orElseThrow(() -> CollectorException.deviceNotFound(String.valueOf(deviceId)));
    }

    public List<DeviceStatus> getAllStatus() {
        return connectionManager.getAllStatus();
    }

    public ProtocolInfo getProtocolInfo() {
        return new ProtocolInfo(handlerFactory.getSupportedProtocols(),
                connectionManager.getActiveConnectionCount(),
                workerPool.getCorePoolSize());
    }

    public CollectorSettings getSettings() {
        return settings;
    }

    public CollectionStatistics getStatistics() {
        return statistics;
    }

    public boolean isRunning() {
        return running;
    }
}
