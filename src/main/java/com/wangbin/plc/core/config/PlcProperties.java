package com.wangbin.plc.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * PLC 采集配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "plc")
public class PlcProperties {

    /**
     * 采集调度配置
     */
    private CollectConfig collect = new CollectConfig();

    /**
     * 重连退避配置
     */
    private BackoffConfig backoff = new BackoffConfig();

    /**
     * Modbus配置
     */
    private ModbusConfig modbus = new ModbusConfig();

    /**
     * 欧姆龙配置
     */
    private OmronConfig omron = new OmronConfig();

    /**
     * 异常检测配置
     */
    private AnomalyConfig anomaly = new AnomalyConfig();

    /**
     * 设备注册表配置
     */
    private RegistryConfig registry = new RegistryConfig();

    /**
     * 时序存储配置
     */
    private StorageConfig storage = new StorageConfig();

    // =============== 配置类定义 ===============

    @Data
    public static class CollectConfig {
        private int intervalSeconds = 5;
        private int connectTimeoutMs = 5000;
        private int receiveTimeoutMs = 10000;
        private int maxConcurrentConnections = 100;
        private int dataRetentionDays = 30;
        private int workerPoolSize = 10;
        private int cycleTimeoutSeconds = 300;
        private int deviceTimeoutSeconds = 60;
        private int batchThreshold = 10;
        private String cleanupCron = "0 0 2 * * ?";
        private boolean autoStart = true;
    }

    @Data
    public static class BackoffConfig {
        private long capSeconds = 300;
    }

    @Data
    public static class ModbusConfig {
        private long stationSwitchDelayMs = 20;
    }

    @Data
    public static class OmronConfig {
        private int readRetries = 2;
        private long retryDelayMs = 100;
    }

    @Data
    public static class AnomalyConfig {
        private long interruptionSeconds = 300;
        private long highInterruptionSeconds = 1800;
        private double spikeSigma = 3.0;
        private double rangeMin = 0;
        private double rangeMax = 1000;
        private int defaultWindowHours = 24;

        /**
         * 按地址覆盖的范围，键为 "设备ID:地址" 或 "地址"
         */
        private Map<String, RangeConfig> addressRanges = new HashMap<>();
    }

    @Data
    public static class RangeConfig {
        private double min;
        private double max;
    }

    @Data
    public static class RegistryConfig {
        private String devicesFile = "devices.json";
    }

    @Data
    public static class StorageConfig {
        /**
         * memory 或 redis
         */
        private String type = "memory";
        private String keyPrefix = "plc:ts:";
        private int logCapacity = 500;
        private int latestExpireMinutes = 10;
    }

    public CollectorSettings toSettings() {
        return CollectorSettings.builder()
                .collectIntervalSeconds(collect.getIntervalSeconds())
                .connectTimeoutMs(collect.getConnectTimeoutMs())
                .receiveTimeoutMs(collect.getReceiveTimeoutMs())
                .maxConcurrentConnections(collect.getMaxConcurrentConnections())
                .dataRetentionDays(collect.getDataRetentionDays())
                .build();
    }
}
