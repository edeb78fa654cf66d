package com.wangbin.plc.core.config;

import com.wangbin.plc.common.domain.dto.SettingsRequest;
import com.wangbin.plc.common.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * 系统设置校验
 */
public final class SettingsValidator {

    private SettingsValidator() {
    }

    public static List<String> validate(CollectorSettings settings) {
        List<String> errors = new ArrayList<>();
        if (settings == null) {
            errors.add("设置不能为空");
            return errors;
        }
        int interval = settings.getCollectIntervalSeconds();
        if (interval < 1) {
            errors.add("采集间隔不能小于1秒");
        } else if (interval > 3600) {
            errors.add("采集间隔不能大于3600秒");
        }

        int connectTimeout = settings.getConnectTimeoutMs();
        if (connectTimeout < 100) {
            errors.add("连接超时不能小于100毫秒");
        } else if (connectTimeout > 30000) {
            errors.add("连接超时不能大于30000毫秒");
        }

        int receiveTimeout = settings.getReceiveTimeoutMs();
        if (receiveTimeout < 100) {
            errors.add("接收超时不能小于100毫秒");
        } else if (receiveTimeout > 60000) {
            errors.add("接收超时不能大于60000毫秒");
        }

        int maxConnections = settings.getMaxConcurrentConnections();
        if (maxConnections < 1) {
            errors.add("最大并发连接数不能小于1");
        } else if (maxConnections > 1000) {
            errors.add("最大并发连接数不能大于1000");
        }

        int retentionDays = settings.getDataRetentionDays();
        if (retentionDays < 0) {
            errors.add("数据保留天数不能为负数");
        } else if (retentionDays > 3650) {
            errors.add("数据保留天数不能大于3650天");
        }
        return errors;
    }

    /**
     * 校验失败时抛出配置异常
     */
    public static CollectorSettings requireValid(CollectorSettings settings) {
        List<String> errors = validate(settings);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("系统设置无效: " + String.join("; ", errors));
        }
        return settings;
    }

    /**
     * 把部分更新合并到当前设置
     */
    public static CollectorSettings merge(CollectorSettings current, SettingsRequest request) {
        CollectorSettings.CollectorSettingsBuilder builder = current.toBuilder();
        if (request.getCollectIntervalSeconds() != null) {
            builder.collectIntervalSeconds(request.getCollectIntervalSeconds());
        }
        if (request.getConnectTimeoutMs() != null) {
            builder.connectTimeoutMs(request.getConnectTimeoutMs());
        }
        if (request.getReceiveTimeoutMs() != null) {
            builder.receiveTimeoutMs(request.getReceiveTimeoutMs());
        }
        if (request.getMaxConcurrentConnections() != null) {
            builder.maxConcurrentConnections(request.getMaxConcurrentConnections());
        }
        if (request.getDataRetentionDays() != null) {
            builder.dataRetentionDays(request.getDataRetentionDays());
        }
        return builder.build();
    }
}
