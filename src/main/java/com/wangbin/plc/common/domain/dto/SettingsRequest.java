package com.wangbin.plc.common.domain.dto;

import lombok.Data;

/**
 * 系统设置更新请求，未提供的字段保持原值
 */
@Data
public class SettingsRequest {

    private Integer collectIntervalSeconds;
    private Integer connectTimeoutMs;
    private Integer receiveTimeoutMs;
    private Integer maxConcurrentConnections;
    private Integer dataRetentionDays;
}
