package com.wangbin.plc.common.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 设备连接状态快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatus {

    private Long deviceId;
    private String deviceName;
    private String protocol;
    private boolean connected;
    private String status;
    private String lastError;
    private int retryCount;
    private Long lastConnectTime;
    private Long lastAttemptTime;
    private Long lastCollectTime;
}
