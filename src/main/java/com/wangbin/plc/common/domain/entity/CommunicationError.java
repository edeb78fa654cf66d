package com.wangbin.plc.common.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 通讯错误事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommunicationError {

    public static final String MEASUREMENT = "communication_errors";

    private Long deviceId;
    private String deviceName;
    private String message;
    @Builder.Default
    private String severity = "high";
    private String address;
    private Integer stationId;
    private long timestamp;
}
