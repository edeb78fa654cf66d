package com.wangbin.plc.common.domain.dto;

import lombok.Data;

/**
 * 设备采集性能汇总
 */
@Data
public class PerformanceStats {

    private Long deviceId;
    private long attempts;
    private long successes;
    private long failures;
    private double successRate;
    private double avgResponseTimeMs;
    private long minResponseTimeMs;
    private long maxResponseTimeMs;
}
