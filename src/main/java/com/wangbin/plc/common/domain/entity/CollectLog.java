package com.wangbin.plc.common.domain.entity;

import com.wangbin.plc.common.enums.CollectOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 采集日志，每个设备每次轮询一条
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectLog {

    private Long deviceId;
    private CollectOutcome outcome;
    private String message;
    private long responseTimeMs;
    private long timestamp;
}
