package com.wangbin.plc.common.domain.entity;

import com.wangbin.plc.common.enums.AnomalyType;
import com.wangbin.plc.common.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 异常事件，由历史数据实时推导，不单独存储
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    private Long deviceId;
    private String address;
    private AnomalyType type;
    private Severity severity;
    private String description;
    private long timestamp;
    private Double value;
}
