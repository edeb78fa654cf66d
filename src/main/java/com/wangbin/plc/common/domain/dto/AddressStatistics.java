package com.wangbin.plc.common.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单地址统计
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddressStatistics {

    private String address;
    private long count;
    private Double min;
    private Double max;
    private Double avg;
    private Double latest;
    private Long latestTime;
}
