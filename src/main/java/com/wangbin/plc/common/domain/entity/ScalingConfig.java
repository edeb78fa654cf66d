package com.wangbin.plc.common.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 线性缩放配置
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScalingConfig {

    private boolean enabled = false;
    private double inputMin = 0;
    private double inputMax = 100;
    private double outputMin = 0;
    private double outputMax = 10;

    public static ScalingConfig disabled() {
        return new ScalingConfig();
    }
}
