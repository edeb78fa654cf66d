package com.wangbin.plc.core.pipeline;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.ScalingConfig;

/**
 * 原始值到工程值的换算
 */
public final class ValueScaler {

    private ValueScaler() {
    }

    /**
     * 倍率不为1时按倍率换算，否则启用线性缩放时按区间映射
     */
    public static double scale(double raw, AddressConfig config) {
        if (config.getScale() != 1.0) {
            return raw * config.getScale();
        }
        ScalingConfig scaling = config.getScaling();
        if (scaling != null && scaling.isEnabled()) {
            return linear(raw, scaling);
        }
        return raw;
    }

    /**
     * 输入区间为零宽时原值返回
     */
    public static double linear(double raw, ScalingConfig scaling) {
        double inputRange = scaling.getInputMax() - scaling.getInputMin();
        if (inputRange == 0) {
            return raw;
        }
        double outputRange = scaling.getOutputMax() - scaling.getOutputMin();
        return scaling.getOutputMin() + (raw - scaling.getInputMin()) * outputRange / inputRange;
    }
}
