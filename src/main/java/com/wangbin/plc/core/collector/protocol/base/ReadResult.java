package com.wangbin.plc.core.collector.protocol.base;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批量读取结果
 * <p>
 * online 为 true 表示至少一个地址得到了协议层响应（包括设备拒绝），
 * 用于区分"设备可达但地址无效"与"设备不可达"。
 */
@Getter
public class ReadResult {

    private final Map<String, Double> values = new LinkedHashMap<>();
    private final Map<String, AddressConfig> configs = new LinkedHashMap<>();
    private boolean online;

    public void put(String key, AddressConfig config, Double value) {
        values.put(key, value);
        configs.put(key, config);
    }

    public void markOnline() {
        this.online = true;
    }

    public int getSuccessCount() {
        int count = 0;
        for (Double value : values.values()) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    public Map<String, Double> getValuesView() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * 设备不可达时所有地址均为空
     */
    public static ReadResult offline(List<AddressConfig> configs, boolean stationKeyed, int defaultStation) {
        ReadResult result = new ReadResult();
        for (AddressConfig config : configs) {
            result.put(config.storageKey(stationKeyed, defaultStation), config, null);
        }
        return result;
    }
}
