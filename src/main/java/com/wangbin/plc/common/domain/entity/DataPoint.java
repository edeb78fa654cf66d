package com.wangbin.plc.common.domain.entity;

import com.wangbin.plc.common.enums.DataQuality;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次成功读取产生的数据点，写入后不再修改
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataPoint {

    public static final String MEASUREMENT = "plc_data";

    private Long deviceId;
    private String deviceName;

    /**
     * 存储键（RTU over TCP 时带站号后缀）
     */
    private String address;
    private Double rawValue;
    private Double scaledValue;
    @Builder.Default
    private DataQuality quality = DataQuality.GOOD;
    private Long responseTimeMs;
    private long timestamp;

    private Integer stationId;
    private String registerType;
    private Integer functionCode;
    private String dataType;
    private String unit;
    private String byteOrder;
    private boolean wordSwap;
    private Integer scanRate;

    /**
     * 查询与分析使用的值
     */
    public Double getValue() {
        return scaledValue != null ? scaledValue : rawValue;
    }

    public Map<String, String> toTags() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("device_id", String.valueOf(deviceId));
        tags.put("device_name", deviceName);
        tags.put("address", address);
        tags.put("station_id", stationId != null ? String.valueOf(stationId) : "");
        tags.put("register_type", registerType);
        tags.put("function_code", functionCode != null ? String.valueOf(functionCode) : "");
        tags.put("data_type", dataType);
        tags.put("unit", unit);
        tags.put("byte_order", byteOrder);
        tags.put("quality", quality != null ? quality.getCode() : DataQuality.BAD.getCode());
        return tags;
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("value", getValue());
        fields.put("raw_value", rawValue);
        fields.put("scaled_value", scaledValue);
        fields.put("response_time", responseTimeMs);
        fields.put("scan_rate", scanRate);
        fields.put("word_swap", wordSwap);
        return fields;
    }
}
