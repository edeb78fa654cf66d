package com.wangbin.plc.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.ScalingConfig;
import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.common.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 地址配置规范化
 * <p>
 * 接受对象列表、旧版字符串列表或二者的 JSON 文本，统一转换为补齐默认值的 {@link AddressConfig}。
 */
@Slf4j
public class AddressConfigNormalizer {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private AddressConfigNormalizer() {
    }

    public static List<AddressConfig> normalize(Object raw) {
        if (raw == null) {
            return new ArrayList<>();
        }
        if (raw instanceof String) {
            return normalizeText((String) raw);
        }
        if (!(raw instanceof Collection)) {
            throw new ConfigurationException("地址配置格式不支持: " + raw.getClass().getSimpleName());
        }

        List<AddressConfig> result = new ArrayList<>();
        int index = 0;
        for (Object item : (Collection<?>) raw) {
            if (item instanceof String) {
                String address = ((String) item).trim();
                if (!address.isEmpty()) {
                    result.add(legacy(address, index));
                }
            } else if (item instanceof Map) {
                AddressConfig config = fromMap((Map<?, ?>) item, index);
                if (config != null) {
                    result.add(config);
                }
            } else if (item != null) {
                log.warn("忽略无法识别的地址配置项: {}", item);
            }
            index++;
        }
        return result;
    }

    private static List<AddressConfig> normalizeText(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<Object> items = objectMapper.readValue(trimmed, new TypeReference<List<Object>>() {});
            return normalize(items);
        } catch (Exception e) {
            throw new ConfigurationException("地址配置JSON解析失败: " + e.getMessage());
        }
    }

    /**
     * 旧版字符串地址，站号与字节序沿用设备配置
     */
    static AddressConfig legacy(String address, int index) {
        AddressConfig config = new AddressConfig();
        config.setId("legacy_" + index);
        config.setName("地址" + (index + 1));
        config.setAddress(address);
        return config;
    }

    private static AddressConfig fromMap(Map<?, ?> map, int index) {
        String address = text(map.get("address"), "").trim();
        if (address.isEmpty()) {
            log.warn("忽略缺少地址的配置项: {}", map);
            return null;
        }
        AddressConfig config = new AddressConfig();
        config.setAddress(address);
        config.setId(text(map.get("id"), "addr_" + index));
        config.setName(text(map.get("name"), address));
        config.setType(DataType.fromString(text(map.get("type"), "int16")));
        config.setUnit(text(map.get("unit"), ""));
        config.setDescription(text(map.get("description"), ""));
        // 未配置站号和字节序时留空，读取时使用设备默认值
        Object stationId = map.get("stationId");
        config.setStationId(stationId != null ? Integer.valueOf(intValue(stationId, AddressConfig.DEFAULT_STATION_ID)) : null);

        int functionCode = intValue(map.get("functionCode"), 3);
        config.setFunctionCode(functionCode);
        Object registerType = map.get("registerType");
        config.setRegisterType(registerType != null
                ? RegisterType.fromCode(registerType.toString())
                : RegisterType.fromFunctionCode(functionCode));

        Object byteOrder = map.get("byteOrder");
        config.setByteOrder(byteOrder != null ? DataFormat.fromString(byteOrder.toString()) : null);
        config.setWordSwap(boolValue(map.get("wordSwap"), false));
        config.setScanRate(intValue(map.get("scanRate"), AddressConfig.DEFAULT_SCAN_RATE));
        config.setStringLength(intValue(map.get("stringLength"), AddressConfig.DEFAULT_STRING_LENGTH));
        config.setScale(doubleValue(map.get("scale"), 1.0));
        config.setScaling(scaling(map.get("scaling")));
        return config;
    }

    private static ScalingConfig scaling(Object raw) {
        ScalingConfig scaling = ScalingConfig.disabled();
        if (!(raw instanceof Map)) {
            return scaling;
        }
        Map<?, ?> map = (Map<?, ?>) raw;
        scaling.setEnabled(boolValue(map.get("enabled"), false));
        scaling.setInputMin(doubleValue(map.get("inputMin"), 0));
        scaling.setInputMax(doubleValue(map.get("inputMax"), 100));
        scaling.setOutputMin(doubleValue(map.get("outputMin"), 0));
        scaling.setOutputMax(doubleValue(map.get("outputMax"), 10));
        return scaling;
    }

    private static String text(Object value, String defaultValue) {
        return value != null ? value.toString() : defaultValue;
    }

    private static int intValue(Object value, int defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("整数配置值无效: {}，使用默认值 {}", value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static double doubleValue(Object value, double defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("数值配置值无效: {}，使用默认值 {}", value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static boolean boolValue(Object value, boolean defaultValue) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null ? Boolean.parseBoolean(value.toString().trim()) : defaultValue;
    }
}
