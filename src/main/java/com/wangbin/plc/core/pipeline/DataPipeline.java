package com.wangbin.plc.core.pipeline;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataQuality;
import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.protocol.base.ReadResult;
import com.wangbin.plc.core.collector.protocol.modbus.domain.ModbusAddress;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.storage.LatestValueCache;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 数据处理管道：缩放、附加元数据并写入时序存储
 */
@Slf4j
@Component
public class DataPipeline {

    private final TimeSeriesStore store;
    private final LatestValueCache latestValueCache;
    private final int batchThreshold;

    @Autowired
    public DataPipeline(TimeSeriesStore store, LatestValueCache latestValueCache, PlcProperties properties) {
        this(store, latestValueCache, properties.getCollect().getBatchThreshold());
    }

    public DataPipeline(TimeSeriesStore store, LatestValueCache latestValueCache, int batchThreshold) {
        this.store = store;
        this.latestValueCache = latestValueCache;
        this.batchThreshold = batchThreshold;
    }

    /**
     * 处理一次读取结果，返回成功写入的点数
     */
    public int process(DeviceInfo device, ReadResult result, long responseTimeMs) {
        long timestamp = System.currentTimeMillis();
        List<DataPoint> points = new ArrayList<>();
        for (Map.Entry<String, Double> entry : result.getValues().entrySet()) {
            Double raw = entry.getValue();
            if (raw == null) {
                continue;
            }
            AddressConfig config = result.getConfigs().get(entry.getKey());
            try {
                points.add(toPoint(device, entry.getKey(), config, raw, responseTimeMs, timestamp));
            } catch (Exception e) {
                log.warn("数据处理失败 {} (地址{}): {}", device.getName(), entry.getKey(), e.getMessage());
            }
        }
        if (points.isEmpty()) {
            return 0;
        }

        int written = device.getAddressConfigs().size() <= batchThreshold
                ? writeIndividually(device, points)
                : writeBatch(device, points);
        for (DataPoint point : points) {
            latestValueCache.put(point);
        }
        return written;
    }

    DataPoint toPoint(DeviceInfo device, String key, AddressConfig config, double raw, long responseTimeMs,
                      long timestamp) {
        double scaled = ValueScaler.scale(raw, config);
        RegisterType registerType = registerType(device, config);
        return DataPoint.builder()
                .deviceId(device.getId())
                .deviceName(device.getName())
                .address(key)
                .rawValue(raw)
                .scaledValue(scaled)
                .quality(DataQuality.GOOD)
                .responseTimeMs(responseTimeMs)
                .timestamp(timestamp)
                .stationId(config.resolveStationId(device.getDefaultStationId()))
                .registerType(registerType.getCode())
                .functionCode(registerType == config.getRegisterType()
                        ? config.getFunctionCode()
                        : registerType.getFunctionCode())
                .dataType(config.getType().getCode())
                .unit(config.getUnit())
                .byteOrder(config.resolveByteOrder(device.getByteOrder()).name())
                .wordSwap(config.isWordSwap())
                .scanRate(config.getScanRate())
                .build();
    }

    /**
     * Modbus 设备按地址本身判断寄存器类型，地址无法解析时沿用配置
     */
    private static RegisterType registerType(DeviceInfo device, AddressConfig config) {
        if (device.getProtocolType() != null && device.getProtocolType().isModbus()) {
            try {
                return ModbusAddress.parse(config.getAddress()).getRegisterType();
            } catch (ConfigurationException e) {
                log.debug("地址无法按 Modbus 解析，使用配置的寄存器类型 {}: {}", config.getAddress(), e.getMessage());
            }
        }
        return config.getRegisterType();
    }

    private int writeIndividually(DeviceInfo device, List<DataPoint> points) {
        int written = 0;
        for (DataPoint point : points) {
            try {
                if (store.writePoint(point)) {
                    written++;
                } else {
                    log.warn("写入数据点失败 {}: {}", device.getName(), point.getAddress());
                }
            } catch (Exception e) {
                log.error("写入数据点异常 {}: {}", device.getName(), point.getAddress(), e);
            }
        }
        log.debug("逐点写入 {}: {}/{}", device.getName(), written, points.size());
        return written;
    }

    private int writeBatch(DeviceInfo device, List<DataPoint> points) {
        try {
            int written = store.writeBatch(points);
            log.debug("批量写入 {}: {}/{}", device.getName(), written, points.size());
            return written;
        } catch (Exception e) {
            log.error("批量写入异常 {}: {} 条", device.getName(), points.size(), e);
            return 0;
        }
    }
}
