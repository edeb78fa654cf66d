package com.wangbin.plc.core.anomaly;

import com.wangbin.plc.common.domain.dto.AnomalyReport;
import com.wangbin.plc.common.domain.entity.Anomaly;
import com.wangbin.plc.common.domain.entity.CommunicationError;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.enums.AnomalyType;
import com.wangbin.plc.common.enums.Severity;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 异常检测器
 * <p>
 * 按设备与地址分组读取时间窗口内的数据点，检测数据中断、数值突变、超范围，
 * 并回放同一窗口内记录的通讯错误。
 */
@Slf4j
@Component
public class AnomalyDetector {

    private final TimeSeriesStore store;
    private final PlcProperties.AnomalyConfig config;

    @Autowired
    public AnomalyDetector(TimeSeriesStore store, PlcProperties properties) {
        this(store, properties.getAnomaly());
    }

    public AnomalyDetector(TimeSeriesStore store, PlcProperties.AnomalyConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * 最近 defaultWindowHours 小时
     */
    public AnomalyReport detectRecent(Long deviceId) {
        long end = System.currentTimeMillis();
        return detect(deviceId, end - config.getDefaultWindowHours() * 3600_000L, end);
    }

    /**
     * 检测时间窗口内的异常，存储不可用时返回带错误信息的空结果
     */
    public AnomalyReport detect(Long deviceId, long start, long end) {
        AnomalyReport report = new AnomalyReport();
        report.setStartTime(start);
        report.setEndTime(end);
        List<Anomaly> anomalies = new ArrayList<>();
        try {
            Map<String, List<DataPoint>> series = groupSeries(store.queryPoints(deviceId, start, end));
            for (List<DataPoint> points : series.values()) {
                anomalies.addAll(detectInterruptions(points));
                anomalies.addAll(detectSpikes(points));
                anomalies.addAll(detectOutOfRange(points));
            }
            anomalies.addAll(communicationAnomalies(store.queryCommunicationErrors(deviceId, start, end)));
        } catch (Exception e) {
            log.error("异常检测失败: deviceId={}", deviceId, e);
            report.setError("异常检测失败: " + e.getMessage());
            report.setSummary(summarize(new ArrayList<>()));
            return report;
        }

        anomalies.sort(Comparator.comparingLong(Anomaly::getTimestamp).reversed());
        report.setAnomalies(anomalies);
        report.setSummary(summarize(anomalies));
        return report;
    }

    private Map<String, List<DataPoint>> groupSeries(List<DataPoint> points) {
        Map<String, List<DataPoint>> series = new LinkedHashMap<>();
        for (DataPoint point : points) {
            series.computeIfAbsent(point.getDeviceId() + ":" + point.getAddress(), k -> new ArrayList<>()).add(point);
        }
        for (List<DataPoint> list : series.values()) {
            list.sort(Comparator.comparingLong(DataPoint::getTimestamp));
        }
        return series;
    }

    /**
     * 相邻两点间隔超过阈值视为数据中断，时间与数值取较早的点
     */
    List<Anomaly> detectInterruptions(List<DataPoint> points) {
        List<Anomaly> result = new ArrayList<>();
        long thresholdMs = config.getInterruptionSeconds() * 1000L;
        long highMs = config.getHighInterruptionSeconds() * 1000L;
        for (int i = 1; i < points.size(); i++) {
            DataPoint previous = points.get(i - 1);
            long gap = points.get(i).getTimestamp() - previous.getTimestamp();
            if (gap <= thresholdMs) {
                continue;
            }
            result.add(Anomaly.builder()
                    .deviceId(previous.getDeviceId())
                    .address(previous.getAddress())
                    .type(AnomalyType.DATA_INTERRUPTION)
                    .severity(gap < highMs ? Severity.MEDIUM : Severity.HIGH)
                    .description(String.format("数据中断%.1f分钟", gap / 60000.0))
                    .timestamp(previous.getTimestamp())
                    .value(previous.getValue())
                    .build());
        }
        return result;
    }

    /**
     * 偏离均值超过 spikeSigma 倍样本标准差的点
     */
    List<Anomaly> detectSpikes(List<DataPoint> points) {
        List<Anomaly> result = new ArrayList<>();
        List<DataPoint> numeric = new ArrayList<>();
        for (DataPoint point : points) {
            if (point.getValue() != null && !point.getValue().isNaN()) {
                numeric.add(point);
            }
        }
        if (numeric.size() < 3) {
            return result;
        }
        double sum = 0;
        for (DataPoint point : numeric) {
            sum += point.getValue();
        }
        double mean = sum / numeric.size();
        double squares = 0;
        for (DataPoint point : numeric) {
            double diff = point.getValue() - mean;
            squares += diff * diff;
        }
        double stdev = Math.sqrt(squares / (numeric.size() - 1));
        if (stdev <= 0) {
            return result;
        }
        for (DataPoint point : numeric) {
            double value = point.getValue();
            if (Math.abs(value - mean) > config.getSpikeSigma() * stdev) {
                result.add(Anomaly.builder()
                        .deviceId(point.getDeviceId())
                        .address(point.getAddress())
                        .type(AnomalyType.VALUE_SPIKE)
                        .severity(Severity.HIGH)
                        .description(String.format("数值异常突变: %s (均值: %.2f, 标准差: %.2f)", value, mean, stdev))
                        .timestamp(point.getTimestamp())
                        .value(value)
                        .build());
            }
        }
        return result;
    }

    List<Anomaly> detectOutOfRange(List<DataPoint> points) {
        List<Anomaly> result = new ArrayList<>();
        for (DataPoint point : points) {
            Double value = point.getValue();
            if (value == null) {
                continue;
            }
            PlcProperties.RangeConfig range = rangeFor(point.getDeviceId(), point.getAddress());
            if (value < range.getMin() || value > range.getMax()) {
                result.add(Anomaly.builder()
                        .deviceId(point.getDeviceId())
                        .address(point.getAddress())
                        .type(AnomalyType.OUT_OF_RANGE)
                        .severity(Severity.MEDIUM)
                        .description("数值超出正常范围: " + value)
                        .timestamp(point.getTimestamp())
                        .value(value)
                        .build());
            }
        }
        return result;
    }

    List<Anomaly> communicationAnomalies(List<CommunicationError> errors) {
        List<Anomaly> result = new ArrayList<>();
        for (CommunicationError error : errors) {
            result.add(Anomaly.builder()
                    .deviceId(error.getDeviceId())
                    .address(error.getAddress() != null ? error.getAddress() : "communication")
                    .type(AnomalyType.COMMUNICATION_ERROR)
                    .severity(Severity.fromCode(error.getSeverity()))
                    .description(error.getMessage())
                    .timestamp(error.getTimestamp())
                    .build());
        }
        return result;
    }

    /**
     * 地址范围：先按 "设备ID:地址" 查找，再按地址，最后使用全局范围
     */
    PlcProperties.RangeConfig rangeFor(Long deviceId, String address) {
        Map<String, PlcProperties.RangeConfig> overrides = config.getAddressRanges();
        if (overrides != null) {
            PlcProperties.RangeConfig range = overrides.get(deviceId + ":" + address);
            if (range == null) {
                range = overrides.get(address);
            }
            if (range != null) {
                return range;
            }
        }
        PlcProperties.RangeConfig global = new PlcProperties.RangeConfig();
        global.setMin(config.getRangeMin());
        global.setMax(config.getRangeMax());
        return global;
    }

    private Map<String, Integer> summarize(List<Anomaly> anomalies) {
        Map<String, Integer> summary = new LinkedHashMap<>();
        summary.put("total_anomalies", anomalies.size());
        for (AnomalyType type : AnomalyType.values()) {
            summary.put(type.getCode(), 0);
        }
        for (Anomaly anomaly : anomalies) {
            summary.merge(anomaly.getType().getCode(), 1, Integer::sum);
        }
        return summary;
    }
}
