package com.wangbin.plc.core.storage;

import com.wangbin.plc.common.domain.dto.AddressStatistics;
import com.wangbin.plc.common.domain.entity.CommunicationError;
import com.wangbin.plc.common.domain.entity.DataPoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 时序存储
 * <p>
 * 写入方法失败时返回 false 或 0，不抛出异常；查询方法在存储不可用时抛出运行时异常。
 */
public interface TimeSeriesStore {

    boolean writePoint(DataPoint point);

    /**
     * 批量写入，返回成功写入的点数
     */
    int writeBatch(List<DataPoint> points);

    boolean writeCommunicationError(CommunicationError error);

    default boolean writeCommunicationError(Long deviceId, String deviceName, String message, String severity,
                                            String address, Integer stationId) {
        return writeCommunicationError(CommunicationError.builder()
                .deviceId(deviceId)
                .deviceName(deviceName)
                .message(message)
                .severity(severity != null ? severity : "high")
                .address(address)
                .stationId(stationId)
                .timestamp(System.currentTimeMillis())
                .build());
    }

    /**
     * 按时间升序返回区间内的数据点，deviceId 为空时返回全部设备
     */
    List<DataPoint> queryPoints(Long deviceId, long start, long end);

    List<CommunicationError> queryCommunicationErrors(Long deviceId, long start, long end);

    /**
     * 删除指定时间之前的数据，返回删除条数
     */
    long deleteBefore(long timestamp);

    boolean isAvailable();

    /**
     * 按地址统计区间内的点数与数值范围
     */
    default List<AddressStatistics> queryStatistics(Long deviceId, long start, long end) {
        Map<String, AddressStatistics> stats = new LinkedHashMap<>();
        Map<String, Double> sums = new LinkedHashMap<>();
        for (DataPoint point : queryPoints(deviceId, start, end)) {
            String key = deviceId != null ? point.getAddress() : point.getDeviceId() + ":" + point.getAddress();
            AddressStatistics stat = stats.computeIfAbsent(key, k -> new AddressStatistics(k, 0, null, null, null, null, null));
            stat.setCount(stat.getCount() + 1);
            Double value = point.getValue();
            if (value == null) {
                continue;
            }
            stat.setMin(stat.getMin() == null ? value : Math.min(stat.getMin(), value));
            stat.setMax(stat.getMax() == null ? value : Math.max(stat.getMax(), value));
            sums.merge(key, value, Double::sum);
            stat.setLatest(value);
            stat.setLatestTime(point.getTimestamp());
        }
        for (Map.Entry<String, AddressStatistics> entry : stats.entrySet()) {
            Double sum = sums.get(entry.getKey());
            if (sum != null && entry.getValue().getCount() > 0) {
                entry.getValue().setAvg(sum / entry.getValue().getCount());
            }
        }
        return new ArrayList<>(stats.values());
    }
}
