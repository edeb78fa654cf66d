package com.wangbin.plc.core.storage;

import com.wangbin.plc.common.domain.entity.CommunicationError;
import com.wangbin.plc.common.domain.entity.DataPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.ToLongFunction;

/**
 * 进程内时序存储，按设备分序列、按时间戳排序
 */
@Slf4j
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private final Map<Long, NavigableMap<Long, List<DataPoint>>> points = new ConcurrentHashMap<>();
    private final Map<Long, NavigableMap<Long, List<CommunicationError>>> errors = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    @Override
    public boolean writePoint(DataPoint point) {
        if (!available || point == null) {
            return false;
        }
        append(points, point.getDeviceId(), point.getTimestamp(), point);
        return true;
    }

    @Override
    public int writeBatch(List<DataPoint> batch) {
        if (!available || batch == null) {
            return 0;
        }
        int written = 0;
        for (DataPoint point : batch) {
            append(points, point.getDeviceId(), point.getTimestamp(), point);
            written++;
        }
        return written;
    }

    @Override
    public boolean writeCommunicationError(CommunicationError error) {
        if (!available || error == null) {
            return false;
        }
        append(errors, error.getDeviceId(), error.getTimestamp(), error);
        return true;
    }

    @Override
    public List<DataPoint> queryPoints(Long deviceId, long start, long end) {
        return query(points, deviceId, start, end, DataPoint::getTimestamp);
    }

    @Override
    public List<CommunicationError> queryCommunicationErrors(Long deviceId, long start, long end) {
        return query(errors, deviceId, start, end, CommunicationError::getTimestamp);
    }

    @Override
    public long deleteBefore(long timestamp) {
        if (!available) {
            return 0;
        }
        long deleted = purge(points, timestamp) + purge(errors, timestamp);
        log.info("清理{}之前的数据 {} 条", timestamp, deleted);
        return deleted;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    /**
     * 模拟存储故障
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    private static <T> void append(Map<Long, NavigableMap<Long, List<T>>> store, Long deviceId, long timestamp, T item) {
        long key = deviceId != null ? deviceId : -1L;
        NavigableMap<Long, List<T>> series = store.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>());
        series.compute(timestamp, (ts, existing) -> {
            List<T> list = existing != null ? new ArrayList<>(existing) : new ArrayList<>(1);
            list.add(item);
            return list;
        });
    }

    private <T> List<T> query(Map<Long, NavigableMap<Long, List<T>>> store, Long deviceId, long start, long end,
                              ToLongFunction<T> timestampOf) {
        if (!available) {
            throw new IllegalStateException("时序存储不可用");
        }
        List<T> result = new ArrayList<>();
        Collection<NavigableMap<Long, List<T>>> series;
        if (deviceId == null) {
            series = store.values();
        } else {
            NavigableMap<Long, List<T>> single = store.get(deviceId);
            series = single != null ? List.of(single) : List.of();
        }
        for (NavigableMap<Long, List<T>> map : series) {
            for (List<T> items : map.subMap(start, true, end, true).values()) {
                result.addAll(items);
            }
        }
        if (deviceId == null) {
            result.sort(Comparator.comparingLong(timestampOf));
        }
        return result;
    }

    private static <T> long purge(Map<Long, NavigableMap<Long, List<T>>> store, long timestamp) {
        long deleted = 0;
        for (NavigableMap<Long, List<T>> series : store.values()) {
            NavigableMap<Long, List<T>> expired = series.headMap(timestamp, false);
            for (List<T> items : expired.values()) {
                deleted += items.size();
            }
            expired.clear();
        }
        return deleted;
    }
}
