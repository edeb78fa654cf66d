package com.wangbin.plc.core.storage;

import com.wangbin.plc.common.domain.entity.CommunicationError;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToLongFunction;

/**
 * 基于 Redis 有序集合的时序存储
 * <p>
 * 每个设备每种测量一个 ZSET，分值为毫秒时间戳，成员为 JSON。
 */
@Slf4j
public class RedisTimeSeriesStore implements TimeSeriesStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisTimeSeriesStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean writePoint(DataPoint point) {
        try {
            String json = JsonUtil.toJsonString(point);
            if (json == null) {
                return false;
            }
            redisTemplate.opsForZSet().add(seriesKey(DataPoint.MEASUREMENT, point.getDeviceId()), json, point.getTimestamp());
            redisTemplate.opsForSet().add(deviceIndexKey(), String.valueOf(point.getDeviceId()));
            return true;
        } catch (Exception e) {
            log.error("写入数据点失败 {}: {}", point.getDeviceName(), point.getAddress(), e);
            return false;
        }
    }

    @Override
    public int writeBatch(List<DataPoint> points) {
        if (points == null || points.isEmpty()) {
            return 0;
        }
        Map<String, Set<ZSetOperations.TypedTuple<String>>> grouped = new HashMap<>();
        Set<String> deviceIds = new HashSet<>();
        for (DataPoint point : points) {
            String json = JsonUtil.toJsonString(point);
            if (json == null) {
                continue;
            }
            grouped.computeIfAbsent(seriesKey(DataPoint.MEASUREMENT, point.getDeviceId()), k -> new HashSet<>())
                    .add(new DefaultTypedTuple<>(json, (double) point.getTimestamp()));
            deviceIds.add(String.valueOf(point.getDeviceId()));
        }
        try {
            int written = 0;
            for (Map.Entry<String, Set<ZSetOperations.TypedTuple<String>>> entry : grouped.entrySet()) {
                Long added = redisTemplate.opsForZSet().add(entry.getKey(), entry.getValue());
                written += added != null ? added.intValue() : 0;
            }
            redisTemplate.opsForSet().add(deviceIndexKey(), deviceIds.toArray(new String[0]));
            return written;
        } catch (Exception e) {
            log.error("批量写入数据点失败: {} 条", points.size(), e);
            return 0;
        }
    }

    @Override
    public boolean writeCommunicationError(CommunicationError error) {
        try {
            String json = JsonUtil.toJsonString(error);
            if (json == null) {
                return false;
            }
            redisTemplate.opsForZSet().add(seriesKey(CommunicationError.MEASUREMENT, error.getDeviceId()), json,
                    error.getTimestamp());
            redisTemplate.opsForSet().add(deviceIndexKey(), String.valueOf(error.getDeviceId()));
            return true;
        } catch (Exception e) {
            log.error("存储通讯错误失败 {}: {}", error.getDeviceName(), error.getMessage(), e);
            return false;
        }
    }

    @Override
    public List<DataPoint> queryPoints(Long deviceId, long start, long end) {
        return query(DataPoint.MEASUREMENT, deviceId, start, end, DataPoint.class, DataPoint::getTimestamp);
    }

    @Override
    public List<CommunicationError> queryCommunicationErrors(Long deviceId, long start, long end) {
        return query(CommunicationError.MEASUREMENT, deviceId, start, end, CommunicationError.class,
                CommunicationError::getTimestamp);
    }

    @Override
    public long deleteBefore(long timestamp) {
        long deleted = 0;
        try {
            for (String deviceId : deviceIds()) {
                for (String measurement : List.of(DataPoint.MEASUREMENT, CommunicationError.MEASUREMENT)) {
                    Long removed = redisTemplate.opsForZSet().removeRangeByScore(
                            keyPrefix + measurement + ":" + deviceId, Double.NEGATIVE_INFINITY, timestamp - 1);
                    deleted += removed != null ? removed : 0;
                }
            }
            log.info("清理{}之前的数据 {} 条", timestamp, deleted);
        } catch (Exception e) {
            log.error("清理历史数据失败", e);
        }
        return deleted;
    }

    @Override
    public boolean isAvailable() {
        try {
            redisTemplate.hasKey(deviceIndexKey());
            return true;
        } catch (Exception e) {
            log.warn("Redis时序存储不可用: {}", e.getMessage());
            return false;
        }
    }

    private <T> List<T> query(String measurement, Long deviceId, long start, long end, Class<T> type,
                              ToLongFunction<T> timestampOf) {
        List<String> ids = deviceId != null ? List.of(String.valueOf(deviceId)) : new ArrayList<>(deviceIds());
        List<T> result = new ArrayList<>();
        for (String id : ids) {
            Set<String> members = redisTemplate.opsForZSet().rangeByScore(keyPrefix + measurement + ":" + id, start, end);
            if (members == null) {
                continue;
            }
            for (String member : members) {
                T item = JsonUtil.parseObject(member, type);
                if (item != null) {
                    result.add(item);
                }
            }
        }
        result.sort(Comparator.comparingLong(timestampOf));
        return result;
    }

    private Set<String> deviceIds() {
        Set<String> ids = redisTemplate.opsForSet().members(deviceIndexKey());
        return ids != null ? ids : Set.of();
    }

    private String seriesKey(String measurement, Long deviceId) {
        return keyPrefix + measurement + ":" + deviceId;
    }

    private String deviceIndexKey() {
        return keyPrefix + "devices";
    }
}
