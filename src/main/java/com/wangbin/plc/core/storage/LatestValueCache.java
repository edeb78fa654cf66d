package com.wangbin.plc.core.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.core.config.PlcProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * 最新值缓存（基于Caffeine），供实时查询
 */
@Component
public class LatestValueCache {

    private final Cache<String, DataPoint> cache;

    @Autowired
    public LatestValueCache(PlcProperties properties) {
        this(properties.getStorage().getLatestExpireMinutes());
    }

    public LatestValueCache(int expireMinutes) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterWrite(Math.max(1, expireMinutes), TimeUnit.MINUTES)
                .build();
    }

    public void put(DataPoint point) {
        cache.put(cacheKey(point.getDeviceId(), point.getAddress()), point);
    }

    /**
     * 设备所有地址的最新值，按存储键排序
     */
    public Map<String, DataPoint> latest(Long deviceId) {
        String prefix = deviceId + ":";
        Map<String, DataPoint> result = new TreeMap<>();
        cache.asMap().forEach((key, point) -> {
            if (key.startsWith(prefix)) {
                result.put(point.getAddress(), point);
            }
        });
        return result;
    }

    public void evictDevice(Long deviceId) {
        String prefix = deviceId + ":";
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }

    private String cacheKey(Long deviceId, String address) {
        return deviceId + ":" + address;
    }
}
