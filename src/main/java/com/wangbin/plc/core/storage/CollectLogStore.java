package com.wangbin.plc.core.storage;

import com.wangbin.plc.common.domain.dto.PerformanceStats;
import com.wangbin.plc.common.domain.entity.CollectLog;
import com.wangbin.plc.common.enums.CollectOutcome;
import com.wangbin.plc.core.config.PlcProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 采集日志存储，每个设备保留最近若干条
 */
@Component
public class CollectLogStore {

    private final int capacity;
    private final Map<Long, Deque<CollectLog>> logs = new ConcurrentHashMap<>();

    @Autowired
    public CollectLogStore(PlcProperties properties) {
        this(properties.getStorage().getLogCapacity());
    }

    public CollectLogStore(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public void record(CollectLog entry) {
        if (entry == null || entry.getDeviceId() == null) {
            return;
        }
        Deque<CollectLog> deque = logs.computeIfAbsent(entry.getDeviceId(), k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(entry);
            while (deque.size() > capacity) {
                deque.pollFirst();
            }
        }
    }

    public void record(Long deviceId, CollectOutcome outcome, String message, long responseTimeMs) {
        record(new CollectLog(deviceId, outcome, message, responseTimeMs, System.currentTimeMillis()));
    }

    /**
     * 最近的日志，新的在前
     */
    public List<CollectLog> recent(Long deviceId, int limit) {
        Deque<CollectLog> deque = logs.get(deviceId);
        List<CollectLog> result = new ArrayList<>();
        if (deque == null || limit <= 0) {
            return result;
        }
        synchronized (deque) {
            Iterator<CollectLog> it = deque.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public PerformanceStats performance(Long deviceId) {
        PerformanceStats stats = new PerformanceStats();
        stats.setDeviceId(deviceId);
        Deque<CollectLog> deque = logs.get(deviceId);
        if (deque == null) {
            return stats;
        }
        long total = 0;
        long min = Long.MAX_VALUE;
        long max = 0;
        synchronized (deque) {
            for (CollectLog entry : deque) {
                stats.setAttempts(stats.getAttempts() + 1);
                if (entry.getOutcome() == CollectOutcome.SUCCESS) {
                    stats.setSuccesses(stats.getSuccesses() + 1);
                } else {
                    stats.setFailures(stats.getFailures() + 1);
                }
                total += entry.getResponseTimeMs();
                min = Math.min(min, entry.getResponseTimeMs());
                max = Math.max(max, entry.getResponseTimeMs());
            }
        }
        if (stats.getAttempts() > 0) {
            stats.setSuccessRate(stats.getSuccesses() * 100.0 / stats.getAttempts());
            stats.setAvgResponseTimeMs((double) total / stats.getAttempts());
            stats.setMinResponseTimeMs(min);
            stats.setMaxResponseTimeMs(max);
        }
        return stats;
    }

    public void clear(Long deviceId) {
        logs.remove(deviceId);
    }
}
