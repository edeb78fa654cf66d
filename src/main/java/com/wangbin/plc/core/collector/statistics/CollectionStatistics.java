package com.wangbin.plc.core.collector.statistics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 采集周期统计
 */
public class CollectionStatistics {

    private final AtomicLong cyclesRun = new AtomicLong();
    private final AtomicLong cyclesCoalesced = new AtomicLong();
    private final AtomicLong cyclesTimedOut = new AtomicLong();
    private final AtomicLong devicePolls = new AtomicLong();
    private final AtomicLong deviceSuccesses = new AtomicLong();
    private final AtomicLong deviceFailures = new AtomicLong();

    private double averageCycleTimeMs;
    private volatile long lastCycleTimeMs;
    private volatile long lastCycleStartTime;

    public void cycleStarted(long startTime) {
        lastCycleStartTime = startTime;
    }

    /**
     * 周期结束，平均耗时按 0.7 旧值 + 0.3 新值滑动
     */
    public synchronized void cycleCompleted(long durationMs) {
        cyclesRun.incrementAndGet();
        lastCycleTimeMs = durationMs;
        averageCycleTimeMs = averageCycleTimeMs == 0
                ? durationMs
                : averageCycleTimeMs * 0.7 + durationMs * 0.3;
    }

    public void cycleCoalesced() {
        cyclesCoalesced.incrementAndGet();
    }

    public void cycleTimedOut() {
        cyclesTimedOut.incrementAndGet();
    }

    public void devicePolled(boolean success) {
        devicePolls.incrementAndGet();
        if (success) {
            deviceSuccesses.incrementAndGet();
        } else {
            deviceFailures.incrementAndGet();
        }
    }

    public long getCyclesRun() {
        return cyclesRun.get();
    }

    public long getCyclesCoalesced() {
        return cyclesCoalesced.get();
    }

    public long getCyclesTimedOut() {
        return cyclesTimedOut.get();
    }

    public long getDevicePolls() {
        return devicePolls.get();
    }

    public synchronized double getAverageCycleTimeMs() {
        return averageCycleTimeMs;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cyclesRun", cyclesRun.get());
        stats.put("cyclesCoalesced", cyclesCoalesced.get());
        stats.put("cyclesTimedOut", cyclesTimedOut.get());
        stats.put("devicePolls", devicePolls.get());
        stats.put("deviceSuccesses", deviceSuccesses.get());
        stats.put("deviceFailures", deviceFailures.get());
        long polls = devicePolls.get();
        stats.put("successRate", polls > 0 ? deviceSuccesses.get() * 100.0 / polls : 0.0);
        stats.put("averageCycleTimeMs", getAverageCycleTimeMs());
        stats.put("lastCycleTimeMs", lastCycleTimeMs);
        stats.put("lastCycleStartTime", lastCycleStartTime);
        return stats;
    }
}
