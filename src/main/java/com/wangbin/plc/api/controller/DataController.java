package com.wangbin.plc.api.controller;

import com.wangbin.plc.common.domain.dto.AddressStatistics;
import com.wangbin.plc.common.domain.dto.AnomalyReport;
import com.wangbin.plc.common.domain.dto.PerformanceStats;
import com.wangbin.plc.common.domain.entity.CollectLog;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.web.result.ApiResult;
import com.wangbin.plc.common.web.result.ResultCode;
import com.wangbin.plc.core.anomaly.AnomalyDetector;
import com.wangbin.plc.core.collector.scheduler.CollectionScheduler;
import com.wangbin.plc.core.storage.CollectLogStore;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 数据查询控制器
 * 提供历史数据、统计、异常分析与采集日志查询
 */
@Slf4j
@RestController
@RequestMapping("/api/data")
public class DataController {

    private static final long DEFAULT_WINDOW_MS = 3600_000L;

    @Autowired
    private TimeSeriesStore timeSeriesStore;

    @Autowired
    private AnomalyDetector anomalyDetector;

    @Autowired
    private CollectLogStore collectLogStore;

    @Autowired
    private CollectionScheduler collectionScheduler;

    /**
     * 查询设备历史数据，默认最近一小时
     */
    @GetMapping("/{deviceId}/history")
    public ApiResult<List<DataPoint>> getHistory(@PathVariable Long deviceId,
                                                 @RequestParam(required = false) Long start,
                                                 @RequestParam(required = false) Long end) {
        long to = end != null ? end : System.currentTimeMillis();
        long from = start != null ? start : to - DEFAULT_WINDOW_MS;
        try {
            return ApiResult.success(timeSeriesStore.queryPoints(deviceId, from, to));
        } catch (Exception e) {
            log.error("查询历史数据失败: deviceId={}", deviceId, e);
            return ApiResult.error(ResultCode.STORAGE_ERROR.getCode(), "查询历史数据失败: " + e.getMessage());
        }
    }

    @GetMapping("/{deviceId}/statistics")
    public ApiResult<List<AddressStatistics>> getStatistics(@PathVariable Long deviceId,
                                                            @RequestParam(required = false) Long start,
                                                            @RequestParam(required = false) Long end) {
        long to = end != null ? end : System.currentTimeMillis();
        long from = start != null ? start : to - DEFAULT_WINDOW_MS;
        try {
            return ApiResult.success(timeSeriesStore.queryStatistics(deviceId, from, to));
        } catch (Exception e) {
            log.error("查询统计数据失败: deviceId={}", deviceId, e);
            return ApiResult.error(ResultCode.STORAGE_ERROR.getCode(), "查询统计数据失败: " + e.getMessage());
        }
    }

    /**
     * 异常分析，未指定时间时取默认窗口
     */
    @GetMapping("/anomalies")
    public ApiResult<AnomalyReport> getAnomalies(@RequestParam(required = false) Long deviceId,
                                                 @RequestParam(required = false) Long start,
                                                 @RequestParam(required = false) Long end) {
        if (start == null && end == null) {
            return ApiResult.success(anomalyDetector.detectRecent(deviceId));
        }
        long to = end != null ? end : System.currentTimeMillis();
        long from = start != null ? start : to - DEFAULT_WINDOW_MS * 24;
        return ApiResult.success(anomalyDetector.detect(deviceId, from, to));
    }

    @GetMapping("/{deviceId}/logs")
    public ApiResult<List<CollectLog>> getLogs(@PathVariable Long deviceId,
                                               @RequestParam(defaultValue = "50") int limit) {
        return ApiResult.success(collectLogStore.recent(deviceId, Math.min(limit, 500)));
    }

    @GetMapping("/{deviceId}/performance")
    public ApiResult<PerformanceStats> getPerformance(@PathVariable Long deviceId) {
        return ApiResult.success(collectLogStore.performance(deviceId));
    }

    @PostMapping("/cleanup")
    public ApiResult<Long> cleanup() {
        long deleted = collectionScheduler.cleanupExpiredData();
        return ApiResult.success("清理完成", deleted);
    }
}
