package com.wangbin.plc.api.controller;

import com.wangbin.plc.common.domain.dto.ConnectionTestRequest;
import com.wangbin.plc.common.domain.dto.ConnectionTestResult;
import com.wangbin.plc.common.domain.dto.DeviceStatus;
import com.wangbin.plc.common.domain.dto.ProtocolInfo;
import com.wangbin.plc.common.domain.dto.SettingsRequest;
import com.wangbin.plc.common.domain.dto.WriteRequest;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.web.result.ApiResult;
import com.wangbin.plc.core.collector.scheduler.CollectionScheduler;
import com.wangbin.plc.core.config.CollectorSettings;
import com.wangbin.plc.core.config.SettingsValidator;
import com.wangbin.plc.core.storage.LatestValueCache;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * PLC 采集控制器
 * 提供设备状态、协议信息、设置重载与地址写入接口
 */
@Slf4j
@RestController
@RequestMapping("/api/plc")
public class PlcController {

    @Autowired
    private CollectionScheduler collectionScheduler;

    @Autowired
    private LatestValueCache latestValueCache;

    @GetMapping("/status")
    public ApiResult<List<DeviceStatus>> getAllStatus() {
        return ApiResult.success(collectionScheduler.getAllStatus());
    }

    @GetMapping("/status/{deviceId}")
    public ApiResult<DeviceStatus> getStatus(@PathVariable Long deviceId) {
        return ApiResult.success(collectionScheduler.getStatus(deviceId));
    }

    @GetMapping("/protocols")
    public ApiResult<ProtocolInfo> getProtocolInfo() {
        return ApiResult.success(collectionScheduler.getProtocolInfo());
    }

    @GetMapping("/statistics")
    public ApiResult<Map<String, Object>> getStatistics() {
        return ApiResult.success(collectionScheduler.getStatistics().getStatistics());
    }

    @PostMapping("/reload")
    public ApiResult<Integer> reloadDevices() {
        int count = collectionScheduler.reloadDevices();
        log.info("设备重新加载完成: {} 台", count);
        return ApiResult.success("设备重新加载完成", count);
    }

    /**
     * 手动触发一次采集，已有周期运行时不排队
     */
    @PostMapping("/collect")
    public ApiResult<Boolean> triggerCollect() {
        boolean started = collectionScheduler.runCycle();
        return ApiResult.success(started ? "采集周期已执行" : "采集周期正在运行，本次触发已跳过", started);
    }

    @GetMapping("/settings")
    public ApiResult<CollectorSettings> getSettings() {
        return ApiResult.success(collectionScheduler.getSettings());
    }

    @PostMapping("/settings")
    public ApiResult<CollectorSettings> updateSettings(@RequestBody SettingsRequest request) {
        CollectorSettings merged = SettingsValidator.merge(collectionScheduler.getSettings(), request);
        return ApiResult.success("系统设置已更新", collectionScheduler.reloadSettings(merged));
    }

    @PostMapping("/{deviceId}/write")
    public ApiResult<Void> writeAddress(@PathVariable Long deviceId, @Valid @RequestBody WriteRequest request) {
        collectionScheduler.writeAddress(deviceId, request.getAddress(), request.getValue());
        return ApiResult.success("写入成功", null);
    }

    /**
     * 测试设备连接，失败也返回成功响应，结果中携带失败原因
     */
    @PostMapping("/test-connection")
    public ApiResult<ConnectionTestResult> testConnection(@Valid @RequestBody ConnectionTestRequest request) {
        ConnectionTestResult result = collectionScheduler.testConnection(request);
        return ApiResult.success(result.getMessage(), result);
    }

    @GetMapping("/{deviceId}/realtime")
    public ApiResult<Map<String, DataPoint>> getRealtime(@PathVariable Long deviceId) {
        collectionScheduler.getStatus(deviceId);
        return ApiResult.success(latestValueCache.latest(deviceId));
    }
}
