package com.wangbin.plc.core.registry;

import com.wangbin.plc.common.domain.entity.DeviceInfo;

import java.util.List;
import java.util.Optional;

/**
 * 设备注册表快照
 */
public interface DeviceRegistry {

    /**
     * 当前启用的设备，地址配置已规范化
     */
    List<DeviceInfo> listActiveDevices();

    Optional<DeviceInfo> findDevice(Long deviceId);

    /**
     * 回写设备在线状态与最后采集时间
     */
    void updateDeviceStatus(Long deviceId, boolean online, long lastCollectTime);

    /**
     * 重新读取设备来源
     */
    void reload();
}
