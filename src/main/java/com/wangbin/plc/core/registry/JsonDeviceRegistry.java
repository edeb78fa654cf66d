package com.wangbin.plc.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.config.PlcProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 JSON 文件的设备注册表
 */
@Slf4j
@Component
public class JsonDeviceRegistry implements DeviceRegistry {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String devicesFile;
    private volatile List<DeviceInfo> devices = new ArrayList<>();
    private final Map<Long, DeviceRuntime> runtimes = new ConcurrentHashMap<>();

    @Autowired
    public JsonDeviceRegistry(PlcProperties properties) {
        this(properties.getRegistry().getDevicesFile());
    }

    public JsonDeviceRegistry(String devicesFile) {
        this.devicesFile = devicesFile;
        reload();
    }

    @Override
    public List<DeviceInfo> listActiveDevices() {
        List<DeviceInfo> active = new ArrayList<>();
        for (DeviceInfo device : devices) {
            if (device.isActive()) {
                active.add(device);
            }
        }
        return active;
    }

    @Override
    public Optional<DeviceInfo> findDevice(Long deviceId) {
        return devices.stream().filter(d -> d.getId().equals(deviceId)).findFirst();
    }

    @Override
    public void updateDeviceStatus(Long deviceId, boolean online, long lastCollectTime) {
        runtimes.put(deviceId, new DeviceRuntime(online, lastCollectTime));
    }

    public Optional<DeviceRuntime> getRuntime(Long deviceId) {
        return Optional.ofNullable(runtimes.get(deviceId));
    }

    @Override
    public synchronized void reload() {
        try (InputStream inputStream = open(devicesFile)) {
            if (inputStream == null) {
                log.warn("设备配置文件不存在: {}，注册表为空", devicesFile);
                devices = new ArrayList<>();
                return;
            }
            List<Map<String, Object>> maps = objectMapper.readValue(inputStream,
                    new TypeReference<List<Map<String, Object>>>() {});
            devices = parseDevices(maps);
            log.info("从 {} 加载 {} 台设备", devicesFile, devices.size());
        } catch (IOException e) {
            log.error("加载设备配置文件失败: {}", devicesFile, e);
            throw new ConfigurationException("加载设备配置文件失败: " + devicesFile);
        }
    }

    /**
     * 解析设备列表，单台设备配置错误时跳过该设备
     */
    public static List<DeviceInfo> parseDevices(List<Map<String, Object>> maps) {
        List<DeviceInfo> result = new ArrayList<>();
        for (Map<String, Object> map : maps) {
            try {
                result.add(toDevice(map));
            } catch (ConfigurationException e) {
                log.error("设备配置无效，已跳过: {} - {}", map.get("name"), e.getMessage());
            }
        }
        return result;
    }

    static DeviceInfo toDevice(Map<String, Object> map) {
        Object id = map.get("id");
        if (id == null) {
            throw new ConfigurationException("设备缺少ID");
        }
        DeviceInfo device = new DeviceInfo();
        try {
            device.setId(Long.valueOf(id.toString()));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("设备ID无效: " + id);
        }
        device.setName(string(map.get("name"), "PLC-" + id));
        device.setPlcType(string(map.get("plcType"), null));
        device.setProtocolType(ProtocolType.detect(string(map.get("protocol"), null), device.getPlcType()));
        device.setHost(string(map.get("host"), string(map.get("ip"), null)));
        device.setPort(number(map.get("port"), 502));
        device.setByteOrder(DataFormat.fromString(string(map.get("byteOrder"), "CDAB")));
        device.setDefaultStationId(number(map.get("defaultStationId"), number(map.get("stationId"), 1)));
        Object groupId = map.get("groupId");
        device.setGroupId(groupId != null ? number(groupId, 999) : null);
        Object active = map.get("active");
        device.setActive(active == null || Boolean.parseBoolean(active.toString()));
        device.setRack(number(map.get("rack"), 0));
        device.setSlot(number(map.get("slot"), 1));
        device.setDescription(string(map.get("description"), null));
        Object addresses = map.containsKey("addressConfigs") ? map.get("addressConfigs") : map.get("addresses");
        device.setAddressConfigs(AddressConfigNormalizer.normalize(addresses));
        return device;
    }

    private static InputStream open(String path) throws IOException {
        Resource resource = new ClassPathResource(path);
        if (resource.exists()) {
            log.info("从类路径加载设备配置: {}", path);
            return resource.getInputStream();
        }
        Path filePath = Paths.get(path);
        if (Files.exists(filePath)) {
            log.info("从文件加载设备配置: {}", filePath);
            return Files.newInputStream(filePath);
        }
        return null;
    }

    private static String string(Object value, String defaultValue) {
        return value != null ? value.toString() : defaultValue;
    }

    private static int number(Object value, int defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("数值配置无效: " + value);
        }
    }

    /**
     * 设备运行时状态
     */
    @Getter
    @AllArgsConstructor
    public static class DeviceRuntime {
        private final boolean online;
        private final long lastCollectTime;
    }
}
