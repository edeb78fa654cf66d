package com.wangbin.plc.core.collector.protocol.base;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.common.exception.ProtocolDataException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 协议处理器基类
 * <p>
 * 子类只实现建连、断开和单地址读写，失败分类、写入校验与批量读取的在线判断在这里统一处理。
 */
@Slf4j
public abstract class AbstractProtocolHandler implements ProtocolHandler {

    public static final int MAX_ADDRESS_LENGTH = 100;
    public static final double MAX_WRITE_MAGNITUDE = 1e10;

    protected final DeviceInfo device;
    protected volatile int connectTimeoutMs;
    protected volatile int receiveTimeoutMs;
    protected volatile boolean connected = false;
    protected volatile boolean instanceCreated = false;
    protected volatile String lastError;

    protected AbstractProtocolHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs) {
        this.device = device;
        this.connectTimeoutMs = connectTimeoutMs;
        this.receiveTimeoutMs = receiveTimeoutMs;
    }

    @Override
    public void createInstance() {
        if (device.getHost() == null || device.getHost().isBlank()) {
            throw new ConfigurationException("设备地址未配置", device.getDeviceKey(), null);
        }
        if (device.getPort() < 1 || device.getPort() > 65535) {
            throw new ConfigurationException("端口必须在1-65535范围内: " + device.getPort(), device.getDeviceKey(), null);
        }
        try {
            doCreateInstance();
            instanceCreated = true;
            log.info("{} 实例创建成功: {} ({}:{}, 字节序 {})", getProtocolType().getDisplayName(),
                    device.getName(), device.getHost(), device.getPort(), device.getByteOrder());
        } catch (ConfigurationException e) {
            lastError = e.getMessage();
            throw e;
        } catch (Exception e) {
            lastError = NetworkErrorClassifier.describe(e);
            throw new ConfigurationException("创建协议实例失败: " + lastError, device.getDeviceKey(), null);
        }
    }

    @Override
    public void connect() {
        if (!instanceCreated) {
            createInstance();
        }
        try {
            doConnect();
            connected = true;
            lastError = null;
            log.info("设备连接成功: {} ({}:{})", device.getName(), device.getHost(), device.getPort());
        } catch (NetworkException | ProtocolDataException e) {
            connected = false;
            lastError = e.getMessage();
            closeQuietly();
            throw e;
        } catch (Exception e) {
            connected = false;
            lastError = NetworkErrorClassifier.describe(e);
            closeQuietly();
            if (NetworkErrorClassifier.isNetworkError(e)) {
                throw new NetworkException("连接失败: " + lastError, device.getDeviceKey(), e);
            }
            throw new ProtocolDataException("连接握手失败: " + lastError, device.getDeviceKey(), null, e);
        }
    }

    @Override
    public void disconnect() {
        if (!connected && !instanceCreated) {
            return;
        }
        try {
            doDisconnect();
            log.info("设备断开连接: {}", device.getName());
        } catch (Exception e) {
            log.warn("断开设备连接异常: {}", device.getName(), e);
        } finally {
            connected = false;
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    public boolean isInstanceCreated() {
        return instanceCreated;
    }

    @Override
    public ReadResult readAddresses(List<AddressConfig> configs) {
        boolean stationKeyed = isStationKeyed();
        int defaultStation = device.getDefaultStationId();
        if (!connected) {
            return ReadResult.offline(configs, stationKeyed, defaultStation);
        }

        ReadResult result = new ReadResult();
        boolean networkLost = false;
        for (AddressConfig config : configs) {
            String key = config.storageKey(stationKeyed, defaultStation);
            if (networkLost) {
                result.put(key, config, null);
                continue;
            }
            try {
                Double value = readValue(config);
                result.put(key, config, value);
                result.markOnline();
                log.debug("读取成功 {}: {} ({}) = {}", device.getName(), key, config.getType().getCode(), value);
            } catch (ConfigurationException e) {
                result.put(key, config, null);
                log.warn("地址配置无效 {} (地址{}): {}", device.getName(), key, e.getMessage());
            } catch (ProtocolDataException e) {
                result.put(key, config, null);
                result.markOnline();
                log.warn("数据读取失败但设备在线 {} (地址{}, 类型{}): {}",
                        device.getName(), key, config.getType().getCode(), e.getMessage());
            } catch (Exception e) {
                result.put(key, config, null);
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    networkLost = true;
                    lastError = "读取被中断";
                    log.warn("读取被中断 {} (地址{})", device.getName(), key);
                } else if (NetworkErrorClassifier.isNetworkError(e)) {
                    networkLost = true;
                    lastError = NetworkErrorClassifier.describe(e);
                    log.error("网络通信失败 {} (地址{}): {}", device.getName(), key, lastError);
                } else {
                    log.error("读取地址{}时发生异常 {}: {}", key, device.getName(), e.getMessage());
                }
            }
        }
        if (networkLost) {
            connected = false;
        }
        return result;
    }

    @Override
    public void writeAddress(String address, double value) {
        validateWrite(address, value);
        if (!connected) {
            throw new NetworkException("设备未连接，无法写入: " + device.getName(), device.getDeviceKey());
        }
        try {
            doWrite(address.trim(), value);
            log.info("写入数据成功 {}: {} = {}", device.getName(), address, value);
        } catch (ConfigurationException | ProtocolDataException e) {
            lastError = e.getMessage();
            throw e;
        } catch (NetworkException e) {
            lastError = e.getMessage();
            connected = false;
            throw e;
        } catch (Exception e) {
            lastError = NetworkErrorClassifier.describe(e);
            if (NetworkErrorClassifier.isNetworkError(e)) {
                connected = false;
                throw new NetworkException("写入失败: " + lastError, device.getDeviceKey(), e);
            }
            throw new ProtocolDataException("写入失败: " + lastError, device.getDeviceKey(), address, e);
        }
    }

    /**
     * 写入前校验，不通过时不访问设备
     */
    public static void validateWrite(String address, double value) {
        if (address == null || address.trim().isEmpty()) {
            throw new ConfigurationException("写入地址不能为空");
        }
        if (address.length() > MAX_ADDRESS_LENGTH) {
            throw new ConfigurationException("写入地址长度不能超过" + MAX_ADDRESS_LENGTH + "个字符");
        }
        if (Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) > MAX_WRITE_MAGNITUDE) {
            throw new ConfigurationException("写入值超出允许范围: " + value, null, address);
        }
    }

    @Override
    public void updateTimeouts(int connectTimeoutMs, int receiveTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.receiveTimeoutMs = receiveTimeoutMs;
        onTimeoutsUpdated();
        log.debug("更新超时设置 {}: 连接{}ms, 接收{}ms", device.getName(), connectTimeoutMs, receiveTimeoutMs);
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    public DeviceInfo getDevice() {
        return device;
    }

    /**
     * 按地址查找配置，找不到时返回 int16 默认配置
     */
    protected AddressConfig findConfig(String address) {
        for (AddressConfig config : device.getAddressConfigs()) {
            if (address.equals(config.getAddress())) {
                return config;
            }
        }
        return AddressConfig.of(address, DataType.INT16);
    }

    /**
     * 字符串读数转换为数值，失败时返回 null
     */
    protected Double coerceString(String text, String address) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.warn("字符串值无法转换为数值 {}: {} = {}", device.getName(), address, text);
            return null;
        }
    }

    private void closeQuietly() {
        try {
            doDisconnect();
        } catch (Exception e) {
            log.debug("清理连接资源异常: {}", device.getName(), e);
        }
    }

    protected void onTimeoutsUpdated() {
    }

    // =============== 子类实现 ===============

    protected abstract void doCreateInstance() throws Exception;

    protected abstract void doConnect() throws Exception;

    protected abstract void doDisconnect() throws Exception;

    /**
     * 读取单个地址，设备拒绝时抛出 ProtocolDataException
     */
    protected abstract Double readValue(AddressConfig config) throws Exception;

    protected abstract void doWrite(String address, double value) throws Exception;
}
