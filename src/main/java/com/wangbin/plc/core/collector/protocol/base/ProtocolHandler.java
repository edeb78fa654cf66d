package com.wangbin.plc.core.collector.protocol.base;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.enums.ProtocolType;

import java.util.List;

/**
 * PLC 协议处理器接口
 */
public interface ProtocolHandler {

    /**
     * 协议类型
     */
    ProtocolType getProtocolType();

    /**
     * 根据设备配置构建协议客户端
     */
    void createInstance();

    /**
     * 建立连接
     */
    void connect();

    /**
     * 断开连接，可重复调用
     */
    void disconnect();

    /**
     * 是否已连接
     */
    boolean isConnected();

    /**
     * 批量读取地址
     */
    ReadResult readAddresses(List<AddressConfig> configs);

    /**
     * 写入单个地址
     */
    void writeAddress(String address, double value);

    /**
     * 在线调整超时，不重新连接
     */
    void updateTimeouts(int connectTimeoutMs, int receiveTimeoutMs);

    /**
     * 存储键是否需要附加站号
     */
    default boolean isStationKeyed() {
        return false;
    }

    /**
     * 最近一次错误信息
     */
    String getLastError();
}
