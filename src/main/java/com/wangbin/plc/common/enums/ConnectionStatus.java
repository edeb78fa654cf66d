package com.wangbin.plc.common.enums;

import lombok.Getter;

/**
 * 设备连接状态
 */
@Getter
public enum ConnectionStatus {

    DISCONNECTED("disconnected", "已断开"),
    CONNECTING("connecting", "连接中"),
    CONNECTED("connected", "已连接"),
    BACKOFF("backoff", "退避等待");

    private final String code;
    private final String description;

    ConnectionStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
