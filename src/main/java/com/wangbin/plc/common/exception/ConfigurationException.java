package com.wangbin.plc.common.exception;

import com.wangbin.plc.common.web.result.ResultCode;

/**
 * 配置错误：地址配置缺失或参数非法，在任何 I/O 之前抛出
 */
public class ConfigurationException extends CollectorException {

    public ConfigurationException(String message) {
        super(ResultCode.CONFIG_INVALID, message, null, null);
    }

    public ConfigurationException(String message, String deviceId, String address) {
        super(ResultCode.CONFIG_INVALID, message, deviceId, address);
    }
}
