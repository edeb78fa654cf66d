package com.wangbin.plc.common.exception;

import com.wangbin.plc.common.enums.DataQuality;
import com.wangbin.plc.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 采集器异常
 */
@Getter
public class CollectorException extends BusinessException {

    private final String deviceId;
    private final String address;
    private final DataQuality dataQuality;

    public CollectorException(ResultCode resultCode, String message, String deviceId, String address) {
        super(resultCode, message);
        this.deviceId = deviceId;
        this.address = address;
        this.dataQuality = DataQuality.BAD;
    }

    public CollectorException(ResultCode resultCode, String message, String deviceId, String address, Throwable cause) {
        this(resultCode, message, deviceId, address);
        initCause(cause);
    }

    public CollectorException(String message, String deviceId, String address) {
        this(ResultCode.COLLECTOR_ERROR, message, deviceId, address);
    }

    // 创建设备未注册异常
    public static CollectorException deviceNotFound(String deviceId) {
        return new CollectorException(ResultCode.DEVICE_NOT_FOUND, "设备未注册或未启用: " + deviceId, deviceId, null);
    }
}
