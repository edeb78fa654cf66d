package com.wangbin.plc.common.exception;

import com.wangbin.plc.common.web.result.ResultCode;

/**
 * 网络错误：超时、连接被拒绝或重置、套接字异常
 */
public class NetworkException extends CollectorException {

    public NetworkException(String message, String deviceId) {
        super(ResultCode.NETWORK_ERROR, message, deviceId, null);
    }

    public NetworkException(String message, String deviceId, Throwable cause) {
        super(ResultCode.NETWORK_ERROR, message, deviceId, null, cause);
    }
}
