package com.wangbin.plc.common.exception;

import com.wangbin.plc.common.web.result.ResultCode;

/**
 * 协议数据错误：设备在线但拒绝了请求，或响应无法解析
 */
public class ProtocolDataException extends CollectorException {

    public ProtocolDataException(String message) {
        super(ResultCode.PROTOCOL_ERROR, message, null, null);
    }

    public ProtocolDataException(String message, String deviceId, String address) {
        super(ResultCode.PROTOCOL_ERROR, message, deviceId, address);
    }

    public ProtocolDataException(String message, String deviceId, String address, Throwable cause) {
        super(ResultCode.PROTOCOL_ERROR, message, deviceId, address, cause);
    }
}
