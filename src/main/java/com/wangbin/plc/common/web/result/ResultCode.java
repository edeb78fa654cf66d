package com.wangbin.plc.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    OPERATION_FAILED(1004, "操作失败"),

    // 采集相关错误
    COLLECTOR_ERROR(2000, "采集器错误"),
    CONNECTION_ERROR(2001, "连接错误"),
    PROTOCOL_ERROR(2002, "协议错误"),
    DEVICE_NOT_FOUND(2003, "设备不存在"),
    WRITE_ERROR(2004, "写入失败"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误"),
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    STORAGE_ERROR(5002, "时序存储错误"),
    NETWORK_ERROR(5004, "网络错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
