package com.wangbin.plc.common.enums;

import lombok.Getter;

import java.util.Locale;

/**
 * 支持的 PLC 通信协议
 */
@Getter
public enum ProtocolType {

    MODBUS_TCP("modbus_tcp", "Modbus TCP"),
    MODBUS_RTU_OVER_TCP("modbus_rtu_over_tcp", "Modbus RTU over TCP"),
    OMRON_FINS("omron_fins", "Omron Fins"),
    SIEMENS_S7("siemens_s7", "Siemens S7");

    private final String code;
    private final String displayName;

    ProtocolType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public boolean isModbus() {
        return this == MODBUS_TCP || this == MODBUS_RTU_OVER_TCP;
    }

    /**
     * 根据协议字段或 PLC 型号关键字识别协议，无法识别时按 Modbus TCP 处理
     */
    public static ProtocolType detect(String protocol, String plcType) {
        ProtocolType byCode = fromCode(protocol);
        if (byCode != null) {
            return byCode;
        }
        String text = ((protocol == null ? "" : protocol) + " " + (plcType == null ? "" : plcType))
                .toLowerCase(Locale.ROOT);
        if (text.contains("omron") || text.contains("欧姆龙") || text.contains("fins")) {
            return OMRON_FINS;
        }
        if (text.contains("siemens") || text.contains("西门子") || text.contains("s7")) {
            return SIEMENS_S7;
        }
        if (text.contains("rtu") && text.contains("tcp")) {
            return MODBUS_RTU_OVER_TCP;
        }
        return MODBUS_TCP;
    }

    public static ProtocolType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ProtocolType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return null;
    }
}
