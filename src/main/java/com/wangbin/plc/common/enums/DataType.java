package com.wangbin.plc.common.enums;

import lombok.Getter;

/**
 * 地址数据类型
 */
@Getter
public enum DataType {
    BOOL("bool", 1),
    INT16("int16", 2),
    UINT16("uint16", 2),
    INT32("int32", 4),
    UINT32("uint32", 4),
    FLOAT("float", 4),
    STRING("string", 2);

    private final String code;

    /**
     * 最小字节长度，字符串按实际长度读取
     */
    private final int minBytes;

    DataType(String code, int minBytes) {
        this.code = code;
        this.minBytes = minBytes;
    }

    /**
     * 返回数据类型对应的寄存器数量（每个寄存器2字节）
     */
    public int getRegisterCount() {
        return (int) Math.ceil((double) minBytes / 2);
    }

    public boolean isMultiWord() {
        return minBytes == 4;
    }

    /**
     * 根据字符串获取枚举，未知类型按 int16 处理
     */
    public static DataType fromString(String type) {
        if (type == null || type.trim().isEmpty()) {
            return INT16;
        }
        String normalized = type.trim().toLowerCase();
        switch (normalized) {
            case "boolean":
            case "bit":
                return BOOL;
            case "float32":
            case "real":
            case "double":
                return FLOAT;
            case "short":
                return INT16;
            case "word":
                return UINT16;
            case "dint":
                return INT32;
            case "dword":
                return UINT32;
            default:
                for (DataType dataType : values()) {
                    if (dataType.code.equals(normalized)) {
                        return dataType;
                    }
                }
                return INT16;
        }
    }
}
