package com.wangbin.plc.common.enums;

/**
 * 多字节数值的字节顺序，A 为最高字节
 */
public enum DataFormat {
    ABCD,
    BADC,
    CDAB,
    DCBA;

    public static DataFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return CDAB;
        }
        try {
            return DataFormat.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return CDAB;
        }
    }

    /**
     * 翻转字序后的格式
     */
    public DataFormat swapWords() {
        switch (this) {
            case ABCD:
                return CDAB;
            case CDAB:
                return ABCD;
            case BADC:
                return DCBA;
            default:
                return BADC;
        }
    }
}
