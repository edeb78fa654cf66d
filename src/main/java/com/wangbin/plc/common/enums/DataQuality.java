package com.wangbin.plc.common.enums;

/**
 * 数据质量
 */
public enum DataQuality {

    GOOD("good", "良好"),
    BAD("bad", "不良");

    private final String code;
    private final String description;

    DataQuality(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
