package com.wangbin.plc.common.enums;

import lombok.Getter;

@Getter
public enum Severity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    public static Severity fromCode(String code) {
        if (code != null) {
            for (Severity severity : values()) {
                if (severity.code.equalsIgnoreCase(code.trim())) {
                    return severity;
                }
            }
        }
        return HIGH;
    }
}
