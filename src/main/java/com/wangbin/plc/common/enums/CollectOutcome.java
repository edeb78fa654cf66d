package com.wangbin.plc.common.enums;

import lombok.Getter;

/**
 * 单次采集结果
 */
@Getter
public enum CollectOutcome {

    SUCCESS("success"),
    FAILED("failed"),
    ERROR("error");

    private final String code;

    CollectOutcome(String code) {
        this.code = code;
    }
}
