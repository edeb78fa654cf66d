package com.wangbin.plc.common.enums;

import lombok.Getter;

@Getter
public enum AnomalyType {

    DATA_INTERRUPTION("data_interruption"),
    VALUE_SPIKE("value_spike"),
    OUT_OF_RANGE("out_of_range"),
    COMMUNICATION_ERROR("communication_error");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }
}
