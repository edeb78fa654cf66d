package com.wangbin.plc.common.enums;

import lombok.Getter;

/**
 * Modbus 寄存器类型
 */
@Getter
public enum RegisterType {

    COIL("coil", 1, true),
    DISCRETE_INPUT("discrete", 2, false),
    HOLDING_REGISTER("holding", 3, true),
    INPUT_REGISTER("input", 4, false);

    private final String code;
    private final int functionCode;
    private final boolean writable;

    RegisterType(String code, int functionCode, boolean writable) {
        this.code = code;
        this.functionCode = functionCode;
        this.writable = writable;
    }

    public boolean isBitType() {
        return this == COIL || this == DISCRETE_INPUT;
    }

    public static RegisterType fromFunctionCode(int functionCode) {
        for (RegisterType type : values()) {
            if (type.functionCode == functionCode) {
                return type;
            }
        }
        return HOLDING_REGISTER;
    }

    public static RegisterType fromCode(String code) {
        if (code == null) {
            return HOLDING_REGISTER;
        }
        String normalized = code.trim().toLowerCase();
        switch (normalized) {
            case "coil":
            case "coils":
                return COIL;
            case "discrete":
            case "discrete_input":
            case "discreteinput":
                return DISCRETE_INPUT;
            case "input":
            case "input_register":
            case "inputregister":
                return INPUT_REGISTER;
            default:
                return HOLDING_REGISTER;
        }
    }
}
