package com.wangbin.plc.common.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class WriteRequest {

    @NotBlank(message = "地址不能为空")
    private String address;

    @NotNull(message = "写入值不能为空")
    private Double value;
}
