package com.wangbin.plc.common.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionTestResult {

    private boolean success;
    private String message;
    private String protocol;
    private long elapsedMs;
    /**
     * 失败类型: network / protocol / configuration，成功时为空
     */
    private String errorType;
}
