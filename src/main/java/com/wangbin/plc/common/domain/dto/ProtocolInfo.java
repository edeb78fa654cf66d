package com.wangbin.plc.common.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolInfo {

    private List<String> supportedProtocols;
    private int activeConnections;
    private int workerCount;
}
