package com.wangbin.plc.core.config;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 运行时采集设置，只能通过 reloadSettings 整体替换
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class CollectorSettings {

    @Builder.Default
    private final int collectIntervalSeconds = 5;

    @Builder.Default
    private final int connectTimeoutMs = 5000;

    @Builder.Default
    private final int receiveTimeoutMs = 10000;

    @Builder.Default
    private final int maxConcurrentConnections = 100;

    @Builder.Default
    private final int dataRetentionDays = 30;

    public static CollectorSettings defaults() {
        return CollectorSettings.builder().build();
    }
}
