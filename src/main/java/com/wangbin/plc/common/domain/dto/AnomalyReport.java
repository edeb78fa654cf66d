package com.wangbin.plc.common.domain.dto;

import com.wangbin.plc.common.domain.entity.Anomaly;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 异常检测结果：明细按时间倒序，附带分类汇总
 */
@Data
public class AnomalyReport {

    private List<Anomaly> anomalies = new ArrayList<>();
    private Map<String, Integer> summary = new LinkedHashMap<>();
    private long startTime;
    private long endTime;

    /**
     * 查询失败时的错误信息，正常时为空
     */
    private String error;

    public int getTotal() {
        return anomalies.size();
    }
}
