package com.wangbin.plc.core.anomaly;

import com.wangbin.plc.common.domain.dto.AnomalyReport;
import com.wangbin.plc.common.domain.entity.Anomaly;
import com.wangbin.plc.common.domain.entity.CommunicationError;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.enums.AnomalyType;
import com.wangbin.plc.common.enums.Severity;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.storage.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    private static final long BASE = 1_700_000_000_000L;

    private final InMemoryTimeSeriesStore store = new InMemoryTimeSeriesStore();
    private final PlcProperties.AnomalyConfig config = new PlcProperties.AnomalyConfig();
    private final AnomalyDetector detector = new AnomalyDetector(store, config);

    private void point(long deviceId, String address, double value, long timestamp) {
        store.writePoint(DataPoint.builder()
                .deviceId(deviceId)
                .address(address)
                .rawValue(value)
                .timestamp(timestamp)
                .build());
    }

    @Test
    void gapLongerThanThresholdIsInterruption() {
        long ts = BASE;
        for (int i = 0; i < 10; i++) {
            point(1, "40001", 50, ts);
            ts += 60_000;
        }
        long beforeGap = ts - 60_000;
        point(1, "40001", 50, beforeGap + 400_000);

        AnomalyReport report = detector.detect(1L, BASE, BASE + 3_600_000);

        assertEquals(1, report.getAnomalies().size());
        Anomaly anomaly = report.getAnomalies().get(0);
        assertEquals(AnomalyType.DATA_INTERRUPTION, anomaly.getType());
        assertEquals(Severity.MEDIUM, anomaly.getSeverity());
        assertEquals(beforeGap, anomaly.getTimestamp());
        assertEquals("数据中断6.7分钟", anomaly.getDescription());
        assertEquals(1, report.getSummary().get("data_interruption"));
    }

    @Test
    void veryLongGapIsHighSeverity() {
        point(1, "40001", 50, BASE);
        point(1, "40001", 50, BASE + 3_600_000);

        List<Anomaly> anomalies = detector.detect(1L, BASE, BASE + 7_200_000).getAnomalies();

        assertEquals(1, anomalies.size());
        assertEquals(Severity.HIGH, anomalies.get(0).getSeverity());
    }

    @Test
    void outlierIsReportedAsSpike() {
        for (int i = 0; i < 20; i++) {
            point(1, "40002", 10 + (i % 2) * 0.5, BASE + i * 1000L);
        }
        point(1, "40002", 500, BASE + 20_000);

        AnomalyReport report = detector.detect(1L, BASE, BASE + 60_000);

        List<Anomaly> spikes = report.getAnomalies().stream()
                .filter(a -> a.getType() == AnomalyType.VALUE_SPIKE)
                .toList();
        assertEquals(1, spikes.size());
        assertEquals(500.0, spikes.get(0).getValue());
        assertEquals(Severity.HIGH, spikes.get(0).getSeverity());
        assertTrue(spikes.get(0).getDescription().startsWith("数值异常突变: 500.0"));
    }

    @Test
    void constantSeriesHasNoSpike() {
        for (int i = 0; i < 5; i++) {
            point(1, "40002", 42, BASE + i * 1000L);
        }
        assertTrue(detector.detect(1L, BASE, BASE + 10_000).getAnomalies().isEmpty());
    }

    @Test
    void valueOutsideGlobalRange() {
        point(1, "40003", 1500, BASE);
        point(1, "40003", -1, BASE + 1000);

        AnomalyReport report = detector.detect(1L, BASE, BASE + 10_000);

        assertEquals(2, report.getSummary().get("out_of_range"));
        assertTrue(report.getAnomalies().stream().allMatch(a -> a.getSeverity() == Severity.MEDIUM));
        assertEquals("数值超出正常范围: -1.0", report.getAnomalies().get(0).getDescription());
    }

    @Test
    void addressRangeOverrideTakesPrecedence() {
        PlcProperties.RangeConfig wide = new PlcProperties.RangeConfig();
        wide.setMin(0);
        wide.setMax(5000);
        PlcProperties.RangeConfig narrow = new PlcProperties.RangeConfig();
        narrow.setMin(0);
        narrow.setMax(100);
        config.getAddressRanges().put("40003", wide);
        config.getAddressRanges().put("2:40003", narrow);

        assertEquals(5000, detector.rangeFor(1L, "40003").getMax());
        assertEquals(100, detector.rangeFor(2L, "40003").getMax());
        assertEquals(1000, detector.rangeFor(1L, "40004").getMax());

        point(1, "40003", 1500, BASE);
        point(2, "40003", 150, BASE);
        AnomalyReport report = detector.detect(null, BASE, BASE + 1000);
        assertEquals(1, report.getAnomalies().size());
        assertEquals(2L, report.getAnomalies().get(0).getDeviceId());
    }

    @Test
    void communicationErrorsAreIncluded() {
        store.writeCommunicationError(CommunicationError.builder()
                .deviceId(1L)
                .deviceName("PLC-1")
                .message("连接失败: Connection refused")
                .timestamp(BASE + 5000)
                .build());
        store.writeCommunicationError(CommunicationError.builder()
                .deviceId(1L)
                .message("读取超时")
                .severity("low")
                .address("40001")
                .timestamp(BASE + 1000)
                .build());

        AnomalyReport report = detector.detect(1L, BASE, BASE + 10_000);

        assertEquals(2, report.getSummary().get("communication_error"));
        Anomaly newest = report.getAnomalies().get(0);
        assertEquals("communication", newest.getAddress());
        assertEquals(Severity.HIGH, newest.getSeverity());
        assertEquals(Severity.LOW, report.getAnomalies().get(1).getSeverity());
    }

    @Test
    void summaryCountsEveryType() {
        point(1, "40001", 2000, BASE);
        point(1, "40001", 50, BASE + 600_000);
        store.writeCommunicationError(1L, "PLC-1", "超时", "medium", null, null);

        AnomalyReport report = detector.detect(1L, BASE, System.currentTimeMillis() + 1000);

        assertEquals(3, report.getSummary().get("total_anomalies"));
        assertEquals(1, report.getSummary().get("data_interruption"));
        assertEquals(1, report.getSummary().get("out_of_range"));
        assertEquals(1, report.getSummary().get("communication_error"));
        assertEquals(0, report.getSummary().get("value_spike"));
    }

    @Test
    void unavailableStoreYieldsEmptyReportWithError() {
        point(1, "40001", 1500, BASE);
        store.setAvailable(false);

        AnomalyReport report = detector.detect(1L, BASE, BASE + 1000);

        assertTrue(report.getAnomalies().isEmpty());
        assertNotNull(report.getError());
        assertTrue(report.getError().startsWith("异常检测失败"));
        assertEquals(0, report.getSummary().get("total_anomalies"));
    }
}
