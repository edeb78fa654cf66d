package com.wangbin.plc.core.pipeline;

import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.DataQuality;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.enums.RegisterType;
import com.wangbin.plc.core.collector.protocol.base.ReadResult;
import com.wangbin.plc.core.storage.InMemoryTimeSeriesStore;
import com.wangbin.plc.core.storage.LatestValueCache;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataPipelineTest {

    /**
     * 统计单点与批量写入次数，可指定某个地址写入失败
     */
    static class CountingStore extends InMemoryTimeSeriesStore {
        int singleWrites;
        int batchWrites;
        String failingAddress;

        @Override
        public boolean writePoint(DataPoint point) {
            singleWrites++;
            if (point.getAddress().equals(failingAddress)) {
                return false;
            }
            return super.writePoint(point);
        }

        @Override
        public int writeBatch(List<DataPoint> batch) {
            batchWrites++;
            return super.writeBatch(batch);
        }
    }

    private DeviceInfo deviceWith(int addressCount, ReadResult result) {
        DeviceInfo device = new DeviceInfo();
        device.setId(1L);
        device.setName("PLC-1");
        for (int i = 0; i < addressCount; i++) {
            AddressConfig config = AddressConfig.of(String.valueOf(40001 + i), DataType.INT16);
            device.getAddressConfigs().add(config);
            result.put(config.getAddress(), config, (double) i);
        }
        result.markOnline();
        return device;
    }

    @Test
    void tenAddressesAreWrittenIndividually() {
        CountingStore store = new CountingStore();
        DataPipeline pipeline = new DataPipeline(store, new LatestValueCache(10), 10);
        ReadResult result = new ReadResult();
        DeviceInfo device = deviceWith(10, result);

        int written = pipeline.process(device, result, 15);

        assertEquals(10, written);
        assertEquals(10, store.singleWrites);
        assertEquals(0, store.batchWrites);
        assertEquals(10, store.queryPoints(1L, 0, Long.MAX_VALUE).size());
    }

    @Test
    void elevenAddressesAreWrittenAsOneBatch() {
        CountingStore store = new CountingStore();
        DataPipeline pipeline = new DataPipeline(store, new LatestValueCache(10), 10);
        ReadResult result = new ReadResult();
        DeviceInfo device = deviceWith(11, result);

        int written = pipeline.process(device, result, 15);

        assertEquals(11, written);
        assertEquals(0, store.singleWrites);
        assertEquals(1, store.batchWrites);
        assertEquals(11, store.queryPoints(1L, 0, Long.MAX_VALUE).size());
    }

    @Test
    void failedAddressDoesNotStopSiblings() {
        CountingStore store = new CountingStore();
        store.failingAddress = "40002";
        DataPipeline pipeline = new DataPipeline(store, new LatestValueCache(10), 10);
        ReadResult result = new ReadResult();
        DeviceInfo device = deviceWith(3, result);

        assertEquals(2, pipeline.process(device, result, 5));
        assertEquals(3, store.singleWrites);
    }

    @Test
    void nullValuesAreSkipped() {
        InMemoryTimeSeriesStore store = new InMemoryTimeSeriesStore();
        DataPipeline pipeline = new DataPipeline(store, new LatestValueCache(10), 10);
        DeviceInfo device = new DeviceInfo();
        device.setId(1L);
        AddressConfig good = AddressConfig.of("40001", DataType.INT16);
        AddressConfig bad = AddressConfig.of("40002", DataType.INT16);
        device.getAddressConfigs().add(good);
        device.getAddressConfigs().add(bad);
        ReadResult result = new ReadResult();
        result.put("40001", good, 3.0);
        result.put("40002", bad, null);
        result.markOnline();

        assertEquals(1, pipeline.process(device, result, 5));
    }

    @Test
    void pointCarriesScaledValueAndMetadata() {
        InMemoryTimeSeriesStore store = new InMemoryTimeSeriesStore();
        LatestValueCache cache = new LatestValueCache(10);
        DataPipeline pipeline = new DataPipeline(store, cache, 10);
        DeviceInfo device = new DeviceInfo();
        device.setId(1L);
        device.setName("PLC-1");
        AddressConfig config = AddressConfig.of("40001", DataType.UINT16);
        config.setScale(0.5);
        config.setUnit("bar");
        device.getAddressConfigs().add(config);
        ReadResult result = new ReadResult();
        result.put("40001", config, 10.0);
        result.markOnline();

        pipeline.process(device, result, 8);

        DataPoint point = store.queryPoints(1L, 0, Long.MAX_VALUE).get(0);
        assertEquals(10.0, point.getRawValue());
        assertEquals(5.0, point.getScaledValue());
        assertEquals(DataQuality.GOOD, point.getQuality());
        assertEquals("uint16", point.getDataType());
        assertEquals("holding", point.getRegisterType());
        assertEquals(1, point.getStationId());
        assertEquals("bar", point.getUnit());
        assertEquals("CDAB", point.getByteOrder());
        assertEquals(8L, point.getResponseTimeMs());
        assertEquals(5.0, cache.latest(1L).get("40001").getValue());
    }

    @Test
    void stationKeyedAddressesDoNotOverwriteEachOther() {
        InMemoryTimeSeriesStore store = new InMemoryTimeSeriesStore();
        DataPipeline pipeline = new DataPipeline(store, new LatestValueCache(10), 10);
        DeviceInfo device = new DeviceInfo();
        device.setId(9L);
        AddressConfig first = AddressConfig.of("40001", DataType.INT16);
        first.setStationId(1);
        AddressConfig second = AddressConfig.of("40001", DataType.INT16);
        second.setStationId(2);
        device.getAddressConfigs().add(first);
        device.getAddressConfigs().add(second);
        ReadResult result = new ReadResult();
        result.put(first.storageKey(true, 1), first, 100.0);
        result.put(second.storageKey(true, 1), second, 200.0);
        result.markOnline();

        pipeline.process(device, result, 5);

        List<DataPoint> points = store.queryPoints(9L, 0, Long.MAX_VALUE);
        assertEquals(2, points.size());
        DataPoint s1 = points.stream().filter(p -> p.getAddress().equals("40001_s1")).findFirst().orElseThrow();
        DataPoint s2 = points.stream().filter(p -> p.getAddress().equals("40001_s2")).findFirst().orElseThrow();
        assertEquals(100.0, s1.getValue());
        assertEquals(200.0, s2.getValue());
        assertEquals(2, s2.getStationId());
    }

    @Test
    void modbusRegisterTagsFollowTheAddress() {
        DataPipeline pipeline = new DataPipeline(new InMemoryTimeSeriesStore(), new LatestValueCache(10), 10);
        DeviceInfo device = new DeviceInfo();
        device.setId(5L);
        device.setProtocolType(ProtocolType.MODBUS_TCP);
        AddressConfig coil = AddressConfig.of("1", DataType.BOOL);
        AddressConfig input = AddressConfig.of("30001", DataType.INT16);
        AddressConfig plain = AddressConfig.of("40010", DataType.INT16);

        DataPoint coilPoint = pipeline.toPoint(device, "1", coil, 1.0, 5, 1000L);
        DataPoint inputPoint = pipeline.toPoint(device, "30001", input, 2.0, 5, 1000L);
        DataPoint plainPoint = pipeline.toPoint(device, "40010", plain, 3.0, 5, 1000L);

        assertEquals("coil", coilPoint.getRegisterType());
        assertEquals(1, coilPoint.getFunctionCode());
        assertEquals("input", inputPoint.getRegisterType());
        assertEquals(4, inputPoint.getFunctionCode());
        assertEquals("holding", plainPoint.getRegisterType());
        assertEquals(3, plainPoint.getFunctionCode());
    }

    @Test
    void nonModbusDevicesKeepConfiguredRegisterTags() {
        DataPipeline pipeline = new DataPipeline(new InMemoryTimeSeriesStore(), new LatestValueCache(10), 10);
        DeviceInfo device = new DeviceInfo();
        device.setId(6L);
        device.setProtocolType(ProtocolType.OMRON_FINS);
        AddressConfig config = AddressConfig.of("D100", DataType.INT16);

        DataPoint point = pipeline.toPoint(device, "D100", config, 1.0, 5, 1000L);

        assertEquals("holding", point.getRegisterType());
        assertEquals(3, point.getFunctionCode());
    }

    @Test
    void unparsableModbusAddressFallsBackToConfig() {
        DataPipeline pipeline = new DataPipeline(new InMemoryTimeSeriesStore(), new LatestValueCache(10), 10);
        DeviceInfo device = new DeviceInfo();
        device.setId(7L);
        device.setProtocolType(ProtocolType.MODBUS_TCP);
        AddressConfig config = AddressConfig.of("HR-1", DataType.INT16);
        config.setRegisterType(RegisterType.INPUT_REGISTER);
        config.setFunctionCode(4);

        DataPoint point = pipeline.toPoint(device, "HR-1", config, 1.0, 5, 1000L);

        assertEquals("input", point.getRegisterType());
        assertEquals(4, point.getFunctionCode());
    }
}
