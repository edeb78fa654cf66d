package com.wangbin.plc.core.collector.scheduler;

import com.wangbin.plc.common.domain.dto.ConnectionTestRequest;
import com.wangbin.plc.common.domain.dto.ConnectionTestResult;
import com.wangbin.plc.common.domain.entity.AddressConfig;
import com.wangbin.plc.common.domain.entity.CollectLog;
import com.wangbin.plc.common.domain.entity.DataPoint;
import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.CollectOutcome;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.exception.CollectorException;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.factory.ProtocolHandlerFactory;
import com.wangbin.plc.core.collector.protocol.base.FakeProtocolHandler;
import com.wangbin.plc.core.config.CollectorSettings;
import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.connection.DeviceConnectionManager;
import com.wangbin.plc.core.pipeline.DataPipeline;
import com.wangbin.plc.core.registry.DeviceRegistry;
import com.wangbin.plc.core.storage.CollectLogStore;
import com.wangbin.plc.core.storage.InMemoryTimeSeriesStore;
import com.wangbin.plc.core.storage.LatestValueCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CollectionSchedulerTest {

    /**
     * 固定设备列表的注册表
     */
    static class StaticDeviceRegistry implements DeviceRegistry {
        final List<DeviceInfo> devices = new ArrayList<>();
        final Map<Long, Boolean> online = new HashMap<>();

        @Override
        public List<DeviceInfo> listActiveDevices() {
            return new ArrayList<>(devices);
        }

        @Override
        public Optional<DeviceInfo> findDevice(Long deviceId) {
            return devices.stream().filter(d -> d.getId().equals(deviceId)).findFirst();
        }

        @Override
        public void updateDeviceStatus(Long deviceId, boolean isOnline, long lastCollectTime) {
            online.put(deviceId, isOnline);
        }

        @Override
        public void reload() {
        }
    }

    private final StaticDeviceRegistry registry = new StaticDeviceRegistry();
    private final InMemoryTimeSeriesStore store = new InMemoryTimeSeriesStore();
    private final CollectLogStore logStore = new CollectLogStore(100);
    private final Map<Long, FakeProtocolHandler> handlers = new HashMap<>();
    private final Map<Long, int[]> createdTimeouts = new HashMap<>();
    private CollectionScheduler scheduler;

    private CollectionScheduler scheduler() {
        PlcProperties properties = new PlcProperties();
        properties.getCollect().setAutoStart(false);
        properties.getCollect().setWorkerPoolSize(4);
        ProtocolHandlerFactory factory = new ProtocolHandlerFactory(properties);
        factory.registerHandler(ProtocolType.MODBUS_TCP, (device, c, r) -> {
            createdTimeouts.put(device.getId(), new int[]{c, r});
            return handlers.get(device.getId());
        });
        DeviceConnectionManager manager = new DeviceConnectionManager(factory, store, properties);
        DataPipeline pipeline = new DataPipeline(store, new LatestValueCache(10), 10);
        scheduler = new CollectionScheduler(registry, manager, pipeline, logStore, store, factory,
                new ThreadPoolTaskScheduler(), properties);
        return scheduler;
    }

    private DeviceInfo device(long id) {
        DeviceInfo device = new DeviceInfo();
        device.setId(id);
        device.setName("PLC-" + id);
        device.setProtocolType(ProtocolType.MODBUS_TCP);
        device.setHost("127.0.0.1");
        device.setPort(502);
        device.getAddressConfigs().add(AddressConfig.of("40001", DataType.INT16));
        device.getAddressConfigs().add(AddressConfig.of("40002", DataType.INT16));
        registry.devices.add(device);
        return device;
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.destroy();
        }
    }

    @Test
    void cycleCollectsAndPersistsEveryDevice() {
        DeviceInfo first = device(1);
        DeviceInfo second = device(2);
        handlers.put(1L, new FakeProtocolHandler(first).withValue("40001", 10).withValue("40002", 20));
        handlers.put(2L, new FakeProtocolHandler(second).withValue("40001", 30));
        CollectionScheduler scheduler = scheduler();
        scheduler.reloadDevices();

        assertTrue(scheduler.runCycle());

        assertEquals(2, store.queryPoints(1L, 0, Long.MAX_VALUE).size());
        assertEquals(1, store.queryPoints(2L, 0, Long.MAX_VALUE).size());
        CollectLog log = logStore.recent(1L, 1).get(0);
        assertEquals(CollectOutcome.SUCCESS, log.getOutcome());
        assertEquals("成功采集 2/2 个地址", log.getMessage());
        assertEquals("成功采集 1/2 个地址", logStore.recent(2L, 1).get(0).getMessage());
        assertTrue(registry.online.get(1L));
        assertEquals(1, scheduler.getStatistics().getCyclesRun());
    }

    @Test
    void overlappingTriggerIsCoalesced() throws Exception {
        DeviceInfo device = device(1);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handlers.put(1L, new FakeProtocolHandler(device).withValue("40001", 1).blockReads(entered, release));
        CollectionScheduler scheduler = scheduler();
        scheduler.reloadDevices();

        Thread first = new Thread(scheduler::runCycle);
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertFalse(scheduler.runCycle());
        assertEquals(1, scheduler.getStatistics().getCyclesCoalesced());

        release.countDown();
        first.join(5000);
        assertEquals(1, scheduler.getStatistics().getCyclesRun());
        assertEquals(1, handlers.get(1L).getReads());
    }

    @Test
    void unreachableDeviceIsLoggedAsFailed() {
        DeviceInfo device = device(1);
        handlers.put(1L, new FakeProtocolHandler(device).failingConnect(true));
        CollectionScheduler scheduler = scheduler();
        scheduler.reloadDevices();

        assertTrue(scheduler.runCycle());

        assertEquals(CollectOutcome.FAILED, logStore.recent(1L, 1).get(0).getOutcome());
        assertFalse(registry.online.get(1L));
        assertEquals("backoff", scheduler.getStatus(1L).getStatus());
        assertEquals(1, scheduler.getStatus(1L).getRetryCount());
    }

    @Test
    void timeoutChangePropagatesToLiveConnections() {
        DeviceInfo device = device(1);
        handlers.put(1L, new FakeProtocolHandler(device));
        CollectionScheduler scheduler = scheduler();
        scheduler.reloadDevices();

        CollectorSettings updated = scheduler.getSettings().toBuilder()
                .connectTimeoutMs(1500)
                .receiveTimeoutMs(2500)
                .build();
        scheduler.reloadSettings(updated);

        assertEquals(1500, handlers.get(1L).getConnectTimeoutMs());
        assertEquals(2500, handlers.get(1L).getReceiveTimeoutMs());
        assertEquals(updated, scheduler.getSettings());
    }

    @Test
    void maxConnectionChangeReloadsDevices() {
        for (long id = 1; id <= 3; id++) {
            DeviceInfo device = device(id);
            handlers.put(id, new FakeProtocolHandler(device));
        }
        CollectionScheduler scheduler = scheduler();
        scheduler.reloadDevices();

        scheduler.reloadSettings(scheduler.getSettings().toBuilder().maxConcurrentConnections(2).build());

        assertEquals("disconnected", scheduler.getStatus(3L).getStatus());
        assertEquals(3, scheduler.getAllStatus().size());
    }

    @Test
    void invalidSettingsAreRejected() {
        CollectionScheduler scheduler = scheduler();
        CollectorSettings before = scheduler.getSettings();

        assertThrows(ConfigurationException.class,
                () -> scheduler.reloadSettings(before.toBuilder().collectIntervalSeconds(0).build()));
        assertEquals(before, scheduler.getSettings());
    }

    @Test
    void writeToUnknownDeviceFails() {
        CollectionScheduler scheduler = scheduler();
        assertThrows(CollectorException.class, () -> scheduler.writeAddress(99L, "40001", 1));
    }

    @Test
    void cleanupRemovesExpiredPoints() {
        DeviceInfo device = device(1);
        handlers.put(1L, new FakeProtocolHandler(device).withValue("40001", 1));
        CollectionScheduler scheduler = scheduler();
        scheduler.reloadDevices();
        scheduler.runCycle();
        store.writePoint(DataPoint.builder()
                .deviceId(1L).address("40001").rawValue(1.0).timestamp(1000L).build());

        assertEquals(1, scheduler.cleanupExpiredData());
        assertEquals(1, store.queryPoints(1L, 0, Long.MAX_VALUE).size());
    }

    private static ConnectionTestRequest connectionRequest(String host, int port) {
        ConnectionTestRequest request = new ConnectionTestRequest();
        request.setHost(host);
        request.setPort(port);
        request.setProtocol("modbus_tcp");
        return request;
    }

    @Test
    void testConnectionConnectsThenDisconnectsWithoutRegistering() {
        DeviceInfo target = new DeviceInfo();
        target.setId(ConnectionTestRequest.TEST_DEVICE_ID);
        FakeProtocolHandler fake = new FakeProtocolHandler(target);
        handlers.put(ConnectionTestRequest.TEST_DEVICE_ID, fake);
        CollectionScheduler scheduler = scheduler();

        ConnectionTestRequest request = connectionRequest("192.168.1.10", 502);
        request.setTimeout(1500);
        ConnectionTestResult result = scheduler.testConnection(request);

        assertTrue(result.isSuccess());
        assertNull(result.getErrorType());
        assertEquals("Modbus TCP", result.getProtocol());
        assertTrue(result.getElapsedMs() >= 0);
        assertEquals(1, fake.getConnectAttempts());
        assertFalse(fake.isConnected());
        assertArrayEquals(new int[]{1500, 1500}, createdTimeouts.get(ConnectionTestRequest.TEST_DEVICE_ID));
        assertTrue(scheduler.getAllStatus().isEmpty());
    }

    @Test
    void testConnectionReportsNetworkFailure() {
        DeviceInfo target = new DeviceInfo();
        target.setId(ConnectionTestRequest.TEST_DEVICE_ID);
        FakeProtocolHandler fake = new FakeProtocolHandler(target).failingConnect(true);
        handlers.put(ConnectionTestRequest.TEST_DEVICE_ID, fake);
        CollectionScheduler scheduler = scheduler();

        ConnectionTestResult result = scheduler.testConnection(connectionRequest("192.168.1.10", 502));

        assertFalse(result.isSuccess());
        assertEquals("network", result.getErrorType());
        assertTrue(result.getMessage().contains("192.168.1.10:502"));
        assertTrue(result.getMessage().contains("Connection refused"));
        CollectorSettings settings = scheduler.getSettings();
        assertArrayEquals(new int[]{settings.getConnectTimeoutMs(), settings.getReceiveTimeoutMs()},
                createdTimeouts.get(ConnectionTestRequest.TEST_DEVICE_ID));
    }

    @Test
    void testConnectionReportsInvalidPortWithoutConnecting() {
        CollectionScheduler scheduler = scheduler();
        ConnectionTestRequest request = connectionRequest("192.168.1.10", 502);
        request.setProtocol("omron_fins");
        request.setPort(0);

        ConnectionTestResult result = scheduler.testConnection(request);

        assertFalse(result.isSuccess());
        assertEquals("configuration", result.getErrorType());
        assertEquals("Omron Fins", result.getProtocol());
    }
}
