package com.wangbin.plc.core.collector.factory;

import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ProtocolType;
import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.core.collector.protocol.base.ProtocolHandler;
import com.wangbin.plc.core.collector.protocol.modbus.ModbusRtuOverTcpProtocolHandler;
import com.wangbin.plc.core.collector.protocol.modbus.ModbusTcpProtocolHandler;
import com.wangbin.plc.core.collector.protocol.omron.OmronFinsProtocolHandler;
import com.wangbin.plc.core.collector.protocol.siemens.SiemensS7ProtocolHandler;
import com.wangbin.plc.core.config.PlcProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 协议处理器工厂
 */
@Slf4j
@Component
public class ProtocolHandlerFactory {

    private final Map<ProtocolType, HandlerCreator> creators = new EnumMap<>(ProtocolType.class);

    @Autowired
    public ProtocolHandlerFactory(PlcProperties properties) {
        PlcProperties.ModbusConfig modbus = properties.getModbus();
        PlcProperties.OmronConfig omron = properties.getOmron();

        registerHandler(ProtocolType.MODBUS_TCP, ModbusTcpProtocolHandler::new);
        registerHandler(ProtocolType.MODBUS_RTU_OVER_TCP, (device, connectMs, receiveMs) ->
                new ModbusRtuOverTcpProtocolHandler(device, connectMs, receiveMs, modbus.getStationSwitchDelayMs()));
        registerHandler(ProtocolType.OMRON_FINS, (device, connectMs, receiveMs) ->
                new OmronFinsProtocolHandler(device, connectMs, receiveMs, omron.getReadRetries(), omron.getRetryDelayMs()));
        registerHandler(ProtocolType.SIEMENS_S7, SiemensS7ProtocolHandler::new);
    }

    /**
     * 创建协议处理器，协议未指定时按 PLC 型号关键字识别
     */
    public ProtocolHandler createHandler(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs) {
        ProtocolType type = device.getProtocolType() != null
                ? device.getProtocolType()
                : ProtocolType.detect(null, device.getPlcType());
        HandlerCreator creator = creators.get(type);
        if (creator == null) {
            throw new ConfigurationException("不支持的协议类型: " + type, device.getDeviceKey(), null);
        }
        ProtocolHandler handler = creator.create(device, connectTimeoutMs, receiveTimeoutMs);
        log.info("协议处理器创建成功: {} [{}]", device.getName(), type.getDisplayName());
        return handler;
    }

    /**
     * 注册处理器，扩展新协议时使用
     */
    public void registerHandler(ProtocolType type, HandlerCreator creator) {
        creators.put(type, creator);
        log.debug("注册协议处理器: {}", type.getDisplayName());
    }

    public List<String> getSupportedProtocols() {
        List<String> names = new ArrayList<>();
        for (ProtocolType type : creators.keySet()) {
            names.add(type.getDisplayName());
        }
        return names;
    }

    @FunctionalInterface
    public interface HandlerCreator {
        ProtocolHandler create(DeviceInfo device, int connectTimeoutMs, int receiveTimeoutMs);
    }
}
