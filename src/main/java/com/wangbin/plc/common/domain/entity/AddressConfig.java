package com.wangbin.plc.common.domain.entity;

import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.enums.RegisterType;
import lombok.Data;

/**
 * 采集地址配置，加载时已补齐默认值
 */
@Data
public class AddressConfig {

    public static final int DEFAULT_STATION_ID = 1;
    public static final int DEFAULT_SCAN_RATE = 1000;
    public static final int DEFAULT_STRING_LENGTH = 10;

    private String id;
    private String name;
    private String address;
    private DataType type = DataType.INT16;
    private String unit = "";
    private String description = "";

    /**
     * 站号，为空时使用设备默认站号
     */
    private Integer stationId;
    private int functionCode = 3;
    private RegisterType registerType = RegisterType.HOLDING_REGISTER;

    /**
     * 字节序，为空时使用设备字节序
     */
    private DataFormat byteOrder;
    private boolean wordSwap = false;
    private int scanRate = DEFAULT_SCAN_RATE;
    private int stringLength = DEFAULT_STRING_LENGTH;

    /**
     * 简单倍率，不等于1时优先于线性缩放
     */
    private double scale = 1.0;
    private ScalingConfig scaling = ScalingConfig.disabled();

    public static AddressConfig of(String address, DataType type) {
        AddressConfig config = new AddressConfig();
        config.setId(address);
        config.setName(address);
        config.setAddress(address);
        config.setType(type);
        return config;
    }

    public int resolveStationId(int deviceDefault) {
        return stationId != null ? stationId : deviceDefault;
    }

    public DataFormat resolveByteOrder(DataFormat deviceDefault) {
        DataFormat format = byteOrder != null ? byteOrder : deviceDefault;
        if (format == null) {
            format = DataFormat.CDAB;
        }
        return wordSwap ? format.swapWords() : format;
    }

    /**
     * 存储键：多站号复用同一连接时附加站号后缀，避免不同站号的同名地址互相覆盖
     */
    public String storageKey(boolean stationKeyed, int deviceDefaultStation) {
        if (!stationKeyed) {
            return address;
        }
        return address + "_s" + resolveStationId(deviceDefaultStation);
    }
}
