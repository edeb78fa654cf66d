package com.wangbin.plc.common.domain.entity;

import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.ProtocolType;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 设备信息，一个采集周期内不变，重新加载注册表时整体替换
 */
@Data
public class DeviceInfo {

    private Long id;
    private String name;

    /**
     * PLC 型号，例如 modbus_tcp、mb_rtu_tcp、omron、siemens
     */
    private String plcType;
    private ProtocolType protocolType;
    private String host;
    private int port;
    private DataFormat byteOrder = DataFormat.CDAB;
    private int defaultStationId = AddressConfig.DEFAULT_STATION_ID;

    /**
     * 分组ID，为空时排在最后
     */
    private Integer groupId;
    private boolean active = true;

    /**
     * S7 机架号与槽号
     */
    private int rack = 0;
    private int slot = 1;

    private String description;
    private List<AddressConfig> addressConfigs = new ArrayList<>();

    public String getDeviceKey() {
        return String.valueOf(id);
    }

    public int getGroupOrder() {
        return groupId != null ? groupId : 999;
    }
}
