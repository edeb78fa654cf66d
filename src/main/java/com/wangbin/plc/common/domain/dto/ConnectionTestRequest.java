package com.wangbin.plc.common.domain.dto;

import com.wangbin.plc.common.domain.entity.DeviceInfo;
import com.wangbin.plc.common.enums.ProtocolType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 连接测试请求，设备不会加入注册表
 */
@Data
public class ConnectionTestRequest {

    public static final long TEST_DEVICE_ID = 0L;

    @NotBlank(message = "主机地址不能为空")
    private String host;

    @NotNull(message = "端口不能为空")
    @Min(value = 1, message = "端口必须在1-65535范围内")
    @Max(value = 65535, message = "端口必须在1-65535范围内")
    private Integer port;

    private String protocol = "modbus_tcp";

    private String plcType;

    /**
     * 超时毫秒数，为空时使用当前采集设置
     */
    @Min(value = 100, message = "超时时间不能小于100ms")
    @Max(value = 60000, message = "超时时间不能大于60000ms")
    private Integer timeout;

    private Integer stationId;

    private Integer rack;

    private Integer slot;

    public DeviceInfo toDevice() {
        DeviceInfo device = new DeviceInfo();
        device.setId(TEST_DEVICE_ID);
        device.setName("连接测试-" + host + ":" + port);
        device.setHost(host);
        device.setPort(port != null ? port : 0);
        device.setPlcType(plcType);
        device.setProtocolType(ProtocolType.detect(protocol, plcType));
        if (stationId != null) {
            device.setDefaultStationId(stationId);
        }
        if (rack != null) {
            device.setRack(rack);
        }
        if (slot != null) {
            device.setSlot(slot);
        }
        return device;
    }
}
