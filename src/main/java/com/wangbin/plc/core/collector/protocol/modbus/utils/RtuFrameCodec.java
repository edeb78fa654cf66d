package com.wangbin.plc.core.collector.protocol.modbus.utils;

import com.digitalpetri.modbus.Crc16;
import com.wangbin.plc.common.exception.ProtocolDataException;
import com.wangbin.plc.core.connection.adapter.FrameLengthResolver;

import java.util.Arrays;

/**
 * Modbus RTU 帧编解码
 */
public final class RtuFrameCodec {

    /**
     * 按功能码推算响应帧长度
     */
    public static final FrameLengthResolver RESPONSE_LENGTH = buffer -> {
        int start = buffer.readerIndex();
        if (buffer.readableBytes() < 2) {
            return -1;
        }
        int functionCode = buffer.getUnsignedByte(start + 1);
        if ((functionCode & 0x80) != 0) {
            return 5;
        }
        switch (functionCode) {
            case 0x01:
            case 0x02:
            case 0x03:
            case 0x04:
                if (buffer.readableBytes() < 3) {
                    return -1;
                }
                return 3 + buffer.getUnsignedByte(start + 2) + 2;
            default:
                return 8;
        }
    };

    private RtuFrameCodec() {
    }

    public static byte[] readRequest(int unitId, int functionCode, int offset, int quantity) {
        byte[] pdu = new byte[]{
                (byte) functionCode,
                (byte) (offset >> 8), (byte) offset,
                (byte) (quantity >> 8), (byte) quantity
        };
        return frame(unitId, pdu);
    }

    public static byte[] writeSingleCoilRequest(int unitId, int offset, boolean value) {
        byte[] pdu = new byte[]{
                0x05,
                (byte) (offset >> 8), (byte) offset,
                (byte) (value ? 0xFF : 0x00), 0x00
        };
        return frame(unitId, pdu);
    }

    public static byte[] writeRegistersRequest(int unitId, int offset, byte[] data) {
        if (data.length == 2) {
            byte[] pdu = new byte[]{0x06, (byte) (offset >> 8), (byte) offset, data[0], data[1]};
            return frame(unitId, pdu);
        }
        int quantity = data.length / 2;
        byte[] pdu = new byte[6 + data.length];
        pdu[0] = 0x10;
        pdu[1] = (byte) (offset >> 8);
        pdu[2] = (byte) offset;
        pdu[3] = (byte) (quantity >> 8);
        pdu[4] = (byte) quantity;
        pdu[5] = (byte) data.length;
        System.arraycopy(data, 0, pdu, 6, data.length);
        return frame(unitId, pdu);
    }

    /**
     * 校验响应并返回数据部分（读请求为字节数后的数据，写请求为空数组）
     */
    public static byte[] parseResponse(byte[] response, int unitId, int functionCode) {
        if (response.length < 5) {
            throw new ProtocolDataException("RTU响应长度不足: " + response.length);
        }
        byte[] expectedCrc = crc(response, response.length - 2);
        if (response[response.length - 2] != expectedCrc[0] || response[response.length - 1] != expectedCrc[1]) {
            throw new ProtocolDataException("RTU响应CRC校验失败");
        }
        if ((response[0] & 0xFF) != unitId) {
            throw new ProtocolDataException(String.format("RTU响应站号不匹配: 期望%d, 实际%d",
                    unitId, response[0] & 0xFF));
        }
        int responseFunction = response[1] & 0xFF;
        if (responseFunction == (functionCode | 0x80)) {
            throw new ProtocolDataException(String.format("设备返回异常码: 0x%02X (功能码%02d)",
                    response[2] & 0xFF, functionCode));
        }
        if (responseFunction != functionCode) {
            throw new ProtocolDataException(String.format("RTU响应功能码不匹配: 期望%d, 实际%d",
                    functionCode, responseFunction));
        }
        if (functionCode >= 0x01 && functionCode <= 0x04) {
            int byteCount = response[2] & 0xFF;
            return Arrays.copyOfRange(response, 3, 3 + byteCount);
        }
        return new byte[0];
    }

    public static byte[] frame(int unitId, byte[] pdu) {
        byte[] frame = new byte[pdu.length + 3];
        frame[0] = (byte) unitId;
        System.arraycopy(pdu, 0, frame, 1, pdu.length);
        byte[] crc = crc(frame, pdu.length + 1);
        frame[frame.length - 2] = crc[0];
        frame[frame.length - 1] = crc[1];
        return frame;
    }

    /**
     * CRC16，低字节在前
     */
    public static byte[] crc(byte[] data, int length) {
        Crc16 crc16 = new Crc16();
        for (int i = 0; i < length; i++) {
            crc16.update(data[i] & 0xFF);
        }
        int crc = crc16.getValue();
        return new byte[]{(byte) (crc & 0xFF), (byte) ((crc >> 8) & 0xFF)};
    }
}
