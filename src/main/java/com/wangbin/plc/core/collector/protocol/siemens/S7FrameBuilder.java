package com.wangbin.plc.core.collector.protocol.siemens;

import com.wangbin.plc.common.exception.ProtocolDataException;
import com.wangbin.plc.core.connection.adapter.FrameLengthResolver;

import java.util.Arrays;

/**
 * ISO-on-TCP (TPKT/COTP) 上的 S7 通信帧
 */
public final class S7FrameBuilder {

    private static final int HEADER_OFFSET = 7;
    private static final int FUNCTION_READ_VAR = 0x04;
    private static final int FUNCTION_WRITE_VAR = 0x05;
    private static final int TRANSPORT_BIT = 0x01;
    private static final int TRANSPORT_BYTE = 0x02;
    private static final int RETURN_SUCCESS = 0xFF;

    /**
     * TPKT 第 2-3 字节为整帧长度
     */
    public static final FrameLengthResolver RESPONSE_LENGTH = buffer -> {
        if (buffer.readableBytes() < 4) {
            return -1;
        }
        return buffer.getUnsignedShort(buffer.readerIndex() + 2);
    };

    private S7FrameBuilder() {
    }

    public static byte[] connectionRequest(int rack, int slot) {
        return new byte[]{
                0x03, 0x00, 0x00, 0x16,
                0x11, (byte) 0xE0, 0x00, 0x00, 0x00, 0x01, 0x00,
                (byte) 0xC0, 0x01, 0x0A,
                (byte) 0xC1, 0x02, 0x01, 0x00,
                (byte) 0xC2, 0x02, 0x01, (byte) (rack * 0x20 + slot)
        };
    }

    public static void checkConnectionConfirm(byte[] response) {
        if (response.length < 7 || (response[5] & 0xFF) != 0xD0) {
            throw new ProtocolDataException("COTP连接被拒绝");
        }
    }

    public static byte[] setupCommunication(int pduRef) {
        return new byte[]{
                0x03, 0x00, 0x00, 0x19,
                0x02, (byte) 0xF0, (byte) 0x80,
                0x32, 0x01, 0x00, 0x00, (byte) (pduRef >> 8), (byte) pduRef, 0x00, 0x08, 0x00, 0x00,
                (byte) 0xF0, 0x00, 0x00, 0x01, 0x00, 0x01, 0x01, (byte) 0xE0
        };
    }

    /**
     * 校验通信建立响应，返回协商的 PDU 长度
     */
    public static int parseSetupCommunication(byte[] response) {
        checkAckHeader(response);
        if (response.length < 27) {
            return 240;
        }
        return ((response[25] & 0xFF) << 8) | (response[26] & 0xFF);
    }

    public static byte[] readRequest(int pduRef, S7Address address, int byteCount) {
        byte[] frame = new byte[31];
        header(frame, pduRef, 14, 0);
        frame[17] = FUNCTION_READ_VAR;
        frame[18] = 0x01;
        item(frame, 19, address, address.isBitAddress() ? 1 : byteCount);
        return frame;
    }

    public static byte[] writeRequest(int pduRef, S7Address address, byte[] data) {
        int dataLength = 4 + data.length;
        byte[] frame = new byte[31 + dataLength];
        header(frame, pduRef, 14, dataLength);
        frame[17] = FUNCTION_WRITE_VAR;
        frame[18] = 0x01;
        item(frame, 19, address, address.isBitAddress() ? 1 : data.length);
        int lengthBits = address.isBitAddress() ? 1 : data.length * 8;
        frame[31] = 0x00;
        frame[32] = (byte) (address.isBitAddress() ? 0x03 : 0x04);
        frame[33] = (byte) (lengthBits >> 8);
        frame[34] = (byte) lengthBits;
        System.arraycopy(data, 0, frame, 35, data.length);
        return frame;
    }

    /**
     * 解析读响应，返回数据字节
     */
    public static byte[] parseReadResponse(byte[] response) {
        checkAckHeader(response);
        checkItemReturnCode(response, FUNCTION_READ_VAR);
        if (response.length < 25) {
            throw new ProtocolDataException("S7读响应长度不足: " + response.length);
        }
        int transportSize = response[22] & 0xFF;
        int length = ((response[23] & 0xFF) << 8) | (response[24] & 0xFF);
        if (transportSize == 0x03 || transportSize == 0x04 || transportSize == 0x05) {
            length = (length + 7) / 8;
        }
        int end = Math.min(response.length, 25 + length);
        return Arrays.copyOfRange(response, 25, end);
    }

    public static void parseWriteResponse(byte[] response) {
        checkAckHeader(response);
        checkItemReturnCode(response, FUNCTION_WRITE_VAR);
    }

    private static void header(byte[] frame, int pduRef, int paramLength, int dataLength) {
        frame[0] = 0x03;
        frame[1] = 0x00;
        frame[2] = (byte) (frame.length >> 8);
        frame[3] = (byte) frame.length;
        frame[4] = 0x02;
        frame[5] = (byte) 0xF0;
        frame[6] = (byte) 0x80;
        frame[7] = 0x32;
        frame[8] = 0x01;
        frame[11] = (byte) (pduRef >> 8);
        frame[12] = (byte) pduRef;
        frame[13] = (byte) (paramLength >> 8);
        frame[14] = (byte) paramLength;
        frame[15] = (byte) (dataLength >> 8);
        frame[16] = (byte) dataLength;
    }

    private static void item(byte[] frame, int offset, S7Address address, int count) {
        int bitAddress = address.bitAddress();
        frame[offset] = 0x12;
        frame[offset + 1] = 0x0A;
        frame[offset + 2] = 0x10;
        frame[offset + 3] = (byte) (address.isBitAddress() ? TRANSPORT_BIT : TRANSPORT_BYTE);
        frame[offset + 4] = (byte) (count >> 8);
        frame[offset + 5] = (byte) count;
        frame[offset + 6] = (byte) (address.getDbNumber() >> 8);
        frame[offset + 7] = (byte) address.getDbNumber();
        frame[offset + 8] = (byte) address.getAreaCode();
        frame[offset + 9] = (byte) (bitAddress >> 16);
        frame[offset + 10] = (byte) (bitAddress >> 8);
        frame[offset + 11] = (byte) bitAddress;
    }

    private static void checkAckHeader(byte[] response) {
        if (response.length < HEADER_OFFSET + 12 || (response[HEADER_OFFSET] & 0xFF) != 0x32) {
            throw new ProtocolDataException("S7响应头无效");
        }
        if ((response[HEADER_OFFSET + 1] & 0xFF) != 0x03) {
            throw new ProtocolDataException(String.format("S7响应类型错误: 0x%02X", response[HEADER_OFFSET + 1] & 0xFF));
        }
        int errorClass = response[HEADER_OFFSET + 10] & 0xFF;
        int errorCode = response[HEADER_OFFSET + 11] & 0xFF;
        if (errorClass != 0 || errorCode != 0) {
            throw new ProtocolDataException(String.format("S7错误: class=0x%02X, code=0x%02X", errorClass, errorCode));
        }
    }

    private static void checkItemReturnCode(byte[] response, int function) {
        if (response.length < 22 || (response[19] & 0xFF) != function) {
            throw new ProtocolDataException("S7响应功能码不匹配");
        }
        int returnCode = response[21] & 0xFF;
        if (returnCode != RETURN_SUCCESS) {
            throw new ProtocolDataException(String.format("S7返回码异常: 0x%02X", returnCode));
        }
    }
}
