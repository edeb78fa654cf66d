package com.wangbin.plc.core.collector.protocol.base;

import com.wangbin.plc.common.enums.DataFormat;
import com.wangbin.plc.common.enums.DataType;
import com.wangbin.plc.common.exception.ProtocolDataException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * 寄存器字节与数值之间的转换
 */
public final class ByteTransform {

    private ByteTransform() {
    }

    /**
     * 把设备字节按字节序重排为大端 ABCD，四字节重排是自反的，编码解码共用
     */
    public static byte[] reorder4(byte[] src, int offset, DataFormat format) {
        byte a = src[offset];
        byte b = src[offset + 1];
        byte c = src[offset + 2];
        byte d = src[offset + 3];
        switch (format) {
            case ABCD:
                return new byte[]{a, b, c, d};
            case BADC:
                return new byte[]{b, a, d, c};
            case DCBA:
                return new byte[]{d, c, b, a};
            case CDAB:
            default:
                return new byte[]{c, d, a, b};
        }
    }

    /**
     * 按数据类型解码，字符串类型返回 null（使用 decodeString）
     */
    public static Double decode(byte[] raw, int offset, DataType type, DataFormat format) {
        if (raw == null || raw.length - offset < type.getMinBytes()) {
            throw new ProtocolDataException(String.format("数据不足: %s需要%d字节, 实际%d字节",
                    type.getCode(), type.getMinBytes(), raw == null ? 0 : raw.length - offset));
        }
        switch (type) {
            case BOOL:
                if (raw.length - offset >= 2) {
                    return (((raw[offset] & 0xFF) << 8) | (raw[offset + 1] & 0xFF)) != 0 ? 1.0 : 0.0;
                }
                return raw[offset] != 0 ? 1.0 : 0.0;
            case INT16:
                return (double) (short) (((raw[offset] & 0xFF) << 8) | (raw[offset + 1] & 0xFF));
            case UINT16:
                return (double) (((raw[offset] & 0xFF) << 8) | (raw[offset + 1] & 0xFF));
            case INT32:
                return (double) ByteBuffer.wrap(reorder4(raw, offset, format)).getInt();
            case UINT32:
                return (double) (ByteBuffer.wrap(reorder4(raw, offset, format)).getInt() & 0xFFFFFFFFL);
            case FLOAT:
                return (double) ByteBuffer.wrap(reorder4(raw, offset, format)).getFloat();
            default:
                return null;
        }
    }

    /**
     * 数值编码为设备字节
     */
    public static byte[] encode(double value, DataType type, DataFormat format) {
        switch (type) {
            case BOOL:
                return new byte[]{0, (byte) (value != 0 ? 1 : 0)};
            case INT16:
            case UINT16: {
                int v = (int) Math.round(value);
                return new byte[]{(byte) (v >> 8), (byte) v};
            }
            case INT32:
            case UINT32: {
                long v = Math.round(value);
                byte[] abcd = ByteBuffer.allocate(4).putInt((int) v).array();
                return reorder4(abcd, 0, format);
            }
            case FLOAT: {
                byte[] abcd = ByteBuffer.allocate(4).putFloat((float) value).array();
                return reorder4(abcd, 0, format);
            }
            default:
                throw new ProtocolDataException("不支持写入的数据类型: " + type.getCode());
        }
    }

    /**
     * ASCII 字符串解码，swapBytes 为 true 时每个字内高低字节互换
     */
    public static String decodeString(byte[] raw, int offset, int length, boolean swapBytes) {
        int len = Math.min(length, raw.length - offset);
        byte[] bytes = new byte[Math.max(len, 0)];
        System.arraycopy(raw, offset, bytes, 0, bytes.length);
        if (swapBytes) {
            for (int i = 0; i + 1 < bytes.length; i += 2) {
                byte tmp = bytes[i];
                bytes[i] = bytes[i + 1];
                bytes[i + 1] = tmp;
            }
        }
        int end = bytes.length;
        while (end > 0 && (bytes[end - 1] == 0 || bytes[end - 1] == ' ')) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.US_ASCII).trim();
    }
}
