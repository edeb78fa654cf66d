package com.wangbin.plc.core.collector.protocol.omron;

import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.common.exception.ProtocolDataException;
import com.wangbin.plc.core.connection.adapter.FrameLengthResolver;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * FINS/TCP 帧构建与解析
 */
public final class FinsFrameBuilder {

    public static final int TCP_HEADER_LENGTH = 16;
    public static final int RESPONSE_DATA_OFFSET = TCP_HEADER_LENGTH + 14;

    public static final int MRC_MEMORY = 0x01;
    public static final int SRC_READ = 0x01;
    public static final int SRC_WRITE = 0x02;

    private static final byte[] MAGIC = {'F', 'I', 'N', 'S'};

    /**
     * 长度字段位于第 4-7 字节，表示其后的字节数
     */
    public static final FrameLengthResolver RESPONSE_LENGTH = buffer -> {
        if (buffer.readableBytes() < 8) {
            return -1;
        }
        return 8 + (int) buffer.getUnsignedInt(buffer.readerIndex() + 4);
    };

    private FinsFrameBuilder() {
    }

    /**
     * 节点地址握手请求，客户端节点为 0 表示由 PLC 自动分配
     */
    public static byte[] handshake() {
        ByteBuffer buffer = ByteBuffer.allocate(20);
        buffer.put(MAGIC).putInt(12).putInt(0).putInt(0).putInt(0);
        return buffer.array();
    }

    /**
     * 解析握手响应，返回 [客户端节点, 服务端节点]
     */
    public static int[] parseHandshake(byte[] response) {
        checkTcpHeader(response);
        if (response.length < 24) {
            throw new ProtocolDataException("FINS握手响应长度不足: " + response.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(response);
        int clientNode = buffer.getInt(16) & 0xFF;
        int serverNode = buffer.getInt(20) & 0xFF;
        return new int[]{clientNode, serverNode};
    }

    public static byte[] readRequest(int clientNode, int serverNode, int sid, FinsAddress address, int count) {
        byte[] body = new byte[8];
        fillMemoryAddress(body, address, count);
        return command(clientNode, serverNode, sid, SRC_READ, body);
    }

    public static byte[] writeRequest(int clientNode, int serverNode, int sid, FinsAddress address, byte[] data) {
        int count = address.isBitAddress() ? data.length : data.length / 2;
        byte[] body = new byte[8 + data.length];
        fillMemoryAddress(body, address, count);
        System.arraycopy(data, 0, body, 8, data.length);
        return command(clientNode, serverNode, sid, SRC_WRITE, body);
    }

    /**
     * 校验响应并返回数据部分
     */
    public static byte[] parseResponse(byte[] response, int expectedSrc) {
        checkTcpHeader(response);
        if (response.length < RESPONSE_DATA_OFFSET) {
            throw new ProtocolDataException("FINS响应长度不足: " + response.length);
        }
        int mrc = response[TCP_HEADER_LENGTH + 10] & 0xFF;
        int src = response[TCP_HEADER_LENGTH + 11] & 0xFF;
        if (mrc != MRC_MEMORY || src != expectedSrc) {
            throw new ProtocolDataException(String.format("FINS响应命令不匹配: %02X%02X", mrc, src));
        }
        int endCode = ((response[TCP_HEADER_LENGTH + 12] & 0xFF) << 8) | (response[TCP_HEADER_LENGTH + 13] & 0xFF);
        // 中继错误与 CPU 状态标志位不影响数据
        if ((endCode & 0x7F3F) != 0) {
            throw new ProtocolDataException(String.format("FINS结束码异常: 0x%04X", endCode));
        }
        return Arrays.copyOfRange(response, RESPONSE_DATA_OFFSET, response.length);
    }

    private static void fillMemoryAddress(byte[] body, FinsAddress address, int count) {
        body[0] = (byte) MRC_MEMORY;
        body[2] = (byte) address.areaCode();
        body[3] = (byte) (address.getWordAddress() >> 8);
        body[4] = (byte) address.getWordAddress();
        body[5] = (byte) (address.isBitAddress() ? address.getBit() : 0);
        body[6] = (byte) (count >> 8);
        body[7] = (byte) count;
    }

    private static byte[] command(int clientNode, int serverNode, int sid, int src, byte[] body) {
        body[1] = (byte) src;
        int finsLength = 10 + body.length;
        ByteBuffer buffer = ByteBuffer.allocate(TCP_HEADER_LENGTH + finsLength);
        buffer.put(MAGIC).putInt(8 + finsLength).putInt(2).putInt(0);
        buffer.put((byte) 0x80)        // ICF
                .put((byte) 0x00)      // RSV
                .put((byte) 0x02)      // GCT
                .put((byte) 0x00)      // DNA
                .put((byte) serverNode)
                .put((byte) 0x00)      // DA2
                .put((byte) 0x00)      // SNA
                .put((byte) clientNode)
                .put((byte) 0x00)      // SA2
                .put((byte) sid);
        buffer.put(body);
        return buffer.array();
    }

    private static void checkTcpHeader(byte[] response) {
        if (response.length < TCP_HEADER_LENGTH) {
            throw new ProtocolDataException("FINS/TCP头长度不足: " + response.length);
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (response[i] != MAGIC[i]) {
                throw new ProtocolDataException("FINS/TCP头标识错误");
            }
        }
        int errorCode = ByteBuffer.wrap(response).getInt(12);
        if (errorCode != 0) {
            throw new NetworkException(String.format("FINS/TCP连接错误码: 0x%08X", errorCode), null);
        }
    }
}
