package com.wangbin.plc.core.collector.protocol.omron;

import com.wangbin.plc.common.exception.ConfigurationException;
import com.wangbin.plc.common.exception.NetworkException;
import com.wangbin.plc.common.exception.ProtocolDataException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class FinsFrameBuilderTest {

    @Test
    void parsesAreaAliasesAndBits() {
        FinsAddress dm = FinsAddress.parse("dm100");
        assertEquals("D", dm.getArea());
        assertEquals(100, dm.getWordAddress());
        assertEquals(0x82, dm.areaCode());

        FinsAddress bit = FinsAddress.parse("W10.3");
        assertTrue(bit.isBitAddress());
        assertEquals(3, bit.getBit());
        assertEquals(0x31, bit.areaCode());

        assertEquals("CIO", FinsAddress.parse("C20").getArea());
        assertThrows(ConfigurationException.class, () -> FinsAddress.parse("D100.16"));
        assertThrows(ConfigurationException.class, () -> FinsAddress.parse("X100"));
    }

    @Test
    void readRequestLayout() {
        byte[] frame = FinsFrameBuilder.readRequest(0x21, 0x01, 7, FinsAddress.parse("D100"), 2);

        assertEquals(34, frame.length);
        assertEquals('F', frame[0]);
        assertEquals('S', frame[3]);
        ByteBuffer buffer = ByteBuffer.wrap(frame);
        assertEquals(26, buffer.getInt(4));
        assertEquals(2, buffer.getInt(8));
        assertEquals((byte) 0x80, frame[16]);
        assertEquals(0x01, frame[20]);
        assertEquals(0x21, frame[23]);
        assertEquals(7, frame[25]);
        assertEquals(0x01, frame[26]);
        assertEquals(0x01, frame[27]);
        assertEquals((byte) 0x82, frame[28]);
        assertEquals(100, buffer.getShort(29));
        assertEquals(2, buffer.getShort(32));
    }

    @Test
    void responseDataFollowsEndCode() {
        byte[] response = response(0x0000, new byte[]{0x12, 0x34});

        assertArrayEquals(new byte[]{0x12, 0x34}, FinsFrameBuilder.parseResponse(response, FinsFrameBuilder.SRC_READ));
    }

    @Test
    void relayFlagInEndCodeIsIgnored() {
        byte[] response = response(0x0080, new byte[]{0x00, 0x01});

        assertEquals(2, FinsFrameBuilder.parseResponse(response, FinsFrameBuilder.SRC_READ).length);
    }

    @Test
    void errorEndCodeIsProtocolError() {
        byte[] response = response(0x1103, new byte[0]);

        ProtocolDataException e = assertThrows(ProtocolDataException.class,
                () -> FinsFrameBuilder.parseResponse(response, FinsFrameBuilder.SRC_READ));
        assertTrue(e.getMessage().contains("0x1103"));
    }

    @Test
    void tcpErrorCodeIsNetworkError() {
        byte[] response = response(0, new byte[0]);
        ByteBuffer.wrap(response).putInt(12, 3);

        assertThrows(NetworkException.class, () -> FinsFrameBuilder.parseResponse(response, FinsFrameBuilder.SRC_READ));
    }

    @Test
    void handshakeAssignsNodes() {
        ByteBuffer buffer = ByteBuffer.allocate(24);
        buffer.put(new byte[]{'F', 'I', 'N', 'S'}).putInt(16).putInt(1).putInt(0).putInt(0x21).putInt(0x01);

        assertArrayEquals(new int[]{0x21, 0x01}, FinsFrameBuilder.parseHandshake(buffer.array()));
        assertEquals(20, FinsFrameBuilder.handshake().length);
    }

    private static byte[] response(int endCode, byte[] data) {
        ByteBuffer buffer = ByteBuffer.allocate(FinsFrameBuilder.RESPONSE_DATA_OFFSET + data.length);
        buffer.put(new byte[]{'F', 'I', 'N', 'S'}).putInt(8 + 14 + data.length).putInt(2).putInt(0);
        buffer.put(new byte[]{(byte) 0xC0, 0, 0x02, 0, 0x21, 0, 0, 0x01, 0, 7});
        buffer.put((byte) FinsFrameBuilder.MRC_MEMORY).put((byte) FinsFrameBuilder.SRC_READ);
        buffer.putShort((short) endCode);
        buffer.put(data);
        return buffer.array();
    }
}
