package com.wangbin.plc.core.collector.protocol.modbus;

import com.wangbin.plc.common.exception.ProtocolDataException;
import com.wangbin.plc.core.collector.protocol.modbus.utils.RtuFrameCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RtuFrameCodecTest {

    @Test
    void readRequestCarriesCrcLowByteFirst() {
        byte[] frame = RtuFrameCodec.readRequest(1, 3, 0, 10);

        assertArrayEquals(new byte[]{0x01, 0x03, 0x00, 0x00, 0x00, 0x0A, (byte) 0xC5, (byte) 0xCD}, frame);
    }

    @Test
    void responseDataIsExtracted() {
        byte[] response = RtuFrameCodec.frame(2, new byte[]{0x03, 0x02, 0x12, 0x34});

        assertArrayEquals(new byte[]{0x12, 0x34}, RtuFrameCodec.parseResponse(response, 2, 3));
    }

    @Test
    void writeResponseHasNoData() {
        byte[] response = RtuFrameCodec.frame(1, new byte[]{0x06, 0x00, 0x01, 0x00, 0x7B});

        assertEquals(0, RtuFrameCodec.parseResponse(response, 1, 6).length);
    }

    @Test
    void corruptedCrcIsRejected() {
        byte[] response = RtuFrameCodec.frame(1, new byte[]{0x03, 0x02, 0x12, 0x34});
        response[response.length - 1] ^= 0x01;

        ProtocolDataException e = assertThrows(ProtocolDataException.class,
                () -> RtuFrameCodec.parseResponse(response, 1, 3));
        assertEquals("RTU响应CRC校验失败", e.getMessage());
    }

    @Test
    void exceptionResponseIsReported() {
        byte[] response = RtuFrameCodec.frame(1, new byte[]{(byte) 0x83, 0x02});

        ProtocolDataException e = assertThrows(ProtocolDataException.class,
                () -> RtuFrameCodec.parseResponse(response, 1, 3));
        assertTrue(e.getMessage().contains("0x02"));
    }

    @Test
    void stationMismatchIsRejected() {
        byte[] response = RtuFrameCodec.frame(3, new byte[]{0x03, 0x02, 0x00, 0x01});

        assertThrows(ProtocolDataException.class, () -> RtuFrameCodec.parseResponse(response, 1, 3));
    }

    @Test
    void multiRegisterWriteUsesFunction16() {
        byte[] frame = RtuFrameCodec.writeRegistersRequest(1, 10, new byte[]{0, 1, 0, 2});

        assertEquals(0x10, frame[1]);
        assertEquals(2, frame[5]);
        assertEquals(4, frame[6]);
        assertEquals(13, frame.length);
    }
}
