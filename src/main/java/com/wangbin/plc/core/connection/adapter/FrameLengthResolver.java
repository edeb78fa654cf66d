package com.wangbin.plc.core.connection.adapter;

import io.netty.buffer.ByteBuf;

/**
 * 根据已收到的字节判断完整响应帧长度
 */
@FunctionalInterface
public interface FrameLengthResolver {

    /**
     * @param buffer 从 readerIndex 开始的已收数据，不得修改读写索引
     * @return 完整帧长度，数据不足以判断时返回 -1
     */
    int frameLength(ByteBuf buffer);
}
