package com.sdu.sparkbridge.network.utils;

import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

/**
 * Netty消息切帧:
 *
 * 1: 首先读取8字节的FrameLength, FrameBody = FrameLength - 8
 *
 * 2: FrameBody = messageType + messageHeader + messageBody
 *
 * 3: 切分出的FrameBody交给{@link com.sdu.sparkbridge.network.protocol.MessageDecoder}处理
 *
 * Note:
 *
 *  有状态, 每个SocketChannel需创建自己的TransportFrameDecoder
 *
 * @author hanhan.zhang
 * */
public class TransportFrameDecoder extends LengthFieldBasedFrameDecoder {

    public static final String HANDLER_NAME = "frameDecoder";

    /**
     * FrameLength, 8字节
     * */
    private static final int LENGTH_SIZE = 8;

    public TransportFrameDecoder(int maxFrameSize) {
        super(maxFrameSize, 0, LENGTH_SIZE, -LENGTH_SIZE, LENGTH_SIZE);
    }
}
