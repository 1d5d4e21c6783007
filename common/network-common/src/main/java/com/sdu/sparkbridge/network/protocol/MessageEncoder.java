package com.sdu.sparkbridge.network.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageEncoder;

import java.util.List;

/**
 * 消息编码[可被多个{@link ChannelHandler}共享], 单例模式
 *
 * @author hanhan.zhang
 * */
@ChannelHandler.Sharable
public class MessageEncoder extends MessageToMessageEncoder<Message> {

    public static final MessageEncoder INSTANCE = new MessageEncoder();

    private MessageEncoder() {}

    @Override
    protected void encode(ChannelHandlerContext ctx, Message in, List<Object> out) throws Exception {
        /*
         * 消息编码:
         *
         * +-------------+------+---------------+----------------+
         * |    header   | Type | MessageHeader |   MessageBody  |
         * +-------------+------+---------------+----------------+
         * | FrameLength |               FrameBody               |
         * +-------------+---------------------------------------+
         *
         * FrameLength包含自身8字节
         * */
        Message.Type msgType = in.type();
        int frameLength = 8 + msgType.encodedLength() + in.encodedLength();
        ByteBuf frame = ctx.alloc().heapBuffer(frameLength);

        frame.writeLong(frameLength);
        msgType.encode(frame);
        in.encode(frame);

        assert frame.writableBytes() == 0;

        out.add(frame);
    }
}
