package com.sdu.sparkbridge.network.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * @author hanhan.zhang
 * */
public class Encoders {

    public static class Strings {

        public static int encodedLength(String s) {
            return 4 + s.getBytes(StandardCharsets.UTF_8).length;
        }

        public static void encode(ByteBuf buf, String s) {
            byte []bytes = s.getBytes(StandardCharsets.UTF_8);
            buf.writeInt(bytes.length);
            buf.writeBytes(bytes);
        }

        public static String decode(ByteBuf buf) {
            int length = buf.readInt();
            byte []bytes = new byte[length];
            buf.readBytes(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }

    }

    public static class ByteBuffers {

        public static int encodedLength(ByteBuffer body) {
            return 4 + body.remaining();
        }

        /** 写入不改变body的position */
        public static void encode(ByteBuf buf, ByteBuffer body) {
            buf.writeInt(body.remaining());
            buf.writeBytes(body.duplicate());
        }

        public static ByteBuffer decode(ByteBuf buf) {
            int length = buf.readInt();
            byte[] bytes = new byte[length];
            buf.readBytes(bytes);
            return ByteBuffer.wrap(bytes);
        }
    }

}
