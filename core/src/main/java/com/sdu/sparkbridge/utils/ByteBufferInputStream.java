package com.sdu.sparkbridge.utils;

import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * 读取ByteBuffer, 不拷贝数据
 *
 * @author hanhan.zhang
 * */
public class ByteBufferInputStream extends InputStream {

    private ByteBuffer buffer;

    public ByteBufferInputStream(ByteBuffer buffer) {
        this.buffer = buffer;
    }

    @Override
    public int read() {
        if (buffer == null || buffer.remaining() == 0) {
            buffer = null;
            return -1;
        } else {
            return buffer.get() & 0xFF;
        }
    }

    @Override
    public int read(byte []dest, int offset, int length){
        if (buffer == null || buffer.remaining() == 0) {
            buffer = null;
            return -1;
        } else {
            int amountToGet = Math.min(buffer.remaining(), length);
            buffer.get(dest, offset, amountToGet);
            return amountToGet;
        }
    }

    @Override
    public long skip(long bytes) {
        if (buffer != null) {
            int amountToSkip = (int) Math.min(bytes, buffer.remaining());
            buffer.position(buffer.position() + amountToSkip);
            return amountToSkip;
        } else {
            return 0L;
        }
    }

    @Override
    public int available() {
        return buffer == null ? 0 : buffer.remaining();
    }
}
