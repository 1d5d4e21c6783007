package com.sdu.sparkbridge.utils;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * 关闭后才允许读取, 读取不拷贝内部数组
 *
 * @author hanhan.zhang
 * */
public class ByteBufferOutputStream extends ByteArrayOutputStream {

    private boolean closed = false;

    public ByteBufferOutputStream() {
        this(32);
    }

    public ByteBufferOutputStream(int capacity) {
        super(capacity);
    }

    @Override
    public void write(int b) {
        checkOpen();
        super.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len){
        checkOpen();
        super.write(b, off, len);
    }

    @Override
    public void reset() {
        checkOpen();
        super.reset();
    }

    @Override
    public void close() {
        closed = true;
    }

    public ByteBuffer toByteBuffer() {
        if (!closed) {
            throw new IllegalStateException("can only call toByteBuffer() after ByteBufferOutputStream has been closed");
        }
        return ByteBuffer.wrap(buf, 0, count);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("cannot write to a closed ByteBufferOutputStream");
        }
    }
}
