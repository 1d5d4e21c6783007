package com.sdu.sparkbridge.serializer;

import com.sdu.sparkbridge.utils.ByteBufferInputStream;
import com.sdu.sparkbridge.utils.ByteBufferOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * @author hanhan.zhang
 * */
public class JavaSerializerInstance implements SerializerInstance {

    /**
     * {@link java.io.ObjectOutputStream}重置阈值
     * */
    private final int counterReset;

    private final ClassLoader loader;

    public JavaSerializerInstance(int counterReset, ClassLoader loader) {
        this.counterReset = counterReset;
        this.loader = loader;
    }

    @Override
    public <T> ByteBuffer serialize(T object) throws IOException {
        ByteBufferOutputStream bos = new ByteBufferOutputStream();
        try (SerializationStream out = serializeStream(bos)) {
            out.writeObject(object);
        }
        return bos.toByteBuffer();
    }

    @Override
    public <T> T deserialize(ByteBuffer buf) throws IOException {
        try (DeserializationStream in = deserializeStream(new ByteBufferInputStream(buf))) {
            return in.readObject();
        }
    }

    @Override
    public SerializationStream serializeStream(OutputStream os) throws IOException {
        return new JavaSerializationStream(os, counterReset);
    }

    @Override
    public DeserializationStream deserializeStream(InputStream is) throws IOException {
        return new JavaDeserializationStream(is, loader);
    }
}
