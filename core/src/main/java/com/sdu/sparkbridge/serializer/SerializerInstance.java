package com.sdu.sparkbridge.serializer;

import com.sdu.sparkbridge.SparkException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * 序列化实例, 非线程安全
 *
 * @author hanhan.zhang
 * */
public interface SerializerInstance {

    <T> ByteBuffer serialize(T object) throws IOException;

    <T> T deserialize(ByteBuffer buf) throws IOException;

    SerializationStream serializeStream(OutputStream os) throws IOException;

    DeserializationStream deserializeStream(InputStream is) throws IOException;

    default byte[] toBytes(Object object) {
        try {
            ByteBuffer buf = serialize(object);
            byte[] bytes = new byte[buf.remaining()];
            buf.get(bytes);
            return bytes;
        } catch (IOException e) {
            throw new SparkException("failed to serialize " + object.getClass().getName(), e);
        }
    }

    default <T> T fromBytes(byte[] bytes) {
        try {
            return deserialize(ByteBuffer.wrap(bytes));
        } catch (IOException e) {
            throw new SparkException("failed to deserialize " + bytes.length + " bytes", e);
        }
    }
}
