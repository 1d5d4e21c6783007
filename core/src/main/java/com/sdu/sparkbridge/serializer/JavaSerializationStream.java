package com.sdu.sparkbridge.serializer;

import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.OutputStream;

/**
 * @author hanhan.zhang
 * */
public class JavaSerializationStream extends SerializationStream {

    private int counter;
    /**
     * {@link ObjectOutputStream}达到阈值时, Stream重置(丢弃Stream状态, 防止JVM内存溢出)
     * */
    private final int counterReset;

    private final ObjectOutputStream objOut;

    public JavaSerializationStream(OutputStream out, int counterReset) throws IOException {
        this.counterReset = counterReset;
        this.objOut = new ObjectOutputStream(out);
        this.counter = 0;
    }

    @Override
    public <T> SerializationStream writeObject(T object) throws IOException {
        objOut.writeObject(object);
        counter++;
        if (counterReset > 0 && counter >= counterReset) {
            objOut.reset();
            counter = 0;
        }
        return this;
    }

    @Override
    public void flush() throws IOException {
        objOut.flush();
    }

    @Override
    public void close() throws IOException {
        objOut.close();
    }
}
