package com.sdu.sparkbridge.serializer;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;

/**
 * @author hanhan.zhang
 * */
public abstract class SerializationStream implements Closeable {

    public abstract <T> SerializationStream writeObject(T object) throws IOException;

    public abstract void flush() throws IOException;

    public <T> SerializationStream writeAll(Iterator<T> iterator) throws IOException {
        while (iterator.hasNext()) {
            writeObject(iterator.next());
        }
        return this;
    }

}
