package com.sdu.sparkbridge.serializer;

import java.io.Closeable;
import java.io.IOException;

/**
 * @author hanhan.zhang
 * */
public abstract class DeserializationStream implements Closeable {

    public abstract <T> T readObject() throws IOException;

}
