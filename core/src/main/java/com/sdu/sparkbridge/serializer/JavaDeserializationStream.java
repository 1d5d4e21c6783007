package com.sdu.sparkbridge.serializer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectStreamClass;

/**
 * @author hanhan.zhang
 * */
public class JavaDeserializationStream extends DeserializationStream {

    private final ObjectInputStream objIn;

    public JavaDeserializationStream(InputStream is, ClassLoader loader) throws IOException {
        this.objIn = new ObjectInputStream(is) {
            @Override
            protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
                try {
                    return Class.forName(desc.getName(), false, loader);
                } catch (ClassNotFoundException e) {
                    // 基本类型及数组
                    return super.resolveClass(desc);
                }
            }
        };
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T readObject() throws IOException {
        try {
            return (T) objIn.readObject();
        } catch (ClassNotFoundException e) {
            InvalidClassException ice = new InvalidClassException("class not found: " + e.getMessage());
            ice.initCause(e);
            throw ice;
        }
    }

    @Override
    public void close() throws IOException {
        objIn.close();
    }
}
