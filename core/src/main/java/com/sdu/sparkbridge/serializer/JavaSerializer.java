package com.sdu.sparkbridge.serializer;

import com.sdu.sparkbridge.SparkConf;

/**
 * 使用JAVA序列化机制
 *
 * @author hanhan.zhang
 * */
public class JavaSerializer implements Serializer {

    public static final String OBJECT_STREAM_RESET = "spark.serializer.objectStreamReset";

    private static final int DEFAULT_COUNTER_RESET = 100;

    private final int counterReset;

    public JavaSerializer() {
        this.counterReset = DEFAULT_COUNTER_RESET;
    }

    public JavaSerializer(SparkConf conf) {
        this.counterReset = conf.getInt(OBJECT_STREAM_RESET, DEFAULT_COUNTER_RESET);
    }

    @Override
    public SerializerInstance newInstance() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = JavaSerializer.class.getClassLoader();
        }
        return new JavaSerializerInstance(counterReset, classLoader);
    }
}
