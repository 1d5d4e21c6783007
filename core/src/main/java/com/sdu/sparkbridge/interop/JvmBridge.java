package com.sdu.sparkbridge.interop;

import java.io.Closeable;

/**
 * 调用宿主JVM中的方法, 参数与返回值类型见{@link SerDe}
 *
 * 远端方法抛出异常时抛出{@link com.sdu.sparkbridge.JobExecutionException},
 * 通信失败时抛出{@link com.sdu.sparkbridge.BridgeException}
 *
 * @author hanhan.zhang
 * */
public interface JvmBridge extends Closeable {

    Object callStaticJavaMethod(String className, String methodName, Object... args);

    Object callNonStaticJavaMethod(JvmObjectReference objectId, String methodName, Object... args);

    JvmObjectReference callConstructor(String className, Object... args);

    @Override
    void close();
}
