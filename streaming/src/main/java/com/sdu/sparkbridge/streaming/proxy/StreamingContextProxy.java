package com.sdu.sparkbridge.streaming.proxy;

import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;

import java.util.List;

/**
 * 宿主引擎StreamingContext代理
 *
 * func参数均为序列化的转换函数, 宿主引擎在每个批次经回调执行
 *
 * @author hanhan.zhang
 * */
public interface StreamingContextProxy {

    void start();

    void stop();

    void remember(long durationMs);

    void checkpoint(String directory);

    void awaitTermination();

    boolean awaitTerminationOrTimeout(long timeoutMs);

    DStreamProxy textFileStream(String directory);

    DStreamProxy socketTextStream(String hostname, int port, StorageLevelType storageLevelType);

    DStreamProxy union(DStreamProxy first, List<DStreamProxy> rest);

    DStreamProxy createTransformedDStream(DStreamProxy parent, byte[] func, SerializedMode serializedMode);

    DStreamProxy createTransformed2DStream(DStreamProxy parent, DStreamProxy other, byte[] func,
                                           SerializedMode serializedMode, SerializedMode otherSerializedMode);

    /**
     * @param invFunc 可为null, 此时每个窗口重新归约
     * */
    DStreamProxy createReducedWindowedDStream(DStreamProxy parent, byte[] func, byte[] invFunc, long windowMs,
                                              long slideMs, SerializedMode serializedMode);

    DStreamProxy createStateDStream(DStreamProxy parent, byte[] func, SerializedMode serializedMode);

    DStreamProxy createConstantInputDStream(RDDProxy rddProxy);
}
