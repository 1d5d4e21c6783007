package com.sdu.sparkbridge.streaming.proxy;

import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;

import java.util.List;

/**
 * 宿主引擎DStream代理, 时间单位均为毫秒
 *
 * @author hanhan.zhang
 * */
public interface DStreamProxy {

    long slideDuration();

    DStreamProxy window(long windowMs, long slideMs);

    /**
     * 注册输出操作, 每个批次宿主引擎回调序列化的{@link com.sdu.sparkbridge.streaming.api.function.ForeachRDDFunction}
     * */
    void callForeachRDD(byte[] func, SerializedMode serializedMode);

    void print(int num);

    void persist(StorageLevelType storageLevelType);

    void checkpoint(long intervalMs);

    List<RDDProxy> slice(long fromTimeMs, long toTimeMs);
}
