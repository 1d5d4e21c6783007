package com.sdu.sparkbridge.proxy;

import com.sdu.sparkbridge.storage.StorageLevelType;

import java.util.List;

/**
 * 宿主引擎RDD代理, collect/count等动作同步等待宿主引擎返回
 *
 * @author hanhan.zhang
 * */
public interface RDDProxy {

    List<byte[]> collect();

    long count();

    RDDProxy union(RDDProxy other);

    void cache();

    void persist(StorageLevelType storageLevelType);

    void unpersist();

    void checkpoint();

    boolean isCheckpointed();

    int getNumPartitions();

    RDDProxy repartition(int numPartitions);

    RDDProxy coalesce(int numPartitions, boolean shuffle);

    RDDProxy sample(boolean withReplacement, double fraction, long seed);

    RDDProxy cartesian(RDDProxy other);

    RDDProxy zip(RDDProxy other);

    void setName(String name);

    String name();

    String toDebugString();

    void saveAsTextFile(String path, String compressionCodecClass);
}
