package com.sdu.sparkbridge.proxy;

import java.util.List;

/**
 * 宿主引擎SparkContext代理
 *
 * @author hanhan.zhang
 * */
public interface SparkContextProxy {

    /**
     * @param elements 已按{@link com.sdu.sparkbridge.serializer.SerializedMode#Byte}编码的元素
     * */
    RDDProxy parallelize(List<byte[]> elements, int numSlices);

    RDDProxy textFile(String path, int minPartitions);

    RDDProxy emptyRDD();

    RDDProxy union(List<RDDProxy> rdds);

    /**
     * 创建新的远端Stage: 对parent每个分区执行command(序列化的{@link com.sdu.sparkbridge.worker.Command})
     * */
    RDDProxy createPipelinedRDD(RDDProxy parent, byte[] command, boolean preservesPartitioning);

    /**
     * keyed的元素为[8字节shuffle key, 序列化键值对]交替出现, 宿主引擎按shuffle key重分区
     * */
    RDDProxy createPairwiseRDD(RDDProxy keyed, int numPartitions, long partitionFuncId);

    int defaultParallelism();

    void setCheckpointDir(String directory);

    void stop();
}
