package com.sdu.sparkbridge;

import com.google.common.base.Objects;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;
import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.serializer.SerializerInstance;

import java.io.Serializable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.sdu.sparkbridge.utils.Utils.nonNegativeMod;

/**
 * Key到分区的映射
 *
 * 1: 指定keyFunc时, partition = nonNegativeMod(keyFunc(key), numPartitions)
 *
 * 2: 未指定keyFunc时, 对Key的序列化字节取MD5, 前8字节作为shuffle key, partition = nonNegativeMod((int) shuffleKey, numPartitions)
 *
 * Note:
 *
 *  默认分区仅对Key的序列化结果计算散列, 与进程无关, 同一Key在所有节点上落入同一分区
 *
 * @author hanhan.zhang
 * */
public class Partitioner implements Serializable {

    private final int numPartitions;

    private final Function<Object, Integer> keyFunc;

    public Partitioner(int numPartitions) {
        this(numPartitions, null);
    }

    public Partitioner(int numPartitions, Function<Object, Integer> keyFunc) {
        checkArgument(numPartitions > 0, "Number of partitions must be positive but found %s", numPartitions);
        this.numPartitions = numPartitions;
        this.keyFunc = keyFunc;
    }

    public int numPartitions() {
        return numPartitions;
    }

    public Function<Object, Integer> keyFunc() {
        return keyFunc;
    }

    /**
     * 8字节shuffle key, 宿主引擎据此重分区
     * */
    public long shuffleKey(Object key, SerializerInstance serializer) {
        if (keyFunc == null) {
            HashCode hash = Hashing.md5().hashBytes(serializer.toBytes(key));
            return Longs.fromByteArray(hash.asBytes());
        }
        return nonNegativeMod(keyFunc.call(key), numPartitions);
    }

    public int getPartition(Object key, SerializerInstance serializer) {
        return partitionOf(shuffleKey(key, serializer), numPartitions);
    }

    /**
     * shuffle key取低32位对分区数取模
     * */
    public static int partitionOf(long shuffleKey, int numPartitions) {
        return nonNegativeMod((int) shuffleKey, numPartitions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Partitioner that = (Partitioner) o;
        // keyFunc按对象标识比较
        return numPartitions == that.numPartitions && keyFunc == that.keyFunc;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(numPartitions, keyFunc == null ? 0 : System.identityHashCode(keyFunc));
    }

    @Override
    public String toString() {
        return String.format("Partitioner(numPartitions=%d, keyFunc=%s)", numPartitions, keyFunc == null ? "hash" : keyFunc);
    }
}
