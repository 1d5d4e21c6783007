package com.sdu.sparkbridge;

import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.serializer.JavaSerializer;
import com.sdu.sparkbridge.serializer.SerializerInstance;
import org.junit.Test;

/**
 * @author hanhan.zhang
 * */
public class TestPartitioner {

    private final SerializerInstance serializer = new JavaSerializer().newInstance();

    @Test
    public void testNegativeShuffleKeys() {
        int[] partitionCounts = {1, 2, 3, 7, 64};
        long[] shuffleKeys = {Long.MIN_VALUE, Long.MAX_VALUE, Integer.MIN_VALUE, -1L, -7L, 0L, 0xFFFFFFFFL, 0x80000000L};
        for (int n : partitionCounts) {
            for (long key : shuffleKeys) {
                int partition = Partitioner.partitionOf(key, n);
                assert partition >= 0 && partition < n : key + " -> " + partition;
            }
        }
    }

    @Test
    public void testDefaultPartitionerInRange() {
        Partitioner partitioner = new Partitioner(5);
        for (int i = -1000; i < 1000; ++i) {
            int partition = partitioner.getPartition("key-" + i, serializer);
            assert partition >= 0 && partition < 5;
        }
    }

    @Test
    public void testDefaultPartitionerIsDeterministic() {
        Partitioner partitioner = new Partitioner(16);
        SerializerInstance other = new JavaSerializer().newInstance();
        for (int i = 0; i < 100; ++i) {
            assert partitioner.shuffleKey(i, serializer) == partitioner.shuffleKey(i, other);
            assert partitioner.getPartition(i, serializer) == new Partitioner(16).getPartition(i, other);
        }
    }

    @Test
    public void testKeyFunction() {
        Function<Object, Integer> keyFunc = key -> (Integer) key;
        Partitioner partitioner = new Partitioner(4, keyFunc);
        assert partitioner.getPartition(6, serializer) == 2;
        assert partitioner.getPartition(-1, serializer) == 3;
        assert partitioner.getPartition(Integer.MIN_VALUE, serializer) == 0;
    }

    @Test
    public void testEquality() {
        Function<Object, Integer> keyFunc = key -> 0;
        Function<Object, Integer> otherKeyFunc = key -> 0;

        assert new Partitioner(3).equals(new Partitioner(3));
        assert !new Partitioner(3).equals(new Partitioner(4));
        assert new Partitioner(3, keyFunc).equals(new Partitioner(3, keyFunc));
        assert new Partitioner(3, keyFunc).hashCode() == new Partitioner(3, keyFunc).hashCode();
        // 分区函数按对象标识比较
        assert !new Partitioner(3, keyFunc).equals(new Partitioner(3, otherKeyFunc));
        assert !new Partitioner(3, keyFunc).equals(new Partitioner(3));
        assert !new Partitioner(3).equals(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositivePartitions() {
        new Partitioner(0);
    }
}
