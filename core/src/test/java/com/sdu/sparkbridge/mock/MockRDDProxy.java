package com.sdu.sparkbridge.mock;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.Lists;
import com.sdu.sparkbridge.SparkException;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.storage.StorageLevelType;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 进程内RDD代理: 分区数据按需计算且只计算一次
 *
 * recordsPerElement为每个元素占用的记录数, Pair编码(cartesian, zip)时为2
 *
 * @author hanhan.zhang
 * */
public class MockRDDProxy implements RDDProxy {

    private final MockSparkContextProxy context;

    private final Supplier<List<List<byte[]>>> partitions;

    private final int recordsPerElement;

    private String name;

    private StorageLevelType storageLevel = StorageLevelType.NONE;

    private boolean checkpointed;

    public MockRDDProxy(MockSparkContextProxy context, List<List<byte[]>> partitions) {
        this(context, () -> partitions, 1);
    }

    public MockRDDProxy(MockSparkContextProxy context, Supplier<List<List<byte[]>>> partitions, int recordsPerElement) {
        this.context = context;
        this.partitions = Suppliers.memoize(partitions);
        this.recordsPerElement = recordsPerElement;
    }

    public List<List<byte[]>> partitions() {
        return partitions.get();
    }

    public int getRecordsPerElement() {
        return recordsPerElement;
    }

    public StorageLevelType getStorageLevel() {
        return storageLevel;
    }

    @Override
    public List<byte[]> collect() {
        List<byte[]> records = Lists.newArrayList();
        for (List<byte[]> partition : partitions()) {
            records.addAll(partition);
        }
        return records;
    }

    @Override
    public long count() {
        long records = 0;
        for (List<byte[]> partition : partitions()) {
            records += partition.size();
        }
        return records / recordsPerElement;
    }

    @Override
    public RDDProxy union(RDDProxy other) {
        return context.union(Lists.newArrayList(this, other));
    }

    @Override
    public void cache() {
        persist(StorageLevelType.MEMORY_ONLY);
    }

    @Override
    public void persist(StorageLevelType storageLevelType) {
        this.storageLevel = storageLevelType;
    }

    @Override
    public void unpersist() {
        this.storageLevel = StorageLevelType.NONE;
    }

    @Override
    public void checkpoint() {
        this.checkpointed = true;
    }

    @Override
    public boolean isCheckpointed() {
        return checkpointed;
    }

    @Override
    public int getNumPartitions() {
        return partitions().size();
    }

    @Override
    public RDDProxy repartition(int numPartitions) {
        return coalesce(numPartitions, true);
    }

    /**
     * 元素按轮询方式重新分布
     * */
    @Override
    public RDDProxy coalesce(int numPartitions, boolean shuffle) {
        return new MockRDDProxy(context, () -> {
            List<List<byte[]>> result = Lists.newArrayList();
            for (int i = 0; i < numPartitions; ++i) {
                result.add(Lists.newArrayList());
            }
            int index = 0;
            List<byte[]> records = collect();
            for (int i = 0; i < records.size(); i += recordsPerElement) {
                result.get(index++ % numPartitions).addAll(records.subList(i, i + recordsPerElement));
            }
            return result;
        }, recordsPerElement);
    }

    @Override
    public RDDProxy sample(boolean withReplacement, double fraction, long seed) {
        return new MockRDDProxy(context, () -> {
            Random random = new Random(seed);
            List<List<byte[]>> result = Lists.newArrayList();
            for (List<byte[]> partition : partitions()) {
                List<byte[]> sampled = Lists.newArrayList();
                for (int i = 0; i < partition.size(); i += recordsPerElement) {
                    if (random.nextDouble() < fraction) {
                        sampled.addAll(partition.subList(i, i + recordsPerElement));
                    }
                }
                result.add(sampled);
            }
            return result;
        }, recordsPerElement);
    }

    @Override
    public RDDProxy cartesian(RDDProxy other) {
        MockRDDProxy right = (MockRDDProxy) other;
        return new MockRDDProxy(context, () -> {
            List<List<byte[]>> result = Lists.newArrayList();
            for (List<byte[]> leftPartition : partitions()) {
                for (List<byte[]> rightPartition : right.partitions()) {
                    List<byte[]> pairs = Lists.newArrayList();
                    for (byte[] l : leftPartition) {
                        for (byte[] r : rightPartition) {
                            pairs.add(l);
                            pairs.add(r);
                        }
                    }
                    result.add(pairs);
                }
            }
            return result;
        }, 2);
    }

    @Override
    public RDDProxy zip(RDDProxy other) {
        MockRDDProxy right = (MockRDDProxy) other;
        return new MockRDDProxy(context, () -> {
            List<List<byte[]>> left = partitions();
            List<List<byte[]>> rightPartitions = right.partitions();
            if (left.size() != rightPartitions.size()) {
                throw new SparkException("Can only zip RDDs with same number of partitions");
            }
            List<List<byte[]>> result = Lists.newArrayList();
            for (int i = 0; i < left.size(); ++i) {
                if (left.get(i).size() != rightPartitions.get(i).size()) {
                    throw new SparkException("Can only zip RDDs with same number of elements in each partition");
                }
                List<byte[]> pairs = Lists.newArrayList();
                for (int j = 0; j < left.get(i).size(); ++j) {
                    pairs.add(left.get(i).get(j));
                    pairs.add(rightPartitions.get(i).get(j));
                }
                result.add(pairs);
            }
            return result;
        }, 2);
    }

    @Override
    public void setName(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toDebugString() {
        return String.format("(%d) MockRDDProxy[%s]", getNumPartitions(), name);
    }

    @Override
    public void saveAsTextFile(String path, String compressionCodecClass) {
        List<String> lines = Lists.newArrayList();
        for (byte[] record : collect()) {
            lines.add(new String(record, StandardCharsets.UTF_8));
        }
        context.saveTextFile(path, Collections.unmodifiableList(lines));
    }
}
