package com.sdu.sparkbridge.rdd;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.sdu.sparkbridge.Partitioner;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.api.function.FlatMapFunction;
import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.api.function.Function2;
import com.sdu.sparkbridge.api.function.VoidFunction;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;
import com.sdu.sparkbridge.utils.scala.Tuple2;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * RDD血缘节点, 持有宿主引擎中对应数据集的代理
 *
 * 1: 所有窄依赖转换均基于{@link #mapPartitionsWithIndex(Function2, boolean)}实现, 转换不触发远端计算
 *
 * 2: 动作(collect, count, saveAsTextFile等)提交累积的WorkerFunction并阻塞等待宿主引擎返回
 *
 * 3: preservesPartitioning = false时结果RDD不继承分区器
 *
 * @author hanhan.zhang
 * */
public class RDD<T> {

    protected final SparkContext sparkContext;

    protected RDDProxy rddProxy;

    /**
     * 本RDD分区元素的编码方式
     * */
    protected SerializedMode serializedMode;

    protected Partitioner partitioner;

    protected boolean cached;

    protected boolean checkpointed;

    public RDD(RDDProxy rddProxy, SparkContext sparkContext) {
        this(rddProxy, sparkContext, SerializedMode.Byte);
    }

    public RDD(RDDProxy rddProxy, SparkContext sparkContext, SerializedMode serializedMode) {
        this.rddProxy = rddProxy;
        this.sparkContext = sparkContext;
        this.serializedMode = serializedMode;
    }

    public RDDProxy getRddProxy() {
        return rddProxy;
    }

    public SparkContext getSparkContext() {
        return sparkContext;
    }

    public SerializedMode getSerializedMode() {
        return serializedMode;
    }

    public Partitioner getPartitioner() {
        return partitioner;
    }

    /**
     * 能否与下游窄依赖转换合并为同一远端Stage
     * */
    public boolean isPipelinable() {
        return false;
    }

    public boolean isCached() {
        return cached;
    }

    // ------------------------------------- 转换 ---------------------------------------

    public <U> RDD<U> map(Function<T, U> f) {
        return map(f, false);
    }

    public <U> RDD<U> map(Function<T, U> f, boolean preservesPartitioning) {
        return mapPartitionsWithIndex(new MapHelper<>(f), preservesPartitioning);
    }

    public <U> RDD<U> flatMap(FlatMapFunction<T, U> f) {
        return flatMap(f, false);
    }

    public <U> RDD<U> flatMap(FlatMapFunction<T, U> f, boolean preservesPartitioning) {
        return mapPartitionsWithIndex(new FlatMapHelper<>(f), preservesPartitioning);
    }

    public RDD<T> filter(Function<T, Boolean> f) {
        return mapPartitionsWithIndex(new FilterHelper<>(f), true);
    }

    public <U> RDD<U> mapPartitions(FlatMapFunction<Iterator<T>, U> f) {
        return mapPartitions(f, false);
    }

    public <U> RDD<U> mapPartitions(FlatMapFunction<Iterator<T>, U> f, boolean preservesPartitioning) {
        return mapPartitionsWithIndex(new MapPartitionsHelper<>(f), preservesPartitioning);
    }

    public <U> RDD<U> mapPartitionsWithIndex(Function2<Integer, Iterator<T>, Iterator<U>> f) {
        return mapPartitionsWithIndex(f, false);
    }

    public <U> RDD<U> mapPartitionsWithIndex(Function2<Integer, Iterator<T>, Iterator<U>> f, boolean preservesPartitioning) {
        return mapPartitionsWithIndex(WorkerFunction.of(f), preservesPartitioning);
    }

    /**
     * 非流水线节点: 以本RDD为起点开启新的流水线
     * */
    <U> PipelinedRDD<U> mapPartitionsWithIndex(WorkerFunction workerFunction, boolean preservesPartitioning) {
        return new PipelinedRDD<>(sparkContext, getRddProxy(), serializedMode, workerFunction,
                preservesPartitioning, preservesPartitioning ? partitioner : null);
    }

    public RDD<List<T>> glom() {
        return mapPartitionsWithIndex(new GlomHelper<>());
    }

    public RDD<T> union(RDD<T> other) {
        if (serializedMode == other.serializedMode) {
            return new RDD<>(getRddProxy().union(other.getRddProxy()), sparkContext, serializedMode);
        }
        // 编码方式不同, 统一转换为Byte
        return reserialize().union(other.reserialize());
    }

    /**
     * 转换为Byte编码
     * */
    public RDD<T> reserialize() {
        if (serializedMode == SerializedMode.Byte) {
            return this;
        }
        return mapPartitionsWithIndex(new IdentityHelper<>(), true);
    }

    public RDD<T> repartition(int numPartitions) {
        checkArgument(numPartitions > 0, "Number of partitions must be positive but found %s", numPartitions);
        return new RDD<>(getRddProxy().repartition(numPartitions), sparkContext, serializedMode);
    }

    public RDD<T> coalesce(int numPartitions) {
        return coalesce(numPartitions, false);
    }

    public RDD<T> coalesce(int numPartitions, boolean shuffle) {
        checkArgument(numPartitions > 0, "Number of partitions must be positive but found %s", numPartitions);
        return new RDD<>(getRddProxy().coalesce(numPartitions, shuffle), sparkContext, serializedMode);
    }

    public RDD<T> distinct() {
        return distinct(0);
    }

    public RDD<T> distinct(int numPartitions) {
        RDD<Tuple2<T, Integer>> keyed = map(x -> new Tuple2<>(x, 0));
        return PairRDDFunctions.of(keyed).reduceByKey((x, y) -> x, numPartitions).map(Tuple2::_1);
    }

    public <K> RDD<Tuple2<K, T>> keyBy(Function<T, K> f) {
        return map(new KeyByHelper<>(f));
    }

    public <K> RDD<Tuple2<K, List<T>>> groupBy(Function<T, K> f) {
        return groupBy(f, 0);
    }

    public <K> RDD<Tuple2<K, List<T>>> groupBy(Function<T, K> f, int numPartitions) {
        return PairRDDFunctions.of(keyBy(f)).groupByKey(numPartitions);
    }

    /**
     * 返回在本RDD中但不在other中的元素
     * */
    public RDD<T> subtract(RDD<T> other) {
        return subtract(other, 0);
    }

    public RDD<T> subtract(RDD<T> other, int numPartitions) {
        RDD<Tuple2<T, Boolean>> left = map(x -> new Tuple2<>(x, true));
        RDD<Tuple2<T, Boolean>> right = other.map(x -> new Tuple2<>(x, true));
        return PairRDDFunctions.of(PairRDDFunctions.of(left).subtractByKey(right, numPartitions)).keys();
    }

    /**
     * 交集, 结果不含重复元素
     * */
    public RDD<T> intersection(RDD<T> other) {
        RDD<Tuple2<T, Boolean>> left = map(x -> new Tuple2<>(x, true));
        RDD<Tuple2<T, Boolean>> right = other.map(x -> new Tuple2<>(x, true));
        return PairRDDFunctions.of(left).groupWith(right)
                .filter(kv -> !kv._2()._1().isEmpty() && !kv._2()._2().isEmpty())
                .map(Tuple2::_1);
    }

    public RDD<T> sample(boolean withReplacement, double fraction, long seed) {
        checkArgument(fraction >= 0.0, "Negative fraction value: %s", fraction);
        return new RDD<>(getRddProxy().sample(withReplacement, fraction, seed), sparkContext, serializedMode);
    }

    public <U> RDD<Tuple2<T, U>> cartesian(RDD<U> other) {
        RDDProxy left = reserialize().getRddProxy();
        RDDProxy right = other.reserialize().getRddProxy();
        return new RDD<>(left.cartesian(right), sparkContext, SerializedMode.Pair);
    }

    /**
     * 按位置组合, 要求两个RDD分区数相同且各分区元素数相同
     * */
    public <U> RDD<Tuple2<T, U>> zip(RDD<U> other) {
        RDDProxy left = reserialize().getRddProxy();
        RDDProxy right = other.reserialize().getRddProxy();
        return new RDD<>(left.zip(right), sparkContext, SerializedMode.Pair);
    }

    // ------------------------------------- 动作 ---------------------------------------

    @SuppressWarnings("unchecked")
    public List<T> collect() {
        List<byte[]> records = getRddProxy().collect();
        Iterator<Object> elements = sparkContext.elementCodec().decode(serializedMode, records.iterator());
        return (List<T>) Lists.newArrayList(elements);
    }

    public long count() {
        return getRddProxy().count();
    }

    public T reduce(Function2<T, T, T> f) {
        List<T> partials = mapPartitionsWithIndex(new ReduceHelper<>(f), true).collect();
        if (partials.isEmpty()) {
            throw new UnsupportedOperationException("empty collection");
        }
        T result = partials.get(0);
        for (int i = 1; i < partials.size(); ++i) {
            result = f.call(result, partials.get(i));
        }
        return result;
    }

    /**
     * zeroValue在每个分区及合并分区结果时各使用一次
     * */
    public T fold(T zeroValue, Function2<T, T, T> op) {
        return aggregate(zeroValue, op, op);
    }

    public <U> U aggregate(U zeroValue, Function2<U, T, U> seqOp, Function2<U, U, U> combOp) {
        List<U> partials = mapPartitionsWithIndex(new AggregateHelper<>(zeroValue, seqOp), true).collect();
        U result = zeroValue;
        for (U partial : partials) {
            result = combOp.call(result, partial);
        }
        return result;
    }

    /**
     * 按分区顺序返回前num个元素
     * */
    public List<T> take(int num) {
        if (num <= 0) {
            return Collections.emptyList();
        }
        List<T> items = mapPartitionsWithIndex(new TakeHelper<>(num), true).collect();
        return items.size() > num ? Lists.newArrayList(items.subList(0, num)) : items;
    }

    public T first() {
        List<T> items = take(1);
        if (items.isEmpty()) {
            throw new UnsupportedOperationException("empty collection");
        }
        return items.get(0);
    }

    public boolean isEmpty() {
        return getNumPartitions() == 0 || take(1).isEmpty();
    }

    public Map<T, Long> countByValue() {
        RDD<Tuple2<T, Long>> ones = map(x -> new Tuple2<>(x, 1L));
        return PairRDDFunctions.of(PairRDDFunctions.of(ones).reduceByKey(Long::sum)).collectAsMap();
    }

    public void foreach(VoidFunction<T> f) {
        mapPartitionsWithIndex(new ForeachHelper<>(f), true).count();
    }

    public void foreachPartition(VoidFunction<Iterator<T>> f) {
        mapPartitionsWithIndex(new ForeachPartitionHelper<>(f), true).count();
    }

    public void saveAsTextFile(String path) {
        saveAsTextFile(path, null);
    }

    /**
     * 元素以String.valueOf写出
     * */
    public void saveAsTextFile(String path, String compressionCodecClass) {
        PipelinedRDD<String> text = mapPartitionsWithIndex(WorkerFunction.of(new ToStringHelper<T>()), true);
        text.setOutputMode(SerializedMode.String);
        text.getRddProxy().saveAsTextFile(path, compressionCodecClass);
    }

    // ------------------------------------ 生命周期 --------------------------------------

    public RDD<T> cache() {
        cached = true;
        getRddProxy().cache();
        return this;
    }

    public RDD<T> persist(StorageLevelType storageLevelType) {
        cached = true;
        getRddProxy().persist(storageLevelType);
        return this;
    }

    public RDD<T> unpersist() {
        cached = false;
        getRddProxy().unpersist();
        return this;
    }

    /**
     * 标记检查点, 本RDD不再参与流水线合并
     * */
    public void checkpoint() {
        checkpointed = true;
        getRddProxy().checkpoint();
    }

    public boolean isCheckpointed() {
        return getRddProxy().isCheckpointed();
    }

    public RDD<T> setName(String name) {
        getRddProxy().setName(name);
        return this;
    }

    public String name() {
        return getRddProxy().name();
    }

    public String toDebugString() {
        return getRddProxy().toDebugString();
    }

    public int getNumPartitions() {
        return getRddProxy().getNumPartitions();
    }

    int getDefaultPartitionNum() {
        return sparkContext.defaultParallelism();
    }

    // ------------------------------------ 计算命令 --------------------------------------

    private static class MapHelper<I, O> implements Function2<Integer, Iterator<I>, Iterator<O>> {
        private final Function<I, O> func;

        MapHelper(Function<I, O> func) {
            this.func = func;
        }

        @Override
        public Iterator<O> call(Integer split, Iterator<I> input) {
            return Iterators.transform(input, func::call);
        }
    }

    private static class FlatMapHelper<I, O> implements Function2<Integer, Iterator<I>, Iterator<O>> {
        private final FlatMapFunction<I, O> func;

        FlatMapHelper(FlatMapFunction<I, O> func) {
            this.func = func;
        }

        @Override
        public Iterator<O> call(Integer split, Iterator<I> input) {
            return Iterators.concat(Iterators.transform(input, func::call));
        }
    }

    private static class FilterHelper<I> implements Function2<Integer, Iterator<I>, Iterator<I>> {
        private final Function<I, Boolean> func;

        FilterHelper(Function<I, Boolean> func) {
            this.func = func;
        }

        @Override
        public Iterator<I> call(Integer split, Iterator<I> input) {
            return Iterators.filter(input, element -> Boolean.TRUE.equals(func.call(element)));
        }
    }

    private static class MapPartitionsHelper<I, O> implements Function2<Integer, Iterator<I>, Iterator<O>> {
        private final FlatMapFunction<Iterator<I>, O> func;

        MapPartitionsHelper(FlatMapFunction<Iterator<I>, O> func) {
            this.func = func;
        }

        @Override
        public Iterator<O> call(Integer split, Iterator<I> input) {
            return func.call(input);
        }
    }

    private static class KeyByHelper<K, I> implements Function<I, Tuple2<K, I>> {
        private final Function<I, K> func;

        KeyByHelper(Function<I, K> func) {
            this.func = func;
        }

        @Override
        public Tuple2<K, I> call(I v) {
            return new Tuple2<>(func.call(v), v);
        }
    }

    private static class GlomHelper<I> implements Function2<Integer, Iterator<I>, Iterator<List<I>>> {
        @Override
        public Iterator<List<I>> call(Integer split, Iterator<I> input) {
            List<I> partition = Lists.newArrayList(input);
            return Iterators.singletonIterator(partition);
        }
    }

    private static class IdentityHelper<I> implements Function2<Integer, Iterator<I>, Iterator<I>> {
        @Override
        public Iterator<I> call(Integer split, Iterator<I> input) {
            return input;
        }
    }

    private static class ReduceHelper<I> implements Function2<Integer, Iterator<I>, Iterator<I>> {
        private final Function2<I, I, I> func;

        ReduceHelper(Function2<I, I, I> func) {
            this.func = func;
        }

        @Override
        public Iterator<I> call(Integer split, Iterator<I> input) {
            if (!input.hasNext()) {
                return Collections.emptyIterator();
            }
            I result = input.next();
            while (input.hasNext()) {
                result = func.call(result, input.next());
            }
            return Iterators.singletonIterator(result);
        }
    }

    private static class AggregateHelper<I, U> implements Function2<Integer, Iterator<I>, Iterator<U>> {
        private final U zeroValue;
        private final Function2<U, I, U> seqOp;

        AggregateHelper(U zeroValue, Function2<U, I, U> seqOp) {
            this.zeroValue = zeroValue;
            this.seqOp = seqOp;
        }

        @Override
        public Iterator<U> call(Integer split, Iterator<I> input) {
            U result = zeroValue;
            while (input.hasNext()) {
                result = seqOp.call(result, input.next());
            }
            return Iterators.singletonIterator(result);
        }
    }

    private static class TakeHelper<I> implements Function2<Integer, Iterator<I>, Iterator<I>> {
        private final int num;

        TakeHelper(int num) {
            this.num = num;
        }

        @Override
        public Iterator<I> call(Integer split, Iterator<I> input) {
            return Iterators.limit(input, num);
        }
    }

    private static class ForeachHelper<I> implements Function2<Integer, Iterator<I>, Iterator<I>> {
        private final VoidFunction<I> func;

        ForeachHelper(VoidFunction<I> func) {
            this.func = func;
        }

        @Override
        public Iterator<I> call(Integer split, Iterator<I> input) {
            while (input.hasNext()) {
                func.call(input.next());
            }
            return Collections.emptyIterator();
        }
    }

    private static class ForeachPartitionHelper<I> implements Function2<Integer, Iterator<I>, Iterator<I>> {
        private final VoidFunction<Iterator<I>> func;

        ForeachPartitionHelper(VoidFunction<Iterator<I>> func) {
            this.func = func;
        }

        @Override
        public Iterator<I> call(Integer split, Iterator<I> input) {
            func.call(input);
            return Collections.emptyIterator();
        }
    }

    private static class ToStringHelper<I> implements Function2<Integer, Iterator<I>, Iterator<String>> {
        @Override
        public Iterator<String> call(Integer split, Iterator<I> input) {
            return Iterators.transform(input, String::valueOf);
        }
    }
}
