package com.sdu.sparkbridge.streaming.dstream;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.sdu.sparkbridge.api.function.FlatMapFunction;
import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.api.function.Function2;
import com.sdu.sparkbridge.api.function.VoidFunction;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;
import com.sdu.sparkbridge.streaming.StreamingContext;
import com.sdu.sparkbridge.streaming.api.function.ForeachRDDFunction;
import com.sdu.sparkbridge.streaming.api.function.Transform2Function;
import com.sdu.sparkbridge.streaming.api.function.TransformFunction;
import com.sdu.sparkbridge.streaming.proxy.DStreamProxy;
import com.sdu.sparkbridge.utils.scala.Tuple2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 按批次间隔生成的RDD序列
 *
 * 1: 窄依赖转换均为{@link #transform(TransformFunction)}, 可流水线节点合并转换函数(见{@link TransformedDStream})
 *
 * 2: 窗口操作要求窗口长度/滑动间隔为本DStream滑动间隔的整数倍, 参数校验先于任何节点创建
 *
 * 3: 宿主引擎回调执行的转换结果统一为Byte编码
 *
 * @author hanhan.zhang
 * */
public class DStream<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DStream.class);

    protected final StreamingContext streamingContext;

    protected DStreamProxy dstreamProxy;

    protected SerializedMode serializedMode;

    protected boolean cached;

    protected boolean checkpointed;

    public DStream(DStreamProxy dstreamProxy, StreamingContext streamingContext, SerializedMode serializedMode) {
        this.dstreamProxy = dstreamProxy;
        this.streamingContext = streamingContext;
        this.serializedMode = serializedMode;
    }

    public DStreamProxy getDStreamProxy() {
        return dstreamProxy;
    }

    public StreamingContext getStreamingContext() {
        return streamingContext;
    }

    public SerializedMode getSerializedMode() {
        return serializedMode;
    }

    public boolean isPipelinable() {
        return false;
    }

    public boolean isCached() {
        return cached;
    }

    public boolean isCheckpointed() {
        return checkpointed;
    }

    public long slideDuration() {
        return getDStreamProxy().slideDuration();
    }

    // ------------------------------------- 转换 ---------------------------------------

    public <U> DStream<U> map(Function<T, U> f) {
        return map(f, false);
    }

    public <U> DStream<U> map(Function<T, U> f, boolean preservesPartitioning) {
        return transform((time, rdd) -> rdd.map(f, preservesPartitioning));
    }

    public <U> DStream<U> flatMap(FlatMapFunction<T, U> f) {
        return flatMap(f, false);
    }

    public <U> DStream<U> flatMap(FlatMapFunction<T, U> f, boolean preservesPartitioning) {
        return transform((time, rdd) -> rdd.flatMap(f, preservesPartitioning));
    }

    public DStream<T> filter(Function<T, Boolean> f) {
        return transform((time, rdd) -> rdd.filter(f));
    }

    public <U> DStream<U> mapPartitions(FlatMapFunction<Iterator<T>, U> f) {
        return mapPartitions(f, false);
    }

    public <U> DStream<U> mapPartitions(FlatMapFunction<Iterator<T>, U> f, boolean preservesPartitioning) {
        return transform((time, rdd) -> rdd.mapPartitions(f, preservesPartitioning));
    }

    public <U> DStream<U> mapPartitionsWithIndex(Function2<Integer, Iterator<T>, Iterator<U>> f) {
        return mapPartitionsWithIndex(f, false);
    }

    public <U> DStream<U> mapPartitionsWithIndex(Function2<Integer, Iterator<T>, Iterator<U>> f,
                                                 boolean preservesPartitioning) {
        return transform((time, rdd) -> rdd.mapPartitionsWithIndex(f, preservesPartitioning));
    }

    public DStream<List<T>> glom() {
        return transform((time, rdd) -> rdd.glom());
    }

    /**
     * 每个批次生成一个元素: 批次元素数
     * */
    public DStream<Long> count() {
        DStream<Long> partitionCounts = mapPartitions(iter -> Iterators.singletonIterator((long) Iterators.size(iter)));
        return partitionCounts.reduce(Long::sum);
    }

    /**
     * 每个批次生成一个元素: 批次元素归约结果
     * */
    public DStream<T> reduce(Function2<T, T, T> f) {
        DStream<Tuple2<String, T>> keyed = map(x -> new Tuple2<>("", x));
        return PairDStreamFunctions.of(keyed).reduceByKey(f, 1).map(Tuple2::_2);
    }

    public DStream<Tuple2<T, Long>> countByValue() {
        return countByValue(0);
    }

    public DStream<Tuple2<T, Long>> countByValue(int numPartitions) {
        DStream<Tuple2<T, Long>> ones = map(x -> new Tuple2<>(x, 1L));
        return PairDStreamFunctions.of(ones).reduceByKey(Long::sum, numPartitions);
    }

    public <U> DStream<U> transform(Function<RDD<T>, RDD<U>> f) {
        return transform((time, rdd) -> f.call(rdd));
    }

    public <U> DStream<U> transform(TransformFunction<T, U> f) {
        return new TransformedDStream<>(this, f);
    }

    public <U, V> DStream<V> transformWith(Function2<RDD<T>, RDD<U>, RDD<V>> f, DStream<U> other) {
        return transformWith((time, rdd, otherRdd) -> f.call(rdd, otherRdd), other);
    }

    /**
     * 可流水线的输入以其上游节点为起点, 其转换函数在f之前执行
     * */
    public <U, V> DStream<V> transformWith(Transform2Function<T, U, V> f, DStream<U> other) {
        TransformFunction<Object, Object> prevFunc = null;
        DStreamProxy prevProxy;
        SerializedMode prevMode;
        if (isPipelinable()) {
            TransformedDStream<T> transformed = (TransformedDStream<T>) this;
            prevFunc = transformed.func;
            prevProxy = transformed.prevDStreamProxy;
            prevMode = transformed.prevSerializedMode;
        } else {
            prevProxy = getDStreamProxy();
            prevMode = serializedMode;
        }

        TransformFunction<Object, Object> otherPrevFunc = null;
        DStreamProxy otherProxy;
        SerializedMode otherMode;
        if (other.isPipelinable()) {
            TransformedDStream<U> transformed = (TransformedDStream<U>) other;
            otherPrevFunc = transformed.func;
            otherProxy = transformed.prevDStreamProxy;
            otherMode = transformed.prevSerializedMode;
        } else {
            otherProxy = other.getDStreamProxy();
            otherMode = other.serializedMode;
        }

        byte[] func = serialize(new TransformWithPrevHelper(prevFunc, otherPrevFunc, f));
        DStreamProxy proxy = streamingContext.getStreamingContextProxy()
                .createTransformed2DStream(prevProxy, otherProxy, func, prevMode, otherMode);
        LOGGER.debug("Create two-input transformed DStream, input modes: {}, {}", prevMode, otherMode);
        return new DStream<>(proxy, streamingContext, SerializedMode.Byte);
    }

    public DStream<T> repartition(int numPartitions) {
        checkArgument(numPartitions > 0, "Number of partitions must be positive but found %s", numPartitions);
        return transform((time, rdd) -> rdd.repartition(numPartitions));
    }

    /**
     * 转换为Byte编码
     * */
    public DStream<T> reserialize() {
        if (serializedMode == SerializedMode.Byte) {
            return this;
        }
        return transform((time, rdd) -> rdd);
    }

    public DStream<T> union(DStream<T> other) {
        checkArgument(slideDuration() == other.slideDuration(), "The two DStreams must have the same slide duration");
        return transformWith((time, rdd, otherRdd) -> rdd.union(otherRdd), other);
    }

    // ------------------------------------- 窗口 ---------------------------------------

    public DStream<T> window(long windowMs) {
        return window(windowMs, 0);
    }

    /**
     * @param slideMs 非正数时取本DStream的滑动间隔
     * */
    public DStream<T> window(long windowMs, long slideMs) {
        validateWindowParam(windowMs, slideMs);
        return new DStream<>(getDStreamProxy().window(windowMs, slideMs), streamingContext, serializedMode);
    }

    public DStream<T> reduceByWindow(Function2<T, T, T> reduceFunc, Function2<T, T, T> invReduceFunc,
                                     long windowMs, long slideMs) {
        validateWindowParam(windowMs, slideMs);
        DStream<Tuple2<Integer, T>> keyed = map(x -> new Tuple2<>(1, x));
        return PairDStreamFunctions.of(keyed)
                .reduceByKeyAndWindow(reduceFunc, invReduceFunc, windowMs, slideMs, 1)
                .map(Tuple2::_2);
    }

    public DStream<Long> countByWindow(long windowMs, long slideMs) {
        validateWindowParam(windowMs, slideMs);
        return map(x -> 1L).reduceByWindow(Long::sum, (x, y) -> x - y, windowMs, slideMs);
    }

    /**
     * 每个窗口内不同元素的个数
     * */
    public DStream<Long> countByValueAndWindow(long windowMs, long slideMs, int numPartitions) {
        validateWindowParam(windowMs, slideMs);
        DStream<Tuple2<T, Long>> ones = map(x -> new Tuple2<>(x, 1L));
        DStream<Tuple2<T, Long>> counted = PairDStreamFunctions.of(ones)
                .reduceByKeyAndWindow(Long::sum, (x, y) -> x - y, windowMs, slideMs, numPartitions);
        return counted.filter(kv -> kv._2() > 0).count();
    }

    void validateWindowParam(long windowMs, long slideMs) {
        long duration = slideDuration();
        checkArgument(windowMs > 0 && windowMs % duration == 0,
                "windowDuration must be multiple of the slide duration (%s ms) but found %s ms", duration, windowMs);
        if (slideMs > 0) {
            checkArgument(slideMs % duration == 0,
                    "slideDuration must be multiple of the slide duration (%s ms) but found %s ms", duration, slideMs);
        }
    }

    // ------------------------------------- 输出 ---------------------------------------

    public void foreachRDD(VoidFunction<RDD<T>> f) {
        foreachRDD((time, rdd) -> f.call(rdd));
    }

    public void foreachRDD(ForeachRDDFunction<T> f) {
        getDStreamProxy().callForeachRDD(serialize(f), serializedMode);
    }

    public void print() {
        print(10);
    }

    public void print(int num) {
        getDStreamProxy().print(num);
    }

    /**
     * 每个批次写出到目录prefix-TIME_IN_MS[.suffix]
     * */
    public void saveAsTextFiles(String prefix, String suffix) {
        foreachRDD((time, rdd) -> rdd.saveAsTextFile(rddToFileName(prefix, suffix, time)));
    }

    static String rddToFileName(String prefix, String suffix, long timeMs) {
        String fileName = prefix + "-" + timeMs;
        return suffix == null || suffix.isEmpty() ? fileName : fileName + "." + suffix;
    }

    // ------------------------------------ 生命周期 --------------------------------------

    public DStream<T> cache() {
        return persist(StorageLevelType.MEMORY_ONLY_SER);
    }

    public DStream<T> persist(StorageLevelType storageLevelType) {
        cached = true;
        getDStreamProxy().persist(storageLevelType);
        return this;
    }

    public DStream<T> checkpoint(long intervalMs) {
        checkpointed = true;
        getDStreamProxy().checkpoint(intervalMs);
        return this;
    }

    /**
     * 返回[fromTimeMs, toTimeMs]内各批次的RDD
     * */
    public List<RDD<T>> slice(long fromTimeMs, long toTimeMs) {
        checkArgument(fromTimeMs <= toTimeMs, "fromTime (%s) must not be after toTime (%s)", fromTimeMs, toTimeMs);
        List<RDD<T>> rdds = Lists.newArrayList();
        for (RDDProxy rddProxy : getDStreamProxy().slice(fromTimeMs, toTimeMs)) {
            rdds.add(new RDD<>(rddProxy, streamingContext.getSparkContext(), serializedMode));
        }
        return rdds;
    }

    byte[] serialize(Object func) {
        return streamingContext.getSparkContext().serializerInstance().toBytes(func);
    }

    /**
     * 依次执行两个输入各自被合并的转换函数, 再执行f
     * */
    static class TransformWithPrevHelper implements Transform2Function<Object, Object, Object> {

        private final TransformFunction<Object, Object> prevFunc;
        private final TransformFunction<Object, Object> otherPrevFunc;
        private final Transform2Function<Object, Object, Object> func;

        @SuppressWarnings("unchecked")
        TransformWithPrevHelper(TransformFunction<Object, Object> prevFunc,
                                TransformFunction<Object, Object> otherPrevFunc,
                                Transform2Function<?, ?, ?> func) {
            this.prevFunc = prevFunc;
            this.otherPrevFunc = otherPrevFunc;
            this.func = (Transform2Function<Object, Object, Object>) func;
        }

        @Override
        public RDD<Object> call(long timeMs, RDD<Object> rdd, RDD<Object> other) {
            RDD<Object> left = prevFunc == null ? rdd : prevFunc.call(timeMs, rdd);
            RDD<Object> right = otherPrevFunc == null ? other : otherPrevFunc.call(timeMs, other);
            return func.call(timeMs, left, right);
        }
    }
}
