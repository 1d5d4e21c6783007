package com.sdu.sparkbridge.rdd;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;
import com.sdu.sparkbridge.Partitioner;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.api.function.FlatMapFunction;
import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.api.function.Function0;
import com.sdu.sparkbridge.api.function.Function2;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.serializer.JavaSerializer;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.serializer.SerializerInstance;
import com.sdu.sparkbridge.utils.scala.Option;
import com.sdu.sparkbridge.utils.scala.Tuple2;
import com.sdu.sparkbridge.utils.scala.Tuple3;
import com.sdu.sparkbridge.utils.scala.Tuple4;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 键值对RDD操作
 *
 * 需Shuffle的操作均由三步组成:
 *
 * 1: 分区内预聚合(mapPartitionsWithIndex, 不跨网络)
 *
 * 2: partitionBy重分区, 若当前分区器与目标分区器相等则跳过
 *
 * 3: 分区内合并来自不同上游分区的同Key结果
 *
 * join系列基于groupWith: 各输入值以{@link CoGroupValue}标记来源后union, 合并阶段按tag分派
 *
 * @author hanhan.zhang
 * */
public class PairRDDFunctions<K, V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PairRDDFunctions.class);

    private final RDD<Tuple2<K, V>> self;

    public PairRDDFunctions(RDD<Tuple2<K, V>> self) {
        this.self = self;
    }

    public static <K, V> PairRDDFunctions<K, V> of(RDD<Tuple2<K, V>> rdd) {
        return new PairRDDFunctions<>(rdd);
    }

    public RDD<Tuple2<K, V>> rdd() {
        return self;
    }

    /**
     * 同一Key出现多次时保留最后一个值
     * */
    public Map<K, V> collectAsMap() {
        Map<K, V> result = Maps.newLinkedHashMap();
        for (Tuple2<K, V> pair : self.collect()) {
            result.put(pair._1(), pair._2());
        }
        return result;
    }

    public RDD<K> keys() {
        return self.map(Tuple2::_1);
    }

    public RDD<V> values() {
        return self.map(Tuple2::_2);
    }

    public <U> RDD<Tuple2<K, U>> mapValues(Function<V, U> f) {
        return self.map(new MapValuesHelper<>(f), true);
    }

    public <U> RDD<Tuple2<K, U>> flatMapValues(FlatMapFunction<V, U> f) {
        return self.flatMap(new FlatMapValuesHelper<>(f), true);
    }

    // ----------------------------------- 聚合 ---------------------------------------

    public RDD<Tuple2<K, V>> reduceByKey(Function2<V, V, V> func) {
        return reduceByKey(func, 0);
    }

    public RDD<Tuple2<K, V>> reduceByKey(Function2<V, V, V> func, int numPartitions) {
        return combineByKey(v -> v, func, func, numPartitions);
    }

    /**
     * 结果直接返回Driver
     * */
    public Map<K, V> reduceByKeyLocally(Function2<V, V, V> func) {
        List<Tuple2<K, V>> partials = self.mapPartitionsWithIndex(
                new CombineLocallyHelper<K, V, V>(v -> v, func), true).collect();
        Map<K, V> result = Maps.newLinkedHashMap();
        for (Tuple2<K, V> partial : partials) {
            if (result.containsKey(partial._1())) {
                result.put(partial._1(), func.call(result.get(partial._1()), partial._2()));
            } else {
                result.put(partial._1(), partial._2());
            }
        }
        return result;
    }

    public Map<K, Long> countByKey() {
        RDD<Tuple2<K, Long>> ones = mapValues(v -> 1L);
        return of(of(ones).reduceByKey(Long::sum)).collectAsMap();
    }

    /**
     * @param createCombiner Key在分区内首次出现时由值创建聚合结果
     * @param mergeValue 将值合并入聚合结果
     * @param mergeCombiners 合并不同分区的聚合结果
     * @param numPartitions 结果分区数, 非正数时取默认并行度
     * */
    public <C> RDD<Tuple2<K, C>> combineByKey(Function<V, C> createCombiner,
                                              Function2<C, V, C> mergeValue,
                                              Function2<C, C, C> mergeCombiners,
                                              int numPartitions) {
        int partitions = numPartitions <= 0 ? self.getDefaultPartitionNum() : numPartitions;
        RDD<Tuple2<K, C>> locallyCombined = self.mapPartitionsWithIndex(
                new CombineLocallyHelper<>(createCombiner, mergeValue), true);
        RDD<Tuple2<K, C>> shuffled = of(locallyCombined).partitionBy(partitions);
        return shuffled.mapPartitionsWithIndex(new MergeCombinersHelper<>(mergeCombiners), true);
    }

    public <C> RDD<Tuple2<K, C>> combineByKey(Function<V, C> createCombiner,
                                              Function2<C, V, C> mergeValue,
                                              Function2<C, C, C> mergeCombiners) {
        return combineByKey(createCombiner, mergeValue, mergeCombiners, 0);
    }

    /**
     * zeroValue每次调用须返回新对象, 聚合过程可能修改其结果
     * */
    public <U> RDD<Tuple2<K, U>> aggregateByKey(Function0<U> zeroValue,
                                                Function2<U, V, U> seqOp,
                                                Function2<U, U, U> combOp,
                                                int numPartitions) {
        return combineByKey(new ZeroCombinerHelper<>(zeroValue, seqOp), seqOp, combOp, numPartitions);
    }

    public <U> RDD<Tuple2<K, U>> aggregateByKey(Function0<U> zeroValue,
                                                Function2<U, V, U> seqOp,
                                                Function2<U, U, U> combOp) {
        return aggregateByKey(zeroValue, seqOp, combOp, 0);
    }

    public RDD<Tuple2<K, V>> foldByKey(Function0<V> zeroValue, Function2<V, V, V> func, int numPartitions) {
        return aggregateByKey(zeroValue, func, func, numPartitions);
    }

    public RDD<Tuple2<K, V>> foldByKey(Function0<V> zeroValue, Function2<V, V, V> func) {
        return foldByKey(zeroValue, func, 0);
    }

    public RDD<Tuple2<K, List<V>>> groupByKey() {
        return groupByKey(0);
    }

    public RDD<Tuple2<K, List<V>>> groupByKey(int numPartitions) {
        return this.<List<V>>combineByKey(
                v -> {
                    List<V> list = new ArrayList<>();
                    list.add(v);
                    return list;
                },
                (list, v) -> {
                    list.add(v);
                    return list;
                },
                (left, right) -> {
                    left.addAll(right);
                    return left;
                },
                numPartitions);
    }

    // ----------------------------------- 分区 ---------------------------------------

    public RDD<Tuple2<K, V>> partitionBy(int numPartitions) {
        return partitionBy(new Partitioner(numPartitions));
    }

    public RDD<Tuple2<K, V>> partitionBy(int numPartitions, Function<Object, Integer> keyFunc) {
        return partitionBy(new Partitioner(numPartitions, keyFunc));
    }

    /**
     * 每个键值对编码为[8字节shuffle key, 序列化键值对]两条记录, 由宿主引擎按shuffle key重分区
     * */
    public RDD<Tuple2<K, V>> partitionBy(Partitioner partitioner) {
        if (partitioner.equals(self.getPartitioner())) {
            LOGGER.debug("RDD already partitioned by {}, skip shuffle", partitioner);
            return self;
        }

        PipelinedRDD<byte[]> keyed = self.mapPartitionsWithIndex(
                WorkerFunction.of(new AddShuffleKeyHelper<K, V>(partitioner)), false);
        keyed.bypassSerializer();

        SparkContext sc = self.getSparkContext();
        RDDProxy shuffled = sc.getSparkContextProxy().createPairwiseRDD(
                keyed.getRddProxy(), partitioner.numPartitions(), partitionFuncId(partitioner));
        RDD<Tuple2<K, V>> rdd = new RDD<>(shuffled, sc, SerializedMode.Byte);
        rdd.partitioner = partitioner;
        return rdd;
    }

    /**
     * 分区函数标识: 默认散列分区为0, 否则取序列化分区函数的MD5前8字节
     * */
    static long partitionFuncId(Partitioner partitioner) {
        if (partitioner.keyFunc() == null) {
            return 0L;
        }
        byte[] bytes = new JavaSerializer().newInstance().toBytes(partitioner.keyFunc());
        return Longs.fromByteArray(Hashing.md5().hashBytes(bytes).asBytes());
    }

    // ----------------------------------- 分组 ---------------------------------------

    public <W> RDD<Tuple2<K, Tuple2<List<V>, List<W>>>> groupWith(RDD<Tuple2<K, W>> other) {
        return groupWith(other, 0);
    }

    public <W> RDD<Tuple2<K, Tuple2<List<V>, List<W>>>> groupWith(RDD<Tuple2<K, W>> other, int numPartitions) {
        return of(cogroup(numPartitions, self, other)).mapValues(groups -> new Tuple2<>(
                PairRDDFunctions.<V>typed(groups.get(0)),
                PairRDDFunctions.<W>typed(groups.get(1))));
    }

    public <W1, W2> RDD<Tuple2<K, Tuple3<List<V>, List<W1>, List<W2>>>> groupWith(RDD<Tuple2<K, W1>> other1,
                                                                                   RDD<Tuple2<K, W2>> other2) {
        return of(cogroup(0, self, other1, other2)).mapValues(groups -> new Tuple3<>(
                PairRDDFunctions.<V>typed(groups.get(0)),
                PairRDDFunctions.<W1>typed(groups.get(1)),
                PairRDDFunctions.<W2>typed(groups.get(2))));
    }

    public <W1, W2, W3> RDD<Tuple2<K, Tuple4<List<V>, List<W1>, List<W2>, List<W3>>>> groupWith(RDD<Tuple2<K, W1>> other1,
                                                                                                 RDD<Tuple2<K, W2>> other2,
                                                                                                 RDD<Tuple2<K, W3>> other3) {
        return of(cogroup(0, self, other1, other2, other3)).mapValues(groups -> new Tuple4<>(
                PairRDDFunctions.<V>typed(groups.get(0)),
                PairRDDFunctions.<W1>typed(groups.get(1)),
                PairRDDFunctions.<W2>typed(groups.get(2)),
                PairRDDFunctions.<W3>typed(groups.get(3))));
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> typed(List<Object> values) {
        return (List<T>) (List<?>) values;
    }

    /**
     * 各输入的值按下标标记后union, 合并为每个Key一组按来源分开的值列表
     * */
    @SafeVarargs
    @SuppressWarnings("unchecked")
    private static <K> RDD<Tuple2<K, List<List<Object>>>> cogroup(int numPartitions, RDD<? extends Tuple2<K, ?>>... rdds) {
        int arity = rdds.length;
        RDD<Tuple2<K, CoGroupValue>> union = null;
        for (int i = 0; i < arity; ++i) {
            RDD<Tuple2<K, Object>> rdd = (RDD<Tuple2<K, Object>>) (RDD<?>) rdds[i];
            RDD<Tuple2<K, CoGroupValue>> tagged = of(rdd).mapValues(new TagHelper(i));
            union = union == null ? tagged : union.union(tagged);
        }
        return of(union).combineByKey(
                new CoGroupCreateHelper(arity),
                (groups, value) -> {
                    groups.get(value.getTag()).add(value.getValue());
                    return groups;
                },
                (left, right) -> {
                    for (int i = 0; i < left.size(); ++i) {
                        left.get(i).addAll(right.get(i));
                    }
                    return left;
                },
                numPartitions);
    }

    // ----------------------------------- 连接 ---------------------------------------

    public <W> RDD<Tuple2<K, Tuple2<V, W>>> join(RDD<Tuple2<K, W>> other) {
        return join(other, 0);
    }

    public <W> RDD<Tuple2<K, Tuple2<V, W>>> join(RDD<Tuple2<K, W>> other, int numPartitions) {
        return of(groupWith(other, numPartitions)).flatMapValues(groups -> {
            List<Tuple2<V, W>> joined = Lists.newArrayList();
            for (V v : groups._1()) {
                for (W w : groups._2()) {
                    joined.add(new Tuple2<>(v, w));
                }
            }
            return joined.iterator();
        });
    }

    public <W> RDD<Tuple2<K, Tuple2<V, Option<W>>>> leftOuterJoin(RDD<Tuple2<K, W>> other) {
        return leftOuterJoin(other, 0);
    }

    public <W> RDD<Tuple2<K, Tuple2<V, Option<W>>>> leftOuterJoin(RDD<Tuple2<K, W>> other, int numPartitions) {
        return of(groupWith(other, numPartitions)).flatMapValues(groups -> {
            List<Tuple2<V, Option<W>>> joined = Lists.newArrayList();
            for (V v : groups._1()) {
                if (groups._2().isEmpty()) {
                    joined.add(new Tuple2<>(v, Option.empty()));
                }
                for (W w : groups._2()) {
                    joined.add(new Tuple2<>(v, Option.of(w)));
                }
            }
            return joined.iterator();
        });
    }

    public <W> RDD<Tuple2<K, Tuple2<Option<V>, W>>> rightOuterJoin(RDD<Tuple2<K, W>> other) {
        return rightOuterJoin(other, 0);
    }

    public <W> RDD<Tuple2<K, Tuple2<Option<V>, W>>> rightOuterJoin(RDD<Tuple2<K, W>> other, int numPartitions) {
        return of(groupWith(other, numPartitions)).flatMapValues(groups -> {
            List<Tuple2<Option<V>, W>> joined = Lists.newArrayList();
            for (W w : groups._2()) {
                if (groups._1().isEmpty()) {
                    joined.add(new Tuple2<>(Option.empty(), w));
                }
                for (V v : groups._1()) {
                    joined.add(new Tuple2<>(Option.of(v), w));
                }
            }
            return joined.iterator();
        });
    }

    public <W> RDD<Tuple2<K, Tuple2<Option<V>, Option<W>>>> fullOuterJoin(RDD<Tuple2<K, W>> other) {
        return fullOuterJoin(other, 0);
    }

    public <W> RDD<Tuple2<K, Tuple2<Option<V>, Option<W>>>> fullOuterJoin(RDD<Tuple2<K, W>> other, int numPartitions) {
        return of(groupWith(other, numPartitions)).flatMapValues(groups -> {
            List<Option<V>> left = Lists.newArrayList();
            for (V v : groups._1()) {
                left.add(Option.of(v));
            }
            List<Option<W>> right = Lists.newArrayList();
            for (W w : groups._2()) {
                right.add(Option.of(w));
            }
            if (left.isEmpty()) {
                left.add(Option.empty());
            }
            if (right.isEmpty()) {
                right.add(Option.empty());
            }
            List<Tuple2<Option<V>, Option<W>>> joined = Lists.newArrayList();
            for (Option<V> v : left) {
                for (Option<W> w : right) {
                    joined.add(new Tuple2<>(v, w));
                }
            }
            return joined.iterator();
        });
    }

    /**
     * 保留other中不存在的Key
     * */
    public <W> RDD<Tuple2<K, V>> subtractByKey(RDD<Tuple2<K, W>> other) {
        return subtractByKey(other, 0);
    }

    public <W> RDD<Tuple2<K, V>> subtractByKey(RDD<Tuple2<K, W>> other, int numPartitions) {
        return of(groupWith(other, numPartitions)).flatMapValues(
                groups -> groups._2().isEmpty() ? groups._1().iterator() : Collections.<V>emptyIterator());
    }

    /**
     * 全量扫描, 返回Key对应的全部值
     *
     * Key按equals比较, 数组类型Key按内容比较
     * */
    public List<V> lookup(K key) {
        return of(self.filter(new KeyEqualsHelper<>(key))).values().collect();
    }

    // ------------------------------------ 计算命令 --------------------------------------

    private static class MapValuesHelper<K, V, U> implements Function<Tuple2<K, V>, Tuple2<K, U>> {
        private final Function<V, U> func;

        MapValuesHelper(Function<V, U> func) {
            this.func = func;
        }

        @Override
        public Tuple2<K, U> call(Tuple2<K, V> pair) {
            return new Tuple2<>(pair._1(), func.call(pair._2()));
        }
    }

    private static class FlatMapValuesHelper<K, V, U> implements FlatMapFunction<Tuple2<K, V>, Tuple2<K, U>> {
        private final FlatMapFunction<V, U> func;

        FlatMapValuesHelper(FlatMapFunction<V, U> func) {
            this.func = func;
        }

        @Override
        public Iterator<Tuple2<K, U>> call(Tuple2<K, V> pair) {
            K key = pair._1();
            return Iterators.transform(func.call(pair._2()), value -> new Tuple2<>(key, value));
        }
    }

    private static class CombineLocallyHelper<K, V, C> implements Function2<Integer, Iterator<Tuple2<K, V>>, Iterator<Tuple2<K, C>>> {
        private final Function<V, C> createCombiner;
        private final Function2<C, V, C> mergeValue;

        CombineLocallyHelper(Function<V, C> createCombiner, Function2<C, V, C> mergeValue) {
            this.createCombiner = createCombiner;
            this.mergeValue = mergeValue;
        }

        @Override
        public Iterator<Tuple2<K, C>> call(Integer split, Iterator<Tuple2<K, V>> input) {
            Map<K, C> combiners = Maps.newLinkedHashMap();
            while (input.hasNext()) {
                Tuple2<K, V> pair = input.next();
                if (combiners.containsKey(pair._1())) {
                    combiners.put(pair._1(), mergeValue.call(combiners.get(pair._1()), pair._2()));
                } else {
                    combiners.put(pair._1(), createCombiner.call(pair._2()));
                }
            }
            return Iterators.transform(combiners.entrySet().iterator(), e -> new Tuple2<>(e.getKey(), e.getValue()));
        }
    }

    private static class MergeCombinersHelper<K, C> implements Function2<Integer, Iterator<Tuple2<K, C>>, Iterator<Tuple2<K, C>>> {
        private final Function2<C, C, C> mergeCombiners;

        MergeCombinersHelper(Function2<C, C, C> mergeCombiners) {
            this.mergeCombiners = mergeCombiners;
        }

        @Override
        public Iterator<Tuple2<K, C>> call(Integer split, Iterator<Tuple2<K, C>> input) {
            Map<K, C> combiners = Maps.newLinkedHashMap();
            while (input.hasNext()) {
                Tuple2<K, C> pair = input.next();
                if (combiners.containsKey(pair._1())) {
                    combiners.put(pair._1(), mergeCombiners.call(combiners.get(pair._1()), pair._2()));
                } else {
                    combiners.put(pair._1(), pair._2());
                }
            }
            return Iterators.transform(combiners.entrySet().iterator(), e -> new Tuple2<>(e.getKey(), e.getValue()));
        }
    }

    private static class ZeroCombinerHelper<V, U> implements Function<V, U> {
        private final Function0<U> zeroValue;
        private final Function2<U, V, U> seqOp;

        ZeroCombinerHelper(Function0<U> zeroValue, Function2<U, V, U> seqOp) {
            this.zeroValue = zeroValue;
            this.seqOp = seqOp;
        }

        @Override
        public U call(V value) {
            return seqOp.call(zeroValue.call(), value);
        }
    }

    /**
     * 在Worker端计算shuffle key, 输出以None编码原样写出
     * */
    private static class AddShuffleKeyHelper<K, V> implements Function2<Integer, Iterator<Tuple2<K, V>>, Iterator<byte[]>> {
        private final Partitioner partitioner;

        AddShuffleKeyHelper(Partitioner partitioner) {
            this.partitioner = partitioner;
        }

        @Override
        public Iterator<byte[]> call(Integer split, Iterator<Tuple2<K, V>> input) {
            SerializerInstance serializer = new JavaSerializer().newInstance();
            return Iterators.concat(Iterators.transform(input, pair -> Iterators.forArray(
                    Longs.toByteArray(partitioner.shuffleKey(pair._1(), serializer)),
                    serializer.toBytes(pair))));
        }
    }

    private static class TagHelper implements Function<Object, CoGroupValue> {
        private final int tag;

        TagHelper(int tag) {
            this.tag = tag;
        }

        @Override
        public CoGroupValue call(Object value) {
            return new CoGroupValue(tag, value);
        }
    }

    private static class CoGroupCreateHelper implements Function<CoGroupValue, List<List<Object>>> {
        private final int arity;

        CoGroupCreateHelper(int arity) {
            this.arity = arity;
        }

        @Override
        public List<List<Object>> call(CoGroupValue value) {
            List<List<Object>> groups = new ArrayList<>(arity);
            for (int i = 0; i < arity; ++i) {
                groups.add(new ArrayList<>());
            }
            groups.get(value.getTag()).add(value.getValue());
            return groups;
        }
    }

    private static class KeyEqualsHelper<K, V> implements Function<Tuple2<K, V>, Boolean> {
        private final K key;

        KeyEqualsHelper(K key) {
            this.key = key;
        }

        @Override
        public Boolean call(Tuple2<K, V> pair) {
            return Objects.deepEquals(key, pair._1());
        }
    }
}
