package com.sdu.sparkbridge.streaming.dstream;

import com.sdu.sparkbridge.api.function.FlatMapFunction;
import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.api.function.Function2;
import com.sdu.sparkbridge.rdd.PairRDDFunctions;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.streaming.StreamingContext;
import com.sdu.sparkbridge.streaming.api.function.Transform2Function;
import com.sdu.sparkbridge.streaming.proxy.DStreamProxy;
import com.sdu.sparkbridge.utils.scala.Option;
import com.sdu.sparkbridge.utils.scala.Tuple2;

import java.util.Collections;
import java.util.List;

/**
 * 键值对DStream操作, 每个批次对应{@link PairRDDFunctions}的同名操作
 *
 * @author hanhan.zhang
 * */
public class PairDStreamFunctions<K, V> {

    private final DStream<Tuple2<K, V>> self;

    public PairDStreamFunctions(DStream<Tuple2<K, V>> self) {
        this.self = self;
    }

    public static <K, V> PairDStreamFunctions<K, V> of(DStream<Tuple2<K, V>> dstream) {
        return new PairDStreamFunctions<>(dstream);
    }

    public DStream<Tuple2<K, V>> dstream() {
        return self;
    }

    public <U> DStream<Tuple2<K, U>> mapValues(Function<V, U> f) {
        return self.<Tuple2<K, U>>transform((time, rdd) -> PairRDDFunctions.of(rdd).mapValues(f));
    }

    public <U> DStream<Tuple2<K, U>> flatMapValues(FlatMapFunction<V, U> f) {
        return self.<Tuple2<K, U>>transform((time, rdd) -> PairRDDFunctions.of(rdd).flatMapValues(f));
    }

    public DStream<Tuple2<K, V>> reduceByKey(Function2<V, V, V> func) {
        return reduceByKey(func, 0);
    }

    public DStream<Tuple2<K, V>> reduceByKey(Function2<V, V, V> func, int numPartitions) {
        return combineByKey(v -> v, func, func, numPartitions);
    }

    public <C> DStream<Tuple2<K, C>> combineByKey(Function<V, C> createCombiner,
                                                  Function2<C, V, C> mergeValue,
                                                  Function2<C, C, C> mergeCombiners,
                                                  int numPartitions) {
        return self.<Tuple2<K, C>>transform((time, rdd) -> PairRDDFunctions.of(rdd)
                .combineByKey(createCombiner, mergeValue, mergeCombiners, numPartitions));
    }

    public DStream<Tuple2<K, List<V>>> groupByKey() {
        return groupByKey(0);
    }

    public DStream<Tuple2<K, List<V>>> groupByKey(int numPartitions) {
        return self.<Tuple2<K, List<V>>>transform((time, rdd) -> PairRDDFunctions.of(rdd).groupByKey(numPartitions));
    }

    public DStream<Tuple2<K, V>> partitionBy(int numPartitions) {
        return self.<Tuple2<K, V>>transform((time, rdd) -> PairRDDFunctions.of(rdd).partitionBy(numPartitions));
    }

    // ------------------------------------- 连接 ---------------------------------------

    public <W> DStream<Tuple2<K, Tuple2<V, W>>> join(DStream<Tuple2<K, W>> other) {
        return join(other, 0);
    }

    public <W> DStream<Tuple2<K, Tuple2<V, W>>> join(DStream<Tuple2<K, W>> other, int numPartitions) {
        return self.<Tuple2<K, W>, Tuple2<K, Tuple2<V, W>>>transformWith(
                (time, rdd, otherRdd) -> PairRDDFunctions.of(rdd).join(otherRdd, numPartitions), other);
    }

    public <W> DStream<Tuple2<K, Tuple2<V, Option<W>>>> leftOuterJoin(DStream<Tuple2<K, W>> other) {
        return leftOuterJoin(other, 0);
    }

    public <W> DStream<Tuple2<K, Tuple2<V, Option<W>>>> leftOuterJoin(DStream<Tuple2<K, W>> other, int numPartitions) {
        return self.<Tuple2<K, W>, Tuple2<K, Tuple2<V, Option<W>>>>transformWith(
                (time, rdd, otherRdd) -> PairRDDFunctions.of(rdd).leftOuterJoin(otherRdd, numPartitions), other);
    }

    public <W> DStream<Tuple2<K, Tuple2<Option<V>, W>>> rightOuterJoin(DStream<Tuple2<K, W>> other) {
        return rightOuterJoin(other, 0);
    }

    public <W> DStream<Tuple2<K, Tuple2<Option<V>, W>>> rightOuterJoin(DStream<Tuple2<K, W>> other, int numPartitions) {
        return self.<Tuple2<K, W>, Tuple2<K, Tuple2<Option<V>, W>>>transformWith(
                (time, rdd, otherRdd) -> PairRDDFunctions.of(rdd).rightOuterJoin(otherRdd, numPartitions), other);
    }

    public <W> DStream<Tuple2<K, Tuple2<Option<V>, Option<W>>>> fullOuterJoin(DStream<Tuple2<K, W>> other) {
        return fullOuterJoin(other, 0);
    }

    public <W> DStream<Tuple2<K, Tuple2<Option<V>, Option<W>>>> fullOuterJoin(DStream<Tuple2<K, W>> other,
                                                                             int numPartitions) {
        return self.<Tuple2<K, W>, Tuple2<K, Tuple2<Option<V>, Option<W>>>>transformWith(
                (time, rdd, otherRdd) -> PairRDDFunctions.of(rdd).fullOuterJoin(otherRdd, numPartitions), other);
    }

    // ------------------------------------- 窗口 ---------------------------------------

    public DStream<Tuple2<K, List<V>>> groupByKeyAndWindow(long windowMs, long slideMs) {
        return groupByKeyAndWindow(windowMs, slideMs, 0);
    }

    public DStream<Tuple2<K, List<V>>> groupByKeyAndWindow(long windowMs, long slideMs, int numPartitions) {
        return of(self.window(windowMs, slideMs)).groupByKey(numPartitions);
    }

    public DStream<Tuple2<K, V>> reduceByKeyAndWindow(Function2<V, V, V> reduceFunc, long windowMs, long slideMs) {
        return reduceByKeyAndWindow(reduceFunc, null, windowMs, slideMs, 0);
    }

    /**
     * 先按批次归约, 再由宿主引擎按窗口合并各批次结果
     *
     * @param invReduceFunc 可为null; 非null时窗口滑动以"上一窗口 - 移出批次 + 移入批次"增量计算
     * @param slideMs 非正数时取本DStream的滑动间隔
     * */
    public DStream<Tuple2<K, V>> reduceByKeyAndWindow(Function2<V, V, V> reduceFunc,
                                                      Function2<V, V, V> invReduceFunc,
                                                      long windowMs, long slideMs, int numPartitions) {
        self.validateWindowParam(windowMs, slideMs);
        long slide = slideMs <= 0 ? self.slideDuration() : slideMs;
        DStream<Tuple2<K, V>> reduced = reduceByKey(reduceFunc, numPartitions);

        byte[] func = self.serialize(new ReduceWindowHelper<K, V>(reduceFunc, numPartitions));
        byte[] invFunc = invReduceFunc == null ? null
                : self.serialize(new InvReduceWindowHelper<K, V>(reduceFunc, invReduceFunc, numPartitions));

        StreamingContext ssc = self.getStreamingContext();
        DStreamProxy proxy = ssc.getStreamingContextProxy().createReducedWindowedDStream(reduced.getDStreamProxy(),
                func, invFunc, windowMs, slide, reduced.getSerializedMode());
        return new DStream<>(proxy, ssc, SerializedMode.Byte);
    }

    // ------------------------------------- 状态 ---------------------------------------

    public <S> DStream<Tuple2<K, S>> updateStateByKey(Function2<List<V>, Option<S>, Option<S>> updateFunc) {
        return updateStateByKey(updateFunc, 0);
    }

    /**
     * 每个批次以(新值列表, 已有状态)更新状态, 返回undefined时移除该键
     * */
    public <S> DStream<Tuple2<K, S>> updateStateByKey(Function2<List<V>, Option<S>, Option<S>> updateFunc,
                                                      int numPartitions) {
        byte[] func = self.serialize(new UpdateStateHelper<K, V, S>(updateFunc, numPartitions));
        StreamingContext ssc = self.getStreamingContext();
        DStreamProxy proxy = ssc.getStreamingContextProxy().createStateDStream(self.getDStreamProxy(), func,
                self.getSerializedMode());
        return new DStream<>(proxy, ssc, SerializedMode.Byte);
    }

    /**
     * 合并上一窗口结果与移入批次
     * */
    static class ReduceWindowHelper<K, V> implements Transform2Function<Tuple2<K, V>, Tuple2<K, V>, Tuple2<K, V>> {

        private final Function2<V, V, V> reduceFunc;
        private final int numPartitions;

        ReduceWindowHelper(Function2<V, V, V> reduceFunc, int numPartitions) {
            this.reduceFunc = reduceFunc;
            this.numPartitions = numPartitions;
        }

        @Override
        public RDD<Tuple2<K, V>> call(long timeMs, RDD<Tuple2<K, V>> rdd, RDD<Tuple2<K, V>> other) {
            if (rdd == null) {
                return other;
            }
            if (other == null) {
                return rdd;
            }
            return PairRDDFunctions.of(rdd.union(other)).reduceByKey(reduceFunc, numPartitions);
        }
    }

    /**
     * 从上一窗口结果中减去移出批次
     * */
    static class InvReduceWindowHelper<K, V> implements Transform2Function<Tuple2<K, V>, Tuple2<K, V>, Tuple2<K, V>> {

        private final Function2<V, V, V> reduceFunc;
        private final Function2<V, V, V> invReduceFunc;
        private final int numPartitions;

        InvReduceWindowHelper(Function2<V, V, V> reduceFunc, Function2<V, V, V> invReduceFunc, int numPartitions) {
            this.reduceFunc = reduceFunc;
            this.invReduceFunc = invReduceFunc;
            this.numPartitions = numPartitions;
        }

        @Override
        public RDD<Tuple2<K, V>> call(long timeMs, RDD<Tuple2<K, V>> rdd, RDD<Tuple2<K, V>> other) {
            if (rdd == null || other == null) {
                return rdd;
            }
            Function2<V, V, V> inv = invReduceFunc;
            // 离开窗口的批次可能有多个, 先按Key归约再与上一窗口关联
            RDD<Tuple2<K, V>> leaving = PairRDDFunctions.of(other).reduceByKey(reduceFunc, numPartitions);
            return PairRDDFunctions.of(PairRDDFunctions.of(rdd).leftOuterJoin(leaving, numPartitions))
                    .mapValues(vs -> vs._2().isDefined() ? inv.call(vs._1(), vs._2().get()) : vs._1());
        }
    }

    static class UpdateStateHelper<K, V, S> implements Transform2Function<Tuple2<K, S>, Tuple2<K, V>, Tuple2<K, S>> {

        private final Function2<List<V>, Option<S>, Option<S>> updateFunc;
        private final int numPartitions;

        UpdateStateHelper(Function2<List<V>, Option<S>, Option<S>> updateFunc, int numPartitions) {
            this.updateFunc = updateFunc;
            this.numPartitions = numPartitions;
        }

        @Override
        public RDD<Tuple2<K, S>> call(long timeMs, RDD<Tuple2<K, S>> state, RDD<Tuple2<K, V>> batch) {
            Function2<List<V>, Option<S>, Option<S>> update = updateFunc;
            RDD<Tuple2<K, Option<S>>> updated;
            if (state == null && batch == null) {
                return null;
            } else if (state == null) {
                updated = PairRDDFunctions.of(PairRDDFunctions.of(batch).groupByKey(numPartitions))
                        .mapValues(values -> update.call(values, Option.empty()));
            } else if (batch == null) {
                updated = PairRDDFunctions.of(state)
                        .mapValues(s -> update.call(Collections.emptyList(), Option.of(s)));
            } else {
                updated = PairRDDFunctions.of(PairRDDFunctions.of(state).groupWith(batch, numPartitions))
                        .mapValues(grouped -> update.call(grouped._2(), current(grouped._1())));
            }
            RDD<Tuple2<K, Option<S>>> defined = updated.filter(kv -> kv._2().isDefined());
            return PairRDDFunctions.of(defined).mapValues(Option::get);
        }

        private static <S> Option<S> current(List<S> states) {
            return states.isEmpty() ? Option.empty() : Option.of(states.get(0));
        }
    }
}
