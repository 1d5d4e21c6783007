package com.sdu.sparkbridge.rdd;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Lists;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import com.sdu.sparkbridge.Partitioner;
import com.sdu.sparkbridge.SparkTestUnit;
import com.sdu.sparkbridge.api.function.Function;
import com.sdu.sparkbridge.api.function.Function0;
import com.sdu.sparkbridge.utils.scala.Option;
import com.sdu.sparkbridge.utils.scala.Tuple2;
import com.sdu.sparkbridge.utils.scala.Tuple3;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @author hanhan.zhang
 * */
public class TestPairRDDFunctions extends SparkTestUnit {

    private RDD<Tuple2<String, Integer>> pairs(int numSlices, Object... keyValues) {
        List<Tuple2<String, Integer>> data = Lists.newArrayList();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.add(new Tuple2<>((String) keyValues[i], (Integer) keyValues[i + 1]));
        }
        return sc.parallelize(data, numSlices);
    }

    @Test
    public void testReduceByKeyIndependentOfPartitionCount() {
        for (int slices : new int[] {1, 2}) {
            RDD<Tuple2<String, Integer>> rdd = pairs(slices, "a", 1, "b", 1, "a", 1);
            for (int numPartitions : new int[] {1, 2}) {
                Map<String, Integer> result = PairRDDFunctions.of(rdd).reduceByKey(Integer::sum, numPartitions).collect()
                        .stream().collect(Collectors.toMap(Tuple2::_1, Tuple2::_2));
                assert result.size() == 2;
                assert result.get("a") == 2;
                assert result.get("b") == 1;
            }
        }
    }

    @Test
    public void testReduceByKeyLocallyAndCountByKey() {
        RDD<Tuple2<String, Integer>> rdd = pairs(3, "a", 1, "b", 5, "a", 2, "c", 1);

        Map<String, Integer> reduced = PairRDDFunctions.of(rdd).reduceByKeyLocally(Integer::sum);
        assert reduced.get("a") == 3;
        assert reduced.get("b") == 5;
        assert reduced.get("c") == 1;
        assert contextProxy.shuffleCount() == 0;

        Map<String, Long> counts = PairRDDFunctions.of(rdd).countByKey();
        assert counts.get("a") == 2L;
        assert counts.get("c") == 1L;
    }

    @Test
    public void testPartitionByIsIdempotent() {
        RDD<Tuple2<String, Integer>> rdd = pairs(2, "a", 1, "b", 2, "c", 3);

        RDD<Tuple2<String, Integer>> once = PairRDDFunctions.of(rdd).partitionBy(3);
        assert contextProxy.shuffleCount() == 1;
        assert once.getNumPartitions() == 3;

        RDD<Tuple2<String, Integer>> twice = PairRDDFunctions.of(once).partitionBy(3);
        assert twice == once;
        assert twice.getPartitioner().equals(once.getPartitioner());
        assert contextProxy.shuffleCount() == 1;

        // 分区数不同需重新shuffle
        PairRDDFunctions.of(once).partitionBy(2);
        assert contextProxy.shuffleCount() == 2;
    }

    @Test
    public void testPartitionByKeyFunction() {
        Function<Object, Integer> byLength = key -> ((String) key).length();
        RDD<Tuple2<String, Integer>> rdd = pairs(1, "a", 1, "bb", 2, "ccc", 3, "dddd", 4);

        RDD<Tuple2<String, Integer>> partitioned = PairRDDFunctions.of(rdd).partitionBy(new Partitioner(2, byLength));
        List<List<Tuple2<String, Integer>>> partitions = partitioned.glom().collect();
        assert partitions.get(0).equals(Arrays.asList(new Tuple2<>("bb", 2), new Tuple2<>("dddd", 4)));
        assert partitions.get(1).equals(Arrays.asList(new Tuple2<>("a", 1), new Tuple2<>("ccc", 3)));
        assert contextProxy.getPartitionFuncIds().get(0) != 0L;
    }

    @Test
    public void testShuffleSkippedOnEqualPartitioner() {
        RDD<Tuple2<String, Integer>> partitioned = PairRDDFunctions.of(pairs(2, "a", 1, "b", 2, "a", 3)).partitionBy(2);
        assert contextProxy.shuffleCount() == 1;

        Map<String, Integer> sums = PairRDDFunctions.of(PairRDDFunctions.of(partitioned).reduceByKey(Integer::sum, 2)).collectAsMap();
        assert sums.get("a") == 4;
        assert sums.get("b") == 2;
        assert contextProxy.shuffleCount() == 1;
        assert contextProxy.getPartitionFuncIds().get(0) == 0L;
    }

    @Test
    public void testGroupByKeyReproducesPairs() {
        Object[] data = {"a", 1, "b", 2, "a", 1, "c", 7, "a", 3, "b", 2};
        Multiset<Tuple2<String, Integer>> expected = HashMultiset.create();
        for (int i = 0; i < data.length; i += 2) {
            expected.add(new Tuple2<>((String) data[i], (Integer) data[i + 1]));
        }

        for (int slices : new int[] {1, 2, 4}) {
            RDD<Tuple2<String, List<Integer>>> grouped = PairRDDFunctions.of(pairs(slices, data)).groupByKey(3);
            Multiset<Tuple2<String, Integer>> flattened = HashMultiset.create();
            for (Tuple2<String, List<Integer>> group : grouped.collect()) {
                for (Integer value : group._2()) {
                    flattened.add(new Tuple2<>(group._1(), value));
                }
            }
            assert flattened.equals(expected);
            assert grouped.count() == 3;
        }
    }

    @Test
    public void testCombineAndAggregateByKey() {
        RDD<Tuple2<String, Integer>> rdd = pairs(2, "a", 1, "a", 2, "b", 3, "a", 4);

        // (sum, count)
        Map<String, Tuple2<Integer, Integer>> averages = PairRDDFunctions.of(PairRDDFunctions.of(rdd).combineByKey(
                v -> new Tuple2<>(v, 1),
                (acc, v) -> new Tuple2<>(acc._1() + v, acc._2() + 1),
                (l, r) -> new Tuple2<>(l._1() + r._1(), l._2() + r._2()))).collectAsMap();
        assert averages.get("a").equals(new Tuple2<>(7, 3));
        assert averages.get("b").equals(new Tuple2<>(3, 1));

        Function0<List<Integer>> zero = Lists::newArrayList;
        Map<String, List<Integer>> aggregated = PairRDDFunctions.of(PairRDDFunctions.of(rdd).aggregateByKey(
                zero,
                (list, v) -> {
                    list.add(v);
                    return list;
                },
                (l, r) -> {
                    l.addAll(r);
                    return l;
                })).collectAsMap();
        assert Sets.newHashSet(aggregated.get("a")).equals(Sets.newHashSet(1, 2, 4));

        Map<String, Integer> folded = PairRDDFunctions.of(PairRDDFunctions.of(rdd).foldByKey(() -> 100, Integer::sum, 1)).collectAsMap();
        // 每个分区使用一次zeroValue: a出现在两个分区
        assert folded.get("a") == 207;
        assert folded.get("b") == 103;
    }

    @Test
    public void testJoinCardinality() {
        RDD<Tuple2<String, Integer>> left = pairs(2, "a", 1, "a", 2, "b", 3, "c", 4);
        RDD<Tuple2<String, Integer>> right = pairs(2, "a", 10, "a", 20, "a", 30, "b", 40, "d", 50);

        List<Tuple2<String, Tuple2<Integer, Integer>>> joined = PairRDDFunctions.of(left).join(right).collect();
        assert joined.size() == 2 * 3 + 1;
        assert joined.stream().filter(kv -> kv._1().equals("a")).count() == 6;
        assert joined.contains(new Tuple2<>("b", new Tuple2<>(3, 40)));
        assert joined.contains(new Tuple2<>("a", new Tuple2<>(2, 30)));
    }

    @Test
    public void testLeftOuterJoin() {
        RDD<Tuple2<String, Integer>> left = pairs(2, "a", 1, "b", 4);
        RDD<Tuple2<String, Integer>> right = pairs(1, "a", 2);

        List<Tuple2<String, Tuple2<Integer, Option<Integer>>>> joined = PairRDDFunctions.of(left).leftOuterJoin(right).collect();
        assert Sets.newHashSet(joined).equals(Sets.newHashSet(
                new Tuple2<>("a", new Tuple2<>(1, Option.of(2))),
                new Tuple2<>("b", new Tuple2<>(4, Option.<Integer>empty()))));
        assert joined.size() == 2;
    }

    @Test
    public void testRightAndFullOuterJoin() {
        RDD<Tuple2<String, Integer>> left = pairs(2, "a", 1, "b", 4);
        RDD<Tuple2<String, Integer>> right = pairs(1, "a", 2, "c", 9);

        List<Tuple2<String, Tuple2<Option<Integer>, Integer>>> rightJoined = PairRDDFunctions.of(left).rightOuterJoin(right).collect();
        assert Sets.newHashSet(rightJoined).equals(Sets.newHashSet(
                new Tuple2<>("a", new Tuple2<>(Option.of(1), 2)),
                new Tuple2<>("c", new Tuple2<>(Option.<Integer>empty(), 9))));

        List<Tuple2<String, Tuple2<Option<Integer>, Option<Integer>>>> fullJoined = PairRDDFunctions.of(left).fullOuterJoin(right).collect();
        assert Sets.newHashSet(fullJoined).equals(Sets.newHashSet(
                new Tuple2<>("a", new Tuple2<>(Option.of(1), Option.of(2))),
                new Tuple2<>("b", new Tuple2<>(Option.of(4), Option.<Integer>empty())),
                new Tuple2<>("c", new Tuple2<>(Option.<Integer>empty(), Option.of(9)))));
    }

    @Test
    public void testGroupWithHeterogeneousValues() {
        RDD<Tuple2<String, Integer>> numbers = pairs(2, "a", 1, "b", 2);
        RDD<Tuple2<String, String>> names = sc.parallelize(Arrays.asList(new Tuple2<>("a", "x"), new Tuple2<>("c", "y")), 1);
        RDD<Tuple2<String, Double>> scores = sc.parallelize(Arrays.asList(new Tuple2<>("a", 0.5), new Tuple2<>("a", 1.5)), 2);

        Map<String, Tuple3<List<Integer>, List<String>, List<Double>>> grouped =
                PairRDDFunctions.of(PairRDDFunctions.of(numbers).groupWith(names, scores)).collectAsMap();
        assert grouped.size() == 3;
        assert grouped.get("a")._1().equals(Arrays.asList(1));
        assert grouped.get("a")._2().equals(Arrays.asList("x"));
        assert Sets.newHashSet(grouped.get("a")._3()).equals(Sets.newHashSet(0.5, 1.5));
        assert grouped.get("b")._2().isEmpty();
        assert grouped.get("c")._1().isEmpty();
        assert grouped.get("c")._2().equals(Arrays.asList("y"));
    }

    @Test
    public void testSubtractByKey() {
        RDD<Tuple2<String, Integer>> left = pairs(2, "a", 1, "b", 2, "b", 3, "c", 4);
        RDD<Tuple2<String, Integer>> right = pairs(1, "a", 9, "c", 9);

        List<Tuple2<String, Integer>> result = PairRDDFunctions.of(left).subtractByKey(right).collect();
        assert Sets.newHashSet(result).equals(Sets.newHashSet(new Tuple2<>("b", 2), new Tuple2<>("b", 3)));
    }

    @Test
    public void testLookupKeysValues() {
        RDD<Tuple2<String, Integer>> rdd = pairs(2, "a", 1, "b", 2, "a", 3);
        PairRDDFunctions<String, Integer> functions = PairRDDFunctions.of(rdd);

        assert functions.lookup("a").equals(Arrays.asList(1, 3));
        assert functions.lookup("z").isEmpty();
        assert functions.keys().collect().equals(Arrays.asList("a", "b", "a"));
        assert functions.values().collect().equals(Arrays.asList(1, 2, 3));
        assert functions.collectAsMap().get("a") == 3;

        List<Tuple2<String, Integer>> flattened = functions.flatMapValues(v -> Arrays.asList(v, v * 10).iterator()).collect();
        assert flattened.size() == 6;
        assert flattened.get(1).equals(new Tuple2<>("a", 10));
    }

    @Test
    public void testLookupArrayKey() {
        List<Tuple2<byte[], Integer>> data = Lists.newArrayList(
                new Tuple2<>(new byte[] {1, 2}, 1),
                new Tuple2<>(new byte[] {3}, 2),
                new Tuple2<>(new byte[] {1, 2}, 3));
        PairRDDFunctions<byte[], Integer> functions = PairRDDFunctions.of(sc.parallelize(data, 2));

        // 数组经序列化后为新实例, 按内容匹配
        assert functions.lookup(new byte[] {1, 2}).equals(Arrays.asList(1, 3));
        assert functions.lookup(new byte[] {9}).isEmpty();
    }
}
