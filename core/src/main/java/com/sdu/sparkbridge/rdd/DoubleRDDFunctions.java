package com.sdu.sparkbridge.rdd;

import com.google.common.collect.Iterators;
import com.sdu.sparkbridge.utils.StatCounter;

/**
 * 数值RDD统计
 *
 * @author hanhan.zhang
 * */
public class DoubleRDDFunctions {

    private final RDD<Double> self;

    public DoubleRDDFunctions(RDD<Double> self) {
        this.self = self;
    }

    public static DoubleRDDFunctions of(RDD<Double> rdd) {
        return new DoubleRDDFunctions(rdd);
    }

    public double sum() {
        return self.fold(0.0, Double::sum);
    }

    /**
     * 各分区计算StatCounter后在Driver端合并
     * */
    public StatCounter stats() {
        StatCounter result = new StatCounter();
        for (StatCounter partial : self.<StatCounter>mapPartitionsWithIndex(
                (split, values) -> Iterators.singletonIterator(new StatCounter(() -> values)), true).collect()) {
            result.merge(partial);
        }
        return result;
    }

    public double mean() {
        return stats().mean();
    }

    public double variance() {
        return stats().variance();
    }

    public double stdev() {
        return stats().stdev();
    }

    public double sampleVariance() {
        return stats().sampleVariance();
    }

    public double sampleStdev() {
        return stats().sampleStdev();
    }

    public double max() {
        return self.reduce(Math::max);
    }

    public double min() {
        return self.reduce(Math::min);
    }
}
