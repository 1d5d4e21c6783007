package com.sdu.sparkbridge.utils;

import java.io.Serializable;

/**
 * 单次遍历统计计数, 均值与方差按增量方式更新, 可合并
 *
 * @author hanhan.zhang
 * */
public class StatCounter implements Serializable {

    private long n = 0;
    // 均值
    private double mu = 0;
    // 与均值差的平方和
    private double m2 = 0;
    private double maxValue = Double.NEGATIVE_INFINITY;
    private double minValue = Double.POSITIVE_INFINITY;

    public StatCounter() {
    }

    public StatCounter(Iterable<Double> values) {
        merge(values);
    }

    public StatCounter merge(double value) {
        double delta = value - mu;
        n += 1;
        mu += delta / n;
        m2 += delta * (value - mu);
        maxValue = Math.max(maxValue, value);
        minValue = Math.min(minValue, value);
        return this;
    }

    public StatCounter merge(Iterable<Double> values) {
        for (double value : values) {
            merge(value);
        }
        return this;
    }

    public StatCounter merge(StatCounter other) {
        if (other == this) {
            return merge(other.copy());
        }
        if (n == 0) {
            mu = other.mu;
            m2 = other.m2;
            n = other.n;
            maxValue = other.maxValue;
            minValue = other.minValue;
        } else if (other.n != 0) {
            double delta = other.mu - mu;
            if (other.n * 10 < n) {
                mu = mu + (delta * other.n) / (n + other.n);
            } else if (n * 10 < other.n) {
                mu = other.mu - (delta * n) / (n + other.n);
            } else {
                mu = (mu * n + other.mu * other.n) / (n + other.n);
            }
            m2 += other.m2 + (delta * delta * n * other.n) / (n + other.n);
            n += other.n;
            maxValue = Math.max(maxValue, other.maxValue);
            minValue = Math.min(minValue, other.minValue);
        }
        return this;
    }

    public StatCounter copy() {
        StatCounter other = new StatCounter();
        other.n = n;
        other.mu = mu;
        other.m2 = m2;
        other.maxValue = maxValue;
        other.minValue = minValue;
        return other;
    }

    public long count() {
        return n;
    }

    public double mean() {
        return mu;
    }

    public double sum() {
        return n * mu;
    }

    public double max() {
        return maxValue;
    }

    public double min() {
        return minValue;
    }

    /**
     * 总体方差
     * */
    public double variance() {
        return n == 0 ? Double.NaN : m2 / n;
    }

    /**
     * 样本方差(除以n - 1)
     * */
    public double sampleVariance() {
        return n <= 1 ? Double.NaN : m2 / (n - 1);
    }

    public double stdev() {
        return Math.sqrt(variance());
    }

    public double sampleStdev() {
        return Math.sqrt(sampleVariance());
    }

    @Override
    public String toString() {
        return String.format("(count: %d, mean: %f, stdev: %f, max: %f, min: %f)", count(), mean(), stdev(), max(), min());
    }
}
