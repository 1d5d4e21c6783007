package com.sdu.sparkbridge.streaming.api.function;

import com.sdu.sparkbridge.rdd.RDD;

import java.io.Serializable;

/**
 * 双输入批次转换, 窗口归约/状态更新时任一输入可能为null
 *
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface Transform2Function<T, U, V> extends Serializable {

    RDD<V> call(long timeMs, RDD<T> rdd, RDD<U> other);

}
