package com.sdu.sparkbridge.streaming.api.function;

import com.sdu.sparkbridge.rdd.RDD;

import java.io.Serializable;

/**
 * 批次转换: (批次时间, 批次RDD) -> RDD
 *
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface TransformFunction<T, U> extends Serializable {

    RDD<U> call(long timeMs, RDD<T> rdd);

}
