package com.sdu.sparkbridge.streaming.api.function;

import com.sdu.sparkbridge.rdd.RDD;

import java.io.Serializable;

/**
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface ForeachRDDFunction<T> extends Serializable {

    void call(long timeMs, RDD<T> rdd);

}
