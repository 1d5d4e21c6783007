package com.sdu.sparkbridge.api.function;

import java.io.Serializable;
import java.util.Iterator;

/**
 * 一对多映射, 返回结果按需遍历
 *
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface FlatMapFunction<T, R> extends Serializable {

    Iterator<R> call(T v);

}
