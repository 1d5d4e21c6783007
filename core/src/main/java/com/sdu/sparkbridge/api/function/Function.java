package com.sdu.sparkbridge.api.function;

import java.io.Serializable;

/**
 * 单参数函数
 *
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface Function<T, R> extends Serializable {

    R call(T v);

}
