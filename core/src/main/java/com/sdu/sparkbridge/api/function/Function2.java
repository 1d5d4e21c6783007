package com.sdu.sparkbridge.api.function;

import java.io.Serializable;

/**
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface Function2<T1, T2, R> extends Serializable {

    R call(T1 v1, T2 v2);

}
