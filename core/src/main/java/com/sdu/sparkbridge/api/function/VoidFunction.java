package com.sdu.sparkbridge.api.function;

import java.io.Serializable;

/**
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface VoidFunction<T> extends Serializable {

    void call(T v);

}
