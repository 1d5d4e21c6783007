package com.sdu.sparkbridge.api.function;

import java.io.Serializable;

/**
 * 无参函数, 用于生成初始值(如combiner)
 *
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface Function0<R> extends Serializable {

    R call();

}
