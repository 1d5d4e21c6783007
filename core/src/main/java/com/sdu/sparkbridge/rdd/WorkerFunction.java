package com.sdu.sparkbridge.rdd;

import com.sdu.sparkbridge.api.function.Function2;
import com.sdu.sparkbridge.utils.Utils;

import java.io.Serializable;
import java.util.Iterator;

/**
 * 远端Worker按分区执行的计算单元: (partitionIndex, input) -> output
 *
 * 1: 输入输出均为按需遍历的Iterator, 内存占用以单分区为界
 *
 * 2: stackTrace为创建时调用栈, 远端执行失败时随异常返回, 不影响计算
 *
 * @author hanhan.zhang
 * */
public class WorkerFunction implements Serializable {

    private final Function2<Integer, Iterator<Object>, Iterator<Object>> func;

    private final String stackTrace;

    public WorkerFunction(Function2<Integer, Iterator<Object>, Iterator<Object>> func) {
        this(func, Utils.currentStackTrace());
    }

    private WorkerFunction(Function2<Integer, Iterator<Object>, Iterator<Object>> func, String stackTrace) {
        this.func = func;
        this.stackTrace = stackTrace;
    }

    /**
     * 以类型化的分区函数构造
     * */
    @SuppressWarnings("unchecked")
    public static <I, O> WorkerFunction of(Function2<Integer, Iterator<I>, Iterator<O>> func) {
        return new WorkerFunction((Function2<Integer, Iterator<Object>, Iterator<Object>>) (Function2<?, ?, ?>) func);
    }

    public Iterator<Object> apply(int partitionIndex, Iterator<Object> input) {
        return func.call(partitionIndex, input);
    }

    public String getStackTrace() {
        return stackTrace;
    }

    /**
     * 组合: outer(split, inner(split, input)), 满足结合律
     * */
    public static WorkerFunction chain(WorkerFunction inner, WorkerFunction outer) {
        String stackTrace = outer.stackTrace + System.lineSeparator()
                + Utils.STACK_PREFIX + "--- Inner stack trace: ---" + System.lineSeparator()
                + inner.stackTrace;
        return new WorkerFunction(new ChainHelper(inner.func, outer.func), stackTrace);
    }

    private static class ChainHelper implements Function2<Integer, Iterator<Object>, Iterator<Object>> {

        private final Function2<Integer, Iterator<Object>, Iterator<Object>> innerFunc;
        private final Function2<Integer, Iterator<Object>, Iterator<Object>> outerFunc;

        ChainHelper(Function2<Integer, Iterator<Object>, Iterator<Object>> innerFunc,
                    Function2<Integer, Iterator<Object>, Iterator<Object>> outerFunc) {
            this.innerFunc = innerFunc;
            this.outerFunc = outerFunc;
        }

        @Override
        public Iterator<Object> call(Integer split, Iterator<Object> input) {
            return outerFunc.call(split, innerFunc.call(split, input));
        }
    }
}
