package com.sdu.sparkbridge.utils.scala;

import com.google.common.base.Objects;

import java.io.Serializable;
import java.util.NoSuchElementException;

/**
 * 外连接结果中可能缺失的值: defined(value)或undefined
 *
 * Note:
 *
 *  defined(null)与undefined不相等
 *
 * @author hanhan.zhang
 * */
public final class Option<T> implements Serializable {

    private static final Option<?> UNDEFINED = new Option<>(null, false);

    private final T value;
    private final boolean defined;

    private Option(T value, boolean defined) {
        this.value = value;
        this.defined = defined;
    }

    public static <T> Option<T> of(T value) {
        return new Option<>(value, true);
    }

    @SuppressWarnings("unchecked")
    public static <T> Option<T> empty() {
        return (Option<T>) UNDEFINED;
    }

    public boolean isDefined() {
        return defined;
    }

    public T get() {
        if (!defined) {
            throw new NoSuchElementException("Option.get on undefined value");
        }
        return value;
    }

    public T getOrElse(T defaultValue) {
        return defined ? value : defaultValue;
    }

    // 反序列化后保持undefined单例语义
    private Object readResolve() {
        return defined ? this : UNDEFINED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Option<?> that = (Option<?>) o;
        return defined == that.defined && Objects.equal(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(defined, value);
    }

    @Override
    public String toString() {
        return defined ? String.format("Some(%s)", value) : "None";
    }
}
