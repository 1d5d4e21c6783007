package com.sdu.sparkbridge.rdd;

import com.google.common.base.MoreObjects;

import java.io.Serializable;

/**
 * cogroup中携带来源标记的值, tag为输入RDD的下标(0 ~ arity - 1)
 *
 * @author hanhan.zhang
 * */
public final class CoGroupValue implements Serializable {

    private final int tag;

    private final Object value;

    public CoGroupValue(int tag, Object value) {
        this.tag = tag;
        this.value = value;
    }

    public int getTag() {
        return tag;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tag", tag)
                .add("value", value)
                .toString();
    }
}
