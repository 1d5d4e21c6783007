package com.sdu.sparkbridge.interop;

import com.google.common.base.Preconditions;

import java.io.Serializable;

/**
 * 宿主JVM中对象的句柄
 *
 * @author hanhan.zhang
 * */
public final class JvmObjectReference implements Serializable {

    private final String id;

    public JvmObjectReference(String id) {
        this.id = Preconditions.checkNotNull(id, "jvm object id");
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((JvmObjectReference) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "JvmObjectReference(" + id + ")";
    }
}
