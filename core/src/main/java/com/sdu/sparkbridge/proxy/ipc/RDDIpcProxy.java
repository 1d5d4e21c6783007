package com.sdu.sparkbridge.proxy.ipc;

import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.interop.JvmBridge;
import com.sdu.sparkbridge.interop.JvmObjectReference;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.storage.StorageLevelType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.sdu.sparkbridge.proxy.ipc.SparkContextIpcProxy.reference;

/**
 * 宿主JVM中JavaRDD的代理
 *
 * @author hanhan.zhang
 * */
public class RDDIpcProxy implements RDDProxy {

    private final JvmBridge jvmBridge;

    private final JvmObjectReference jvmRddReference;

    public RDDIpcProxy(JvmBridge jvmBridge, JvmObjectReference jvmRddReference) {
        this.jvmBridge = jvmBridge;
        this.jvmRddReference = jvmRddReference;
    }

    public JvmObjectReference getJvmRddReference() {
        return jvmRddReference;
    }

    private Object call(String methodName, Object... args) {
        return jvmBridge.callNonStaticJavaMethod(jvmRddReference, methodName, args);
    }

    private RDDIpcProxy callRdd(String methodName, Object... args) {
        return new RDDIpcProxy(jvmBridge, reference(call(methodName, args)));
    }

    /**
     * 宿主引擎返回byte[]或String(文本RDD)
     * */
    @Override
    public List<byte[]> collect() {
        Object result = call("collect");
        if (!(result instanceof List)) {
            throw new BridgeException("collect returned " + result + " instead of a list");
        }
        List<?> items = (List<?>) result;
        List<byte[]> records = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof byte[]) {
                records.add((byte[]) item);
            } else if (item instanceof String) {
                records.add(((String) item).getBytes(StandardCharsets.UTF_8));
            } else {
                throw new BridgeException("unexpected collected element " + item);
            }
        }
        return records;
    }

    @Override
    public long count() {
        return ((Number) call("count")).longValue();
    }

    @Override
    public RDDProxy union(RDDProxy other) {
        return callRdd("union", ((RDDIpcProxy) other).jvmRddReference);
    }

    @Override
    public void cache() {
        call("cache");
    }

    @Override
    public void persist(StorageLevelType storageLevelType) {
        call("persist", SparkContextIpcProxy.storageLevel(jvmBridge, storageLevelType));
    }

    @Override
    public void unpersist() {
        call("unpersist");
    }

    @Override
    public void checkpoint() {
        call("checkpoint");
    }

    @Override
    public boolean isCheckpointed() {
        return (Boolean) call("isCheckpointed");
    }

    @Override
    public int getNumPartitions() {
        return ((Number) call("getNumPartitions")).intValue();
    }

    @Override
    public RDDProxy repartition(int numPartitions) {
        return callRdd("repartition", numPartitions);
    }

    @Override
    public RDDProxy coalesce(int numPartitions, boolean shuffle) {
        return callRdd("coalesce", numPartitions, shuffle);
    }

    @Override
    public RDDProxy sample(boolean withReplacement, double fraction, long seed) {
        return callRdd("sample", withReplacement, fraction, seed);
    }

    @Override
    public RDDProxy cartesian(RDDProxy other) {
        return callRdd("cartesian", ((RDDIpcProxy) other).jvmRddReference);
    }

    @Override
    public RDDProxy zip(RDDProxy other) {
        return callRdd("zip", ((RDDIpcProxy) other).jvmRddReference);
    }

    @Override
    public void setName(String name) {
        call("setName", name);
    }

    @Override
    public String name() {
        return (String) call("name");
    }

    @Override
    public String toDebugString() {
        return (String) call("toDebugString");
    }

    @Override
    public void saveAsTextFile(String path, String compressionCodecClass) {
        if (compressionCodecClass == null) {
            call("saveAsTextFile", path);
            return;
        }
        JvmObjectReference codec = reference(jvmBridge.callStaticJavaMethod("java.lang.Class", "forName", compressionCodecClass));
        call("saveAsTextFile", path, codec);
    }

    @Override
    public String toString() {
        return "RDDIpcProxy(" + jvmRddReference + ")";
    }
}
