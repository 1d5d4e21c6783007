package com.sdu.sparkbridge.streaming.proxy.ipc;

import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.interop.JvmBridge;
import com.sdu.sparkbridge.interop.JvmObjectReference;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.proxy.ipc.RDDIpcProxy;
import com.sdu.sparkbridge.proxy.ipc.SparkContextIpcProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;
import com.sdu.sparkbridge.streaming.proxy.DStreamProxy;

import java.util.ArrayList;
import java.util.List;

import static com.sdu.sparkbridge.proxy.ipc.SparkContextIpcProxy.reference;
import static com.sdu.sparkbridge.streaming.proxy.ipc.StreamingContextIpcProxy.BRIDGE_DSTREAM_CLASS;

/**
 * 宿主JVM中JavaDStream的代理
 *
 * @author hanhan.zhang
 * */
public class DStreamIpcProxy implements DStreamProxy {

    private final JvmBridge jvmBridge;

    private final JvmObjectReference jvmDStreamReference;

    public DStreamIpcProxy(JvmBridge jvmBridge, JvmObjectReference jvmDStreamReference) {
        this.jvmBridge = jvmBridge;
        this.jvmDStreamReference = jvmDStreamReference;
    }

    public JvmObjectReference getJvmDStreamReference() {
        return jvmDStreamReference;
    }

    private Object call(String methodName, Object... args) {
        return jvmBridge.callNonStaticJavaMethod(jvmDStreamReference, methodName, args);
    }

    @Override
    public long slideDuration() {
        JvmObjectReference dstream = reference(call("dstream"));
        JvmObjectReference duration = reference(jvmBridge.callNonStaticJavaMethod(dstream, "slideDuration"));
        return ((Number) jvmBridge.callNonStaticJavaMethod(duration, "milliseconds")).longValue();
    }

    @Override
    public DStreamProxy window(long windowMs, long slideMs) {
        JvmObjectReference window = StreamingContextIpcProxy.duration(jvmBridge, windowMs);
        JvmObjectReference windowed = slideMs <= 0
                ? reference(call("window", window))
                : reference(call("window", window, StreamingContextIpcProxy.duration(jvmBridge, slideMs)));
        return new DStreamIpcProxy(jvmBridge, windowed);
    }

    @Override
    public void callForeachRDD(byte[] func, SerializedMode serializedMode) {
        jvmBridge.callStaticJavaMethod(BRIDGE_DSTREAM_CLASS, "callForeachRDD", jvmDStreamReference, func,
                serializedMode.name());
    }

    @Override
    public void print(int num) {
        jvmBridge.callStaticJavaMethod(BRIDGE_DSTREAM_CLASS, "print", jvmDStreamReference, num);
    }

    @Override
    public void persist(StorageLevelType storageLevelType) {
        call("persist", SparkContextIpcProxy.storageLevel(jvmBridge, storageLevelType));
    }

    @Override
    public void checkpoint(long intervalMs) {
        JvmObjectReference dstream = reference(call("dstream"));
        jvmBridge.callNonStaticJavaMethod(dstream, "checkpoint", StreamingContextIpcProxy.duration(jvmBridge, intervalMs));
    }

    @Override
    public List<RDDProxy> slice(long fromTimeMs, long toTimeMs) {
        JvmObjectReference from = jvmBridge.callConstructor(StreamingContextIpcProxy.TIME_CLASS, fromTimeMs);
        JvmObjectReference to = jvmBridge.callConstructor(StreamingContextIpcProxy.TIME_CLASS, toTimeMs);
        Object result = call("slice", from, to);
        if (!(result instanceof List)) {
            throw new BridgeException("slice returned " + result + " instead of a list");
        }
        List<RDDProxy> rdds = new ArrayList<>();
        for (Object jrdd : (List<?>) result) {
            rdds.add(new RDDIpcProxy(jvmBridge, reference(jrdd)));
        }
        return rdds;
    }

    @Override
    public String toString() {
        return "DStreamIpcProxy(" + jvmDStreamReference + ")";
    }
}
