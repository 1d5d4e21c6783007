package com.sdu.sparkbridge.streaming.proxy.ipc;

import com.google.common.collect.Lists;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.interop.JvmBridge;
import com.sdu.sparkbridge.interop.JvmObjectReference;
import com.sdu.sparkbridge.interop.SparkTransportConf;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.proxy.ipc.RDDIpcProxy;
import com.sdu.sparkbridge.proxy.ipc.SparkContextIpcProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;
import com.sdu.sparkbridge.streaming.callback.CallbackServer;
import com.sdu.sparkbridge.streaming.callback.DStreamCallbacks;
import com.sdu.sparkbridge.streaming.proxy.DStreamProxy;
import com.sdu.sparkbridge.streaming.proxy.StreamingContextProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.sdu.sparkbridge.proxy.ipc.SparkContextIpcProxy.reference;

/**
 * 经{@link JvmBridge}调用宿主JVM中的JavaStreamingContext
 *
 * 创建时启动{@link CallbackServer}并向宿主JVM注册回调端口, 批次转换在客户端执行
 *
 * @author hanhan.zhang
 * */
public class StreamingContextIpcProxy implements StreamingContextProxy {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingContextIpcProxy.class);

    static final String JAVA_STREAMING_CONTEXT_CLASS = "org.apache.spark.streaming.api.java.JavaStreamingContext";
    static final String DURATION_CLASS = "org.apache.spark.streaming.Duration";
    static final String TIME_CLASS = "org.apache.spark.streaming.Time";
    static final String BRIDGE_DSTREAM_CLASS = "org.apache.spark.streaming.api.bridge.BridgeDStream";
    static final String BRIDGE_TRANSFORMED_DSTREAM_CLASS = "org.apache.spark.streaming.api.bridge.BridgeTransformedDStream";
    static final String BRIDGE_TRANSFORMED2_DSTREAM_CLASS = "org.apache.spark.streaming.api.bridge.BridgeTransformed2DStream";
    static final String BRIDGE_REDUCED_WINDOWED_DSTREAM_CLASS = "org.apache.spark.streaming.api.bridge.BridgeReducedWindowedDStream";
    static final String BRIDGE_STATE_DSTREAM_CLASS = "org.apache.spark.streaming.api.bridge.BridgeStateDStream";

    private static final String MODULE = "callback";

    private final JvmBridge jvmBridge;

    private final JvmObjectReference jvmStreamingContextReference;

    private final CallbackServer callbackServer;

    public StreamingContextIpcProxy(SparkContext sparkContext, long batchIntervalMs) {
        checkArgument(sparkContext.getSparkContextProxy() instanceof SparkContextIpcProxy,
                "StreamingContext over the JVM bridge requires a bridged SparkContext");
        SparkContextIpcProxy contextProxy = (SparkContextIpcProxy) sparkContext.getSparkContextProxy();
        this.jvmBridge = contextProxy.getJvmBridge();
        this.jvmStreamingContextReference = jvmBridge.callConstructor(JAVA_STREAMING_CONTEXT_CLASS,
                contextProxy.getJvmJavaContextReference(), duration(jvmBridge, batchIntervalMs));
        this.callbackServer = new CallbackServer(SparkTransportConf.fromSparkConf(sparkContext.getConf(), MODULE),
                jvmBridge, new DStreamCallbacks(sparkContext));
        jvmBridge.callStaticJavaMethod(BRIDGE_DSTREAM_CLASS, "connectCallback", callbackServer.getPort());
        LOGGER.info("Created JavaStreamingContext {} with batch interval {} ms", jvmStreamingContextReference,
                batchIntervalMs);
    }

    private Object call(String methodName, Object... args) {
        return jvmBridge.callNonStaticJavaMethod(jvmStreamingContextReference, methodName, args);
    }

    private DStreamProxy dstream(Object jdstream) {
        return new DStreamIpcProxy(jvmBridge, reference(jdstream));
    }

    private DStreamProxy asJavaDStream(JvmObjectReference dstream) {
        return dstream(jvmBridge.callNonStaticJavaMethod(dstream, "asJavaDStream"));
    }

    private JvmObjectReference scalaDStream(DStreamProxy proxy) {
        return reference(jvmBridge.callNonStaticJavaMethod(((DStreamIpcProxy) proxy).getJvmDStreamReference(), "dstream"));
    }

    @Override
    public void start() {
        call("start");
    }

    @Override
    public void stop() {
        try {
            call("stop", false);
        } finally {
            callbackServer.close();
        }
    }

    @Override
    public void remember(long durationMs) {
        call("remember", duration(jvmBridge, durationMs));
    }

    @Override
    public void checkpoint(String directory) {
        call("checkpoint", directory);
    }

    @Override
    public void awaitTermination() {
        call("awaitTermination");
    }

    @Override
    public boolean awaitTerminationOrTimeout(long timeoutMs) {
        return (Boolean) call("awaitTerminationOrTimeout", timeoutMs);
    }

    @Override
    public DStreamProxy textFileStream(String directory) {
        return dstream(call("textFileStream", directory));
    }

    @Override
    public DStreamProxy socketTextStream(String hostname, int port, StorageLevelType storageLevelType) {
        return dstream(call("socketTextStream", hostname, port,
                SparkContextIpcProxy.storageLevel(jvmBridge, storageLevelType)));
    }

    @Override
    public DStreamProxy union(DStreamProxy first, List<DStreamProxy> rest) {
        List<JvmObjectReference> others = Lists.newArrayListWithCapacity(rest.size());
        for (DStreamProxy proxy : rest) {
            others.add(((DStreamIpcProxy) proxy).getJvmDStreamReference());
        }
        return dstream(call("union", ((DStreamIpcProxy) first).getJvmDStreamReference(), others));
    }

    @Override
    public DStreamProxy createTransformedDStream(DStreamProxy parent, byte[] func, SerializedMode serializedMode) {
        JvmObjectReference dstream = jvmBridge.callConstructor(BRIDGE_TRANSFORMED_DSTREAM_CLASS, scalaDStream(parent),
                func, serializedMode.name());
        return asJavaDStream(dstream);
    }

    @Override
    public DStreamProxy createTransformed2DStream(DStreamProxy parent, DStreamProxy other, byte[] func,
                                                  SerializedMode serializedMode, SerializedMode otherSerializedMode) {
        JvmObjectReference dstream = jvmBridge.callConstructor(BRIDGE_TRANSFORMED2_DSTREAM_CLASS, scalaDStream(parent),
                scalaDStream(other), func, serializedMode.name(), otherSerializedMode.name());
        return asJavaDStream(dstream);
    }

    @Override
    public DStreamProxy createReducedWindowedDStream(DStreamProxy parent, byte[] func, byte[] invFunc, long windowMs,
                                                     long slideMs, SerializedMode serializedMode) {
        JvmObjectReference dstream = jvmBridge.callConstructor(BRIDGE_REDUCED_WINDOWED_DSTREAM_CLASS,
                scalaDStream(parent), func, invFunc, duration(jvmBridge, windowMs), duration(jvmBridge, slideMs),
                serializedMode.name());
        return asJavaDStream(dstream);
    }

    @Override
    public DStreamProxy createStateDStream(DStreamProxy parent, byte[] func, SerializedMode serializedMode) {
        JvmObjectReference dstream = jvmBridge.callConstructor(BRIDGE_STATE_DSTREAM_CLASS, scalaDStream(parent),
                func, serializedMode.name());
        return asJavaDStream(dstream);
    }

    @Override
    public DStreamProxy createConstantInputDStream(RDDProxy rddProxy) {
        return dstream(jvmBridge.callStaticJavaMethod(BRIDGE_DSTREAM_CLASS, "createConstantInputDStream",
                jvmStreamingContextReference, ((RDDIpcProxy) rddProxy).getJvmRddReference()));
    }

    static JvmObjectReference duration(JvmBridge jvmBridge, long ms) {
        return jvmBridge.callConstructor(DURATION_CLASS, ms);
    }
}
