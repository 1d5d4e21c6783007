package com.sdu.sparkbridge.proxy.ipc;

import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.SparkConf;
import com.sdu.sparkbridge.interop.JvmBridge;
import com.sdu.sparkbridge.interop.JvmObjectReference;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.proxy.SparkContextProxy;
import com.sdu.sparkbridge.storage.StorageLevelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 经{@link JvmBridge}调用宿主JVM中的JavaSparkContext
 *
 * @author hanhan.zhang
 * */
public class SparkContextIpcProxy implements SparkContextProxy {

    private static final Logger LOGGER = LoggerFactory.getLogger(SparkContextIpcProxy.class);

    static final String SPARK_CONF_CLASS = "org.apache.spark.SparkConf";
    static final String JAVA_SPARK_CONTEXT_CLASS = "org.apache.spark.api.java.JavaSparkContext";
    static final String BRIDGE_RDD_CLASS = "org.apache.spark.api.bridge.BridgeRDD";
    static final String PAIRWISE_RDD_CLASS = "org.apache.spark.api.python.PairwiseRDD";
    static final String PYTHON_PARTITIONER_CLASS = "org.apache.spark.api.python.PythonPartitioner";
    static final String PYTHON_RDD_CLASS = "org.apache.spark.api.python.PythonRDD";
    static final String STORAGE_LEVEL_CLASS = "org.apache.spark.storage.StorageLevel";

    private final JvmBridge jvmBridge;

    private final JvmObjectReference jvmJavaContextReference;

    public SparkContextIpcProxy(JvmBridge jvmBridge, SparkConf conf) {
        this.jvmBridge = jvmBridge;
        JvmObjectReference jvmConfReference = jvmBridge.callConstructor(SPARK_CONF_CLASS, false);
        for (Map.Entry<String, String> entry : conf.getAll().entrySet()) {
            jvmBridge.callNonStaticJavaMethod(jvmConfReference, "set", entry.getKey(), entry.getValue());
        }
        this.jvmJavaContextReference = jvmBridge.callConstructor(JAVA_SPARK_CONTEXT_CLASS, jvmConfReference);
        LOGGER.info("Created JavaSparkContext {} in JVM backend", jvmJavaContextReference);
    }

    public JvmBridge getJvmBridge() {
        return jvmBridge;
    }

    public JvmObjectReference getJvmJavaContextReference() {
        return jvmJavaContextReference;
    }

    @Override
    public RDDProxy parallelize(List<byte[]> elements, int numSlices) {
        JvmObjectReference jrdd = reference(jvmBridge.callStaticJavaMethod(BRIDGE_RDD_CLASS, "createRDDFromArray",
                jvmJavaContextReference, elements, numSlices));
        return new RDDIpcProxy(jvmBridge, jrdd);
    }

    @Override
    public RDDProxy textFile(String path, int minPartitions) {
        JvmObjectReference jrdd = reference(jvmBridge.callNonStaticJavaMethod(jvmJavaContextReference,
                "textFile", path, minPartitions));
        return new RDDIpcProxy(jvmBridge, jrdd);
    }

    @Override
    public RDDProxy emptyRDD() {
        JvmObjectReference jrdd = reference(jvmBridge.callNonStaticJavaMethod(jvmJavaContextReference, "emptyRDD"));
        return new RDDIpcProxy(jvmBridge, jrdd);
    }

    @Override
    public RDDProxy union(List<RDDProxy> rdds) {
        List<JvmObjectReference> jrdds = rdds.stream()
                .map(rdd -> ((RDDIpcProxy) rdd).getJvmRddReference())
                .collect(Collectors.toList());
        JvmObjectReference jrdd = reference(jvmBridge.callNonStaticJavaMethod(jvmJavaContextReference, "union",
                jrdds.get(0), jrdds.subList(1, jrdds.size())));
        return new RDDIpcProxy(jvmBridge, jrdd);
    }

    @Override
    public RDDProxy createPipelinedRDD(RDDProxy parent, byte[] command, boolean preservesPartitioning) {
        JvmObjectReference parentRdd = reference(jvmBridge.callNonStaticJavaMethod(
                ((RDDIpcProxy) parent).getJvmRddReference(), "rdd"));
        JvmObjectReference bridgeRdd = jvmBridge.callConstructor(BRIDGE_RDD_CLASS, parentRdd, command, preservesPartitioning);
        JvmObjectReference jrdd = reference(jvmBridge.callNonStaticJavaMethod(bridgeRdd, "asJavaRDD"));
        return new RDDIpcProxy(jvmBridge, jrdd);
    }

    @Override
    public RDDProxy createPairwiseRDD(RDDProxy keyed, int numPartitions, long partitionFuncId) {
        JvmObjectReference rdd = reference(jvmBridge.callNonStaticJavaMethod(
                ((RDDIpcProxy) keyed).getJvmRddReference(), "rdd"));
        JvmObjectReference pairwiseRdd = jvmBridge.callConstructor(PAIRWISE_RDD_CLASS, rdd);
        JvmObjectReference pairRdd = reference(jvmBridge.callNonStaticJavaMethod(pairwiseRdd, "asJavaPairRDD"));
        JvmObjectReference partitioner = jvmBridge.callConstructor(PYTHON_PARTITIONER_CLASS, numPartitions, partitionFuncId);
        JvmObjectReference partitionedRdd = reference(jvmBridge.callNonStaticJavaMethod(pairRdd, "partitionBy", partitioner));
        JvmObjectReference jrdd = reference(jvmBridge.callStaticJavaMethod(PYTHON_RDD_CLASS, "valueOfPair", partitionedRdd));
        return new RDDIpcProxy(jvmBridge, jrdd);
    }

    @Override
    public int defaultParallelism() {
        return (Integer) jvmBridge.callNonStaticJavaMethod(jvmJavaContextReference, "defaultParallelism");
    }

    @Override
    public void setCheckpointDir(String directory) {
        jvmBridge.callNonStaticJavaMethod(jvmJavaContextReference, "setCheckpointDir", directory);
    }

    @Override
    public void stop() {
        jvmBridge.callNonStaticJavaMethod(jvmJavaContextReference, "stop");
    }

    public static JvmObjectReference storageLevel(JvmBridge jvmBridge, StorageLevelType type) {
        return reference(jvmBridge.callStaticJavaMethod(STORAGE_LEVEL_CLASS, "apply", type.isUseDisk(),
                type.isUseMemory(), type.isUseOffHeap(), type.isDeserialized(), type.getReplication()));
    }

    public static JvmObjectReference reference(Object value) {
        if (!(value instanceof JvmObjectReference)) {
            throw new BridgeException("expect object reference but found " + value);
        }
        return (JvmObjectReference) value;
    }
}
