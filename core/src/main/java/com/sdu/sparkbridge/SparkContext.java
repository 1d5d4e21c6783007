package com.sdu.sparkbridge;

import com.google.common.collect.Lists;
import com.sdu.sparkbridge.interop.JvmBridge;
import com.sdu.sparkbridge.interop.NettyJvmBridge;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.proxy.SparkContextProxy;
import com.sdu.sparkbridge.proxy.ipc.SparkContextIpcProxy;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.ElementCodec;
import com.sdu.sparkbridge.serializer.JavaSerializer;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.serializer.Serializer;
import com.sdu.sparkbridge.serializer.SerializerInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * 客户端入口: 创建RDD血缘的起点
 *
 * 1: 构建转换不访问宿主引擎, 仅动作触发远端计算
 *
 * 2: SparkContext(SparkConf)经{@link NettyJvmBridge}连接宿主JVM; 测试时可注入{@link SparkContextProxy}
 *
 * @author hanhan.zhang
 * */
public class SparkContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(SparkContext.class);

    private final SparkConf conf;

    private final SparkContextProxy sparkContextProxy;

    // 注入代理时为null
    private final JvmBridge jvmBridge;

    private final Serializer serializer;

    private final SerializerInstance serializerInstance;

    private final ElementCodec elementCodec;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SparkContext(SparkConf conf) {
        this(validate(conf), new NettyJvmBridge(conf));
    }

    private SparkContext(SparkConf conf, JvmBridge jvmBridge) {
        this(conf, new SparkContextIpcProxy(jvmBridge, conf), jvmBridge);
    }

    public SparkContext(SparkConf conf, SparkContextProxy sparkContextProxy) {
        this(validate(conf), sparkContextProxy, null);
    }

    private SparkContext(SparkConf conf, SparkContextProxy sparkContextProxy, JvmBridge jvmBridge) {
        this.conf = conf;
        this.sparkContextProxy = sparkContextProxy;
        this.jvmBridge = jvmBridge;
        this.serializer = new JavaSerializer(conf);
        this.serializerInstance = serializer.newInstance();
        this.elementCodec = new ElementCodec(serializerInstance);
        LOGGER.info("Started SparkContext for app '{}', master {}", conf.get(SparkConf.SPARK_APP_NAME),
                conf.get(SparkConf.SPARK_MASTER));
    }

    private static SparkConf validate(SparkConf conf) {
        checkArgument(conf.contains(SparkConf.SPARK_MASTER), "A master URL must be set in your configuration");
        checkArgument(conf.contains(SparkConf.SPARK_APP_NAME), "An application name must be set in your configuration");
        return conf;
    }

    public SparkConf getConf() {
        return conf;
    }

    public SparkContextProxy getSparkContextProxy() {
        return sparkContextProxy;
    }

    public Serializer getSerializer() {
        return serializer;
    }

    public SerializerInstance serializerInstance() {
        return serializerInstance;
    }

    public ElementCodec elementCodec() {
        return elementCodec;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * 未配置spark.default.parallelism时由宿主引擎决定
     * */
    public int defaultParallelism() {
        if (conf.contains(SparkConf.SPARK_DEFAULT_PARALLELISM)) {
            return conf.getInt(SparkConf.SPARK_DEFAULT_PARALLELISM, 2);
        }
        return sparkContextProxy.defaultParallelism();
    }

    public <T> RDD<T> parallelize(List<T> data) {
        return parallelize(data, 0);
    }

    /**
     * @param numSlices 分区数, 非正数时取默认并行度
     * */
    public <T> RDD<T> parallelize(List<T> data, int numSlices) {
        assertNotStopped();
        int slices = numSlices <= 0 ? defaultParallelism() : numSlices;
        List<byte[]> elements = Lists.newArrayList(elementCodec.encode(SerializedMode.Byte, data.iterator()));
        RDDProxy rddProxy = sparkContextProxy.parallelize(elements, slices);
        return new RDD<>(rddProxy, this, SerializedMode.Byte);
    }

    public RDD<String> textFile(String path) {
        return textFile(path, 0);
    }

    public RDD<String> textFile(String path, int minPartitions) {
        assertNotStopped();
        int partitions = minPartitions <= 0 ? Math.min(defaultParallelism(), 2) : minPartitions;
        return new RDD<>(sparkContextProxy.textFile(path, partitions), this, SerializedMode.String);
    }

    public <T> RDD<T> emptyRDD() {
        assertNotStopped();
        return new RDD<>(sparkContextProxy.emptyRDD(), this, SerializedMode.Byte);
    }

    /**
     * 编码方式不一致时统一为Byte编码
     * */
    @SafeVarargs
    public final <T> RDD<T> union(RDD<T> first, RDD<T>... rest) {
        assertNotStopped();
        List<RDD<T>> rdds = Lists.asList(first, rest);
        SerializedMode mode = first.getSerializedMode();
        boolean sameMode = rdds.stream().allMatch(rdd -> rdd.getSerializedMode() == mode);
        List<RDDProxy> proxies = Lists.newArrayListWithCapacity(rdds.size());
        for (RDD<T> rdd : rdds) {
            proxies.add(sameMode ? rdd.getRddProxy() : rdd.reserialize().getRddProxy());
        }
        return new RDD<>(sparkContextProxy.union(proxies), this, sameMode ? mode : SerializedMode.Byte);
    }

    public void setCheckpointDir(String directory) {
        sparkContextProxy.setCheckpointDir(directory);
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            LOGGER.info("SparkContext already stopped");
            return;
        }
        try {
            sparkContextProxy.stop();
        } finally {
            if (jvmBridge != null) {
                jvmBridge.close();
            }
        }
        LOGGER.info("Successfully stopped SparkContext");
    }

    private void assertNotStopped() {
        checkState(!stopped.get(), "Cannot call methods on a stopped SparkContext");
    }
}
