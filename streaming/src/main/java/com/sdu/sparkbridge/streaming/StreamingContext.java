package com.sdu.sparkbridge.streaming;

import com.google.common.collect.Lists;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.storage.StorageLevelType;
import com.sdu.sparkbridge.streaming.dstream.DStream;
import com.sdu.sparkbridge.streaming.proxy.DStreamProxy;
import com.sdu.sparkbridge.streaming.proxy.StreamingContextProxy;
import com.sdu.sparkbridge.streaming.proxy.ipc.StreamingContextIpcProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 流计算入口: 以固定批次间隔将输入切分为RDD序列
 *
 * @author hanhan.zhang
 * */
public class StreamingContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingContext.class);

    private final SparkContext sparkContext;

    private final StreamingContextProxy streamingContextProxy;

    private final long batchIntervalMs;

    public StreamingContext(SparkContext sparkContext, long batchIntervalMs) {
        this(sparkContext, new StreamingContextIpcProxy(sparkContext, checkInterval(batchIntervalMs)), batchIntervalMs);
    }

    public StreamingContext(SparkContext sparkContext, StreamingContextProxy streamingContextProxy, long batchIntervalMs) {
        this.sparkContext = sparkContext;
        this.streamingContextProxy = streamingContextProxy;
        this.batchIntervalMs = checkInterval(batchIntervalMs);
    }

    private static long checkInterval(long batchIntervalMs) {
        checkArgument(batchIntervalMs > 0, "Batch interval must be positive but found %s ms", batchIntervalMs);
        return batchIntervalMs;
    }

    public SparkContext getSparkContext() {
        return sparkContext;
    }

    public StreamingContextProxy getStreamingContextProxy() {
        return streamingContextProxy;
    }

    public long getBatchIntervalMs() {
        return batchIntervalMs;
    }

    public void start() {
        streamingContextProxy.start();
        LOGGER.info("StreamingContext started, batch interval {} ms", batchIntervalMs);
    }

    public void stop() {
        streamingContextProxy.stop();
        LOGGER.info("StreamingContext stopped");
    }

    /**
     * 每个DStream至少保留最近durationMs内生成的RDD
     * */
    public void remember(long durationMs) {
        streamingContextProxy.remember(durationMs);
    }

    public void checkpoint(String directory) {
        streamingContextProxy.checkpoint(directory);
    }

    public void awaitTermination() {
        streamingContextProxy.awaitTermination();
    }

    public boolean awaitTerminationOrTimeout(long timeoutMs) {
        return streamingContextProxy.awaitTerminationOrTimeout(timeoutMs);
    }

    public DStream<String> textFileStream(String directory) {
        return new DStream<>(streamingContextProxy.textFileStream(directory), this, SerializedMode.String);
    }

    public DStream<String> socketTextStream(String hostname, int port) {
        return socketTextStream(hostname, port, StorageLevelType.MEMORY_AND_DISK_SER_2);
    }

    public DStream<String> socketTextStream(String hostname, int port, StorageLevelType storageLevelType) {
        return new DStream<>(streamingContextProxy.socketTextStream(hostname, port, storageLevelType), this,
                SerializedMode.String);
    }

    /**
     * 每个批次均返回同一RDD
     * */
    public <T> DStream<T> constantStream(RDD<T> rdd) {
        return new DStream<>(streamingContextProxy.createConstantInputDStream(rdd.getRddProxy()), this,
                rdd.getSerializedMode());
    }

    /**
     * 各DStream的滑动间隔须相同, 编码方式不同时统一为Byte编码
     * */
    @SafeVarargs
    public final <T> DStream<T> union(DStream<T> first, DStream<T>... rest) {
        List<DStream<T>> dstreams = Lists.asList(first, rest);
        long slideDuration = first.slideDuration();
        SerializedMode mode = first.getSerializedMode();
        boolean sameMode = true;
        for (DStream<T> dstream : dstreams) {
            checkArgument(dstream.slideDuration() == slideDuration,
                    "All DStreams must have the same slide duration");
            sameMode &= dstream.getSerializedMode() == mode;
        }
        List<DStreamProxy> proxies = Lists.newArrayListWithCapacity(dstreams.size());
        for (DStream<T> dstream : dstreams) {
            proxies.add(sameMode ? dstream.getDStreamProxy() : dstream.reserialize().getDStreamProxy());
        }
        DStreamProxy union = streamingContextProxy.union(proxies.get(0), proxies.subList(1, proxies.size()));
        return new DStream<>(union, this, sameMode ? mode : SerializedMode.Byte);
    }
}
