package com.sdu.sparkbridge.streaming.callback;

import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.streaming.api.function.ForeachRDDFunction;
import com.sdu.sparkbridge.streaming.api.function.Transform2Function;
import com.sdu.sparkbridge.streaming.api.function.TransformFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 宿主引擎每个批次的回调入口: 反序列化转换函数, 以批次RDD代理构建客户端RDD并执行
 *
 * 1: 转换结果统一为Byte编码, 下游节点按Byte解码
 *
 * 2: 宿主引擎传入的RDD代理可为null(首个状态批次, 空窗口), 对应的RDD参数为null
 *
 * @author hanhan.zhang
 * */
public class DStreamCallbacks {

    private static final Logger LOGGER = LoggerFactory.getLogger(DStreamCallbacks.class);

    private final SparkContext sparkContext;

    public DStreamCallbacks(SparkContext sparkContext) {
        this.sparkContext = sparkContext;
    }

    public SparkContext getSparkContext() {
        return sparkContext;
    }

    public RDDProxy transform(byte[] func, long timeMs, RDDProxy rddProxy, SerializedMode serializedMode) {
        TransformFunction<Object, Object> f = deserialize(func);
        LOGGER.debug("Transform batch {}", timeMs);
        return output(f.call(timeMs, toRDD(rddProxy, serializedMode)));
    }

    public RDDProxy transform2(byte[] func, long timeMs, RDDProxy rddProxy, SerializedMode serializedMode,
                               RDDProxy otherProxy, SerializedMode otherSerializedMode) {
        Transform2Function<Object, Object, Object> f = deserialize(func);
        LOGGER.debug("Transform two batches at {}", timeMs);
        return output(f.call(timeMs, toRDD(rddProxy, serializedMode), toRDD(otherProxy, otherSerializedMode)));
    }

    public void foreachRDD(byte[] func, long timeMs, RDDProxy rddProxy, SerializedMode serializedMode) {
        ForeachRDDFunction<Object> f = deserialize(func);
        LOGGER.debug("Run output operation for batch {}", timeMs);
        f.call(timeMs, toRDD(rddProxy, serializedMode));
    }

    private <F> F deserialize(byte[] func) {
        // 回调可能并发, 每次使用独立的序列化实例
        return sparkContext.getSerializer().newInstance().fromBytes(func);
    }

    private RDD<Object> toRDD(RDDProxy rddProxy, SerializedMode serializedMode) {
        return rddProxy == null ? null : new RDD<>(rddProxy, sparkContext, serializedMode);
    }

    private static RDDProxy output(RDD<Object> rdd) {
        return rdd == null ? null : rdd.reserialize().getRddProxy();
    }
}
