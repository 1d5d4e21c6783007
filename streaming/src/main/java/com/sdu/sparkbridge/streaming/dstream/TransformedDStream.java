package com.sdu.sparkbridge.streaming.dstream;

import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.streaming.api.function.TransformFunction;
import com.sdu.sparkbridge.streaming.proxy.DStreamProxy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 尚未提交的转换节点: 持有上游DStream代理与累积的转换函数
 *
 * 1: 上游可流水线时合并转换函数(先上游后本节点), 复用上游的起点代理
 *
 * 2: 首次访问{@link #getDStreamProxy()}时向宿主引擎创建节点
 *
 * Note:
 *
 *  cache/checkpoint后节点不再可流水线
 *
 * @author hanhan.zhang
 * */
public class TransformedDStream<U> extends DStream<U> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformedDStream.class);

    private final DStream<?> parent;

    final TransformFunction<Object, Object> func;

    final DStreamProxy prevDStreamProxy;

    final SerializedMode prevSerializedMode;

    <T> TransformedDStream(DStream<T> parent, TransformFunction<T, U> f) {
        super(null, parent.streamingContext, SerializedMode.Byte);
        this.parent = parent;
        if (parent.isPipelinable()) {
            TransformedDStream<T> prev = (TransformedDStream<T>) parent;
            this.func = new ChainedTransformHelper(prev.func, erase(f));
            this.prevDStreamProxy = prev.prevDStreamProxy;
            this.prevSerializedMode = prev.prevSerializedMode;
            LOGGER.debug("Fuse transformation into pending DStream node");
        } else {
            this.func = erase(f);
            this.prevDStreamProxy = parent.getDStreamProxy();
            this.prevSerializedMode = parent.serializedMode;
        }
    }

    @SuppressWarnings("unchecked")
    private static TransformFunction<Object, Object> erase(TransformFunction<?, ?> f) {
        return (TransformFunction<Object, Object>) f;
    }

    @Override
    public boolean isPipelinable() {
        return !(cached || checkpointed);
    }

    /**
     * 转换不改变滑动间隔, 不触发节点创建
     * */
    @Override
    public long slideDuration() {
        return parent.slideDuration();
    }

    public DStreamProxy getPrevDStreamProxy() {
        return prevDStreamProxy;
    }

    public SerializedMode getPrevSerializedMode() {
        return prevSerializedMode;
    }

    @Override
    public DStreamProxy getDStreamProxy() {
        if (dstreamProxy == null) {
            byte[] funcBytes = serialize(func);
            dstreamProxy = streamingContext.getStreamingContextProxy()
                    .createTransformedDStream(prevDStreamProxy, funcBytes, prevSerializedMode);
            LOGGER.debug("Create transformed DStream, input mode: {}, func size: {} bytes",
                    prevSerializedMode, funcBytes.length);
        }
        return dstreamProxy;
    }

    static class ChainedTransformHelper implements TransformFunction<Object, Object> {

        private final TransformFunction<Object, Object> inner;
        private final TransformFunction<Object, Object> outer;

        ChainedTransformHelper(TransformFunction<Object, Object> inner, TransformFunction<Object, Object> outer) {
            this.inner = inner;
            this.outer = outer;
        }

        @Override
        public RDD<Object> call(long timeMs, RDD<Object> rdd) {
            return outer.call(timeMs, inner.call(timeMs, rdd));
        }
    }
}
