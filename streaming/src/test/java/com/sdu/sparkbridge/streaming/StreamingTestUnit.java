package com.sdu.sparkbridge.streaming;

import com.google.common.collect.Lists;
import com.sdu.sparkbridge.SparkTestUnit;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.streaming.dstream.DStream;
import com.sdu.sparkbridge.streaming.mock.MockStreamingContextProxy;
import org.junit.After;
import org.junit.Before;

import java.util.List;

/**
 * 基于进程内流计算引擎的测试基类, 批次间隔1秒
 *
 * @author hanhan.zhang
 * */
public abstract class StreamingTestUnit extends SparkTestUnit {

    protected static final long BATCH_INTERVAL_MS = 1000;

    protected MockStreamingContextProxy streamingProxy;

    protected StreamingContext ssc;

    @Before
    @Override
    public void beforeEach() {
        super.beforeEach();
        streamingProxy = new MockStreamingContextProxy(sc, BATCH_INTERVAL_MS);
        ssc = new StreamingContext(sc, streamingProxy, BATCH_INTERVAL_MS);
        CollectedOutputs.clear();
    }

    @After
    @Override
    public void afterEach() {
        ssc.stop();
        super.afterEach();
    }

    /**
     * 第i个批次的数据为batches[i - 1]
     * */
    protected <T> DStream<T> queueStream(List<List<T>> batches) {
        List<RDDProxy> rdds = Lists.newArrayList();
        for (List<T> batch : batches) {
            rdds.add(sc.parallelize(batch, 2).getRddProxy());
        }
        return new DStream<>(streamingProxy.queueStream(rdds), ssc, SerializedMode.Byte);
    }
}
