package com.sdu.sparkbridge.streaming.callback;

import com.sdu.sparkbridge.JobExecutionException;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.streaming.CollectedOutputs;
import com.sdu.sparkbridge.streaming.StreamingTestUnit;
import com.sdu.sparkbridge.streaming.api.function.Transform2Function;
import com.sdu.sparkbridge.streaming.api.function.TransformFunction;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

/**
 * @author hanhan.zhang
 * */
public class TestDStreamCallbacks extends StreamingTestUnit {

    private byte[] serialize(Object func) {
        return sc.serializerInstance().toBytes(func);
    }

    @Test
    public void testTransformOutputIsByteEncoded() {
        DStreamCallbacks callbacks = new DStreamCallbacks(sc);
        RDD<Integer> input = sc.parallelize(Arrays.asList(1, 2, 3), 2);
        TransformFunction<Integer, String> func = (time, rdd) -> rdd.map(x -> time + ":" + x);

        RDDProxy output = callbacks.transform(serialize(func), 5000, input.getRddProxy(), SerializedMode.Byte);
        RDD<String> result = new RDD<>(output, sc, SerializedMode.Byte);
        assert result.collect().equals(Arrays.asList("5000:1", "5000:2", "5000:3"));
    }

    @Test
    public void testTransformAcceptsMissingInput() {
        DStreamCallbacks callbacks = new DStreamCallbacks(sc);
        Transform2Function<Integer, Integer, Integer> func = (time, rdd, other) -> rdd == null ? other : rdd;
        RDD<Integer> other = sc.parallelize(Collections.singletonList(7), 1);

        RDDProxy output = callbacks.transform2(serialize(func), 1000, null, SerializedMode.Byte,
                other.getRddProxy(), SerializedMode.Byte);
        assert new RDD<Integer>(output, sc, SerializedMode.Byte).collect().equals(Collections.singletonList(7));

        TransformFunction<Integer, Integer> nothing = (time, rdd) -> null;
        assert callbacks.transform(serialize(nothing), 1000, null, SerializedMode.Byte) == null;
    }

    @Test
    public void testForeachRDD() {
        DStreamCallbacks callbacks = new DStreamCallbacks(sc);
        RDD<String> input = sc.parallelize(Arrays.asList("x", "y"), 1);
        callbacks.foreachRDD(serialize(CollectedOutputs.collectTo("callback")), 1000, input.getRddProxy(),
                SerializedMode.Byte);
        assert CollectedOutputs.get("callback").equals(Collections.singletonList(Arrays.asList("x", "y")));
    }

    @Test(expected = JobExecutionException.class)
    public void testUserFailurePropagates() {
        DStreamCallbacks callbacks = new DStreamCallbacks(sc);
        RDD<Integer> input = sc.parallelize(Arrays.asList(1, 0), 1);
        TransformFunction<Integer, Integer> func = (time, rdd) -> rdd.map(x -> 10 / x);

        RDDProxy output = callbacks.transform(serialize(func), 1000, input.getRddProxy(), SerializedMode.Byte);
        new RDD<Integer>(output, sc, SerializedMode.Byte).collect();
    }
}
