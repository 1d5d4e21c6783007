package com.sdu.sparkbridge.streaming.proxy.ipc;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.sdu.sparkbridge.JobExecutionException;
import com.sdu.sparkbridge.SparkConf;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.interop.JvmObjectReference;
import com.sdu.sparkbridge.interop.SerDe;
import com.sdu.sparkbridge.network.TransportContext;
import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.client.TransportClientFactory;
import com.sdu.sparkbridge.network.server.RpcHandler;
import com.sdu.sparkbridge.network.server.TransportServer;
import com.sdu.sparkbridge.network.utils.MapConfigProvider;
import com.sdu.sparkbridge.network.utils.TransportConf;
import com.sdu.sparkbridge.streaming.StreamingContext;
import com.sdu.sparkbridge.streaming.api.function.ForeachRDDFunction;
import com.sdu.sparkbridge.streaming.api.function.TransformFunction;
import com.sdu.sparkbridge.streaming.dstream.DStream;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 以脚本化的宿主JVM后端验证StreamingContext桥接调用与批次回调
 *
 * @author hanhan.zhang
 * */
public class TestStreamingContextIpcProxy {

    private static final List<Long> CALLBACK_TIMES = new CopyOnWriteArrayList<>();

    private TransportServer server;

    private List<SerDe.Call> calls;

    private SparkContext sc;

    @Before
    public void beforeEach() {
        CALLBACK_TIMES.clear();
        calls = Collections.synchronizedList(Lists.newArrayList());
        AtomicInteger objectIds = new AtomicInteger(0);
        RpcHandler backend = new RpcHandler() {
            @Override
            public void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) {
                SerDe.Call call = SerDe.readCall(message);
                calls.add(call);
                switch (call.methodName) {
                    case "milliseconds":
                        callback.onSuccess(SerDe.buildResponse(1000L));
                        break;
                    case "awaitTerminationOrTimeout":
                        callback.onSuccess(SerDe.buildResponse(true));
                        break;
                    case "set":
                    case "start":
                    case "stop":
                    case "connectCallback":
                        callback.onSuccess(SerDe.buildResponse(null));
                        break;
                    default:
                        callback.onSuccess(SerDe.buildResponse(new JvmObjectReference("obj-" + objectIds.incrementAndGet())));
                }
            }
        };
        TransportConf transportConf = new TransportConf("bridge", new MapConfigProvider(ImmutableMap.of()));
        server = new TransportContext(transportConf, backend).createServer("localhost", 0);

        SparkConf conf = new SparkConf(false)
                .setMaster("local[2]")
                .setAppName("streaming-bridge-test")
                .set(SparkConf.SPARK_BRIDGE_BACKEND_HOST, "localhost")
                .set(SparkConf.SPARK_BRIDGE_BACKEND_PORT, String.valueOf(server.getPort()))
                .set(SparkConf.SPARK_BRIDGE_RPC_TIMEOUT, "2s");
        sc = new SparkContext(conf);
    }

    @After
    public void afterEach() {
        sc.stop();
        server.close();
    }

    private SerDe.Call lastCall(String methodName) {
        synchronized (calls) {
            for (int i = calls.size() - 1; i >= 0; --i) {
                if (calls.get(i).methodName.equals(methodName)) {
                    return calls.get(i);
                }
            }
        }
        throw new AssertionError("no call to " + methodName);
    }

    private Object callback(int port, String methodName, Object... args) throws Exception {
        TransportConf clientConf = new TransportConf("callback", new MapConfigProvider(ImmutableMap.of()));
        RpcHandler noop = new RpcHandler() {
            @Override
            public void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) {
                throw new UnsupportedOperationException("client side");
            }
        };
        try (TransportClientFactory factory = new TransportContext(clientConf, noop).createClientFactory()) {
            TransportClient client = factory.createClient("localhost", port);
            ByteBuffer payload = SerDe.buildPayload(false, "callback", methodName, args);
            return SerDe.readResponse(client.sendRpcSync(payload, 2000));
        }
    }

    @Test
    public void testStreamingContextOverBridge() {
        StreamingContext ssc = new StreamingContext(sc, 1000);

        assert calls.stream().anyMatch(call -> call.target.equals(StreamingContextIpcProxy.JAVA_STREAMING_CONTEXT_CLASS));
        assert calls.stream().anyMatch(call -> call.target.equals(StreamingContextIpcProxy.DURATION_CLASS)
                && call.args.equals(Collections.singletonList(1000L)));
        assert (Integer) lastCall("connectCallback").args.get(0) > 0;

        DStream<String> lines = ssc.socketTextStream("localhost", 9999);
        assert lines.slideDuration() == 1000;

        lines.window(2000, 1000);
        assert lastCall("window").args.size() == 2;

        ssc.start();
        assert ssc.awaitTerminationOrTimeout(100);
        ssc.stop();
        assert lastCall("stop").args.equals(Collections.singletonList(false));
    }

    @Test
    public void testCallbackRoundTrip() throws Exception {
        StreamingContext ssc = new StreamingContext(sc, 1000);
        int port = (Integer) lastCall("connectCallback").args.get(0);
        try {
            ForeachRDDFunction<String> record = (time, rdd) -> CALLBACK_TIMES.add(time);
            byte[] func = sc.serializerInstance().toBytes(record);
            assert callback(port, "foreachRDD", func, 3000L, null, "Byte") == null;
            assert CALLBACK_TIMES.equals(Collections.singletonList(3000L));

            TransformFunction<String, String> nothing = (time, rdd) -> null;
            byte[] transform = sc.serializerInstance().toBytes(nothing);
            assert callback(port, "transform", transform, 3000L, null, "Byte") == null;
        } finally {
            ssc.stop();
        }
    }

    @Test
    public void testCallbackFailureReturnsError() throws Exception {
        StreamingContext ssc = new StreamingContext(sc, 1000);
        int port = (Integer) lastCall("connectCallback").args.get(0);
        try {
            callback(port, "unknownCallback");
            assert false : "unknown callback must fail";
        } catch (JobExecutionException e) {
            assert e.getMessage().contains("unknown callback method");
        } finally {
            ssc.stop();
        }
    }
}
