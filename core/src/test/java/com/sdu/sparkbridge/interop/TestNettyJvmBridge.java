package com.sdu.sparkbridge.interop;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.JobExecutionException;
import com.sdu.sparkbridge.SparkConf;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.network.TransportContext;
import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.server.RpcHandler;
import com.sdu.sparkbridge.network.server.TransportServer;
import com.sdu.sparkbridge.network.utils.MapConfigProvider;
import com.sdu.sparkbridge.network.utils.TransportConf;
import com.sdu.sparkbridge.rdd.PairRDDFunctions;
import com.sdu.sparkbridge.rdd.RDD;
import com.sdu.sparkbridge.utils.scala.Tuple2;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 以脚本化的宿主JVM后端验证桥接调用
 *
 * @author hanhan.zhang
 * */
public class TestNettyJvmBridge {

    private TransportServer server;

    private List<SerDe.Call> calls;

    private SparkConf conf;

    @Before
    public void beforeEach() {
        calls = Collections.synchronizedList(Lists.newArrayList());
        AtomicInteger objectIds = new AtomicInteger(0);
        RpcHandler backend = new RpcHandler() {
            @Override
            public void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) {
                SerDe.Call call = SerDe.readCall(message);
                calls.add(call);
                switch (call.methodName) {
                    case SerDe.CONSTRUCTOR:
                        callback.onSuccess(SerDe.buildResponse(new JvmObjectReference("obj-" + objectIds.incrementAndGet())));
                        break;
                    case "echo":
                        callback.onSuccess(SerDe.buildResponse(call.args));
                        break;
                    case "fail":
                        callback.onSuccess(SerDe.buildErrorResponse(-1, "java.lang.IllegalStateException: job aborted"));
                        break;
                    case "reject":
                        throw new IllegalStateException("unsupported method");
                    case "hang":
                        break;
                    case "count":
                        callback.onSuccess(SerDe.buildResponse(3L));
                        break;
                    case "defaultParallelism":
                        callback.onSuccess(SerDe.buildResponse(4));
                        break;
                    case "set":
                    case "stop":
                    case "setCheckpointDir":
                        callback.onSuccess(SerDe.buildResponse(null));
                        break;
                    default:
                        // 其余调用均返回新对象
                        callback.onSuccess(SerDe.buildResponse(new JvmObjectReference("obj-" + objectIds.incrementAndGet())));
                }
            }
        };
        TransportConf transportConf = new TransportConf("bridge", new MapConfigProvider(ImmutableMap.of()));
        server = new TransportContext(transportConf, backend).createServer("localhost", 0);

        conf = new SparkConf(false)
                .setMaster("local[2]")
                .setAppName("bridge-test")
                .set(SparkConf.SPARK_BRIDGE_BACKEND_HOST, "localhost")
                .set(SparkConf.SPARK_BRIDGE_BACKEND_PORT, String.valueOf(server.getPort()))
                .set(SparkConf.SPARK_BRIDGE_RPC_TIMEOUT, "2s");
    }

    @After
    public void afterEach() {
        server.close();
    }

    @Test
    public void testCallRoundTrip() {
        try (NettyJvmBridge bridge = new NettyJvmBridge(conf)) {
            JvmObjectReference ref = bridge.callConstructor("java.util.ArrayList");
            assert ref.getId().equals("obj-1");

            Object echoed = bridge.callNonStaticJavaMethod(ref, "echo", 1, "two", 3L);
            assert echoed.equals(Arrays.asList(1, "two", 3L));

            SerDe.Call last = calls.get(calls.size() - 1);
            assert !last.isStatic;
            assert last.target.equals("obj-1");
        }
    }

    @Test
    public void testRemoteFailure() {
        try (NettyJvmBridge bridge = new NettyJvmBridge(conf)) {
            bridge.callStaticJavaMethod("org.apache.spark.Job", "fail");
            assert false : "remote failure expected";
        } catch (JobExecutionException e) {
            assert e.getMessage().contains("job aborted");
        }
    }

    @Test(expected = BridgeException.class)
    public void testBackendRejectsRequest() {
        try (NettyJvmBridge bridge = new NettyJvmBridge(conf)) {
            bridge.callStaticJavaMethod("org.apache.spark.Job", "reject");
        }
    }

    @Test(expected = BridgeException.class)
    public void testTimeout() {
        conf.set(SparkConf.SPARK_BRIDGE_RPC_TIMEOUT, "200ms");
        try (NettyJvmBridge bridge = new NettyJvmBridge(conf)) {
            bridge.callStaticJavaMethod("org.apache.spark.Job", "hang");
        }
    }

    @Test(expected = BridgeException.class)
    public void testBackendUnavailable() {
        int port = server.getPort();
        server.close();
        conf.set(SparkConf.SPARK_BRIDGE_BACKEND_PORT, String.valueOf(port));
        try (NettyJvmBridge bridge = new NettyJvmBridge(conf)) {
            bridge.callStaticJavaMethod("org.apache.spark.Job", "count");
        }
    }

    @Test
    public void testSparkContextOverBridge() {
        SparkContext sc = new SparkContext(conf);

        // SparkConf构造, 逐项set, JavaSparkContext构造
        assert calls.get(0).target.equals("org.apache.spark.SparkConf");
        assert calls.get(0).methodName.equals(SerDe.CONSTRUCTOR);
        long sets = calls.stream().filter(call -> call.methodName.equals("set")).count();
        assert sets == conf.getAll().size();
        SerDe.Call context = calls.stream()
                .filter(call -> call.target.equals("org.apache.spark.api.java.JavaSparkContext"))
                .findFirst().get();
        assert context.args.get(0).equals(new JvmObjectReference("obj-1"));

        RDD<String> rdd = sc.parallelize(Arrays.asList("a", "b"), 2);
        assert sc.defaultParallelism() == 4;

        RDD<Tuple2<String, Integer>> pairs = rdd.map(s -> new Tuple2<>(s, 1));
        RDD<Tuple2<String, Integer>> shuffled = PairRDDFunctions.of(pairs).partitionBy(3);
        assert shuffled.getRddProxy() != null;

        SerDe.Call partitioner = calls.stream()
                .filter(call -> call.target.equals("org.apache.spark.api.python.PythonPartitioner"))
                .findFirst().get();
        assert partitioner.args.equals(Arrays.asList(3, 0L));

        assert rdd.count() == 3L;

        sc.stop();
        assert calls.get(calls.size() - 1).methodName.equals("stop");
    }
}
