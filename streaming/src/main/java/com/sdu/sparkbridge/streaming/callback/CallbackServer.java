package com.sdu.sparkbridge.streaming.callback;

import com.google.common.base.Throwables;
import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.interop.JvmBridge;
import com.sdu.sparkbridge.interop.JvmObjectReference;
import com.sdu.sparkbridge.interop.SerDe;
import com.sdu.sparkbridge.network.TransportContext;
import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.server.RpcHandler;
import com.sdu.sparkbridge.network.server.TransportServer;
import com.sdu.sparkbridge.network.utils.TransportConf;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.proxy.ipc.RDDIpcProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * 接收宿主JVM的DStream批次回调, 请求格式同{@link SerDe}
 *
 * +-------------+---------------------------------------------------------------+
 * | methodName  | args                                                          |
 * +-------------+---------------------------------------------------------------+
 * | transform   | func, timeMs, rdd, mode                                       |
 * | transform2  | func, timeMs, rdd, mode, otherRdd, otherMode                  |
 * | foreachRDD  | func, timeMs, rdd, mode                                       |
 * +-------------+---------------------------------------------------------------+
 *
 * rdd为JavaRDD句柄或null, 转换结果以句柄返回; 执行失败以错误响应返回异常栈
 *
 * @author hanhan.zhang
 * */
public class CallbackServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CallbackServer.class);

    private final TransportServer server;

    public CallbackServer(TransportConf conf, JvmBridge jvmBridge, DStreamCallbacks callbacks) {
        TransportContext context = new TransportContext(conf, new CallbackRpcHandler(jvmBridge, callbacks));
        this.server = context.createServer(0);
        LOGGER.info("Callback server started on port {}", server.getPort());
    }

    public int getPort() {
        return server.getPort();
    }

    @Override
    public void close() {
        server.close();
        LOGGER.info("Callback server closed");
    }

    static class CallbackRpcHandler extends RpcHandler {

        private final JvmBridge jvmBridge;

        private final DStreamCallbacks callbacks;

        CallbackRpcHandler(JvmBridge jvmBridge, DStreamCallbacks callbacks) {
            this.jvmBridge = jvmBridge;
            this.callbacks = callbacks;
        }

        @Override
        public void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) {
            SerDe.Call call = SerDe.readCall(message);
            ByteBuffer response;
            try {
                response = SerDe.buildResponse(dispatch(call));
            } catch (RuntimeException e) {
                LOGGER.error("Callback {} failed", call.methodName, e);
                response = SerDe.buildErrorResponse(-1, Throwables.getStackTraceAsString(e));
            }
            callback.onSuccess(response);
        }

        JvmObjectReference dispatch(SerDe.Call call) {
            List<Object> args = call.args;
            switch (call.methodName) {
                case "transform":
                    checkArity(call, 4);
                    return reference(callbacks.transform((byte[]) args.get(0), (Long) args.get(1),
                            rdd(args.get(2)), mode(args.get(3))));
                case "transform2":
                    checkArity(call, 6);
                    return reference(callbacks.transform2((byte[]) args.get(0), (Long) args.get(1),
                            rdd(args.get(2)), mode(args.get(3)), rdd(args.get(4)), mode(args.get(5))));
                case "foreachRDD":
                    checkArity(call, 4);
                    callbacks.foreachRDD((byte[]) args.get(0), (Long) args.get(1), rdd(args.get(2)), mode(args.get(3)));
                    return null;
                default:
                    throw new BridgeException("unknown callback method " + call.methodName);
            }
        }

        private static void checkArity(SerDe.Call call, int expected) {
            if (call.args.size() != expected) {
                throw new BridgeException(String.format("callback %s expects %d args but found %d",
                        call.methodName, expected, call.args.size()));
            }
        }

        private RDDProxy rdd(Object arg) {
            return arg == null ? null : new RDDIpcProxy(jvmBridge, (JvmObjectReference) arg);
        }

        private static SerializedMode mode(Object arg) {
            return SerializedMode.fromString((String) arg);
        }

        private static JvmObjectReference reference(RDDProxy rddProxy) {
            return rddProxy == null ? null : ((RDDIpcProxy) rddProxy).getJvmRddReference();
        }
    }
}
