package com.sdu.sparkbridge.interop;

import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.SparkConf;
import com.sdu.sparkbridge.network.TransportContext;
import com.sdu.sparkbridge.network.client.RpcFailureException;
import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.RpcTimeoutException;
import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.client.TransportClientFactory;
import com.sdu.sparkbridge.network.server.RpcHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;

import static com.sdu.sparkbridge.SparkConf.SPARK_BRIDGE_BACKEND_HOST;
import static com.sdu.sparkbridge.SparkConf.SPARK_BRIDGE_BACKEND_PORT;
import static com.sdu.sparkbridge.SparkConf.SPARK_BRIDGE_RPC_TIMEOUT;

/**
 * 基于Netty的{@link JvmBridge}, 每次调用阻塞等待响应直至spark.bridge.rpc.timeout
 *
 * @author hanhan.zhang
 * */
public class NettyJvmBridge implements JvmBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyJvmBridge.class);

    private static final String MODULE = "bridge";

    private final String host;
    private final int port;
    private final long timeoutMs;

    private final TransportClientFactory clientFactory;

    public NettyJvmBridge(SparkConf conf) {
        this.host = conf.get(SPARK_BRIDGE_BACKEND_HOST, "localhost");
        this.port = conf.getInt(SPARK_BRIDGE_BACKEND_PORT, 5567);
        this.timeoutMs = conf.getTimeAsMs(SPARK_BRIDGE_RPC_TIMEOUT, "120s");
        TransportContext context = new TransportContext(SparkTransportConf.fromSparkConf(conf, MODULE),
                new RejectingRpcHandler());
        this.clientFactory = context.createClientFactory();
        LOGGER.info("JVM bridge targets backend {}:{}, rpc timeout {} ms", host, port, timeoutMs);
    }

    @Override
    public Object callStaticJavaMethod(String className, String methodName, Object... args) {
        return call(true, className, methodName, args);
    }

    @Override
    public Object callNonStaticJavaMethod(JvmObjectReference objectId, String methodName, Object... args) {
        return call(false, objectId.getId(), methodName, args);
    }

    @Override
    public JvmObjectReference callConstructor(String className, Object... args) {
        Object result = call(true, className, SerDe.CONSTRUCTOR, args);
        if (!(result instanceof JvmObjectReference)) {
            throw new BridgeException(String.format("constructor of %s returned %s instead of an object reference",
                    className, result));
        }
        return (JvmObjectReference) result;
    }

    private Object call(boolean isStatic, String target, String methodName, Object[] args) {
        ByteBuffer payload = SerDe.buildPayload(isStatic, target, methodName, args);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Calling JVM method {}.{} with {} args", target, methodName, args.length);
        }
        ByteBuffer response;
        try {
            TransportClient client = clientFactory.createClient(host, port);
            response = client.sendRpcSync(payload, timeoutMs);
        } catch (RpcTimeoutException e) {
            throw new BridgeException(String.format("JVM method %s.%s timed out after %d ms",
                    target, methodName, timeoutMs), e);
        } catch (RpcFailureException e) {
            throw new BridgeException(String.format("JVM backend failed to process %s.%s: %s",
                    target, methodName, e.getMessage()), e);
        } catch (IOException e) {
            LOGGER.error("Failed to call JVM method {}.{} on {}:{}", target, methodName, host, port, e);
            throw new BridgeException(String.format("JVM method %s.%s failed: %s", target, methodName, e.getMessage()), e);
        }
        return SerDe.readResponse(response);
    }

    @Override
    public void close() {
        clientFactory.close();
    }

    /**
     * 客户端不处理宿主JVM主动发起的请求
     * */
    private static class RejectingRpcHandler extends RpcHandler {
        @Override
        public void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) {
            callback.onFailure(new UnsupportedOperationException("bridge client does not serve requests"));
        }
    }
}
