package com.sdu.sparkbridge.network;

import com.google.common.collect.ImmutableMap;
import com.sdu.sparkbridge.network.client.RpcFailureException;
import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.RpcTimeoutException;
import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.client.TransportClientFactory;
import com.sdu.sparkbridge.network.server.RpcHandler;
import com.sdu.sparkbridge.network.server.TransportServer;
import com.sdu.sparkbridge.network.utils.MapConfigProvider;
import com.sdu.sparkbridge.network.utils.TransportConf;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @author hanhan.zhang
 * */
public class TestTransportClient {

    private TransportServer server;
    private TransportClientFactory clientFactory;


    @Before
    public void beforeEach() {
        TransportConf conf = new TransportConf("bridge", new MapConfigProvider(
                ImmutableMap.of("spark.bridge.io.connectionTimeout", "5s")));
        RpcHandler handler = new RpcHandler() {
            @Override
            public void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) {
                String request = StandardCharsets.UTF_8.decode(message).toString();
                switch (request) {
                    case "fail":
                        throw new IllegalStateException("backend rejected request");
                    case "hang":
                        // 不响应
                        break;
                    default:
                        callback.onSuccess(ByteBuffer.wrap(("echo:" + request).getBytes(StandardCharsets.UTF_8)));
                }
            }
        };
        TransportContext context = new TransportContext(conf, handler);
        server = context.createServer("localhost", 0);
        clientFactory = context.createClientFactory();
    }

    @Test
    public void testEcho() throws IOException {
        TransportClient client = clientFactory.createClient("localhost", server.getPort());
        ByteBuffer response = client.sendRpcSync(toBuffer("hello"), 5000);
        assert "echo:hello".equals(StandardCharsets.UTF_8.decode(response).toString());
    }

    @Test
    public void testLargeMessage() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100000; ++i) {
            sb.append(i % 10);
        }
        TransportClient client = clientFactory.createClient("localhost", server.getPort());
        ByteBuffer response = client.sendRpcSync(toBuffer(sb.toString()), 5000);
        assert StandardCharsets.UTF_8.decode(response).toString().equals("echo:" + sb);
    }

    @Test
    public void testClientReused() throws IOException {
        TransportClient first = clientFactory.createClient("localhost", server.getPort());
        TransportClient second = clientFactory.createClient("localhost", server.getPort());
        assert first == second;
    }

    @Test
    public void testRemoteFailure() throws IOException {
        TransportClient client = clientFactory.createClient("localhost", server.getPort());
        try {
            client.sendRpcSync(toBuffer("fail"), 5000);
            assert false : "RpcFailureException expected";
        } catch (RpcFailureException e) {
            assert e.getMessage().contains("backend rejected request");
        }
    }

    @Test(expected = RpcTimeoutException.class)
    public void testTimeout() throws IOException {
        TransportClient client = clientFactory.createClient("localhost", server.getPort());
        client.sendRpcSync(toBuffer("hang"), 200);
    }

    @Test
    public void testServerCloseFailsOutstandingRequest() throws Exception {
        TransportClient client = clientFactory.createClient("localhost", server.getPort());
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        client.sendRpc(toBuffer("hang"), new RpcResponseCallback() {
            @Override
            public void onSuccess(ByteBuffer response) {
                latch.countDown();
            }

            @Override
            public void onFailure(Throwable e) {
                failure.set(e);
                latch.countDown();
            }
        });

        // 等待请求到达服务端
        Thread.sleep(200);
        client.close();

        assert latch.await(5, TimeUnit.SECONDS);
        assert failure.get() instanceof IOException;
    }

    @Test(expected = IOException.class)
    public void testConnectRefused() throws IOException {
        int port = server.getPort();
        server.close();
        server = null;
        clientFactory.createClient("localhost", port);
    }

    private static ByteBuffer toBuffer(String message) {
        return ByteBuffer.wrap(message.getBytes(StandardCharsets.UTF_8));
    }

    @After
    public void afterEach() {
        clientFactory.close();
        if (server != null) {
            server.close();
        }
    }
}
