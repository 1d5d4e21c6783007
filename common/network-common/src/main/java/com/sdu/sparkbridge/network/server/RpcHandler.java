package com.sdu.sparkbridge.network.server;

import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.TransportClient;

import java.nio.ByteBuffer;

/**
 * 服务端请求处理
 *
 * @author hanhan.zhang
 * */
public abstract class RpcHandler {

    /**
     * Rpc请求处理, 处理结果通过callback返回; 抛出异常时以{@link com.sdu.sparkbridge.network.protocol.RpcFailure}响应
     * */
    public abstract void receive(TransportClient client, ByteBuffer message, RpcResponseCallback callback) throws Exception;

    public void channelActive(TransportClient client) { }

    public void channelInactive(TransportClient client) { }

    public void exceptionCaught(Throwable cause, TransportClient client) { }

}
