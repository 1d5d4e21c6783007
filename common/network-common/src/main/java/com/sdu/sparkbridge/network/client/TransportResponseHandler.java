package com.sdu.sparkbridge.network.client;

import com.google.common.collect.Maps;
import com.sdu.sparkbridge.network.protocol.ResponseMessage;
import com.sdu.sparkbridge.network.protocol.RpcFailure;
import com.sdu.sparkbridge.network.protocol.RpcResponse;
import com.sdu.sparkbridge.network.server.MessageHandler;
import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static com.sdu.sparkbridge.network.utils.NettyUtils.getRemoteAddress;

/**
 * 客户端响应消息处理
 *
 * Note:
 *
 *  连接断开或异常时, 所有未完成请求均以失败结束
 *
 * @author hanhan.zhang
 * */
public class TransportResponseHandler extends MessageHandler<ResponseMessage> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportResponseHandler.class);

    private final Channel channel;

    /**
     * Rpc请求响应回调函数[key = requestId, value = callback]
     * */
    private final Map<Long, RpcResponseCallback> outstandingRpcCalls;

    private final AtomicLong timeOfLastRequestNs;

    public TransportResponseHandler(Channel channel) {
        this.channel = channel;
        this.outstandingRpcCalls = Maps.newConcurrentMap();
        this.timeOfLastRequestNs = new AtomicLong(0);
    }

    public void addRpcRequest(long requestId, RpcResponseCallback callback) {
        updateTimeOfLastRequest();
        outstandingRpcCalls.put(requestId, callback);
    }

    public void removeRpcRequest(long requestId) {
        outstandingRpcCalls.remove(requestId);
    }

    @Override
    public void handle(ResponseMessage message) throws Exception {
        if (message instanceof RpcResponse) {
            RpcResponse resp = (RpcResponse) message;
            RpcResponseCallback listener = outstandingRpcCalls.remove(resp.requestId);
            if (listener != null) {
                listener.onSuccess(resp.body);
            } else {
                LOGGER.warn("Ignoring response for RPC {} from {} ({} bytes) since it is not outstanding",
                        resp.requestId, getRemoteAddress(channel), resp.body.remaining());
            }
        } else if (message instanceof RpcFailure) {
            RpcFailure resp = (RpcFailure) message;
            RpcResponseCallback listener = outstandingRpcCalls.remove(resp.requestId);
            if (listener == null) {
                LOGGER.warn("Ignoring response for RPC {} from {} ({}) since it is not outstanding",
                        resp.requestId, getRemoteAddress(channel), resp.errorString);
            } else {
                listener.onFailure(new RpcFailureException(resp.errorString));
            }
        } else {
            throw new IllegalStateException("Unknown response type: " + message.type());
        }
    }

    @Override
    public void channelActive() {

    }

    @Override
    public void exceptionCaught(Throwable cause) {
        if (numOutstandingRequests() > 0) {
            String remoteAddress = getRemoteAddress(channel);
            LOGGER.error("Still have {} requests outstanding when connection from {} is closed",
                    numOutstandingRequests(), remoteAddress);
            failOutstandingRequests(cause);
        }
    }

    @Override
    public void channelInActive() {
        if (numOutstandingRequests() > 0) {
            String remoteAddress = getRemoteAddress(channel);
            LOGGER.error("Still have {} requests outstanding when connection from {} is closed",
                    numOutstandingRequests(), remoteAddress);
            failOutstandingRequests(new IOException("Connection from " + remoteAddress + " closed"));
        }
    }

    private void failOutstandingRequests(Throwable cause) {
        for (Long requestId : outstandingRpcCalls.keySet()) {
            RpcResponseCallback callback = outstandingRpcCalls.remove(requestId);
            if (callback == null) {
                continue;
            }
            try {
                callback.onFailure(cause);
            } catch (Exception e) {
                LOGGER.warn("RpcResponseCallback.onFailure throws exception", e);
            }
        }
    }

    public void updateTimeOfLastRequest() {
        timeOfLastRequestNs.set(System.nanoTime());
    }

    public long getTimeOfLastRequestNs() {
        return timeOfLastRequestNs.get();
    }

    public int numOutstandingRequests() {
        return outstandingRpcCalls.size();
    }
}
