package com.sdu.sparkbridge.network.server;

import com.google.common.base.Throwables;
import com.sdu.sparkbridge.network.client.RpcResponseCallback;
import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.protocol.Encodable;
import com.sdu.sparkbridge.network.protocol.RequestMessage;
import com.sdu.sparkbridge.network.protocol.RpcFailure;
import com.sdu.sparkbridge.network.protocol.RpcRequest;
import com.sdu.sparkbridge.network.protocol.RpcResponse;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.ByteBuffer;

import static com.sdu.sparkbridge.network.utils.NettyUtils.getRemoteAddress;

/**
 * {@link RpcRequest}消息处理
 *
 * @author hanhan.zhang
 * */
public class TransportRequestHandler extends MessageHandler<RequestMessage> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportRequestHandler.class);

    private final Channel channel;
    private final TransportClient reverseClient;

    // 消息处理接口
    private final RpcHandler rpcHandler;

    public TransportRequestHandler(Channel channel, TransportClient reverseClient, RpcHandler rpcHandler) {
        this.channel = channel;
        this.reverseClient = reverseClient;
        this.rpcHandler = rpcHandler;
    }

    @Override
    public void handle(RequestMessage message) throws Exception {
        if (message instanceof RpcRequest) {
            processRpcRequest((RpcRequest) message);
        } else {
            throw new IllegalArgumentException("Unknown request type: " + message.type());
        }
    }

    @Override
    public void channelActive() {
        rpcHandler.channelActive(reverseClient);
    }

    @Override
    public void exceptionCaught(Throwable cause) {
        rpcHandler.exceptionCaught(cause, reverseClient);
    }

    @Override
    public void channelInActive() {
        rpcHandler.channelInactive(reverseClient);
    }

    private void processRpcRequest(RpcRequest req) {
        try {
            rpcHandler.receive(reverseClient, req.body, new RpcResponseCallback() {
                @Override
                public void onSuccess(ByteBuffer response) {
                    respond(new RpcResponse(req.requestId, response));
                }

                @Override
                public void onFailure(Throwable e) {
                    respond(new RpcFailure(req.requestId, Throwables.getStackTraceAsString(e)));
                }
            });
        } catch (Exception e) {
            LOGGER.error("Error while invoking RpcHandler#receive() on RPC id {}", req.requestId, e);
            respond(new RpcFailure(req.requestId, Throwables.getStackTraceAsString(e)));
        }
    }

    /**
     * 响应Rpc请求
     * */
    private ChannelFuture respond(Encodable result) {
        SocketAddress remoteAddress = channel.remoteAddress();
        return channel.writeAndFlush(result).addListener(future -> {
            if (future.isSuccess()) {
                LOGGER.trace("Sent result {} to client {}", result, remoteAddress);
            } else {
                LOGGER.error(String.format("Error sending result %s to %s; closing connection",
                        result, getRemoteAddress(channel)), future.cause());
                channel.close();
            }
        });
    }
}
