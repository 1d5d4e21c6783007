package com.sdu.sparkbridge.network.server;

import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.client.TransportResponseHandler;
import com.sdu.sparkbridge.network.protocol.RequestMessage;
import com.sdu.sparkbridge.network.protocol.ResponseMessage;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.sdu.sparkbridge.network.utils.NettyUtils.getRemoteAddress;

/**
 * 连接消息分发: RequestMessage交给{@link TransportRequestHandler}, ResponseMessage交给{@link TransportResponseHandler}
 *
 * @author hanhan.zhang
 * */
public class TransportChannelHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportChannelHandler.class);

    private final TransportClient client;
    private final TransportRequestHandler requestHandler;
    private final TransportResponseHandler responseHandler;

    public TransportChannelHandler(TransportClient client, TransportRequestHandler requestHandler,
                                   TransportResponseHandler responseHandler) {
        this.client = client;
        this.requestHandler = requestHandler;
        this.responseHandler = responseHandler;
    }

    public TransportClient getClient() {
        return client;
    }

    public TransportResponseHandler getResponseHandler() {
        return responseHandler;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        try {
            requestHandler.channelActive();
        } catch (RuntimeException e) {
            LOGGER.error("Exception from request handler while channel is active", e);
        }
        try {
            responseHandler.channelActive();
        } catch (RuntimeException e) {
            LOGGER.error("Exception from response handler while channel is active", e);
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        try {
            requestHandler.channelInActive();
        } catch (RuntimeException e) {
            LOGGER.error("Exception from request handler while channel is inactive", e);
        }
        try {
            responseHandler.channelInActive();
        } catch (RuntimeException e) {
            LOGGER.error("Exception from response handler while channel is inactive", e);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof RequestMessage) {
            requestHandler.handle((RequestMessage) msg);
        } else if (msg instanceof ResponseMessage) {
            responseHandler.handle((ResponseMessage) msg);
        } else {
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        LOGGER.warn("Exception in connection from " + getRemoteAddress(ctx.channel()), cause);
        requestHandler.exceptionCaught(cause);
        responseHandler.exceptionCaught(cause);
        ctx.close();
    }
}
