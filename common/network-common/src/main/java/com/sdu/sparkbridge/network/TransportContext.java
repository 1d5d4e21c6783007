package com.sdu.sparkbridge.network;

import com.sdu.sparkbridge.network.client.TransportClient;
import com.sdu.sparkbridge.network.client.TransportClientFactory;
import com.sdu.sparkbridge.network.client.TransportResponseHandler;
import com.sdu.sparkbridge.network.protocol.MessageDecoder;
import com.sdu.sparkbridge.network.protocol.MessageEncoder;
import com.sdu.sparkbridge.network.server.RpcHandler;
import com.sdu.sparkbridge.network.server.TransportChannelHandler;
import com.sdu.sparkbridge.network.server.TransportRequestHandler;
import com.sdu.sparkbridge.network.server.TransportServer;
import com.sdu.sparkbridge.network.utils.TransportConf;
import com.sdu.sparkbridge.network.utils.TransportFrameDecoder;
import io.netty.channel.Channel;
import io.netty.channel.socket.SocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportContext}负责创建{@link TransportServer}和{@link TransportClientFactory}
 *
 * @author hanhan.zhang
 * */
public class TransportContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportContext.class);

    private final TransportConf conf;
    private final RpcHandler rpcHandler;

    /**
     * RpcMessage编码/解码
     * */
    private static final MessageEncoder ENCODER = MessageEncoder.INSTANCE;
    private static final MessageDecoder DECODER = MessageDecoder.INSTANCE;

    public TransportContext(TransportConf conf, RpcHandler rpcHandler) {
        this.conf = conf;
        this.rpcHandler = rpcHandler;
    }

    public TransportClientFactory createClientFactory() {
        return new TransportClientFactory(this);
    }

    public TransportServer createServer(int port) {
        return createServer(null, port);
    }

    public TransportServer createServer(String host, int port) {
        return new TransportServer(this, host, port, rpcHandler);
    }

    public TransportConf getConf() {
        return conf;
    }

    public TransportChannelHandler initializePipeline(SocketChannel channel) {
        return initializePipeline(channel, rpcHandler);
    }

    /**
     * 初始化ChannelHandler
     * */
    public TransportChannelHandler initializePipeline(SocketChannel channel, RpcHandler channelRpcHandler) {
        try {
            TransportChannelHandler channelHandler = createChannelHandler(channel, channelRpcHandler);
            channel.pipeline()
                    .addLast("encoder", ENCODER)
                    .addLast(TransportFrameDecoder.HANDLER_NAME, new TransportFrameDecoder(conf.maxFrameSize()))
                    .addLast("decoder", DECODER)
                    .addLast("handler", channelHandler);
            return channelHandler;
        } catch (RuntimeException e) {
            LOGGER.error("Error while initializing Netty pipeline", e);
            throw e;
        }
    }

    private TransportChannelHandler createChannelHandler(Channel channel, RpcHandler rpcHandler) {
        TransportResponseHandler responseHandler = new TransportResponseHandler(channel);
        TransportClient client = new TransportClient(channel, responseHandler);
        TransportRequestHandler requestHandler = new TransportRequestHandler(channel, client, rpcHandler);
        return new TransportChannelHandler(client, requestHandler, responseHandler);
    }
}
