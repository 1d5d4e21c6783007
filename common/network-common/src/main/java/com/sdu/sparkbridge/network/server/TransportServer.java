package com.sdu.sparkbridge.network.server;

import com.sdu.sparkbridge.network.TransportContext;
import com.sdu.sparkbridge.network.utils.IOModel;
import com.sdu.sparkbridge.network.utils.JavaUtils;
import com.sdu.sparkbridge.network.utils.NettyUtils;
import com.sdu.sparkbridge.network.utils.TransportConf;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * 后端服务Server, 端口为0时绑定随机端口
 *
 * @author hanhan.zhang
 * */
public class TransportServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportServer.class);

    private final TransportContext context;
    private final TransportConf conf;
    private final RpcHandler appRpcHandler;

    private ServerBootstrap bootstrap;
    private ChannelFuture channelFuture;
    private int port = -1;

    public TransportServer(TransportContext context, String hostToBind, int portToBind, RpcHandler appRpcHandler) {
        this.context = context;
        this.conf = context.getConf();
        this.appRpcHandler = appRpcHandler;

        try {
            init(hostToBind, portToBind);
        } catch (RuntimeException e) {
            JavaUtils.closeQuietly(this);
            throw e;
        }
    }

    private void init(String hostToBind, int portToBind) {
        IOModel ioModel = conf.ioMode();
        EventLoopGroup bossGroup =
                NettyUtils.createEventLoop(ioModel, conf.serverThreads(), conf.getModuleName() + "-server");
        EventLoopGroup workerGroup = bossGroup;

        bootstrap = new ServerBootstrap().group(bossGroup, workerGroup)
                .channel(NettyUtils.getServerChannelClass(ioModel))
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);

        if (conf.backLog() > 0) {
            bootstrap.option(ChannelOption.SO_BACKLOG, conf.backLog());
        }

        bootstrap.childHandler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                context.initializePipeline(ch, appRpcHandler);
            }
        });

        InetSocketAddress address = hostToBind == null ?
                new InetSocketAddress(portToBind): new InetSocketAddress(hostToBind, portToBind);
        channelFuture = bootstrap.bind(address);
        channelFuture.syncUninterruptibly();

        port = ((InetSocketAddress) channelFuture.channel().localAddress()).getPort();
        LOGGER.debug("Transport server started on port: {}", port);
    }

    public int getPort() {
        if (port == -1) {
            throw new IllegalStateException("Server not initialized");
        }
        return port;
    }

    @Override
    public void close() {
        if (channelFuture != null) {
            // 本地关闭, 10秒超时
            channelFuture.channel().close().awaitUninterruptibly(10, TimeUnit.SECONDS);
            channelFuture = null;
        }
        if (bootstrap != null && bootstrap.config().group() != null) {
            bootstrap.config().group().shutdownGracefully();
        }
        if (bootstrap != null && bootstrap.config().childGroup() != null) {
            bootstrap.config().childGroup().shutdownGracefully();
        }
        bootstrap = null;
    }
}
