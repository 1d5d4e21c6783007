package com.sdu.sparkbridge.network.client;

import com.sdu.sparkbridge.network.TransportContext;
import com.sdu.sparkbridge.network.server.TransportChannelHandler;
import com.sdu.sparkbridge.network.utils.JavaUtils;
import com.sdu.sparkbridge.network.utils.NettyUtils;
import com.sdu.sparkbridge.network.utils.TransportConf;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 客户端工厂, 每个服务端地址缓存一个连接
 *
 * @author hanhan.zhang
 * */
public class TransportClientFactory implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportClientFactory.class);

    private final TransportContext context;
    private final TransportConf conf;

    /**
     * 服务端连接[key = 服务端地址, value = 连接]
     * */
    private final ConcurrentHashMap<InetSocketAddress, TransportClient> connectionPool;

    /**
     * 多个客户端共用
     * */
    private EventLoopGroup workerGroup;
    private final Class<? extends Channel> socketChannelClass;

    public TransportClientFactory(TransportContext context) {
        this.context = context;
        this.conf = context.getConf();
        this.connectionPool = new ConcurrentHashMap<>();
        this.socketChannelClass = NettyUtils.getClientChannelClass(conf.ioMode());
        this.workerGroup = NettyUtils.createEventLoop(conf.ioMode(), conf.clientThreads(),
                conf.getModuleName() + "-client");
    }

    /**
     * 创建连接
     *
     * 1: 先在连接池中取
     *
     * 2: 连接池中不存在或连接失效, 则创建连接
     * */
    public TransportClient createClient(String remoteHost, int remotePort) throws IOException {
        final InetSocketAddress unresolved = InetSocketAddress.createUnresolved(remoteHost, remotePort);
        TransportClient client = connectionPool.get(unresolved);
        if (client != null && client.isActive()) {
            return client;
        }

        synchronized (this) {
            client = connectionPool.get(unresolved);
            if (client != null && client.isActive()) {
                return client;
            }
            final long preResolveHost = System.nanoTime();
            final InetSocketAddress resolvedAddress = new InetSocketAddress(remoteHost, remotePort);
            final long hostResolveTimeMs = (System.nanoTime() - preResolveHost) / 1000000;
            if (hostResolveTimeMs > 2000) {
                LOGGER.warn("DNS resolution for {} took {} ms", resolvedAddress, hostResolveTimeMs);
            } else {
                LOGGER.trace("DNS resolution for {} took {} ms", resolvedAddress, hostResolveTimeMs);
            }
            client = createClient(resolvedAddress);
            connectionPool.put(unresolved, client);
            return client;
        }
    }

    private TransportClient createClient(InetSocketAddress address) throws IOException {
        if (workerGroup == null) {
            throw new IOException("TransportClientFactory already closed");
        }
        LOGGER.debug("Creating new connection to {}", address);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(socketChannelClass)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, conf.connectionTimeoutMs())
                .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);

        final AtomicReference<TransportClient> clientRef = new AtomicReference<>();

        bootstrap.handler(new ChannelInitializer<SocketChannel>() {
            @Override
            public void initChannel(SocketChannel ch) {
                TransportChannelHandler clientHandler = context.initializePipeline(ch);
                clientRef.set(clientHandler.getClient());
            }
        });

        long preConnect = System.nanoTime();
        ChannelFuture cf = bootstrap.connect(address);
        try {
            if (!cf.await(conf.connectionTimeoutMs())) {
                throw new IOException(String.format("Connecting to %s timed out (%s ms)",
                        address, conf.connectionTimeoutMs()));
            } else if (cf.cause() != null) {
                throw new IOException(String.format("Failed to connect to %s", address), cf.cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException(String.format("Interrupted while connecting to %s", address), e);
        }

        TransportClient client = clientRef.get();
        assert client != null : "Channel future completed successfully with null client";

        LOGGER.info("Successfully created connection to {} after {} ms",
                address, (System.nanoTime() - preConnect) / 1000000);
        return client;
    }

    @Override
    public void close() {
        for (TransportClient client : connectionPool.values()) {
            JavaUtils.closeQuietly(client);
        }
        connectionPool.clear();

        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }
}
