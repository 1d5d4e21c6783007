package com.sdu.sparkbridge.network.client;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.SettableFuture;
import com.sdu.sparkbridge.network.protocol.RpcRequest;
import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.sdu.sparkbridge.network.utils.NettyUtils.getRemoteAddress;

/**
 * 后端服务(JVM Backend)客户端, 线程安全
 *
 * @author hanhan.zhang
 * */
public class TransportClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransportClient.class);

    private final Channel channel;

    private final TransportResponseHandler responseHandler;

    public TransportClient(Channel channel, TransportResponseHandler responseHandler) {
        this.channel = channel;
        this.responseHandler = responseHandler;
    }

    public boolean isActive() {
        return channel.isOpen() && channel.isActive();
    }

    public Channel getChannel() {
        return channel;
    }

    /**
     * 同步发送, 超时后移除未完成请求并抛出{@link RpcTimeoutException}
     * */
    public ByteBuffer sendRpcSync(ByteBuffer message, long timeoutMs) throws IOException {
        final SettableFuture<ByteBuffer> result = SettableFuture.create();

        long requestId = sendRpc(message, new RpcResponseCallback() {
            @Override
            public void onSuccess(ByteBuffer response) {
                ByteBuffer copy = ByteBuffer.allocate(response.remaining());
                copy.put(response);
                // flip "copy" to make it readable
                copy.flip();
                result.set(copy);
            }

            @Override
            public void onFailure(Throwable e) {
                result.setException(e);
            }
        });

        try {
            return result.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause);
        } catch (TimeoutException e) {
            responseHandler.removeRpcRequest(requestId);
            throw new RpcTimeoutException(String.format("RPC %s to %s timed out after %s ms",
                    requestId, getRemoteAddress(channel), timeoutMs), e);
        } catch (InterruptedException e) {
            responseHandler.removeRpcRequest(requestId);
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for RPC " + requestId, e);
        }
    }

    /**
     * 异步发送, 返回请求标识
     * */
    public long sendRpc(ByteBuffer message, RpcResponseCallback callback) {
        long startTime = System.currentTimeMillis();
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Sending RPC to {}", getRemoteAddress(channel));
        }
        long requestId = Math.abs(UUID.randomUUID().getLeastSignificantBits());
        responseHandler.addRpcRequest(requestId, callback);
        channel.writeAndFlush(new RpcRequest(requestId, message))
                .addListener(future -> {
                    if (future.isSuccess()) {
                        long timeTaken = System.currentTimeMillis() - startTime;
                        if (LOGGER.isTraceEnabled()) {
                            LOGGER.trace("Sending request {} to {} took {} ms", requestId,
                                    getRemoteAddress(channel), timeTaken);
                        }
                    } else {
                        String errorMsg = String.format("Failed to send RPC %s to %s: %s", requestId,
                                getRemoteAddress(channel), future.cause());
                        LOGGER.error(errorMsg, future.cause());
                        responseHandler.removeRpcRequest(requestId);
                        channel.close();
                        try {
                            callback.onFailure(new IOException(errorMsg, future.cause()));
                        } catch (Exception e) {
                            LOGGER.error("Uncaught exception in RPC response callback handler!", e);
                        }
                    }
                });
        return requestId;
    }

    @Override
    public void close() {
        // close is a local operation and should finish with milliseconds; timeout just to be safe
        channel.close().awaitUninterruptibly(10, TimeUnit.SECONDS);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("remoteAddress", channel.remoteAddress())
                .add("isActive", isActive())
                .toString();
    }
}
