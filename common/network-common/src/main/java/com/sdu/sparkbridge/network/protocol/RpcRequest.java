package com.sdu.sparkbridge.network.protocol;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import io.netty.buffer.ByteBuf;

import java.nio.ByteBuffer;

/**
 * 需要响应的请求消息
 *
 * @author hanhan.zhang
 * */
public final class RpcRequest implements RequestMessage {
    /**
     * 映射RpcRequest与RpcResponse关系
     * */
    public final long requestId;

    public final ByteBuffer body;

    public RpcRequest(long requestId, ByteBuffer body) {
        this.requestId = requestId;
        this.body = body;
    }

    @Override
    public Type type() {
        return Type.RpcRequest;
    }

    @Override
    public int encodedLength() {
        // requestId + body
        return 8 + Encoders.ByteBuffers.encodedLength(body);
    }

    @Override
    public void encode(ByteBuf buf) {
        buf.writeLong(requestId);
        Encoders.ByteBuffers.encode(buf, body);
    }

    public static RpcRequest decode(ByteBuf buf) {
        long requestId = buf.readLong();
        return new RpcRequest(requestId, Encoders.ByteBuffers.decode(buf));
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) return true;
        if (object == null || getClass() != object.getClass()) return false;

        RpcRequest that = (RpcRequest) object;
        return requestId == that.requestId && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(requestId, body);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("requestId", requestId)
                .add("bodySize", body.remaining())
                .toString();
    }
}
