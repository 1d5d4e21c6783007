package com.sdu.sparkbridge.network.protocol;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import io.netty.buffer.ByteBuf;

import java.nio.ByteBuffer;

/**
 * 服务端对客户端请求响应
 *
 * @author hanhan.zhang
 * */
public final class RpcResponse implements ResponseMessage {

    public final long requestId;

    public final ByteBuffer body;

    public RpcResponse(long requestId, ByteBuffer body) {
        this.requestId = requestId;
        this.body = body;
    }

    @Override
    public Type type() {
        return Type.RpcResponse;
    }

    @Override
    public int encodedLength() {
        return 8 + Encoders.ByteBuffers.encodedLength(body);
    }

    @Override
    public void encode(ByteBuf buf) {
        buf.writeLong(requestId);
        Encoders.ByteBuffers.encode(buf, body);
    }

    public static RpcResponse decode(ByteBuf buf) {
        long requestId = buf.readLong();
        return new RpcResponse(requestId, Encoders.ByteBuffers.decode(buf));
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) return true;
        if (object == null || getClass() != object.getClass()) return false;

        RpcResponse that = (RpcResponse) object;
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
