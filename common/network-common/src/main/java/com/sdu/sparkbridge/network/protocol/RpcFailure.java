package com.sdu.sparkbridge.network.protocol;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import io.netty.buffer.ByteBuf;

/**
 * 服务端处理请求失败
 *
 * @author hanhan.zhang
 * */
public final class RpcFailure implements ResponseMessage {

    public final long requestId;

    public final String errorString;

    public RpcFailure(long requestId, String errorString) {
        this.requestId = requestId;
        this.errorString = errorString;
    }

    @Override
    public Type type() {
        return Type.RpcFailure;
    }

    @Override
    public int encodedLength() {
        return 8 + Encoders.Strings.encodedLength(errorString);
    }

    @Override
    public void encode(ByteBuf buf) {
        buf.writeLong(requestId);
        Encoders.Strings.encode(buf, errorString);
    }

    public static RpcFailure decode(ByteBuf buf) {
        long requestId = buf.readLong();
        String errorString = Encoders.Strings.decode(buf);
        return new RpcFailure(requestId, errorString);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) return true;
        if (object == null || getClass() != object.getClass()) return false;

        RpcFailure that = (RpcFailure) object;
        return requestId == that.requestId && errorString.equals(that.errorString);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(requestId, errorString);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("requestId", requestId)
                .add("errorString", errorString)
                .toString();
    }
}
