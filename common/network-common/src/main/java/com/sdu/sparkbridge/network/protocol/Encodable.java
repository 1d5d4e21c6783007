package com.sdu.sparkbridge.network.protocol;

import io.netty.buffer.ByteBuf;

/**
 * @author hanhan.zhang
 * */
public interface Encodable {

    /** 编码后字节数 */
    int encodedLength();

    void encode(ByteBuf buf);

}
