package com.sdu.sparkbridge.network.client;

import java.nio.ByteBuffer;

/**
 * Rpc响应回调, onSuccess与onFailure仅会调用其中一个且只调用一次
 *
 * @author hanhan.zhang
 * */
public interface RpcResponseCallback {

    /**
     * response在回调返回后会被回收, 需要保留数据时应拷贝
     * */
    void onSuccess(ByteBuffer response);

    void onFailure(Throwable e);

}
