package com.sdu.sparkbridge.network.client;

import java.io.IOException;

/**
 * 服务端处理Rpc请求失败, message为服务端返回的错误信息
 *
 * @author hanhan.zhang
 * */
public class RpcFailureException extends IOException {

    public RpcFailureException(String message) {
        super(message);
    }
}
