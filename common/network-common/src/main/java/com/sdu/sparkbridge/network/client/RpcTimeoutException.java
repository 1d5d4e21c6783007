package com.sdu.sparkbridge.network.client;

import java.io.IOException;

/**
 * @author hanhan.zhang
 * */
public class RpcTimeoutException extends IOException {

    public RpcTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
