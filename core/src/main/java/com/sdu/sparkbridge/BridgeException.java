package com.sdu.sparkbridge;

/**
 * 与宿主引擎通信失败: 响应缺失或格式错误, 超时, 连接断开
 *
 * @author hanhan.zhang
 * */
public class BridgeException extends SparkException {

    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
