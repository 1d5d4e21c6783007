package com.sdu.sparkbridge.network.protocol;

/**
 * 客户端请求消息
 *
 * @author hanhan.zhang
 * */
public interface RequestMessage extends Message {
}
