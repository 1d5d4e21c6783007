package com.sdu.sparkbridge.network.protocol;

/**
 * 服务端响应消息
 *
 * @author hanhan.zhang
 * */
public interface ResponseMessage extends Message {
}
