package com.sdu.sparkbridge.network.utils;

import static com.sdu.sparkbridge.network.utils.JavaUtils.timeStringAsMs;

/**
 * 网络模块配置, 配置项格式: spark.{module}.{suffix}
 *
 * @author hanhan.zhang
 * */
public class TransportConf {
    /**
     * IO模型[NIO, EPOLL]
     * */
    private final String SPARK_NETWORK_IO_MODE_KEY;
    /**
     * 服务端IO线程数
     * */
    private final String SPARK_NETWORK_IO_SERVER_THREADS_KEY;
    /**
     * 客户端IO线程数
     * */
    private final String SPARK_NETWORK_IO_CLIENT_THREADS_KEY;
    /**
     * 最大连接请求数
     * */
    private final String SPARK_NETWORK_IO_BACKLOG_KEY;
    /**
     * 建立连接超时时间
     * */
    private final String SPARK_NETWORK_IO_CONNECTION_TIMEOUT_KEY;
    /**
     * 单帧最大字节数
     * */
    private final String SPARK_NETWORK_IO_MAX_FRAME_SIZE_KEY;

    private final String module;

    private final ConfigProvider conf;

    public TransportConf(String module, ConfigProvider conf) {
        this.module = module;
        this.conf = conf;
        SPARK_NETWORK_IO_MODE_KEY = getConfKey("io.mode");
        SPARK_NETWORK_IO_SERVER_THREADS_KEY = getConfKey("io.serverThreads");
        SPARK_NETWORK_IO_CLIENT_THREADS_KEY = getConfKey("io.clientThreads");
        SPARK_NETWORK_IO_BACKLOG_KEY = getConfKey("io.backLog");
        SPARK_NETWORK_IO_CONNECTION_TIMEOUT_KEY = getConfKey("io.connectionTimeout");
        SPARK_NETWORK_IO_MAX_FRAME_SIZE_KEY = getConfKey("io.maxFrameSize");
    }

    private String getConfKey(String suffix) {
        return "spark." + module + "." + suffix;
    }

    public String getModuleName() {
        return module;
    }

    public IOModel ioMode() {
        return IOModel.convert(conf.get(SPARK_NETWORK_IO_MODE_KEY, "NIO"));
    }

    public int serverThreads() {
        return conf.getInt(SPARK_NETWORK_IO_SERVER_THREADS_KEY, 0);
    }

    public int clientThreads() {
        return conf.getInt(SPARK_NETWORK_IO_CLIENT_THREADS_KEY, 1);
    }

    public int backLog() {
        return conf.getInt(SPARK_NETWORK_IO_BACKLOG_KEY, -1);
    }

    public int connectionTimeoutMs() {
        return (int) timeStringAsMs(conf.get(SPARK_NETWORK_IO_CONNECTION_TIMEOUT_KEY, "30s"));
    }

    public int maxFrameSize() {
        return conf.getInt(SPARK_NETWORK_IO_MAX_FRAME_SIZE_KEY, Integer.MAX_VALUE);
    }
}
