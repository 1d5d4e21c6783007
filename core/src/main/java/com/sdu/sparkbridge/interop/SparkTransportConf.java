package com.sdu.sparkbridge.interop;

import com.sdu.sparkbridge.SparkConf;
import com.sdu.sparkbridge.network.utils.ConfigProvider;
import com.sdu.sparkbridge.network.utils.TransportConf;

import java.util.Map;

/**
 * @author hanhan.zhang
 * */
public class SparkTransportConf {

    public static TransportConf fromSparkConf(SparkConf conf, String module) {
        // 连接超时沿用spark.{module}.connect.timeout
        String connectTimeoutKey = String.format("spark.%s.connect.timeout", module);
        if (conf.contains(connectTimeoutKey)) {
            conf.setIfMissing(String.format("spark.%s.io.connectionTimeout", module), conf.get(connectTimeoutKey));
        }

        return new TransportConf(module, new ConfigProvider() {
            @Override
            public String get(String name) {
                return conf.get(name, null);
            }

            @Override
            public Map<String, String> getAll() {
                return conf.getAll();
            }
        });
    }
}
