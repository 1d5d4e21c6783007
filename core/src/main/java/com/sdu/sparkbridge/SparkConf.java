package com.sdu.sparkbridge;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.Serializable;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

import static com.sdu.sparkbridge.network.utils.JavaUtils.timeStringAs;

/**
 * 应用配置, 键值均为字符串
 *
 * @author hanhan.zhang
 * */
public class SparkConf implements Serializable {

    public static final String SPARK_MASTER = "spark.master";
    public static final String SPARK_APP_NAME = "spark.app.name";
    public static final String SPARK_DEFAULT_PARALLELISM = "spark.default.parallelism";

    public static final String SPARK_BRIDGE_BACKEND_HOST = "spark.bridge.backend.host";
    public static final String SPARK_BRIDGE_BACKEND_PORT = "spark.bridge.backend.port";
    public static final String SPARK_BRIDGE_RPC_TIMEOUT = "spark.bridge.rpc.timeout";
    public static final String SPARK_BRIDGE_CONNECT_TIMEOUT = "spark.bridge.connect.timeout";

    private final Map<String, String> settings = Maps.newConcurrentMap();

    public SparkConf() {
        this(true);
    }

    /**
     * @param loadDefaults 是否加载JVM系统属性中以"spark."开头的配置
     * */
    public SparkConf(boolean loadDefaults) {
        if (loadDefaults) {
            for (String key : System.getProperties().stringPropertyNames()) {
                if (key.startsWith("spark.")) {
                    settings.put(key, System.getProperty(key));
                }
            }
        }
    }

    public SparkConf set(String key, String value) {
        if (key == null) {
            throw new NullPointerException("null key");
        }
        if (value == null) {
            throw new NullPointerException("null value for " + key);
        }
        settings.put(key, value);
        return this;
    }

    public SparkConf setMaster(String master) {
        return set(SPARK_MASTER, master);
    }

    public SparkConf setAppName(String name) {
        return set(SPARK_APP_NAME, name);
    }

    public SparkConf setIfMissing(String key, String value) {
        settings.putIfAbsent(key, value);
        return this;
    }

    public SparkConf remove(String key) {
        settings.remove(key);
        return this;
    }

    public String get(String key) {
        String value = settings.get(key);
        if (value == null) {
            throw new NoSuchElementException(key);
        }
        return value;
    }

    public String get(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public boolean contains(String key) {
        return settings.containsKey(key);
    }

    public long getLong(String key, long defaultValue) {
        return NumberUtils.toLong(settings.get(key), defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return NumberUtils.toInt(settings.get(key), defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = settings.get(key);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    public long getTimeAsMs(String key, String defaultValue) {
        return timeStringAs(get(key, defaultValue), TimeUnit.MILLISECONDS);
    }

    public long getTimeAsSeconds(String key, String defaultValue) {
        return timeStringAs(get(key, defaultValue), TimeUnit.SECONDS);
    }

    public Map<String, String> getAll() {
        return ImmutableMap.copyOf(settings);
    }

    public SparkConf copy() {
        SparkConf conf = new SparkConf(false);
        conf.settings.putAll(settings);
        return conf;
    }

    public String toDebugString() {
        StringBuilder sb = new StringBuilder();
        settings.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> sb.append(entry.getKey()).append("=").append(entry.getValue()).append("\n"));
        return sb.toString();
    }
}
