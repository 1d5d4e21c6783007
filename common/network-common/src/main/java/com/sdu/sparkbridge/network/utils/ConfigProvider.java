package com.sdu.sparkbridge.network.utils;

import org.apache.commons.lang3.math.NumberUtils;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 网络层配置来源, 与上层配置(SparkConf)解耦
 *
 * @author hanhan.zhang
 * */
public abstract class ConfigProvider {

    public abstract String get(String name);

    public abstract Map<String, String> getAll();

    public String get(String name, String defaultValue) {
        String value = get(name);
        return value == null ? defaultValue : value;
    }

    public int getInt(String name, int defaultValue) {
        return NumberUtils.toInt(get(name), defaultValue);
    }

    public long getLong(String name, long defaultValue) {
        return NumberUtils.toLong(get(name), defaultValue);
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        String value = get(name);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    public String getRequired(String name) {
        String value = get(name);
        if (value == null) {
            throw new NoSuchElementException(name);
        }
        return value;
    }
}
