package com.sdu.sparkbridge.network.utils;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * @author hanhan.zhang
 * */
public class MapConfigProvider extends ConfigProvider {

    public static final MapConfigProvider EMPTY = new MapConfigProvider(ImmutableMap.of());

    private final Map<String, String> config;

    public MapConfigProvider(Map<String, String> config) {
        this.config = ImmutableMap.copyOf(config);
    }

    @Override
    public String get(String name) {
        return config.get(name);
    }

    @Override
    public Map<String, String> getAll() {
        return config;
    }
}
