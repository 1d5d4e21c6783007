package com.sdu.sparkbridge.network.utils;

import com.google.common.base.Strings;

import java.util.Locale;

/**
 * @author hanhan.zhang
 * */
public enum IOModel {

    NIO, EPOLL;

    public static IOModel convert(String name) {
        if (Strings.isNullOrEmpty(name)) {
            return NIO;
        }
        String upper = name.toUpperCase(Locale.ROOT);
        for (IOModel model : IOModel.values()) {
            if (model.name().equals(upper)) {
                return model;
            }
        }
        throw new IllegalArgumentException("Unknown io mode: " + name);
    }
}
