package com.sdu.sparkbridge.serializer;

/**
 * 分区元素在线路上的编码方式
 *
 * None: 原始字节, 不做转换
 *
 * String: UTF-8文本
 *
 * Byte: Java序列化对象
 *
 * Pair: 连续两条记录组成一个键值对, 键与值分别为Java序列化对象
 *
 * Row: Java序列化的Object[]
 *
 * @author hanhan.zhang
 * */
public enum SerializedMode {

    None, String, Byte, Pair, Row;

    public static SerializedMode fromString(java.lang.String name) {
        for (SerializedMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown serialized mode: " + name);
    }
}
