package com.sdu.sparkbridge.utils;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * @author hanhan.zhang
 * */
public class Utils {

    public static final String STACK_PREFIX = "   [STACK] ";

    public static int nonNegativeMod(int x, int mod) {
        int rawMod = x % mod;
        return rawMod + (rawMod < 0 ? mod : 0);
    }

    /**
     * 当前线程调用栈, 每行以"[STACK]"开头
     * */
    public static String currentStackTrace() {
        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        List<String> lines = Lists.newArrayListWithCapacity(elements.length);
        // 跳过getStackTrace与currentStackTrace自身
        for (int i = 2; i < elements.length; ++i) {
            lines.add(STACK_PREFIX + elements[i]);
        }
        return Joiner.on(System.lineSeparator()).join(lines);
    }
}
