package com.sdu.sparkbridge.network.utils;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @author hanhan.zhang
 * */
public class JavaUtils {

    private static final Logger LOGGER = LoggerFactory.getLogger(JavaUtils.class);

    private static final Pattern TIME_STRING = Pattern.compile("(-?[0-9]+)([a-z]+)?");

    private static final Map<String, TimeUnit> TIME_SUFFIXES = ImmutableMap.<String, TimeUnit>builder()
            .put("us", TimeUnit.MICROSECONDS)
            .put("ms", TimeUnit.MILLISECONDS)
            .put("s", TimeUnit.SECONDS)
            .put("m", TimeUnit.MINUTES)
            .put("min", TimeUnit.MINUTES)
            .put("h", TimeUnit.HOURS)
            .put("d", TimeUnit.DAYS)
            .build();

    public static void closeQuietly(Closeable closeable) {
        try {
            if (closeable != null) {
                closeable.close();
            }
        } catch (IOException e) {
            LOGGER.error("IOException should not have been thrown.", e);
        }
    }

    /**
     * 时间字符串转换, 如: 100ms, 30s, 2min; 无单位时按unit处理
     * */
    public static long timeStringAs(String str, TimeUnit unit) {
        String lower = str.toLowerCase(Locale.ROOT).trim();

        Matcher m = TIME_STRING.matcher(lower);
        if (!m.matches()) {
            throw new NumberFormatException("Failed to parse time string: " + str);
        }

        long val = Long.parseLong(m.group(1));
        String suffix = m.group(2);

        if (suffix != null && !TIME_SUFFIXES.containsKey(suffix)) {
            throw new NumberFormatException("Invalid suffix: \"" + suffix + "\"");
        }

        return unit.convert(val, suffix != null ? TIME_SUFFIXES.get(suffix) : unit);
    }

    public static long timeStringAsMs(String str) {
        return timeStringAs(str, TimeUnit.MILLISECONDS);
    }

    public static long timeStringAsSec(String str) {
        return timeStringAs(str, TimeUnit.SECONDS);
    }
}
