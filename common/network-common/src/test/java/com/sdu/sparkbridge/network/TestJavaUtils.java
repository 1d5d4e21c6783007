package com.sdu.sparkbridge.network;

import com.sdu.sparkbridge.network.utils.IOModel;
import com.sdu.sparkbridge.network.utils.JavaUtils;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

/**
 * @author hanhan.zhang
 * */
public class TestJavaUtils {

    @Test
    public void testTimeString() {
        assert JavaUtils.timeStringAsMs("120s") == 120000;
        assert JavaUtils.timeStringAsMs("100ms") == 100;
        assert JavaUtils.timeStringAsMs("2min") == 120000;
        assert JavaUtils.timeStringAsMs("1500") == 1500;
        assert JavaUtils.timeStringAs("3000ms", TimeUnit.SECONDS) == 3;
        assert JavaUtils.timeStringAsSec("1h") == 3600;
    }

    @Test(expected = NumberFormatException.class)
    public void testInvalidSuffix() {
        JavaUtils.timeStringAsMs("10years");
    }

    @Test
    public void testIOModel() {
        assert IOModel.convert("nio") == IOModel.NIO;
        assert IOModel.convert(null) == IOModel.NIO;
        assert IOModel.convert("Epoll") == IOModel.EPOLL;
    }
}
