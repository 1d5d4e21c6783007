package com.sdu.sparkbridge;

import com.sdu.sparkbridge.mock.MockSparkContextProxy;
import org.junit.Test;

import java.util.NoSuchElementException;

/**
 * @author hanhan.zhang
 * */
public class TestSparkConf {

    @Test
    public void testGetAndDefaults() {
        SparkConf conf = new SparkConf(false)
                .set("spark.default.parallelism", "8")
                .set("spark.bridge.rpc.timeout", "2min")
                .set("spark.bridge.enabled", "true");

        assert conf.getInt(SparkConf.SPARK_DEFAULT_PARALLELISM, 2) == 8;
        assert conf.getInt("spark.missing", 2) == 2;
        assert conf.getLong("spark.bridge.rpc.timeout", 5L) == 5L;
        assert conf.getTimeAsMs(SparkConf.SPARK_BRIDGE_RPC_TIMEOUT, "120s") == 120000L;
        assert conf.getTimeAsSeconds(SparkConf.SPARK_BRIDGE_CONNECT_TIMEOUT, "30s") == 30L;
        assert conf.getBoolean("spark.bridge.enabled", false);
        assert !conf.getBoolean("spark.bridge.disabled", false);
        assert conf.get("spark.missing", "x").equals("x");
    }

    @Test(expected = NoSuchElementException.class)
    public void testMissingKey() {
        new SparkConf(false).get("spark.missing");
    }

    @Test(expected = NullPointerException.class)
    public void testNullValue() {
        new SparkConf(false).set("spark.master", null);
    }

    @Test
    public void testSetIfMissingAndCopy() {
        SparkConf conf = new SparkConf(false).setMaster("local").setIfMissing("spark.master", "yarn");
        assert conf.get(SparkConf.SPARK_MASTER).equals("local");

        SparkConf copy = conf.copy().remove(SparkConf.SPARK_MASTER);
        assert conf.contains(SparkConf.SPARK_MASTER);
        assert !copy.contains(SparkConf.SPARK_MASTER);
        assert conf.toDebugString().contains("spark.master=local");
    }

    @Test
    public void testLoadSystemProperties() {
        System.setProperty("spark.bridge.test.key", "value");
        try {
            assert new SparkConf().get("spark.bridge.test.key").equals("value");
            assert !new SparkConf(false).contains("spark.bridge.test.key");
        } finally {
            System.clearProperty("spark.bridge.test.key");
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testContextRequiresMaster() {
        new SparkContext(new SparkConf(false).setAppName("test"), new MockSparkContextProxy());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testContextRequiresAppName() {
        new SparkContext(new SparkConf(false).setMaster("local"), new MockSparkContextProxy());
    }

    @Test
    public void testDefaultParallelism() {
        SparkConf conf = new SparkConf(false).setMaster("local").setAppName("test");
        assert new SparkContext(conf, new MockSparkContextProxy()).defaultParallelism() == 2;

        conf.set(SparkConf.SPARK_DEFAULT_PARALLELISM, "5");
        assert new SparkContext(conf, new MockSparkContextProxy()).defaultParallelism() == 5;
    }
}
