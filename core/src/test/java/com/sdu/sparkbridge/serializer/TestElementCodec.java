package com.sdu.sparkbridge.serializer;

import com.google.common.collect.Lists;
import com.sdu.sparkbridge.SparkException;
import com.sdu.sparkbridge.utils.scala.Tuple2;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * @author hanhan.zhang
 * */
public class TestElementCodec {

    private final SerializerInstance serializer = new JavaSerializer().newInstance();

    private final ElementCodec codec = new ElementCodec(serializer);

    @Test
    public void testStringMode() {
        List<byte[]> records = Lists.newArrayList(codec.encode(SerializedMode.String, Arrays.asList("中文", 12).iterator()));
        assert new String(records.get(0), StandardCharsets.UTF_8).equals("中文");
        assert new String(records.get(1), StandardCharsets.UTF_8).equals("12");

        List<Object> decoded = Lists.newArrayList(codec.decode(SerializedMode.String, records.iterator()));
        assert decoded.equals(Arrays.asList("中文", "12"));
    }

    @Test
    public void testPairModeUsesTwoRecordsPerElement() {
        List<byte[]> records = Lists.newArrayList(codec.encode(SerializedMode.Pair,
                Arrays.asList(new Tuple2<>("a", 1), new Tuple2<>("b", 2)).iterator()));
        assert records.size() == 4;
        assert serializer.fromBytes(records.get(2)).equals("b");

        List<Object> decoded = Lists.newArrayList(codec.decode(SerializedMode.Pair, records.iterator()));
        assert decoded.equals(Arrays.asList(new Tuple2<>("a", 1), new Tuple2<>("b", 2)));
    }

    @Test(expected = SparkException.class)
    public void testPairModeMissingValue() {
        List<byte[]> records = Lists.newArrayList(serializer.toBytes("a"));
        Lists.newArrayList(codec.decode(SerializedMode.Pair, records.iterator()));
    }

    @Test
    public void testRowMode() {
        List<byte[]> records = Lists.newArrayList(codec.encode(SerializedMode.Row,
                Lists.newArrayList((Object) Arrays.asList("x", 1, 2.5)).iterator()));
        List<Object> decoded = Lists.newArrayList(codec.decode(SerializedMode.Row, records.iterator()));
        assert decoded.get(0).equals(Arrays.asList("x", 1, 2.5));
    }

    @Test
    public void testNoneModePassesBytesThrough() {
        byte[] raw = {1, 2, 3};
        Iterator<byte[]> encoded = codec.encode(SerializedMode.None, Lists.newArrayList(raw).iterator());
        assert encoded.next() == raw;
    }

    @Test(expected = SparkException.class)
    public void testNoneModeRejectsObjects() {
        codec.encode(SerializedMode.None, Lists.newArrayList("not bytes").iterator()).next();
    }

    @Test
    public void testModeFromString() {
        assert SerializedMode.fromString("Pair") == SerializedMode.Pair;
    }
}
