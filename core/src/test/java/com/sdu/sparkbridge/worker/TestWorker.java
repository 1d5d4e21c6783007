package com.sdu.sparkbridge.worker;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;
import com.sdu.sparkbridge.JobExecutionException;
import com.sdu.sparkbridge.api.function.Function2;
import com.sdu.sparkbridge.rdd.WorkerFunction;
import com.sdu.sparkbridge.serializer.JavaSerializer;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.serializer.SerializerInstance;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;

/**
 * @author hanhan.zhang
 * */
public class TestWorker {

    private final SerializerInstance serializer = new JavaSerializer().newInstance();

    private byte[] command(SerializedMode input, SerializedMode output, Function2<Integer, Iterator<Object>, Iterator<Object>> func) {
        return serializer.toBytes(new Command(input, output, new WorkerFunction(func)));
    }

    @Test
    public void testStringInputByteOutput() {
        byte[] command = command(SerializedMode.String, SerializedMode.Byte,
                (split, input) -> Iterators.transform(input, line -> ((String) line).length() + split));
        List<byte[]> input = Lists.newArrayList("ab".getBytes(StandardCharsets.UTF_8), "abcd".getBytes(StandardCharsets.UTF_8));

        List<byte[]> output = Lists.newArrayList(Worker.run(command, 10, input.iterator()));
        assert output.size() == 2;
        assert serializer.fromBytes(output.get(0)).equals(12);
        assert serializer.fromBytes(output.get(1)).equals(14);
    }

    @Test
    public void testBypassSerializerOutput() {
        byte[] command = command(SerializedMode.Byte, SerializedMode.None,
                (split, input) -> Iterators.transform(input, value -> (Object) Longs.toByteArray((Integer) value)));
        List<byte[]> input = Lists.newArrayList(serializer.toBytes(7));

        List<byte[]> output = Lists.newArrayList(Worker.run(command, 0, input.iterator()));
        assert Longs.fromByteArray(output.get(0)) == 7L;
    }

    @Test
    public void testOutputIsLazy() {
        byte[] command = command(SerializedMode.Byte, SerializedMode.Byte, (split, input) -> Iterators.transform(input, value -> {
            if ((Integer) value < 0) {
                throw new IllegalArgumentException("negative value " + value);
            }
            return value;
        }));
        List<byte[]> input = Lists.newArrayList(serializer.toBytes(1), serializer.toBytes(-1));

        Iterator<byte[]> output = Worker.run(command, 3, input.iterator());
        assert serializer.fromBytes(output.next()).equals(1);
        try {
            output.next();
            assert false : "second element should fail";
        } catch (JobExecutionException e) {
            assert e.getMessage().contains("partition 3");
            assert e.getMessage().contains("negative value -1");
            assert e.getWorkerStackTrace().contains("TestWorker");
        }
    }
}
