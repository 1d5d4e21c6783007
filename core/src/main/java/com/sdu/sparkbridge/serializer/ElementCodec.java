package com.sdu.sparkbridge.serializer;

import com.google.common.collect.Iterators;
import com.sdu.sparkbridge.SparkException;
import com.sdu.sparkbridge.utils.NextIterator;
import com.sdu.sparkbridge.utils.scala.Tuple2;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 按{@link SerializedMode}编码/解码分区元素, 编码与解码均按需进行
 *
 * @author hanhan.zhang
 * */
public class ElementCodec {

    private final SerializerInstance serializer;

    public ElementCodec(SerializerInstance serializer) {
        this.serializer = serializer;
    }

    public Iterator<Object> decode(SerializedMode mode, Iterator<byte[]> records) {
        switch (mode) {
            case None:
                return Iterators.transform(records, bytes -> (Object) bytes);
            case String:
                return Iterators.transform(records, bytes -> new String(bytes, StandardCharsets.UTF_8));
            case Byte:
                return Iterators.transform(records, serializer::fromBytes);
            case Row:
                return Iterators.transform(records, bytes -> {
                    Object[] row = serializer.fromBytes(bytes);
                    return Collections.unmodifiableList(Arrays.asList(row));
                });
            case Pair:
                return new NextIterator<Object>() {
                    @Override
                    protected Object getNext() {
                        if (!records.hasNext()) {
                            finished = true;
                            return null;
                        }
                        byte[] key = records.next();
                        if (!records.hasNext()) {
                            throw new SparkException("pair record without value");
                        }
                        byte[] value = records.next();
                        return new Tuple2<>(serializer.fromBytes(key), serializer.fromBytes(value));
                    }
                };
            default:
                throw new IllegalArgumentException("Unsupported serialized mode: " + mode);
        }
    }

    public Iterator<byte[]> encode(SerializedMode mode, Iterator<?> elements) {
        switch (mode) {
            case None:
                return Iterators.transform(elements, element -> {
                    if (!(element instanceof byte[])) {
                        throw new SparkException("expect byte[] element in None mode, but found "
                                + (element == null ? "null" : element.getClass().getName()));
                    }
                    return (byte[]) element;
                });
            case String:
                return Iterators.transform(elements, element -> String.valueOf(element).getBytes(StandardCharsets.UTF_8));
            case Byte:
                return Iterators.transform(elements, serializer::toBytes);
            case Row:
                return Iterators.transform(elements, element -> {
                    Object[] row = element instanceof List ? ((List<?>) element).toArray() : (Object[]) element;
                    return serializer.toBytes(row);
                });
            case Pair:
                return Iterators.concat(Iterators.transform(elements, element -> {
                    Tuple2<?, ?> pair = (Tuple2<?, ?>) element;
                    return Iterators.forArray(serializer.toBytes(pair._1()), serializer.toBytes(pair._2()));
                }));
            default:
                throw new IllegalArgumentException("Unsupported serialized mode: " + mode);
        }
    }
}
