package com.sdu.sparkbridge.interop;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.JobExecutionException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * 宿主JVM方法调用编码
 *
 * 请求:
 *
 * +----------+--------+------------+---------+-------------------+
 * | isStatic | target | methodName | numArgs | typed args ...    |
 * +----------+--------+------------+---------+-------------------+
 *
 * target为类名(静态方法/构造函数)或对象句柄, 构造函数的methodName为"<init>"
 *
 * 响应: [int returnCode][typed value], returnCode != 0时为[int returnCode][string error]
 *
 * 类型标记: n(null), i(int), g(long), d(double), b(boolean), s(string), r(bytes), j(对象句柄), l(list)
 *
 * @author hanhan.zhang
 * */
public class SerDe {

    public static final String CONSTRUCTOR = "<init>";

    private static final byte NULL_TYPE = 'n';
    private static final byte INT_TYPE = 'i';
    private static final byte LONG_TYPE = 'g';
    private static final byte DOUBLE_TYPE = 'd';
    private static final byte BOOLEAN_TYPE = 'b';
    private static final byte STRING_TYPE = 's';
    private static final byte BYTES_TYPE = 'r';
    private static final byte REFERENCE_TYPE = 'j';
    private static final byte LIST_TYPE = 'l';

    /**
     * 一次方法调用
     * */
    public static class Call {
        public final boolean isStatic;
        public final String target;
        public final String methodName;
        public final List<Object> args;

        public Call(boolean isStatic, String target, String methodName, List<Object> args) {
            this.isStatic = isStatic;
            this.target = target;
            this.methodName = methodName;
            this.args = args;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("isStatic", isStatic)
                    .add("target", target)
                    .add("methodName", methodName)
                    .add("numArgs", args.size())
                    .toString();
        }
    }

    public static ByteBuffer buildPayload(boolean isStatic, String target, String methodName, Object... args) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeBoolean(isStatic);
        writeString(buf, target);
        writeString(buf, methodName);
        buf.writeInt(args.length);
        for (Object arg : args) {
            writeObject(buf, arg);
        }
        return buf.nioBuffer();
    }

    public static Call readCall(ByteBuffer payload) {
        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        try {
            boolean isStatic = buf.readBoolean();
            String target = readString(buf);
            String methodName = readString(buf);
            int numArgs = buf.readInt();
            List<Object> args = Lists.newArrayListWithCapacity(numArgs);
            for (int i = 0; i < numArgs; ++i) {
                args.add(readObject(buf));
            }
            return new Call(isStatic, target, methodName, args);
        } catch (IndexOutOfBoundsException e) {
            throw new BridgeException("truncated call payload", e);
        }
    }

    public static ByteBuffer buildResponse(Object value) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(0);
        writeObject(buf, value);
        return buf.nioBuffer();
    }

    public static ByteBuffer buildErrorResponse(int returnCode, String error) {
        if (returnCode == 0) {
            throw new IllegalArgumentException("error response must carry a non-zero return code");
        }
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(returnCode);
        writeString(buf, error);
        return buf.nioBuffer();
    }

    /**
     * 解析响应, returnCode != 0时抛出{@link JobExecutionException}
     * */
    public static Object readResponse(ByteBuffer response) {
        ByteBuf buf = Unpooled.wrappedBuffer(response);
        try {
            int returnCode = buf.readInt();
            if (returnCode != 0) {
                String error = readString(buf);
                throw new JobExecutionException(String.format("JVM method execution failed (return code %d): %s",
                        returnCode, error));
            }
            Object value = readObject(buf);
            if (buf.isReadable()) {
                throw new BridgeException(String.format("%d unexpected trailing bytes in response", buf.readableBytes()));
            }
            return value;
        } catch (IndexOutOfBoundsException e) {
            throw new BridgeException("truncated response from JVM backend", e);
        }
    }

    public static void writeObject(ByteBuf buf, Object value) {
        if (value == null) {
            buf.writeByte(NULL_TYPE);
        } else if (value instanceof Integer) {
            buf.writeByte(INT_TYPE);
            buf.writeInt((Integer) value);
        } else if (value instanceof Long) {
            buf.writeByte(LONG_TYPE);
            buf.writeLong((Long) value);
        } else if (value instanceof Double) {
            buf.writeByte(DOUBLE_TYPE);
            buf.writeDouble((Double) value);
        } else if (value instanceof Boolean) {
            buf.writeByte(BOOLEAN_TYPE);
            buf.writeBoolean((Boolean) value);
        } else if (value instanceof String) {
            buf.writeByte(STRING_TYPE);
            writeString(buf, (String) value);
        } else if (value instanceof byte[]) {
            buf.writeByte(BYTES_TYPE);
            writeBytes(buf, (byte[]) value);
        } else if (value instanceof JvmObjectReference) {
            buf.writeByte(REFERENCE_TYPE);
            writeString(buf, ((JvmObjectReference) value).getId());
        } else if (value instanceof List || value instanceof Object[]) {
            List<?> list = value instanceof List ? (List<?>) value : Arrays.asList((Object[]) value);
            buf.writeByte(LIST_TYPE);
            buf.writeInt(list.size());
            for (Object element : list) {
                writeObject(buf, element);
            }
        } else {
            throw new IllegalArgumentException("Unsupported argument type: " + value.getClass().getName());
        }
    }

    public static Object readObject(ByteBuf buf) {
        byte type = buf.readByte();
        switch (type) {
            case NULL_TYPE:
                return null;
            case INT_TYPE:
                return buf.readInt();
            case LONG_TYPE:
                return buf.readLong();
            case DOUBLE_TYPE:
                return buf.readDouble();
            case BOOLEAN_TYPE:
                return buf.readBoolean();
            case STRING_TYPE:
                return readString(buf);
            case BYTES_TYPE:
                return readBytes(buf);
            case REFERENCE_TYPE:
                return new JvmObjectReference(readString(buf));
            case LIST_TYPE:
                int size = buf.readInt();
                ImmutableList.Builder<Object> builder = ImmutableList.builder();
                for (int i = 0; i < size; ++i) {
                    // ImmutableList不接受null
                    Object element = readObject(buf);
                    if (element == null) {
                        throw new BridgeException("null element in list value");
                    }
                    builder.add(element);
                }
                return builder.build();
            default:
                throw new BridgeException("Unknown type tag in JVM response: " + (char) type);
        }
    }

    private static void writeString(ByteBuf buf, String value) {
        writeBytes(buf, value.getBytes(StandardCharsets.UTF_8));
    }

    private static String readString(ByteBuf buf) {
        return new String(readBytes(buf), StandardCharsets.UTF_8);
    }

    private static void writeBytes(ByteBuf buf, byte[] bytes) {
        buf.writeInt(bytes.length);
        buf.writeBytes(bytes);
    }

    private static byte[] readBytes(ByteBuf buf) {
        int length = buf.readInt();
        if (length < 0 || length > buf.readableBytes()) {
            throw new BridgeException(String.format("invalid length %d, %d bytes readable", length, buf.readableBytes()));
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return bytes;
    }
}
