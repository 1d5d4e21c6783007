package com.sdu.sparkbridge.interop;

import com.google.common.collect.Lists;
import com.sdu.sparkbridge.BridgeException;
import com.sdu.sparkbridge.JobExecutionException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

/**
 * @author hanhan.zhang
 * */
public class TestSerDe {

    @Test
    public void testCallPayload() {
        byte[] bytes = new byte[] {1, 2, 3};
        ByteBuffer payload = SerDe.buildPayload(false, "obj-1", "union", 7, 8L, 0.5, true, "text", bytes,
                new JvmObjectReference("obj-2"), Arrays.asList("a", 1), null);

        SerDe.Call call = SerDe.readCall(payload);
        assert !call.isStatic;
        assert call.target.equals("obj-1");
        assert call.methodName.equals("union");
        assert call.args.size() == 9;
        assert call.args.get(0).equals(7);
        assert call.args.get(1).equals(8L);
        assert call.args.get(2).equals(0.5);
        assert call.args.get(3).equals(true);
        assert call.args.get(4).equals("text");
        assert Arrays.equals((byte[]) call.args.get(5), bytes);
        assert call.args.get(6).equals(new JvmObjectReference("obj-2"));
        assert call.args.get(7).equals(Arrays.asList("a", 1));
        assert call.args.get(8) == null;
    }

    @Test
    public void testResponse() {
        assert SerDe.readResponse(SerDe.buildResponse(42L)).equals(42L);
        assert SerDe.readResponse(SerDe.buildResponse(null)) == null;

        List<Object> values = Lists.newArrayList("x", new JvmObjectReference("obj-3"));
        assert SerDe.readResponse(SerDe.buildResponse(values)).equals(values);
    }

    @Test
    public void testErrorResponse() {
        try {
            SerDe.readResponse(SerDe.buildErrorResponse(-1, "java.lang.IllegalStateException: stage failed"));
            assert false : "error response should throw";
        } catch (JobExecutionException e) {
            assert e.getMessage().contains("stage failed");
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testErrorResponseRequiresNonZeroCode() {
        SerDe.buildErrorResponse(0, "ok");
    }

    @Test(expected = BridgeException.class)
    public void testTruncatedResponse() {
        SerDe.readResponse(ByteBuffer.wrap(new byte[] {0, 0}));
    }

    @Test(expected = BridgeException.class)
    public void testUnknownTypeTag() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(0);
        buf.writeByte('?');
        SerDe.readResponse(buf.nioBuffer());
    }

    @Test(expected = BridgeException.class)
    public void testInvalidStringLength() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(0);
        buf.writeByte('s');
        buf.writeInt(1024);
        buf.writeByte('a');
        SerDe.readResponse(buf.nioBuffer());
    }
}
