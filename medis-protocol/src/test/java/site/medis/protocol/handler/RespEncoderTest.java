package site.medis.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.Test;
import site.medis.protocol.BulkString;
import site.medis.protocol.Errors;
import site.medis.protocol.Resp;
import site.medis.protocol.RespArray;
import site.medis.protocol.RespInteger;
import site.medis.protocol.SimpleString;

import static org.junit.jupiter.api.Assertions.*;

class RespEncoderTest {

    private static String encode(final Resp resp) {
        final EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(resp));

        final ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(CharsetUtil.UTF_8);
        } finally {
            buf.release();
            channel.finish();
        }
    }

    @Test
    void testEncodeSimpleString() {
        assertEquals("+OK\r\n", encode(SimpleString.OK));
    }

    @Test
    void testEncodeError() {
        assertEquals("-ERR unknown command FOOO\r\n", encode(new Errors("ERR unknown command FOOO")));
    }

    @Test
    void testEncodeInteger() {
        assertEquals(":1000\r\n", encode(RespInteger.valueOf(1000)));
    }

    @Test
    void testEncodeBulkString() {
        assertEquals("$3\r\nbar\r\n", encode(BulkString.fromString("bar")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
    }

    @Test
    void testEncodeArray() {
        final RespArray array = RespArray.valueOf(BulkString.fromString("GET"), BulkString.fromString("foo"));
        assertEquals("*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n", encode(array));
        assertEquals("*-1\r\n", encode(RespArray.NULL));
    }
}
