package site.medis.protocol;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RespStreamReader 测试")
class RespStreamReaderTest {

    private static RespStreamReader reader(final String data) {
        return new RespStreamReader(new ByteArrayInputStream(data.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("连续读取多个值并跳过分隔符")
    void testReadSequence() throws IOException {
        final RespStreamReader reader = reader("\r\n +PONG\r\n$3\r\nbar\r\n\n*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n:5\r\n");

        assertSame(SimpleString.PONG, reader.readNext());
        assertEquals(BulkString.fromString("bar"), reader.readNext());
        assertEquals(RespArray.valueOf(BulkString.fromString("GET"), BulkString.fromString("foo")), reader.readNext());
        assertEquals(RespInteger.valueOf(5), reader.readNext());
        assertThrows(EOFException.class, reader::readNext);
    }

    @Test
    @DisplayName("不会越过当前帧读取")
    void testDoesNotOverRead() throws IOException {
        final InputStream in = new ByteArrayInputStream("$-1\r\n+OK\r\n".getBytes(StandardCharsets.UTF_8));
        final RespStreamReader reader = new RespStreamReader(in);

        assertSame(BulkString.NULL, reader.readNext());
        assertSame(SimpleString.OK, reader.readNext());
    }

    @Test
    @DisplayName("空流为EOF")
    void testEmptyStream() {
        assertThrows(EOFException.class, () -> reader("").readNext());
        assertThrows(EOFException.class, () -> reader("\r\n").readNext());
    }

    @Test
    @DisplayName("值读到一半时流结束")
    void testEofInsideValue() {
        assertThrows(EOFException.class, () -> reader("$5\r\nab").readNext());
        assertThrows(EOFException.class, () -> reader("*2\r\n$1\r\na\r\n").readNext());
    }

    @Test
    @DisplayName("未知前缀")
    void testUnknownPrefix() {
        final RespException e = assertThrows(RespException.class, () -> reader("hello\r\n").readNext());
        assertEquals(RespErrorType.UNKNOWN_TYPE, e.getErrorType());
    }

    @Test
    @DisplayName("帧内部不一致时抛出解码错误")
    void testDecodeError() {
        final RespException e = assertThrows(RespException.class, () -> reader("$3\r\nabcd\r\n").readNext());
        assertEquals(RespErrorType.MALFORMED_FRAME, e.getErrorType());
    }

    @Test
    @DisplayName("底层IO错误原样传播")
    void testIoErrorPropagates() {
        final InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };

        final IOException e = assertThrows(IOException.class, () -> new RespStreamReader(failing).readNext());
        assertEquals("connection reset", e.getMessage());
    }
}
