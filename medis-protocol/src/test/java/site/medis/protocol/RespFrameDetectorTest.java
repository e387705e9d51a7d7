package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RespFrameDetector 测试
 *
 * 重点：
 * 1. 任意真前缀都不完整，完整帧返回帧长度
 * 2. 逐字节增量检测与一次性检测结果一致
 * 3. 终止性错误
 */
@DisplayName("RespFrameDetector 测试")
class RespFrameDetectorTest {

    private ByteBuf buf;

    @BeforeEach
    void setUp() {
        buf = Unpooled.buffer();
    }

    @AfterEach
    void tearDown() {
        buf.release();
    }

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static int detectFresh(final byte[] wire, final int length) {
        final ByteBuf slice = Unpooled.wrappedBuffer(wire, 0, length);
        try {
            return new RespFrameDetector().detect(slice);
        } finally {
            slice.release();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "+OK\r\n", "-ERR x\r\n", ":123\r\n", "$3\r\nfoo\r\n", "$-1\r\n", "$0\r\n\r\n", "$4\r\na\r\nb\r\n",
            "*-1\r\n", "*0\r\n", "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n", "*3\r\n$3\r\nSET\r\n$-1\r\n$0\r\n\r\n"})
    @DisplayName("真前缀不完整，完整帧返回长度")
    void testMonotonic(final String frame) {
        final byte[] wire = bytes(frame);
        for (int i = 1; i < wire.length; i++) {
            assertEquals(RespFrameDetector.INCOMPLETE, detectFresh(wire, i), "前缀长度 " + i);
        }
        assertEquals(wire.length, detectFresh(wire, wire.length));
    }

    @ParameterizedTest
    @ValueSource(strings = {"+PONG\r\n", "$5\r\nhello\r\n", "*2\r\n$3\r\nGET\r\n$10\r\n0123456789\r\n"})
    @DisplayName("逐字节增量检测与一次性检测一致")
    void testIncrementalMatchesStateless(final String frame) {
        final byte[] wire = bytes(frame);
        final RespFrameDetector detector = new RespFrameDetector();

        for (int i = 0; i < wire.length - 1; i++) {
            buf.writeByte(wire[i]);
            assertEquals(RespFrameDetector.INCOMPLETE, detector.detect(buf));
            assertFalse(detector.isIdle());
        }
        buf.writeByte(wire[wire.length - 1]);

        assertEquals(wire.length, detector.detect(buf));
        assertTrue(detector.isIdle());
    }

    @Test
    @DisplayName("任意切分点的两段写入")
    void testEverySplitPoint() {
        final byte[] wire = bytes("*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
        for (int split = 1; split < wire.length; split++) {
            final ByteBuf cumulation = Unpooled.buffer();
            try {
                final RespFrameDetector detector = new RespFrameDetector();
                cumulation.writeBytes(wire, 0, split);
                assertEquals(RespFrameDetector.INCOMPLETE, detector.detect(cumulation));
                cumulation.writeBytes(wire, split, wire.length - split);
                assertEquals(wire.length, detector.detect(cumulation), "切分点 " + split);
            } finally {
                cumulation.release();
            }
        }
    }

    @Test
    @DisplayName("只消费第一个帧")
    void testStopsAtFirstFrame() {
        buf.writeBytes(bytes("$3\r\nfoo\r\n+OK\r\n"));
        final RespFrameDetector detector = new RespFrameDetector();

        assertEquals(9, detector.detect(buf));
        buf.skipBytes(9);
        assertEquals(5, detector.detect(buf));
    }

    @Test
    @DisplayName("读索引不为0时使用相对偏移")
    void testNonZeroReaderIndex() {
        buf.writeBytes(bytes("xx$3\r\nfo"));
        buf.skipBytes(2);
        final RespFrameDetector detector = new RespFrameDetector();

        assertEquals(RespFrameDetector.INCOMPLETE, detector.detect(buf));
        buf.writeBytes(bytes("o\r\n"));
        assertEquals(9, detector.detect(buf));
    }

    @Test
    @DisplayName("数组元素必须是批量字符串")
    void testArrayElementMustBeBulk() {
        buf.writeBytes(bytes("*1\r\n:1\r\n"));
        final RespFrameDetector detector = new RespFrameDetector();

        assertThatThrownBy(() -> detector.detect(buf))
                .isInstanceOf(RespException.class)
                .extracting(e -> ((RespException) e).getErrorType())
                .isEqualTo(RespErrorType.UNKNOWN_TYPE);
        assertTrue(detector.isIdle());
    }

    @Test
    void testUnknownPrefix() {
        buf.writeBytes(bytes("?x\r\n"));
        final RespException e = assertThrows(RespException.class, () -> new RespFrameDetector().detect(buf));
        assertEquals(RespErrorType.UNKNOWN_TYPE, e.getErrorType());
    }

    @Test
    void testInvalidLength() {
        buf.writeBytes(bytes("$abc\r\n"));
        final RespException e = assertThrows(RespException.class, () -> new RespFrameDetector().detect(buf));
        assertEquals(RespErrorType.INVALID_INTEGER, e.getErrorType());
    }

    @Test
    @DisplayName("长度或数量超过上限")
    void testDeclaredLengthTooLarge() {
        final RespLimits limits = RespLimits.builder().maxBulkLength(8).maxArrayLength(2).build();

        buf.writeBytes(bytes("$9\r\n"));
        assertEquals(RespErrorType.FRAME_TOO_LARGE,
                assertThrows(RespException.class, () -> new RespFrameDetector(limits).detect(buf)).getErrorType());

        buf.clear().writeBytes(bytes("*3\r\n"));
        assertEquals(RespErrorType.FRAME_TOO_LARGE,
                assertThrows(RespException.class, () -> new RespFrameDetector(limits).detect(buf)).getErrorType());
    }

    @Test
    @DisplayName("没有CRLF的行超过上限")
    void testLineTooLong() {
        final RespLimits limits = RespLimits.builder().maxInlineLength(8).build();
        final RespFrameDetector detector = new RespFrameDetector(limits);

        buf.writeBytes(bytes("+aaaaaaa"));
        assertEquals(RespFrameDetector.INCOMPLETE, detector.detect(buf));
        buf.writeBytes(bytes("aaaa"));

        assertEquals(RespErrorType.FRAME_TOO_LARGE,
                assertThrows(RespException.class, () -> detector.detect(buf)).getErrorType());
    }

    @Test
    @DisplayName("reset 丢弃扫描进度")
    void testReset() {
        final RespFrameDetector detector = new RespFrameDetector();
        buf.writeBytes(bytes("$3\r\nfo"));
        assertEquals(RespFrameDetector.INCOMPLETE, detector.detect(buf));

        detector.reset();
        buf.clear().writeBytes(bytes(":1\r\n"));

        assertTrue(detector.isIdle());
        assertEquals(4, detector.detect(buf));
    }
}
