package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP值基类
 *
 * <p>五种RESP值类型的公共父类，负责编码入口、按类型分派的解码入口以及
 * 帧检测器和解码器共用的扫描工具方法。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头</li>
 *     <li>数组 - 以"*"开头</li>
 * </ul>
 *
 * <p>所有值都是不可变的。解码要么返回一个新构造的值，要么抛出{@link RespException}，
 * 不存在部分填充的中间状态。
 *
 * @author medis
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    private static final int MAX_CACHED_NUMBER = 255;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 值的类型标签
     *
     * @return 类型
     */
    public abstract RespType getType();

    /**
     * 将值编码写入缓冲区
     *
     * @param out 输出缓冲区
     */
    public abstract void encode(ByteBuf out);

    /**
     * 编码为独立的字节数组
     *
     * @return 完整的线上字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encode(buf);
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 使用默认上限解码
     *
     * @see #decode(ByteBuf, RespType, RespLimits)
     */
    public static Resp decode(final ByteBuf frame, final RespType type) {
        return decode(frame, type, RespLimits.DEFAULT);
    }

    /**
     * 解码一个完整的帧
     *
     * <p>frame的可读区域必须恰好是一个type类型的值，从前缀字节开始、到该值自身的CRLF结束。
     * 本方法只校验帧内部的一致性（长度字段与实际字节是否吻合），不负责判断帧是否完整，
     * 那是{@link RespFrameDetector}的工作。读写索引不会被修改。
     *
     * @param frame 帧数据
     * @param type 期望的类型
     * @param limits 长度上限
     * @return 新构造的值
     * @throws RespException 帧格式不合法时
     */
    public static Resp decode(final ByteBuf frame, final RespType type, final RespLimits limits) {
        final int start = frame.readerIndex();
        final int end = frame.writerIndex();
        validateFrame(frame, start, end, type);
        if (type != RespType.BULK_STRING && type != RespType.ARRAY
                && (frame.indexOf(start + 1, end - 2, (byte) '\r') >= 0
                || frame.indexOf(start + 1, end - 2, (byte) '\n') >= 0)) {
            throw new RespException(RespErrorType.MALFORMED_FRAME, "单行类型的内容中不能包含CR或LF");
        }

        switch (type) {
            case SIMPLE_STRING:
                return SimpleString.valueOf(readText(frame, start + 1, end - 2));
            case ERROR:
                return new Errors(readText(frame, start + 1, end - 2));
            case INTEGER:
                return RespInteger.valueOf(parseLong(frame, start + 1, end - 2));
            case BULK_STRING:
                return BulkString.decode(frame, start, end, limits);
            case ARRAY:
                return RespArray.decode(frame, start, end, limits);
            default:
                throw new RespException(RespErrorType.UNKNOWN_TYPE, "不支持的类型: " + type);
        }
    }

    /**
     * 公共校验：长度至少为3，首字节为前缀，末尾两个字节为CRLF
     */
    private static void validateFrame(final ByteBuf frame, final int start, final int end, final RespType type) {
        if (end - start < 3) {
            throw new RespException(RespErrorType.MALFORMED_FRAME, "帧过短: " + (end - start) + " 字节");
        }
        if (frame.getByte(start) != type.getPrefix()) {
            throw new RespException(RespErrorType.MALFORMED_FRAME,
                    "期望前缀 '" + (char) type.getPrefix() + "'，实际为 '" + (char) frame.getByte(start) + "'");
        }
        if (frame.getByte(end - 2) != '\r' || frame.getByte(end - 1) != '\n') {
            throw new RespException(RespErrorType.MALFORMED_FRAME, "帧未以\\r\\n结尾");
        }
    }

    /**
     * 计算从offset开始的一个元素的结束位置（不含），可用于任意类型，数组递归处理。
     *
     * @param buf 缓冲区
     * @param offset 元素首字节的绝对位置
     * @param end 可用数据的结束位置（不含）
     * @param limits 长度上限
     * @return 元素结束位置（绝对位置，不含）
     * @throws RespException 数据在元素结束前耗尽时为UNEXPECTED_END，批量字符串长度与内容不符时为LENGTH_MISMATCH
     */
    static int elementEnd(final ByteBuf buf, final int offset, final int end, final RespLimits limits) {
        if (offset >= end) {
            throw new RespException(RespErrorType.UNEXPECTED_END, "数组元素数据不完整");
        }
        final RespType type = RespType.fromPrefix(buf.getByte(offset));
        final int crlf = findCrlf(buf, offset + 1, end);
        if (crlf < 0) {
            throw new RespException(RespErrorType.UNEXPECTED_END, "数组元素缺少\\r\\n");
        }

        switch (type) {
            case BULK_STRING: {
                final long length = parseLength(buf, offset + 1, crlf, limits.getMaxBulkLength());
                if (length == -1) {
                    return crlf + 2;
                }
                final long elementEnd = crlf + 2L + length + 2L;
                if (elementEnd > end) {
                    throw new RespException(RespErrorType.UNEXPECTED_END, "批量字符串元素数据不完整");
                }
                if (buf.getByte((int) elementEnd - 2) != '\r' || buf.getByte((int) elementEnd - 1) != '\n') {
                    throw new RespException(RespErrorType.LENGTH_MISMATCH, "批量字符串元素的长度与内容不符");
                }
                return (int) elementEnd;
            }
            case ARRAY: {
                final long count = parseLength(buf, offset + 1, crlf, limits.getMaxArrayLength());
                int position = crlf + 2;
                for (long i = 0; i < count; i++) {
                    position = elementEnd(buf, position, end, limits);
                }
                return position;
            }
            default:
                return crlf + 2;
        }
    }

    /**
     * 在[from, to)范围内查找第一个CRLF
     *
     * @param buf 缓冲区
     * @param from 起始位置（绝对位置）
     * @param to 结束位置（绝对位置，不含）
     * @return '\r'的绝对位置，找不到返回-1
     */
    static int findCrlf(final ByteBuf buf, final int from, final int to) {
        int index = from;
        while (index < to - 1) {
            final int cr = buf.indexOf(index, to - 1, (byte) '\r');
            if (cr < 0) {
                return -1;
            }
            if (buf.getByte(cr + 1) == '\n') {
                return cr;
            }
            index = cr + 1;
        }
        return -1;
    }

    /**
     * 解析[from, to)范围内的十进制有符号64位整数
     *
     * <p>允许一个可选的前导负号，不限制前导零，"-0"解析为0。
     *
     * @throws RespException 为空、只有负号、含非数字字符或溢出时为INVALID_INTEGER
     */
    static long parseLong(final ByteBuf buf, final int from, final int to) {
        if (from >= to) {
            throw new RespException(RespErrorType.INVALID_INTEGER, "数字解析错误：长度为0");
        }
        final boolean negative = buf.getByte(from) == '-';
        int index = negative ? from + 1 : from;
        if (index == to) {
            throw new RespException(RespErrorType.INVALID_INTEGER, "数字解析错误：只有负号");
        }

        // 以负数累加，才能覆盖Long.MIN_VALUE
        final long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        final long multiplyMin = limit / 10;
        long result = 0;
        for (; index < to; index++) {
            final byte b = buf.getByte(index);
            if (b < '0' || b > '9') {
                throw new RespException(RespErrorType.INVALID_INTEGER, "数字解析错误：包含非数字字符");
            }
            final int digit = b - '0';
            if (result < multiplyMin) {
                throw new RespException(RespErrorType.INVALID_INTEGER, "数字解析错误：超出64位整数范围");
            }
            result *= 10;
            if (result < limit + digit) {
                throw new RespException(RespErrorType.INVALID_INTEGER, "数字解析错误：超出64位整数范围");
            }
            result -= digit;
        }
        return negative ? result : -result;
    }

    /**
     * 解析批量字符串长度或数组元素数
     *
     * @param max 允许的最大值
     * @return 非负长度，或表示null的-1
     * @throws RespException 不是整数或小于-1时为INVALID_INTEGER，超过max时为FRAME_TOO_LARGE
     */
    static long parseLength(final ByteBuf buf, final int from, final int to, final long max) {
        final long length = parseLong(buf, from, to);
        if (length < -1) {
            throw new RespException(RespErrorType.INVALID_INTEGER, "长度非法: " + length);
        }
        if (length > max) {
            throw new RespException(RespErrorType.FRAME_TOO_LARGE, "协议错误：长度 " + length + " 超过最大限制 " + max);
        }
        return length;
    }

    private static String readText(final ByteBuf buf, final int from, final int to) {
        return buf.toString(from, to - from, StandardCharsets.UTF_8);
    }

    /**
     * 写入十进制数字，常用小数字走缓存
     *
     * @param buf 目标缓冲区
     * @param value 数值
     */
    protected static void writeLongAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }
}
