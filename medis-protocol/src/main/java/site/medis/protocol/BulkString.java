package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.medis.datastructure.RedisBytes;

import java.nio.charset.StandardCharsets;

/**
 * 批量字符串类型
 *
 * <p>二进制安全的字节串，内容可以包含任意字节（包括CR和LF）。基于{@link RedisBytes}，
 * 内容为null时表示null批量字符串，编码为"$-1\r\n"，与空串"$0\r\n\r\n"不相等。
 *
 * <p>使用建议：
 * <ul>
 *     <li>内部解码使用wrapTrusted避免再次拷贝</li>
 *     <li>外部数据使用create确保安全性</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class BulkString extends Resp {
    /** 空值的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BYTES = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** null批量字符串 */
    public static final BulkString NULL = new BulkString((RedisBytes) null);

    /** 字符串内容，null表示null批量字符串 */
    private final RedisBytes content;

    /**
     * 构造函数
     *
     * @param content 内容，可以为null
     */
    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 安全模式工厂方法，会复制输入数组
     *
     * @param content 字节数组内容
     * @return BulkString实例，输入为null时返回{@link #NULL}
     */
    public static BulkString create(final byte[] content) {
        if (content == null) {
            return NULL;
        }
        return new BulkString(new RedisBytes(content));
    }

    /**
     * 零拷贝工厂方法
     *
     * <p>警告：调用者必须保证数组此后不会被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.fromString(str));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    @Override
    public void encode(final ByteBuf out) {
        if (content == null) {
            out.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            out.writeBytes(EMPTY_BYTES);
            return;
        }

        // 1. 预留空间：'$' + 长度(最多10位) + CRLF + 内容 + CRLF
        out.ensureWritable(bytes.length + 15);
        // 2. 头部
        out.writeByte(RespType.BULK_STRING.getPrefix());
        writeLongAsBytes(out, bytes.length);
        out.writeBytes(CRLF);
        // 3. 内容
        out.writeBytes(bytes);
        out.writeBytes(CRLF);
    }

    /**
     * 解码[start, end)范围内的批量字符串帧
     */
    static BulkString decode(final ByteBuf frame, final int start, final int end, final RespLimits limits) {
        final int crlf = findCrlf(frame, start + 1, end);
        if (crlf < 0) {
            throw new RespException(RespErrorType.MALFORMED_FRAME, "批量字符串缺少长度行");
        }
        final long length = parseLength(frame, start + 1, crlf, limits.getMaxBulkLength());
        final int headerEnd = crlf + 2;

        if (length == -1) {
            if (headerEnd != end) {
                throw new RespException(RespErrorType.LENGTH_MISMATCH, "null批量字符串后存在多余字节");
            }
            return NULL;
        }
        if ((long) (end - headerEnd) != length + 2) {
            throw new RespException(RespErrorType.LENGTH_MISMATCH,
                    "声明长度 " + length + " 与实际内容长度 " + (end - headerEnd - 2) + " 不一致");
        }

        final byte[] bytes = new byte[(int) length];
        frame.getBytes(headerEnd, bytes);
        return wrapTrusted(bytes);
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，null批量字符串返回null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
