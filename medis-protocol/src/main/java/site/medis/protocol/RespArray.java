package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 数组类型
 *
 * <p>元素可以是任意RESP类型，允许嵌套。内容为null时表示null数组。
 * 构造时复制传入的数组，{@link #getContent()}返回副本，实例不可变。
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@EqualsAndHashCode(callSuper = false, doNotUseGetters = true)
public class RespArray extends Resp {
    /** null数组的RESP编码 */
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespArray EMPTY = new RespArray(new Resp[0], true);

    public static final RespArray NULL = new RespArray(null, true);

    /** 数组内容 */
    private final Resp[] content;

    /**
     * 构造函数
     *
     * @param content 数组内容，null表示null数组
     */
    public RespArray(final Resp[] content) {
        this(content == null ? null : content.clone(), true);
    }

    private RespArray(final Resp[] content, final boolean trusted) {
        this.content = content;
    }

    /**
     * 工厂方法：空数组和null数组返回缓存实例
     *
     * @param content 数组内容
     * @return RespArray实例
     */
    public static RespArray valueOf(final Resp... content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /**
     * 零拷贝创建实例，数组此后不能再被修改
     */
    static RespArray wrapTrusted(final Resp[] elements) {
        if (elements.length == 0) {
            return EMPTY;
        }
        return new RespArray(elements, true);
    }

    /**
     * 数组内容的副本
     *
     * @return 元素数组，null数组返回null
     */
    public Resp[] getContent() {
        return content == null ? null : content.clone();
    }

    /**
     * 按下标取元素
     *
     * @param index 下标
     * @return 元素
     * @throws IllegalStateException 如果是null数组
     */
    public Resp get(final int index) {
        if (content == null) {
            throw new IllegalStateException("null数组没有元素");
        }
        return content[index];
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * 元素个数，null数组为-1
     */
    public int size() {
        return content == null ? -1 : content.length;
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    @Override
    public void encode(final ByteBuf out) {
        // 1. null数组
        if (content == null) {
            out.writeBytes(NULL_ARRAY_BYTES);
            return;
        }

        // 2. 空数组
        if (content.length == 0) {
            out.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        // 3. 头部
        out.writeByte(RespType.ARRAY.getPrefix());
        writeLongAsBytes(out, content.length);
        out.writeBytes(CRLF);

        // 4. 逐个编码元素
        for (final Resp element : content) {
            element.encode(out);
        }
    }

    /**
     * 解码[start, end)范围内的数组帧，元素按首字节递归解码
     */
    static RespArray decode(final ByteBuf frame, final int start, final int end, final RespLimits limits) {
        final int crlf = findCrlf(frame, start + 1, end);
        if (crlf < 0) {
            throw new RespException(RespErrorType.MALFORMED_FRAME, "数组缺少长度行");
        }
        final long count = parseLength(frame, start + 1, crlf, limits.getMaxArrayLength());
        int offset = crlf + 2;

        if (count == -1) {
            if (offset != end) {
                throw new RespException(RespErrorType.LENGTH_MISMATCH, "null数组后存在多余字节");
            }
            return NULL;
        }

        final Resp[] elements = new Resp[(int) count];
        for (int i = 0; i < elements.length; i++) {
            if (offset >= end) {
                throw new RespException(RespErrorType.UNEXPECTED_END,
                        "数组声明 " + count + " 个元素，实际只有 " + i + " 个");
            }
            final RespType type = RespType.fromPrefix(frame.getByte(offset));
            final int elementEnd = elementEnd(frame, offset, end, limits);
            elements[i] = Resp.decode(frame.slice(offset, elementEnd - offset), type, limits);
            offset = elementEnd;
        }
        if (offset != end) {
            throw new RespException(RespErrorType.LENGTH_MISMATCH, "数组最后一个元素后存在多余字节: " + (end - offset));
        }
        return wrapTrusted(elements);
    }

    @Override
    public String toString() {
        return content == null ? "null" : Arrays.toString(content);
    }
}
