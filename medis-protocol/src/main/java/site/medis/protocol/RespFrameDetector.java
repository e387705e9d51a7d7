package site.medis.protocol;

import io.netty.buffer.ByteBuf;

/**
 * RESP帧完整性检测器
 *
 * <p>判断缓冲区可读区域（从一个值的前缀字节开始）中是否已经到达一个完整的值，
 * 完整时返回帧长度，否则返回{@link #INCOMPLETE}。检测只看帧边界，
 * 内容的合法性由{@link Resp#decode(ByteBuf, RespType, RespLimits)}负责。
 *
 * <p>判定规则：
 * <ul>
 *     <li>简单字符串、错误、整数 - 前缀之后的第一个CRLF处完整</li>
 *     <li>批量字符串 - 先要有"$长度\r\n"头部，-1在头部处完整，否则在头部+长度+2字节处完整</li>
 *     <li>数组 - 先要有头部，-1在头部处完整，否则逐个检查元素直到满足声明数量，
 *     元素必须是批量字符串</li>
 * </ul>
 *
 * <p>扫描进度（CRLF查找的续扫位置、已解析的头部、数组已完成的元素）在两次调用之间保留，
 * 以相对于帧起点的偏移量记录，因此调用方在帧完整之前不能移动读索引，
 * 但可以追加数据或整体搬移缓冲区。结果与每次从头扫描完全一致。
 * 检测完成或抛出异常后状态自动清空。
 *
 * <p>线程安全性：非线程安全，每个连接持有自己的实例。
 *
 * @author medis
 * @since 1.0.0
 */
public class RespFrameDetector {
    /** 数据不完整 */
    public static final int INCOMPLETE = -1;

    private final RespLimits limits;

    /** 当前帧的类型，null表示空闲 */
    private RespType frameType;

    /** 下一次查找CRLF的起点 */
    private int scanOffset;

    /** 当前条目（帧本身或数组元素）的起点 */
    private int itemOffset;

    /** 数组剩余未完成的元素数，-1表示头部尚未解析 */
    private long remaining = -1;

    /** 当前批量字符串的结束位置，-1表示头部尚未解析 */
    private long pendingEnd = -1;

    public RespFrameDetector() {
        this(RespLimits.DEFAULT);
    }

    public RespFrameDetector(final RespLimits limits) {
        this.limits = limits;
    }

    /**
     * 检测可读区域中是否已有一个完整的值
     *
     * @param in 缓冲区，读索引指向值的前缀字节
     * @return 帧长度，或{@link #INCOMPLETE}
     * @throws RespException 前缀未知（UNKNOWN_TYPE）、长度不是整数（INVALID_INTEGER）、
     *                       长度或行超出上限（FRAME_TOO_LARGE）
     */
    public int detect(final ByteBuf in) {
        try {
            final int length = scan(in, in.readerIndex(), in.readableBytes());
            if (length != INCOMPLETE) {
                reset();
            }
            return length;
        } catch (RespException e) {
            reset();
            throw e;
        }
    }

    /**
     * 清空扫描进度，丢弃当前帧时调用
     */
    public void reset() {
        frameType = null;
        scanOffset = 0;
        itemOffset = 0;
        remaining = -1;
        pendingEnd = -1;
    }

    /**
     * 是否处于两帧之间
     */
    public boolean isIdle() {
        return frameType == null;
    }

    private int scan(final ByteBuf in, final int base, final int readable) {
        if (readable == 0) {
            return INCOMPLETE;
        }
        if (frameType == null) {
            frameType = RespType.fromPrefix(in.getByte(base));
            itemOffset = 0;
            scanOffset = 1;
        }

        switch (frameType) {
            case SIMPLE_STRING:
            case ERROR:
            case INTEGER: {
                final int crlf = findLine(in, base, readable);
                return crlf < 0 ? INCOMPLETE : crlf + 2;
            }
            case BULK_STRING: {
                final long end = bulkEnd(in, base, readable);
                return end < 0 || end > readable ? INCOMPLETE : (int) end;
            }
            case ARRAY:
                return arrayEnd(in, base, readable);
            default:
                throw new RespException(RespErrorType.UNKNOWN_TYPE, "不支持的类型: " + frameType);
        }
    }

    /**
     * 从续扫位置查找当前条目的行结束符
     *
     * @return CRLF中'\r'的相对位置，找不到返回-1
     */
    private int findLine(final ByteBuf in, final int base, final int readable) {
        final int crlf = Resp.findCrlf(in, base + scanOffset, base + readable);
        if (crlf >= 0) {
            return crlf - base;
        }
        if (readable - itemOffset > limits.getMaxInlineLength()) {
            throw new RespException(RespErrorType.FRAME_TOO_LARGE,
                    "协议错误：行长度超过最大限制 " + limits.getMaxInlineLength());
        }
        // 末尾的'\r'可能等待下一批数据中的'\n'
        scanOffset = Math.max(scanOffset, readable - 1);
        return -1;
    }

    /**
     * 计算itemOffset处批量字符串的结束位置，头部不完整时返回-1
     */
    private long bulkEnd(final ByteBuf in, final int base, final int readable) {
        if (pendingEnd >= 0) {
            return pendingEnd;
        }
        final int crlf = findLine(in, base, readable);
        if (crlf < 0) {
            return -1;
        }
        final long length = Resp.parseLength(in, base + itemOffset + 1, base + crlf, limits.getMaxBulkLength());
        final long end = length == -1 ? crlf + 2L : crlf + 2L + length + 2L;
        if (end > Integer.MAX_VALUE) {
            throw new RespException(RespErrorType.FRAME_TOO_LARGE, "协议错误：帧长度超出缓冲区上限");
        }
        pendingEnd = end;
        return end;
    }

    private int arrayEnd(final ByteBuf in, final int base, final int readable) {
        // 1. 头部
        if (remaining < 0) {
            final int crlf = findLine(in, base, readable);
            if (crlf < 0) {
                return INCOMPLETE;
            }
            final long count = Resp.parseLength(in, base + 1, base + crlf, limits.getMaxArrayLength());
            if (count == -1) {
                return crlf + 2;
            }
            remaining = count;
            startItem(crlf + 2);
        }

        // 2. 逐个元素
        while (remaining > 0) {
            if (itemOffset >= readable) {
                return INCOMPLETE;
            }
            final byte prefix = in.getByte(base + itemOffset);
            if (prefix != RespType.BULK_STRING.getPrefix()) {
                throw new RespException(RespErrorType.UNKNOWN_TYPE,
                        String.format("数组元素必须是批量字符串，实际类型标识: 0x%02x", prefix & 0xFF));
            }
            final long end = bulkEnd(in, base, readable);
            if (end < 0 || end > readable) {
                return INCOMPLETE;
            }
            remaining--;
            startItem((int) end);
        }
        return itemOffset;
    }

    private void startItem(final int offset) {
        itemOffset = offset;
        scanOffset = offset + 1;
        pendingEnd = -1;
    }
}
