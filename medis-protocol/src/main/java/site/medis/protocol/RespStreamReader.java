package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * 阻塞式RESP读取器
 *
 * <p>从输入流中逐个读取完整的RESP值。每读入一个字节就询问一次{@link RespFrameDetector}，
 * 因此不会越过当前帧多读数据；底层流被包装为{@link BufferedInputStream}以减少系统调用。
 *
 * <p>读取流程：
 * <ul>
 *     <li>跳过值之前的CR、LF和空格</li>
 *     <li>检查前缀字节，未知前缀抛出UNKNOWN_TYPE</li>
 *     <li>逐字节追加并检测帧是否完整</li>
 *     <li>用值模型解码完整的帧</li>
 * </ul>
 *
 * <p>线程安全性：非线程安全。
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
public class RespStreamReader {
    private final InputStream in;

    private final RespLimits limits;

    private final RespFrameDetector detector;

    public RespStreamReader(final InputStream in) {
        this(in, RespLimits.DEFAULT);
    }

    public RespStreamReader(final InputStream in, final RespLimits limits) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.limits = limits;
        this.detector = new RespFrameDetector(limits);
    }

    /**
     * 读取下一个完整的值
     *
     * @return 解码后的值
     * @throws EOFException 值开始之前或读到一半时流结束
     * @throws IOException 底层读取失败
     * @throws RespException 数据不符合协议
     */
    public Resp readNext() throws IOException {
        // 1. 跳过分隔字节
        int b = in.read();
        while (b == '\r' || b == '\n' || b == ' ') {
            b = in.read();
        }
        if (b < 0) {
            throw new EOFException("连接已关闭");
        }

        // 2. 检查前缀
        final RespType type = RespType.fromPrefix((byte) b);

        // 3. 逐字节读取直到帧完整
        final ByteBuf frame = Unpooled.buffer(64);
        try {
            frame.writeByte(b);
            detector.reset();
            while (detector.detect(frame) == RespFrameDetector.INCOMPLETE) {
                final int next = in.read();
                if (next < 0) {
                    detector.reset();
                    throw new EOFException("读取" + type + "时连接意外关闭，已读取 " + frame.readableBytes() + " 字节");
                }
                frame.writeByte(next);
            }

            // 4. 解码
            final Resp resp = Resp.decode(frame, type, limits);
            log.debug("读取到RESP值: {} ({} 字节)", type, frame.readableBytes());
            return resp;
        } finally {
            frame.release();
        }
    }
}
