package site.medis.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.medis.protocol.Resp;
import site.medis.protocol.RespException;
import site.medis.protocol.RespFrameDetector;
import site.medis.protocol.RespLimits;
import site.medis.protocol.RespType;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，在累积缓冲区上驱动{@link RespFrameDetector}，
 * 帧完整后切片解码。一次读事件中可以解出多个值；数据不完整时保留扫描进度，等待更多数据。
 *
 * <p>处理流程：
 * <ul>
 *     <li>跳过值之前的CR、LF和空格</li>
 *     <li>询问检测器帧长度</li>
 *     <li>切出完整的帧并交给值模型解码</li>
 * </ul>
 *
 * <p>任何{@link RespException}都视为协议错误：记录日志，在已解码的值之后输出一个
 * {@link RespProtocolViolation}，并丢弃此后收到的全部数据。连接由下游处理器在写出之前的回复后关闭，
 * 不影响其他连接。不支持INLINE命令格式。
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    private final RespLimits limits;

    private final RespFrameDetector detector;

    /** 是否已经发生协议错误 */
    private boolean failed;

    public RespDecoder() {
        this(RespLimits.DEFAULT);
    }

    public RespDecoder(final RespLimits limits) {
        this.limits = limits;
        this.detector = new RespFrameDetector(limits);
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        while (in.isReadable()) {
            // 1. 两帧之间跳过分隔字节
            if (detector.isIdle()) {
                skipSeparators(in);
                if (!in.isReadable()) {
                    return;
                }
            }

            try {
                // 2. 检测帧长度
                final int length = detector.detect(in);
                if (length == RespFrameDetector.INCOMPLETE) {
                    return;
                }

                // 3. 切片解码
                final ByteBuf frame = in.readSlice(length);
                final RespType type = RespType.fromPrefix(frame.getByte(frame.readerIndex()));
                final Resp resp = Resp.decode(frame, type, limits);
                out.add(resp);
                log.debug("成功解码RESP对象: {} ({} 字节)", type, length);
            } catch (RespException e) {
                log.warn("协议错误，停止解码 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                failed = true;
                detector.reset();
                in.skipBytes(in.readableBytes());
                out.add(new RespProtocolViolation(e));
                return;
            }
        }
    }

    private static void skipSeparators(final ByteBuf in) {
        while (in.isReadable()) {
            final byte b = in.getByte(in.readerIndex());
            if (b != '\r' && b != '\n' && b != ' ') {
                return;
            }
            in.skipBytes(1);
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
