package site.medis.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.medis.protocol.Resp;

/**
 * RESP协议编码器
 *
 * <p>将{@link Resp}直接编码到出站ByteBuf，不经过中间数组。
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        msg.encode(out);
        if (log.isDebugEnabled()) {
            log.debug("成功编码RESP响应: {} (大小: {} bytes)", msg.getType(), out.readableBytes());
        }
    }

    /**
     * 处理编码异常
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespEncoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
