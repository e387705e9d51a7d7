package site.medis.server.handler;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.medis.command.CommandDispatcher;
import site.medis.command.CommandRequest;
import site.medis.protocol.Resp;
import site.medis.protocol.handler.RespProtocolViolation;

import java.io.IOException;

/**
 * 命令处理器，负责把解码后的请求交给分派器并写回回复。
 *
 * <p>运行在命令执行线程组上，同一连接的请求总是由同一个线程按顺序处理，
 * 回复顺序与请求顺序一致。
 *
 * <p>连接处理策略：
 * <ul>
 *   <li>应用错误（未知命令、参数个数）作为错误回复，连接保持打开
 *   <li>不是批量字符串数组的请求视为协议违规，关闭连接
 *   <li>解码器报告协议错误时，先写出之前请求的回复，再关闭连接
 *   <li>I/O异常只关闭当前连接
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandDispatcher dispatcher;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分派器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.info("客户端连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
        if (msg instanceof RespProtocolViolation) {
            log.warn("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(),
                    ((RespProtocolViolation) msg).getCause().getMessage());
            closeAfterPendingReplies(ctx);
            return;
        }
        super.channelRead(ctx, msg);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        // 1. 映射为命令请求
        final CommandRequest request;
        try {
            request = CommandRequest.from(msg);
        } catch (IllegalArgumentException e) {
            log.warn("非法命令格式，关闭连接 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            closeAfterPendingReplies(ctx);
            return;
        }

        // 2. 执行并回复
        final Resp response = dispatcher.dispatch(request);
        ctx.writeAndFlush(response);
    }

    /**
     * 空写入在之前的回复全部写出后完成，再关闭连接
     */
    private static void closeAfterPendingReplies(final ChannelHandlerContext ctx) {
        ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        log.info("客户端断开: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    /**
     * 处理连接异常
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof IOException) {
            log.info("连接异常 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }
}
