package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误消息类型
 *
 * <p>用于向客户端传递命令层面的错误，连接保持打开。
 *
 * <p>错误格式：
 * <ul>
 *     <li>语法："-Error message\r\n"</li>
 *     <li>示例："-ERR unknown command FOOO"</li>
 *     <li>示例："-ERR wrong number of arguments for GET"</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    /**
     * 创建错误消息实例
     *
     * @param content 错误消息内容，不能包含CR或LF
     * @throws IllegalArgumentException 内容为null或包含CR/LF时
     */
    public Errors(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("错误消息不能为null");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("错误消息不能包含CR或LF");
        }
        this.content = content;
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }

    @Override
    public void encode(final ByteBuf out) {
        out.writeByte(RespType.ERROR.getPrefix());
        out.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
