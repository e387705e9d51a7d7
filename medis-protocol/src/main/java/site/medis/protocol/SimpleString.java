package site.medis.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串类型
 *
 * <p>编码为"+内容\r\n"，内容不允许包含CR或LF，不做转义。
 *
 * <p>预定义常量：
 * <ul>
 *     <li>OK - SET的成功响应</li>
 *     <li>PONG - PING的响应</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false, of = "content")
public class SimpleString extends Resp {
    public static final SimpleString OK = new SimpleString("OK");

    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    /** 编码用的字节形式 */
    private final byte[] contentBytes;

    /**
     * 构造函数
     *
     * @param content 字符串内容，不能包含CR或LF
     * @throws IllegalArgumentException 内容为null或包含CR/LF时
     */
    public SimpleString(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("简单字符串内容不能为null");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("简单字符串不能包含CR或LF");
        }
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 工厂方法：常用响应返回缓存的实例
     *
     * @param content 字符串内容
     * @return SimpleString实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }

    @Override
    public void encode(final ByteBuf out) {
        out.writeByte(RespType.SIMPLE_STRING.getPrefix());
        out.writeBytes(contentBytes);
        out.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
