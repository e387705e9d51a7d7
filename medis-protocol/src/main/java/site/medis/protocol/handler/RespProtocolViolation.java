package site.medis.protocol.handler;

import lombok.Getter;
import site.medis.protocol.RespException;

/**
 * 协议错误标记
 *
 * <p>{@link RespDecoder}遇到无法解析的数据时，把本对象作为最后一条入站消息传给下游，
 * 排在此前已解码的值之后。下游处理器收到它时，之前的请求都已处理完毕，
 * 应在回复写出后关闭连接。
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
public final class RespProtocolViolation {

    /** 导致解码失败的异常 */
    private final RespException cause;

    public RespProtocolViolation(final RespException cause) {
        this.cause = cause;
    }

    @Override
    public String toString() {
        return "RespProtocolViolation[" + cause.getMessage() + "]";
    }
}
