package site.medis.protocol;

import lombok.Getter;

/**
 * RESP协议解码异常
 *
 * <p>携带{@link RespErrorType}，便于调用方区分错误种类。解码失败时不会产生任何部分填充的值。
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
public class RespException extends RuntimeException {

    /** 错误类型 */
    private final RespErrorType errorType;

    public RespException(final RespErrorType errorType, final String message) {
        super(errorType + ": " + message);
        this.errorType = errorType;
    }
}
