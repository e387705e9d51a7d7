package site.medis.protocol;

import lombok.Builder;
import lombok.Getter;

/**
 * 协议长度上限
 *
 * <p>等待帧剩余部分时用来限制内存增长，超出即为FRAME_TOO_LARGE。
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
@Builder
public class RespLimits {

    /** 默认上限 */
    public static final RespLimits DEFAULT = RespLimits.builder().build();

    /** 批量字符串最大长度，512MB */
    @Builder.Default
    private final long maxBulkLength = 512L * 1024 * 1024;

    /** 数组最大元素数 */
    @Builder.Default
    private final long maxArrayLength = 1024 * 1024;

    /** 单行（简单字符串、错误、整数和长度头）在未见到CRLF前允许的最大字节数，64KB */
    @Builder.Default
    private final int maxInlineLength = 64 * 1024;
}
