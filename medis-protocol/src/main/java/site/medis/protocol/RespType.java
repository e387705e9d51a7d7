package site.medis.protocol;

import lombok.Getter;

/**
 * RESP值类型标签
 *
 * <p>协议只有五种值类型，每种由一个前缀字节标识，解码按此标签分派：
 * <ul>
 *     <li>SIMPLE_STRING - "+"</li>
 *     <li>ERROR - "-"</li>
 *     <li>INTEGER - ":"</li>
 *     <li>BULK_STRING - "$"</li>
 *     <li>ARRAY - "*"</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*');

    /** 前缀字节 */
    private final byte prefix;

    RespType(final char prefix) {
        this.prefix = (byte) prefix;
    }

    /**
     * 根据前缀字节查找类型
     *
     * @param prefix 前缀字节
     * @return 对应的类型
     * @throws RespException 前缀不是五种已知类型之一时，类型为UNKNOWN_TYPE
     */
    public static RespType fromPrefix(final byte prefix) {
        switch (prefix) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            default:
                throw new RespException(RespErrorType.UNKNOWN_TYPE,
                        String.format("无法识别的RESP类型标识: 0x%02x", prefix & 0xFF));
        }
    }

}
