package site.medis.protocol;

/**
 * 协议解码错误分类
 *
 * <p>任何一种都意味着当前连接上的读位置不再可信，调用方应关闭连接。
 *
 * @author medis
 * @since 1.0.0
 */
public enum RespErrorType {
    /** 前缀或结尾CRLF不符合 */
    MALFORMED_FRAME,
    /** 整数为空、只有负号、含非数字字符或超出64位有符号范围 */
    INVALID_INTEGER,
    /** 声明的长度与实际字节不一致 */
    LENGTH_MISMATCH,
    /** 数组元素数量未满足时数据已耗尽 */
    UNEXPECTED_END,
    /** 前缀字节不是五种已知类型之一 */
    UNKNOWN_TYPE,
    /** 声明的长度超过配置的上限 */
    FRAME_TOO_LARGE
}
