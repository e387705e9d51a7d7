package site.medis.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节序列封装类。
 *
 * <p>存储层的键和值、批量字符串的内容都以本类表示。内容按不透明字节处理，
 * 不要求是合法的UTF-8文本：
 * <ul>
 *   <li>相等性与哈希值只由字节内容决定，可直接作为HashMap的键
 *   <li>哈希值在构造时预先计算
 *   <li>字符串形式延迟生成并缓存，仅用于日志和命令名匹配
 *   <li>{@link #wrapTrusted(byte[])}为解码器等可信路径提供零拷贝入口
 * </ul>
 *
 * <p>线程安全性：实例不可变，可在连接之间共享。
 *
 * @author medis
 * @since 1.0.0
 */
public final class RedisBytes {

    /** 字符串与字节互转使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 空字节序列 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    /** toString预览的最大字节数 */
    private static final int PREVIEW_LIMIT = 16;

    private final byte[] bytes;

    private final int hashCode;

    private volatile String stringValue;

    /**
     * 创建实例，对入参做防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝创建实例。
     *
     * <p><b>警告</b>：调用者必须保证数组此后不再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 以UTF-8编码字符串创建实例。
     *
     * @param str 源字符串
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 获取字节内容的副本。
     *
     * @return 字节数组副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用者不得修改。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 以UTF-8解码得到的字符串，非法字节按替换字符处理。
     *
     * @return 字符串形式
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * ASCII大写形式，其余字节原样保留。
     *
     * <p>用于命令名的大小写不敏感匹配；内容本身已是大写时返回当前实例。
     *
     * @return 大写形式的实例
     */
    public RedisBytes toUpperCase() {
        int firstLower = -1;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] >= 'a' && bytes[i] <= 'z') {
                firstLower = i;
                break;
            }
        }
        if (firstLower < 0) {
            return this;
        }
        final byte[] upper = bytes.clone();
        for (int i = firstLower; i < upper.length; i++) {
            if (upper[i] >= 'a' && upper[i] <= 'z') {
                upper[i] -= 32;
            }
        }
        return new RedisBytes(upper, true);
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length).append(", preview='");
        for (int i = 0; i < Math.min(bytes.length, PREVIEW_LIMIT); i++) {
            final byte b = bytes[i];
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        if (bytes.length > PREVIEW_LIMIT) {
            sb.append("...");
        }
        return sb.append("']").toString();
    }
}
