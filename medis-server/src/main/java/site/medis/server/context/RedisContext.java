package site.medis.server.context;

import site.medis.datastructure.RedisBytes;

/**
 * 命令执行时可见的服务器上下文
 *
 * <p>命令只通过本接口访问存储，便于在测试中替换。实现必须是线程安全的。
 *
 * @author medis
 * @since 1.0.0
 */
public interface RedisContext {

    /**
     * 获取指定键的值
     *
     * @param key 键
     * @return 值，键不存在时返回null
     */
    RedisBytes get(RedisBytes key);

    /**
     * 存储键值对，已存在时覆盖
     *
     * @param key 键
     * @param value 值
     */
    void put(RedisBytes key, RedisBytes value);

    /**
     * 当前键的数量
     *
     * @return 键数量
     */
    long keyCount();
}
