package site.medis.database;

import lombok.Getter;
import site.medis.datastructure.RedisBytes;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Redis数据库实现类
 *
 * <p>进程内唯一的键值存储，键和值都是不透明字节。所有读写都在同一把
 * {@link ReentrantLock}下串行执行：
 * <ul>
 *     <li>SET完成后开始的GET一定能看到新值</li>
 *     <li>对同一个键的并发SET只保留其中一个值（后写者胜出）</li>
 *     <li>条目创建后只会被覆盖，不会过期</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
public class RedisDB {

    /** 底层数据存储结构 */
    private final Map<RedisBytes, RedisBytes> data = new HashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    /** 数据库标识ID */
    @Getter
    private final int id;

    /**
     * 构造函数
     *
     * @param id 数据库标识ID
     */
    public RedisDB(final int id) {
        this.id = id;
    }

    /**
     * 存储键值对，已存在时覆盖
     *
     * @param key 键
     * @param value 值
     */
    public void put(final RedisBytes key, final RedisBytes value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("键和值都不能为null");
        }
        lock.lock();
        try {
            data.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取指定键的值
     *
     * @param key 要获取的键
     * @return 对应的值，如果键不存在则返回null
     */
    public RedisBytes get(final RedisBytes key) {
        lock.lock();
        try {
            return data.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取数据库中键值对的数量
     *
     * @return 键值对数量
     */
    public long size() {
        lock.lock();
        try {
            return data.size();
        } finally {
            lock.unlock();
        }
    }
}
