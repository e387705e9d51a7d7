package site.medis.server.context;

import site.medis.database.RedisDB;
import site.medis.datastructure.RedisBytes;

/**
 * 基于单个{@link RedisDB}的上下文实现
 *
 * @author medis
 * @since 1.0.0
 */
public class RedisContextImpl implements RedisContext {

    private final RedisDB database;

    public RedisContextImpl() {
        this(new RedisDB(0));
    }

    public RedisContextImpl(final RedisDB database) {
        if (database == null) {
            throw new IllegalArgumentException("数据库不能为null");
        }
        this.database = database;
    }

    @Override
    public RedisBytes get(final RedisBytes key) {
        return database.get(key);
    }

    @Override
    public void put(final RedisBytes key, final RedisBytes value) {
        database.put(key, value);
    }

    @Override
    public long keyCount() {
        return database.size();
    }
}
