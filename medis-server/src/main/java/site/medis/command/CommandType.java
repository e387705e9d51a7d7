package site.medis.command;

import lombok.Getter;
import site.medis.command.impl.Get;
import site.medis.command.impl.Ping;
import site.medis.command.impl.Set;
import site.medis.datastructure.RedisBytes;
import site.medis.server.context.RedisContext;

import java.util.HashMap;
import java.util.Map;

/**
 * 命令类型枚举，定义了系统支持的所有命令及其参数个数。
 *
 * <p>命令名大小写不敏感：查找时先直接命中缓存，未命中再转为大写查找。
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** PING命令：测试服务器连接，可选一个回显参数 */
    PING("PING", 0, 1),
    /** SET命令：设置键值对 */
    SET("SET", 2, 2),
    /** GET命令：获取键值 */
    GET("GET", 1, 1);

    /** 命令查找缓存 */
    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    /** 命令名 */
    private final String commandName;

    /** 命令名的字节形式 */
    private final RedisBytes commandBytes;

    /** 最少参数个数（不含命令名） */
    private final int minArgs;

    /** 最多参数个数（不含命令名） */
    private final int maxArgs;

    CommandType(final String commandName, final int minArgs, final int maxArgs) {
        this.commandName = commandName;
        this.commandBytes = RedisBytes.fromString(commandName);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    /**
     * 根据命令名查找命令类型，大小写不敏感
     *
     * @param commandBytes 命令名
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        return COMMAND_CACHE.get(commandBytes.toUpperCase());
    }

    /**
     * 参数个数是否符合声明
     *
     * @param argCount 参数个数（不含命令名）
     */
    public boolean acceptsArgCount(final int argCount) {
        return argCount >= minArgs && argCount <= maxArgs;
    }

    /**
     * 使用上下文创建命令实例
     *
     * @param context 服务器上下文
     * @return 命令实例
     */
    public Command createCommand(final RedisContext context) {
        switch (this) {
            case PING:
                return new Ping();
            case SET:
                return new Set(context);
            case GET:
                return new Get(context);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
