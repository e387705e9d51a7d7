package site.medis.command.impl;

import site.medis.command.Command;
import site.medis.command.CommandRequest;
import site.medis.command.CommandType;
import site.medis.datastructure.RedisBytes;
import site.medis.protocol.BulkString;
import site.medis.protocol.Resp;
import site.medis.server.context.RedisContext;

/**
 * GET key
 *
 * <p>键存在时回复其值，否则回复null批量字符串。
 */
public class Get implements Command {
    private RedisBytes key;
    private final RedisContext redisContext;

    public Get(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final CommandRequest request) {
        key = request.getArg(0);
    }

    @Override
    public Resp handle() {
        final RedisBytes value = redisContext.get(key);
        // 键不存在时回复null批量字符串
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
