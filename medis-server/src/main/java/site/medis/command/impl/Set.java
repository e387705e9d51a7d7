package site.medis.command.impl;

import site.medis.command.Command;
import site.medis.command.CommandRequest;
import site.medis.command.CommandType;
import site.medis.datastructure.RedisBytes;
import site.medis.protocol.Resp;
import site.medis.protocol.SimpleString;
import site.medis.server.context.RedisContext;

/**
 * SET key value
 *
 * <p>写入或覆盖键值对，回复OK。
 */
public class Set implements Command {
    private RedisBytes key;
    private RedisBytes value;
    private final RedisContext redisContext;

    public Set(final RedisContext redisContext) {
        this.redisContext = redisContext;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final CommandRequest request) {
        key = request.getArg(0);
        value = request.getArg(1);
    }

    @Override
    public Resp handle() {
        redisContext.put(key, value);
        return SimpleString.OK;
    }
}
