package site.medis.command.impl;

import site.medis.command.Command;
import site.medis.command.CommandRequest;
import site.medis.command.CommandType;
import site.medis.datastructure.RedisBytes;
import site.medis.protocol.BulkString;
import site.medis.protocol.Resp;
import site.medis.protocol.SimpleString;

/**
 * PING [message]
 *
 * <p>无参数时回复PONG，带一个参数时原样回显。
 */
public class Ping implements Command {
    private RedisBytes message;

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final CommandRequest request) {
        message = request.getArgCount() == 1 ? request.getArg(0) : null;
    }

    @Override
    public Resp handle() {
        if (message == null) {
            return SimpleString.PONG;
        }
        return new BulkString(message);
    }
}
