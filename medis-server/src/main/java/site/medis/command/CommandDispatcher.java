package site.medis.command;

import lombok.extern.slf4j.Slf4j;
import site.medis.protocol.Errors;
import site.medis.protocol.Resp;
import site.medis.server.context.RedisContext;

/**
 * 命令分派器
 *
 * <p>查找命令类型、检查参数个数、创建命令并执行。应用层面的错误都转换为错误回复，
 * 连接保持打开：
 * <ul>
 *   <li>未知命令 - "ERR unknown command NAME"</li>
 *   <li>参数个数不对 - "ERR wrong number of arguments for NAME"</li>
 *   <li>执行时的意外异常 - "ERR internal error"</li>
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    /** 命令执行失败错误响应 */
    private static final Errors INTERNAL_ERROR = new Errors("ERR internal error");

    private final RedisContext redisContext;

    public CommandDispatcher(final RedisContext redisContext) {
        if (redisContext == null) {
            throw new IllegalArgumentException("Redis上下文不能为null");
        }
        this.redisContext = redisContext;
    }

    /**
     * 执行一条命令
     *
     * @param request 命令请求
     * @return 回复，不会为null
     */
    public Resp dispatch(final CommandRequest request) {
        // 1. 查找命令
        final CommandType commandType = CommandType.findByBytes(request.getName());
        if (commandType == null) {
            log.debug("未知命令: {}", request.getNameString());
            return new Errors("ERR unknown command " + printable(request.getNameString()));
        }

        // 2. 检查参数个数
        if (!commandType.acceptsArgCount(request.getArgCount())) {
            return new Errors("ERR wrong number of arguments for " + commandType.getCommandName());
        }

        // 3. 执行
        try {
            final Command command = commandType.createCommand(redisContext);
            command.setContext(request);
            return command.handle();
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", commandType, e);
            return INTERNAL_ERROR;
        }
    }

    /**
     * 错误消息中不能出现CR/LF
     */
    private static String printable(final String name) {
        return name.replace('\r', ' ').replace('\n', ' ');
    }
}
