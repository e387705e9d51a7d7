package site.medis.command;

import site.medis.protocol.Resp;

/**
 * 命令接口
 *
 * <p>每次请求创建一个新实例：先通过{@link #setContext(CommandRequest)}注入参数，
 * 再调用{@link #handle()}得到回复。参数个数已由{@link CommandDispatcher}按
 * {@link CommandType}的声明检查过。
 *
 * @author medis
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 设置命令参数
     *
     * @param request 命令请求
     */
    void setContext(CommandRequest request);

    /**
     * 执行命令并返回结果
     *
     * @return RESP协议格式的执行结果
     */
    Resp handle();
}
