package site.medis.command;

import lombok.Getter;
import site.medis.datastructure.RedisBytes;
import site.medis.protocol.BulkString;
import site.medis.protocol.Resp;
import site.medis.protocol.RespArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 命令请求
 *
 * <p>由入站的RESP值映射而来：第一个元素是命令名（已转为大写），其余是参数。
 * 参数按不透明字节保存，不做任何解释。
 *
 * @author medis
 * @since 1.0.0
 */
@Getter
public final class CommandRequest {

    /** 大写形式的命令名 */
    private final RedisBytes name;

    /** 命令参数 */
    private final List<RedisBytes> args;

    private CommandRequest(final RedisBytes name, final List<RedisBytes> args) {
        this.name = name;
        this.args = args;
    }

    /**
     * 将RESP值映射为命令请求
     *
     * <p>只接受非null、非空、元素全部为非null批量字符串的数组。
     *
     * @param resp 入站值
     * @return 命令请求
     * @throws IllegalArgumentException 值不是合法的命令格式时
     */
    public static CommandRequest from(final Resp resp) {
        if (!(resp instanceof RespArray)) {
            throw new IllegalArgumentException("命令必须是数组，实际为: " + (resp == null ? "null" : resp.getType()));
        }
        final RespArray array = (RespArray) resp;
        if (array.size() <= 0) {
            throw new IllegalArgumentException("命令不能为空");
        }

        final List<RedisBytes> parts = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            final Resp element = array.get(i);
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                throw new IllegalArgumentException("命令第 " + i + " 个元素不是批量字符串");
            }
            parts.add(((BulkString) element).getContent());
        }
        final RedisBytes name = parts.get(0).toUpperCase();
        return new CommandRequest(name, Collections.unmodifiableList(parts.subList(1, parts.size())));
    }

    /**
     * 便捷构造，主要用于测试和内部调用
     */
    public static CommandRequest of(final String name, final String... args) {
        final List<RedisBytes> list = new ArrayList<>(args.length);
        for (String arg : args) {
            list.add(RedisBytes.fromString(arg));
        }
        return new CommandRequest(RedisBytes.fromString(name).toUpperCase(), Collections.unmodifiableList(list));
    }

    public String getNameString() {
        return name.getString();
    }

    public int getArgCount() {
        return args.size();
    }

    public RedisBytes getArg(final int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        return "CommandRequest[" + getNameString() + ", args=" + args.size() + "]";
    }
}
