package site.medis.server.config;

import lombok.Builder;
import lombok.Data;
import site.medis.protocol.RespLimits;

/**
 * 服务器配置类，统一管理所有服务器配置参数。
 *
 * <p>主要配置包括：
 * <ul>
 *   <li>网络配置：主机地址、端口、连接参数
 *   <li>线程配置：boss、worker和命令执行线程数
 *   <li>协议配置：批量字符串、数组和单行的长度上限
 * </ul>
 *
 * @author medis
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    /** 服务器监听地址，0.0.0.0表示所有网卡 */
    @Builder.Default
    private String host = "0.0.0.0";

    /** 服务器监听端口，0表示由系统分配 */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接） */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O） */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /** 命令执行器线程数 */
    @Builder.Default
    private int commandExecutorThreadCount = 1;

    /** 关闭时的静默期（毫秒） */
    @Builder.Default
    private long shutdownQuietPeriodMillis = 100;

    /** 关闭时等待的最长时间（毫秒） */
    @Builder.Default
    private long shutdownTimeoutMillis = 15_000;

    // ========== 协议配置 ==========

    /** 批量字符串最大长度 */
    @Builder.Default
    private long maxBulkLength = RespLimits.DEFAULT.getMaxBulkLength();

    /** 数组最大元素数 */
    @Builder.Default
    private long maxArrayLength = RespLimits.DEFAULT.getMaxArrayLength();

    /** 没有CRLF的单行最大长度 */
    @Builder.Default
    private int maxInlineLength = RespLimits.DEFAULT.getMaxInlineLength();

    /**
     * 创建默认配置
     *
     * @return 默认配置实例
     */
    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 协议层使用的长度上限
     */
    public RespLimits toRespLimits() {
        return RespLimits.builder()
                .maxBulkLength(maxBulkLength)
                .maxArrayLength(maxArrayLength)
                .maxInlineLength(maxInlineLength)
                .build();
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (shutdownQuietPeriodMillis < 0 || shutdownTimeoutMillis < shutdownQuietPeriodMillis) {
            throw new IllegalArgumentException("关闭超时时间不能小于静默期");
        }

        if (maxBulkLength <= 0 || maxArrayLength <= 0 || maxInlineLength <= 0) {
            throw new IllegalArgumentException("协议长度上限必须大于0");
        }

        if (maxBulkLength > Integer.MAX_VALUE - 64) {
            throw new IllegalArgumentException("批量字符串上限超出单个缓冲区的容量");
        }
    }
}
