package site.medis.server;

/**
 * 服务器生命周期接口
 *
 * @author medis
 * @since 1.0.0
 */
public interface RedisServer {

    /**
     * 绑定端口并开始接受连接
     *
     * @throws IllegalStateException 如果绑定失败
     */
    void start();

    /**
     * 优雅停止：先关闭监听端口，再等待处理中的请求完成并释放线程
     */
    void stop();
}
