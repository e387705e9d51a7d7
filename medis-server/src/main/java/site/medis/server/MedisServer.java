package site.medis.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.medis.command.CommandDispatcher;
import site.medis.protocol.RespLimits;
import site.medis.protocol.handler.RespDecoder;
import site.medis.protocol.handler.RespEncoder;
import site.medis.server.config.RedisServerConfig;
import site.medis.server.context.RedisContext;
import site.medis.server.context.RedisContextImpl;
import site.medis.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * 基于Netty的服务器实现。
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss线程组接受连接
 *   <li>每个连接固定在一个worker事件循环上完成解码和编码
 *   <li>命令在独立的命令执行线程组上运行
 * </ul>
 *
 * <p>根据操作系统自动选择Epoll、KQueue或NIO传输。
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
@Getter
public class MedisServer implements RedisServer {

    /** 服务器配置 */
    private final RedisServerConfig config;

    /** 服务器Channel类型，根据操作系统自动选择最优实现 */
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private volatile Channel serverChannel;

    /** 服务器上下文 */
    private final RedisContext redisContext;

    private final CommandDispatcher dispatcher;

    private final RespLimits limits;

    public MedisServer(final RedisServerConfig config) {
        this(config, new RedisContextImpl());
    }

    /**
     * 构造函数
     *
     * @param config 服务器配置
     * @param redisContext 命令使用的上下文
     * @throws IllegalArgumentException 如果配置无效
     */
    public MedisServer(final RedisServerConfig config, final RedisContext redisContext) {
        config.validate();
        this.config = config;
        this.redisContext = redisContext;
        this.dispatcher = new CommandDispatcher(redisContext);
        this.limits = config.toRespLimits();

        initializeEventLoopGroups();
        initializeCommandExecutor();
    }

    @Override
    public void start() {
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        // 解码器持有每个连接的帧检测状态，不能共享
                        pipeline.addLast(new RespDecoder(limits));
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("Medis server started at {}:{}", config.getHost(), getBoundPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("服务器启动被中断", e);
        } catch (Exception e) {
            log.error("Medis server start error", e);
            stop();
            throw new IllegalStateException("服务器启动失败: " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    /**
     * 实际监听的端口，配置端口为0时由系统分配
     *
     * @return 端口号，未启动时返回配置值
     */
    public int getBoundPort() {
        final Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress)) {
            return config.getPort();
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /**
     * 优雅停止服务器。
     *
     * <p>按以下顺序关闭各个组件：
     * <ul>
     *   <li>关闭服务器Channel，不再接受新连接
     *   <li>关闭worker线程组，已提交的任务会执行完
     *   <li>关闭boss线程组
     *   <li>关闭命令执行器
     * </ul>
     */
    @Override
    public void stop() {
        final long quiet = config.getShutdownQuietPeriodMillis();
        final long timeout = config.getShutdownTimeoutMillis();
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(quiet, timeout, TimeUnit.MILLISECONDS).sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(quiet, timeout, TimeUnit.MILLISECONDS).sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully(quiet, timeout, TimeUnit.MILLISECONDS).sync();
            }
            log.info("Medis server stopped, {} keys in memory", redisContext.keyCount());
        } catch (InterruptedException e) {
            log.error("Medis server stop error", e);
            Thread.currentThread().interrupt();
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("medis-cmd"));
    }
}
