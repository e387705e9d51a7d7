package site.medis;

import lombok.extern.slf4j.Slf4j;
import site.medis.server.MedisServer;
import site.medis.server.RedisServer;
import site.medis.server.config.RedisServerConfig;

/**
 * 启动入口：{@code MedisServerLauncher [port]}
 */
@Slf4j
public class MedisServerLauncher {

    public static void main(final String[] args) {
        final RedisServerConfig config;
        try {
            config = parseArgs(args);
            config.validate();
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            log.error("用法: MedisServerLauncher [port]");
            System.exit(1);
            return;
        }

        final RedisServer redisServer = new MedisServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
        }, "medis-shutdown"));

        redisServer.start();
    }

    static RedisServerConfig parseArgs(final String[] args) {
        final RedisServerConfig.RedisServerConfigBuilder builder = RedisServerConfig.builder();
        if (args.length > 1) {
            throw new IllegalArgumentException("参数过多");
        }
        if (args.length == 1) {
            try {
                builder.port(Integer.parseInt(args[0].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("端口号不是整数: " + args[0], e);
            }
        }
        return builder.build();
    }
}
