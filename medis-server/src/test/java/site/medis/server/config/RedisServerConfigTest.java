package site.medis.server.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import site.medis.protocol.RespLimits;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("RedisServerConfig 测试")
class RedisServerConfigTest {

    @Test
    @DisplayName("默认配置")
    void testDefaults() {
        final RedisServerConfig config = RedisServerConfig.defaultConfig();

        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getHost()).isEqualTo("0.0.0.0");
        assertThat(config.getCommandExecutorThreadCount()).isEqualTo(1);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    void testToRespLimits() {
        final RespLimits limits = RedisServerConfig.builder()
                .maxBulkLength(1024)
                .maxArrayLength(8)
                .maxInlineLength(256)
                .build()
                .toRespLimits();

        assertThat(limits.getMaxBulkLength()).isEqualTo(1024);
        assertThat(limits.getMaxArrayLength()).isEqualTo(8);
        assertThat(limits.getMaxInlineLength()).isEqualTo(256);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 65536})
    void testInvalidPort(final int port) {
        final RedisServerConfig config = RedisServerConfig.builder().port(port).build();
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("端口0表示由系统分配")
    void testEphemeralPortAllowed() {
        assertThatCode(() -> RedisServerConfig.builder().port(0).build().validate()).doesNotThrowAnyException();
    }

    @Test
    void testInvalidValues() {
        assertThatThrownBy(() -> RedisServerConfig.builder().workerThreadCount(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().backlogSize(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().maxBulkLength(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().maxBulkLength(Integer.MAX_VALUE).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().host(" ").build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RedisServerConfig.builder().shutdownTimeoutMillis(10).shutdownQuietPeriodMillis(20)
                .build().validate())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
