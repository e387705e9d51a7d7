package site.medis;

import org.junit.jupiter.api.Test;
import site.medis.server.config.RedisServerConfig;

import static org.junit.jupiter.api.Assertions.*;

class MedisServerLauncherTest {

    @Test
    void testDefaultPort() {
        assertEquals(6379, MedisServerLauncher.parseArgs(new String[0]).getPort());
    }

    @Test
    void testPortArgument() {
        final RedisServerConfig config = MedisServerLauncher.parseArgs(new String[]{"7000"});
        assertEquals(7000, config.getPort());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> MedisServerLauncher.parseArgs(new String[]{"abc"}));
        assertThrows(IllegalArgumentException.class, () -> MedisServerLauncher.parseArgs(new String[]{"1", "2"}));
    }
}
