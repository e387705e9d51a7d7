package site.medis.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import site.medis.datastructure.RedisBytes;
import site.medis.protocol.BulkString;
import site.medis.protocol.Errors;
import site.medis.protocol.Resp;
import site.medis.protocol.SimpleString;
import site.medis.server.context.RedisContext;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CommandDispatcher 测试，存储由Mockito替换
 */
@DisplayName("CommandDispatcher 测试")
class CommandDispatcherTest {

    @Mock
    private RedisContext redisContext;

    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        dispatcher = new CommandDispatcher(redisContext);
    }

    @Nested
    @DisplayName("PING")
    class PingTests {

        @Test
        void testPing() {
            assertSame(SimpleString.PONG, dispatcher.dispatch(CommandRequest.of("PING")));
            verifyNoInteractions(redisContext);
        }

        @Test
        @DisplayName("带参数时回显")
        void testPingEcho() {
            assertEquals(BulkString.fromString("hello"), dispatcher.dispatch(CommandRequest.of("ping", "hello")));
        }

        @Test
        void testPingTooManyArgs() {
            assertEquals(new Errors("ERR wrong number of arguments for PING"),
                    dispatcher.dispatch(CommandRequest.of("PING", "a", "b")));
        }
    }

    @Nested
    @DisplayName("SET/GET")
    class SetGetTests {

        @Test
        void testSet() {
            assertSame(SimpleString.OK, dispatcher.dispatch(CommandRequest.of("SET", "foo", "bar")));
            verify(redisContext).put(RedisBytes.fromString("foo"), RedisBytes.fromString("bar"));
        }

        @Test
        void testGetHit() {
            when(redisContext.get(RedisBytes.fromString("foo"))).thenReturn(RedisBytes.fromString("bar"));

            assertEquals(BulkString.fromString("bar"), dispatcher.dispatch(CommandRequest.of("GET", "foo")));
        }

        @Test
        @DisplayName("不存在的键返回null批量字符串")
        void testGetMiss() {
            assertSame(BulkString.NULL, dispatcher.dispatch(CommandRequest.of("GET", "absent")));
        }

        @Test
        void testWrongArgCount() {
            assertEquals(new Errors("ERR wrong number of arguments for SET"),
                    dispatcher.dispatch(CommandRequest.of("SET", "only-key")));
            assertEquals(new Errors("ERR wrong number of arguments for SET"),
                    dispatcher.dispatch(CommandRequest.of("set", "k", "v", "extra")));
            assertEquals(new Errors("ERR wrong number of arguments for GET"),
                    dispatcher.dispatch(CommandRequest.of("GET")));
            verifyNoInteractions(redisContext);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"FOOO", "fooo", "Fooo"})
    @DisplayName("未知命令名以大写形式回复")
    void testUnknownCommand(final String name) {
        final Resp reply = dispatcher.dispatch(CommandRequest.of(name));
        assertEquals(new Errors("ERR unknown command FOOO"), reply);
    }

    @Test
    @DisplayName("命令名中的CR/LF不会破坏错误回复")
    void testUnknownCommandWithCrlf() {
        final Resp reply = dispatcher.dispatch(CommandRequest.of("a\r\nb"));
        assertEquals(new Errors("ERR unknown command A  B"), reply);
    }

    @Test
    @DisplayName("执行异常转换为内部错误回复")
    void testInternalError() {
        doThrow(new IllegalStateException("boom")).when(redisContext).put(any(), any());

        assertEquals(new Errors("ERR internal error"), dispatcher.dispatch(CommandRequest.of("SET", "k", "v")));
    }

    @Test
    void testNullContextRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CommandDispatcher(null));
    }
}
