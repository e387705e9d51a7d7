package site.medis.client;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.medis.protocol.BulkString;
import site.medis.protocol.Resp;
import site.medis.protocol.RespArray;
import site.medis.protocol.RespStreamReader;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * 阻塞式客户端
 *
 * <p>把命令编码为批量字符串数组发出，再用{@link RespStreamReader}读取一个回复。
 * 一个实例对应一条连接，方法之间互斥，可在多个线程间共享但请求会串行。
 *
 * <pre>{@code
 * try (MedisClient client = new MedisClient("127.0.0.1", 6379)) {
 *     client.execute("SET", "foo", "bar");
 *     Resp value = client.execute("GET", "foo");
 * }
 * }</pre>
 *
 * @author medis
 * @since 1.0.0
 */
@Slf4j
public class MedisClient implements Closeable {

    /** 默认连接和读取超时（毫秒） */
    public static final int DEFAULT_TIMEOUT_MILLIS = 5000;

    @Getter
    private final String host;

    @Getter
    private final int port;

    private final Socket socket;

    private final OutputStream out;

    private final RespStreamReader reader;

    public MedisClient(final String host, final int port) throws IOException {
        this(host, port, DEFAULT_TIMEOUT_MILLIS);
    }

    /**
     * 建立连接
     *
     * @param host 服务器地址
     * @param port 服务器端口
     * @param timeoutMillis 连接和读取超时，0表示不超时
     * @throws IOException 连接失败时
     */
    public MedisClient(final String host, final int port, final int timeoutMillis) throws IOException {
        this.host = host;
        this.port = port;
        this.socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(timeoutMillis);
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            this.out = new BufferedOutputStream(socket.getOutputStream());
            this.reader = new RespStreamReader(socket.getInputStream());
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        log.debug("已连接到 {}:{}", host, port);
    }

    /**
     * 发送命令并等待回复，各部分以UTF-8编码
     *
     * @param parts 命令名和参数
     * @return 服务器回复
     * @throws IOException 连接失败或服务器关闭连接时
     */
    public Resp execute(final String... parts) throws IOException {
        final byte[][] bytes = new byte[parts.length][];
        for (int i = 0; i < parts.length; i++) {
            bytes[i] = parts[i].getBytes(StandardCharsets.UTF_8);
        }
        return execute(bytes);
    }

    /**
     * 发送二进制命令并等待回复
     *
     * @param parts 命令名和参数
     * @return 服务器回复
     * @throws IOException 连接失败或服务器关闭连接时
     */
    public synchronized Resp execute(final byte[]... parts) throws IOException {
        if (parts.length == 0) {
            throw new IllegalArgumentException("命令不能为空");
        }
        final Resp[] elements = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = BulkString.create(parts[i]);
        }
        out.write(RespArray.valueOf(elements).toBytes());
        out.flush();
        return reader.readNext();
    }

    /**
     * 发送原始字节，不等待回复
     */
    public synchronized void sendRaw(final byte[] data) throws IOException {
        out.write(data);
        out.flush();
    }

    /**
     * 读取下一个回复
     */
    public synchronized Resp readReply() throws IOException {
        return reader.readNext();
    }

    public boolean isConnected() {
        return socket.isConnected() && !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        socket.close();
        log.debug("已断开 {}:{}", host, port);
    }
}
