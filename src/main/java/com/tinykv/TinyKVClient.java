package com.tinykv;

import com.tinykv.client.ClientConfig;
import com.tinykv.network.protocol.Command;
import com.tinykv.network.protocol.ProtocolException;
import com.tinykv.network.protocol.Reply;
import com.tinykv.network.protocol.RespCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * TinyKV client library.
 * A blocking client over a single connection. Not thread-safe; use one
 * client per thread.
 */
public class TinyKVClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TinyKVClient.class);
    private static final int BUFFER_SIZE = 8 * 1024;

    private final String host;
    private final int port;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private ByteBuffer readBuffer;
    private volatile boolean closed = false;

    /**
     * Connect to a server.
     *
     * @param host server host
     * @param port server port
     * @throws IOException if the connection cannot be established
     */
    public TinyKVClient(String host, int port) throws IOException {
        this(new ClientConfig(), host, port);
    }

    /**
     * Connect to a server with custom configuration.
     *
     * @param config the client configuration
     * @param host   server host
     * @param port   server port
     * @throws IOException if the connection cannot be established
     */
    public TinyKVClient(ClientConfig config, String host, int port) throws IOException {
        this.host = host;
        this.port = port;
        this.socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(config.getReadTimeoutMs());
            socket.connect(new InetSocketAddress(host, port), config.getConnectTimeoutMs());
            this.in = socket.getInputStream();
            this.out = socket.getOutputStream();
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        this.readBuffer = ByteBuffer.allocate(BUFFER_SIZE);
        this.readBuffer.flip();
        logger.debug("TinyKV client connected to {}:{}", host, port);
    }

    /**
     * Get a value by key.
     *
     * @param key the key to retrieve
     * @return the value if found, empty otherwise
     * @throws IOException if the request fails
     */
    public Optional<byte[]> get(String key) throws IOException {
        validateKey(key);
        Reply reply = call(Command.of("GET", key));
        return reply.isNil() ? Optional.empty() : Optional.of(reply.getBulk());
    }

    /**
     * Get a value as a string.
     *
     * @param key the key to retrieve
     * @return the value as UTF-8 string if found, empty otherwise
     * @throws IOException if the request fails
     */
    public Optional<String> getString(String key) throws IOException {
        return get(key).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    /**
     * Store a value.
     *
     * @param key   the key to store
     * @param value the value to store
     * @throws IOException if the request fails
     */
    public void set(String key, byte[] value) throws IOException {
        validateKey(key);
        call(new Command("SET", Arrays.asList(key.getBytes(StandardCharsets.UTF_8), value)));
    }

    /**
     * Store a string value.
     *
     * @param key   the key to store
     * @param value the string value to store (UTF-8 encoded)
     * @throws IOException if the request fails
     */
    public void set(String key, String value) throws IOException {
        set(key, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Store a string value that expires after the given time.
     *
     * @param key       the key to store
     * @param value     the string value to store (UTF-8 encoded)
     * @param ttlMillis time-to-live in milliseconds, must be positive
     * @throws IOException if the request fails
     */
    public void set(String key, String value, long ttlMillis) throws IOException {
        validateKey(key);
        call(Command.of("SET", key, value, "PX", Long.toString(ttlMillis)));
    }

    /**
     * Delete a key.
     *
     * @param key the key to delete
     * @return true if a live key was removed
     * @throws IOException if the request fails
     */
    public boolean delete(String key) throws IOException {
        validateKey(key);
        return call(Command.of("DEL", key)).getInteger() == 1;
    }

    /**
     * Check if a key exists.
     *
     * @param key the key to check
     * @return true if the key exists
     * @throws IOException if the request fails
     */
    public boolean exists(String key) throws IOException {
        validateKey(key);
        return call(Command.of("EXISTS", key)).getInteger() == 1;
    }

    /**
     * Remove every key.
     *
     * @return the number of keys removed
     * @throws IOException if the request fails
     */
    public long flush() throws IOException {
        return call(Command.of("FLUSH")).getInteger();
    }

    /**
     * Get several values at once.
     *
     * @return one entry per key, empty where the key is absent
     * @throws IOException if the request fails
     */
    public List<Optional<String>> mget(String... keys) throws IOException {
        Reply reply = call(Command.of("MGET", keys));
        List<Optional<String>> values = new ArrayList<>(reply.getElements().size());
        for (Reply element : reply.getElements()) {
            values.add(element.isNil() ? Optional.empty() : Optional.of(element.getBulkString()));
        }
        return values;
    }

    /**
     * Store several key/value pairs, given as alternating keys and values.
     *
     * @return the number of pairs written
     * @throws IOException if the request fails
     */
    public long mset(String... keysAndValues) throws IOException {
        return call(Command.of("MSET", keysAndValues)).getInteger();
    }

    /**
     * Ping the server to check connectivity.
     *
     * @return true if the server responds
     */
    public boolean ping() {
        try {
            Reply reply = execute(Command.of("PING"));
            return reply.getType() == Reply.Type.STATUS && "PONG".equals(reply.getText());
        } catch (IOException e) {
            logger.debug("Ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Send a raw command and return the reply as-is, error replies included.
     *
     * @throws IOException if the connection fails or the reply is malformed
     */
    public Reply execute(Command command) throws IOException {
        ensureOpen();
        ByteBuffer request = RespCodec.encode(command);
        out.write(request.array(), request.position(), request.remaining());
        out.flush();
        return readReply();
    }

    /**
     * Send a command and turn an error reply into an exception.
     */
    private Reply call(Command command) throws IOException {
        Reply reply = execute(command);
        if (reply.isError()) {
            throw new IOException("Server error: " + reply.getText());
        }
        return reply;
    }

    private Reply readReply() throws IOException {
        while (true) {
            try {
                Reply reply = RespCodec.decodeReply(readBuffer);
                if (reply != null) {
                    return reply;
                }
            } catch (ProtocolException e) {
                close();
                throw new IOException("Malformed reply from " + host + ":" + port + ": " + e.getMessage(), e);
            }
            fill();
        }
    }

    private void fill() throws IOException {
        readBuffer.compact();
        if (!readBuffer.hasRemaining()) {
            ByteBuffer larger = ByteBuffer.allocate(readBuffer.capacity() * 2);
            readBuffer.flip();
            larger.put(readBuffer);
            readBuffer = larger;
        }
        int read = in.read(readBuffer.array(), readBuffer.arrayOffset() + readBuffer.position(),
                readBuffer.remaining());
        if (read == -1) {
            readBuffer.flip();
            close();
            throw new IOException("Connection closed by " + host + ":" + port);
        }
        readBuffer.position(readBuffer.position() + read);
        readBuffer.flip();
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Client is closed");
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            try {
                socket.close();
            } catch (IOException e) {
                logger.debug("Error closing connection: {}", e.getMessage());
            }
            logger.debug("TinyKV client closed");
        }
    }

    /**
     * Check if the client is closed.
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Command-line interface for testing.
     */
    public static void main(String[] args) {
        if (args.length < 2) {
            System.out.println("Usage: TinyKVClient <host> <port> [command] [args...]");
            System.out.println("Commands:");
            System.out.println("  get <key>                - Get a value");
            System.out.println("  set <key> <value> [ttl]  - Store a value, optionally expiring after ttl ms");
            System.out.println("  del <key>                - Delete a value");
            System.out.println("  exists <key>             - Check whether a key exists");
            System.out.println("  flush                    - Remove every key");
            System.out.println("  ping                     - Ping the server");
            return;
        }

        String host = args[0];
        int port;
        try {
            port = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            System.err.println("Error: invalid port " + args[1]);
            System.exit(1);
            return;
        }

        try (TinyKVClient client = new TinyKVClient(host, port)) {
            if (args.length == 2 || args[2].equalsIgnoreCase("ping")) {
                boolean ok = client.ping();
                System.out.println(ok ? "PONG" : "Connection failed");
                return;
            }

            String command = args[2];
            switch (command.toLowerCase(Locale.ROOT)) {
                case "get":
                    if (args.length < 4) {
                        System.out.println("Usage: get <key>");
                        return;
                    }
                    Optional<String> value = client.getString(args[3]);
                    System.out.println(value.orElse("(nil)"));
                    break;

                case "set":
                    if (args.length < 5) {
                        System.out.println("Usage: set <key> <value> [ttl]");
                        return;
                    }
                    if (args.length > 5) {
                        client.set(args[3], args[4], Long.parseLong(args[5]));
                    } else {
                        client.set(args[3], args[4]);
                    }
                    System.out.println("OK");
                    break;

                case "del":
                    if (args.length < 4) {
                        System.out.println("Usage: del <key>");
                        return;
                    }
                    System.out.println(client.delete(args[3]) ? "1" : "0");
                    break;

                case "exists":
                    if (args.length < 4) {
                        System.out.println("Usage: exists <key>");
                        return;
                    }
                    System.out.println(client.exists(args[3]) ? "1" : "0");
                    break;

                case "flush":
                    System.out.println(client.flush());
                    break;

                default:
                    System.out.println("Unknown command: " + command);
            }
        } catch (IOException | NumberFormatException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
