package com.tinykv.network;

import com.tinykv.command.CommandInterpreter;
import com.tinykv.network.protocol.Command;
import com.tinykv.network.protocol.ProtocolException;
import com.tinykv.network.protocol.Reply;
import com.tinykv.network.protocol.RespCodec;
import com.tinykv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.LinkedList;
import java.util.Queue;
import java.util.concurrent.ExecutorService;

/**
 * One client connection.
 * Owns the read/write buffers, decodes requests, and executes them one at a
 * time on the worker pool so that replies leave in request order.
 * <p>
 * Both queues are bounded by backpressure rather than by disconnecting: a
 * full command queue stops decoding and reading from the socket, and a full
 * response queue stops command execution until the client drains its replies.
 */
public class ConnectionSession {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionSession.class);
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int MAX_QUEUED_RESPONSES = 1024;
    private static final int MAX_QUEUED_COMMANDS = 1024;
    // Largest frame we are willing to buffer: one maximal bulk plus its header lines
    private static final int MAX_READ_BUFFER_SIZE = RespCodec.MAX_BULK_LENGTH + RespCodec.MAX_INLINE_LENGTH;
    // Timeout for completing a request frame (30 seconds)
    static final long INCOMPLETE_FRAME_TIMEOUT_MS = 30_000;

    private final SocketChannel channel;
    private final CommandInterpreter interpreter;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final ExecutorService workerPool;
    private final Selector selector;
    private ByteBuffer readBuffer;
    private final ByteBuffer writeBuffer;
    private final String clientAddress;
    private final Queue<ByteBuffer> pendingResponses;
    private final Queue<PendingRequest> pendingCommands;
    private ByteBuffer currentResponse;
    private boolean closed = false;
    private volatile SelectionKey selectionKey;
    private boolean commandInProgress = false;
    private boolean writeInProgress = false;
    // Read interest is cleared while set; written only on the selector thread
    private volatile boolean readPaused = false;

    // Set while the read buffer holds the start of a frame that hasn't completed
    private volatile long incompleteFrameStartTime = 0;

    private final Object interestOpsLock = new Object();

    public ConnectionSession(SocketChannel channel, CommandInterpreter interpreter, MetricsCollector metrics,
            TcpServer server, ExecutorService workerPool, Selector selector) {
        this.channel = channel;
        this.interpreter = interpreter;
        this.metrics = metrics;
        this.server = server;
        this.workerPool = workerPool;
        this.selector = selector;
        this.readBuffer = ByteBuffer.allocateDirect(BUFFER_SIZE);
        this.writeBuffer = ByteBuffer.allocateDirect(BUFFER_SIZE);
        this.clientAddress = getClientAddress();
        this.pendingResponses = new LinkedList<>();
        this.pendingCommands = new LinkedList<>();
        metrics.connectionOpened();
        logger.debug("New connection from {}", clientAddress);
    }

    private String getClientAddress() {
        try {
            return channel.getRemoteAddress().toString();
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Handle a read event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleRead(SelectionKey key) {
        if (this.selectionKey == null) {
            this.selectionKey = key;
        }

        try {
            int bytesRead = channel.read(readBuffer);
            if (bytesRead == -1) {
                logger.debug("Client {} disconnected", clientAddress);
                return false;
            }
            if (bytesRead == 0) {
                return true;
            }

            if (!processReadBuffer()) {
                return false;
            }
            return checkLeftoverBytes();
        } catch (IOException e) {
            logger.warn("Read error from {}: {}", clientAddress, e.getMessage());
            return false;
        }
    }

    /**
     * Resume a paused reader once the queues have drained below half.
     * Decodes the requests still buffered before re-enabling read interest.
     * Called on the selector thread after every select.
     *
     * @return false if the connection must be closed
     */
    boolean resumeReadingIfDrained() {
        if (!readPaused || isClosed() || isBackedUp(MAX_QUEUED_COMMANDS / 2, MAX_QUEUED_RESPONSES / 2)) {
            return true;
        }
        readPaused = false;
        logger.trace("Resuming reads from {}", clientAddress);

        if (!processReadBuffer()) {
            return false;
        }
        if (!readPaused) {
            setReadInterest(true);
        }
        return checkLeftoverBytes();
    }

    /**
     * Track the bytes left in the read buffer after decoding.
     * The buffer is in write mode; while reading runs, leftover bytes are an
     * incomplete frame.
     *
     * @return false if the connection must be closed
     */
    private boolean checkLeftoverBytes() {
        if (readPaused || readBuffer.position() == 0) {
            // Paused leftovers are complete requests waiting for queue space
            incompleteFrameStartTime = 0;
            return true;
        }
        if (incompleteFrameStartTime == 0) {
            incompleteFrameStartTime = System.currentTimeMillis();
            logger.trace("Started tracking incomplete frame from {}", clientAddress);
        } else if (isFrameTimedOut(System.currentTimeMillis())) {
            logger.warn("Connection from {} exceeded incomplete frame timeout ({}ms), closing",
                    clientAddress, INCOMPLETE_FRAME_TIMEOUT_MS);
            return false;
        }
        if (readBuffer.position() == readBuffer.capacity()) {
            return growReadBuffer();
        }
        return true;
    }

    private boolean isBackedUp(int commandLimit, int responseLimit) {
        synchronized (pendingCommands) {
            if (pendingCommands.size() >= commandLimit) {
                return true;
            }
        }
        synchronized (this) {
            return pendingResponses.size() >= responseLimit;
        }
    }

    private void setReadInterest(boolean enabled) {
        SelectionKey key = selectionKey;
        if (key == null) {
            return;
        }
        synchronized (interestOpsLock) {
            if (key.isValid()) {
                int ops = enabled
                        ? key.interestOps() | SelectionKey.OP_READ
                        : key.interestOps() & ~SelectionKey.OP_READ;
                key.interestOps(ops);
            }
        }
    }

    boolean isReadPaused() {
        return readPaused;
    }

    /**
     * Decode every complete request in the read buffer and queue it.
     *
     * @return false if the connection must be closed
     */
    private boolean processReadBuffer() {
        readBuffer.flip();
        try {
            while (readBuffer.hasRemaining()) {
                if (isBackedUp(MAX_QUEUED_COMMANDS, MAX_QUEUED_RESPONSES)) {
                    // Undecoded bytes stay buffered until the queues drain
                    readPaused = true;
                    setReadInterest(false);
                    logger.debug("Queues full for {}, pausing reads", clientAddress);
                    break;
                }
                PendingRequest request;
                try {
                    Command command = RespCodec.decodeCommand(readBuffer);
                    if (command == null) {
                        break;
                    }
                    request = new PendingRequest(command, null);
                } catch (ProtocolException e) {
                    if (e.isFatal()) {
                        logger.warn("Protocol violation from {} (closing connection): {}",
                                clientAddress, e.getMessage());
                        return false;
                    }
                    logger.debug("Protocol error from {}: {}", clientAddress, e.getMessage());
                    metrics.recordError();
                    // Goes through the command queue so the error keeps its place in the reply order
                    request = new PendingRequest(null, Reply.error("ERROR: " + e.getMessage()));
                }

                synchronized (pendingCommands) {
                    pendingCommands.offer(request);
                }
                processNextCommand();
            }
            return true;
        } finally {
            readBuffer.compact();
        }
    }

    /**
     * Process the next queued request if one is not already being processed.
     * Requests of one connection run one at a time, in arrival order. Nothing
     * runs while the response queue is full; the write path restarts it.
     */
    private void processNextCommand() {
        PendingRequest request;
        synchronized (pendingCommands) {
            if (commandInProgress || pendingCommands.isEmpty()) {
                return;
            }
            synchronized (this) {
                if (closed || pendingResponses.size() >= MAX_QUEUED_RESPONSES) {
                    return;
                }
            }
            request = pendingCommands.poll();
            commandInProgress = true;
        }
        if (readPaused) {
            // Let the selector thread see the freed queue slot
            selector.wakeup();
        }

        // Submitted outside the lock: CallerRunsPolicy may run the task on this thread
        workerPool.submit(() -> {
            try {
                queueResponse(execute(request));
            } finally {
                synchronized (pendingCommands) {
                    commandInProgress = false;
                }
                processNextCommand();
            }
        });
    }

    private Reply execute(PendingRequest request) {
        if (request.reply != null) {
            return request.reply;
        }
        Command command = request.command;
        try {
            return interpreter.execute(command);
        } catch (RuntimeException e) {
            logger.error("Error processing command {} from {}: {}", command.getName(), clientAddress,
                    e.toString(), e);
            metrics.recordError();
            return Reply.error(CommandInterpreter.ERR_INTERNAL);
        }
    }

    /**
     * Queue an encoded reply and wake up the selector to write it.
     * Thread-safe - can be called from any worker thread.
     */
    private void queueResponse(Reply reply) {
        ByteBuffer encoded = RespCodec.encode(reply);

        synchronized (this) {
            if (closed) {
                return; // Connection closed, discard response
            }

            // Bounded by processNextCommand, which starts nothing while the queue is full
            pendingResponses.offer(encoded);

            if (!writeInProgress && selectionKey != null && selectionKey.isValid()) {
                writeInProgress = true;
                synchronized (interestOpsLock) {
                    if (selectionKey.isValid()) {
                        selectionKey.interestOps(selectionKey.interestOps() | SelectionKey.OP_WRITE);
                    }
                }
                selector.wakeup();
            }
        }
    }

    private void drainToWriteBuffer() {
        while (writeBuffer.hasRemaining()) {
            if (currentResponse == null || !currentResponse.hasRemaining()) {
                currentResponse = pendingResponses.poll();
                if (currentResponse == null) {
                    break;
                }
            }

            int toWrite = Math.min(writeBuffer.remaining(), currentResponse.remaining());
            if (toWrite > 0) {
                int oldLimit = currentResponse.limit();
                currentResponse.limit(currentResponse.position() + toWrite);
                writeBuffer.put(currentResponse);
                currentResponse.limit(oldLimit);
            }
        }
    }

    /**
     * Handle a write event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleWrite(SelectionKey key) {
        boolean ok = writePending(key);
        if (ok) {
            // Restart execution that stopped on a full response queue
            processNextCommand();
        }
        return ok;
    }

    private boolean writePending(SelectionKey key) {
        synchronized (this) {
            try {
                drainToWriteBuffer();
                writeBuffer.flip();
                channel.write(writeBuffer);
                writeBuffer.compact();

                drainToWriteBuffer();

                boolean allWritten = writeBuffer.position() == 0
                        && pendingResponses.isEmpty()
                        && (currentResponse == null || !currentResponse.hasRemaining());

                if (allWritten) {
                    writeInProgress = false;
                    currentResponse = null;
                    synchronized (interestOpsLock) {
                        if (key.isValid()) {
                            key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
                        }
                    }
                }
                return true;
            } catch (IOException e) {
                logger.warn("Write error to {}: {}", clientAddress, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Grow the read buffer to accommodate a larger frame.
     * The buffer must be in write mode; unread bytes are preserved at the start.
     *
     * @return false if the buffer is already at its maximum size
     */
    private boolean growReadBuffer() {
        int currentCapacity = readBuffer.capacity();
        if (currentCapacity >= MAX_READ_BUFFER_SIZE) {
            logger.warn("Frame from {} exceeds maximum size of {} bytes, closing", clientAddress,
                    MAX_READ_BUFFER_SIZE);
            return false;
        }

        int newCapacity = (int) Math.min((long) currentCapacity * 2, MAX_READ_BUFFER_SIZE);
        logger.debug("Growing read buffer from {} to {} bytes for {}", currentCapacity, newCapacity,
                clientAddress);

        ByteBuffer newBuffer = ByteBuffer.allocateDirect(newCapacity);
        readBuffer.flip();
        newBuffer.put(readBuffer);
        readBuffer = newBuffer;
        return true;
    }

    /**
     * Check whether a partially received frame has been pending for too long.
     *
     * @param now current time in milliseconds
     */
    boolean isFrameTimedOut(long now) {
        long started = incompleteFrameStartTime;
        return started > 0 && now - started > INCOMPLETE_FRAME_TIMEOUT_MS;
    }

    /**
     * Close this connection and release its buffers.
     * Idempotent and thread-safe. A command already running on a worker
     * finishes; its reply is discarded.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            pendingResponses.clear();
            currentResponse = null;
        }
        synchronized (pendingCommands) {
            pendingCommands.clear();
        }

        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        if (server != null) {
            server.removeConnection(channel);
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public boolean isClosed() {
        synchronized (this) {
            return closed;
        }
    }

    public String getRemoteAddress() {
        return clientAddress;
    }

    /**
     * A decoded command, or a reply already decided by the decoder.
     */
    private static final class PendingRequest {
        final Command command;
        final Reply reply;

        PendingRequest(Command command, Reply reply) {
            this.command = command;
            this.reply = reply;
        }
    }
}
