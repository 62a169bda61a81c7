package com.tinykv.network.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP wire protocol encoder/decoder for TinyKV.
 *
 * Requests are either RESP arrays of bulk strings or inline commands:
 * <pre>
 *   *3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n
 *   SET k v\r\n
 * </pre>
 * Replies use the RESP2 types: {@code +status}, {@code -error}, {@code :integer},
 * {@code $len bulk}, {@code $-1} (nil) and {@code *count} arrays.
 *
 * Line terminators are CRLF; a bare LF is accepted on request lines so that
 * plain line-oriented clients work. Bulk payloads must end with CRLF.
 *
 * All decode methods work on a buffer in read mode. They return null and leave
 * the position untouched when the buffer does not yet hold a complete frame.
 */
public final class RespCodec {

    // Maximum sizes
    public static final int MAX_INLINE_LENGTH = 64 * 1024;          // 64KB per line
    public static final int MAX_BULK_LENGTH = 16 * 1024 * 1024;     // 16MB per bulk string
    public static final int MAX_ARRAY_ELEMENTS = 1024;

    private static final long INVALID_NUMBER = Long.MIN_VALUE;
    private static final byte[] NIL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespCodec() {
        // Utility class
    }

    // ==================== Request decoding ====================

    /**
     * Decode the next command from a buffer.
     * Blank inline lines are skipped.
     *
     * @param buffer the buffer to decode from, in read mode
     * @return the decoded command, or null if no complete command is buffered
     * @throws ProtocolException if the data is malformed; when not fatal, the
     *                           offending line or array has been consumed
     */
    public static Command decodeCommand(ByteBuffer buffer) {
        while (buffer.hasRemaining()) {
            int start = buffer.position();
            int lineEnd = findLineEnd(buffer, start);
            if (lineEnd < 0) {
                checkLineLength(buffer, start);
                return null;
            }
            if (buffer.get(start) == '*') {
                return decodeArray(buffer, start, lineEnd);
            }
            List<byte[]> parts = splitInline(buffer, start, contentEnd(buffer, start, lineEnd));
            buffer.position(lineEnd + 1);
            if (!parts.isEmpty()) {
                return Command.fromParts(parts);
            }
        }
        return null;
    }

    private static Command decodeArray(ByteBuffer buffer, int start, int headerEnd) {
        long count = parseNumber(buffer, start + 1, contentEnd(buffer, start, headerEnd));
        if (count == INVALID_NUMBER) {
            buffer.position(headerEnd + 1);
            throw new ProtocolException("Protocol error: invalid multibulk length");
        }
        if (count <= 0) {
            buffer.position(headerEnd + 1);
            throw new ProtocolException("Missing command");
        }
        if (count > MAX_ARRAY_ELEMENTS) {
            throw new ProtocolException("Protocol error: too many arguments (" + count + ")", true);
        }

        int pos = headerEnd + 1;
        List<byte[]> parts = new ArrayList<>((int) count);
        // A bad element is skipped so the rest of its array is consumed with it
        String error = null;
        for (int i = 0; i < count; i++) {
            if (pos >= buffer.limit()) {
                return null;
            }
            int elementEnd = findLineEnd(buffer, pos);
            if (elementEnd < 0) {
                checkLineLength(buffer, pos);
                return null;
            }
            byte type = buffer.get(pos);
            int content = contentEnd(buffer, pos, elementEnd);
            if (type == '$') {
                long length = parseNumber(buffer, pos + 1, content);
                if (length == INVALID_NUMBER || length < 0) {
                    if (error == null) {
                        error = "Protocol error: invalid bulk length";
                    }
                    pos = elementEnd + 1;
                    continue;
                }
                if (length > MAX_BULK_LENGTH) {
                    throw new ProtocolException("Protocol error: bulk length " + length + " exceeds limit", true);
                }
                int dataStart = elementEnd + 1;
                int dataEnd = dataStart + (int) length;
                if (dataEnd + 2 > buffer.limit()) {
                    return null;
                }
                if (buffer.get(dataEnd) != '\r' || buffer.get(dataEnd + 1) != '\n') {
                    throw new ProtocolException("Protocol error: bulk string not terminated by CRLF", true);
                }
                parts.add(copy(buffer, dataStart, dataEnd));
                pos = dataEnd + 2;
            } else if (type == '+' || type == ':') {
                parts.add(copy(buffer, pos + 1, content));
                pos = elementEnd + 1;
            } else {
                if (error == null) {
                    error = "Protocol error: expected '$', got '" + (char) type + "'";
                }
                pos = elementEnd + 1;
            }
        }

        buffer.position(pos);
        if (error != null) {
            throw new ProtocolException(error);
        }
        if (parts.get(0).length == 0) {
            throw new ProtocolException("Missing command");
        }
        return Command.fromParts(parts);
    }

    private static List<byte[]> splitInline(ByteBuffer buffer, int from, int to) {
        List<byte[]> parts = new ArrayList<>();
        int tokenStart = -1;
        for (int i = from; i < to; i++) {
            byte b = buffer.get(i);
            boolean space = b == ' ' || b == '\t';
            if (space && tokenStart >= 0) {
                parts.add(copy(buffer, tokenStart, i));
                tokenStart = -1;
            } else if (!space && tokenStart < 0) {
                tokenStart = i;
            }
        }
        if (tokenStart >= 0) {
            parts.add(copy(buffer, tokenStart, to));
        }
        return parts;
    }

    private static void checkLineLength(ByteBuffer buffer, int lineStart) {
        if (buffer.limit() - lineStart > MAX_INLINE_LENGTH) {
            throw new ProtocolException("Protocol error: line exceeds " + MAX_INLINE_LENGTH + " bytes", true);
        }
    }

    // ==================== Reply encoding ====================

    /**
     * Encode a reply into a ByteBuffer.
     *
     * @param reply the reply to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(Reply reply) {
        ByteBuffer buffer = ByteBuffer.allocate(encodedLength(reply));
        write(reply, buffer);
        buffer.flip();
        return buffer;
    }

    private static int encodedLength(Reply reply) {
        switch (reply.getType()) {
            case STATUS:
            case ERROR:
                return 1 + reply.getText().getBytes(StandardCharsets.UTF_8).length + 2;
            case INTEGER:
                return 1 + Long.toString(reply.getInteger()).length() + 2;
            case BULK:
                return bulkLength(reply.getBulkUnsafe().length);
            case NIL:
                return NIL_BULK.length;
            default:
                int total = 1 + Integer.toString(reply.getElements().size()).length() + 2;
                for (Reply element : reply.getElements()) {
                    total += encodedLength(element);
                }
                return total;
        }
    }

    private static void write(Reply reply, ByteBuffer buffer) {
        switch (reply.getType()) {
            case STATUS:
                writeLine(buffer, '+', reply.getText().getBytes(StandardCharsets.UTF_8));
                break;
            case ERROR:
                writeLine(buffer, '-', reply.getText().getBytes(StandardCharsets.UTF_8));
                break;
            case INTEGER:
                writeLine(buffer, ':', ascii(reply.getInteger()));
                break;
            case BULK:
                writeBulk(buffer, reply.getBulkUnsafe());
                break;
            case NIL:
                buffer.put(NIL_BULK);
                break;
            default:
                writeLine(buffer, '*', ascii(reply.getElements().size()));
                for (Reply element : reply.getElements()) {
                    write(element, buffer);
                }
        }
    }

    // ==================== Request encoding (client side) ====================

    /**
     * Encode a command as a RESP array of bulk strings.
     *
     * @param command the command to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(Command command) {
        byte[] name = command.getName().getBytes(StandardCharsets.UTF_8);
        int parts = command.argCount() + 1;
        int total = 1 + Integer.toString(parts).length() + 2 + bulkLength(name.length);
        for (int i = 0; i < command.argCount(); i++) {
            total += bulkLength(command.getArgUnsafe(i).length);
        }

        ByteBuffer buffer = ByteBuffer.allocate(total);
        writeLine(buffer, '*', ascii(parts));
        writeBulk(buffer, name);
        for (int i = 0; i < command.argCount(); i++) {
            writeBulk(buffer, command.getArgUnsafe(i));
        }
        buffer.flip();
        return buffer;
    }

    // ==================== Reply decoding (client side) ====================

    /**
     * Decode a reply from a ByteBuffer.
     *
     * @param buffer the buffer to decode from, in read mode
     * @return the decoded reply, or null if the buffer holds no complete reply
     * @throws ProtocolException if the data is invalid
     */
    public static Reply decodeReply(ByteBuffer buffer) {
        int[] cursor = {buffer.position()};
        Reply reply = readReply(buffer, cursor);
        if (reply != null) {
            buffer.position(cursor[0]);
        }
        return reply;
    }

    private static Reply readReply(ByteBuffer buffer, int[] cursor) {
        int pos = cursor[0];
        if (pos >= buffer.limit()) {
            return null;
        }
        int lineEnd = findLineEnd(buffer, pos);
        if (lineEnd < 0) {
            return null;
        }
        byte type = buffer.get(pos);
        int content = contentEnd(buffer, pos, lineEnd);
        cursor[0] = lineEnd + 1;

        switch (type) {
            case '+':
                return Reply.status(new String(copy(buffer, pos + 1, content), StandardCharsets.UTF_8));
            case '-':
                return Reply.error(new String(copy(buffer, pos + 1, content), StandardCharsets.UTF_8));
            case ':': {
                long value = parseNumber(buffer, pos + 1, content);
                if (value == INVALID_NUMBER) {
                    throw new ProtocolException("Invalid integer reply");
                }
                return Reply.integer(value);
            }
            case '$': {
                long length = parseNumber(buffer, pos + 1, content);
                if (length == -1) {
                    return Reply.nil();
                }
                if (length < 0 || length > MAX_BULK_LENGTH) {
                    throw new ProtocolException("Invalid bulk reply length: " + length);
                }
                int dataStart = lineEnd + 1;
                int dataEnd = dataStart + (int) length;
                if (dataEnd + 2 > buffer.limit()) {
                    return null;
                }
                if (buffer.get(dataEnd) != '\r' || buffer.get(dataEnd + 1) != '\n') {
                    throw new ProtocolException("Bulk reply not terminated by CRLF");
                }
                cursor[0] = dataEnd + 2;
                return Reply.bulk(copy(buffer, dataStart, dataEnd));
            }
            case '*': {
                long count = parseNumber(buffer, pos + 1, content);
                if (count == -1) {
                    return Reply.nil();
                }
                if (count < 0 || count > Integer.MAX_VALUE) {
                    throw new ProtocolException("Invalid array reply length: " + count);
                }
                List<Reply> elements = new ArrayList<>();
                for (int i = 0; i < count; i++) {
                    Reply element = readReply(buffer, cursor);
                    if (element == null) {
                        return null;
                    }
                    elements.add(element);
                }
                return Reply.array(elements);
            }
            default:
                throw new ProtocolException("Unknown reply type: '" + (char) type + "'");
        }
    }

    // ==================== Helpers ====================

    private static int bulkLength(int payload) {
        return 1 + Integer.toString(payload).length() + 2 + payload + 2;
    }

    private static void writeLine(ByteBuffer buffer, char prefix, byte[] content) {
        buffer.put((byte) prefix);
        buffer.put(content);
        buffer.put((byte) '\r');
        buffer.put((byte) '\n');
    }

    private static void writeBulk(ByteBuffer buffer, byte[] data) {
        writeLine(buffer, '$', ascii(data.length));
        buffer.put(data);
        buffer.put((byte) '\r');
        buffer.put((byte) '\n');
    }

    private static byte[] ascii(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Index of the next LF at or after {@code from}, or -1.
     */
    private static int findLineEnd(ByteBuffer buffer, int from) {
        for (int i = from; i < buffer.limit(); i++) {
            if (buffer.get(i) == '\n') {
                return i;
            }
        }
        return -1;
    }

    /**
     * End of line content, excluding the optional CR before the LF.
     */
    private static int contentEnd(ByteBuffer buffer, int lineStart, int lineEnd) {
        if (lineEnd > lineStart && buffer.get(lineEnd - 1) == '\r') {
            return lineEnd - 1;
        }
        return lineEnd;
    }

    private static long parseNumber(ByteBuffer buffer, int from, int to) {
        if (from >= to || to - from > 18) {
            return INVALID_NUMBER;
        }
        boolean negative = buffer.get(from) == '-';
        int i = negative ? from + 1 : from;
        if (i >= to) {
            return INVALID_NUMBER;
        }
        long value = 0;
        for (; i < to; i++) {
            byte b = buffer.get(i);
            if (b < '0' || b > '9') {
                return INVALID_NUMBER;
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    private static byte[] copy(ByteBuffer buffer, int from, int to) {
        byte[] out = new byte[to - from];
        ByteBuffer view = buffer.duplicate();
        view.position(from);
        view.get(out);
        return out;
    }
}
