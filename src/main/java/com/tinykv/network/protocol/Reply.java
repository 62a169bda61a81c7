package com.tinykv.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable server reply: a status string, an error, an integer, a bulk value,
 * nil, or an array of replies.
 */
public final class Reply {

    public enum Type {
        STATUS,
        ERROR,
        INTEGER,
        BULK,
        NIL,
        ARRAY
    }

    private static final Reply OK = new Reply(Type.STATUS, "OK", 0, null, null);
    private static final Reply PONG = new Reply(Type.STATUS, "PONG", 0, null, null);
    private static final Reply NIL = new Reply(Type.NIL, null, 0, null, null);

    private final Type type;
    private final String text;
    private final long integer;
    private final byte[] bulk;
    private final List<Reply> elements;

    private Reply(Type type, String text, long integer, byte[] bulk, List<Reply> elements) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.bulk = bulk;
        this.elements = elements;
    }

    public static Reply ok() {
        return OK;
    }

    public static Reply pong() {
        return PONG;
    }

    public static Reply nil() {
        return NIL;
    }

    /**
     * Create a simple status reply. The text must not contain CR or LF.
     */
    public static Reply status(String text) {
        return new Reply(Type.STATUS, requireLine(text), 0, null, null);
    }

    /**
     * Create an error reply. The message must not contain CR or LF.
     */
    public static Reply error(String message) {
        return new Reply(Type.ERROR, requireLine(message), 0, null, null);
    }

    public static Reply integer(long value) {
        return new Reply(Type.INTEGER, null, value, null, null);
    }

    public static Reply bulk(byte[] value) {
        if (value == null) {
            return NIL;
        }
        return new Reply(Type.BULK, null, 0, Arrays.copyOf(value, value.length), null);
    }

    public static Reply bulk(String value) {
        return value == null ? NIL : bulk(value.getBytes(StandardCharsets.UTF_8));
    }

    public static Reply array(List<Reply> elements) {
        return new Reply(Type.ARRAY, null, 0, null, List.copyOf(elements));
    }

    private static String requireLine(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Line replies cannot contain CR or LF");
        }
        return text;
    }

    public Type getType() {
        return type;
    }

    /**
     * Get the status text or error message.
     *
     * @return the text, or null for non-line replies
     */
    public String getText() {
        return text;
    }

    public long getInteger() {
        return integer;
    }

    /**
     * Get a copy of the bulk value.
     *
     * @return copy of the value, or null if this is not a bulk reply
     */
    public byte[] getBulk() {
        return bulk != null ? Arrays.copyOf(bulk, bulk.length) : null;
    }

    /**
     * Get the bulk value without copying.
     * Use with caution - do not modify the returned array.
     */
    public byte[] getBulkUnsafe() {
        return bulk;
    }

    public String getBulkString() {
        return bulk != null ? new String(bulk, StandardCharsets.UTF_8) : null;
    }

    public List<Reply> getElements() {
        return elements != null ? elements : Collections.emptyList();
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean isNil() {
        return type == Type.NIL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reply reply = (Reply) o;
        return type == reply.type &&
               integer == reply.integer &&
               Objects.equals(text, reply.text) &&
               Arrays.equals(bulk, reply.bulk) &&
               Objects.equals(elements, reply.elements);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, text, integer, elements);
        result = 31 * result + Arrays.hashCode(bulk);
        return result;
    }

    @Override
    public String toString() {
        switch (type) {
            case STATUS: return "Reply{status=" + text + '}';
            case ERROR: return "Reply{error='" + text + "'}";
            case INTEGER: return "Reply{integer=" + integer + '}';
            case BULK: return "Reply{bulkLength=" + bulk.length + '}';
            case NIL: return "Reply{nil}";
            default: return "Reply{array=" + elements.size() + '}';
        }
    }
}
