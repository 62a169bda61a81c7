package com.tinykv.network.protocol;

/**
 * Exception thrown when protocol encoding/decoding fails.
 *
 * <p>A recoverable exception means the decoder has already skipped the
 * offending line, so the connection can answer with an error and keep reading.
 * A fatal one means the byte stream can no longer be framed.
 */
public class ProtocolException extends RuntimeException {

    private final boolean fatal;

    public ProtocolException(String message) {
        this(message, false);
    }

    public ProtocolException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
        this.fatal = false;
    }

    public boolean isFatal() {
        return fatal;
    }
}
