package com.tinykv.client;

/**
 * Configuration for TinyKV client.
 */
public class ClientConfig {

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;

    /**
     * Create a config builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got: " + connectTimeoutMs);
        }
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    /**
     * @param readTimeoutMs socket read timeout, 0 to wait forever
     */
    public void setReadTimeoutMs(int readTimeoutMs) {
        if (readTimeoutMs < 0) {
            throw new IllegalArgumentException("readTimeoutMs must be non-negative, got: " + readTimeoutMs);
        }
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Builder for ClientConfig.
     */
    public static class Builder {
        private final ClientConfig config = new ClientConfig();

        public Builder connectTimeoutMs(int timeout) {
            config.setConnectTimeoutMs(timeout);
            return this;
        }

        public Builder readTimeoutMs(int timeout) {
            config.setReadTimeoutMs(timeout);
            return this;
        }

        public ClientConfig build() {
            return config;
        }
    }
}
