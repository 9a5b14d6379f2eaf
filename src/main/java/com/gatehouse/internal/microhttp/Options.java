package com.gatehouse.internal.microhttp;

import java.time.Duration;
import java.util.List;

/**
 * Transport settings. Instances are immutable and built via {@link #builder()}.
 */
public class Options {

    private final String host;
    private final int port;
    private final boolean reuseAddr;
    private final Duration resolution;
    private final Duration requestTimeout;
    private final Duration headersTimeout;
    private final Duration keepAliveTimeout;
    private final int readBufferSize;
    private final int acceptLength;
    private final int maxRequestSize;
    private final int concurrency;
    private final List<Header> terminalResponseHeaders;

    Options(
            String host,
            int port,
            boolean reuseAddr,
            Duration resolution,
            Duration requestTimeout,
            Duration headersTimeout,
            Duration keepAliveTimeout,
            int readBufferSize,
            int acceptLength,
            int maxRequestSize,
            int concurrency,
            List<Header> terminalResponseHeaders) {
        this.host = host;
        this.port = port;
        this.reuseAddr = reuseAddr;
        this.resolution = resolution;
        this.requestTimeout = requestTimeout;
        this.headersTimeout = headersTimeout;
        this.keepAliveTimeout = keepAliveTimeout;
        this.readBufferSize = readBufferSize;
        this.acceptLength = acceptLength;
        this.maxRequestSize = maxRequestSize;
        this.concurrency = concurrency;
        this.terminalResponseHeaders = List.copyOf(terminalResponseHeaders);
    }

    public static OptionsBuilder builder() {
        return OptionsBuilder.newBuilder();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public boolean reuseAddr() {
        return reuseAddr;
    }

    /**
     * Maximum time a selector blocks, which bounds timeout precision.
     */
    public Duration resolution() {
        return resolution;
    }

    /**
     * Time allowed for a request to arrive in full once its first byte has been read.
     */
    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Time allowed for the request line and headers to arrive once the first byte has been read. Bounded by
     * {@link #requestTimeout()}.
     */
    public Duration headersTimeout() {
        return headersTimeout;
    }

    /**
     * Time an idle persistent connection may wait for its next request.
     */
    public Duration keepAliveTimeout() {
        return keepAliveTimeout;
    }

    public int readBufferSize() {
        return readBufferSize;
    }

    public int acceptLength() {
        return acceptLength;
    }

    public int maxRequestSize() {
        return maxRequestSize;
    }

    public int concurrency() {
        return concurrency;
    }

    /**
     * Headers added to responses the transport writes on its own (malformed request, request too large, request timeout).
     */
    public List<Header> terminalResponseHeaders() {
        return terminalResponseHeaders;
    }

}
