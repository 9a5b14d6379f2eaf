package com.gatehouse.internal.microhttp;

import java.time.Duration;
import java.util.List;

public class OptionsBuilder {

    private String host = "127.0.0.1";
    private int port = 8080;
    private boolean reuseAddr = false;
    private Duration resolution = Duration.ofMillis(100);
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration headersTimeout = Duration.ofSeconds(10);
    private Duration keepAliveTimeout = Duration.ofSeconds(5);
    private int readBufferSize = 1_024 * 64;
    private int acceptLength = 0;
    private int maxRequestSize = 1_024 * 1_024;
    private int concurrency = Runtime.getRuntime().availableProcessors();
    private List<Header> terminalResponseHeaders = List.of();

    private OptionsBuilder() {
    }

    public static OptionsBuilder newBuilder() {
        return new OptionsBuilder();
    }

    public Options build() {
        return new Options(
                host,
                port,
                reuseAddr,
                resolution,
                requestTimeout,
                headersTimeout,
                keepAliveTimeout,
                readBufferSize,
                acceptLength,
                maxRequestSize,
                concurrency,
                terminalResponseHeaders);
    }

    public OptionsBuilder withHost(String host) {
        this.host = host;
        return this;
    }

    public OptionsBuilder withPort(int port) {
        this.port = port;
        return this;
    }

    public OptionsBuilder withReuseAddr(boolean reuseAddr) {
        this.reuseAddr = reuseAddr;
        return this;
    }

    public OptionsBuilder withResolution(Duration resolution) {
        this.resolution = resolution;
        return this;
    }

    public OptionsBuilder withRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public OptionsBuilder withHeadersTimeout(Duration headersTimeout) {
        this.headersTimeout = headersTimeout;
        return this;
    }

    public OptionsBuilder withKeepAliveTimeout(Duration keepAliveTimeout) {
        this.keepAliveTimeout = keepAliveTimeout;
        return this;
    }

    public OptionsBuilder withReadBufferSize(int readBufferSize) {
        this.readBufferSize = readBufferSize;
        return this;
    }

    public OptionsBuilder withAcceptLength(int acceptLength) {
        this.acceptLength = acceptLength;
        return this;
    }

    public OptionsBuilder withMaxRequestSize(int maxRequestSize) {
        this.maxRequestSize = maxRequestSize;
        return this;
    }

    public OptionsBuilder withConcurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public OptionsBuilder withTerminalResponseHeaders(List<Header> terminalResponseHeaders) {
        this.terminalResponseHeaders = terminalResponseHeaders;
        return this;
    }

}
