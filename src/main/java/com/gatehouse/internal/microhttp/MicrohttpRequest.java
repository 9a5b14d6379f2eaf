package com.gatehouse.internal.microhttp;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * HTTP request entity, as read off the wire.
 * <p>
 * Headers are in arrival order; duplicates are preserved.
 */
public record MicrohttpRequest(
        String method,
        String uri,
        String version,
        List<Header> headers,
        byte[] body,
        InetSocketAddress remoteAddress) {

    public String header(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return header.value();
            }
        }
        return null;
    }

}
