package com.gatehouse.internal.microhttp;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTTP response entity. {@code Content-Length} is added by the transport when absent.
 */
public record MicrohttpResponse(
        int status,
        String reason,
        List<Header> headers,
        byte[] body) {

    static final byte[] COLON_SPACE = ": ".getBytes(StandardCharsets.US_ASCII);
    static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);
    static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    public boolean hasHeader(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Status line, then {@code headers} (transport-supplied), then this response's own headers, then the body.
     */
    byte[] serialize(String version, List<Header> headers) {
        ByteMerger merger = new ByteMerger();
        merger.add(version.getBytes(StandardCharsets.US_ASCII));
        merger.add(SPACE);
        merger.add(Integer.toString(status).getBytes(StandardCharsets.US_ASCII));
        merger.add(SPACE);
        merger.add(reason.getBytes(StandardCharsets.ISO_8859_1));
        merger.add(CRLF);
        appendHeaders(merger, this.headers);
        appendHeaders(merger, headers);
        merger.add(CRLF);
        merger.add(body);
        return merger.merge();
    }

    private static void appendHeaders(ByteMerger merger, List<Header> headers) {
        for (Header header : headers) {
            merger.add(header.name().getBytes(StandardCharsets.US_ASCII));
            merger.add(COLON_SPACE);
            merger.add(header.value().getBytes(StandardCharsets.ISO_8859_1));
            merger.add(CRLF);
        }
    }

}
