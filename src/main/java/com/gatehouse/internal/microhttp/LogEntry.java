package com.gatehouse.internal.microhttp;

/**
 * Key-value pair describing one facet of a transport event, e.g. {@code event=request_timeout}.
 */
public record LogEntry(String key, String value) {
}
