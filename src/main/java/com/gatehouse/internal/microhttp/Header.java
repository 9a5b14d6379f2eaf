package com.gatehouse.internal.microhttp;

/**
 * HTTP request/response header.
 */
public record Header(String name, String value) {
}
