package com.gatehouse.internal.microhttp;

/**
 * Thrown by {@link RequestParser} when bytes on the wire cannot be an HTTP/1.x request.
 */
class MalformedRequestException extends RuntimeException {
    MalformedRequestException(String message) {
        super(message);
    }
}
