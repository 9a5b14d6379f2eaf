package com.gatehouse.internal.microhttp;

import java.util.function.Consumer;

/**
 * HTTP request handler.
 * <p>
 * Handlers are invoked on a connection event loop thread and must not block. The callback may be invoked from any thread.
 */
public interface Handler {

    void handle(MicrohttpRequest request, Consumer<MicrohttpResponse> callback);

}
