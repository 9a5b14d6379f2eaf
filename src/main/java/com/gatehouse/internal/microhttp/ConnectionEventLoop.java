package com.gatehouse.internal.microhttp;

import com.gatehouse.Connection;
import com.gatehouse.ConnectionObserver;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * This class represents an independent, threaded event loop for managing a group of connections.
 * It has its own selector, direct off-heap byte buffer, timeout queue, task queue, and state-per-connection.
 * <p>
 * ConnectionEventLoop instances are managed by a parent EventLoop.
 * <p>
 * Every accepted socket is reported to the {@link ConnectionObserver} exactly once on open and exactly once on close,
 * both from this loop's thread, so the open notification always happens-before the close notification.
 *
 * <pre>
 *                                                   Write Complete Non-Persistent
 *                                   Write     +--------------------------------------------+
 *                                   Complete  |                                            |
 *              Read                 Request   |                Write                       |
 *              Partial              Pipelined |                Partial                     |
 *              +-----+                +-----+ |                +-----+                     |
 *              |     |                |     | |                |     |    Write            |
 *              |     v                |     v |                |     v    Complete         v
 *            +-+--------+  Read-     ++-------+-+  Write-    +-+--------+ Non-       +----------+
 *    Accept  |          |  Complete  |          |  Partial   |          | Persist.   |          |
 * ---------->| READABLE +----------->| DISPATCH +----------->| WRITABLE +----------->|  CLOSED  |
 *            |          |            |          |            |          |            |          |
 *            +----+-----+            +----------+ Write      +-+---+----+            +----------+
 *                 |                        ^      Complete     |   |
 *                 |                        |      Request      |   |
 *                 |                        |      Pipelined    |   |
 *                 |                        +-------------------+   |
 *                 |                                                |
 *                 +------------------------------------------------+
 *                               Write Complete Persistent
 * </pre>
 * <p>
 * A connection in READABLE with no buffered bytes is idle. Idle connections are closed silently after the keep-alive
 * timeout. Once the first byte of a request arrives, its headers must be complete within the headers timeout and the
 * whole request within the request timeout. Otherwise a {@code 408} is written and the connection is closed.
 */
class ConnectionEventLoop {

    private static final String HTTP_1_0 = "HTTP/1.0";
    private static final String HTTP_1_1 = "HTTP/1.1";

    private static final String HEADER_CONNECTION = "Connection";
    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String HEADER_CONTENT_TYPE = "Content-Type";

    private static final String KEEP_ALIVE = "Keep-Alive";
    private static final String CLOSE = "close";

    private final Options options;
    private final Logger logger;
    private final Handler handler;
    private final ConnectionObserver connectionObserver;
    private final AtomicLong connectionCounter;
    private final AtomicBoolean stop;

    private final Scheduler timeoutQueue;
    private final Queue<Runnable> taskQueue;
    private final ByteBuffer buffer;
    private final Selector selector;
    private final Thread thread;
    private final AtomicInteger connectionCount;

    ConnectionEventLoop(
            Options options,
            Logger logger,
            Handler handler,
            ConnectionObserver connectionObserver,
            AtomicLong connectionCounter,
            AtomicBoolean stop,
            int index) throws IOException {
        this.options = options;
        this.logger = logger;
        this.handler = handler;
        this.connectionObserver = connectionObserver;
        this.connectionCounter = connectionCounter;
        this.stop = stop;

        connectionCount = new AtomicInteger();
        timeoutQueue = new Scheduler();
        taskQueue = new ConcurrentLinkedQueue<>();
        buffer = ByteBuffer.allocateDirect(options.readBufferSize());
        selector = Selector.open();
        thread = new Thread(this::run, "gatehouse-connection-event-loop-" + index);
    }

    private class HttpConnection implements Connection {
        final SocketChannel socketChannel;
        final SelectionKey selectionKey;
        final ByteTokenizer byteTokenizer;
        final long id;
        final InetSocketAddress remoteAddress;
        final Instant openedAt;
        final AtomicBoolean closed;
        RequestParser requestParser;
        ByteBuffer writeBuffer;
        Cancellable timeoutTask;
        boolean httpOneDotZero;
        boolean keepAlive;
        boolean closeAfterResponse;
        boolean awaitingHeaders;
        long requestStartedAt;
        volatile boolean idle;
        volatile boolean closeRequested;

        private HttpConnection(SocketChannel socketChannel, SelectionKey selectionKey, InetSocketAddress remoteAddress) {
            this.socketChannel = socketChannel;
            this.selectionKey = selectionKey;
            this.remoteAddress = remoteAddress;
            byteTokenizer = new ByteTokenizer();
            id = connectionCounter.incrementAndGet();
            openedAt = Instant.now();
            closed = new AtomicBoolean(false);
            requestParser = new RequestParser(byteTokenizer, remoteAddress);
            awaitRequest();
        }

        @Override
        public Long getId() {
            return id;
        }

        @Override
        public Optional<InetSocketAddress> getRemoteAddress() {
            return Optional.ofNullable(remoteAddress);
        }

        @Override
        public Instant getOpenedAt() {
            return openedAt;
        }

        @Override
        public Boolean isIdle() {
            return idle && !closed.get();
        }

        @Override
        public void closeGracefully() {
            closeRequested = true;
            runOnLoop(() -> {
                if (idle) {
                    failSafeClose();
                }
            });
        }

        @Override
        public void closeForcibly() {
            closeRequested = true;
            runOnLoop(this::failSafeClose);
        }

        @Override
        public String toString() {
            return "HttpConnection{id=" + id + ", remoteAddress=" + remoteAddress + ", idle=" + idle + "}";
        }

        private void awaitRequest() {
            idle = true;
            replaceTimeout(this::onKeepAliveTimeout, options.keepAliveTimeout());
        }

        private void replaceTimeout(Runnable task, Duration duration) {
            cancelTimeout();
            timeoutTask = timeoutQueue.schedule(task, duration);
        }

        private void cancelTimeout() {
            if (timeoutTask != null) {
                timeoutTask.cancel();
                timeoutTask = null;
            }
        }

        /**
         * First bytes of a request have arrived. The headers must be complete within the headers timeout and the
         * whole request within the request timeout, both measured from now.
         */
        private void beginRequest() {
            idle = false;
            awaitingHeaders = true;
            requestStartedAt = System.nanoTime();
            if (options.headersTimeout().compareTo(options.requestTimeout()) < 0) {
                replaceTimeout(this::onHeadersTimeout, options.headersTimeout());
            } else {
                replaceTimeout(this::onRequestTimeout, options.requestTimeout());
            }
        }

        private void onHeadersComplete() {
            awaitingHeaders = false;
            Duration remaining = options.requestTimeout().minusNanos(System.nanoTime() - requestStartedAt);
            if (remaining.isNegative() || remaining.isZero()) {
                onRequestTimeout();
            } else {
                replaceTimeout(this::onRequestTimeout, remaining);
            }
        }

        private void onHeadersTimeout() {
            timeoutTask = null;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "headers_timeout"),
                        new LogEntry("id", Long.toString(id)));
            }
            respondAndClose(408, "Request Timeout", "Request Timeout\n");
        }

        private void onKeepAliveTimeout() {
            timeoutTask = null;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "keep_alive_timeout"),
                        new LogEntry("id", Long.toString(id)));
            }
            failSafeClose();
        }

        private void onRequestTimeout() {
            timeoutTask = null;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "request_timeout"),
                        new LogEntry("id", Long.toString(id)));
            }
            respondAndClose(408, "Request Timeout", "Request Timeout\n");
        }

        private void onReadable() {
            try {
                doOnReadable();
            } catch (MalformedRequestException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "malformed_request"),
                            new LogEntry("id", Long.toString(id)));
                }
                respondAndClose(400, "Bad Request", "Bad Request\n");
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "read_error"),
                            new LogEntry("id", Long.toString(id)));
                }
                failSafeClose();
            }
        }

        private void doOnReadable() throws IOException {
            buffer.clear();
            int numBytes = socketChannel.read(buffer);
            if (numBytes < 0) {
                failSafeClose();
                return;
            }
            if (numBytes == 0) {
                return;
            }
            buffer.flip();
            byteTokenizer.add(buffer);
            if (idle) {
                beginRequest();
            }
            if (requestParser.parse()) {
                onParseRequest();
            } else if (byteTokenizer.size() > options.maxRequestSize()) {
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "request_too_large"),
                            new LogEntry("id", Long.toString(id)),
                            new LogEntry("request_size", Integer.toString(byteTokenizer.size())));
                }
                respondAndClose(400, "Bad Request", "Bad Request\n");
            } else if (awaitingHeaders && requestParser.headersComplete()) {
                onHeadersComplete();
            }
        }

        /**
         * Writes a transport-generated terminal response and closes once it has been written.
         */
        private void respondAndClose(int status, String reason, String body) {
            if (closed.get()) {
                return;
            }
            if (writeBuffer != null) { // already writing a response; can't interleave another
                failSafeClose();
                return;
            }
            if (selectionKey.interestOps() != 0) {
                selectionKey.interestOps(0);
            }
            cancelTimeout();
            idle = false;
            closeAfterResponse = true;

            List<Header> headers = new ArrayList<>(options.terminalResponseHeaders());
            headers.add(new Header(HEADER_CONTENT_TYPE, "text/plain; charset=UTF-8"));
            headers.add(new Header(HEADER_CONNECTION, CLOSE));
            byte[] bodyBytes = body.getBytes(StandardCharsets.UTF_8);
            headers.add(new Header(HEADER_CONTENT_LENGTH, Integer.toString(bodyBytes.length)));

            MicrohttpResponse response = new MicrohttpResponse(status, reason, headers, bodyBytes);
            writeBuffer = ByteBuffer.wrap(response.serialize(HTTP_1_1, List.of()));
            try {
                doOnWritable();
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "write_error"),
                            new LogEntry("id", Long.toString(id)));
                }
                failSafeClose();
            }
        }

        private void onParseRequest() {
            if (selectionKey.interestOps() != 0) {
                selectionKey.interestOps(0);
            }
            cancelTimeout();
            idle = false;
            awaitingHeaders = false;
            MicrohttpRequest request = requestParser.request();
            applyConnectionPolicy(request);
            byteTokenizer.compact();
            requestParser = new RequestParser(byteTokenizer, remoteAddress);
            handler.handle(request, this::onResponse);
        }

        private void onResponse(MicrohttpResponse microhttpResponse) {
            // enqueuing the callback invocation and waking the selector
            // ensures that the microhttpResponse callback works properly when
            // invoked inline from the event loop thread or a separate background thread
            taskQueue.add(() -> {
                if (closed.get()) {
                    return;
                }
                try {
                    prepareToWriteResponse(microhttpResponse);
                } catch (IOException | RuntimeException e) {
                    if (logger.enabled()) {
                        logger.log(e,
                                new LogEntry("event", "write_error"),
                                new LogEntry("id", Long.toString(id)));
                    }
                    failSafeClose();
                }
            });
            // selector wakeup is not necessary if callback was invoked within event loop thread
            // since tasks are processed at the end of every event loop iteration
            if (Thread.currentThread() != thread) {
                selector.wakeup();
            }
        }

        private void prepareToWriteResponse(MicrohttpResponse microhttpResponse) throws IOException {
            if (closeRequested || hasHeaderToken(microhttpResponse.headers(), HEADER_CONNECTION, CLOSE)) {
                closeAfterResponse = true;
            }
            String version = httpOneDotZero ? HTTP_1_0 : HTTP_1_1;
            List<Header> headers = new ArrayList<>();
            if (httpOneDotZero && keepAlive && !closeAfterResponse) {
                headers.add(new Header(HEADER_CONNECTION, KEEP_ALIVE));
            }
            if (closeAfterResponse && !microhttpResponse.hasHeader(HEADER_CONNECTION)) {
                headers.add(new Header(HEADER_CONNECTION, CLOSE));
            }
            if (!microhttpResponse.hasHeader(HEADER_CONTENT_LENGTH)) {
                headers.add(new Header(HEADER_CONTENT_LENGTH, Integer.toString(microhttpResponse.body().length)));
            }
            writeBuffer = ByteBuffer.wrap(microhttpResponse.serialize(version, headers));
            doOnWritable();
        }

        private void onWritable() {
            try {
                doOnWritable();
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "write_error"),
                            new LogEntry("id", Long.toString(id)));
                }
                failSafeClose();
            }
        }

        private int doWrite() throws IOException {
            buffer.clear(); // pos = 0, limit = capacity
            int amount = Math.min(buffer.remaining(), writeBuffer.remaining()); // determine transfer quantity
            buffer.put(writeBuffer.array(), writeBuffer.position(), amount); // do transfer
            buffer.flip();
            int written = socketChannel.write(buffer);
            writeBuffer.position(writeBuffer.position() + written); // advance write buffer
            return written;
        }

        private void doOnWritable() throws IOException {
            doWrite();
            if (writeBuffer.hasRemaining()) { // response not fully written, switch to or remain in write mode
                if ((selectionKey.interestOps() & SelectionKey.OP_WRITE) == 0) {
                    selectionKey.interestOps(SelectionKey.OP_WRITE);
                }
                return;
            }
            writeBuffer = null; // done with current write buffer, remove reference
            if (closeAfterResponse || closeRequested) { // non-persistent connection, close now
                failSafeClose();
            } else if (requestParser.parse()) { // subsequent request in buffer
                onParseRequest();
            } else { // switch back to read mode
                if (requestParser.inProgress()) { // part of the next request is already buffered
                    beginRequest();
                    if (requestParser.headersComplete()) {
                        onHeadersComplete();
                    }
                } else {
                    awaitRequest();
                }
                selectionKey.interestOps(SelectionKey.OP_READ);
            }
        }

        private void failSafeClose() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            idle = false;
            cancelTimeout();
            selectionKey.cancel();
            CloseUtils.closeQuietly(socketChannel, logger);
            connectionCount.decrementAndGet();
            try {
                connectionObserver.didCloseConnection(this);
            } catch (RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "observer_error"),
                            new LogEntry("id", Long.toString(id)));
                }
            }
        }

        private void applyConnectionPolicy(MicrohttpRequest request) {
            closeAfterResponse = false;
            httpOneDotZero = request.version().equalsIgnoreCase(HTTP_1_0);

            boolean hasClose = hasHeaderToken(request.headers(), HEADER_CONNECTION, CLOSE);
            boolean hasKeepAlive = hasHeaderToken(request.headers(), HEADER_CONNECTION, KEEP_ALIVE);

            if (hasClose) {
                keepAlive = false;
                closeAfterResponse = true;
            } else if (httpOneDotZero) {
                keepAlive = hasKeepAlive;
                closeAfterResponse = !keepAlive;
            } else {
                keepAlive = true;
            }
        }

        private boolean hasHeaderToken(List<Header> headers, String headerName, String token) {
            if (headers == null) {
                return false;
            }
            for (Header header : headers) {
                if (!header.name().equalsIgnoreCase(headerName)) {
                    continue;
                }
                String value = header.value();
                if (value == null) {
                    continue;
                }
                for (String part : value.split(",")) {
                    if (token.equalsIgnoreCase(part.trim())) {
                        return true;
                    }
                }
            }
            return false;
        }
    }

    int numConnections() {
        return connectionCount.get();
    }

    void start() {
        thread.start();
    }

    void join() throws InterruptedException {
        thread.join();
    }

    /**
     * Releases the selector of a loop that was never started. A started loop releases it on exit.
     */
    void discard() {
        if (thread.getState() == Thread.State.NEW) {
            CloseUtils.closeQuietly(selector, logger);
        }
    }

    /**
     * Runs {@code task} on this loop's thread. If the loop has already exited, runs it on the caller's thread.
     */
    private void runOnLoop(Runnable task) {
        if (Thread.currentThread() == thread) {
            task.run();
        } else if (thread.isAlive()) {
            taskQueue.add(task);
            selector.wakeup();
        } else {
            task.run();
        }
    }

    private void run() {
        try {
            doStart();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "sub_event_loop_terminate"));
            }
            stop.set(true); // stop the world on critical error
        } finally {
            for (SelectionKey selKey : selector.keys()) {
                Object attachment = selKey.attachment();
                if (attachment instanceof HttpConnection connection) {
                    connection.failSafeClose();
                }
            }
            CloseUtils.closeQuietly(selector, logger);
        }
    }

    private void doStart() throws IOException {
        while (!stop.get()) {
            selector.select(options.resolution().toMillis());
            Set<SelectionKey> selectedKeys = selector.selectedKeys();
            Iterator<SelectionKey> it = selectedKeys.iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                if (selKey.isValid() && selKey.isReadable()) {
                    ((HttpConnection) selKey.attachment()).onReadable();
                } else if (selKey.isValid() && selKey.isWritable()) {
                    ((HttpConnection) selKey.attachment()).onWritable();
                }
                it.remove();
            }
            timeoutQueue.expired().forEach(Runnable::run);
            Runnable task;
            while ((task = taskQueue.poll()) != null) {
                task.run();
            }
        }
    }

    void register(SocketChannel socketChannel) {
        taskQueue.add(() -> {
            try {
                doRegister(socketChannel);
            } catch (IOException e) {
                if (logger.enabled()) {
                    logger.log(e, new LogEntry("event", "register_error"));
                }
                CloseUtils.closeQuietly(socketChannel, logger);
            }
        });
        selector.wakeup(); // wakeup event loop thread to process task immediately
    }

    private void doRegister(SocketChannel socketChannel) throws IOException {
        socketChannel.configureBlocking(false);
        SelectionKey selectionKey = socketChannel.register(selector, SelectionKey.OP_READ);
        SocketAddress socketAddress = socketChannel.getRemoteAddress();
        InetSocketAddress remoteAddress = socketAddress instanceof InetSocketAddress
                ? (InetSocketAddress) socketAddress
                : null;
        HttpConnection connection = new HttpConnection(socketChannel, selectionKey, remoteAddress);
        connectionCount.incrementAndGet();
        selectionKey.attach(connection);
        try {
            connectionObserver.didOpenConnection(connection);
        } catch (RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e,
                        new LogEntry("event", "observer_error"),
                        new LogEntry("id", Long.toString(connection.id)));
            }
            connection.failSafeClose();
        }
    }
}
