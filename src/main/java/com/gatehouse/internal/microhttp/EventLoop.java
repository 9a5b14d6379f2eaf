package com.gatehouse.internal.microhttp;

import com.gatehouse.ConnectionObserver;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EventLoop is an HTTP server implementation. It provides connection management, network I/O,
 * request parsing, and request dispatching.
 * <p>
 * The listening socket is bound in the constructor, so a port conflict surfaces as a {@link java.net.BindException}
 * before any thread is started. {@link #stopAccepting()} closes the listening socket while leaving established
 * connections to finish on their connection event loops.
 */
public class EventLoop {

    private final Options options;
    private final Logger logger;

    private final Selector selector;
    private final AtomicBoolean stop;
    private final AtomicBoolean accepting;
    private final CountDownLatch stoppedAccepting;
    private final ServerSocketChannel serverSocketChannel;
    private final List<ConnectionEventLoop> connectionEventLoops;
    private final Thread thread;

    public EventLoop(Options options, Logger logger, Handler handler, ConnectionObserver connectionObserver) throws IOException {
        this.options = options;
        this.logger = logger;

        stop = new AtomicBoolean();
        accepting = new AtomicBoolean(true);
        stoppedAccepting = new CountDownLatch(1);

        InetSocketAddress address = options.host() == null
                ? new InetSocketAddress(options.port()) // wildcard address
                : new InetSocketAddress(options.host(), options.port());

        // bind before opening per-loop selectors so a port conflict has nothing else to release
        selector = Selector.open();
        serverSocketChannel = ServerSocketChannel.open();
        connectionEventLoops = new ArrayList<>();
        try {
            if (options.reuseAddr()) {
                serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, options.reuseAddr());
            }
            serverSocketChannel.configureBlocking(false);
            serverSocketChannel.bind(address, options.acceptLength());
            serverSocketChannel.register(selector, SelectionKey.OP_ACCEPT);

            AtomicLong connectionCounter = new AtomicLong();
            for (int i = 0; i < options.concurrency(); i++) {
                connectionEventLoops.add(new ConnectionEventLoop(options, logger, handler, connectionObserver, connectionCounter, stop, i));
            }
        } catch (IOException | RuntimeException e) {
            connectionEventLoops.forEach(ConnectionEventLoop::discard);
            CloseUtils.closeQuietly(serverSocketChannel, logger);
            CloseUtils.closeQuietly(selector, logger);
            throw e;
        }

        thread = new Thread(this::run, "gatehouse-event-loop");
    }

    public int getPort() throws IOException {
        return serverSocketChannel.getLocalAddress() instanceof InetSocketAddress a ? a.getPort() : -1;
    }

    public void start() {
        thread.start();
        connectionEventLoops.forEach(ConnectionEventLoop::start);
    }

    /**
     * Closes the listening socket. Connections already accepted are unaffected.
     * <p>
     * Blocks briefly until the accept loop has released the socket, so a new connection attempt made after this
     * method returns is refused by the operating system.
     */
    public void stopAccepting() {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        if (!thread.isAlive()) {
            CloseUtils.closeQuietly(serverSocketChannel, logger);
            stoppedAccepting.countDown();
            return;
        }
        selector.wakeup();
        try {
            stoppedAccepting.await(options.resolution().toMillis() * 10, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    private void run() {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "event_loop_terminate"));
            }
            stop.set(true); // stop the world on critical error
        } finally {
            CloseUtils.closeQuietly(selector, logger);
            CloseUtils.closeQuietly(serverSocketChannel, logger);
            stoppedAccepting.countDown();
        }
    }

    private void doRun() throws IOException {
        while (!stop.get()) {
            if (!accepting.get() && serverSocketChannel.isOpen()) {
                closeListeningSocket();
            }
            selector.select(options.resolution().toMillis());
            Set<SelectionKey> selectedKeys = selector.selectedKeys();
            Iterator<SelectionKey> it = selectedKeys.iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                it.remove();
                if (!accepting.get() || !selKey.isValid() || !selKey.isAcceptable()) {
                    continue;
                }
                SocketChannel socketChannel;
                try {
                    socketChannel = serverSocketChannel.accept();
                } catch (ClosedChannelException e) {
                    continue;
                }
                if (socketChannel == null) {
                    continue;
                }
                leastConnections().register(socketChannel);
            }
        }
    }

    private void closeListeningSocket() throws IOException {
        for (SelectionKey selKey : selector.keys()) {
            selKey.cancel();
        }
        CloseUtils.closeQuietly(serverSocketChannel, logger);
        selector.selectNow(); // flush cancelled keys so the socket is released
        stoppedAccepting.countDown();
        if (logger.enabled()) {
            logger.log(new LogEntry("event", "stopped_accepting"));
        }
    }

    private ConnectionEventLoop leastConnections() {
        return connectionEventLoops.stream()
                .min(Comparator.comparing(ConnectionEventLoop::numConnections))
                .get();
    }

    public void stop() {
        stop.set(true);
        selector.wakeup();
        if (thread.getState() == Thread.State.NEW) {
            // never started, so run() will not release anything
            CloseUtils.closeQuietly(serverSocketChannel, logger);
            CloseUtils.closeQuietly(selector, logger);
            stoppedAccepting.countDown();
        }
        connectionEventLoops.forEach(ConnectionEventLoop::discard);
    }

    public void join() throws InterruptedException {
        thread.join();
        for (ConnectionEventLoop connectionEventLoop : connectionEventLoops) {
            connectionEventLoop.join();
        }
    }
}
