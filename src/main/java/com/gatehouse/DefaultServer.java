/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.gatehouse;

import com.gatehouse.internal.microhttp.EventLoop;
import com.gatehouse.internal.microhttp.Handler;
import com.gatehouse.internal.microhttp.Header;
import com.gatehouse.internal.microhttp.LogEntry;
import com.gatehouse.internal.microhttp.Logger;
import com.gatehouse.internal.microhttp.MicrohttpRequest;
import com.gatehouse.internal.microhttp.MicrohttpResponse;
import com.gatehouse.internal.microhttp.Options;
import com.gatehouse.internal.microhttp.OptionsBuilder;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	static final String BAD_REQUEST_INVALID_URL_BODY;
	@NonNull
	static final String BAD_REQUEST_INVALID_HEADERS_BODY;
	@NonNull
	static final String REQUEST_TIMEOUT_BODY;
	@NonNull
	static final String INTERNAL_SERVER_ERROR_BODY;
	@NonNull
	private static final List<Header> SECURITY_HEADERS;
	@NonNull
	private static final Integer SOCKET_PENDING_CONNECTION_LIMIT;
	@NonNull
	private static final Long EXECUTOR_TERMINATION_TIMEOUT_IN_MILLIS;

	static {
		BAD_REQUEST_INVALID_URL_BODY = "Bad Request: Invalid URL\n";
		BAD_REQUEST_INVALID_HEADERS_BODY = "Bad Request: Invalid Headers\n";
		REQUEST_TIMEOUT_BODY = "Request Timeout\n";
		INTERNAL_SERVER_ERROR_BODY = "Internal Server Error\n";
		SOCKET_PENDING_CONNECTION_LIMIT = 0;
		EXECUTOR_TERMINATION_TIMEOUT_IN_MILLIS = 1_000L;

		List<Header> securityHeaders = new ArrayList<>();

		for (Map.Entry<String, String> entry : SecurityHeaders.asMap().entrySet())
			securityHeaders.add(new Header(entry.getKey(), entry.getValue()));

		SECURITY_HEADERS = List.copyOf(securityHeaders);
	}

	@NonNull
	private final ServerConfig serverConfig;
	@NonNull
	private final RequestRouter requestRouter;
	@NonNull
	private final RequestValidator requestValidator;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ConnectionRegistry connectionRegistry;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private volatile ServerStateMachine serverStateMachine;
	@Nullable
	private volatile ShutdownCoordinator shutdownCoordinator;
	@Nullable
	private volatile CompletableFuture<ShutdownOutcome> coordinatorShutdownFuture;
	@Nullable
	private volatile CompletableFuture<ShutdownOutcome> shutdownFuture;
	@NonNull
	private final AtomicReference<EventLoop> eventLoop;
	@Nullable
	private volatile Integer boundPort;
	@Nullable
	private volatile ExecutorService requestHandlerExecutorService;
	@Nullable
	private volatile ScheduledExecutorService requestTimeoutExecutorService;

	protected DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.serverConfig = builder.serverConfig;
		this.requestRouter = builder.requestRouter != null ? builder.requestRouter : RequestRouter.defaultInstance();
		this.requestValidator = builder.requestValidator != null ? builder.requestValidator : RequestValidator.defaultInstance();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.connectionRegistry = new ConnectionRegistry();
		this.serverStateMachine = new ServerStateMachine();
		this.eventLoop = new AtomicReference<>();
		this.lock = new ReentrantLock();
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			// The state reaches STOPPED before the transport is released; let that finish so it cannot tear down a fresh start
			CompletableFuture<ShutdownOutcome> pendingShutdownFuture = this.shutdownFuture;

			if (pendingShutdownFuture != null && !pendingShutdownFuture.isDone())
				pendingShutdownFuture.handle((shutdownOutcome, throwable) -> null).join();

			if (getServerStateMachine().getCurrentState() != ServerState.STOPPED)
				return;

			// A start that fails leaves this machine in STARTING, so each attempt gets its own
			ServerStateMachine serverStateMachine = new ServerStateMachine();
			serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.STARTING);
			this.serverStateMachine = serverStateMachine;

			safelyNotify(lifecycleObserver -> lifecycleObserver.willStartServer(this));

			if (getServerConfig().requiresElevatedPrivileges())
				safelyLog(LogEvent.with(LogEventType.CONFIGURATION_PRIVILEGED_PORT,
								format("Port %d is below %d and requires elevated privileges", getServerConfig().getPort(), ServerConfig.PRIVILEGED_PORT_CEILING))
						.field("port", getServerConfig().getPort())
						.build());

			Options options = OptionsBuilder.newBuilder()
					.withHost(getServerConfig().getHost())
					.withPort(getServerConfig().getPort())
					.withConcurrency(getServerConfig().getConcurrency())
					.withRequestTimeout(getServerConfig().getRequestTimeout())
					.withHeadersTimeout(getServerConfig().getHeadersTimeout())
					.withKeepAliveTimeout(getServerConfig().getKeepAliveTimeout())
					.withResolution(getServerConfig().getSocketSelectTimeout())
					.withReadBufferSize(getServerConfig().getRequestReadBufferSizeInBytes())
					.withMaxRequestSize(getServerConfig().getMaximumRequestSizeInBytes())
					.withAcceptLength(SOCKET_PENDING_CONNECTION_LIMIT)
					.withTerminalResponseHeaders(SECURITY_HEADERS)
					.build();

			this.requestHandlerExecutorService = Executors.newFixedThreadPool(requestHandlerThreadCount(),
					new NonvirtualThreadFactory("gatehouse-request-handler"));
			this.requestTimeoutExecutorService = Executors.newSingleThreadScheduledExecutor(new NonvirtualThreadFactory("gatehouse-request-timeout"));

			EventLoop eventLoop;

			try {
				eventLoop = new EventLoop(options, new LogEventLogger(), createHandler(), new RegisteringConnectionObserver());
				this.boundPort = eventLoop.getPort();
				this.eventLoop.set(eventLoop);
			} catch (BindException e) {
				UncheckedIOException uncheckedIOException = new UncheckedIOException(
						format("Unable to start server - port %d is already in use.", getServerConfig().getPort()), e);
				failStart(uncheckedIOException);
				throw uncheckedIOException;
			} catch (IOException e) {
				UncheckedIOException uncheckedIOException = new UncheckedIOException(
						format("Unable to start server on %s:%d", getServerConfig().getHost(), getServerConfig().getPort()), e);
				failStart(uncheckedIOException);
				throw uncheckedIOException;
			} catch (RuntimeException e) {
				failStart(e);
				throw e;
			}

			this.shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, getConnectionRegistry())
					.stopAccepting(() -> {
						safelyNotify(lifecycleObserver -> lifecycleObserver.willStopServer(this));
						eventLoop.stopAccepting();
					})
					.gracePeriod(getServerConfig().getShutdownGracePeriod())
					.forceCloseTimeout(getServerConfig().getForceCloseTimeout())
					.drainPollInterval(getServerConfig().getDrainPollInterval())
					.lifecycleObserver(getLifecycleObserver())
					.build();
			this.coordinatorShutdownFuture = null;
			this.shutdownFuture = null;

			// RUNNING before the first connection can be accepted
			serverStateMachine.tryTransition(ServerState.STARTING, ServerState.RUNNING);

			try {
				eventLoop.start();
			} catch (RuntimeException e) {
				failStart(e);
				throw e;
			}

			safelyLog(LogEvent.with(LogEventType.SERVER_STARTED,
							format("Server running at http://%s:%d/", getServerConfig().getHost(), this.boundPort))
					.field("host", getServerConfig().getHost())
					.field("port", this.boundPort)
					.build());

			safelyNotify(lifecycleObserver -> lifecycleObserver.didStartServer(this));
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		CompletableFuture<ShutdownOutcome> shutdownFuture = shutdown("STOP");
		boolean interrupted = false;

		while (true) {
			try {
				shutdownFuture.get();
				break;
			} catch (InterruptedException e) {
				interrupted = true;
			} catch (ExecutionException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Shutdown failed")
						.throwable(e.getCause())
						.build());
				break;
			}
		}

		if (interrupted)
			Thread.currentThread().interrupt();
	}

	@NonNull
	@Override
	public CompletableFuture<ShutdownOutcome> shutdown(@NonNull String reason) {
		requireNonNull(reason);

		getLock().lock();

		try {
			ShutdownCoordinator shutdownCoordinator = this.shutdownCoordinator;

			if (shutdownCoordinator == null)
				return CompletableFuture.completedFuture(ShutdownOutcome.NOT_RUNNING);

			CompletableFuture<ShutdownOutcome> coordinatorShutdownFuture = shutdownCoordinator.shutdown(reason);

			if (coordinatorShutdownFuture == this.coordinatorShutdownFuture && this.shutdownFuture != null)
				return this.shutdownFuture;

			if (coordinatorShutdownFuture.getNow(null) == ShutdownOutcome.NOT_RUNNING)
				return coordinatorShutdownFuture;

			this.coordinatorShutdownFuture = coordinatorShutdownFuture;
			this.shutdownFuture = coordinatorShutdownFuture.thenApply(shutdownOutcome -> {
				releaseTransport();
				safelyNotify(lifecycleObserver -> lifecycleObserver.didStopServer(this));
				return shutdownOutcome;
			});

			return this.shutdownFuture;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		return getState() == ServerState.RUNNING;
	}

	@NonNull
	@Override
	public ServerState getState() {
		return getServerStateMachine().getCurrentState();
	}

	@NonNull
	@Override
	public Optional<Integer> getPort() {
		return this.eventLoop.get() == null ? Optional.empty() : Optional.ofNullable(this.boundPort);
	}

	@NonNull
	@Override
	public ServerConfig getServerConfig() {
		return this.serverConfig;
	}

	@NonNull
	@Override
	public ConnectionRegistry getConnectionRegistry() {
		return this.connectionRegistry;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{host=%s, port=%s, state=%s}", getClass().getSimpleName(), getServerConfig().getHost(),
				getPort().map(String::valueOf).orElse(String.valueOf(getServerConfig().getPort())), getState());
	}

	/**
	 * Size of the request handler pool.
	 */
	@NonNull
	static Integer requestHandlerThreadCount() {
		return Math.max(2, Runtime.getRuntime().availableProcessors());
	}

	@NonNull
	protected Handler createHandler() {
		return (microhttpRequest, microhttpCallback) -> {
			Request request = toRequest(microhttpRequest);
			ValidationVerdict validationVerdict = getRequestValidator().validate(request);

			// Rejections never reach the router
			if (!validationVerdict.isAdmitted()) {
				safelyNotify(lifecycleObserver -> lifecycleObserver.didRejectRequest(request, validationVerdict));
				safelyLog(LogEvent.with(LogEventType.SERVER_REQUEST_REJECTED,
								format("Rejected %s %s with %d: %s", request.getMethod(), request.getRawUrl(),
										validationVerdict.getStatusCode().orElse(400), validationVerdict.getReason().orElse("unknown")))
						.request(request)
						.field("statusCode", validationVerdict.getStatusCode().orElse(null))
						.field("rejectionReason", validationVerdict.getRejectionReason().orElse(null))
						.build());

				microhttpCallback.accept(toMicrohttpResponse(rejectionResponse(validationVerdict), false));
				return;
			}

			// The timeout clock starts at admission, so time spent queued for a handler thread counts against it
			RequestHandling requestHandling = new RequestHandling(request, microhttpCallback);
			requestHandling.scheduleTimeout();

			ExecutorService requestHandlerExecutorService = this.requestHandlerExecutorService;

			try {
				if (requestHandlerExecutorService == null)
					throw new RejectedExecutionException("Request handler executor service is unavailable");

				requestHandlerExecutorService.submit(() -> routeRequest(requestHandling));
			} catch (RejectedExecutionException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Request handler executor rejected task")
						.throwable(e)
						.request(request)
						.build());

				requestHandling.respond(Response.plainText(StatusCode.HTTP_500.getStatusCode(), INTERNAL_SERVER_ERROR_BODY), true);
			}
		};
	}

	protected void routeRequest(@NonNull RequestHandling requestHandling) {
		requireNonNull(requestHandling);

		// Timed out while queued
		if (!requestHandling.begin())
			return;

		Request request = requestHandling.getRequest();
		Response response;

		try {
			response = getRequestRouter().routeRequest(request);

			if (response == null)
				throw new IllegalStateException(format("%s returned a null response", getRequestRouter().getClass().getName()));
		} catch (Throwable t) {
			if (requestHandling.isFinished())
				return;

			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An unexpected error occurred during request handling")
					.throwable(t)
					.request(request)
					.build());

			response = Response.plainText(StatusCode.HTTP_500.getStatusCode(), INTERNAL_SERVER_ERROR_BODY);
		} finally {
			requestHandling.end();
		}

		requestHandling.respond(response, false);
	}

	@NonNull
	protected Response rejectionResponse(@NonNull ValidationVerdict validationVerdict) {
		requireNonNull(validationVerdict);

		RequestRejectionReason rejectionReason = validationVerdict.getRejectionReason().orElse(null);
		Integer statusCode = validationVerdict.getStatusCode().orElse(StatusCode.HTTP_400.getStatusCode());

		if (rejectionReason == RequestRejectionReason.METHOD_NOT_ALLOWED)
			return Response.withStatusCode(statusCode)
					.header("Content-Type", "text/plain; charset=UTF-8")
					.header("Allow", validationVerdict.getAllowHeaderValue().orElse(HttpMethod.allowHeaderValue()))
					.body(DefaultRequestRouter.METHOD_NOT_ALLOWED_BODY.getBytes(StandardCharsets.UTF_8))
					.build();

		boolean headerRejection = rejectionReason == RequestRejectionReason.HEADERS_TOO_LARGE
				|| rejectionReason == RequestRejectionReason.HEADERS_SUSPICIOUS_CONTENT;

		return Response.plainText(statusCode, headerRejection ? BAD_REQUEST_INVALID_HEADERS_BODY : BAD_REQUEST_INVALID_URL_BODY);
	}

	@NonNull
	protected Request toRequest(@NonNull MicrohttpRequest microhttpRequest) {
		requireNonNull(microhttpRequest);

		Map<String, List<String>> headers = new LinkedHashMap<>();

		for (Header header : microhttpRequest.headers())
			headers.computeIfAbsent(header.name().toLowerCase(Locale.ROOT), name -> new ArrayList<>())
					.add(header.value() == null ? "" : header.value());

		return Request.with(microhttpRequest.method(), microhttpRequest.uri())
				.headers(headers)
				.body(microhttpRequest.body())
				.remoteAddress(microhttpRequest.remoteAddress())
				.build();
	}

	/**
	 * Security headers first, then the response's own headers. Once the server has left {@link ServerState#RUNNING},
	 * every response also closes its connection so the drain can finish.
	 */
	@NonNull
	protected MicrohttpResponse toMicrohttpResponse(@NonNull Response response,
																									@NonNull Boolean closeConnection) {
		requireNonNull(response);
		requireNonNull(closeConnection);

		Map<String, String> headersByName = new LinkedHashMap<>(SecurityHeaders.asMap());
		headersByName.putAll(response.getHeaders());

		if (closeConnection || !getServerStateMachine().isAcceptingConnections())
			headersByName.put("Connection", "close");

		List<Header> headers = new ArrayList<>(headersByName.size());

		for (Map.Entry<String, String> entry : headersByName.entrySet())
			headers.add(new Header(entry.getKey(), entry.getValue()));

		return new MicrohttpResponse(response.getStatusCode(), StatusCode.reasonPhraseFor(response.getStatusCode()),
				headers, response.getBody().orElse(new byte[0]));
	}

	protected void failStart(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		if (throwable instanceof UncheckedIOException && throwable.getCause() instanceof BindException)
			safelyLog(LogEvent.with(LogEventType.SERVER_BIND_FAILED, throwable.getMessage())
					.throwable(throwable.getCause())
					.field("host", getServerConfig().getHost())
					.field("port", getServerConfig().getPort())
					.build());
		else
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to start server")
					.throwable(throwable)
					.build());

		releaseTransport();
		this.shutdownCoordinator = null;
		this.serverStateMachine = new ServerStateMachine();

		safelyNotify(lifecycleObserver -> lifecycleObserver.didFailToStartServer(this, throwable));
	}

	/**
	 * Stops the event loop and request executors. Safe to call more than once.
	 */
	protected void releaseTransport() {
		EventLoop eventLoop = this.eventLoop.getAndSet(null);
		boolean interrupted = false;

		if (eventLoop != null) {
			eventLoop.stop();

			try {
				eventLoop.join();
			} catch (InterruptedException e) {
				interrupted = true;
			}
		}

		ExecutorService requestHandlerExecutorService = this.requestHandlerExecutorService;
		this.requestHandlerExecutorService = null;

		if (requestHandlerExecutorService != null) {
			requestHandlerExecutorService.shutdown();

			try {
				if (!requestHandlerExecutorService.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_IN_MILLIS, TimeUnit.MILLISECONDS))
					requestHandlerExecutorService.shutdownNow();
			} catch (InterruptedException e) {
				requestHandlerExecutorService.shutdownNow();
				interrupted = true;
			}
		}

		ScheduledExecutorService requestTimeoutExecutorService = this.requestTimeoutExecutorService;
		this.requestTimeoutExecutorService = null;

		if (requestTimeoutExecutorService != null)
			requestTimeoutExecutorService.shutdownNow();

		this.boundPort = null;

		if (interrupted)
			Thread.currentThread().interrupt();
	}

	protected void safelyNotify(@NonNull Consumer<LifecycleObserver> notification) {
		requireNonNull(notification);

		try {
			notification.accept(getLifecycleObserver());
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, "Lifecycle observer threw an exception")
					.throwable(throwable)
					.build());
		}
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	protected ServerStateMachine getServerStateMachine() {
		return this.serverStateMachine;
	}

	@NonNull
	protected RequestRouter getRequestRouter() {
		return this.requestRouter;
	}

	@NonNull
	protected RequestValidator getRequestValidator() {
		return this.requestValidator;
	}

	@NonNull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * One admitted request on its way through the handler pool. Exactly one response is written: the router's, a 500,
	 * or a 408 if {@link ServerConfig#getRequestTimeout()} elapses first.
	 */
	@ThreadSafe
	protected final class RequestHandling {
		@NonNull
		private final Request request;
		@NonNull
		private final Consumer<MicrohttpResponse> microhttpCallback;
		@NonNull
		private final AtomicBoolean finished;
		@NonNull
		private final AtomicReference<Thread> handlerThread;
		@Nullable
		private volatile ScheduledFuture<?> timeoutFuture;

		private RequestHandling(@NonNull Request request,
														@NonNull Consumer<MicrohttpResponse> microhttpCallback) {
			requireNonNull(request);
			requireNonNull(microhttpCallback);

			this.request = request;
			this.microhttpCallback = microhttpCallback;
			this.finished = new AtomicBoolean(false);
			this.handlerThread = new AtomicReference<>();
		}

		private void scheduleTimeout() {
			ScheduledExecutorService requestTimeoutExecutorService = DefaultServer.this.requestTimeoutExecutorService;

			if (requestTimeoutExecutorService == null || requestTimeoutExecutorService.isShutdown())
				return;

			try {
				this.timeoutFuture = requestTimeoutExecutorService.schedule(this::timeOut,
						Math.max(1L, getServerConfig().getRequestTimeout().toMillis()), TimeUnit.MILLISECONDS);
			} catch (RejectedExecutionException e) {
				// Scheduler was shut down concurrently; the transport's own timeouts still apply
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to schedule request timeout")
						.throwable(e)
						.request(getRequest())
						.build());
			}
		}

		private void timeOut() {
			if (!this.finished.compareAndSet(false, true))
				return;

			Thread handlerThread = this.handlerThread.getAndSet(null);

			if (handlerThread != null)
				handlerThread.interrupt();

			safelyLog(LogEvent.with(LogEventType.SERVER_REQUEST_TIMED_OUT,
							format("Handling of %s %s exceeded %d ms", getRequest().getMethod(), getRequest().getRawUrl(),
									getServerConfig().getRequestTimeout().toMillis()))
					.request(getRequest())
					.build());

			this.microhttpCallback.accept(toMicrohttpResponse(Response.plainText(StatusCode.HTTP_408.getStatusCode(), REQUEST_TIMEOUT_BODY), true));
		}

		/**
		 * Claims the request for the calling handler thread.
		 *
		 * @return {@code false} if the request already timed out
		 */
		@NonNull
		private Boolean begin() {
			this.handlerThread.set(Thread.currentThread());

			if (isFinished()) {
				this.handlerThread.set(null);
				return false;
			}

			return true;
		}

		private void end() {
			this.handlerThread.set(null);
		}

		private void respond(@NonNull Response response,
												 @NonNull Boolean closeConnection) {
			requireNonNull(response);
			requireNonNull(closeConnection);

			if (!this.finished.compareAndSet(false, true))
				return;

			ScheduledFuture<?> timeoutFuture = this.timeoutFuture;

			if (timeoutFuture != null)
				timeoutFuture.cancel(false);

			this.microhttpCallback.accept(toMicrohttpResponse(response, closeConnection));
		}

		@NonNull
		private Boolean isFinished() {
			return this.finished.get();
		}

		@NonNull
		private Request getRequest() {
			return this.request;
		}
	}

	/**
	 * Keeps the registry in step with the transport, then tells the lifecycle observer.
	 */
	@ThreadSafe
	private final class RegisteringConnectionObserver implements ConnectionObserver {
		@Override
		public void didOpenConnection(@NonNull Connection connection) {
			requireNonNull(connection);

			getConnectionRegistry().didOpenConnection(connection);
			safelyNotify(lifecycleObserver -> lifecycleObserver.didOpenConnection(connection));
		}

		@Override
		public void didCloseConnection(@NonNull Connection connection) {
			requireNonNull(connection);

			getConnectionRegistry().didCloseConnection(connection);
			safelyNotify(lifecycleObserver -> lifecycleObserver.didCloseConnection(connection));
		}
	}

	/**
	 * Translates transport events into {@link LogEvent}s.
	 */
	@ThreadSafe
	private final class LogEventLogger implements Logger {
		@Override
		public boolean enabled() {
			return true;
		}

		@Override
		public void log(@Nullable LogEntry... logEntries) {
			log(null, logEntries);
		}

		@Override
		public void log(@Nullable Exception e,
										@Nullable LogEntry... logEntries) {
			Map<String, String> values = new LinkedHashMap<>();

			if (logEntries != null)
				for (LogEntry logEntry : logEntries)
					values.put(logEntry.key(), logEntry.value());

			String event = values.getOrDefault("event", "unknown");
			LogEventType logEventType = logEventTypeFor(event);

			if (logEventType == null)
				return;

			LogEvent.Builder builder = LogEvent.with(logEventType, format("Transport event '%s'", event))
					.throwable(e);

			for (Map.Entry<String, String> entry : values.entrySet())
				if (!entry.getKey().equals("event"))
					builder.field(entry.getKey().equals("id") ? "connectionId" : entry.getKey(), entry.getValue());

			safelyLog(builder.field("event", event).build());
		}

		@Nullable
		private LogEventType logEventTypeFor(@NonNull String event) {
			requireNonNull(event);

			switch (event) {
				case "keep_alive_timeout":
				case "stopped_accepting":
					return null;
				case "malformed_request":
				case "request_too_large":
					return LogEventType.SERVER_UNPARSEABLE_REQUEST;
				case "request_timeout":
				case "headers_timeout":
					return LogEventType.SERVER_REQUEST_TIMED_OUT;
				case "event_loop_terminate":
				case "sub_event_loop_terminate":
				case "observer_error":
					return LogEventType.SERVER_INTERNAL_ERROR;
				default:
					return LogEventType.SERVER_TRANSPORT_ERROR;
			}
		}
	}

	@ThreadSafe
	protected static class NonvirtualThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final AtomicInteger idGenerator;

		public NonvirtualThreadFactory(@NonNull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			String name = format("%s-%s", getNamePrefix(), getIdGenerator().incrementAndGet());
			Thread thread = new Thread(runnable, name);
			thread.setDaemon(true);
			return thread;
		}

		@NonNull
		protected String getNamePrefix() {
			return this.namePrefix;
		}

		@NonNull
		protected AtomicInteger getIdGenerator() {
			return this.idGenerator;
		}
	}
}
