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

import com.gatehouse.util.LoggingUtils;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Process entry point: loads configuration, starts a {@link Server}, and turns JVM shutdown and uncaught exceptions
 * into a single graceful shutdown cycle.
 * <p>
 * Exit status is {@code 0} once shutdown completes, whether or not connections had to be force-closed, and {@code 1}
 * if configuration is invalid or the listener cannot be bound.
 * <p>
 * If the {@code GATEHOUSE_LOGBACK_CONFIG} environment variable names a file, Logback is configured from it;
 * otherwise the bundled {@code logback.xml} applies.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Gatehouse {
	@NonNull
	static final Integer EXIT_STATUS_SUCCESS;
	@NonNull
	static final Integer EXIT_STATUS_FAILURE;

	static {
		EXIT_STATUS_SUCCESS = 0;
		EXIT_STATUS_FAILURE = 1;
	}

	@NonNull
	private final Server server;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final CompletableFuture<ShutdownOutcome> shutdownOutcome;

	public static void main(@Nullable String[] args) {
		LifecycleObserver lifecycleObserver = LifecycleObserver.defaultInstance();
		String logbackConfigurationFile = System.getenv("GATEHOUSE_LOGBACK_CONFIG");

		if (logbackConfigurationFile != null && logbackConfigurationFile.trim().length() > 0)
			LoggingUtils.initializeLogback(Path.of(logbackConfigurationFile.trim()));
		else
			LoggingUtils.installJulBridge();

		ServerConfig serverConfig;

		try {
			serverConfig = ServerConfigLoader.load();
		} catch (ConfigurationException e) {
			lifecycleObserver.didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR,
					format("Invalid configuration: %s", e.getMessage())).throwable(e).build());
			System.exit(EXIT_STATUS_FAILURE);
			return;
		}

		Server server = Server.withConfig(serverConfig)
				.lifecycleObserver(lifecycleObserver)
				.build();

		System.exit(new Gatehouse(server, lifecycleObserver).run());
	}

	Gatehouse(@NonNull Server server,
						@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(server);
		requireNonNull(lifecycleObserver);

		this.server = server;
		this.lifecycleObserver = lifecycleObserver;
		this.shutdownOutcome = new CompletableFuture<>();
	}

	/**
	 * Starts the server, installs the JVM shutdown hook and default uncaught-exception handler, and blocks until
	 * shutdown completes.
	 *
	 * @return the process exit status
	 */
	@NonNull
	Integer run() {
		if (!start())
			return EXIT_STATUS_FAILURE;

		Thread shutdownHook = new Thread(this::handleJvmShutdown, "gatehouse-shutdown-hook");
		Runtime.getRuntime().addShutdownHook(shutdownHook);
		Thread.setDefaultUncaughtExceptionHandler(this::handleUncaughtException);

		try {
			awaitShutdown();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			triggerShutdown(ShutdownTrigger.JVM_SHUTDOWN).join();
		}

		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		} catch (IllegalStateException ignored) {
			// JVM is already shutting down; the hook is running or has run
		}

		return EXIT_STATUS_SUCCESS;
	}

	/**
	 * Starts the server.
	 *
	 * @return {@code true} if the server is running, {@code false} if the listener could not be bound
	 */
	@NonNull
	Boolean start() {
		try {
			getServer().start();
			return true;
		} catch (UncheckedIOException e) {
			// Server has already logged the bind failure with its details
			System.err.println(e.getMessage());
			return false;
		}
	}

	/**
	 * Starts a shutdown cycle for {@code shutdownTrigger}. Every trigger after the first joins the cycle in progress.
	 *
	 * @param shutdownTrigger what caused the shutdown
	 * @return a future which completes with the cycle's outcome
	 */
	@NonNull
	CompletableFuture<ShutdownOutcome> triggerShutdown(@NonNull ShutdownTrigger shutdownTrigger) {
		requireNonNull(shutdownTrigger);

		getServer().shutdown(shutdownTrigger.getReason()).whenComplete((outcome, throwable) -> {
			if (throwable != null)
				getShutdownOutcome().completeExceptionally(throwable);
			else if (outcome != ShutdownOutcome.NOT_RUNNING || getServer().getState() == ServerState.STOPPED)
				getShutdownOutcome().complete(outcome);
		});

		return getShutdownOutcome();
	}

	/**
	 * Blocks until a shutdown cycle completes.
	 *
	 * @return the outcome of the cycle
	 * @throws InterruptedException if interrupted while waiting
	 */
	@NonNull
	ShutdownOutcome awaitShutdown() throws InterruptedException {
		try {
			return getShutdownOutcome().get();
		} catch (ExecutionException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Shutdown failed")
					.throwable(e.getCause())
					.build());
			return ShutdownOutcome.FORCED;
		}
	}

	void handleUncaughtException(@NonNull Thread thread,
															 @NonNull Throwable throwable) {
		requireNonNull(thread);
		requireNonNull(throwable);

		safelyLog(LogEvent.with(LogEventType.UNCAUGHT_EXCEPTION, format("Uncaught exception on thread '%s', shutting down", thread.getName()))
				.throwable(throwable)
				.field("thread", thread.getName())
				.build());

		triggerShutdown(ShutdownTrigger.UNCAUGHT_EXCEPTION);
	}

	/**
	 * Runs on the JVM's shutdown hook thread. The JVM would otherwise report the signal's status, so once the
	 * drain has finished the process halts with status {@code 0}.
	 */
	void handleJvmShutdown() {
		try {
			triggerShutdown(ShutdownTrigger.JVM_SHUTDOWN).join();
		} catch (RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Shutdown failed during JVM shutdown")
					.throwable(e)
					.build());
		}

		System.out.flush();
		System.err.flush();
		Runtime.getRuntime().halt(EXIT_STATUS_SUCCESS);
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	Server getServer() {
		return this.server;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	private CompletableFuture<ShutdownOutcome> getShutdownOutcome() {
		return this.shutdownOutcome;
	}
}
