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

import org.jspecify.annotations.NonNull;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

/**
 * Read-only hooks into server and connection lifecycle events.
 * <p>
 * Gatehouse invokes these methods from transport, request-handling and shutdown threads, so implementations must be threadsafe
 * and should return quickly. Exceptions thrown by an observer are caught and never interrupt the server; they are
 * written to {@code stderr} instead.
 * <p>
 * A standard threadsafe implementation which routes {@link LogEvent}s to SLF4J can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called before the server starts.
	 */
	default void willStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server starts.
	 */
	default void didStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after a {@link Server} instance was asked to start, but failed due to an exception.
	 */
	default void didFailToStartServer(@NonNull Server server,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before the server stops.
	 */
	default void willStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server stops.
	 */
	default void didStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after a transport connection is accepted and registered.
	 */
	default void didOpenConnection(@NonNull Connection connection) {
		// No-op by default
	}

	/**
	 * Called after a transport connection is closed and deregistered.
	 */
	default void didCloseConnection(@NonNull Connection connection) {
		// No-op by default
	}

	/**
	 * Called when the {@link RequestValidator} rejects a request; the terminal response is written immediately afterward.
	 */
	default void didRejectRequest(@NonNull Request request,
																@NonNull ValidationVerdict validationVerdict) {
		// No-op by default
	}

	/**
	 * Called once per shutdown cycle, after the server has moved to {@link ServerState#STOPPING}.
	 */
	default void didStartShutdown(@NonNull ShutdownPlan shutdownPlan) {
		// No-op by default
	}

	/**
	 * Called once per shutdown cycle, after the server has moved to {@link ServerState#STOPPED}.
	 */
	default void didFinishShutdown(@NonNull ShutdownPlan shutdownPlan,
																 @NonNull ShutdownOutcome shutdownOutcome,
																 @NonNull Duration duration) {
		// No-op by default
	}

	/**
	 * Called when Gatehouse has diagnostic information to report.
	 * <p>
	 * The default implementation writes to {@code stderr}; {@link #defaultInstance()} routes to SLF4J instead.
	 *
	 * @param logEvent the event to report
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		String message = logEvent.getMessage();
		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable == null) {
			System.err.printf("%s::didReceiveLogEvent [%s]: %s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message);
		} else {
			StringWriter stringWriter = new StringWriter();
			PrintWriter printWriter = new PrintWriter(stringWriter);
			throwable.printStackTrace(printWriter);
			String throwableWithStackTrace = stringWriter.toString();

			System.err.printf("%s::didReceiveLogEvent [%s]: %s\n%s\n", LifecycleObserver.class.getSimpleName(), logEvent.getLogEventType().name(), message, throwableWithStackTrace);
		}
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 * <p>
	 * The returned instance is guaranteed to be a JVM-wide singleton.
	 *
	 * @return a {@code LifecycleObserver} which logs via SLF4J
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
