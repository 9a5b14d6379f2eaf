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

/**
 * Kinds of {@link LogEvent} instances that Gatehouse can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates the configured port is below 1024 and binding to it requires elevated privileges.
	 */
	CONFIGURATION_PRIVILEGED_PORT,
	/**
	 * Indicates the server bound its listener and is accepting connections.
	 */
	SERVER_STARTED,
	/**
	 * Indicates the server was unable to bind its listener, e.g. because the port is already in use.
	 */
	SERVER_BIND_FAILED,
	/**
	 * Indicates that the server received a request it could not parse.
	 */
	SERVER_UNPARSEABLE_REQUEST,
	/**
	 * Indicates that the {@link RequestValidator} rejected a request before routing.
	 */
	SERVER_REQUEST_REJECTED,
	/**
	 * Indicates a request did not complete within the per-request timeout.
	 */
	SERVER_REQUEST_TIMED_OUT,
	/**
	 * Indicates a socket-level fault on an individual connection.
	 */
	SERVER_TRANSPORT_ERROR,
	/**
	 * Indicates an internal server error occurred.
	 */
	SERVER_INTERNAL_ERROR,
	/**
	 * Indicates a graceful shutdown began.
	 */
	SHUTDOWN_STARTED,
	/**
	 * Indicates a shutdown was requested while one was already in progress or the server was not running.
	 */
	SHUTDOWN_ALREADY_IN_PROGRESS,
	/**
	 * Periodic drain progress while waiting for connections to close.
	 */
	SHUTDOWN_DRAINING,
	/**
	 * Indicates the grace period elapsed and remaining connections are being forcibly closed.
	 */
	SHUTDOWN_FORCING,
	/**
	 * Indicates a connection could not be forcibly closed, or failed to report closure after being forcibly closed.
	 */
	SHUTDOWN_FORCE_CLOSE_FAILED,
	/**
	 * Indicates shutdown finished and the server is stopped.
	 */
	SHUTDOWN_COMPLETED,
	/**
	 * Indicates an uncaught exception reached a thread's top level and triggered a shutdown.
	 */
	UNCAUGHT_EXCEPTION,
	/**
	 * Indicates a {@link LifecycleObserver} invocation threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED
}
