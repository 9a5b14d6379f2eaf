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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * A loopback-only HTTP server which validates every request before routing it and shuts down by draining its
 * open connections.
 * <p>
 * For example:
 * <pre>{@code  ServerConfig serverConfig = ServerConfigLoader.load();
 *
 * try (Server server = Server.withConfig(serverConfig).build()) {
 *   server.start();
 *   ShutdownOutcome outcome = server.shutdown("SIGTERM").join();
 * }}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listener and starts accepting connections.
	 * <p>
	 * If the server is already started, no action is taken.
	 *
	 * @throws java.io.UncheckedIOException if the listener cannot be bound, e.g. because the port is already in use
	 */
	void start();

	/**
	 * Performs a shutdown cycle with reason {@code STOP} and blocks until it completes.
	 * <p>
	 * If the server is not running, no action is taken.
	 */
	void stop();

	/**
	 * Starts a graceful shutdown cycle: stop accepting, close idle connections, drain, then force-close whatever remains.
	 * <p>
	 * Calls made while a cycle is in progress return a future for that same cycle.
	 *
	 * @param reason why shutdown was requested, e.g. {@code SIGINT}
	 * @return a future which completes once the server is {@link ServerState#STOPPED} and its transport is released
	 */
	@NonNull
	CompletableFuture<ShutdownOutcome> shutdown(@NonNull String reason);

	/**
	 * Is this server started (that is, {@link ServerState#RUNNING})?
	 *
	 * @return {@code true} if the server is started, {@code false} otherwise
	 */
	@NonNull
	Boolean isStarted();

	@NonNull
	ServerState getState();

	/**
	 * The port the listener is actually bound to, which differs from the configured port when that port is {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if the listener is not bound
	 */
	@NonNull
	Optional<Integer> getPort();

	@NonNull
	ServerConfig getServerConfig();

	/**
	 * The connections currently open on this server.
	 *
	 * @return the registry
	 */
	@NonNull
	ConnectionRegistry getConnectionRegistry();

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	/**
	 * Acquires a builder for the standard {@link Server} implementation.
	 *
	 * @param serverConfig the validated configuration
	 * @return the builder
	 */
	@NonNull
	static Builder withConfig(@NonNull ServerConfig serverConfig) {
		requireNonNull(serverConfig);
		return new Builder(serverConfig);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		ServerConfig serverConfig;
		@Nullable
		RequestRouter requestRouter;
		@Nullable
		RequestValidator requestValidator;
		@Nullable
		LifecycleObserver lifecycleObserver;

		@NonNull
		private Builder(@NonNull ServerConfig serverConfig) {
			requireNonNull(serverConfig);
			this.serverConfig = serverConfig;
		}

		@NonNull
		public Builder serverConfig(@NonNull ServerConfig serverConfig) {
			requireNonNull(serverConfig);
			this.serverConfig = serverConfig;
			return this;
		}

		@NonNull
		public Builder requestRouter(@Nullable RequestRouter requestRouter) {
			this.requestRouter = requestRouter;
			return this;
		}

		@NonNull
		public Builder requestValidator(@Nullable RequestValidator requestValidator) {
			this.requestValidator = requestValidator;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
