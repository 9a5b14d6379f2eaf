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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Orchestrates graceful drain versus forced termination for one server instance.
 * <p>
 * A shutdown cycle moves the {@link ServerStateMachine} from {@link ServerState#RUNNING} to {@link ServerState#STOPPING},
 * stops the listener, asks idle connections to close and then waits for the {@link ConnectionRegistry} to empty.
 * If the grace period elapses first, every remaining connection is forcibly closed. The cycle ends by moving to
 * {@link ServerState#STOPPED} with an empty registry.
 * <p>
 * Concurrent or repeated calls to {@link #shutdown(String)} during a cycle share that cycle's future.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ShutdownCoordinator {
	@NonNull
	private static final Duration DEFAULT_GRACE_PERIOD;
	@NonNull
	private static final Duration DEFAULT_FORCE_CLOSE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_DRAIN_POLL_INTERVAL;
	@NonNull
	private static final AtomicInteger THREAD_ID_GENERATOR;

	static {
		DEFAULT_GRACE_PERIOD = Duration.ofSeconds(10);
		DEFAULT_FORCE_CLOSE_TIMEOUT = Duration.ofSeconds(1);
		DEFAULT_DRAIN_POLL_INTERVAL = Duration.ofSeconds(1);
		THREAD_ID_GENERATOR = new AtomicInteger(0);
	}

	@NonNull
	private final ServerStateMachine serverStateMachine;
	@NonNull
	private final ConnectionRegistry connectionRegistry;
	@NonNull
	private final Runnable stopAccepting;
	@NonNull
	private final Duration gracePeriod;
	@NonNull
	private final Duration forceCloseTimeout;
	@NonNull
	private final Duration drainPollInterval;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private CompletableFuture<ShutdownOutcome> pendingShutdown;

	/**
	 * Acquires a builder for {@link ShutdownCoordinator} instances.
	 *
	 * @param serverStateMachine the state machine to drive
	 * @param connectionRegistry the registry to drain
	 * @return the builder
	 */
	@NonNull
	public static Builder withStateMachine(@NonNull ServerStateMachine serverStateMachine,
																				 @NonNull ConnectionRegistry connectionRegistry) {
		requireNonNull(serverStateMachine);
		requireNonNull(connectionRegistry);

		return new Builder(serverStateMachine, connectionRegistry);
	}

	protected ShutdownCoordinator(@NonNull Builder builder) {
		requireNonNull(builder);

		this.serverStateMachine = builder.serverStateMachine;
		this.connectionRegistry = builder.connectionRegistry;
		this.stopAccepting = builder.stopAccepting != null ? builder.stopAccepting : () -> {};
		this.gracePeriod = builder.gracePeriod != null ? builder.gracePeriod : DEFAULT_GRACE_PERIOD;
		this.forceCloseTimeout = builder.forceCloseTimeout != null ? builder.forceCloseTimeout : DEFAULT_FORCE_CLOSE_TIMEOUT;
		this.drainPollInterval = builder.drainPollInterval != null ? builder.drainPollInterval : DEFAULT_DRAIN_POLL_INTERVAL;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.lock = new ReentrantLock();

		if (this.gracePeriod.isNegative())
			throw new IllegalArgumentException("Grace period must be >= 0");

		if (this.forceCloseTimeout.isNegative())
			throw new IllegalArgumentException("Force-close timeout must be >= 0");

		if (this.drainPollInterval.isNegative() || this.drainPollInterval.isZero())
			throw new IllegalArgumentException("Drain poll interval must be > 0");
	}

	/**
	 * Begins a shutdown cycle, or joins the one already in progress.
	 * <p>
	 * If the server is {@link ServerState#RUNNING}, it moves to {@link ServerState#STOPPING} and a drain starts on a
	 * dedicated thread. If a cycle is already in progress, its future is returned. Otherwise the returned future is
	 * already completed with {@link ShutdownOutcome#NOT_RUNNING}.
	 *
	 * @param reason why shutdown was requested, e.g. {@code SIGTERM}
	 * @return a future which completes once the server is {@link ServerState#STOPPED} and the registry is empty
	 */
	@NonNull
	public CompletableFuture<ShutdownOutcome> shutdown(@NonNull String reason) {
		requireNonNull(reason);

		ShutdownPlan shutdownPlan;
		CompletableFuture<ShutdownOutcome> shutdownFuture;

		getLock().lock();

		try {
			if (this.pendingShutdown != null && !this.pendingShutdown.isDone()) {
				safelyLog(LogEvent.with(LogEventType.SHUTDOWN_ALREADY_IN_PROGRESS,
								format("Shutdown requested (%s) while a shutdown is already in progress", reason))
						.field("reason", reason)
						.build());

				return this.pendingShutdown;
			}

			ServerState currentState = getServerStateMachine().getCurrentState();

			if (currentState != ServerState.RUNNING || !getServerStateMachine().tryTransition(ServerState.RUNNING, ServerState.STOPPING)) {
				safelyLog(LogEvent.with(LogEventType.SHUTDOWN_ALREADY_IN_PROGRESS,
								format("Shutdown requested (%s) but server is %s", reason, currentState))
						.field("reason", reason)
						.field("state", currentState)
						.build());

				return CompletableFuture.completedFuture(ShutdownOutcome.NOT_RUNNING);
			}

			shutdownPlan = ShutdownPlan.withReason(reason)
					.gracePeriod(getGracePeriod())
					.forceCloseTimeout(getForceCloseTimeout())
					.drainPollInterval(getDrainPollInterval())
					.build();

			shutdownFuture = new CompletableFuture<>();
			this.pendingShutdown = shutdownFuture;
		} finally {
			getLock().unlock();
		}

		Thread drainThread = new Thread(() -> drain(shutdownPlan, shutdownFuture),
				format("gatehouse-shutdown-%d", THREAD_ID_GENERATOR.incrementAndGet()));

		drainThread.start();

		return shutdownFuture;
	}

	/**
	 * The future for the shutdown cycle currently in progress, if any.
	 *
	 * @return the pending shutdown, or {@link Optional#empty()} if no cycle is in progress
	 */
	@NonNull
	public Optional<CompletableFuture<ShutdownOutcome>> getPendingShutdown() {
		getLock().lock();

		try {
			if (this.pendingShutdown == null || this.pendingShutdown.isDone())
				return Optional.empty();

			return Optional.of(this.pendingShutdown);
		} finally {
			getLock().unlock();
		}
	}

	protected void drain(@NonNull ShutdownPlan shutdownPlan,
											 @NonNull CompletableFuture<ShutdownOutcome> shutdownFuture) {
		requireNonNull(shutdownPlan);
		requireNonNull(shutdownFuture);

		ShutdownOutcome shutdownOutcome = ShutdownOutcome.GRACEFUL;
		boolean interrupted = false;

		try {
			safelyLog(LogEvent.with(LogEventType.SHUTDOWN_STARTED,
							format("Received %s, starting graceful shutdown with %d open connection[s]...", shutdownPlan.getReason(), getConnectionRegistry().size()))
					.field("reason", shutdownPlan.getReason())
					.field("openConnections", getConnectionRegistry().size())
					.build());

			safelyNotify(() -> getLifecycleObserver().didStartShutdown(shutdownPlan));

			try {
				getStopAccepting().run();
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to stop accepting new connections")
						.throwable(e)
						.build());
			}

			if (!awaitDrained(shutdownPlan)) {
				shutdownOutcome = ShutdownOutcome.FORCED;
				forceCloseRemaining(shutdownPlan);
			}
		} catch (InterruptedException e) {
			interrupted = true;
			shutdownOutcome = ShutdownOutcome.FORCED;
			forceCloseRemaining(shutdownPlan);
		} catch (RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unexpected error during shutdown drain")
					.throwable(e)
					.build());

			shutdownOutcome = ShutdownOutcome.FORCED;
			forceCloseRemaining(shutdownPlan);
		} finally {
			finish(shutdownPlan, shutdownOutcome, shutdownFuture);

			if (interrupted)
				Thread.currentThread().interrupt();
		}
	}

	/**
	 * Waits for the registry to empty until the grace deadline, asking idle connections to close at every poll.
	 */
	@NonNull
	protected Boolean awaitDrained(@NonNull ShutdownPlan shutdownPlan) throws InterruptedException {
		requireNonNull(shutdownPlan);

		while (true) {
			closeIdleConnections();

			Instant now = Instant.now();

			if (!now.isBefore(shutdownPlan.getGraceDeadline()))
				return getConnectionRegistry().isEmpty();

			Instant nextCheck = now.plus(shutdownPlan.getDrainPollInterval());

			if (nextCheck.isAfter(shutdownPlan.getGraceDeadline()))
				nextCheck = shutdownPlan.getGraceDeadline();

			if (getConnectionRegistry().awaitEmpty(shutdownPlan.getDrainPollInterval(), nextCheck))
				return true;

			safelyLog(LogEvent.with(LogEventType.SHUTDOWN_DRAINING,
							format("Waiting for %d connection[s] to close...", getConnectionRegistry().size()))
					.field("openConnections", getConnectionRegistry().size())
					.build());
		}
	}

	protected void closeIdleConnections() {
		getConnectionRegistry().forEach(connection -> {
			try {
				if (connection.isIdle())
					connection.closeGracefully();
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_TRANSPORT_ERROR, "Unable to close idle connection")
						.connection(connection)
						.throwable(e)
						.build());
			}
		});
	}

	protected void forceCloseRemaining(@NonNull ShutdownPlan shutdownPlan) {
		requireNonNull(shutdownPlan);

		if (getConnectionRegistry().isEmpty())
			return;

		safelyLog(LogEvent.with(LogEventType.SHUTDOWN_FORCING,
						format("Could not close connections in time, forcefully shutting down %d connection[s]", getConnectionRegistry().size()))
				.field("openConnections", getConnectionRegistry().size())
				.build());

		getConnectionRegistry().forEach(connection -> {
			try {
				connection.closeForcibly();
			} catch (RuntimeException e) {
				safelyLog(LogEvent.with(LogEventType.SHUTDOWN_FORCE_CLOSE_FAILED, "Unable to forcibly close connection")
						.connection(connection)
						.throwable(e)
						.build());
			}
		});

		boolean interrupted = false;

		try {
			if (getConnectionRegistry().awaitEmpty(shutdownPlan.getDrainPollInterval(), shutdownPlan.getForceDeadline()))
				return;
		} catch (InterruptedException e) {
			interrupted = true;
		}

		List<Connection> purgedConnections = getConnectionRegistry().purge();

		for (Connection connection : purgedConnections)
			safelyLog(LogEvent.with(LogEventType.SHUTDOWN_FORCE_CLOSE_FAILED,
							format("Connection %d did not report closure after being forcibly closed; dropping it", connection.getId()))
					.connection(connection)
					.build());

		if (interrupted)
			Thread.currentThread().interrupt();
	}

	protected void finish(@NonNull ShutdownPlan shutdownPlan,
												@NonNull ShutdownOutcome shutdownOutcome,
												@NonNull CompletableFuture<ShutdownOutcome> shutdownFuture) {
		requireNonNull(shutdownPlan);
		requireNonNull(shutdownOutcome);
		requireNonNull(shutdownFuture);

		// Stopped is only ever entered with an empty registry
		if (!getConnectionRegistry().isEmpty())
			for (Connection connection : getConnectionRegistry().purge())
				safelyLog(LogEvent.with(LogEventType.SHUTDOWN_FORCE_CLOSE_FAILED,
								format("Connection %d was still registered at shutdown completion; dropping it", connection.getId()))
						.connection(connection)
						.build());

		Duration duration = Duration.between(shutdownPlan.getStartedAt(), Instant.now());

		getLock().lock();

		try {
			getServerStateMachine().tryTransition(ServerState.STOPPING, ServerState.STOPPED);
		} finally {
			getLock().unlock();
		}

		safelyLog(LogEvent.with(LogEventType.SHUTDOWN_COMPLETED, shutdownOutcome == ShutdownOutcome.FORCED
						? format("Forced shutdown complete after %d ms", duration.toMillis())
						: format("All connections closed, shutdown complete after %d ms", duration.toMillis()))
				.field("reason", shutdownPlan.getReason())
				.field("outcome", shutdownOutcome)
				.field("durationMillis", duration.toMillis())
				.build());

		safelyNotify(() -> getLifecycleObserver().didFinishShutdown(shutdownPlan, shutdownOutcome, duration));

		shutdownFuture.complete(shutdownOutcome);
	}

	protected void safelyNotify(@NonNull Runnable notification) {
		requireNonNull(notification);

		try {
			notification.run();
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED, "Lifecycle observer threw an exception during shutdown")
					.throwable(throwable)
					.build());
		}
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	protected ServerStateMachine getServerStateMachine() {
		return this.serverStateMachine;
	}

	@NonNull
	protected ConnectionRegistry getConnectionRegistry() {
		return this.connectionRegistry;
	}

	@NonNull
	protected Runnable getStopAccepting() {
		return this.stopAccepting;
	}

	@NonNull
	public Duration getGracePeriod() {
		return this.gracePeriod;
	}

	@NonNull
	public Duration getForceCloseTimeout() {
		return this.forceCloseTimeout;
	}

	@NonNull
	public Duration getDrainPollInterval() {
		return this.drainPollInterval;
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
	 * Builder used to construct instances of {@link ShutdownCoordinator}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final ServerStateMachine serverStateMachine;
		@NonNull
		private final ConnectionRegistry connectionRegistry;
		@Nullable
		private Runnable stopAccepting;
		@Nullable
		private Duration gracePeriod;
		@Nullable
		private Duration forceCloseTimeout;
		@Nullable
		private Duration drainPollInterval;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		protected Builder(@NonNull ServerStateMachine serverStateMachine,
											@NonNull ConnectionRegistry connectionRegistry) {
			requireNonNull(serverStateMachine);
			requireNonNull(connectionRegistry);

			this.serverStateMachine = serverStateMachine;
			this.connectionRegistry = connectionRegistry;
		}

		/**
		 * Invoked once per cycle to stop the listener from accepting new connections.
		 */
		@NonNull
		public Builder stopAccepting(@Nullable Runnable stopAccepting) {
			this.stopAccepting = stopAccepting;
			return this;
		}

		@NonNull
		public Builder gracePeriod(@Nullable Duration gracePeriod) {
			this.gracePeriod = gracePeriod;
			return this;
		}

		@NonNull
		public Builder forceCloseTimeout(@Nullable Duration forceCloseTimeout) {
			this.forceCloseTimeout = forceCloseTimeout;
			return this;
		}

		@NonNull
		public Builder drainPollInterval(@Nullable Duration drainPollInterval) {
			this.drainPollInterval = drainPollInterval;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public ShutdownCoordinator build() {
			return new ShutdownCoordinator(this);
		}
	}
}
