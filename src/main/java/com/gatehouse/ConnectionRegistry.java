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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The set of currently-open transport connections for one server instance, keyed by {@link Connection#getId()}.
 * <p>
 * Connection-handling threads add and remove concurrently while a shutdown thread iterates; iteration is over a
 * snapshot, which is sufficient because no new connections are accepted once the server leaves {@link ServerState#RUNNING}.
 * <p>
 * Every removal that leaves the registry empty signals waiters in {@link #awaitEmpty(Duration, Instant)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ConnectionRegistry implements ConnectionObserver {
	@NonNull
	private final ConcurrentHashMap<Long, Connection> connectionsById;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Condition emptied;

	public ConnectionRegistry() {
		this.connectionsById = new ConcurrentHashMap<>();
		this.lock = new ReentrantLock();
		this.emptied = this.lock.newCondition();
	}

	/**
	 * Inserts a connection. Callers must not add the same identity twice.
	 *
	 * @param connection the connection to track
	 * @throws IllegalStateException if a connection with the same identity is already present
	 */
	public void add(@NonNull Connection connection) {
		requireNonNull(connection);

		Connection existingConnection = getConnectionsById().putIfAbsent(connection.getId(), connection);

		if (existingConnection != null)
			throw new IllegalStateException(format("Connection with ID %s is already registered", connection.getId()));
	}

	/**
	 * Removes the connection with the given identity, if present.
	 *
	 * @param connectionId the identity to remove
	 * @return {@code true} if a connection was removed, {@code false} if none was present
	 */
	@NonNull
	public Boolean remove(@NonNull Long connectionId) {
		requireNonNull(connectionId);

		boolean removed = getConnectionsById().remove(connectionId) != null;

		if (removed && getConnectionsById().isEmpty())
			signalEmptied();

		return removed;
	}

	@NonNull
	public Integer size() {
		return getConnectionsById().size();
	}

	@NonNull
	public Boolean isEmpty() {
		return getConnectionsById().isEmpty();
	}

	/**
	 * Applies {@code consumer} to a snapshot of the registered connections.
	 * <p>
	 * The consumer may cause connections to be removed (for example by closing them) without affecting iteration.
	 *
	 * @param consumer the function to apply
	 */
	public void forEach(@NonNull Consumer<Connection> consumer) {
		requireNonNull(consumer);

		for (Connection connection : snapshot())
			consumer.accept(connection);
	}

	/**
	 * Blocks until the registry is empty or {@code deadline} passes, re-checking at least every {@code pollInterval}.
	 *
	 * @param pollInterval maximum time between size checks
	 * @param deadline     when to give up
	 * @return {@code true} if the registry became empty, {@code false} if the deadline passed first
	 * @throws InterruptedException if interrupted while waiting
	 */
	@NonNull
	public Boolean awaitEmpty(@NonNull Duration pollInterval,
														@NonNull Instant deadline) throws InterruptedException {
		requireNonNull(pollInterval);
		requireNonNull(deadline);

		long pollIntervalNanos = Math.max(1L, pollInterval.toNanos());

		getLock().lock();

		try {
			while (!isEmpty()) {
				long remainingNanos = Duration.between(Instant.now(), deadline).toNanos();

				if (remainingNanos <= 0L)
					return false;

				getEmptied().await(Math.min(remainingNanos, pollIntervalNanos), TimeUnit.NANOSECONDS);
			}

			return true;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Drops every remaining entry without closing anything.
	 * <p>
	 * Used only as a last resort when connections failed to report closure after being forcibly closed.
	 *
	 * @return the connections that were dropped
	 */
	@NonNull
	public List<Connection> purge() {
		List<Connection> purgedConnections = new ArrayList<>();

		for (Connection connection : snapshot())
			if (getConnectionsById().remove(connection.getId()) != null)
				purgedConnections.add(connection);

		if (getConnectionsById().isEmpty())
			signalEmptied();

		return purgedConnections;
	}

	@Override
	public void didOpenConnection(@NonNull Connection connection) {
		add(connection);
	}

	@Override
	public void didCloseConnection(@NonNull Connection connection) {
		requireNonNull(connection);
		remove(connection.getId());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{size=%d}", getClass().getSimpleName(), size());
	}

	@NonNull
	private List<Connection> snapshot() {
		return new ArrayList<>(getConnectionsById().values());
	}

	private void signalEmptied() {
		getLock().lock();

		try {
			getEmptied().signalAll();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	private ConcurrentHashMap<Long, Connection> getConnectionsById() {
		return this.connectionsById;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Condition getEmptied() {
		return this.emptied;
	}
}
