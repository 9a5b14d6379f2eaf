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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable parameters captured at the moment a shutdown cycle begins.
 * <p>
 * The grace deadline is when draining gives up and forced closure starts; the force deadline is how long forced closure
 * may wait for connections to report that they have closed before they are dropped from the registry regardless.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ShutdownPlan {
	@NonNull
	private final String reason;
	@NonNull
	private final Instant startedAt;
	@NonNull
	private final Instant graceDeadline;
	@NonNull
	private final Instant forceDeadline;
	@NonNull
	private final Duration drainPollInterval;

	@NonNull
	public static Builder withReason(@NonNull String reason) {
		requireNonNull(reason);
		return new Builder(reason);
	}

	protected ShutdownPlan(@NonNull Builder builder) {
		requireNonNull(builder);

		this.reason = builder.reason;
		this.startedAt = builder.startedAt == null ? Instant.now() : builder.startedAt;
		this.drainPollInterval = builder.drainPollInterval == null ? Duration.ofSeconds(1) : builder.drainPollInterval;

		Duration gracePeriod = builder.gracePeriod == null ? Duration.ofSeconds(10) : builder.gracePeriod;
		Duration forceCloseTimeout = builder.forceCloseTimeout == null ? Duration.ofSeconds(1) : builder.forceCloseTimeout;

		if (gracePeriod.isNegative())
			throw new IllegalArgumentException("Grace period cannot be negative");

		if (forceCloseTimeout.isNegative())
			throw new IllegalArgumentException("Force-close timeout cannot be negative");

		if (this.drainPollInterval.isNegative() || this.drainPollInterval.isZero())
			throw new IllegalArgumentException("Drain poll interval must be positive");

		this.graceDeadline = this.startedAt.plus(gracePeriod);
		this.forceDeadline = this.graceDeadline.plus(forceCloseTimeout);
	}

	/**
	 * Why shutdown was requested, e.g. {@code SIGTERM} or {@code UNCAUGHT_EXCEPTION}.
	 */
	@NonNull
	public String getReason() {
		return this.reason;
	}

	@NonNull
	public Instant getStartedAt() {
		return this.startedAt;
	}

	@NonNull
	public Instant getGraceDeadline() {
		return this.graceDeadline;
	}

	@NonNull
	public Instant getForceDeadline() {
		return this.forceDeadline;
	}

	@NonNull
	public Duration getDrainPollInterval() {
		return this.drainPollInterval;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{reason=%s, startedAt=%s, graceDeadline=%s, forceDeadline=%s, drainPollInterval=%s}",
				getClass().getSimpleName(), getReason(), getStartedAt(), getGraceDeadline(), getForceDeadline(), getDrainPollInterval());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ShutdownPlan shutdownPlan))
			return false;

		return Objects.equals(getReason(), shutdownPlan.getReason())
				&& Objects.equals(getStartedAt(), shutdownPlan.getStartedAt())
				&& Objects.equals(getGraceDeadline(), shutdownPlan.getGraceDeadline())
				&& Objects.equals(getForceDeadline(), shutdownPlan.getForceDeadline())
				&& Objects.equals(getDrainPollInterval(), shutdownPlan.getDrainPollInterval());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getReason(), getStartedAt(), getGraceDeadline(), getForceDeadline(), getDrainPollInterval());
	}

	/**
	 * Builder used to construct instances of {@link ShutdownPlan}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String reason;
		@Nullable
		private Instant startedAt;
		@Nullable
		private Duration gracePeriod;
		@Nullable
		private Duration forceCloseTimeout;
		@Nullable
		private Duration drainPollInterval;

		protected Builder(@NonNull String reason) {
			requireNonNull(reason);
			this.reason = reason;
		}

		@NonNull
		public Builder startedAt(@Nullable Instant startedAt) {
			this.startedAt = startedAt;
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
		public ShutdownPlan build() {
			return new ShutdownPlan(this);
		}
	}
}
