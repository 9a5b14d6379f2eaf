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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An informational "loggable" event that occurs during Gatehouse's internal processing - for example, if a request is rejected or a shutdown is forced.
 * <p>
 * These events are exposed via {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 * <p>
 * Instances can be acquired via the {@link #with(LogEventType, String)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LogEvent {
	@NonNull
	private final LogEventType logEventType;
	@NonNull
	private final String message;
	@Nullable
	private final Throwable throwable;
	@Nullable
	private final Connection connection;
	@Nullable
	private final Request request;
	@NonNull
	private final Map<String, Object> fields;

	/**
	 * Acquires a builder for {@link LogEvent} instances.
	 *
	 * @param logEventType what kind of log event this is
	 * @param message      the message for this log event
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull LogEventType logEventType,
														 @NonNull String message) {
		requireNonNull(logEventType);
		requireNonNull(message);

		return new Builder(logEventType, message);
	}

	protected LogEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		this.logEventType = builder.logEventType;
		this.message = builder.message;
		this.throwable = builder.throwable;
		this.connection = builder.connection;
		this.request = builder.request;
		this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{logEventType=%s, message=%s, fields=%s, throwable=%s}", getClass().getSimpleName(),
				getLogEventType(), getMessage(), getFields(), getThrowable().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogEvent logEvent))
			return false;

		return Objects.equals(getLogEventType(), logEvent.getLogEventType())
				&& Objects.equals(getMessage(), logEvent.getMessage())
				&& Objects.equals(getThrowable(), logEvent.getThrowable())
				&& Objects.equals(getConnection(), logEvent.getConnection())
				&& Objects.equals(getRequest(), logEvent.getRequest())
				&& Objects.equals(getFields(), logEvent.getFields());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLogEventType(), getMessage(), getThrowable(), getConnection(), getRequest(), getFields());
	}

	@NonNull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	@NonNull
	public String getMessage() {
		return this.message;
	}

	@NonNull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	/**
	 * The connection associated with this log event, if available.
	 *
	 * @return the connection, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<Connection> getConnection() {
		return Optional.ofNullable(this.connection);
	}

	/**
	 * The request associated with this log event, if available.
	 *
	 * @return the request, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<Request> getRequest() {
		return Optional.ofNullable(this.request);
	}

	/**
	 * Structured key-value context for this event, in insertion order.
	 *
	 * @return the fields, possibly empty
	 */
	@NonNull
	public Map<String, Object> getFields() {
		return this.fields;
	}

	/**
	 * Builder used to construct instances of {@link LogEvent} via {@link LogEvent#with(LogEventType, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final LogEventType logEventType;
		@NonNull
		private final String message;
		@NonNull
		private final Map<String, Object> fields;
		@Nullable
		private Throwable throwable;
		@Nullable
		private Connection connection;
		@Nullable
		private Request request;

		protected Builder(@NonNull LogEventType logEventType,
											@NonNull String message) {
			requireNonNull(logEventType);
			requireNonNull(message);

			this.logEventType = logEventType;
			this.message = message;
			this.fields = new LinkedHashMap<>();
		}

		@NonNull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@NonNull
		public Builder connection(@Nullable Connection connection) {
			this.connection = connection;
			return this;
		}

		@NonNull
		public Builder request(@Nullable Request request) {
			this.request = request;
			return this;
		}

		@NonNull
		public Builder field(@NonNull String name,
												 @Nullable Object value) {
			requireNonNull(name);

			if (value != null)
				this.fields.put(name, value);

			return this;
		}

		@NonNull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}
}
