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
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable, validated server configuration.
 * <p>
 * Only loopback hosts are permitted. Ports must be in {@code 1..65535}; {@code 0} is additionally accepted and binds an
 * ephemeral port. Ports below 1024 are accepted but {@link #requiresElevatedPrivileges()} reports {@code true}.
 * <p>
 * Instances can be acquired via the {@link #withPort(Integer)} builder factory method or loaded via {@link ServerConfigLoader}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerConfig {
	@NonNull
	public static final List<String> PERMITTED_HOSTS;
	@NonNull
	public static final Integer PRIVILEGED_PORT_CEILING;

	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_HEADERS_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_KEEP_ALIVE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD;
	@NonNull
	private static final Duration DEFAULT_DRAIN_POLL_INTERVAL;
	@NonNull
	private static final Duration DEFAULT_FORCE_CLOSE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SOCKET_SELECT_TIMEOUT;
	@NonNull
	private static final Integer DEFAULT_CONCURRENCY;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;

	static {
		PERMITTED_HOSTS = List.of("127.0.0.1", "localhost");
		PRIVILEGED_PORT_CEILING = 1_024;

		DEFAULT_HOST = "127.0.0.1";
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_HEADERS_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_KEEP_ALIVE_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(10);
		DEFAULT_DRAIN_POLL_INTERVAL = Duration.ofSeconds(1);
		DEFAULT_FORCE_CLOSE_TIMEOUT = Duration.ofSeconds(1);
		DEFAULT_SOCKET_SELECT_TIMEOUT = Duration.ofMillis(100);
		DEFAULT_CONCURRENCY = Runtime.getRuntime().availableProcessors();
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 1_024;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 64;
	}

	@NonNull
	private final String host;
	@NonNull
	private final Integer port;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Duration headersTimeout;
	@NonNull
	private final Duration keepAliveTimeout;
	@NonNull
	private final Duration shutdownGracePeriod;
	@NonNull
	private final Duration drainPollInterval;
	@NonNull
	private final Duration forceCloseTimeout;
	@NonNull
	private final Duration socketSelectTimeout;
	@NonNull
	private final Integer concurrency;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;

	/**
	 * Acquires a builder for {@link ServerConfig} instances.
	 *
	 * @param port the port to bind, or {@code 0} for an ephemeral port
	 * @return the builder
	 */
	@NonNull
	public static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	protected ServerConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.host = builder.host != null ? builder.host.trim() : DEFAULT_HOST;
		this.port = builder.port;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.headersTimeout = builder.headersTimeout != null ? builder.headersTimeout : DEFAULT_HEADERS_TIMEOUT;
		this.keepAliveTimeout = builder.keepAliveTimeout != null ? builder.keepAliveTimeout : DEFAULT_KEEP_ALIVE_TIMEOUT;
		this.shutdownGracePeriod = builder.shutdownGracePeriod != null ? builder.shutdownGracePeriod : DEFAULT_SHUTDOWN_GRACE_PERIOD;
		this.drainPollInterval = builder.drainPollInterval != null ? builder.drainPollInterval : DEFAULT_DRAIN_POLL_INTERVAL;
		this.forceCloseTimeout = builder.forceCloseTimeout != null ? builder.forceCloseTimeout : DEFAULT_FORCE_CLOSE_TIMEOUT;
		this.socketSelectTimeout = builder.socketSelectTimeout != null ? builder.socketSelectTimeout : DEFAULT_SOCKET_SELECT_TIMEOUT;
		this.concurrency = builder.concurrency != null ? builder.concurrency : DEFAULT_CONCURRENCY;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;

		if (!PERMITTED_HOSTS.contains(this.host))
			throw new ConfigurationException(format("Invalid host '%s'. Only %s are permitted", this.host, String.join(" or ", PERMITTED_HOSTS)));

		if (this.port < 0 || this.port > 65_535)
			throw new ConfigurationException(format("Invalid port %d. Must be between 1 and 65535, or 0 for an ephemeral port", this.port));

		requirePositive(this.requestTimeout, "Request timeout");
		requirePositive(this.headersTimeout, "Headers timeout");
		requirePositive(this.keepAliveTimeout, "Keep-alive timeout");
		requirePositive(this.drainPollInterval, "Drain poll interval");
		requirePositive(this.socketSelectTimeout, "Socket select timeout");

		if (this.shutdownGracePeriod.isNegative())
			throw new ConfigurationException("Shutdown grace period must be >= 0");

		if (this.forceCloseTimeout.isNegative())
			throw new ConfigurationException("Force-close timeout must be >= 0");

		if (this.concurrency < 1)
			throw new ConfigurationException("Concurrency must be > 0");

		if (this.maximumRequestSizeInBytes < 1)
			throw new ConfigurationException("Maximum request size must be > 0");

		if (this.requestReadBufferSizeInBytes < 1)
			throw new ConfigurationException("Request read buffer size must be > 0");
	}

	private static void requirePositive(@NonNull Duration duration,
																			@NonNull String description) {
		if (duration.isNegative() || duration.isZero())
			throw new ConfigurationException(format("%s must be > 0", description));
	}

	/**
	 * Does binding to the configured port normally require elevated (root/administrator) privileges?
	 *
	 * @return {@code true} for ports {@code 1..1023}
	 */
	@NonNull
	public Boolean requiresElevatedPrivileges() {
		return getPort() > 0 && getPort() < PRIVILEGED_PORT_CEILING;
	}

	/**
	 * Returns a builder pre-populated with this configuration's values.
	 *
	 * @return a copy builder
	 */
	@NonNull
	public Builder copy() {
		return new Builder(getPort())
				.host(getHost())
				.requestTimeout(getRequestTimeout())
				.headersTimeout(getHeadersTimeout())
				.keepAliveTimeout(getKeepAliveTimeout())
				.shutdownGracePeriod(getShutdownGracePeriod())
				.drainPollInterval(getDrainPollInterval())
				.forceCloseTimeout(getForceCloseTimeout())
				.socketSelectTimeout(getSocketSelectTimeout())
				.concurrency(getConcurrency())
				.maximumRequestSizeInBytes(getMaximumRequestSizeInBytes())
				.requestReadBufferSizeInBytes(getRequestReadBufferSizeInBytes());
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	/**
	 * Maximum time for a request to arrive in full, and for its handling to complete, before a 408 is written.
	 */
	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	/**
	 * Maximum time for the request line and headers to arrive once the first byte has been read. The request timeout
	 * still applies when it is shorter.
	 */
	@NonNull
	public Duration getHeadersTimeout() {
		return this.headersTimeout;
	}

	/**
	 * How long an idle persistent connection is kept open waiting for its next request.
	 */
	@NonNull
	public Duration getKeepAliveTimeout() {
		return this.keepAliveTimeout;
	}

	@NonNull
	public Duration getShutdownGracePeriod() {
		return this.shutdownGracePeriod;
	}

	@NonNull
	public Duration getDrainPollInterval() {
		return this.drainPollInterval;
	}

	@NonNull
	public Duration getForceCloseTimeout() {
		return this.forceCloseTimeout;
	}

	@NonNull
	public Duration getSocketSelectTimeout() {
		return this.socketSelectTimeout;
	}

	@NonNull
	public Integer getConcurrency() {
		return this.concurrency;
	}

	@NonNull
	public Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	public Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{host=%s, port=%d, requestTimeout=%s, headersTimeout=%s, keepAliveTimeout=%s, shutdownGracePeriod=%s, drainPollInterval=%s, forceCloseTimeout=%s, concurrency=%d}",
				getClass().getSimpleName(), getHost(), getPort(), getRequestTimeout(), getHeadersTimeout(), getKeepAliveTimeout(),
				getShutdownGracePeriod(), getDrainPollInterval(), getForceCloseTimeout(), getConcurrency());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ServerConfig serverConfig))
			return false;

		return Objects.equals(getHost(), serverConfig.getHost())
				&& Objects.equals(getPort(), serverConfig.getPort())
				&& Objects.equals(getRequestTimeout(), serverConfig.getRequestTimeout())
				&& Objects.equals(getHeadersTimeout(), serverConfig.getHeadersTimeout())
				&& Objects.equals(getKeepAliveTimeout(), serverConfig.getKeepAliveTimeout())
				&& Objects.equals(getShutdownGracePeriod(), serverConfig.getShutdownGracePeriod())
				&& Objects.equals(getDrainPollInterval(), serverConfig.getDrainPollInterval())
				&& Objects.equals(getForceCloseTimeout(), serverConfig.getForceCloseTimeout())
				&& Objects.equals(getSocketSelectTimeout(), serverConfig.getSocketSelectTimeout())
				&& Objects.equals(getConcurrency(), serverConfig.getConcurrency())
				&& Objects.equals(getMaximumRequestSizeInBytes(), serverConfig.getMaximumRequestSizeInBytes())
				&& Objects.equals(getRequestReadBufferSizeInBytes(), serverConfig.getRequestReadBufferSizeInBytes());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHost(), getPort(), getRequestTimeout(), getHeadersTimeout(), getKeepAliveTimeout(), getShutdownGracePeriod(),
				getDrainPollInterval(), getForceCloseTimeout(), getSocketSelectTimeout(), getConcurrency(),
				getMaximumRequestSizeInBytes(), getRequestReadBufferSizeInBytes());
	}

	/**
	 * Builder used to construct instances of {@link ServerConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Integer port;
		@Nullable
		private String host;
		@Nullable
		private Duration requestTimeout;
		@Nullable
		private Duration headersTimeout;
		@Nullable
		private Duration keepAliveTimeout;
		@Nullable
		private Duration shutdownGracePeriod;
		@Nullable
		private Duration drainPollInterval;
		@Nullable
		private Duration forceCloseTimeout;
		@Nullable
		private Duration socketSelectTimeout;
		@Nullable
		private Integer concurrency;
		@Nullable
		private Integer maximumRequestSizeInBytes;
		@Nullable
		private Integer requestReadBufferSizeInBytes;

		protected Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder headersTimeout(@Nullable Duration headersTimeout) {
			this.headersTimeout = headersTimeout;
			return this;
		}

		@NonNull
		public Builder keepAliveTimeout(@Nullable Duration keepAliveTimeout) {
			this.keepAliveTimeout = keepAliveTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownGracePeriod(@Nullable Duration shutdownGracePeriod) {
			this.shutdownGracePeriod = shutdownGracePeriod;
			return this;
		}

		@NonNull
		public Builder drainPollInterval(@Nullable Duration drainPollInterval) {
			this.drainPollInterval = drainPollInterval;
			return this;
		}

		@NonNull
		public Builder forceCloseTimeout(@Nullable Duration forceCloseTimeout) {
			this.forceCloseTimeout = forceCloseTimeout;
			return this;
		}

		@NonNull
		public Builder socketSelectTimeout(@Nullable Duration socketSelectTimeout) {
			this.socketSelectTimeout = socketSelectTimeout;
			return this;
		}

		@NonNull
		public Builder concurrency(@Nullable Integer concurrency) {
			this.concurrency = concurrency;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public ServerConfig build() {
			return new ServerConfig(this);
		}
	}
}
