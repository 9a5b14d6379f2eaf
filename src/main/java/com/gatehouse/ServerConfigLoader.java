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

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Loads {@link ServerConfig} from a classpath properties file and then applies environment overrides.
 * <p>
 * Recognized properties are {@code gatehouse.host}, {@code gatehouse.port}, {@code gatehouse.request-timeout},
 * {@code gatehouse.headers-timeout}, {@code gatehouse.keep-alive-timeout}, {@code gatehouse.shutdown-grace-period},
 * {@code gatehouse.drain-poll-interval}, {@code gatehouse.force-close-timeout}, {@code gatehouse.concurrency},
 * {@code gatehouse.maximum-request-size} and {@code gatehouse.request-read-buffer-size}. Durations are ISO-8601 ({@code PT30S}) or a plain number of milliseconds.
 * <p>
 * Environment variables {@code HOST}, {@code PORT} and {@code SERVER_TIMEOUT} (milliseconds) take precedence.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerConfigLoader {
	@NonNull
	public static final String DEFAULT_RESOURCE_NAME;
	@NonNull
	public static final Integer DEFAULT_PORT;

	static {
		DEFAULT_RESOURCE_NAME = "gatehouse.properties";
		DEFAULT_PORT = 3_000;
	}

	private ServerConfigLoader() {
		// Non-instantiable
	}

	/**
	 * Loads configuration from {@code gatehouse.properties} on the classpath, if present, overridden by the process environment.
	 *
	 * @return the validated configuration
	 * @throws ConfigurationException if any value is invalid
	 */
	@NonNull
	public static ServerConfig load() {
		return load(DEFAULT_RESOURCE_NAME, System.getenv());
	}

	/**
	 * Loads configuration from the named classpath resource, if present, overridden by {@code environment}.
	 *
	 * @param resourceName classpath resource to read
	 * @param environment  environment variables to apply
	 * @return the validated configuration
	 * @throws ConfigurationException if the resource cannot be read or any value is invalid
	 */
	@NonNull
	public static ServerConfig load(@NonNull String resourceName,
																	@NonNull Map<String, String> environment) {
		requireNonNull(resourceName);
		requireNonNull(environment);

		Properties properties = new Properties();
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

		if (classLoader == null)
			classLoader = ServerConfigLoader.class.getClassLoader();

		try (InputStream inputStream = classLoader.getResourceAsStream(resourceName)) {
			if (inputStream != null)
				try (Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
					properties.load(reader);
				}
		} catch (IOException e) {
			throw new ConfigurationException(format("Unable to read configuration resource '%s'", resourceName), e);
		}

		return fromProperties(properties, environment);
	}

	@NonNull
	static ServerConfig fromProperties(@NonNull Properties properties,
																		 @NonNull Map<String, String> environment) {
		requireNonNull(properties);
		requireNonNull(environment);

		Integer port = parseInteger("gatehouse.port", properties.getProperty("gatehouse.port"));
		String host = trimToNull(properties.getProperty("gatehouse.host"));
		Duration requestTimeout = parseDuration("gatehouse.request-timeout", properties.getProperty("gatehouse.request-timeout"));

		String environmentPort = trimToNull(environment.get("PORT"));
		String environmentHost = trimToNull(environment.get("HOST"));
		String environmentServerTimeout = trimToNull(environment.get("SERVER_TIMEOUT"));

		if (environmentPort != null)
			port = parseInteger("PORT", environmentPort);

		if (environmentHost != null)
			host = environmentHost.toLowerCase(Locale.ROOT);

		if (environmentServerTimeout != null)
			requestTimeout = parseDuration("SERVER_TIMEOUT", environmentServerTimeout);

		return ServerConfig.withPort(port == null ? DEFAULT_PORT : port)
				.host(host)
				.requestTimeout(requestTimeout)
				.headersTimeout(parseDuration("gatehouse.headers-timeout", properties.getProperty("gatehouse.headers-timeout")))
				.keepAliveTimeout(parseDuration("gatehouse.keep-alive-timeout", properties.getProperty("gatehouse.keep-alive-timeout")))
				.shutdownGracePeriod(parseDuration("gatehouse.shutdown-grace-period", properties.getProperty("gatehouse.shutdown-grace-period")))
				.drainPollInterval(parseDuration("gatehouse.drain-poll-interval", properties.getProperty("gatehouse.drain-poll-interval")))
				.forceCloseTimeout(parseDuration("gatehouse.force-close-timeout", properties.getProperty("gatehouse.force-close-timeout")))
				.concurrency(parseInteger("gatehouse.concurrency", properties.getProperty("gatehouse.concurrency")))
				.maximumRequestSizeInBytes(parseInteger("gatehouse.maximum-request-size", properties.getProperty("gatehouse.maximum-request-size")))
				.requestReadBufferSizeInBytes(parseInteger("gatehouse.request-read-buffer-size", properties.getProperty("gatehouse.request-read-buffer-size")))
				.build();
	}

	@Nullable
	static Integer parseInteger(@NonNull String name,
															@Nullable String value) {
		requireNonNull(name);

		value = trimToNull(value);

		if (value == null)
			return null;

		try {
			return Integer.valueOf(value);
		} catch (NumberFormatException e) {
			throw new ConfigurationException(format("Invalid value '%s' for %s: expected an integer", value, name), e);
		}
	}

	@Nullable
	static Duration parseDuration(@NonNull String name,
																@Nullable String value) {
		requireNonNull(name);

		value = trimToNull(value);

		if (value == null)
			return null;

		if (value.chars().allMatch(Character::isDigit)) {
			try {
				return Duration.ofMillis(Long.parseLong(value));
			} catch (NumberFormatException e) {
				throw new ConfigurationException(format("Invalid value '%s' for %s: too large", value, name), e);
			}
		}

		try {
			return Duration.parse(value);
		} catch (DateTimeParseException e) {
			throw new ConfigurationException(format("Invalid value '%s' for %s: expected milliseconds or an ISO-8601 duration such as PT30S", value, name), e);
		}
	}

	@Nullable
	private static String trimToNull(@Nullable String value) {
		if (value == null)
			return null;

		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}
}
