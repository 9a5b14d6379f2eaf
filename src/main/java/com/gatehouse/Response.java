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
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A finalized HTTP response, suitable for sending to clients over the wire.
 * <p>
 * Security headers are not part of this type: the server attaches {@link SecurityHeaders} to every response it writes.
 * <p>
 * Instances can be acquired via the {@link #withStatusCode(Integer)} builder factory method or the {@link #plainText(Integer, String)} convenience.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Response {
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Map<String, String> headers;
	@Nullable
	private final byte[] body;

	/**
	 * Acquires a builder for {@link Response} instances.
	 *
	 * @param statusCode the HTTP status code for this response
	 * @return the builder
	 */
	@NonNull
	public static Builder withStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	/**
	 * A {@code text/plain; charset=UTF-8} response with the given body.
	 *
	 * @param statusCode the HTTP status code
	 * @param body       the body text
	 * @return the response
	 */
	@NonNull
	public static Response plainText(@NonNull Integer statusCode,
																	 @NonNull String body) {
		requireNonNull(statusCode);
		requireNonNull(body);

		return withStatusCode(statusCode)
				.header("Content-Type", "text/plain; charset=UTF-8")
				.body(body.getBytes(StandardCharsets.UTF_8))
				.build();
	}

	protected Response(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.body = builder.body;

		for (Map.Entry<String, String> entry : this.headers.entrySet())
			validateHeaderNameAndValue(entry.getKey(), entry.getValue());
	}

	private static void validateHeaderNameAndValue(@NonNull String name,
																								 @NonNull String value) {
		if (name.isEmpty())
			throw new IllegalArgumentException("Header name cannot be empty");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c <= 0x20 || c >= 0x7F || c == ':')
				throw new IllegalArgumentException(format("Illegal header name '%s'", name));
		}

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c == '\r' || c == '\n')
				throw new IllegalArgumentException(format("Illegal value for header '%s'", name));
		}
	}

	@Override
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), format("%d bytes", getBody().isPresent() ? getBody().get().length : 0));
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public Map<String, String> getHeaders() {
		return this.headers;
	}

	@NonNull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * Builder used to construct instances of {@link Response} via {@link Response#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Integer statusCode;
		@NonNull
		private final Map<String, String> headers;
		@Nullable
		private byte[] body;

		protected Builder(@NonNull Integer statusCode) {
			requireNonNull(statusCode);

			this.statusCode = statusCode;
			this.headers = new LinkedHashMap<>();
		}

		@NonNull
		public Builder header(@NonNull String name,
													@NonNull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.put(name, value);
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Response build() {
			return new Response(this);
		}
	}
}
