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
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP request as parsed off the wire, prior to admission.
 * <p>
 * The method is kept in its raw form because admission decisions must be made on exactly what the client sent,
 * including methods outside {@link HttpMethod}.
 * <p>
 * Instances can be acquired via the {@link #with(String, String)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String method;
	@NonNull
	private final String rawUrl;
	@NonNull
	private final String path;
	@NonNull
	private final Map<String, List<String>> headers;
	@Nullable
	private final byte[] body;
	@Nullable
	private final InetSocketAddress remoteAddress;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param method the raw request method, e.g. {@code GET} or {@code TRACE}
	 * @param rawUrl the raw request-target, e.g. {@code /hello?name=x}
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String method,
														 @NonNull String rawUrl) {
		requireNonNull(method);
		requireNonNull(rawUrl);

		return new Builder(method, rawUrl);
	}

	protected Request(@NonNull Builder builder) {
		requireNonNull(builder);

		this.method = builder.method;
		this.rawUrl = builder.rawUrl;
		this.path = extractPath(builder.rawUrl);
		this.body = builder.body == null || builder.body.length == 0 ? null : builder.body;
		this.remoteAddress = builder.remoteAddress;

		Map<String, List<String>> headers = new LinkedHashMap<>();

		if (builder.headers != null)
			for (Map.Entry<String, List<String>> entry : builder.headers.entrySet())
				headers.put(entry.getKey(), List.copyOf(entry.getValue()));

		this.headers = Collections.unmodifiableMap(headers);
	}

	@NonNull
	private static String extractPath(@NonNull String rawUrl) {
		requireNonNull(rawUrl);

		int queryIndex = rawUrl.indexOf('?');
		int fragmentIndex = rawUrl.indexOf('#');
		int end = rawUrl.length();

		if (queryIndex >= 0)
			end = queryIndex;
		if (fragmentIndex >= 0 && fragmentIndex < end)
			end = fragmentIndex;

		return rawUrl.substring(0, end);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, rawUrl=%s, remoteAddress=%s}", getClass().getSimpleName(),
				getMethod(), getRawUrl(), getRemoteAddress().orElse(null));
	}

	/**
	 * The request method exactly as sent by the client.
	 *
	 * @return the raw method
	 */
	@NonNull
	public String getMethod() {
		return this.method;
	}

	/**
	 * The request method, if it is one Gatehouse admits.
	 *
	 * @return the method, or {@link Optional#empty()} if it is outside the whitelist
	 */
	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return HttpMethod.fromName(getMethod());
	}

	/**
	 * The request-target exactly as sent by the client, including any query string.
	 *
	 * @return the raw URL
	 */
	@NonNull
	public String getRawUrl() {
		return this.rawUrl;
	}

	/**
	 * The path component of the raw URL (query and fragment removed, no decoding performed).
	 *
	 * @return the path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * Request headers in arrival order, keyed by name as sent.
	 *
	 * @return the headers
	 */
	@NonNull
	public Map<String, List<String>> getHeaders() {
		return this.headers;
	}

	/**
	 * Case-insensitive header lookup.
	 *
	 * @param name the header name
	 * @return all values for the header, possibly empty
	 */
	@NonNull
	public List<String> getHeaderValues(@NonNull String name) {
		requireNonNull(name);

		List<String> values = new ArrayList<>();
		String lowercaseName = name.toLowerCase(Locale.ROOT);

		for (Map.Entry<String, List<String>> entry : getHeaders().entrySet())
			if (entry.getKey().toLowerCase(Locale.ROOT).equals(lowercaseName))
				values.addAll(entry.getValue());

		return values;
	}

	@NonNull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String method;
		@NonNull
		private final String rawUrl;
		@Nullable
		private Map<String, List<String>> headers;
		@Nullable
		private byte[] body;
		@Nullable
		private InetSocketAddress remoteAddress;

		protected Builder(@NonNull String method,
											@NonNull String rawUrl) {
			requireNonNull(method);
			requireNonNull(rawUrl);

			this.method = method;
			this.rawUrl = rawUrl;
		}

		@NonNull
		public Builder headers(@Nullable Map<String, List<String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}
}
