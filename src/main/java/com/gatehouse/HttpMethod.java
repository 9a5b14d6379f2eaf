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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Typesafe representation of the <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods">HTTP request methods</a> admitted by Gatehouse.
 * <p>
 * Declaration order is significant: it is the order in which methods are listed in {@code Allow} response headers.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum HttpMethod {
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/GET">{@code GET}</a> request method.
	 */
	GET,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/POST">{@code POST}</a> request method.
	 */
	POST,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/PUT">{@code PUT}</a> request method.
	 */
	PUT,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/DELETE">{@code DELETE}</a> request method.
	 */
	DELETE,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/PATCH">{@code PATCH}</a> request method.
	 */
	PATCH,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/HEAD">{@code HEAD}</a> request method.
	 */
	HEAD,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/OPTIONS">{@code OPTIONS}</a> request method.
	 */
	OPTIONS;

	@NonNull
	private static final List<HttpMethod> VALUES_AS_LIST;
	@NonNull
	private static final String ALLOW_HEADER_VALUE;

	static {
		VALUES_AS_LIST = List.of(HttpMethod.values());
		ALLOW_HEADER_VALUE = Arrays.stream(HttpMethod.values())
				.map(HttpMethod::name)
				.collect(Collectors.joining(", "));
	}

	/**
	 * Exposes {@link HttpMethod#values()} as an immutable {@link List} in declaration order.
	 *
	 * @return a {@link List} representation of this enum's values
	 */
	@NonNull
	public static List<HttpMethod> valuesAsList() {
		return VALUES_AS_LIST;
	}

	/**
	 * The whitelist of methods joined by {@code ", "}, suitable for use as an {@code Allow} header value.
	 *
	 * @return the {@code Allow} header value, e.g. {@code GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS}
	 */
	@NonNull
	public static String allowHeaderValue() {
		return ALLOW_HEADER_VALUE;
	}

	/**
	 * Case-sensitive lookup of an admitted method by its wire name.
	 * <p>
	 * HTTP method names are case-sensitive, so {@code get} does not match {@link #GET}.
	 *
	 * @param name the method name as it appeared on the request line
	 * @return the method, or {@link Optional#empty()} if it is not admitted
	 */
	@NonNull
	public static Optional<HttpMethod> fromName(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		for (HttpMethod httpMethod : VALUES_AS_LIST)
			if (httpMethod.name().equals(name))
				return Optional.of(httpMethod);

		return Optional.empty();
	}
}
