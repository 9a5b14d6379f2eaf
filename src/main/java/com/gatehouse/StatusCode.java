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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Enumeration of the HTTP status codes Gatehouse produces.
 * <p>
 * See <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status">https://developer.mozilla.org/en-US/docs/Web/HTTP/Status</a> for details.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum StatusCode {
	/**
	 * The request was admitted and handled.
	 */
	HTTP_200(200, "OK"),
	/**
	 * The request URL or headers were rejected, or the request could not be parsed.
	 */
	HTTP_400(400, "Bad Request"),
	/**
	 * No route matched the request path.
	 */
	HTTP_404(404, "Not Found"),
	/**
	 * The request method is not in the admitted whitelist, or the route does not support it.
	 */
	HTTP_405(405, "Method Not Allowed"),
	/**
	 * The request did not complete within the per-request timeout.
	 */
	HTTP_408(408, "Request Timeout"),
	/**
	 * An unexpected error occurred while handling the request.
	 */
	HTTP_500(500, "Internal Server Error");

	@NonNull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Gets the {@link StatusCode} corresponding to the given numeric status.
	 *
	 * @param statusCode the numeric status, e.g. {@code 404}
	 * @return the enum value, or {@link Optional#empty()} if Gatehouse does not produce this status
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * Reason phrase for the given numeric status, falling back to {@code Unknown}.
	 *
	 * @param statusCode the numeric status
	 * @return the reason phrase
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return fromStatusCode(statusCode).map(StatusCode::getReasonPhrase).orElse("Unknown");
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	/**
	 * The HTTP status code that corresponds to this enum value.
	 *
	 * @return the HTTP status code
	 */
	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * An English-language description for this HTTP status code.
	 *
	 * @return the reason phrase
	 */
	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
