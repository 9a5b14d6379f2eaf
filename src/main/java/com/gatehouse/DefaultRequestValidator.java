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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link RequestValidator}.
 * <p>
 * Path-traversal and injection detection is substring-based on the raw, lowercased input. It is a heuristic, not a
 * canonicalization: it rejects some benign encoded paths and does not recognize encodings absent from the signature list.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultRequestValidator implements RequestValidator {
	@NonNull
	static final Integer MAXIMUM_URL_LENGTH;
	@NonNull
	static final Integer MAXIMUM_SERIALIZED_HEADERS_LENGTH;
	@NonNull
	static final List<String> PATH_TRAVERSAL_SIGNATURES;
	@NonNull
	static final List<String> SUSPICIOUS_HEADER_SIGNATURES;
	@NonNull
	private static final DefaultRequestValidator DEFAULT_INSTANCE;

	static {
		MAXIMUM_URL_LENGTH = 2_048;
		MAXIMUM_SERIALIZED_HEADERS_LENGTH = 8_192;

		// All lowercase; input is lowercased before matching
		PATH_TRAVERSAL_SIGNATURES = List.of(
				"../", "..\\",
				"%2e%2e%2f", "%2e%2e%5c",
				"%252e%252e%252f", "%252e%252e%255c",
				"..%2f", "..%5c",
				"%2e%2e/", "%2e%2e\\",
				"....//", "....\\\\",
				"..;/", "..;\\",
				"%u002e%u002e%u002f", "%u002e%u002e%u005c"
		);

		SUSPICIOUS_HEADER_SIGNATURES = List.of("<script", "javascript:", "vbscript:", "onload=");

		DEFAULT_INSTANCE = new DefaultRequestValidator();
	}

	@NonNull
	public static DefaultRequestValidator defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultRequestValidator() {
		// Only the shared instance
	}

	@NonNull
	@Override
	public ValidationVerdict validate(@Nullable String method,
																		@Nullable String rawUrl,
																		@Nullable Map<String, List<String>> headers) {
		if (HttpMethod.fromName(method).isEmpty())
			return ValidationVerdict.rejectMethod();

		ValidationVerdict urlVerdict = validateRawUrl(rawUrl);

		if (!urlVerdict.isAdmitted())
			return urlVerdict;

		return validateHeaders(headers);
	}

	@NonNull
	ValidationVerdict validateRawUrl(@Nullable String rawUrl) {
		if (rawUrl == null || rawUrl.isEmpty())
			return ValidationVerdict.reject(StatusCode.HTTP_400.getStatusCode(), RequestRejectionReason.URL_MISSING, "missing URL");

		if (rawUrl.length() > MAXIMUM_URL_LENGTH)
			return ValidationVerdict.reject(StatusCode.HTTP_400.getStatusCode(), RequestRejectionReason.URL_TOO_LONG,
					format("URL length %d exceeds maximum of %d", rawUrl.length(), MAXIMUM_URL_LENGTH));

		String lowercaseRawUrl = rawUrl.toLowerCase(Locale.ROOT);

		for (String signature : PATH_TRAVERSAL_SIGNATURES)
			if (lowercaseRawUrl.contains(signature))
				return ValidationVerdict.reject(StatusCode.HTTP_400.getStatusCode(), RequestRejectionReason.URL_PATH_TRAVERSAL,
						format("URL contains path traversal sequence '%s'", signature));

		return ValidationVerdict.admit();
	}

	@NonNull
	ValidationVerdict validateHeaders(@Nullable Map<String, List<String>> headers) {
		String serializedHeaders = serializeHeaders(headers == null ? Map.of() : headers);

		if (serializedHeaders.length() > MAXIMUM_SERIALIZED_HEADERS_LENGTH)
			return ValidationVerdict.reject(StatusCode.HTTP_400.getStatusCode(), RequestRejectionReason.HEADERS_TOO_LARGE,
					format("Serialized headers length %d exceeds maximum of %d", serializedHeaders.length(), MAXIMUM_SERIALIZED_HEADERS_LENGTH));

		String lowercaseSerializedHeaders = serializedHeaders.toLowerCase(Locale.ROOT);

		for (String signature : SUSPICIOUS_HEADER_SIGNATURES)
			if (lowercaseSerializedHeaders.contains(signature))
				return ValidationVerdict.reject(StatusCode.HTTP_400.getStatusCode(), RequestRejectionReason.HEADERS_SUSPICIOUS_CONTENT,
						format("Headers contain suspicious sequence '%s'", signature));

		return ValidationVerdict.admit();
	}

	/**
	 * Serializes headers as a JSON object of lowercased names to comma-joined values, e.g. {@code {"host":"localhost:3000"}}.
	 * Duplicate names (differing only by case) are merged in arrival order.
	 */
	@NonNull
	static String serializeHeaders(@NonNull Map<String, List<String>> headers) {
		requireNonNull(headers);

		Map<String, String> normalizedHeaders = new LinkedHashMap<>();

		for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
			if (entry.getKey() == null)
				continue;

			String name = entry.getKey().toLowerCase(Locale.ROOT);
			String value = entry.getValue() == null ? "" : String.join(", ", entry.getValue());
			normalizedHeaders.merge(name, value, (existing, additional) -> existing + ", " + additional);
		}

		StringBuilder stringBuilder = new StringBuilder(64 * (normalizedHeaders.size() + 1));
		stringBuilder.append('{');

		boolean first = true;

		for (Map.Entry<String, String> entry : normalizedHeaders.entrySet()) {
			if (!first)
				stringBuilder.append(',');

			appendJsonString(stringBuilder, entry.getKey());
			stringBuilder.append(':');
			appendJsonString(stringBuilder, entry.getValue());
			first = false;
		}

		return stringBuilder.append('}').toString();
	}

	private static void appendJsonString(@NonNull StringBuilder stringBuilder,
																			 @NonNull String value) {
		stringBuilder.append('"');

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			switch (c) {
				case '"' -> stringBuilder.append("\\\"");
				case '\\' -> stringBuilder.append("\\\\");
				case '\b' -> stringBuilder.append("\\b");
				case '\f' -> stringBuilder.append("\\f");
				case '\n' -> stringBuilder.append("\\n");
				case '\r' -> stringBuilder.append("\\r");
				case '\t' -> stringBuilder.append("\\t");
				default -> {
					if (c < 0x20)
						stringBuilder.append(format("\\u%04x", (int) c));
					else
						stringBuilder.append(c);
				}
			}
		}

		stringBuilder.append('"');
	}
}
