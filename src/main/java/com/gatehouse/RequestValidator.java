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

import java.util.List;
import java.util.Map;

/**
 * Decides whether an inbound request is well-formed and safe to dispatch to the {@link RequestRouter}.
 * <p>
 * Implementations must be pure: no side effects, no I/O, and the same inputs always produce the same verdict.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface RequestValidator {
	/**
	 * Validates the request method, raw URL and headers, in that order, short-circuiting on the first failure.
	 *
	 * @param method  the raw request method
	 * @param rawUrl  the raw request-target
	 * @param headers the request headers, keyed by name as sent
	 * @return the verdict
	 */
	@NonNull
	ValidationVerdict validate(@Nullable String method,
														 @Nullable String rawUrl,
														 @Nullable Map<String, List<String>> headers);

	/**
	 * Convenience overload for an already-parsed {@link Request}.
	 *
	 * @param request the request to validate
	 * @return the verdict
	 */
	@NonNull
	default ValidationVerdict validate(@NonNull Request request) {
		return validate(request.getMethod(), request.getRawUrl(), request.getHeaders());
	}

	/**
	 * Acquires a threadsafe {@link RequestValidator} with the standard method whitelist, URL and header rules.
	 *
	 * @return the default validator
	 */
	@NonNull
	static RequestValidator defaultInstance() {
		return DefaultRequestValidator.defaultInstance();
	}
}
