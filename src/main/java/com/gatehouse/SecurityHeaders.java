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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed security headers attached to every response Gatehouse writes, regardless of outcome.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SecurityHeaders {
	@NonNull
	private static final Map<String, String> HEADERS;

	static {
		Map<String, String> headers = new LinkedHashMap<>(6);
		headers.put("X-Content-Type-Options", "nosniff");
		headers.put("X-Frame-Options", "DENY");
		headers.put("X-XSS-Protection", "1; mode=block");
		headers.put("Strict-Transport-Security", "max-age=31536000; includeSubDomains");
		headers.put("Content-Security-Policy", "default-src 'none'");
		headers.put("Referrer-Policy", "no-referrer");

		HEADERS = Collections.unmodifiableMap(headers);
	}

	private SecurityHeaders() {
		// Non-instantiable
	}

	/**
	 * The security headers in a stable order.
	 *
	 * @return an immutable name-to-value map
	 */
	@NonNull
	public static Map<String, String> asMap() {
		return HEADERS;
	}
}
