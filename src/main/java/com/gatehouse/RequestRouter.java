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

/**
 * Produces a {@link Response} for a request that has already been admitted by the {@link RequestValidator}.
 * <p>
 * Implementations must be threadsafe. Exceptions thrown here are answered with {@code 500 Internal Server Error}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface RequestRouter {
	/**
	 * Routes an admitted request.
	 *
	 * @param request the admitted request
	 * @return the response to write; security headers are added by the server
	 */
	@NonNull
	Response routeRequest(@NonNull Request request);

	/**
	 * Acquires the standard router: {@code /} and {@code /hello} greet, {@code /health} reports liveness.
	 *
	 * @return a threadsafe {@code RequestRouter}
	 */
	@NonNull
	static RequestRouter defaultInstance() {
		return DefaultRequestRouter.defaultInstance();
	}
}
