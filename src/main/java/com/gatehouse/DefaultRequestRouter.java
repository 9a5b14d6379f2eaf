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
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fixed routing table.
 * <ul>
 *   <li>{@code GET /} and {@code GET /hello}: {@code 200 "Hello, World!\n"}</li>
 *   <li>{@code GET /health}: {@code 200} JSON liveness report</li>
 *   <li>{@code HEAD} on any of the above: same status and headers, no body</li>
 *   <li>any other method on a known path: {@code 405} with {@code Allow} listing every admitted method</li>
 *   <li>anything else: {@code 404 "Not Found\n"}</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultRequestRouter implements RequestRouter {
	@NonNull
	static final String HELLO_WORLD_BODY;
	@NonNull
	static final String NOT_FOUND_BODY;
	@NonNull
	static final String METHOD_NOT_ALLOWED_BODY;
	@NonNull
	private static final Set<String> GREETING_PATHS;
	@NonNull
	private static final String HEALTH_PATH;
	@NonNull
	private static final DefaultRequestRouter DEFAULT_INSTANCE;

	static {
		HELLO_WORLD_BODY = "Hello, World!\n";
		NOT_FOUND_BODY = "Not Found\n";
		METHOD_NOT_ALLOWED_BODY = "Method Not Allowed\n";
		GREETING_PATHS = Set.of("/", "", "/hello");
		HEALTH_PATH = "/health";
		DEFAULT_INSTANCE = new DefaultRequestRouter(Clock.systemUTC(), () -> ManagementFactory.getRuntimeMXBean().getUptime());
	}

	@NonNull
	private final Clock clock;
	@NonNull
	private final Supplier<Long> uptimeInMillisSupplier;

	@NonNull
	public static DefaultRequestRouter defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	DefaultRequestRouter(@NonNull Clock clock,
											 @NonNull Supplier<Long> uptimeInMillisSupplier) {
		requireNonNull(clock);
		requireNonNull(uptimeInMillisSupplier);

		this.clock = clock;
		this.uptimeInMillisSupplier = uptimeInMillisSupplier;
	}

	@NonNull
	@Override
	public Response routeRequest(@NonNull Request request) {
		requireNonNull(request);

		String path = request.getPath();
		boolean greetingPath = GREETING_PATHS.contains(path);
		boolean healthPath = HEALTH_PATH.equals(path);

		if (!greetingPath && !healthPath)
			return Response.plainText(StatusCode.HTTP_404.getStatusCode(), NOT_FOUND_BODY);

		HttpMethod httpMethod = request.getHttpMethod().orElse(null);

		if (httpMethod != HttpMethod.GET && httpMethod != HttpMethod.HEAD)
			return Response.withStatusCode(StatusCode.HTTP_405.getStatusCode())
					.header("Content-Type", "text/plain; charset=UTF-8")
					.header("Allow", HttpMethod.allowHeaderValue())
					.body(METHOD_NOT_ALLOWED_BODY.getBytes(StandardCharsets.UTF_8))
					.build();

		Response response = greetingPath
				? Response.plainText(StatusCode.HTTP_200.getStatusCode(), HELLO_WORLD_BODY)
				: healthResponse();

		return httpMethod == HttpMethod.HEAD ? withoutBody(response) : response;
	}

	@NonNull
	private Response healthResponse() {
		Instant now = getClock().instant().truncatedTo(ChronoUnit.MILLIS);
		double uptimeInSeconds = getUptimeInMillisSupplier().get() / 1_000D;

		String json = format(Locale.ROOT, "{\"status\":\"healthy\",\"timestamp\":\"%s\",\"uptime\":%.3f}\n",
				DateTimeFormatter.ISO_INSTANT.format(now), uptimeInSeconds);

		return Response.withStatusCode(StatusCode.HTTP_200.getStatusCode())
				.header("Content-Type", "application/json")
				.body(json.getBytes(StandardCharsets.UTF_8))
				.build();
	}

	/**
	 * HEAD responses keep GET's headers (including the GET body's {@code Content-Length}) but carry no body.
	 */
	@NonNull
	private Response withoutBody(@NonNull Response response) {
		requireNonNull(response);

		Response.Builder builder = Response.withStatusCode(response.getStatusCode());
		response.getHeaders().forEach(builder::header);
		builder.header("Content-Length", String.valueOf(response.getBody().map(body -> body.length).orElse(0)));

		return builder.build();
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Supplier<Long> getUptimeInMillisSupplier() {
		return this.uptimeInMillisSupplier;
	}
}
