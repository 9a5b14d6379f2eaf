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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DefaultRequestRouterTests {
	private final DefaultRequestRouter requestRouter = new DefaultRequestRouter(
			Clock.fixed(Instant.parse("2026-03-01T12:00:00.123Z"), ZoneOffset.UTC), () -> 12_345L);

	@Test
	public void greetingPaths() {
		for (String rawUrl : new String[]{"/", "/hello", "/hello?name=test"}) {
			Response response = route("GET", rawUrl);

			Assertions.assertEquals(200, response.getStatusCode(), rawUrl);
			Assertions.assertEquals("text/plain; charset=UTF-8", response.getHeaders().get("Content-Type"));
			Assertions.assertEquals("Hello, World!\n", bodyAsString(response));
		}
	}

	@Test
	public void health() {
		Response response = route("GET", "/health");

		Assertions.assertEquals(200, response.getStatusCode());
		Assertions.assertEquals("application/json", response.getHeaders().get("Content-Type"));
		Assertions.assertEquals("{\"status\":\"healthy\",\"timestamp\":\"2026-03-01T12:00:00.123Z\",\"uptime\":12.345}\n",
				bodyAsString(response));
	}

	@Test
	public void headHasNoBodyButKeepsLength() {
		Response response = route("HEAD", "/hello");

		Assertions.assertEquals(200, response.getStatusCode());
		Assertions.assertTrue(response.getBody().isEmpty());
		Assertions.assertEquals(String.valueOf("Hello, World!\n".length()), response.getHeaders().get("Content-Length"));
		Assertions.assertEquals("text/plain; charset=UTF-8", response.getHeaders().get("Content-Type"));
	}

	@Test
	public void otherMethodsOnKnownPathsAreNotAllowed() {
		for (String method : new String[]{"POST", "PUT", "DELETE", "PATCH", "OPTIONS"}) {
			Response response = route(method, "/hello");

			Assertions.assertEquals(405, response.getStatusCode(), method);
			Assertions.assertEquals("GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS", response.getHeaders().get("Allow"));
			Assertions.assertEquals("Method Not Allowed\n", bodyAsString(response));
		}
	}

	@Test
	public void unknownPathsAreNotFound() {
		Response response = route("GET", "/nope");

		Assertions.assertEquals(404, response.getStatusCode());
		Assertions.assertEquals("Not Found\n", bodyAsString(response));

		// Unknown path wins over method
		Assertions.assertEquals(404, route("POST", "/nope").getStatusCode());
	}

	private Response route(String method, String rawUrl) {
		return this.requestRouter.routeRequest(Request.with(method, rawUrl).build());
	}

	private static String bodyAsString(Response response) {
		return new String(response.getBody().orElse(new byte[0]), StandardCharsets.UTF_8);
	}
}
