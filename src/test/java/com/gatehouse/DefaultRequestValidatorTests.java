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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DefaultRequestValidatorTests {
	private static final RequestValidator VALIDATOR = RequestValidator.defaultInstance();
	private static final Map<String, List<String>> HOST_ONLY = Map.of("host", List.of("localhost:3000"));

	@Test
	public void admitsWhitelistedMethodsOnCleanUrls() {
		for (HttpMethod httpMethod : HttpMethod.values()) {
			ValidationVerdict verdict = VALIDATOR.validate(httpMethod.name(), "/hello?name=world", HOST_ONLY);
			Assertions.assertTrue(verdict.isAdmitted(), "Expected admission for " + httpMethod);
			Assertions.assertTrue(verdict.getStatusCode().isEmpty());
		}
	}

	@Test
	public void rejectsMethodsOutsideWhitelistWith405AndAllowHeader() {
		for (String method : List.of("TRACE", "CONNECT", "PROPFIND", "get", "")) {
			ValidationVerdict verdict = VALIDATOR.validate(method, "/hello", HOST_ONLY);
			Assertions.assertFalse(verdict.isAdmitted(), "Expected rejection for '" + method + "'");
			Assertions.assertEquals(405, verdict.getStatusCode().orElseThrow());
			Assertions.assertEquals(RequestRejectionReason.METHOD_NOT_ALLOWED, verdict.getRejectionReason().orElseThrow());
			Assertions.assertEquals("GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS", verdict.getAllowHeaderValue().orElseThrow());
		}
	}

	@Test
	public void rejectsPathTraversalSignaturesCaseInsensitively() {
		List<String> rawUrls = List.of(
				"/a/../b",
				"/../../etc/passwd",
				"/static/..\\windows",
				"/%2e%2e%2fetc/passwd",
				"/%2E%2E%2Fetc/passwd",
				"/%252e%252e%252fsecret",
				"/files/..;/admin",
				"/%u002e%u002e%u002fboot.ini",
				"/x?next=../../private"
		);

		for (String rawUrl : rawUrls) {
			ValidationVerdict verdict = VALIDATOR.validate("GET", rawUrl, HOST_ONLY);
			Assertions.assertFalse(verdict.isAdmitted(), "Expected rejection for " + rawUrl);
			Assertions.assertEquals(400, verdict.getStatusCode().orElseThrow());
			Assertions.assertEquals(RequestRejectionReason.URL_PATH_TRAVERSAL, verdict.getRejectionReason().orElseThrow());
		}
	}

	@Test
	public void traversalFilterIsSubstringBasedAndOverRejectsBenignContent() {
		// A query value that merely mentions a relative path is still refused
		ValidationVerdict verdict = VALIDATOR.validate("GET", "/docs?example=see%20../readme", HOST_ONLY);
		Assertions.assertFalse(verdict.isAdmitted());

		// Dots without a separator are fine
		Assertions.assertTrue(VALIDATOR.validate("GET", "/archive/v1..v2", HOST_ONLY).isAdmitted());
	}

	@Test
	public void rejectsMissingAndOverlongUrls() {
		ValidationVerdict missing = VALIDATOR.validate("GET", "", HOST_ONLY);
		Assertions.assertEquals(400, missing.getStatusCode().orElseThrow());
		Assertions.assertEquals(RequestRejectionReason.URL_MISSING, missing.getRejectionReason().orElseThrow());

		Assertions.assertEquals(RequestRejectionReason.URL_MISSING,
				VALIDATOR.validate("GET", null, HOST_ONLY).getRejectionReason().orElseThrow());

		String atLimit = "/" + "a".repeat(DefaultRequestValidator.MAXIMUM_URL_LENGTH - 1);
		Assertions.assertTrue(VALIDATOR.validate("GET", atLimit, HOST_ONLY).isAdmitted());

		ValidationVerdict overlong = VALIDATOR.validate("GET", atLimit + "a", HOST_ONLY);
		Assertions.assertEquals(400, overlong.getStatusCode().orElseThrow());
		Assertions.assertEquals(RequestRejectionReason.URL_TOO_LONG, overlong.getRejectionReason().orElseThrow());
	}

	@Test
	public void rejectsOversizedHeaders() {
		Map<String, List<String>> headers = new LinkedHashMap<>(HOST_ONLY);
		headers.put("x-padding", List.of("p".repeat(DefaultRequestValidator.MAXIMUM_SERIALIZED_HEADERS_LENGTH)));

		ValidationVerdict verdict = VALIDATOR.validate("GET", "/hello", headers);
		Assertions.assertEquals(400, verdict.getStatusCode().orElseThrow());
		Assertions.assertEquals(RequestRejectionReason.HEADERS_TOO_LARGE, verdict.getRejectionReason().orElseThrow());
	}

	@Test
	public void rejectsScriptInjectionInHeaders() {
		List<String> payloads = List.of("<SCRIPT>alert(1)</script>", "javascript:alert(1)", "VBScript:msgbox", "<img onload=x>");

		for (String payload : payloads) {
			ValidationVerdict verdict = VALIDATOR.validate("GET", "/hello", Map.of("user-agent", List.of(payload)));
			Assertions.assertFalse(verdict.isAdmitted(), "Expected rejection for " + payload);
			Assertions.assertEquals(RequestRejectionReason.HEADERS_SUSPICIOUS_CONTENT, verdict.getRejectionReason().orElseThrow());
		}
	}

	@Test
	public void checksRunInMethodUrlHeaderOrder() {
		Map<String, List<String>> badHeaders = Map.of("referer", List.of("javascript:void(0)"));

		Assertions.assertEquals(RequestRejectionReason.METHOD_NOT_ALLOWED,
				VALIDATOR.validate("TRACE", "/../x", badHeaders).getRejectionReason().orElseThrow());
		Assertions.assertEquals(RequestRejectionReason.URL_PATH_TRAVERSAL,
				VALIDATOR.validate("GET", "/../x", badHeaders).getRejectionReason().orElseThrow());
		Assertions.assertEquals(RequestRejectionReason.HEADERS_SUSPICIOUS_CONTENT,
				VALIDATOR.validate("GET", "/x", badHeaders).getRejectionReason().orElseThrow());
	}

	@Test
	public void validatesParsedRequests() {
		Request request = Request.with("DELETE", "/hello").headers(HOST_ONLY).build();
		Assertions.assertTrue(VALIDATOR.validate(request).isAdmitted());
		Assertions.assertEquals(ValidationVerdict.admit(), VALIDATOR.validate(request));
	}
}
