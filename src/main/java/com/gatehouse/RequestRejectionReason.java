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

/**
 * Reasons an HTTP request was rejected before it reached the {@link RequestRouter}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum RequestRejectionReason {
	/**
	 * The request method is not in the {@link HttpMethod} whitelist.
	 */
	METHOD_NOT_ALLOWED,
	/**
	 * The raw URL was missing or empty.
	 */
	URL_MISSING,
	/**
	 * The raw URL exceeded the maximum permitted length.
	 */
	URL_TOO_LONG,
	/**
	 * The raw URL contained a path-traversal signature.
	 */
	URL_PATH_TRAVERSAL,
	/**
	 * The serialized request headers exceeded the maximum permitted size.
	 */
	HEADERS_TOO_LARGE,
	/**
	 * The serialized request headers contained a markup or script injection signature.
	 */
	HEADERS_SUSPICIOUS_CONTENT
}
