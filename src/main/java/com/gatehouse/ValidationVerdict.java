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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of {@link RequestValidator#validate(String, String, java.util.Map)}: either admit the request or reject it with a terminal status.
 * <p>
 * A verdict is never both. Rejections for {@link RequestRejectionReason#METHOD_NOT_ALLOWED} carry the value for the {@code Allow} response header.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ValidationVerdict {
	@NonNull
	private static final ValidationVerdict ADMIT;

	static {
		ADMIT = new ValidationVerdict(null, null, null, null);
	}

	@Nullable
	private final Integer statusCode;
	@Nullable
	private final RequestRejectionReason rejectionReason;
	@Nullable
	private final String reason;
	@Nullable
	private final String allowHeaderValue;

	/**
	 * The verdict that admits a request for routing.
	 *
	 * @return the shared admit verdict
	 */
	@NonNull
	public static ValidationVerdict admit() {
		return ADMIT;
	}

	/**
	 * A rejection with the given status and reason.
	 *
	 * @param statusCode      the terminal HTTP status to write
	 * @param rejectionReason the typed reason
	 * @param reason          a human-readable reason
	 * @return the rejection verdict
	 */
	@NonNull
	public static ValidationVerdict reject(@NonNull Integer statusCode,
																				 @NonNull RequestRejectionReason rejectionReason,
																				 @NonNull String reason) {
		requireNonNull(statusCode);
		requireNonNull(rejectionReason);
		requireNonNull(reason);

		return new ValidationVerdict(statusCode, rejectionReason, reason, null);
	}

	/**
	 * A {@code 405} rejection carrying the whitelist for the {@code Allow} header.
	 *
	 * @return the rejection verdict
	 */
	@NonNull
	public static ValidationVerdict rejectMethod() {
		return new ValidationVerdict(StatusCode.HTTP_405.getStatusCode(), RequestRejectionReason.METHOD_NOT_ALLOWED,
				"method not allowed", HttpMethod.allowHeaderValue());
	}

	private ValidationVerdict(@Nullable Integer statusCode,
														@Nullable RequestRejectionReason rejectionReason,
														@Nullable String reason,
														@Nullable String allowHeaderValue) {
		this.statusCode = statusCode;
		this.rejectionReason = rejectionReason;
		this.reason = reason;
		this.allowHeaderValue = allowHeaderValue;
	}

	@Override
	@NonNull
	public String toString() {
		if (isAdmitted())
			return format("%s{admit}", getClass().getSimpleName());

		return format("%s{reject, statusCode=%s, rejectionReason=%s, reason=%s}", getClass().getSimpleName(),
				this.statusCode, this.rejectionReason, this.reason);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ValidationVerdict validationVerdict))
			return false;

		return Objects.equals(this.statusCode, validationVerdict.statusCode)
				&& Objects.equals(this.rejectionReason, validationVerdict.rejectionReason)
				&& Objects.equals(this.reason, validationVerdict.reason)
				&& Objects.equals(this.allowHeaderValue, validationVerdict.allowHeaderValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.statusCode, this.rejectionReason, this.reason, this.allowHeaderValue);
	}

	@NonNull
	public Boolean isAdmitted() {
		return this.statusCode == null;
	}

	@NonNull
	public Optional<Integer> getStatusCode() {
		return Optional.ofNullable(this.statusCode);
	}

	@NonNull
	public Optional<RequestRejectionReason> getRejectionReason() {
		return Optional.ofNullable(this.rejectionReason);
	}

	@NonNull
	public Optional<String> getReason() {
		return Optional.ofNullable(this.reason);
	}

	/**
	 * Value for the {@code Allow} response header, present only for method rejections.
	 *
	 * @return the header value, or {@link Optional#empty()}
	 */
	@NonNull
	public Optional<String> getAllowHeaderValue() {
		return Optional.ofNullable(this.allowHeaderValue);
	}
}
