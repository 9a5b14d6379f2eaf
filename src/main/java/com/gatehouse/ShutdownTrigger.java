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

import static java.util.Objects.requireNonNull;

/**
 * Process-level events which start a shutdown cycle. Each carries the reason string recorded in the
 * {@link ShutdownPlan}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @see Gatehouse
 */
public enum ShutdownTrigger {
	/**
	 * When the JVM is shutting down: {@code SIGTERM}, CTRL-C ({@code SIGINT}), {@code System.exit}, and others.
	 * <p>
	 * A shutdown hook cannot learn which signal started it, so {@code SIGINT} and {@code SIGTERM} share the reason
	 * {@code SIGINT/SIGTERM}.
	 */
	JVM_SHUTDOWN("SIGINT/SIGTERM"),
	/**
	 * When an exception escapes any thread.
	 */
	UNCAUGHT_EXCEPTION("UNCAUGHT_EXCEPTION");

	@NonNull
	private final String reason;

	ShutdownTrigger(@NonNull String reason) {
		requireNonNull(reason);
		this.reason = reason;
	}

	/**
	 * @return the shutdown reason this trigger records
	 */
	@NonNull
	public String getReason() {
		return this.reason;
	}
}
