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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a {@link ServerStateMachine} transition outside the legal table is attempted.
 * <p>
 * No state is mutated when this is thrown.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class IllegalStateTransitionException extends IllegalStateException {
	@NonNull
	private final ServerState fromState;
	@NonNull
	private final ServerState toState;

	public IllegalStateTransitionException(@NonNull ServerState fromState,
																				 @NonNull ServerState toState) {
		super(format("Illegal server state transition %s -> %s", requireNonNull(fromState).name(), requireNonNull(toState).name()));

		this.fromState = fromState;
		this.toState = toState;
	}

	@NonNull
	public ServerState getFromState() {
		return this.fromState;
	}

	@NonNull
	public ServerState getToState() {
		return this.toState;
	}
}
