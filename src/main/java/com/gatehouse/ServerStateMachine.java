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
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Tracks the {@link ServerState} of a single server instance and guards which transitions are legal.
 * <p>
 * Reads and writes are atomic: a connection handler asking "are we still accepting?" can never observe a torn state
 * relative to the shutdown task flipping {@code RUNNING -> STOPPING}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerStateMachine {
	@NonNull
	private static final Map<ServerState, ServerState> LEGAL_TRANSITIONS;

	static {
		Map<ServerState, ServerState> legalTransitions = new EnumMap<>(ServerState.class);
		legalTransitions.put(ServerState.STOPPED, ServerState.STARTING);
		legalTransitions.put(ServerState.STARTING, ServerState.RUNNING);
		legalTransitions.put(ServerState.RUNNING, ServerState.STOPPING);
		legalTransitions.put(ServerState.STOPPING, ServerState.STOPPED);

		LEGAL_TRANSITIONS = Collections.unmodifiableMap(legalTransitions);
	}

	@NonNull
	private final AtomicReference<ServerState> currentState;

	public ServerStateMachine() {
		this.currentState = new AtomicReference<>(ServerState.STOPPED);
	}

	/**
	 * Is {@code fromState -> toState} in the legal transition table?
	 *
	 * @param fromState the state being left
	 * @param toState   the state being entered
	 * @return {@code true} if the transition is legal
	 */
	@NonNull
	public static Boolean isLegalTransition(@NonNull ServerState fromState,
																					@NonNull ServerState toState) {
		requireNonNull(fromState);
		requireNonNull(toState);

		return LEGAL_TRANSITIONS.get(fromState) == toState;
	}

	/**
	 * Atomically moves from {@code fromState} to {@code toState} if the machine is currently in {@code fromState}.
	 *
	 * @param fromState the expected current state
	 * @param toState   the state to enter
	 * @return {@code true} if the transition happened, {@code false} if the current state was not {@code fromState}
	 * @throws IllegalStateTransitionException if the transition is not in the legal table; no state is mutated
	 */
	@NonNull
	public Boolean tryTransition(@NonNull ServerState fromState,
															 @NonNull ServerState toState) {
		requireNonNull(fromState);
		requireNonNull(toState);

		if (!isLegalTransition(fromState, toState))
			throw new IllegalStateTransitionException(fromState, toState);

		return this.currentState.compareAndSet(fromState, toState);
	}

	@NonNull
	public ServerState getCurrentState() {
		return this.currentState.get();
	}

	/**
	 * Should new connections and requests be admitted?
	 *
	 * @return {@code true} only while {@link ServerState#RUNNING}
	 */
	@NonNull
	public Boolean isAcceptingConnections() {
		return getCurrentState() == ServerState.RUNNING;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{currentState=%s}", getClass().getSimpleName(), getCurrentState());
	}
}
