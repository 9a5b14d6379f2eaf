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
 * Lifecycle phase of a {@link Server}.
 * <p>
 * Legal transitions are {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}; see {@link ServerStateMachine}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ServerState {
	/**
	 * Not listening. Terminal for a start/stop cycle; the connection registry is empty.
	 */
	STOPPED,
	/**
	 * The listener is being bound but is not yet confirmed accepting; no connections are possible.
	 */
	STARTING,
	/**
	 * The listener is accepting connections and all admission logic is live.
	 */
	RUNNING,
	/**
	 * The listener no longer accepts connections; in-flight connections may still be draining.
	 */
	STOPPING
}
