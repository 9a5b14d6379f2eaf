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
 * How a call to {@link ShutdownCoordinator#shutdown(String)} concluded.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ShutdownOutcome {
	/**
	 * Every connection closed on its own before the grace period elapsed.
	 */
	GRACEFUL,
	/**
	 * The grace period elapsed and the remaining connections were forcibly closed.
	 */
	FORCED,
	/**
	 * The server was not running, so there was nothing to shut down.
	 */
	NOT_RUNNING
}
