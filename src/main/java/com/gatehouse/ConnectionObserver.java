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

/**
 * Receives transport connection lifecycle events.
 * <p>
 * For any given connection, {@link #didOpenConnection(Connection)} happens-before {@link #didCloseConnection(Connection)}.
 * Close may be reported more than once for the same connection; implementations must tolerate that.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ConnectionObserver {
	/**
	 * Called after the transport accepts and registers a new connection.
	 *
	 * @param connection the newly-opened connection
	 */
	void didOpenConnection(@NonNull Connection connection);

	/**
	 * Called after the transport closes a connection, for any reason.
	 *
	 * @param connection the closed connection
	 */
	void didCloseConnection(@NonNull Connection connection);
}
