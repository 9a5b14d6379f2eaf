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

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Optional;

/**
 * One open transport-layer link between a client and the server.
 * <p>
 * Instances are created by the transport when it accepts a socket, handed to a {@link ConnectionObserver}, and owned
 * by the {@link ConnectionRegistry} until the transport reports closure.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Connection {
	/**
	 * Opaque identity of this connection, unique per server instance.
	 *
	 * @return the identifier
	 */
	@NonNull
	Long getId();

	/**
	 * Best-effort remote address of the client.
	 *
	 * @return the address, or {@link Optional#empty()} if unavailable
	 */
	@NonNull
	Optional<InetSocketAddress> getRemoteAddress();

	/**
	 * When the transport accepted this connection.
	 *
	 * @return the open timestamp
	 */
	@NonNull
	Instant getOpenedAt();

	/**
	 * Is this connection idle: no request bytes pending, no request being handled, no response being written?
	 *
	 * @return {@code true} if idle
	 */
	@NonNull
	Boolean isIdle();

	/**
	 * Asks the connection to close once it has no in-flight request.
	 * <p>
	 * Idle connections close promptly; busy connections finish their current response and then close.
	 */
	void closeGracefully();

	/**
	 * Severs the connection immediately, discarding any in-flight work.
	 */
	void closeForcibly();
}
