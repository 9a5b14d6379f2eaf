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
import java.time.Duration;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerConfigTests {
	@Test
	public void defaultsMatchDocumentedValues() {
		ServerConfig serverConfig = ServerConfig.withPort(3000).build();

		Assertions.assertEquals("127.0.0.1", serverConfig.getHost());
		Assertions.assertEquals(3000, serverConfig.getPort());
		Assertions.assertEquals(Duration.ofSeconds(30), serverConfig.getRequestTimeout());
		Assertions.assertEquals(Duration.ofSeconds(10), serverConfig.getHeadersTimeout());
		Assertions.assertEquals(Duration.ofSeconds(5), serverConfig.getKeepAliveTimeout());
		Assertions.assertEquals(Duration.ofSeconds(10), serverConfig.getShutdownGracePeriod());
		Assertions.assertEquals(Duration.ofSeconds(1), serverConfig.getDrainPollInterval());
		Assertions.assertEquals(Duration.ofSeconds(1), serverConfig.getForceCloseTimeout());
		Assertions.assertEquals(1_024 * 1_024, serverConfig.getMaximumRequestSizeInBytes());
		Assertions.assertEquals(1_024 * 64, serverConfig.getRequestReadBufferSizeInBytes());
		Assertions.assertTrue(serverConfig.getConcurrency() >= 1);
		Assertions.assertFalse(serverConfig.requiresElevatedPrivileges());
	}

	@Test
	public void onlyLoopbackHostsArePermitted() {
		Assertions.assertEquals("localhost", ServerConfig.withPort(3000).host("localhost").build().getHost());
		Assertions.assertEquals("127.0.0.1", ServerConfig.withPort(3000).host(" 127.0.0.1 ").build().getHost());

		for (String host : List.of("0.0.0.0", "192.168.1.10", "::", "example.com", ""))
			Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).host(host).build(), host);
	}

	@Test
	public void portRangeIsEnforced() {
		Assertions.assertEquals(1, ServerConfig.withPort(1).build().getPort());
		Assertions.assertEquals(65_535, ServerConfig.withPort(65_535).build().getPort());
		Assertions.assertEquals(0, ServerConfig.withPort(0).build().getPort());

		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(-1).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(65_536).build());
	}

	@Test
	public void privilegedPortsAreAcceptedButFlagged() {
		Assertions.assertTrue(ServerConfig.withPort(80).build().requiresElevatedPrivileges());
		Assertions.assertTrue(ServerConfig.withPort(1_023).build().requiresElevatedPrivileges());
		Assertions.assertFalse(ServerConfig.withPort(1_024).build().requiresElevatedPrivileges());
		Assertions.assertFalse(ServerConfig.withPort(0).build().requiresElevatedPrivileges());
	}

	@Test
	public void nonPositiveDurationsAndSizesAreRejected() {
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).requestTimeout(Duration.ZERO).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).headersTimeout(Duration.ZERO).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).keepAliveTimeout(Duration.ofMillis(-1)).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).drainPollInterval(Duration.ZERO).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).shutdownGracePeriod(Duration.ofSeconds(-1)).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).forceCloseTimeout(Duration.ofSeconds(-1)).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).concurrency(0).build());
		Assertions.assertThrows(ConfigurationException.class, () -> ServerConfig.withPort(3000).maximumRequestSizeInBytes(0).build());

		// A zero grace period means "force immediately"
		Assertions.assertEquals(Duration.ZERO, ServerConfig.withPort(3000).shutdownGracePeriod(Duration.ZERO).build().getShutdownGracePeriod());
	}

	@Test
	public void copyProducesAnEqualConfiguration() {
		ServerConfig serverConfig = ServerConfig.withPort(8080)
				.host("localhost")
				.requestTimeout(Duration.ofSeconds(3))
				.headersTimeout(Duration.ofSeconds(2))
				.shutdownGracePeriod(Duration.ofSeconds(2))
				.concurrency(3)
				.build();

		ServerConfig copy = serverConfig.copy().build();
		Assertions.assertEquals(serverConfig, copy);
		Assertions.assertEquals(serverConfig.hashCode(), copy.hashCode());
		Assertions.assertNotEquals(serverConfig, serverConfig.copy().port(8081).build());
		Assertions.assertNotEquals(serverConfig, serverConfig.copy().headersTimeout(Duration.ofSeconds(4)).build());
	}
}
