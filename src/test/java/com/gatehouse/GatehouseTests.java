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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class GatehouseTests {
	@Test
	public void bindFailureExitsWithFailureStatus() throws Exception {
		try (ServerSocket blocker = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
			Gatehouse gatehouse = gatehouse(ServerConfig.withPort(blocker.getLocalPort()).build());

			Assertions.assertEquals(Gatehouse.EXIT_STATUS_FAILURE, gatehouse.run());
			Assertions.assertEquals(ServerState.STOPPED, gatehouse.getServer().getState());
		}
	}

	@Test
	public void uncaughtExceptionTriggersGracefulShutdown() throws Exception {
		Gatehouse gatehouse = gatehouse(ServerConfig.withPort(0).build());

		Assertions.assertTrue(gatehouse.start());

		gatehouse.handleUncaughtException(Thread.currentThread(), new IllegalStateException("Simulated failure"));

		Assertions.assertEquals(ShutdownOutcome.GRACEFUL, gatehouse.awaitShutdown());
		Assertions.assertEquals(ServerState.STOPPED, gatehouse.getServer().getState());
	}

	@Test
	public void repeatedTriggersShareOneCycle() throws Exception {
		Gatehouse gatehouse = gatehouse(ServerConfig.withPort(0).build());

		Assertions.assertTrue(gatehouse.start());

		CompletableFuture<ShutdownOutcome> first = gatehouse.triggerShutdown(ShutdownTrigger.JVM_SHUTDOWN);
		CompletableFuture<ShutdownOutcome> second = gatehouse.triggerShutdown(ShutdownTrigger.UNCAUGHT_EXCEPTION);

		Assertions.assertSame(first, second);
		Assertions.assertEquals(ShutdownOutcome.GRACEFUL, first.get(5, TimeUnit.SECONDS));
	}

	@Test
	public void jvmShutdownRecordsSignalReason() throws Exception {
		List<String> reasons = new CopyOnWriteArrayList<>();
		LifecycleObserver lifecycleObserver = new TestSupport.QuietLifecycleObserver() {
			@Override
			public void didStartShutdown(@NonNull ShutdownPlan shutdownPlan) {
				reasons.add(shutdownPlan.getReason());
			}
		};
		Server server = Server.withConfig(ServerConfig.withPort(0).build())
				.lifecycleObserver(lifecycleObserver)
				.build();
		Gatehouse gatehouse = new Gatehouse(server, lifecycleObserver);

		Assertions.assertTrue(gatehouse.start());

		// The shutdown hook's trigger, without its halt
		Assertions.assertEquals(ShutdownOutcome.GRACEFUL, gatehouse.triggerShutdown(ShutdownTrigger.JVM_SHUTDOWN).get(5, TimeUnit.SECONDS));

		Assertions.assertEquals(ServerState.STOPPED, server.getState());
		Assertions.assertEquals(List.of("SIGINT/SIGTERM"), reasons);
	}

	@Test
	public void runBlocksUntilShutdownThenExitsCleanly() throws Exception {
		Thread.UncaughtExceptionHandler originalHandler = Thread.getDefaultUncaughtExceptionHandler();
		Gatehouse gatehouse = gatehouse(ServerConfig.withPort(0).build());
		CompletableFuture<Integer> exitStatus = CompletableFuture.supplyAsync(gatehouse::run);

		try {
			Assertions.assertTrue(TestSupport.awaitCondition(() -> gatehouse.getServer().isStarted(), Duration.ofSeconds(5)));
			Assertions.assertFalse(exitStatus.isDone());

			gatehouse.triggerShutdown(ShutdownTrigger.JVM_SHUTDOWN);

			Assertions.assertEquals(Gatehouse.EXIT_STATUS_SUCCESS, exitStatus.get(5, TimeUnit.SECONDS));
			Assertions.assertEquals(ServerState.STOPPED, gatehouse.getServer().getState());
		} finally {
			Thread.setDefaultUncaughtExceptionHandler(originalHandler);
			gatehouse.getServer().stop();
		}
	}

	private static Gatehouse gatehouse(ServerConfig serverConfig) {
		LifecycleObserver lifecycleObserver = new TestSupport.QuietLifecycleObserver();
		Server server = Server.withConfig(serverConfig)
				.lifecycleObserver(lifecycleObserver)
				.build();

		return new Gatehouse(server, lifecycleObserver);
	}
}
