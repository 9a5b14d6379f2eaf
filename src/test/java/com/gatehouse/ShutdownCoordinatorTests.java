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

import com.gatehouse.TestSupport.FakeConnection;
import com.gatehouse.TestSupport.QuietLifecycleObserver;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ShutdownCoordinatorTests {
	@Test
	@Timeout(10)
	public void shutdownWhenNotRunningIsANoOp() throws Exception {
		ServerStateMachine serverStateMachine = new ServerStateMachine();
		AtomicInteger stopAcceptingCalls = new AtomicInteger();

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, new ConnectionRegistry())
				.stopAccepting(stopAcceptingCalls::incrementAndGet)
				.lifecycleObserver(new QuietLifecycleObserver())
				.build();

		Assertions.assertEquals(ShutdownOutcome.NOT_RUNNING, shutdownCoordinator.shutdown("SIGINT").get(1, TimeUnit.SECONDS));
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
		Assertions.assertEquals(0, stopAcceptingCalls.get());
	}

	@Test
	@Timeout(10)
	public void idleConnectionsDrainWellBeforeGracePeriod() throws Exception {
		ServerStateMachine serverStateMachine = runningStateMachine();
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		List<FakeConnection> connections = new ArrayList<>();

		for (long id = 1; id <= 3; ++id) {
			FakeConnection connection = new FakeConnection(id, connectionRegistry);
			connections.add(connection);
			connectionRegistry.add(connection);
		}

		AtomicInteger stopAcceptingCalls = new AtomicInteger();
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, connectionRegistry)
				.stopAccepting(stopAcceptingCalls::incrementAndGet)
				.gracePeriod(Duration.ofSeconds(5))
				.drainPollInterval(Duration.ofMillis(100))
				.lifecycleObserver(lifecycleObserver)
				.build();

		long start = System.nanoTime();
		ShutdownOutcome shutdownOutcome = shutdownCoordinator.shutdown("SIGTERM").get(5, TimeUnit.SECONDS);
		long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		Assertions.assertEquals(ShutdownOutcome.GRACEFUL, shutdownOutcome);
		Assertions.assertTrue(elapsedMillis < 2_000, "Took " + elapsedMillis + "ms");
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
		Assertions.assertTrue(connectionRegistry.isEmpty());
		Assertions.assertEquals(1, stopAcceptingCalls.get());
		Assertions.assertTrue(connections.stream().allMatch(FakeConnection::isClosed));
		Assertions.assertTrue(connections.stream().noneMatch(FakeConnection::wasClosedForcibly));

		Assertions.assertEquals(List.of("didStartShutdown:SIGTERM", "didFinishShutdown:GRACEFUL"), lifecycleObserver.getNotifications());
		Assertions.assertTrue(lifecycleObserver.getLogEventTypes().contains(LogEventType.SHUTDOWN_STARTED));
		Assertions.assertTrue(lifecycleObserver.getLogEventTypes().contains(LogEventType.SHUTDOWN_COMPLETED));
		Assertions.assertFalse(lifecycleObserver.getLogEventTypes().contains(LogEventType.SHUTDOWN_FORCING));
	}

	@Test
	@Timeout(10)
	public void busyConnectionFinishingWithinGracePeriodCompletesGracefully() throws Exception {
		ServerStateMachine serverStateMachine = runningStateMachine();
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		FakeConnection busy = new FakeConnection(1L, connectionRegistry).busy();
		connectionRegistry.add(busy);

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, connectionRegistry)
				.gracePeriod(Duration.ofSeconds(5))
				.drainPollInterval(Duration.ofSeconds(1))
				.lifecycleObserver(new QuietLifecycleObserver())
				.build();

		CompletableFuture<ShutdownOutcome> shutdownFuture = shutdownCoordinator.shutdown("SIGTERM");

		Thread.sleep(300);
		Assertions.assertFalse(shutdownFuture.isDone());
		Assertions.assertEquals(ServerState.STOPPING, serverStateMachine.getCurrentState());
		Assertions.assertFalse(busy.isClosed(), "Busy connections are not closed while draining");

		long start = System.nanoTime();
		busy.finish();

		Assertions.assertEquals(ShutdownOutcome.GRACEFUL, shutdownFuture.get(5, TimeUnit.SECONDS));
		long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		// Drain is signalled by the removal, not discovered by the next poll
		Assertions.assertTrue(elapsedMillis < 900, "Took " + elapsedMillis + "ms");
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
	}

	@Test
	@Timeout(10)
	public void stuckConnectionsAreForceClosedAtTheGraceDeadline() throws Exception {
		ServerStateMachine serverStateMachine = runningStateMachine();
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		FakeConnection busy = new FakeConnection(1L, connectionRegistry).busy();
		FakeConnection stubborn = new FakeConnection(2L, connectionRegistry).ignoringGracefulClose();
		connectionRegistry.add(busy);
		connectionRegistry.add(stubborn);

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, connectionRegistry)
				.gracePeriod(Duration.ofMillis(600))
				.forceCloseTimeout(Duration.ofMillis(500))
				.drainPollInterval(Duration.ofMillis(100))
				.lifecycleObserver(lifecycleObserver)
				.build();

		long start = System.nanoTime();
		ShutdownOutcome shutdownOutcome = shutdownCoordinator.shutdown("SIGINT").get(5, TimeUnit.SECONDS);
		long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		Assertions.assertEquals(ShutdownOutcome.FORCED, shutdownOutcome);
		Assertions.assertTrue(elapsedMillis >= 550, "Took " + elapsedMillis + "ms");
		Assertions.assertTrue(elapsedMillis < 3_000, "Took " + elapsedMillis + "ms");
		Assertions.assertTrue(busy.wasClosedForcibly());
		Assertions.assertTrue(stubborn.wasClosedForcibly());
		Assertions.assertTrue(connectionRegistry.isEmpty());
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
		Assertions.assertTrue(lifecycleObserver.getLogEventTypes().contains(LogEventType.SHUTDOWN_FORCING));
		Assertions.assertEquals(List.of("didStartShutdown:SIGINT", "didFinishShutdown:FORCED"), lifecycleObserver.getNotifications());
	}

	@Test
	@Timeout(10)
	public void forceCloseFailuresAreLoggedAndDoNotBlockCompletion() throws Exception {
		ServerStateMachine serverStateMachine = runningStateMachine();
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		FakeConnection broken = new FakeConnection(1L, connectionRegistry).busy().failingForcibleClose();
		connectionRegistry.add(broken);

		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, connectionRegistry)
				.gracePeriod(Duration.ofMillis(200))
				.forceCloseTimeout(Duration.ofMillis(200))
				.drainPollInterval(Duration.ofMillis(50))
				.lifecycleObserver(lifecycleObserver)
				.build();

		Assertions.assertEquals(ShutdownOutcome.FORCED, shutdownCoordinator.shutdown("SIGTERM").get(5, TimeUnit.SECONDS));
		Assertions.assertTrue(connectionRegistry.isEmpty());
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
		Assertions.assertTrue(lifecycleObserver.getLogEventTypes().contains(LogEventType.SHUTDOWN_FORCE_CLOSE_FAILED));
	}

	@Test
	@Timeout(10)
	public void concurrentShutdownRequestsShareOneDrainCycle() throws Exception {
		ServerStateMachine serverStateMachine = runningStateMachine();
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		FakeConnection busy = new FakeConnection(1L, connectionRegistry).busy();
		connectionRegistry.add(busy);

		AtomicInteger stopAcceptingCalls = new AtomicInteger();
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, connectionRegistry)
				.stopAccepting(stopAcceptingCalls::incrementAndGet)
				.gracePeriod(Duration.ofSeconds(5))
				.drainPollInterval(Duration.ofMillis(50))
				.lifecycleObserver(lifecycleObserver)
				.build();

		int threads = 8;
		ExecutorService executorService = Executors.newFixedThreadPool(threads);
		CountDownLatch go = new CountDownLatch(1);
		List<Future<CompletableFuture<ShutdownOutcome>>> futures = new ArrayList<>();

		try {
			for (int i = 0; i < threads; ++i) {
				String reason = i % 2 == 0 ? "SIGINT" : "SIGTERM";
				futures.add(executorService.submit(() -> {
					go.await();
					return shutdownCoordinator.shutdown(reason);
				}));
			}

			go.countDown();

			List<CompletableFuture<ShutdownOutcome>> shutdownFutures = new ArrayList<>();

			for (Future<CompletableFuture<ShutdownOutcome>> future : futures)
				shutdownFutures.add(future.get(5, TimeUnit.SECONDS));

			CompletableFuture<ShutdownOutcome> first = shutdownFutures.get(0);

			for (CompletableFuture<ShutdownOutcome> shutdownFuture : shutdownFutures)
				Assertions.assertSame(first, shutdownFuture);

			Assertions.assertEquals(first, shutdownCoordinator.getPendingShutdown().orElseThrow());

			busy.finish();

			Assertions.assertEquals(ShutdownOutcome.GRACEFUL, first.get(5, TimeUnit.SECONDS));
			Assertions.assertEquals(1, stopAcceptingCalls.get());
			Assertions.assertEquals(2, lifecycleObserver.getNotifications().size());
			Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
			Assertions.assertTrue(shutdownCoordinator.getPendingShutdown().isEmpty());

			// Once stopped, further requests are no-ops
			Assertions.assertEquals(ShutdownOutcome.NOT_RUNNING, shutdownCoordinator.shutdown("SIGINT").get(1, TimeUnit.SECONDS));
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	@Timeout(10)
	public void stopAcceptingFailureDoesNotAbortShutdown() throws Exception {
		ServerStateMachine serverStateMachine = runningStateMachine();

		ShutdownCoordinator shutdownCoordinator = ShutdownCoordinator.withStateMachine(serverStateMachine, new ConnectionRegistry())
				.stopAccepting(() -> {
					throw new IllegalStateException("listener already gone");
				})
				.drainPollInterval(Duration.ofMillis(50))
				.lifecycleObserver(new QuietLifecycleObserver())
				.build();

		Assertions.assertEquals(ShutdownOutcome.GRACEFUL, shutdownCoordinator.shutdown("SIGTERM").get(5, TimeUnit.SECONDS));
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
	}

	@Test
	public void shutdownPlanDeadlinesDeriveFromStart() {
		ShutdownPlan shutdownPlan = ShutdownPlan.withReason("SIGTERM")
				.gracePeriod(Duration.ofSeconds(10))
				.forceCloseTimeout(Duration.ofSeconds(1))
				.build();

		Assertions.assertEquals(shutdownPlan.getStartedAt().plusSeconds(10), shutdownPlan.getGraceDeadline());
		Assertions.assertEquals(shutdownPlan.getStartedAt().plusSeconds(11), shutdownPlan.getForceDeadline());
		Assertions.assertEquals("SIGTERM", shutdownPlan.getReason());
	}

	@NonNull
	private static ServerStateMachine runningStateMachine() {
		ServerStateMachine serverStateMachine = new ServerStateMachine();
		serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.STARTING);
		serverStateMachine.tryTransition(ServerState.STARTING, ServerState.RUNNING);
		return serverStateMachine;
	}

	@ThreadSafe
	private static class RecordingLifecycleObserver implements LifecycleObserver {
		private final List<String> notifications = Collections.synchronizedList(new ArrayList<>());
		private final List<LogEventType> logEventTypes = Collections.synchronizedList(new ArrayList<>());

		@Override
		public void didStartShutdown(@NonNull ShutdownPlan shutdownPlan) {
			notifications.add("didStartShutdown:" + shutdownPlan.getReason());
		}

		@Override
		public void didFinishShutdown(@NonNull ShutdownPlan shutdownPlan,
																	@NonNull ShutdownOutcome shutdownOutcome,
																	@NonNull Duration duration) {
			notifications.add("didFinishShutdown:" + shutdownOutcome.name());
		}

		@Override
		public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
			logEventTypes.add(logEvent.getLogEventType());
		}

		List<String> getNotifications() {
			synchronized (notifications) {
				return List.copyOf(notifications);
			}
		}

		List<LogEventType> getLogEventTypes() {
			synchronized (logEventTypes) {
				return List.copyOf(logEventTypes);
			}
		}
	}
}
