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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
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
public class ConnectionRegistryTests {
	@Test
	public void addAndRemoveTrackSize() {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		Assertions.assertTrue(connectionRegistry.isEmpty());

		connectionRegistry.add(new FakeConnection(1L, connectionRegistry));
		connectionRegistry.add(new FakeConnection(2L, connectionRegistry));
		Assertions.assertEquals(2, connectionRegistry.size());

		Assertions.assertTrue(connectionRegistry.remove(1L));
		Assertions.assertEquals(1, connectionRegistry.size());

		// Late or duplicate close events are harmless
		Assertions.assertFalse(connectionRegistry.remove(1L));
		Assertions.assertFalse(connectionRegistry.remove(99L));
		Assertions.assertEquals(1, connectionRegistry.size());
	}

	@Test
	public void doubleAddIsRefused() {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		connectionRegistry.add(new FakeConnection(7L, connectionRegistry));

		Assertions.assertThrows(IllegalStateException.class,
				() -> connectionRegistry.add(new FakeConnection(7L, connectionRegistry)));
		Assertions.assertEquals(1, connectionRegistry.size());
	}

	@Test
	public void forEachIteratesASnapshotThatToleratesRemoval() {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		List<FakeConnection> connections = new ArrayList<>();

		for (long id = 1; id <= 5; ++id) {
			FakeConnection connection = new FakeConnection(id, connectionRegistry);
			connections.add(connection);
			connectionRegistry.didOpenConnection(connection);
		}

		AtomicInteger visited = new AtomicInteger();

		connectionRegistry.forEach(connection -> {
			visited.incrementAndGet();
			connection.closeForcibly();
		});

		Assertions.assertEquals(5, visited.get());
		Assertions.assertTrue(connectionRegistry.isEmpty());
		Assertions.assertTrue(connections.stream().allMatch(FakeConnection::isClosed));
	}

	@Test
	@Timeout(5)
	public void awaitEmptyWakesWhenLastConnectionIsRemoved() throws Exception {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		FakeConnection connection = new FakeConnection(1L, connectionRegistry).busy();
		connectionRegistry.add(connection);

		Thread closer = new Thread(() -> {
			try {
				Thread.sleep(150);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			connection.finish();
		});

		long start = System.nanoTime();
		closer.start();

		// Poll interval is long, so returning quickly means the removal signalled the waiter
		Boolean emptied = connectionRegistry.awaitEmpty(Duration.ofSeconds(3), Instant.now().plusSeconds(4));
		long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

		closer.join();

		Assertions.assertTrue(emptied);
		Assertions.assertTrue(elapsedMillis < 2_000, "Took " + elapsedMillis + "ms");
	}

	@Test
	public void awaitEmptyReturnsFalseAtDeadline() throws Exception {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		connectionRegistry.add(new FakeConnection(1L, connectionRegistry));

		Assertions.assertFalse(connectionRegistry.awaitEmpty(Duration.ofMillis(20), Instant.now().plusMillis(100)));
		Assertions.assertTrue(new ConnectionRegistry().awaitEmpty(Duration.ofMillis(20), Instant.now()));
	}

	@Test
	public void purgeDropsEverything() {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		connectionRegistry.add(new FakeConnection(1L, connectionRegistry));
		connectionRegistry.add(new FakeConnection(2L, connectionRegistry));

		Assertions.assertEquals(2, connectionRegistry.purge().size());
		Assertions.assertTrue(connectionRegistry.isEmpty());
		Assertions.assertTrue(connectionRegistry.purge().isEmpty());
	}

	@Test
	@Timeout(20)
	public void interleavedAddAndRemoveNeverLoseCount() throws Exception {
		ConnectionRegistry connectionRegistry = new ConnectionRegistry();
		int threads = 8;
		int perThread = 500;
		ExecutorService executorService = Executors.newFixedThreadPool(threads);
		CountDownLatch go = new CountDownLatch(1);
		List<Future<?>> futures = new ArrayList<>();

		try {
			for (int t = 0; t < threads; ++t) {
				long base = (long) t * perThread;

				futures.add(executorService.submit(() -> {
					go.await();

					for (long i = 0; i < perThread; ++i) {
						long id = base + i;
						connectionRegistry.add(new FakeConnection(id, connectionRegistry));

						// Keep every other connection
						if (i % 2 == 1)
							connectionRegistry.remove(id);

						Assertions.assertTrue(connectionRegistry.size() >= 0);
					}

					return null;
				}));
			}

			go.countDown();

			for (Future<?> future : futures)
				future.get(10, TimeUnit.SECONDS);

			Assertions.assertEquals(threads * perThread / 2, connectionRegistry.size());
		} finally {
			executorService.shutdownNow();
		}
	}
}
