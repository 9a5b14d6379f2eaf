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
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ServerStateMachineTests {
	@Test
	public void startsStoppedAndWalksTheFullCycle() {
		ServerStateMachine serverStateMachine = new ServerStateMachine();
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
		Assertions.assertFalse(serverStateMachine.isAcceptingConnections());

		Assertions.assertTrue(serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.STARTING));
		Assertions.assertFalse(serverStateMachine.isAcceptingConnections());
		Assertions.assertTrue(serverStateMachine.tryTransition(ServerState.STARTING, ServerState.RUNNING));
		Assertions.assertTrue(serverStateMachine.isAcceptingConnections());
		Assertions.assertTrue(serverStateMachine.tryTransition(ServerState.RUNNING, ServerState.STOPPING));
		Assertions.assertFalse(serverStateMachine.isAcceptingConnections());
		Assertions.assertTrue(serverStateMachine.tryTransition(ServerState.STOPPING, ServerState.STOPPED));

		// A second cycle is allowed
		Assertions.assertTrue(serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.STARTING));
	}

	@Test
	public void illegalTransitionsThrowWithoutMutatingState() {
		ServerStateMachine serverStateMachine = new ServerStateMachine();

		IllegalStateTransitionException exception = Assertions.assertThrows(IllegalStateTransitionException.class,
				() -> serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.RUNNING));
		Assertions.assertNotNull(exception.getMessage());
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());

		serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.STARTING);
		serverStateMachine.tryTransition(ServerState.STARTING, ServerState.RUNNING);

		Assertions.assertThrows(IllegalStateTransitionException.class,
				() -> serverStateMachine.tryTransition(ServerState.RUNNING, ServerState.STARTING));
		Assertions.assertThrows(IllegalStateTransitionException.class,
				() -> serverStateMachine.tryTransition(ServerState.RUNNING, ServerState.STOPPED));
		Assertions.assertEquals(ServerState.RUNNING, serverStateMachine.getCurrentState());
	}

	@Test
	public void legalTransitionFromWrongCurrentStateReturnsFalse() {
		ServerStateMachine serverStateMachine = new ServerStateMachine();

		Assertions.assertFalse(serverStateMachine.tryTransition(ServerState.RUNNING, ServerState.STOPPING));
		Assertions.assertEquals(ServerState.STOPPED, serverStateMachine.getCurrentState());
	}

	@Test
	public void transitionTableMatchesTheLifecycle() {
		for (ServerState from : ServerState.values()) {
			for (ServerState to : ServerState.values()) {
				boolean expected = (from == ServerState.STOPPED && to == ServerState.STARTING)
						|| (from == ServerState.STARTING && to == ServerState.RUNNING)
						|| (from == ServerState.RUNNING && to == ServerState.STOPPING)
						|| (from == ServerState.STOPPING && to == ServerState.STOPPED);

				Assertions.assertEquals(expected, ServerStateMachine.isLegalTransition(from, to), from + " -> " + to);
			}
		}
	}

	@Test
	@Timeout(10)
	public void exactlyOneConcurrentStopWins() throws Exception {
		ServerStateMachine serverStateMachine = new ServerStateMachine();
		serverStateMachine.tryTransition(ServerState.STOPPED, ServerState.STARTING);
		serverStateMachine.tryTransition(ServerState.STARTING, ServerState.RUNNING);

		int threads = 16;
		ExecutorService executorService = Executors.newFixedThreadPool(threads);
		CountDownLatch go = new CountDownLatch(1);
		List<Future<Boolean>> futures = new ArrayList<>();

		try {
			for (int i = 0; i < threads; i++)
				futures.add(executorService.submit(() -> {
					go.await();
					return serverStateMachine.tryTransition(ServerState.RUNNING, ServerState.STOPPING);
				}));

			go.countDown();

			int winners = 0;

			for (Future<Boolean> future : futures)
				if (future.get(5, TimeUnit.SECONDS))
					++winners;

			Assertions.assertEquals(1, winners);
			Assertions.assertEquals(ServerState.STOPPING, serverStateMachine.getCurrentState());
		} finally {
			executorService.shutdownNow();
		}
	}
}
