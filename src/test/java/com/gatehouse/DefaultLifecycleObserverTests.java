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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class DefaultLifecycleObserverTests {
	private Logger logger;
	private Level originalLevel;
	private ListAppender<ILoggingEvent> listAppender;

	@BeforeEach
	public void attachAppender() {
		this.logger = (Logger) LoggerFactory.getLogger("com.gatehouse.Gatehouse");
		this.originalLevel = this.logger.getLevel();
		this.logger.setLevel(Level.DEBUG);

		this.listAppender = new ListAppender<>();
		this.listAppender.start();
		this.logger.addAppender(this.listAppender);
	}

	@AfterEach
	public void detachAppender() {
		this.logger.detachAppender(this.listAppender);
		this.logger.setLevel(this.originalLevel);
	}

	@Test
	public void levelsFollowSeverity() {
		Assertions.assertEquals(org.slf4j.event.Level.INFO, DefaultLifecycleObserver.levelFor(LogEventType.SERVER_STARTED));
		Assertions.assertEquals(org.slf4j.event.Level.DEBUG, DefaultLifecycleObserver.levelFor(LogEventType.SERVER_REQUEST_REJECTED));
		Assertions.assertEquals(org.slf4j.event.Level.WARN, DefaultLifecycleObserver.levelFor(LogEventType.SHUTDOWN_FORCING));
		Assertions.assertEquals(org.slf4j.event.Level.ERROR, DefaultLifecycleObserver.levelFor(LogEventType.SERVER_BIND_FAILED));
		Assertions.assertEquals(org.slf4j.event.Level.ERROR, DefaultLifecycleObserver.levelFor(LogEventType.UNCAUGHT_EXCEPTION));
	}

	@Test
	public void logEventsCarryTypeFieldsAndCause() {
		IllegalStateException cause = new IllegalStateException("boom");

		DefaultLifecycleObserver.defaultInstance().didReceiveLogEvent(
				LogEvent.with(LogEventType.SERVER_BIND_FAILED, "Unable to start server - port 3000 is already in use.")
						.throwable(cause)
						.field("port", 3000)
						.field("ignored", null)
						.build());

		Assertions.assertEquals(1, this.listAppender.list.size());

		ILoggingEvent loggingEvent = this.listAppender.list.get(0);

		Assertions.assertEquals(Level.ERROR, loggingEvent.getLevel());
		Assertions.assertEquals("Unable to start server - port 3000 is already in use.", loggingEvent.getFormattedMessage());
		Assertions.assertEquals("boom", loggingEvent.getThrowableProxy().getMessage());

		Map<String, Object> keyValues = loggingEvent.getKeyValuePairs().stream()
				.collect(Collectors.toMap(keyValuePair -> keyValuePair.key, keyValuePair -> keyValuePair.value));

		Assertions.assertEquals("SERVER_BIND_FAILED", keyValues.get("logEventType"));
		Assertions.assertEquals(3000, keyValues.get("port"));
		Assertions.assertFalse(keyValues.containsKey("ignored"));
	}
}
