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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Routes {@link LogEvent}s and lifecycle milestones to SLF4J.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultLifecycleObserver implements LifecycleObserver {
	@NonNull
	private static final DefaultLifecycleObserver DEFAULT_INSTANCE;
	@NonNull
	private static final Map<LogEventType, Level> LEVELS_BY_LOG_EVENT_TYPE;

	static {
		Map<LogEventType, Level> levelsByLogEventType = new EnumMap<>(LogEventType.class);
		levelsByLogEventType.put(LogEventType.CONFIGURATION_PRIVILEGED_PORT, Level.WARN);
		levelsByLogEventType.put(LogEventType.SERVER_STARTED, Level.INFO);
		levelsByLogEventType.put(LogEventType.SERVER_BIND_FAILED, Level.ERROR);
		levelsByLogEventType.put(LogEventType.SERVER_UNPARSEABLE_REQUEST, Level.DEBUG);
		levelsByLogEventType.put(LogEventType.SERVER_REQUEST_REJECTED, Level.DEBUG);
		levelsByLogEventType.put(LogEventType.SERVER_REQUEST_TIMED_OUT, Level.WARN);
		levelsByLogEventType.put(LogEventType.SERVER_TRANSPORT_ERROR, Level.WARN);
		levelsByLogEventType.put(LogEventType.SERVER_INTERNAL_ERROR, Level.ERROR);
		levelsByLogEventType.put(LogEventType.SHUTDOWN_STARTED, Level.INFO);
		levelsByLogEventType.put(LogEventType.SHUTDOWN_ALREADY_IN_PROGRESS, Level.DEBUG);
		levelsByLogEventType.put(LogEventType.SHUTDOWN_DRAINING, Level.INFO);
		levelsByLogEventType.put(LogEventType.SHUTDOWN_FORCING, Level.WARN);
		levelsByLogEventType.put(LogEventType.SHUTDOWN_FORCE_CLOSE_FAILED, Level.WARN);
		levelsByLogEventType.put(LogEventType.SHUTDOWN_COMPLETED, Level.INFO);
		levelsByLogEventType.put(LogEventType.UNCAUGHT_EXCEPTION, Level.ERROR);
		levelsByLogEventType.put(LogEventType.LIFECYCLE_OBSERVER_FAILED, Level.ERROR);

		LEVELS_BY_LOG_EVENT_TYPE = Collections.unmodifiableMap(levelsByLogEventType);
		DEFAULT_INSTANCE = new DefaultLifecycleObserver();
	}

	@NonNull
	private final Logger logger;

	@NonNull
	public static DefaultLifecycleObserver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultLifecycleObserver() {
		this.logger = LoggerFactory.getLogger("com.gatehouse.Gatehouse");
	}

	@NonNull
	static Level levelFor(@NonNull LogEventType logEventType) {
		requireNonNull(logEventType);
		return LEVELS_BY_LOG_EVENT_TYPE.getOrDefault(logEventType, Level.INFO);
	}

	@Override
	public void didStopServer(@NonNull Server server) {
		getLogger().info("Server stopped.");
	}

	@Override
	public void didFinishShutdown(@NonNull ShutdownPlan shutdownPlan,
																@NonNull ShutdownOutcome shutdownOutcome,
																@NonNull Duration duration) {
		getLogger().debug("Shutdown ({}) finished with outcome {} in {} ms", shutdownPlan.getReason(), shutdownOutcome, duration.toMillis());
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		LoggingEventBuilder loggingEventBuilder = getLogger().atLevel(levelFor(logEvent.getLogEventType()))
				.addKeyValue("logEventType", logEvent.getLogEventType().name());

		for (Map.Entry<String, Object> field : logEvent.getFields().entrySet())
			loggingEventBuilder = loggingEventBuilder.addKeyValue(field.getKey(), field.getValue());

		Connection connection = logEvent.getConnection().orElse(null);

		if (connection != null)
			loggingEventBuilder = loggingEventBuilder.addKeyValue("connectionId", connection.getId());

		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable != null)
			loggingEventBuilder = loggingEventBuilder.setCause(throwable);

		loggingEventBuilder.log(logEvent.getMessage());
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
