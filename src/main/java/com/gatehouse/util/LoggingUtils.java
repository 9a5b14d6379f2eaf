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

package com.gatehouse.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.ILoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.LogManager.getLogManager;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Utility methods for common logging functions.
 * <p>
 * Gatehouse logs through SLF4J; these methods let a deployment point Logback at an external configuration file
 * and route JDK-internal {@code java.util.logging} output to the same place.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LoggingUtils {
  @NonNull
  private static final Object LOCK;

  static {
    LOCK = new Object();
  }

  public enum LogbackOption {
    DEBUGGING_ENABLED
  }

  private LoggingUtils() {}

  /**
   * Reconfigures Logback from {@code logbackConfigurationFile} and bridges {@code java.util.logging} to SLF4J.
   *
   * @param logbackConfigurationFile a Logback XML configuration file
   * @param logbackOptions           optional behavior flags
   * @throws IllegalArgumentException if the file does not exist or is not a regular file
   * @throws IllegalStateException    if Logback is not the SLF4J binding or rejects the configuration
   */
  public static void initializeLogback(@NonNull Path logbackConfigurationFile,
                                       @Nullable LogbackOption... logbackOptions) {
    synchronized (LOCK) {
      requireNonNull(logbackConfigurationFile);

      List<LogbackOption> logbackOptionsAsList = logbackOptions == null ? Collections.emptyList() : Arrays.asList(logbackOptions);

      if (!Files.exists(logbackConfigurationFile))
        throw new IllegalArgumentException(format(
            "Unable to initialize Logback logging. Could not find a configuration file at %s",
            logbackConfigurationFile.toAbsolutePath()));

      if (!Files.isRegularFile(logbackConfigurationFile))
        throw new IllegalArgumentException(format(
            "Unable to initialize Logback logging. The configuration path %s does not appear to be a regular file",
            logbackConfigurationFile.toAbsolutePath()));

      ILoggerFactory loggerFactory = getILoggerFactory();

      if (!(loggerFactory instanceof LoggerContext))
        throw new IllegalStateException(format("Unable to initialize Logback logging. SLF4J is bound to %s",
            loggerFactory.getClass().getName()));

      LoggerContext loggerContext = (LoggerContext) loggerFactory;

      try {
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(loggerContext);
        loggerContext.reset();
        configurator.doConfigure(logbackConfigurationFile.toFile().getAbsolutePath());
      } catch (JoranException e) {
        throw new IllegalStateException("Unable to configure Logback logging", e);
      }

      if (logbackOptionsAsList.contains(LogbackOption.DEBUGGING_ENABLED))
        StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

      installJulBridge();
    }
  }

  /**
   * Routes all {@code java.util.logging} output to SLF4J, replacing the JDK's console handlers.
   * <p>
   * Calling this more than once has no further effect.
   */
  public static void installJulBridge() {
    synchronized (LOCK) {
      if (SLF4JBridgeHandler.isInstalled())
        return;

      java.util.logging.Logger rootLogger = getLogManager().getLogger("");
      for (Handler handler : rootLogger.getHandlers())
        rootLogger.removeHandler(handler);

      SLF4JBridgeHandler.install();
    }
  }

  public static void uninstallJulBridge() {
    synchronized (LOCK) {
      if (SLF4JBridgeHandler.isInstalled()) SLF4JBridgeHandler.uninstall();
    }
  }
}
