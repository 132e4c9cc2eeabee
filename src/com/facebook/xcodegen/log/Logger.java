/*
 * Copyright (c) Facebook, Inc. and its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.facebook.xcodegen.log;

import static java.util.logging.Level.FINE;
import static java.util.logging.Level.FINER;
import static java.util.logging.Level.INFO;
import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.logging.Level;
import javax.annotation.Nullable;

/**
 * Thin wrapper around {@link java.util.logging.Logger} that takes {@link String#format} style
 * arguments and only formats when the level is enabled.
 *
 * <pre>
 *    LOG.debug("Merged %d indexers into %d", before, after);
 * </pre>
 */
public class Logger {

  private final java.util.logging.Logger logger;

  Logger(java.util.logging.Logger logger) {
    this.logger = logger;
  }

  /** Gets a logger named after a class' fully qualified name. */
  public static Logger get(Class<?> clazz) {
    return get(clazz.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name));
  }

  public boolean isVerboseEnabled() {
    return logger.isLoggable(FINER);
  }

  public boolean isDebugEnabled() {
    return logger.isLoggable(FINE);
  }

  public void verbose(String format, Object... args) {
    log(FINER, null, format, args);
  }

  public void verbose(Throwable exception, String format, Object... args) {
    log(FINER, exception, format, args);
  }

  public void debug(String format, Object... args) {
    log(FINE, null, format, args);
  }

  public void debug(Throwable exception, String format, Object... args) {
    log(FINE, exception, format, args);
  }

  public void info(String format, Object... args) {
    log(INFO, null, format, args);
  }

  public void info(Throwable exception, String format, Object... args) {
    log(INFO, exception, format, args);
  }

  public void warn(String format, Object... args) {
    log(WARNING, null, format, args);
  }

  public void warn(Throwable exception, String format, Object... args) {
    log(WARNING, exception, format, args);
  }

  public void error(String format, Object... args) {
    log(SEVERE, null, format, args);
  }

  public void error(Throwable exception, String format, Object... args) {
    log(SEVERE, exception, format, args);
  }

  private void log(Level level, @Nullable Throwable exception, String format, Object... args) {
    if (!logger.isLoggable(level)) {
      return;
    }
    String message;
    if (args.length == 0) {
      message = format;
    } else {
      try {
        message = String.format(format, args);
      } catch (IllegalFormatException e) {
        logger.log(SEVERE, illegalFormatMessageFor(level, format, args), e);
        message = rawMessageFor(format, args);
      }
    }
    if (exception == null) {
      logger.log(level, message);
    } else {
      logger.log(level, message, exception);
    }
  }

  private static String illegalFormatMessageFor(Level level, String message, Object... args) {
    return String.format(
        "Illegal format in %s log message: '%s' with args %s",
        level.getName(), message, Arrays.asList(args));
  }

  private static String rawMessageFor(String format, Object... args) {
    return String.format("'%s' %s", format, Arrays.asList(args));
  }
}
