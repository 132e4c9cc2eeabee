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

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.TimeUnit;

/**
 * Emits diagnostics as a message key plus positional values.
 *
 * <p>Messages are looked up in the {@code Messages} resource bundle next to this class. Every
 * diagnostic is also kept in memory so callers can report a summary and tests can assert on the
 * exact keys and values that were raised.
 */
public class LocalizedMessageLogger {

  private static final Logger LOG = Logger.get(LocalizedMessageLogger.class);
  private static final String BUNDLE_NAME = "com.facebook.xcodegen.log.Messages";

  private final ResourceBundle bundle;
  private final Locale locale;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public LocalizedMessageLogger() {
    this(Locale.getDefault());
  }

  public LocalizedMessageLogger(Locale locale) {
    this.locale = locale;
    this.bundle = ResourceBundle.getBundle(BUNDLE_NAME, locale);
  }

  public Diagnostic warning(String key, Object... values) {
    Diagnostic diagnostic = record(Severity.WARNING, key, values);
    LOG.warn("%s", diagnostic.getMessage());
    return diagnostic;
  }

  public Diagnostic error(String key, Object... values) {
    Diagnostic diagnostic = record(Severity.ERROR, key, values);
    LOG.error("%s", diagnostic.getMessage());
    return diagnostic;
  }

  public Diagnostic info(String key, Object... values) {
    Diagnostic diagnostic = record(Severity.INFO, key, values);
    LOG.info("%s", diagnostic.getMessage());
    return diagnostic;
  }

  /** Starts timing an action; pair with {@link #logProfilingEnd(ProfilingToken)}. */
  public ProfilingToken startProfiling(String action) {
    LOG.debug("Starting %s", action);
    return new ProfilingToken(action, Stopwatch.createStarted());
  }

  public void logProfilingEnd(ProfilingToken token) {
    long elapsed = token.stopwatch.elapsed(TimeUnit.MILLISECONDS);
    LOG.debug("%s", formatMessage("ProfilingEnd", ImmutableList.of(token.action, elapsed)));
  }

  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public ImmutableList<Diagnostic> getDiagnostics(String key) {
    ImmutableList.Builder<Diagnostic> builder = ImmutableList.builder();
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getKey().equals(key)) {
        builder.add(diagnostic);
      }
    }
    return builder.build();
  }

  private Diagnostic record(Severity severity, String key, Object... values) {
    ImmutableList.Builder<String> stringValues = ImmutableList.builder();
    for (Object value : values) {
      stringValues.add(String.valueOf(value));
    }
    ImmutableList<String> valueList = stringValues.build();
    Diagnostic diagnostic =
        Diagnostic.of(
            severity, key, valueList, formatMessage(key, ImmutableList.copyOf(valueList)));
    diagnostics.add(diagnostic);
    return diagnostic;
  }

  private String formatMessage(String key, ImmutableList<?> values) {
    String pattern;
    try {
      pattern = bundle.getString(key);
    } catch (MissingResourceException e) {
      LOG.verbose("No message for key %s", key);
      return key + ": " + Joiner.on(", ").join(values);
    }
    return new MessageFormat(pattern, locale).format(values.toArray());
  }

  /** Handle returned by {@link #startProfiling(String)}. */
  public static class ProfilingToken {
    private final String action;
    private final Stopwatch stopwatch;

    private ProfilingToken(String action, Stopwatch stopwatch) {
      this.action = action;
      this.stopwatch = stopwatch;
    }
  }
}
