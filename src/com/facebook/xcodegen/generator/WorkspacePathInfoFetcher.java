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

package com.facebook.xcodegen.generator;

import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.util.HumanReadableException;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import javax.annotation.Nullable;

/**
 * Runs {@code bazel info} in the background and hands out the paths it reports. Getters block
 * until the command has finished.
 */
public class WorkspacePathInfoFetcher {

  private static final Logger LOG = Logger.get(WorkspacePathInfoFetcher.class);

  static final String EXECUTION_ROOT_KEY = "execution_root";
  static final String OUTPUT_BASE_KEY = "output_base";
  static final String PACKAGE_PATH_KEY = "package_path";

  private final ImmutableList<String> command;
  private final Path workspaceRoot;
  private final CountDownLatch fetchCompleted = new CountDownLatch(1);

  @Nullable private volatile ImmutableMap<String, String> info;
  @Nullable private volatile Exception failure;
  private volatile boolean started;

  public WorkspacePathInfoFetcher(
      String bazelPath, Path workspaceRoot, List<String> startupOptions) {
    this.command =
        ImmutableList.<String>builder()
            .add(bazelPath)
            .addAll(startupOptions)
            .add("info")
            .add(EXECUTION_ROOT_KEY, OUTPUT_BASE_KEY, PACKAGE_PATH_KEY)
            .build();
    this.workspaceRoot = workspaceRoot;
  }

  /** Starts the fetch. Only the first call has an effect. */
  public synchronized void start() {
    if (started) {
      return;
    }
    started = true;
    Thread thread = new Thread(this::fetch, "workspace-path-info-fetcher");
    thread.setDaemon(true);
    thread.start();
  }

  private void fetch() {
    try {
      LOG.debug("Running %s in %s", Joiner.on(' ').join(command), workspaceRoot);
      info = parseInfoOutput(executeCommand());
    } catch (IOException | InterruptedException | RuntimeException e) {
      failure = e;
    } finally {
      fetchCompleted.countDown();
    }
  }

  private List<String> executeCommand() throws IOException, InterruptedException {
    Process process =
        new ProcessBuilder(command)
            .directory(workspaceRoot.toFile())
            .redirectError(ProcessBuilder.Redirect.INHERIT)
            .start();
    List<String> lines = new ArrayList<>();
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lines.add(line);
      }
    }
    int exitCode = process.waitFor();
    Preconditions.checkState(
        exitCode == 0,
        "command `%s` returned exit code %s",
        Joiner.on(' ').join(command),
        exitCode);
    return lines;
  }

  /** Parses {@code key: value} lines. Lines without a separator are ignored. */
  static ImmutableMap<String, String> parseInfoOutput(List<String> lines) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String line : lines) {
      int separator = line.indexOf(": ");
      if (separator <= 0) {
        continue;
      }
      values.put(line.substring(0, separator).trim(), line.substring(separator + 2).trim());
    }
    return ImmutableMap.copyOf(values);
  }

  public String getExecutionRoot() {
    return getValue(EXECUTION_ROOT_KEY);
  }

  public String getOutputBase() {
    return getValue(OUTPUT_BASE_KEY);
  }

  public String getPackagePath() {
    return getValue(PACKAGE_PATH_KEY);
  }

  private String getValue(String key) {
    Preconditions.checkState(started, "The fetch was not started");
    try {
      fetchCompleted.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HumanReadableException(e, "Interrupted while waiting for bazel info");
    }
    Exception fetchFailure = failure;
    if (fetchFailure != null) {
      throw new HumanReadableException(
          fetchFailure,
          "Failed to read workspace paths from bazel info: %s",
          fetchFailure.getMessage());
    }
    String value = info.get(key);
    if (value == null) {
      throw new HumanReadableException("bazel info did not report %s", key);
    }
    return value;
  }
}
