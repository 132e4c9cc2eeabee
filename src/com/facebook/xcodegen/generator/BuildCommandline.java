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

import com.facebook.xcodegen.model.BuildLabel;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the shell command run by the script phase of a product target. The command hands the
 * target label to the build script together with the Bazel invocation options of every build
 * configuration.
 */
class BuildCommandline {

  private static final ImmutableMap<String, OptionKey> BUILD_OPTIONS =
      ImmutableMap.of(
          "Debug", OptionKey.BAZEL_BUILD_OPTIONS_DEBUG,
          "Fastbuild", OptionKey.BAZEL_BUILD_OPTIONS_FASTBUILD,
          "Release", OptionKey.BAZEL_BUILD_OPTIONS_RELEASE);

  private static final ImmutableMap<String, OptionKey> STARTUP_OPTIONS =
      ImmutableMap.of(
          "Debug", OptionKey.BAZEL_BUILD_STARTUP_OPTIONS_DEBUG,
          "Fastbuild", OptionKey.BAZEL_BUILD_STARTUP_OPTIONS_FASTBUILD,
          "Release", OptionKey.BAZEL_BUILD_STARTUP_OPTIONS_RELEASE);

  private final String buildScriptPath;
  private final String bazelPath;
  private final String bazelBinPath;
  private final OptionSet options;

  BuildCommandline(
      String buildScriptPath, String bazelPath, String bazelBinPath, OptionSet options) {
    this.buildScriptPath = buildScriptPath;
    this.bazelPath = bazelPath;
    this.bazelBinPath = bazelBinPath;
    this.options = options;
  }

  String forTarget(BuildLabel label) {
    StringBuilder commandline =
        new StringBuilder()
            .append(String.format("\"%s\" %s ", buildScriptPath, label))
            .append(String.format("--bazel \"%s\" ", bazelPath))
            .append(String.format("--bazel_bin_path \"%s\" ", bazelBinPath))
            .append("--verbose ");
    appendOptions(commandline, "--bazel_options", BUILD_OPTIONS, label);
    appendOptions(commandline, "--bazel_startup_options", STARTUP_OPTIONS, label);
    return commandline.toString();
  }

  /**
   * Appends one {@code flag[Config] value --} group per configuration with a value, or a single
   * unqualified group when every configuration has the same value.
   */
  private void appendOptions(
      StringBuilder commandline,
      String flag,
      ImmutableMap<String, OptionKey> keysByConfig,
      BuildLabel label) {
    Map<String, Optional<String>> valuesByConfig = new LinkedHashMap<>();
    for (Map.Entry<String, OptionKey> entry : keysByConfig.entrySet()) {
      valuesByConfig.put(
          entry.getKey(),
          options.get(entry.getValue(), label.getValue()).filter(value -> !value.isEmpty()));
    }

    if (valuesByConfig.values().stream().distinct().count() == 1) {
      Optional<String> value = valuesByConfig.values().iterator().next();
      value.ifPresent(v -> commandline.append(String.format("%s %s -- ", flag, v)));
      return;
    }
    for (Map.Entry<String, Optional<String>> entry : valuesByConfig.entrySet()) {
      entry
          .getValue()
          .ifPresent(
              v -> commandline.append(String.format("%s[%s] %s -- ", flag, entry.getKey(), v)));
    }
  }
}
