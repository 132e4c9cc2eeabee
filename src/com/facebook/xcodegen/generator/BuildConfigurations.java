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

import com.dd.plist.NSDictionary;
import com.dd.plist.NSObject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.XCBuildConfiguration;
import com.facebook.xcodegen.apple.xcode.xcodeproj.XCConfigurationList;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.Nullable;

/** Creates the build configurations of targets and of the project. */
final class BuildConfigurations {

  /** Build configurations of every target. The build script reads these from CONFIGURATION. */
  static final ImmutableList<String> BUILD_CONFIG_NAMES = ImmutableList.of("Debug", "Release");

  static final String TEST_RUNNER_CONFIG_PREFIX = "__TulsiTestRunner_";

  /** Test runner configuration name to the configuration it is based on. */
  static final ImmutableMap<String, String> TEST_RUNNER_CONFIG_NAMES =
      ImmutableMap.of(
          TEST_RUNNER_CONFIG_PREFIX + "Debug", "Debug",
          TEST_RUNNER_CONFIG_PREFIX + "Release", "Release");

  private static final String PREPROCESSOR_DEFINITIONS = "GCC_PREPROCESSOR_DEFINITIONS";

  private static final ImmutableMap<String, String> CONFIG_DEFINES =
      ImmutableMap.of("Debug", "DEBUG=1", "Release", "NDEBUG=1");

  private BuildConfigurations() {}

  /**
   * Sets {@code settings} on every build configuration of {@code list}, together with the
   * preprocessor define Bazel injects for that configuration.
   */
  static void createBuildConfigurationsForList(
      XCConfigurationList list, Map<String, String> settings) {
    for (String configName : BUILD_CONFIG_NAMES) {
      SortedMap<String, String> configSettings = new TreeMap<>(settings);
      String define = CONFIG_DEFINES.get(configName);
      String existing = configSettings.get(PREPROCESSOR_DEFINITIONS);
      configSettings.put(
          PREPROCESSOR_DEFINITIONS, existing == null ? define : existing + " " + define);
      list.getOrCreateBuildConfiguration(configName).setBuildSettings(toDictionary(configSettings));
    }
  }

  /**
   * Adds configurations used when running tests. They are copies of the base configurations whose
   * compile and link invocations only print the tool version, so running tests never rebuilds.
   */
  static void addTestRunnerBuildConfigurations(XCConfigurationList list) {
    for (Map.Entry<String, String> names : TEST_RUNNER_CONFIG_NAMES.entrySet()) {
      XCBuildConfiguration baseConfig = list.getOrCreateBuildConfiguration(names.getValue());
      XCBuildConfiguration config = list.getOrCreateBuildConfiguration(names.getKey());

      SortedMap<String, String> settings = toMap(baseConfig.getBuildSettings());
      settings.put("OTHER_CFLAGS", "--version");
      settings.put("OTHER_SWIFT_FLAGS", "--version");
      settings.put("OTHER_LDFLAGS", "--version");
      // Kept in sync with the Swift dummy file generation phase.
      settings.put("SWIFT_OBJC_INTERFACE_HEADER_NAME", "$(PRODUCT_NAME).h");
      settings.put("SWIFT_INSTALL_OBJC_HEADER", "NO");
      settings.put("ONLY_ACTIVE_ARCH", "YES");
      settings.put("FRAMEWORK_SEARCH_PATHS", "");
      settings.put("HEADER_SEARCH_PATHS", "");
      config.setBuildSettings(toDictionary(settings));
    }
  }

  /**
   * Adds {@code newSettings}, then the settings of the same named configuration in {@code
   * baseList}, to every configuration of {@code list}. Settings a configuration already has are
   * never replaced. Test runner configurations fall back to the base configuration of {@code
   * baseList} when it has no test runner configuration.
   */
  static void updateMissingBuildConfigurationsForList(
      XCConfigurationList list,
      Map<String, String> newSettings,
      @Nullable XCConfigurationList baseList,
      ImmutableSet<String> suppressedKeys) {
    for (String configName : BUILD_CONFIG_NAMES) {
      XCBuildConfiguration config = list.getOrCreateBuildConfiguration(configName);
      SortedMap<String, String> settings = toMap(config.getBuildSettings());
      mergeMissing(settings, newSettings, suppressedKeys);
      if (baseList != null) {
        baseList
            .getBuildConfiguration(configName)
            .ifPresent(
                base -> mergeMissing(settings, toMap(base.getBuildSettings()), suppressedKeys));
      }
      config.setBuildSettings(toDictionary(settings));
    }

    for (Map.Entry<String, String> names : TEST_RUNNER_CONFIG_NAMES.entrySet()) {
      XCBuildConfiguration config = list.getOrCreateBuildConfiguration(names.getKey());
      SortedMap<String, String> settings = toMap(config.getBuildSettings());
      mergeMissing(settings, newSettings, suppressedKeys);
      if (baseList != null) {
        Optional<XCBuildConfiguration> base = baseList.getBuildConfiguration(names.getKey());
        if (!base.isPresent()) {
          base = baseList.getBuildConfiguration(names.getValue());
        }
        base.ifPresent(b -> mergeMissing(settings, toMap(b.getBuildSettings()), suppressedKeys));
      }
      config.setBuildSettings(toDictionary(settings));
    }
  }

  private static void mergeMissing(
      Map<String, String> settings,
      Map<String, String> newSettings,
      ImmutableSet<String> suppressed) {
    for (Map.Entry<String, String> entry : newSettings.entrySet()) {
      if (suppressed.contains(entry.getKey())) {
        continue;
      }
      settings.putIfAbsent(entry.getKey(), entry.getValue());
    }
  }

  static NSDictionary toDictionary(Map<String, String> settings) {
    NSDictionary dictionary = new NSDictionary();
    for (Map.Entry<String, String> entry : settings.entrySet()) {
      dictionary.put(entry.getKey(), entry.getValue());
    }
    return dictionary;
  }

  static SortedMap<String, String> toMap(NSDictionary dictionary) {
    SortedMap<String, String> settings = new TreeMap<>();
    for (Map.Entry<String, NSObject> entry : dictionary.entrySet()) {
      settings.put(entry.getKey(), entry.getValue().toJavaObject().toString());
    }
    return settings;
  }
}
