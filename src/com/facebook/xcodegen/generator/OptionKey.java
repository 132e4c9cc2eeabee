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

import java.util.Optional;
import javax.annotation.Nullable;

/** The options a project can be generated with. */
public enum OptionKey {
  ALWAYS_SEARCH_USER_PATHS("ALWAYS_SEARCH_USER_PATHS", Kind.BUILD_SETTING, "NO", true),
  CLANG_CXX_LANGUAGE_STANDARD("CLANG_CXX_LANGUAGE_STANDARD", Kind.BUILD_SETTING, null, true),

  SUPPRESS_SWIFT_UPDATE_CHECK("SuppressSwiftUpdateCheck", Kind.BOOLEAN, "YES", false),
  IMPROVED_IMPORT_AUTOCOMPLETION_FIX(
      "ImprovedImportAutocompletionFix", Kind.BOOLEAN, "YES", false),
  PATH_FILTERS_APPLY_TO_TEST_SOURCES(
      "PathFiltersApplyToTestSources", Kind.BOOLEAN, "YES", false),

  BAZEL_BUILD_OPTIONS_DEBUG("BazelBuildOptionsDebug", Kind.STRING, null, true),
  BAZEL_BUILD_OPTIONS_FASTBUILD("BazelBuildOptionsFastbuild", Kind.STRING, null, true),
  BAZEL_BUILD_OPTIONS_RELEASE("BazelBuildOptionsRelease", Kind.STRING, null, true),
  BAZEL_BUILD_STARTUP_OPTIONS_DEBUG("BazelBuildStartupOptionsDebug", Kind.STRING, null, true),
  BAZEL_BUILD_STARTUP_OPTIONS_FASTBUILD(
      "BazelBuildStartupOptionsFastbuild", Kind.STRING, null, true),
  BAZEL_BUILD_STARTUP_OPTIONS_RELEASE("BazelBuildStartupOptionsRelease", Kind.STRING, null, true),

  /** Startup options for the {@code bazel clean} invoked by the clean target. */
  PROJECT_GENERATION_BAZEL_STARTUP_OPTIONS(
      "ProjectGenerationBazelStartupOptions", Kind.STRING, null, false),

  PRE_BUILD_PHASE_RUN_SCRIPT("PreBuildPhaseRunScript", Kind.STRING, null, true),
  POST_BUILD_PHASE_RUN_SCRIPT("PostBuildPhaseRunScript", Kind.STRING, null, true),
  ;

  /** How the value of an option is interpreted. */
  public enum Kind {
    /** {@code YES} or {@code NO}. */
    BOOLEAN,
    STRING,
    /** Copied verbatim into the Xcode build settings under the option's name. */
    BUILD_SETTING,
  }

  private final String name;
  private final Kind kind;
  @Nullable private final String defaultValue;
  private final boolean targetSpecializable;

  OptionKey(
      String name, Kind kind, @Nullable String defaultValue, boolean targetSpecializable) {
    this.name = name;
    this.kind = kind;
    this.defaultValue = defaultValue;
    this.targetSpecializable = targetSpecializable;
  }

  /** The name used for this option in configuration files. */
  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public Optional<String> getDefaultValue() {
    return Optional.ofNullable(defaultValue);
  }

  /** Whether individual targets may override the project wide value. */
  public boolean isTargetSpecializable() {
    return targetSpecializable;
  }

  public static Optional<OptionKey> fromName(String name) {
    for (OptionKey key : values()) {
      if (key.name.equals(name)) {
        return Optional.of(key);
      }
    }
    return Optional.empty();
  }
}
