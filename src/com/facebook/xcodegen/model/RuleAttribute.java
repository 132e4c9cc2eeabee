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

package com.facebook.xcodegen.model;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * The attribute keys the extraction aspect may report for a rule. This set is kept in sync with the
 * aspect's output; anything else is rejected when parsing.
 */
public enum RuleAttribute {
  BINARY("binary", Kind.LABEL),
  BRIDGING_HEADER("bridging_header", Kind.FILE),
  /** Defines set on the Bazel command line or built into Bazel itself. */
  COMPILER_DEFINES("compiler_defines", Kind.STRING_LIST),
  COPTS("copts", Kind.STRING_LIST),
  DATAMODELS("datamodels", Kind.FILE_LIST),
  DEFINES("defines", Kind.STRING_LIST),
  ENABLE_MODULES("enable_modules", Kind.BOOLEAN),
  HAS_SWIFT_DEPENDENCY("has_swift_dependency", Kind.BOOLEAN),
  HAS_SWIFT_INFO("has_swift_info", Kind.BOOLEAN),
  INCLUDES("includes", Kind.STRING_LIST),
  LAUNCH_STORYBOARD("launch_storyboard", Kind.FILE),
  PCH("pch", Kind.FILE),
  SWIFT_LANGUAGE_VERSION("swift_language_version", Kind.STRING),
  SWIFT_TOOLCHAIN("swift_toolchain", Kind.STRING),
  SWIFTC_OPTS("swiftc_opts", Kind.STRING_LIST),
  /** Asset catalogs, storyboards, xibs and other files that need no special handling. */
  SUPPORTING_FILES("supporting_files", Kind.FILE_LIST),
  TEST_HOST("test_host", Kind.LABEL),
  /** For {@code ios_test}: false for tests that are not XCTest based (e.g. KIF). */
  XCTEST("xctest", Kind.BOOLEAN),
  XCTEST_APP("xctest_app", Kind.LABEL),
  ;

  /** The JSON shape an attribute value must have. */
  public enum Kind {
    BOOLEAN,
    STRING,
    STRING_LIST,
    LABEL,
    FILE,
    FILE_LIST,
  }

  private static final ImmutableMap<String, RuleAttribute> BY_KEY;

  static {
    ImmutableMap.Builder<String, RuleAttribute> builder = ImmutableMap.builder();
    for (RuleAttribute attribute : values()) {
      builder.put(attribute.key, attribute);
    }
    BY_KEY = builder.build();
  }

  private final String key;
  private final Kind kind;

  RuleAttribute(String key, Kind kind) {
    this.key = key;
    this.kind = kind;
  }

  public String getKey() {
    return key;
  }

  public Kind getKind() {
    return kind;
  }

  public static Optional<RuleAttribute> fromKey(String key) {
    return Optional.ofNullable(BY_KEY.get(key));
  }
}
