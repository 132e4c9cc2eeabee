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

/** Build setting variables the generated project defines for its build scripts. */
final class BuildVariables {

  /** The workspace root, as seen from the project. */
  static final String WORKSPACE_ROOT = "TULSI_WR";

  /** A symlink to the Bazel execution root, kept inside the project bundle. */
  static final String EXECUTION_ROOT = "TULSI_EXECUTION_ROOT";

  /** Older name of {@link #EXECUTION_ROOT}, still read by existing build scripts. */
  static final String EXECUTION_ROOT_LEGACY = "TULSI_BWRS";

  /** A symlink to the Bazel output base, kept inside the project bundle. */
  static final String OUTPUT_BASE = "TULSI_OUTPUT_BASE";

  static final String EXECUTION_ROOT_SYMLINK_PATH = ".tulsi/tulsi-execution-root";
  static final String OUTPUT_BASE_SYMLINK_PATH = ".tulsi/tulsi-output-base";

  /** Where the extraction aspect places generated headers, relative to the execution root. */
  static final String INCLUDES_PATH = "bazel-tulsi-includes/x/x";

  static final String EXTERNAL_PREFIX = "external/";

  private BuildVariables() {}

  /** Returns {@code $(name)}. */
  static String reference(String name) {
    return "$(" + name + ")";
  }

  static String underVariable(String name, String path) {
    return reference(name) + "/" + path;
  }
}
