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

import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.IncludePath;
import com.facebook.xcodegen.model.RuleEntry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiler settings of one rule, read from its attributes and rewritten so that paths resolve
 * through the project's build variables.
 */
final class CompileSettings {

  private final Set<String> defines = new LinkedHashSet<>();
  private final Set<String> includes = new LinkedHashSet<>();
  private final List<String> otherCFlags = new ArrayList<>();
  private final Set<String> swiftIncludePaths = new LinkedHashSet<>();
  private final List<String> otherSwiftFlags = new ArrayList<>();

  private CompileSettings() {}

  static CompileSettings forRuleEntry(RuleEntry entry) {
    CompileSettings settings = new CompileSettings();
    settings.defines.addAll(entry.getObjcDefines());
    settings.defines.addAll(entry.getAttributes().getDefines());
    settings.defines.addAll(entry.getAttributes().getCompilerDefines());
    settings.addIncludes(entry);
    settings.addLocalSettings(entry);
    settings.addOtherSwiftFlags(entry);
    settings.addSwiftIncludes(entry);
    return settings;
  }

  ImmutableSet<String> getDefines() {
    return ImmutableSet.copyOf(defines);
  }

  ImmutableSet<String> getIncludes() {
    return ImmutableSet.copyOf(includes);
  }

  ImmutableList<String> getOtherCFlags() {
    return ImmutableList.copyOf(otherCFlags);
  }

  ImmutableSet<String> getSwiftIncludePaths() {
    return ImmutableSet.copyOf(swiftIncludePaths);
  }

  ImmutableList<String> getOtherSwiftFlags() {
    return ImmutableList.copyOf(otherSwiftFlags);
  }

  /**
   * Generated header directories live under the execution root and external repositories under
   * the output base. Everything else is taken to be in the workspace.
   */
  private void addIncludes(RuleEntry entry) {
    for (IncludePath includePath : entry.getGeneratedIncludePaths()) {
      String path = includePath.getPath();
      String variable;
      if (path.startsWith(BuildVariables.INCLUDES_PATH)) {
        variable = BuildVariables.EXECUTION_ROOT;
      } else if (path.startsWith(BuildVariables.EXTERNAL_PREFIX)) {
        variable = BuildVariables.OUTPUT_BASE;
      } else {
        variable = BuildVariables.WORKSPACE_ROOT;
      }
      String rootedPath = BuildVariables.underVariable(variable, path);
      includes.add(includePath.isRecursive() ? rootedPath + "/**" : rootedPath);
    }
  }

  /** Sorts {@code copts} and {@code swiftc_opts} into defines, include paths and other flags. */
  private void addLocalSettings(RuleEntry entry) {
    for (String opt : entry.getAttributes().getSwiftcOpts()) {
      if (opt.startsWith("-I")) {
        swiftIncludePaths.add(rootInExecutionRoot(opt.substring(2)));
      } else {
        otherSwiftFlags.add(opt);
      }
    }
    for (String opt : entry.getAttributes().getCopts()) {
      if (opt.startsWith("-D")) {
        defines.add(opt.substring(2));
      } else if (opt.startsWith("-I")) {
        includes.add(rootInExecutionRoot(opt.substring(2)));
      } else {
        otherCFlags.add(opt);
      }
    }
  }

  /** Module maps are loaded explicitly so Clang never sees a header as both modular and not. */
  private void addOtherSwiftFlags(RuleEntry entry) {
    for (BazelFileInfo moduleMap : entry.getObjcModuleMaps()) {
      otherSwiftFlags.add(
          "-Xcc -fmodule-map-file="
              + BuildVariables.underVariable(
                  BuildVariables.EXECUTION_ROOT, moduleMap.getFullPath()));
    }
    for (String define : entry.getSwiftDefines()) {
      otherSwiftFlags.add("-D" + define);
    }
  }

  private void addSwiftIncludes(RuleEntry entry) {
    for (BazelFileInfo module : entry.getSwiftTransitiveModules()) {
      swiftIncludePaths.add(
          BuildVariables.underVariable(
              BuildVariables.EXECUTION_ROOT, parentPath(module.getFullPath())));
    }
  }

  private static String rootInExecutionRoot(String path) {
    if (path.startsWith("/")) {
      return path;
    }
    return BuildVariables.underVariable(BuildVariables.EXECUTION_ROOT, path);
  }

  /** The path without its last component, or "" for a single component. */
  static String parentPath(String path) {
    int slash = path.lastIndexOf('/');
    return slash < 0 ? "" : path.substring(0, slash);
  }
}
