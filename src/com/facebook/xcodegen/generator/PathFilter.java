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
import com.google.common.collect.ImmutableSet;

/**
 * Decides which workspace files get a project reference.
 *
 * <p>A filter is either a directory, matching files directly inside it, or a directory followed by
 * {@code /...}, matching everything below it. A filter of just {@code ...} matches the whole
 * workspace. An empty set of filters matches every file.
 */
public class PathFilter {

  private static final String RECURSIVE_SUFFIX = "...";

  private final ImmutableSet<String> directories;
  private final ImmutableSet<String> recursivePrefixes;

  private PathFilter(ImmutableSet<String> directories, ImmutableSet<String> recursivePrefixes) {
    this.directories = directories;
    this.recursivePrefixes = recursivePrefixes;
  }

  public static PathFilter of(Iterable<String> filters) {
    ImmutableSet.Builder<String> directories = ImmutableSet.builder();
    ImmutableSet.Builder<String> recursivePrefixes = ImmutableSet.builder();
    for (String filter : filters) {
      if (filter.endsWith(RECURSIVE_SUFFIX)) {
        recursivePrefixes.add(
            filter.substring(0, filter.length() - RECURSIVE_SUFFIX.length()));
      } else {
        directories.add(filter);
      }
    }
    return new PathFilter(directories.build(), recursivePrefixes.build());
  }

  public static PathFilter acceptAll() {
    return new PathFilter(ImmutableSet.of(), ImmutableSet.of());
  }

  public boolean acceptsAll() {
    return directories.isEmpty() && recursivePrefixes.isEmpty();
  }

  public boolean includes(String path) {
    if (acceptsAll()) {
      return true;
    }
    int slash = path.lastIndexOf('/');
    String directory = slash < 0 ? "" : path.substring(0, slash);
    if (directories.contains(directory)) {
      return true;
    }
    String terminatedDirectory = directory + "/";
    for (String prefix : recursivePrefixes) {
      if (prefix.isEmpty() || terminatedDirectory.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  public boolean includes(BazelFileInfo fileInfo) {
    return includes(fileInfo.getFullPath());
  }
}
