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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.facebook.xcodegen.model.BazelFileInfo;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class PathFilterTest {

  @Test
  public void noFiltersIncludeEverything() {
    PathFilter filter = PathFilter.of(ImmutableList.of());

    assertTrue(filter.acceptsAll());
    assertTrue(filter.includes("any/where/a.m"));
  }

  @Test
  public void directoryFilterIsNotRecursive() {
    PathFilter filter = PathFilter.of(ImmutableList.of("lib"));

    assertTrue(filter.includes("lib/a.m"));
    assertFalse(filter.includes("lib/sub/a.m"));
    assertFalse(filter.includes("library/a.m"));
  }

  @Test
  public void recursiveFilterIncludesSubdirectories() {
    PathFilter filter = PathFilter.of(ImmutableList.of("lib/..."));

    assertTrue(filter.includes("lib/a.m"));
    assertTrue(filter.includes("lib/sub/deep/a.m"));
    assertFalse(filter.includes("library/a.m"));
  }

  @Test
  public void bareRecursiveFilterIncludesEverything() {
    assertTrue(PathFilter.of(ImmutableList.of("...")).includes("a/b/c.m"));
  }

  @Test
  public void emptyDirectoryFilterMatchesWorkspaceRootFiles() {
    PathFilter filter = PathFilter.of(ImmutableList.of(""));

    assertTrue(filter.includes("BUILD"));
    assertFalse(filter.includes("lib/BUILD"));
  }

  @Test
  public void generatedFilesAreMatchedByFullPath() {
    PathFilter filter = PathFilter.of(ImmutableList.of("lib"));

    assertFalse(filter.includes(BazelFileInfo.generated("bazel-out/genfiles", "lib/gen.m")));
    assertTrue(filter.includes(BazelFileInfo.source("lib/a.m")));
  }
}
