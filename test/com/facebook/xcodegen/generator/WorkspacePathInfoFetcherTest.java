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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Paths;
import org.junit.Test;

public class WorkspacePathInfoFetcherTest {

  @Test
  public void parsesKeyValueLines() {
    ImmutableMap<String, String> info =
        WorkspacePathInfoFetcher.parseInfoOutput(
            ImmutableList.of(
                "execution_root: /private/var/tmp/_bazel/abc/execroot/ws",
                "output_base: /private/var/tmp/_bazel/abc",
                "Starting local Bazel server and connecting to it...",
                "package_path: %workspace%"));

    assertThat(info, hasEntry("execution_root", "/private/var/tmp/_bazel/abc/execroot/ws"));
    assertThat(info, hasEntry("output_base", "/private/var/tmp/_bazel/abc"));
    assertThat(info, hasEntry("package_path", "%workspace%"));
    assertThat(info.size(), equalTo(3));
  }

  @Test
  public void valuesMayContainTheSeparator() {
    ImmutableMap<String, String> info =
        WorkspacePathInfoFetcher.parseInfoOutput(ImmutableList.of("release: release 6.0.0: rc"));

    assertThat(info, hasEntry("release", "release 6.0.0: rc"));
    assertThat(info, not(hasKey("release 6.0.0")));
  }

  @Test(expected = IllegalStateException.class)
  public void gettersRequireAStartedFetch() {
    new WorkspacePathInfoFetcher("bazel", Paths.get("."), ImmutableList.of()).getExecutionRoot();
  }
}
