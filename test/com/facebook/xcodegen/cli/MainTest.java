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

package com.facebook.xcodegen.cli;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.io.MoreFiles;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

  private static final String RULE_ENTRIES =
      "[{\"label\": \"//lib:L\", \"type\": \"objc_library\", \"srcs\": [\"lib/a.m\"],"
          + " \"platform_type\": \"ios\", \"os_deployment_target\": \"10.0\"},"
          + " {\"label\": \"//app:A\", \"type\": \"ios_application\", \"deps\": [\"//lib:L\"],"
          + " \"platform_type\": \"ios\", \"os_deployment_target\": \"10.0\"}]";

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private Path ruleEntries;
  private Path output;

  @Before
  public void setUp() throws IOException {
    ruleEntries = temporaryFolder.newFile("entries.json").toPath();
    MoreFiles.asCharSink(ruleEntries, StandardCharsets.UTF_8).write(RULE_ENTRIES);
    output = temporaryFolder.newFolder("out").toPath();
  }

  private Path writeConfig(String buildTarget) throws IOException {
    File config = temporaryFolder.newFile();
    MoreFiles.asCharSink(config.toPath(), StandardCharsets.UTF_8)
        .write(
            String.format(
                "{\"projectName\": \"Demo\", \"buildTargets\": [\"%s\"],"
                    + " \"sourceFilters\": [\"lib/...\"]}",
                buildTarget));
    return config.toPath();
  }

  private int run(Path config) {
    return new Main()
        .runMain(
            new String[] {
              "--config",
              config.toString(),
              "--rule-entries",
              ruleEntries.toString(),
              "--output-folder",
              output.toString(),
              "--workspace-root",
              temporaryFolder.getRoot().toString()
            });
  }

  @Test
  public void missingRequiredOptionIsUsageError() {
    assertThat(new Main().runMain(new String[] {"--config", "x.json"}), equalTo(Main.EXIT_USAGE));
  }

  @Test
  public void writesProjectBundle() throws IOException {
    assertThat(run(writeConfig("//app:A")), equalTo(Main.EXIT_SUCCESS));

    assertTrue(Files.isRegularFile(output.resolve("Demo.xcodeproj").resolve("project.pbxproj")));
  }

  @Test
  public void unresolvedLabelFailsGeneration() throws IOException {
    assertThat(run(writeConfig("//app:missing")), equalTo(Main.EXIT_GENERATION_FAILED));

    assertFalse(Files.exists(output.resolve("Demo.xcodeproj")));
  }
}
