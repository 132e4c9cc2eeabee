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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import org.junit.Test;

public class RuleEntryParserTest {

  private final RuleEntryParser parser = new RuleEntryParser();

  @Test
  public void parsesFixture() throws IOException {
    ImmutableList<RuleEntry> entries;
    try (InputStream stream = getClass().getResourceAsStream("rule_entries.json")) {
      entries = parser.parse(stream);
    }
    assertThat(entries, hasSize(2));

    RuleEntry library = entries.get(0);
    assertThat(library.getLabel(), equalTo(BuildLabel.of("//lib:L")));
    assertThat(library.getType(), equalTo("objc_library"));
    assertThat(library.getSourceFiles(), hasSize(3));
    assertTrue(library.getSourceFiles().get(0).isSourceFile());
    BazelFileInfo generated = library.getSourceFiles().get(2);
    assertFalse(generated.isSourceFile());
    assertThat(generated.getFullPath(), equalTo("bazel-out/ios/genfiles/lib/gen.m"));
    assertThat(library.getAttributes().getCopts(), contains("-DFOO=1"));
    assertThat(
        library.getDeploymentTarget(),
        equalTo(Optional.of(DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("10.0")))));
    assertThat(library.getGeneratedIncludePaths(), contains(IncludePath.of("lib/include", true)));

    RuleEntry application = entries.get(1);
    assertThat(application.getDependencies(), contains(BuildLabel.of("//lib:L")));
    assertThat(application.getBundleId(), equalTo(Optional.of("com.example.app")));
    assertTrue(application.getAttributes().isHasSwiftDependency());
  }

  @Test
  public void acceptsWrappedList() {
    ImmutableList<RuleEntry> entries =
        parser.parse("{\"rule_entries\": [{\"label\": \"//a:a\", \"type\": \"filegroup\"}]}");
    assertThat(entries, hasSize(1));
  }

  @Test
  public void unknownRecordKeyIsAnError() {
    try {
      parser.parse("[{\"label\": \"//a:a\", \"type\": \"filegroup\", \"colour\": 1}]");
      fail("Expected RuleEntryParseException");
    } catch (RuleEntryParseException e) {
      assertThat(e.getMessage(), containsString("colour"));
    }
  }

  @Test
  public void unknownAttributeIsAnError() {
    try {
      parser.parse("[{\"label\": \"//a:a\", \"type\": \"objc_library\", \"attr\": {\"x\": 1}}]");
      fail("Expected RuleEntryParseException");
    } catch (RuleEntryParseException e) {
      assertThat(e.getMessage(), containsString("'x'"));
    }
  }

  @Test(expected = RuleEntryParseException.class)
  public void missingTypeIsAnError() {
    parser.parse("[{\"label\": \"//a:a\"}]");
  }

  @Test(expected = RuleEntryParseException.class)
  public void malformedJsonIsAnError() {
    parser.parse("[{\"label\": ");
  }
}
