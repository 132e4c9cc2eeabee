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
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertFalse;

import java.util.Optional;
import org.junit.Test;

public class BuildLabelTest {

  @Test
  public void targetNameIsTheComponentAfterTheColon() {
    assertThat(BuildLabel.of("//foo/bar:baz").getTargetName(), equalTo(Optional.of("baz")));
  }

  @Test
  public void implicitTargetNameIsTheLastPackageComponent() {
    assertThat(BuildLabel.of("//foo/bar").getTargetName(), equalTo(Optional.of("bar")));
  }

  @Test
  public void labelEndingWithSlashHasNoTargetName() {
    assertFalse(BuildLabel.of("//foo/").getTargetName().isPresent());
  }

  @Test
  public void packageNameDropsLeadingSlashes() {
    assertThat(BuildLabel.of("//foo/bar:baz").getPackageName(), equalTo("foo/bar"));
    assertThat(BuildLabel.of("//:baz").getPackageName(), equalTo(""));
    assertThat(BuildLabel.of("//foo/").getPackageName(), equalTo(""));
  }

  @Test
  public void fullTargetNameReplacesSlashes() {
    assertThat(BuildLabel.of("//foo/bar:baz").asFullPBXTargetName(), equalTo("foo-bar-baz"));
  }

  @Test
  public void labelsCompareByValue() {
    assertThat(BuildLabel.of("//a:a"), equalTo(BuildLabel.of("//a:a")));
    assertThat(BuildLabel.of("//a:a").compareTo(BuildLabel.of("//b:b")), lessThan(0));
  }
}
