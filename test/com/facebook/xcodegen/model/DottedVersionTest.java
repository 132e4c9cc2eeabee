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
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertFalse;

import com.facebook.xcodegen.util.HumanReadableException;
import org.junit.Test;

public class DottedVersionTest {

  @Test
  public void trailingZerosDoNotAffectEquality() {
    assertThat(DottedVersion.of("9.0"), equalTo(DottedVersion.of("9")));
    assertThat(DottedVersion.of("9.0").hashCode(), equalTo(DottedVersion.of("9").hashCode()));
  }

  @Test
  public void componentsCompareNumerically() {
    assertThat(DottedVersion.of("10.1").compareTo(DottedVersion.of("9.3")), greaterThan(0));
  }

  @Test
  public void nonNumericComponentIsRejected() {
    assertFalse(DottedVersion.parse("9.x").isPresent());
  }

  @Test(expected = HumanReadableException.class)
  public void ofThrowsOnMalformedVersion() {
    DottedVersion.of("beta");
  }

  @Test
  public void toStringKeepsComponents() {
    assertThat(DottedVersion.of("10.3.1").toString(), equalTo("10.3.1"));
  }
}
