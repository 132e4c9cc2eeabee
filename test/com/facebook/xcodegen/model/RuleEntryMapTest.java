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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import com.facebook.xcodegen.log.LocalizedMessageLogger;
import org.junit.Before;
import org.junit.Test;

public class RuleEntryMapTest {

  private static final BuildLabel LIB = BuildLabel.of("//lib:lib");
  private static final DeploymentTarget IOS_10 =
      DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("10.0"));
  private static final DeploymentTarget IOS_11 =
      DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("11.0"));
  private static final DeploymentTarget TVOS_11 =
      DeploymentTarget.of(PlatformType.TVOS, DottedVersion.of("11.0"));

  private LocalizedMessageLogger logger;
  private RuleEntryMap ruleEntryMap;

  @Before
  public void setUp() {
    logger = new LocalizedMessageLogger();
    ruleEntryMap = new RuleEntryMap(logger);
  }

  private static RuleEntry libraryFor(DeploymentTarget deploymentTarget) {
    return RuleEntry.builder()
        .setLabel(LIB)
        .setType("objc_library")
        .setDeploymentTarget(deploymentTarget)
        .build();
  }

  @Test
  public void singleEntryResolvesForAnyDeploymentTarget() {
    RuleEntry entry = libraryFor(IOS_10);
    ruleEntryMap.insert(entry);

    assertThat(ruleEntryMap.entry(LIB, TVOS_11), sameInstance(entry));
    assertThat(logger.getDiagnostics(), hasSize(0));
  }

  @Test
  public void matchingDeploymentTargetIsPreferred() {
    RuleEntry ios10 = libraryFor(IOS_10);
    RuleEntry ios11 = libraryFor(IOS_11);
    ruleEntryMap.insert(ios10);
    ruleEntryMap.insert(ios11);

    assertThat(ruleEntryMap.entry(LIB, IOS_10), sameInstance(ios10));
    assertThat(ruleEntryMap.entry(LIB, IOS_11), sameInstance(ios11));
  }

  @Test
  public void ambiguousLookupWarnsOncePerLabel() {
    ruleEntryMap.insert(libraryFor(IOS_10));
    RuleEntry latest = libraryFor(IOS_11);
    ruleEntryMap.insert(latest);

    assertThat(ruleEntryMap.entry(LIB, TVOS_11), sameInstance(latest));
    assertThat(ruleEntryMap.entry(LIB, TVOS_11), sameInstance(latest));
    assertThat(logger.getDiagnostics("AmbiguousRuleEntryReference"), hasSize(1));
  }

  @Test
  public void dependerWithoutDeploymentTargetGetsAnyEntry() {
    RuleEntry latest = libraryFor(IOS_11);
    ruleEntryMap.insert(libraryFor(IOS_10));
    ruleEntryMap.insert(latest);
    RuleEntry depender =
        RuleEntry.builder().setLabel(BuildLabel.of("//app:app")).setType("objc_library").build();

    assertThat(ruleEntryMap.entry(LIB, depender), sameInstance(latest));
    assertThat(logger.getDiagnostics("DependentRuleEntryHasNoDeploymentTarget"), hasSize(1));
  }

  @Test
  public void unknownLabelResolvesToNull() {
    assertThat(ruleEntryMap.entry(LIB, IOS_10), nullValue());
    assertThat(ruleEntryMap.anyEntry(LIB), nullValue());
  }

  @Test
  public void copyStartsWithFreshWarningState() {
    ruleEntryMap.insert(libraryFor(IOS_10));
    ruleEntryMap.insert(libraryFor(IOS_11));
    ruleEntryMap.entry(LIB, TVOS_11);

    new RuleEntryMap(ruleEntryMap).entry(LIB, TVOS_11);

    assertThat(logger.getDiagnostics("AmbiguousRuleEntryReference"), hasSize(2));
  }
}
