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

import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.immutables.value.Value;

/** The typed attribute bag of a rule. Every field corresponds to one {@link RuleAttribute}. */
@Value.Immutable
@XcodegenStyleImmutable
abstract class AbstractRuleAttributes {

  public abstract Optional<BuildLabel> getBinary();

  public abstract Optional<BazelFileInfo> getBridgingHeader();

  public abstract ImmutableList<String> getCompilerDefines();

  public abstract ImmutableList<String> getCopts();

  public abstract ImmutableList<BazelFileInfo> getDatamodels();

  public abstract ImmutableList<String> getDefines();

  @Value.Default
  public boolean isEnableModules() {
    return false;
  }

  @Value.Default
  public boolean isHasSwiftDependency() {
    return false;
  }

  @Value.Default
  public boolean isHasSwiftInfo() {
    return false;
  }

  public abstract ImmutableList<String> getIncludes();

  public abstract Optional<BazelFileInfo> getLaunchStoryboard();

  public abstract Optional<BazelFileInfo> getPch();

  public abstract Optional<String> getSwiftLanguageVersion();

  public abstract Optional<String> getSwiftToolchain();

  public abstract ImmutableList<String> getSwiftcOpts();

  public abstract ImmutableList<BazelFileInfo> getSupportingFiles();

  public abstract Optional<BuildLabel> getTestHost();

  public abstract Optional<Boolean> getXctest();

  public abstract Optional<BuildLabel> getXctestApp();

  /** Labels of targets this rule must be linked against at test time, i.e. its test host. */
  public ImmutableSet<BuildLabel> getLinkedTargetLabels() {
    ImmutableSet.Builder<BuildLabel> labels = ImmutableSet.builder();
    getXctestApp().ifPresent(labels::add);
    getTestHost().ifPresent(labels::add);
    return labels.build();
  }
}
