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

import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXSourcesBuildPhase;
import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.RuleEntry;
import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything needed to create one indexer target: the sources of one or more rules that compile
 * with identical settings.
 */
@Value.Immutable
@XcodegenStyleImmutable
abstract class AbstractIndexerData {

  static final String TARGET_PREFIX = "_idx_";
  static final int MAX_NAME_LENGTH = 180;

  public abstract ImmutableList<IndexerNameToken> getNameTokens();

  public abstract ImmutableSet<BuildLabel> getDependencies();

  public abstract ImmutableSet<RuleEntry> getResolvedDependencies();

  public abstract ImmutableSet<String> getPreprocessorDefines();

  public abstract ImmutableList<String> getOtherCFlags();

  public abstract ImmutableList<String> getOtherSwiftFlags();

  public abstract ImmutableSet<String> getIncludes();

  public abstract ImmutableSet<String> getFrameworkSearchPaths();

  public abstract ImmutableSet<String> getSwiftIncludePaths();

  public abstract DeploymentTarget getDeploymentTarget();

  public abstract PBXSourcesBuildPhase getBuildPhase();

  public abstract Optional<BazelFileInfo> getPchFile();

  public abstract Optional<BazelFileInfo> getBridgingHeader();

  public abstract Optional<String> getSwiftLanguageVersion();

  public abstract boolean isEnableModules();

  /** Indexers of rules providing Swift modules are frameworks, all others static libraries. */
  public abstract boolean isFramework();

  /**
   * Returns {@code _idx_<name>_<hash>_<suffix>}. Names longer than {@link #MAX_NAME_LENGTH} are
   * truncated and marked with {@code _etc}.
   */
  static String indexerNameForTargetName(String targetName, int hash, String suffix) {
    String normalizedTargetName = targetName;
    if (targetName.length() > MAX_NAME_LENGTH) {
      normalizedTargetName = targetName.substring(0, MAX_NAME_LENGTH - 4) + "_etc";
    }
    return String.format("%s%s_%08X_%s", TARGET_PREFIX, normalizedTargetName, hash, suffix);
  }

  static String indexerNameForRuleEntry(RuleEntry entry, DeploymentTarget fallback) {
    IndexerNameToken token = IndexerNameToken.forLabel(entry.getLabel());
    return indexerNameForTargetName(
        token.getTargetName(),
        token.getLabelHash(),
        entry.getDeploymentTarget().orElse(fallback).getLabel());
  }

  @Value.Lazy
  public String getIndexerName() {
    StringBuilder name = new StringBuilder();
    int hash = 0;
    for (IndexerNameToken token : getNameTokens()) {
      if (name.length() > 0) {
        name.append('_');
      }
      name.append(token.getTargetName());
      hash += token.getLabelHash();
    }
    return indexerNameForTargetName(name.toString(), hash, getDeploymentTarget().getLabel());
  }

  /** Every name this indexer answers to: its own plus that of each rule it covers. */
  public ImmutableList<String> getSupportedIndexingTargets() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    names.add(getIndexerName());
    if (getNameTokens().size() > 1) {
      for (IndexerNameToken token : getNameTokens()) {
        names.add(
            indexerNameForTargetName(
                token.getTargetName(), token.getLabelHash(), getDeploymentTarget().getLabel()));
      }
    }
    return names.build();
  }

  /** Names of the indexers of the resolved dependencies, which this indexer depends on. */
  public ImmutableSet<String> getIndexerNamesForResolvedDependencies() {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (RuleEntry dependency : getResolvedDependencies()) {
      names.add(indexerNameForRuleEntry(dependency, getDeploymentTarget()));
    }
    return names.build();
  }

  /** Two indexers can share a target when all of their compile settings agree. */
  public boolean canMergeWith(IndexerData other) {
    return getPchFile().equals(other.getPchFile())
        && getBridgingHeader().equals(other.getBridgingHeader())
        && getPreprocessorDefines().equals(other.getPreprocessorDefines())
        && isEnableModules() == other.isEnableModules()
        && isFramework() == other.isFramework()
        && getSwiftLanguageVersion().equals(other.getSwiftLanguageVersion())
        && getOtherCFlags().equals(other.getOtherCFlags())
        && getOtherSwiftFlags().equals(other.getOtherSwiftFlags())
        && getFrameworkSearchPaths().equals(other.getFrameworkSearchPaths())
        && getIncludes().equals(other.getIncludes())
        && getSwiftIncludePaths().equals(other.getSwiftIncludePaths())
        && getDeploymentTarget().equals(other.getDeploymentTarget());
  }

  /** Returns an indexer compiling the sources of this indexer, then those of {@code other}. */
  public IndexerData merging(IndexerData other) {
    PBXSourcesBuildPhase buildPhase = new PBXSourcesBuildPhase();
    buildPhase.getFiles().addAll(getBuildPhase().getFiles());
    buildPhase.getFiles().addAll(other.getBuildPhase().getFiles());
    return IndexerData.builder()
        .from(this)
        .addAllNameTokens(other.getNameTokens())
        .addAllDependencies(other.getDependencies())
        .addAllResolvedDependencies(other.getResolvedDependencies())
        .setBuildPhase(buildPhase)
        .build();
  }
}
