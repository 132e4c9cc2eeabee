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

import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXContainerItemProxy;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXFileReference;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXNativeTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXReference;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXSourcesBuildPhase;
import com.facebook.xcodegen.apple.xcode.xcodeproj.ProductType;
import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.DottedVersion;
import com.facebook.xcodegen.model.PlatformType;
import com.facebook.xcodegen.model.RuleEntry;
import com.facebook.xcodegen.model.RuleEntryMap;
import com.facebook.xcodegen.model.RuleTypes;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Synthesizes the indexer targets of a project.
 *
 * <p>Indexer targets are never built. They exist so that Xcode indexes the sources of the Bazel
 * rules with the compiler flags Bazel would use. Rules are first registered, which records an
 * {@link IndexerData} for every rule with compilable sources. Registered indexers whose settings
 * agree are then merged and each survivor becomes one static library or framework target.
 */
public class IndexerSynthesizer {

  private static final Logger LOG = Logger.get(IndexerSynthesizer.class);

  static final DeploymentTarget DEFAULT_DEPLOYMENT_TARGET =
      DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("9.0"));

  private final PBXProject project;
  private final OptionSet options;
  private final ProjectFileReferences fileReferences;
  private final LocalizedMessageLogger localizedMessageLogger;

  private final Map<String, IndexerData> staticIndexers = new HashMap<>();
  private final Map<String, IndexerData> frameworkIndexers = new HashMap<>();

  /** Framework search paths of every rule already registered, including its dependencies. */
  private final Map<RuleEntry, ImmutableSet<String>> processedEntries = new HashMap<>();

  private final Map<String, PBXNativeTarget> indexerTargetsByName = new HashMap<>();
  private boolean generated;

  IndexerSynthesizer(
      PBXProject project,
      OptionSet options,
      ProjectFileReferences fileReferences,
      LocalizedMessageLogger localizedMessageLogger) {
    this.project = project;
    this.options = options;
    this.fileReferences = fileReferences;
    this.localizedMessageLogger = localizedMessageLogger;
  }

  /**
   * Registers {@code entry} and its transitive dependencies for indexing and creates file
   * references for the files they include. Rules that are tests, filegroups, direct dependencies
   * of tests or that have nothing to compile get no indexer.
   */
  public void registerRuleEntryForIndexer(
      RuleEntry entry, RuleEntryMap ruleEntryMap, PathFilter pathFilter) {
    Preconditions.checkState(!generated, "Indexer targets were already generated");
    Set<BuildLabel> labelsToSkip = new HashSet<>();
    addTestDependenciesToSkipList(entry, ruleEntryMap, labelsToSkip);
    registerRecursively(entry, ruleEntryMap, pathFilter, labelsToSkip);
  }

  /** Sources of the direct dependencies of tests are compiled by the test target instead. */
  private void addTestDependenciesToSkipList(
      RuleEntry entry, RuleEntryMap ruleEntryMap, Set<BuildLabel> labelsToSkip) {
    if (!entry.getProductType().map(ProductType::isTest).orElse(false)) {
      return;
    }
    for (BuildLabel dependency : entry.getDependencies()) {
      labelsToSkip.add(dependency);
      RuleEntry dependencyEntry = ruleEntryMap.entry(dependency, entry);
      if (dependencyEntry == null) {
        localizedMessageLogger.warning("UnknownTargetRule", dependency, entry.getLabel());
        continue;
      }
      addTestDependenciesToSkipList(dependencyEntry, ruleEntryMap, labelsToSkip);
    }
  }

  private ImmutableSet<String> registerRecursively(
      RuleEntry entry,
      RuleEntryMap ruleEntryMap,
      PathFilter pathFilter,
      Set<BuildLabel> labelsToSkip) {
    ImmutableSet<String> processed = processedEntries.get(entry);
    if (processed != null) {
      return processed;
    }
    Set<String> frameworkSearchPaths = new LinkedHashSet<>();
    ImmutableSet<String> result =
        registerEntry(entry, ruleEntryMap, pathFilter, labelsToSkip, frameworkSearchPaths);
    processedEntries.put(entry, result);
    return result;
  }

  private ImmutableSet<String> registerEntry(
      RuleEntry entry,
      RuleEntryMap ruleEntryMap,
      PathFilter pathFilter,
      Set<BuildLabel> labelsToSkip,
      Set<String> frameworkSearchPaths) {
    List<RuleEntry> resolvedDependencies = new ArrayList<>();
    for (BuildLabel dependency : entry.getDependencies()) {
      RuleEntry dependencyEntry = ruleEntryMap.entry(dependency, entry);
      if (dependencyEntry == null) {
        localizedMessageLogger.warning("UnknownTargetRule", dependency, entry.getLabel());
        continue;
      }
      resolvedDependencies.add(dependencyEntry);
      frameworkSearchPaths.addAll(
          registerRecursively(dependencyEntry, ruleEntryMap, pathFilter, labelsToSkip));
    }

    // Framework bundles are searched even when the path filters exclude them.
    for (BazelFileInfo frameworkImport : entry.getFrameworkImports()) {
      frameworkSearchPaths.add(
          BuildVariables.underVariable(
              BuildVariables.EXECUTION_ROOT,
              CompileSettings.parentPath(frameworkImport.getFullPath())));
    }

    List<BazelFileInfo> sources = filter(entry.getSourceFiles(), pathFilter);
    List<BazelFileInfo> nonArcSources = filter(entry.getNonARCSourceFiles(), pathFilter);
    List<BazelFileInfo> frameworks = filter(entry.getFrameworkImports(), pathFilter);
    List<BazelFileInfo> versionedFiles = filter(entry.getVersionedNonSourceArtifacts(), pathFilter);
    for (BazelFileInfo artifact : filter(entry.getNormalNonSourceArtifacts(), pathFilter)) {
      fileReferences.addNonSourceFileReference(artifact);
    }

    boolean hasFiles =
        !sources.isEmpty()
            || !nonArcSources.isEmpty()
            || !frameworks.isEmpty()
            || !versionedFiles.isEmpty();
    if (!hasFiles
        || entry.getProductType().map(ProductType::isTest).orElse(false)
        || RuleTypes.FILEGROUP.equals(entry.getType())
        || labelsToSkip.contains(entry.getLabel())) {
      fileReferences.addBuildFileReference(entry, pathFilter);
      return ImmutableSet.copyOf(frameworkSearchPaths);
    }

    CompileSettings compileSettings = CompileSettings.forRuleEntry(entry);

    Optional<BazelFileInfo> pchFile = entry.getAttributes().getPch();
    pchFile.filter(pathFilter::includes).ifPresent(fileReferences::addFileReference);
    Optional<BazelFileInfo> bridgingHeader = entry.getAttributes().getBridgingHeader();
    bridgingHeader.filter(pathFilter::includes).ifPresent(fileReferences::addFileReference);

    fileReferences.addBuildFileReference(entry, pathFilter);

    ImmutableList<PBXFileReference> nonArcReferences =
        fileReferences.createFileReferences(nonArcSources);
    List<PBXReference> buildPhaseReferences = new ArrayList<>();
    buildPhaseReferences.addAll(fileReferences.createVersionGroups(versionedFiles));
    buildPhaseReferences.addAll(fileReferences.createFileReferences(sources));
    buildPhaseReferences.addAll(fileReferences.createFileReferences(frameworks));
    buildPhaseReferences.addAll(nonArcReferences);
    PBXSourcesBuildPhase buildPhase =
        ProjectFileReferences.createSourcesBuildPhase(
            buildPhaseReferences, ImmutableSet.copyOf(nonArcReferences));
    if (buildPhase.getFiles().isEmpty()) {
      return ImmutableSet.copyOf(frameworkSearchPaths);
    }

    DeploymentTarget deploymentTarget;
    if (entry.getDeploymentTarget().isPresent()) {
      deploymentTarget = entry.getDeploymentTarget().get();
    } else {
      deploymentTarget = DEFAULT_DEPLOYMENT_TARGET;
      localizedMessageLogger.warning(
          "NoDeploymentTarget", entry.getLabel(), DEFAULT_DEPLOYMENT_TARGET.getLabel());
    }

    IndexerData data =
        IndexerData.builder()
            .addNameTokens(IndexerNameToken.forLabel(entry.getLabel()))
            .addAllDependencies(entry.getDependencies())
            .addAllResolvedDependencies(resolvedDependencies)
            .addAllPreprocessorDefines(compileSettings.getDefines())
            .addAllOtherCFlags(compileSettings.getOtherCFlags())
            .addAllOtherSwiftFlags(compileSettings.getOtherSwiftFlags())
            .addAllIncludes(compileSettings.getIncludes())
            .addAllFrameworkSearchPaths(frameworkSearchPaths)
            .addAllSwiftIncludePaths(compileSettings.getSwiftIncludePaths())
            .setDeploymentTarget(deploymentTarget)
            .setBuildPhase(buildPhase)
            .setPchFile(pchFile)
            .setBridgingHeader(bridgingHeader)
            .setSwiftLanguageVersion(entry.getSwiftLanguageVersion())
            .setEnableModules(entry.getAttributes().isEnableModules())
            .setFramework(entry.getAttributes().isHasSwiftInfo())
            .build();
    LOG.verbose("Registered %s for %s", data.getIndexerName(), entry.getLabel());
    if (data.isFramework()) {
      frameworkIndexers.put(data.getIndexerName(), data);
    } else {
      staticIndexers.put(data.getIndexerName(), data);
    }
    return ImmutableSet.copyOf(frameworkSearchPaths);
  }

  private static List<BazelFileInfo> filter(List<BazelFileInfo> infos, PathFilter pathFilter) {
    return infos.stream().filter(pathFilter::includes).collect(Collectors.toList());
  }

  /**
   * Merges the registered indexers and creates their targets. Returns the indexer targets keyed by
   * every name they answer to. May only be called once, after all rules have been registered.
   */
  public ImmutableMap<String, PBXNativeTarget> generateIndexerTargets() {
    Preconditions.checkState(!generated, "Indexer targets were already generated");
    generated = true;

    SortedMap<String, IndexerData> indexers = new TreeMap<>();
    indexers.putAll(mergeIndexers(staticIndexers.values()));
    indexers.putAll(mergeIndexers(frameworkIndexers.values()));
    LOG.debug(
        "Merged %d registered indexers into %d",
        staticIndexers.size() + frameworkIndexers.size(),
        indexers.size());

    for (Map.Entry<String, IndexerData> entry : indexers.entrySet()) {
      IndexerData data = entry.getValue();
      PBXNativeTarget target =
          project.createNativeTarget(
              entry.getKey(),
              null,
              data.isFramework() ? ProductType.FRAMEWORK : ProductType.STATIC_LIBRARY);
      target.getBuildPhases().add(data.getBuildPhase());
      addConfigsForIndexingTarget(target, data);
      for (String name : data.getSupportedIndexingTargets()) {
        indexerTargetsByName.put(name, target);
      }
    }

    for (IndexerData data : indexers.values()) {
      PBXNativeTarget target = indexerTargetsByName.get(data.getIndexerName());
      for (String dependencyName : data.getIndexerNamesForResolvedDependencies()) {
        PBXNativeTarget dependency = indexerTargetsByName.get(dependencyName);
        if (dependency == null) {
          // Dependencies without sources have no indexer.
          LOG.verbose("%s has no indexer target %s", target.getName(), dependencyName);
          continue;
        }
        if (dependency == target) {
          continue;
        }
        target.createDependencyOn(
            dependency, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);
      }
    }
    return ImmutableMap.copyOf(indexerTargetsByName);
  }

  /**
   * Greedily folds indexers with equal settings. Indexers are visited in reverse name order; each
   * one absorbs every remaining indexer it can merge with.
   */
  static ImmutableSortedMap<String, IndexerData> mergeIndexers(Iterable<IndexerData> indexers) {
    List<IndexerData> remaining = new ArrayList<>();
    indexers.forEach(remaining::add);
    remaining.sort(Comparator.comparing(IndexerData::getIndexerName));

    Map<String, IndexerData> merged = new LinkedHashMap<>();
    while (!remaining.isEmpty()) {
      IndexerData current = remaining.remove(remaining.size() - 1);
      List<IndexerData> unmerged = new ArrayList<>();
      for (IndexerData other : remaining) {
        if (current.canMergeWith(other)) {
          current = current.merging(other);
        } else {
          unmerged.add(other);
        }
      }
      merged.put(current.getIndexerName(), current);
      remaining = unmerged;
    }
    return ImmutableSortedMap.copyOf(merged);
  }

  private void addConfigsForIndexingTarget(PBXNativeTarget target, IndexerData data) {
    SortedMap<String, String> settings =
        new TreeMap<>(options.buildSettingsForTarget(target.getName()));
    settings.put("PRODUCT_NAME", target.getProductName());

    data.getPchFile()
        .ifPresent(pch -> settings.put("GCC_PREFIX_HEADER", projectReferencePath(pch)));

    List<String> otherCFlags = new ArrayList<>();
    for (String flag : data.getOtherCFlags()) {
      if (!flag.startsWith("-W")) {
        otherCFlags.add(flag);
      }
    }
    data.getPreprocessorDefines().stream()
        .sorted()
        .map(IndexerSynthesizer::defineFlag)
        .forEach(otherCFlags::add);
    if (!otherCFlags.isEmpty()) {
      settings.put("OTHER_CFLAGS", Joiner.on(' ').join(otherCFlags));
    }

    data.getBridgingHeader()
        .ifPresent(
            header -> settings.put("SWIFT_OBJC_BRIDGING_HEADER", projectReferencePath(header)));
    if (data.isEnableModules()) {
      settings.put("CLANG_ENABLE_MODULES", "YES");
    }
    if (!data.getIncludes().isEmpty()) {
      settings.put(
          "HEADER_SEARCH_PATHS", "$(inherited) " + Joiner.on(' ').join(data.getIncludes()) + " ");
    }
    if (!data.getFrameworkSearchPaths().isEmpty()) {
      settings.put(
          "FRAMEWORK_SEARCH_PATHS",
          "$(inherited) " + Joiner.on(' ').join(data.getFrameworkSearchPaths()));
    }
    if (!data.getSwiftIncludePaths().isEmpty()) {
      settings.put(
          "SWIFT_INCLUDE_PATHS",
          "$(inherited) " + Joiner.on(' ').join(data.getSwiftIncludePaths()));
    }
    if (!data.getOtherSwiftFlags().isEmpty()) {
      settings.put(
          "OTHER_SWIFT_FLAGS", "$(inherited) " + Joiner.on(' ').join(data.getOtherSwiftFlags()));
    }
    data.getSwiftLanguageVersion().ifPresent(version -> settings.put("SWIFT_VERSION", version));

    if (options.isEnabled(OptionKey.IMPROVED_IMPORT_AUTOCOMPLETION_FIX)
        && target.getProductType() == ProductType.STATIC_LIBRARY) {
      settings.put(
          "USER_HEADER_SEARCH_PATHS", BuildVariables.reference(BuildVariables.WORKSPACE_ROOT));
    }

    // Indexing uses the device SDK so Swift modules built for device are found.
    DeploymentTarget deploymentTarget = data.getDeploymentTarget();
    PlatformType platform = deploymentTarget.getPlatform();
    settings.put("SDKROOT", platform.getDeviceSdk());
    settings.put(
        platform.getDeploymentTargetBuildSetting(), deploymentTarget.getOsVersion().toString());

    BuildConfigurations.createBuildConfigurationsForList(
        target.getBuildConfigurationList(), settings);
  }

  /** Quotes defines containing whitespace, so {@code -Dfoo bar} becomes {@code -D"foo bar"}. */
  static String defineFlag(String define) {
    boolean quoted =
        (define.startsWith("\"") && define.endsWith("\""))
            || (define.startsWith("'") && define.endsWith("'"));
    if (!quoted && define.chars().anyMatch(Character::isWhitespace)) {
      return "-D\"" + define + "\"";
    }
    return "-D" + define;
  }

  /** Generated files are reached through the workspace, sources through the execution root. */
  static String projectReferencePath(BazelFileInfo info) {
    String variable =
        info.isSourceFile() ? BuildVariables.EXECUTION_ROOT : BuildVariables.WORKSPACE_ROOT;
    return BuildVariables.underVariable(variable, info.getFullPath());
  }

  /** Returns the indexer target covering {@code entry}, if one was generated. */
  public Optional<PBXNativeTarget> getIndexerTargetForRuleEntry(RuleEntry entry) {
    return Optional.ofNullable(
        indexerTargetsByName.get(
            IndexerData.indexerNameForRuleEntry(entry, DEFAULT_DEPLOYMENT_TARGET)));
  }

  /** Names of all indexer targets, including the names of merged rules. */
  public ImmutableSet<String> getIndexerTargetNames() {
    return ImmutableSet.copyOf(indexerTargetsByName.keySet());
  }
}
