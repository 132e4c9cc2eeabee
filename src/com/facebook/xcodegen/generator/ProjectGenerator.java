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

import com.facebook.xcodegen.apple.xcode.GidGenerator;
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXNativeTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.RuleEntry;
import com.facebook.xcodegen.model.RuleEntryMap;
import com.facebook.xcodegen.model.RuleTypes;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one generation pass: resolves the selected labels, synthesizes indexer and product targets
 * and writes {@code <outputFolder>/<projectName>.xcodeproj/project.pbxproj}.
 */
public class ProjectGenerator {

  private static final Logger LOG = Logger.get(ProjectGenerator.class);

  public static final String GENERATOR_VERSION = "1.0";

  static final String SWIFT_UPDATE_CHECK_VERSION = "0710";

  private final GeneratorConfig config;
  private final WorkspaceInfoExtractor workspaceInfoExtractor;
  private final LocalizedMessageLogger localizedMessageLogger;
  private final Path workspaceRoot;
  private final Path outputFolder;
  private final Optional<WorkspacePathInfoFetcher> workspacePathInfoFetcher;

  public ProjectGenerator(
      GeneratorConfig config,
      WorkspaceInfoExtractor workspaceInfoExtractor,
      LocalizedMessageLogger localizedMessageLogger,
      Path workspaceRoot,
      Path outputFolder,
      Optional<WorkspacePathInfoFetcher> workspacePathInfoFetcher) {
    this.config = config;
    this.workspaceInfoExtractor = workspaceInfoExtractor;
    this.localizedMessageLogger = localizedMessageLogger;
    this.workspaceRoot = workspaceRoot;
    this.outputFolder = outputFolder;
    this.workspacePathInfoFetcher = workspacePathInfoFetcher;
  }

  /**
   * Generates and writes the project.
   *
   * @return the path of the written {@code .xcodeproj} bundle
   */
  public Path generate() throws IOException, ProjectGenerationException {
    workspacePathInfoFetcher.ifPresent(WorkspacePathInfoFetcher::start);

    RuleEntryMap ruleEntryMap = new RuleEntryMap(workspaceInfoExtractor.extractRuleEntries());
    List<RuleEntry> selectedEntries = resolveSelectedEntries(ruleEntryMap);
    localizedMessageLogger.info(
        "GeneratingProject", config.getProjectName(), selectedEntries.size());

    LocalizedMessageLogger.ProfilingToken profilingToken =
        localizedMessageLogger.startProfiling("Generating " + config.getProjectName());
    PBXProject project = generateProject(selectedEntries, ruleEntryMap);
    localizedMessageLogger.logProfilingEnd(profilingToken);

    Path bundlePath = writeProject(project);
    if (workspacePathInfoFetcher.isPresent()) {
      linkBazelPaths(bundlePath, workspacePathInfoFetcher.get());
    }
    localizedMessageLogger.info("GeneratedProject", bundlePath);
    return bundlePath;
  }

  /** Builds the project model without writing it. */
  PBXProject generateProject(List<RuleEntry> selectedEntries, RuleEntryMap ruleEntryMap)
      throws ProjectGenerationException {
    OptionSet options = config.getOptions();
    PBXProject project =
        new PBXProject(
            config.getProjectName(),
            TargetGenerator.mainGroupForOutputFolder(outputFolder, workspaceRoot));
    if (options.isEnabled(OptionKey.SUPPRESS_SWIFT_UPDATE_CHECK)) {
      project.setLastSwiftUpdateCheck(SWIFT_UPDATE_CHECK_VERSION);
    }

    ProjectFileReferences fileReferences =
        new ProjectFileReferences(project, workspaceRoot, localizedMessageLogger);
    IndexerSynthesizer indexerSynthesizer =
        new IndexerSynthesizer(project, options, fileReferences, localizedMessageLogger);
    TargetGenerator targetGenerator =
        new TargetGenerator(
            project,
            options,
            indexerSynthesizer,
            fileReferences,
            localizedMessageLogger,
            config.getBazelPath(),
            config.getBazelBinPath(),
            config.getBuildScriptPath(),
            GENERATOR_VERSION);

    PathFilter pathFilter = PathFilter.of(config.getPathFilters());
    for (RuleEntry entry : selectedEntries) {
      indexerSynthesizer.registerRuleEntryForIndexer(entry, ruleEntryMap, pathFilter);
    }
    ImmutableMap<String, PBXNativeTarget> indexerTargets =
        indexerSynthesizer.generateIndexerTargets();
    LOG.debug("Generated %d indexer targets", indexerTargets.size());

    targetGenerator.generateBazelCleanTarget(
        config.getCleanScriptPath(),
        TargetGenerator.workingDirectoryForPBXGroup(project.getMainGroup()),
        options.getArguments(OptionKey.PROJECT_GENERATION_BAZEL_STARTUP_OPTIONS));
    targetGenerator.generateTopLevelBuildConfigurations(ImmutableMap.of());

    PathFilter testPathFilter =
        options.isEnabled(OptionKey.PATH_FILTERS_APPLY_TO_TEST_SOURCES)
            ? pathFilter
            : PathFilter.acceptAll();
    targetGenerator.generateBuildTargetsForRuleEntries(
        selectedEntries, ruleEntryMap, testPathFilter);

    targetGenerator.generateFileReferencesForFilePaths(
        config.getAdditionalFilePaths(), PathFilter.acceptAll());
    return project;
  }

  /**
   * Looks up the entries of the selected labels, expanding test suites into their members and
   * adding placeholder hosts for tests whose host was not selected. {@code ruleEntryMap} receives
   * the placeholders.
   *
   * @throws ProjectGenerationException if a selected label has no entry
   */
  List<RuleEntry> resolveSelectedEntries(RuleEntryMap ruleEntryMap)
      throws ProjectGenerationException {
    List<BuildLabel> unresolvedLabels = new ArrayList<>();
    Map<BuildLabel, RuleEntry> selectedEntries = new LinkedHashMap<>();
    for (BuildLabel label : config.getBuildTargetLabels()) {
      RuleEntry entry = ruleEntryMap.anyEntry(label);
      if (entry == null) {
        unresolvedLabels.add(label);
        continue;
      }
      if (entry.getType().equals(RuleTypes.TEST_SUITE)) {
        expandTestSuite(entry, ruleEntryMap, selectedEntries, new HashSet<>());
      } else {
        selectedEntries.put(label, entry);
      }
    }
    if (!unresolvedLabels.isEmpty()) {
      String message =
          localizedMessageLogger
              .error("LabelResolutionFailed", Joiner.on(", ").join(unresolvedLabels))
              .getMessage();
      throw new ProjectGenerationException(
          ProjectGenerationException.Kind.LABEL_RESOLUTION_FAILED, message);
    }

    for (RuleEntry entry : ImmutableList.copyOf(selectedEntries.values())) {
      Optional<BuildLabel> testHost = TargetGenerator.getTestHostLabel(entry);
      if (!testHost.isPresent() || selectedEntries.containsKey(testHost.get())) {
        continue;
      }
      localizedMessageLogger.warning("MissingTestHost", entry.getLabel(), testHost.get());
      RuleEntry placeholder = createTestHostPlaceholder(testHost.get(), entry, ruleEntryMap);
      ruleEntryMap.insert(placeholder);
      selectedEntries.put(testHost.get(), placeholder);
    }
    return ImmutableList.copyOf(selectedEntries.values());
  }

  private void expandTestSuite(
      RuleEntry testSuite,
      RuleEntryMap ruleEntryMap,
      Map<BuildLabel, RuleEntry> selectedEntries,
      Set<BuildLabel> expandedSuites) {
    if (!expandedSuites.add(testSuite.getLabel())) {
      return;
    }
    for (BuildLabel member : testSuite.getWeakDependencies()) {
      RuleEntry memberEntry = ruleEntryMap.entry(member, testSuite);
      if (memberEntry == null) {
        localizedMessageLogger.warning(
            "TestSuiteMemberResolutionFailed", member, testSuite.getLabel());
        continue;
      }
      if (memberEntry.getType().equals(RuleTypes.TEST_SUITE)) {
        expandTestSuite(memberEntry, ruleEntryMap, selectedEntries, expandedSuites);
      } else {
        selectedEntries.putIfAbsent(member, memberEntry);
      }
    }
  }

  /**
   * The host stands in for an unselected application. It is built with the test's configuration
   * and reuses what the extractor knows about the real host, minus its sources.
   */
  private static RuleEntry createTestHostPlaceholder(
      BuildLabel hostLabel, RuleEntry test, RuleEntryMap ruleEntryMap) {
    RuleEntry.Builder builder =
        RuleEntry.builder().setLabel(hostLabel).setType(RuleTypes.TEST_HOST_PLACEHOLDER);
    Optional<DeploymentTarget> deploymentTarget = test.getDeploymentTarget();
    RuleEntry knownHost = ruleEntryMap.entry(hostLabel, test);
    if (knownHost != null) {
      builder.setBundleId(knownHost.getBundleId()).setBundleName(knownHost.getBundleName());
      if (knownHost.getDeploymentTarget().isPresent()) {
        deploymentTarget = knownHost.getDeploymentTarget();
      }
    }
    return builder.setDeploymentTarget(deploymentTarget).build();
  }

  private Path writeProject(PBXProject project) throws ProjectGenerationException {
    Path bundlePath = outputFolder.resolve(config.getProjectName() + ".xcodeproj");
    Path projectFile = bundlePath.resolve("project.pbxproj");
    String contents;
    try {
      XcodeprojSerializer serializer = new XcodeprojSerializer(new GidGenerator(), project);
      contents = serializer.toOpenStepString();
    } catch (RuntimeException e) {
      throw new ProjectGenerationException(
          ProjectGenerationException.Kind.SERIALIZATION_FAILED,
          String.format("Failed to serialize %s: %s", config.getProjectName(), e.getMessage()),
          e);
    }
    try {
      Files.createDirectories(bundlePath);
      LOG.debug("Writing %s", projectFile);
      MoreFiles.asCharSink(projectFile, StandardCharsets.UTF_8).write(contents);
    } catch (IOException e) {
      throw new ProjectGenerationException(
          ProjectGenerationException.Kind.SERIALIZATION_FAILED,
          String.format("Failed to write %s: %s", projectFile, e.getMessage()),
          e);
    }
    return bundlePath;
  }

  /** Points the bundle's execution root and output base symlinks at what Bazel reported. */
  private static void linkBazelPaths(Path bundlePath, WorkspacePathInfoFetcher fetcher)
      throws IOException {
    createSymlink(
        bundlePath.resolve(BuildVariables.EXECUTION_ROOT_SYMLINK_PATH),
        Paths.get(fetcher.getExecutionRoot()));
    createSymlink(
        bundlePath.resolve(BuildVariables.OUTPUT_BASE_SYMLINK_PATH),
        Paths.get(fetcher.getOutputBase()));
  }

  private static void createSymlink(Path link, Path target) throws IOException {
    Preconditions.checkNotNull(link.getParent());
    Files.createDirectories(link.getParent());
    Files.deleteIfExists(link);
    LOG.debug("Linking %s to %s", link, target);
    Files.createSymbolicLink(link, target);
  }
}
