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
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXGroup;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXLegacyTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXNativeTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXShellScriptBuildPhase;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.ProductType;
import com.facebook.xcodegen.apple.xcode.xcodeproj.SourceTree;
import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.RuleEntry;
import com.facebook.xcodegen.model.RuleEntryMap;
import com.facebook.xcodegen.model.RuleTypes;
import com.facebook.xcodegen.util.Escaper;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.io.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Creates the targets of a project that Xcode builds: one native target per selected rule, whose
 * only build phase runs the build script with the rule's label, and a legacy target running
 * {@code bazel clean} that every other target depends on.
 */
public class TargetGenerator {

  private static final Logger LOG = Logger.get(TargetGenerator.class);

  static final String BAZEL_CLEAN_TARGET_NAME = "_bazel_clean_";
  static final String WATCH_EXTENSION_TARGET_PREFIX = "_tulsi_appex_";

  private static final String SHELL_PATH = "/bin/bash";

  private static final ImmutableSet<String> TEST_SUPPRESSED_SETTINGS =
      ImmutableSet.of("ARCHS", "VALID_ARCHS");

  private static final String SWIFT_DUMMY_FILES_SCRIPT =
      "# Script to generate specific Swift files Xcode expects when running tests.\n"
          + "set -eu\n"
          + "ARCH_ARRAY=($ARCHS)\n"
          + "SUFFIXES=(swiftdoc swiftmodule)\n"
          + "for ARCH in \"${ARCH_ARRAY[@]}\"\n"
          + "do\n"
          + "  mkdir -p \"$OBJECT_FILE_DIR_normal/$ARCH/\"\n"
          + "  touch \"$OBJECT_FILE_DIR_normal/$ARCH/$SWIFT_OBJC_INTERFACE_HEADER_NAME\"\n"
          + "  for SUFFIX in \"${SUFFIXES[@]}\"\n"
          + "  do\n"
          + "    touch \"$OBJECT_FILE_DIR_normal/$ARCH/$PRODUCT_MODULE_NAME.$SUFFIX\"\n"
          + "  done\n"
          + "done\n";

  private static final String OBJC_DUMMY_FILES_SCRIPT =
      "# Script to generate dependency files Xcode expects when running tests.\n"
          + "set -eu\n"
          + "ARCH_ARRAY=($ARCHS)\n"
          + "FILES=(%s)\n"
          + "for ARCH in \"${ARCH_ARRAY[@]}\"\n"
          + "do\n"
          + "  mkdir -p \"$OBJECT_FILE_DIR_normal/$ARCH/\"\n"
          + "  rm -f \"$OBJECT_FILE_DIR_normal/$ARCH/${PRODUCT_NAME}_dependency_info.dat\"\n"
          + "  printf '\\x00\\x31\\x00' "
          + ">\"$OBJECT_FILE_DIR_normal/$ARCH/${PRODUCT_NAME}_dependency_info.dat\"\n"
          + "  for FILE in \"${FILES[@]}\"\n"
          + "  do\n"
          + "    touch \"$OBJECT_FILE_DIR_normal/$ARCH/$FILE.d\"\n"
          + "  done\n"
          + "done\n";

  private final PBXProject project;
  private final OptionSet options;
  private final IndexerSynthesizer indexerSynthesizer;
  private final ProjectFileReferences fileReferences;
  private final LocalizedMessageLogger localizedMessageLogger;
  private final String bazelPath;
  private final String bazelBinPath;
  private final String generatorVersion;
  private final BuildCommandline buildCommandline;

  @Nullable private PBXLegacyTarget bazelCleanTarget;

  TargetGenerator(
      PBXProject project,
      OptionSet options,
      IndexerSynthesizer indexerSynthesizer,
      ProjectFileReferences fileReferences,
      LocalizedMessageLogger localizedMessageLogger,
      String bazelPath,
      String bazelBinPath,
      String buildScriptPath,
      String generatorVersion) {
    this.project = project;
    this.options = options;
    this.indexerSynthesizer = indexerSynthesizer;
    this.fileReferences = fileReferences;
    this.localizedMessageLogger = localizedMessageLogger;
    this.bazelPath = bazelPath;
    this.bazelBinPath = bazelBinPath;
    this.generatorVersion = generatorVersion;
    this.buildCommandline = new BuildCommandline(buildScriptPath, bazelPath, bazelBinPath, options);
  }

  /** Adds references to workspace files that no target uses. */
  public void generateFileReferencesForFilePaths(Iterable<String> paths, PathFilter pathFilter) {
    List<String> includedPaths = new ArrayList<>();
    for (String path : paths) {
      if (pathFilter.includes(path)) {
        includedPaths.add(path);
      }
    }
    project.getOrCreateGroupsAndFileReferencesForPaths(includedPaths);
  }

  /**
   * Adds the legacy target running the clean script and makes every existing target depend on it
   * first. Targets created later get the same dependency. May only be called once.
   */
  public void generateBazelCleanTarget(
      String scriptPath, String workingDirectory, List<String> startupOptions) {
    Preconditions.checkState(bazelCleanTarget == null, "The clean target was already generated");
    List<String> arguments = new ArrayList<>();
    arguments.add(bazelPath);
    arguments.add(bazelBinPath);
    arguments.addAll(startupOptions);
    String buildArguments =
        arguments.stream().map(argument -> "\"" + argument + "\"").collect(Collectors.joining(" "));

    bazelCleanTarget =
        project.createLegacyTarget(
            BAZEL_CLEAN_TARGET_NAME, scriptPath, buildArguments, workingDirectory);
    for (PBXTarget target : project.getTargets()) {
      if (target == bazelCleanTarget) {
        continue;
      }
      target.createDependencyOn(
          bazelCleanTarget, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project, true);
    }
  }

  /** Sets the project level build configurations. */
  public void generateTopLevelBuildConfigurations(Map<String, String> buildSettingOverrides) {
    SortedMap<String, String> settings = new TreeMap<>(options.commonBuildSettings());
    settings.putAll(buildSettingOverrides);

    settings.put("ONLY_ACTIVE_ARCH", "YES");
    settings.put("ENABLE_TESTABILITY", "YES");
    // Bazel compiles with ARC unless a file is listed in non_arc_srcs.
    settings.put("CLANG_ENABLE_OBJC_ARC", "YES");
    // Bazel signs the products.
    settings.put("CODE_SIGNING_REQUIRED", "NO");
    settings.put("CODE_SIGN_IDENTITY", "");
    // Lets live issues resolve XCTest.
    settings.put("FRAMEWORK_SEARCH_PATHS", "$(PLATFORM_DIR)/Developer/Library/Frameworks");
    // Bazel already packages the Swift runtime.
    settings.put("DONT_RUN_SWIFT_STDLIB_TOOL", "YES");

    String sourceDirectory = workingDirectoryForPBXGroup(project.getMainGroup());
    if (sourceDirectory.isEmpty()) {
      sourceDirectory = "$(SRCROOT)";
    }
    settings.put(BuildVariables.WORKSPACE_ROOT, sourceDirectory);

    String executionRoot = "$(PROJECT_FILE_PATH)/" + BuildVariables.EXECUTION_ROOT_SYMLINK_PATH;
    settings.put(BuildVariables.EXECUTION_ROOT, executionRoot);
    settings.put(BuildVariables.EXECUTION_ROOT_LEGACY, executionRoot);
    settings.put(
        BuildVariables.OUTPUT_BASE,
        "$(PROJECT_FILE_PATH)/" + BuildVariables.OUTPUT_BASE_SYMLINK_PATH);

    settings.put("TULSI_VERSION", generatorVersion);
    settings.put("PYTHONIOENCODING", "utf8");

    settings.put(
        "HEADER_SEARCH_PATHS",
        Joiner.on(' ')
            .join(
                BuildVariables.reference(BuildVariables.EXECUTION_ROOT),
                BuildVariables.underVariable(BuildVariables.WORKSPACE_ROOT, bazelBinPath),
                BuildVariables.underVariable(BuildVariables.WORKSPACE_ROOT, getBazelGenfilesPath()),
                BuildVariables.underVariable(
                    BuildVariables.EXECUTION_ROOT, BuildVariables.INCLUDES_PATH)));

    BuildConfigurations.createBuildConfigurationsForList(
        project.getBuildConfigurationList(), settings);
    BuildConfigurations.addTestRunnerBuildConfigurations(project.getBuildConfigurationList());
  }

  private String getBazelGenfilesPath() {
    return bazelBinPath.replace("-bin", "-genfiles");
  }

  /**
   * Creates a target for each of {@code entries}, then links tests to their hosts and watch
   * applications to their extensions.
   *
   * @param testPathFilter filters the sources compiled by test targets
   * @return the generated targets keyed by label
   * @throws ProjectGenerationException if a rule has no Xcode product type
   */
  public ImmutableMap<BuildLabel, PBXNativeTarget> generateBuildTargetsForRuleEntries(
      Collection<RuleEntry> entries, RuleEntryMap ruleEntryMap, PathFilter testPathFilter)
      throws ProjectGenerationException {
    ImmutableSortedMap<String, RuleEntry> namedEntries = generateUniqueNamesForRuleEntries(entries);

    List<TestLinkage> testLinkages = new ArrayList<>();
    Map<String, RuleEntry> watchApplications = new LinkedHashMap<>();
    Map<RuleEntry, PBXNativeTarget> watchExtensionsByEntry = new LinkedHashMap<>();
    Map<BuildLabel, PBXNativeTarget> targetsByLabel = new LinkedHashMap<>();

    for (Map.Entry<String, RuleEntry> namedEntry : namedEntries.entrySet()) {
      String name = namedEntry.getKey();
      RuleEntry entry = namedEntry.getValue();
      PBXNativeTarget target = createBuildTargetForRuleEntry(entry, name, ruleEntryMap);
      targetsByLabel.put(entry.getLabel(), target);

      Optional<String> preBuildScript =
          options.get(OptionKey.PRE_BUILD_PHASE_RUN_SCRIPT, entry.getLabel().getValue());
      if (preBuildScript.isPresent()) {
        target
            .getBuildPhases()
            .add(0, createShellScriptPhase("Pre-build Run Script", preBuildScript.get()));
      }
      Optional<String> postBuildScript =
          options.get(OptionKey.POST_BUILD_PHASE_RUN_SCRIPT, entry.getLabel().getValue());
      if (postBuildScript.isPresent()) {
        target
            .getBuildPhases()
            .add(createShellScriptPhase("Post-build Run Script", postBuildScript.get()));
      }

      Optional<BuildLabel> testHost = getTestHostLabel(entry);
      if (testHost.isPresent()) {
        testLinkages.add(new TestLinkage(target, testHost.get(), entry));
      } else if (target.getProductType() == ProductType.UNIT_TEST) {
        // A unit test without a host is a library test.
        testLinkages.add(new TestLinkage(target, null, entry));
      }

      if (target.getProductType().isWatchApplication()) {
        watchApplications.put(name, entry);
      } else if (target.getProductType() == ProductType.WATCH2_EXTENSION) {
        watchExtensionsByEntry.put(entry, target);
      }
    }

    for (RuleEntry watchApplication : watchApplications.values()) {
      linkWatchApplication(
          targetsByLabel.get(watchApplication.getLabel()),
          watchApplication,
          ruleEntryMap,
          watchExtensionsByEntry);
    }

    for (TestLinkage linkage : testLinkages) {
      PBXNativeTarget hostTarget = null;
      if (linkage.hostLabel != null) {
        hostTarget = targetsByLabel.get(linkage.hostLabel);
        if (hostTarget == null) {
          localizedMessageLogger.warning(
              "MissingTestHost", linkage.entry.getLabel(), linkage.hostLabel);
          continue;
        }
      }
      updateTestTarget(linkage.target, hostTarget, linkage.entry, testPathFilter);
    }
    return ImmutableMap.copyOf(targetsByLabel);
  }

  /** The host of an XCTest bundle, from {@code test_host} or the older {@code xctest_app}. */
  static Optional<BuildLabel> getTestHostLabel(RuleEntry entry) {
    Optional<BuildLabel> testHost = entry.getAttributes().getTestHost();
    if (testHost.isPresent()) {
      return testHost;
    }
    return entry.getAttributes().getXctestApp();
  }

  private PBXNativeTarget createBuildTargetForRuleEntry(
      RuleEntry entry, String name, RuleEntryMap ruleEntryMap) throws ProjectGenerationException {
    Optional<ProductType> productType = entry.getProductType();
    if (!productType.isPresent()) {
      throw new ProjectGenerationException(
          ProjectGenerationException.Kind.UNSUPPORTED_TARGET_TYPE,
          localizedMessageLogger
              .error("UnsupportedTargetType", entry.getType(), entry.getLabel())
              .getMessage());
    }
    PBXNativeTarget target =
        project.createNativeTarget(
            name, entry.getDeploymentTarget().orElse(null), productType.get());
    for (BazelFileInfo artifact : entry.getSecondaryArtifacts()) {
      project.createProductReference(artifact.getFullPath());
    }

    SortedMap<String, String> settings = new TreeMap<>(options.buildSettingsForTarget(name));
    settings.put("TULSI_BUILD_PATH", entry.getLabel().getPackageName());
    settings.put("PRODUCT_NAME", name);
    entry.getBundleId().ifPresent(bundleId -> settings.put("PRODUCT_BUNDLE_IDENTIFIER", bundleId));
    entry.getXcodeSdkRoot().ifPresent(sdkRoot -> settings.put("SDKROOT", sdkRoot));
    // An invalid launch image suppresses the warning about missing launch images.
    settings.put("ASSETCATALOG_COMPILER_LAUNCHIMAGE_NAME", "Stub Launch Image");
    entry
        .getDeploymentTarget()
        .ifPresent(
            deploymentTarget ->
                settings.put(
                    deploymentTarget.getPlatform().getDeploymentTargetBuildSetting(),
                    deploymentTarget.getOsVersion().toString()));

    // watchOS 1 apps are a specialization of an iOS target.
    if (productType.get() == ProductType.WATCH1_APPLICATION) {
      settings.put("TARGETED_DEVICE_FAMILY", "4");
      settings.put("TARGETED_DEVICE_FAMILY[sdk=iphonesimulator*]", "1,4");
    }

    settings.put(
        "DEBUG_INFORMATION_FORMAT",
        dependsOnRuleType(entry, RuleTypes.SWIFT_LIBRARY, ruleEntryMap)
            ? "dwarf-with-dsym"
            : "dwarf");
    settings.put("BAZEL_TARGET", entry.getLabel().getValue());

    BuildConfigurations.createBuildConfigurationsForList(
        target.getBuildConfigurationList(), settings);
    BuildConfigurations.addTestRunnerBuildConfigurations(target.getBuildConfigurationList());

    target.getBuildPhases().add(createBuildPhaseForRuleEntry(entry));

    if (bazelCleanTarget != null) {
      target.createDependencyOn(
          bazelCleanTarget, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project, true);
    }
    return target;
  }

  /** Returns true if any transitive dependency of {@code entry} is of {@code ruleType}. */
  private static boolean dependsOnRuleType(
      RuleEntry entry, String ruleType, RuleEntryMap ruleEntryMap) {
    Set<RuleEntry> visited = new HashSet<>();
    List<RuleEntry> toVisit = new ArrayList<>();
    toVisit.add(entry);
    while (!toVisit.isEmpty()) {
      RuleEntry current = toVisit.remove(toVisit.size() - 1);
      for (BuildLabel dependency : current.getDependencies()) {
        RuleEntry dependencyEntry = ruleEntryMap.entry(dependency, current);
        if (dependencyEntry == null || !visited.add(dependencyEntry)) {
          continue;
        }
        if (ruleType.equals(dependencyEntry.getType())) {
          return true;
        }
        toVisit.add(dependencyEntry);
      }
    }
    return false;
  }

  private PBXShellScriptBuildPhase createBuildPhaseForRuleEntry(RuleEntry entry) {
    String workingDirectory = workingDirectoryForPBXGroup(project.getMainGroup());
    String changeDirectoryAction =
        workingDirectory.isEmpty() ? "" : String.format("cd \"%s\"", workingDirectory);
    String shellScript =
        String.format(
            "set -e\n%s\nexec %s",
            changeDirectoryAction, buildCommandline.forTarget(entry.getLabel()));

    PBXShellScriptBuildPhase buildPhase =
        createShellScriptPhase("build " + entry.getLabel(), shellScript);
    // Running after Info.plist processing lets the build script replace the processed plist.
    buildPhase.getInputPaths().add("$(TARGET_BUILD_DIR)/$(INFOPLIST_PATH)");
    return buildPhase;
  }

  private static PBXShellScriptBuildPhase createShellScriptPhase(String name, String script) {
    PBXShellScriptBuildPhase phase = new PBXShellScriptBuildPhase();
    phase.setName(name);
    phase.setShellPath(SHELL_PATH);
    phase.setShellScript(script);
    phase.setShowEnvVarsInLog(true);
    return phase;
  }

  /**
   * Makes a watch application depend on the targets of its extensions. When no extension target
   * was generated, a stub extension target is added so Xcode can still launch the application.
   */
  private void linkWatchApplication(
      PBXNativeTarget watchTarget,
      RuleEntry watchEntry,
      RuleEntryMap ruleEntryMap,
      Map<RuleEntry, PBXNativeTarget> watchExtensionsByEntry) {
    boolean linked = false;
    for (BuildLabel extension : watchEntry.getExtensions()) {
      RuleEntry extensionEntry = ruleEntryMap.entry(extension, watchEntry);
      if (extensionEntry == null) {
        localizedMessageLogger.warning("FindingWatchExtensionFailed", extension);
        continue;
      }
      if (extensionEntry.getProductType().orElse(null) != ProductType.WATCH2_EXTENSION) {
        continue;
      }
      PBXNativeTarget extensionTarget = watchExtensionsByEntry.get(extensionEntry);
      if (extensionTarget == null) {
        localizedMessageLogger.warning("FindingWatchExtensionFailed", extensionEntry.getLabel());
        continue;
      }
      watchTarget.createDependencyOn(
          extensionTarget, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);
      linked = true;
    }
    if (!linked) {
      createWatchExtensionStubTarget(watchTarget, watchEntry);
    }
  }

  private void createWatchExtensionStubTarget(PBXNativeTarget watchTarget, RuleEntry watchEntry) {
    ProductType extensionType =
        watchTarget.getProductType().getWatchApplicationExtensionType().get();
    String name = WATCH_EXTENSION_TARGET_PREFIX + watchTarget.getName();
    PBXNativeTarget extensionTarget =
        project.createNativeTarget(
            name, watchEntry.getDeploymentTarget().orElse(null), extensionType);

    SortedMap<String, String> settings = new TreeMap<>();
    settings.put("PRODUCT_NAME", name);
    watchEntry.getXcodeSdkRoot().ifPresent(sdkRoot -> settings.put("SDKROOT", sdkRoot));
    watchEntry
        .getBundleId()
        .ifPresent(
            bundleId ->
                settings.put("PRODUCT_BUNDLE_IDENTIFIER", bundleId + ".watchkitextension"));
    settings.put("BAZEL_TARGET", watchEntry.getLabel().getValue());
    BuildConfigurations.createBuildConfigurationsForList(
        extensionTarget.getBuildConfigurationList(), settings);

    if (bazelCleanTarget != null) {
      extensionTarget.createDependencyOn(
          bazelCleanTarget, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project, true);
    }
    watchTarget.createBuildActionDependencyOn(extensionTarget);
    LOG.debug("Added stub watch extension %s", name);
  }

  private void updateTestTarget(
      PBXNativeTarget target,
      @Nullable PBXNativeTarget hostTarget,
      RuleEntry entry,
      PathFilter pathFilter) {
    if (hostTarget != null) {
      project.linkTestTarget(target, hostTarget);
    }

    SortedMap<String, String> testSettings = targetTestSettings(target, hostTarget, entry);
    BuildConfigurations.updateMissingBuildConfigurationsForList(
        target.getBuildConfigurationList(),
        testSettings,
        indexerSynthesizer
            .getIndexerTargetForRuleEntry(entry)
            .map(PBXTarget::getBuildConfigurationList)
            .orElse(null),
        TEST_SUPPRESSED_SETTINGS);

    updateTestTargetBuildPhases(target, entry, pathFilter);
  }

  private SortedMap<String, String> targetTestSettings(
      PBXNativeTarget target, @Nullable PBXNativeTarget hostTarget, RuleEntry entry) {
    SortedMap<String, String> settings = new TreeMap<>();
    settings.put("TULSI_TEST_RUNNER_ONLY", "YES");

    DeploymentTarget deploymentTarget = target.getDeploymentTarget();
    if (hostTarget != null && deploymentTarget != null) {
      PBXFileReference hostProduct = hostTarget.getProductReference();
      String hostProductName = hostTarget.getProductName();
      if (target.getProductType() == ProductType.UI_TEST) {
        settings.put("TEST_TARGET_NAME", hostProductName);
      } else {
        Optional<String> testHostPath =
            deploymentTarget.getPlatform().getTestHostPath(hostProduct.getPath(), hostProductName);
        if (testHostPath.isPresent()) {
          settings.put("BUNDLE_LOADER", "$(TEST_HOST)");
          settings.put("TEST_HOST", testHostPath.get());
        }
      }
    }

    CompileSettings compileSettings = CompileSettings.forRuleEntry(entry);
    if (!compileSettings.getIncludes().isEmpty()) {
      settings.put(
          "HEADER_SEARCH_PATHS",
          "$(inherited) " + Joiner.on(' ').join(compileSettings.getIncludes()));
    }
    if (!compileSettings.getSwiftIncludePaths().isEmpty()) {
      settings.put(
          "SWIFT_INCLUDE_PATHS",
          "$(inherited) " + Joiner.on(' ').join(compileSettings.getSwiftIncludePaths()));
    }
    if (!compileSettings.getOtherSwiftFlags().isEmpty()) {
      settings.put(
          "OTHER_SWIFT_FLAGS",
          "$(inherited) " + Joiner.on(' ').join(compileSettings.getOtherSwiftFlags()));
    }
    entry.getModuleName().ifPresent(moduleName -> settings.put("PRODUCT_MODULE_NAME", moduleName));
    return settings;
  }

  /**
   * Gives a test target the sources of its rule, so they are indexed with the test, and the
   * phases producing the intermediate files Xcode looks for when it runs tests.
   */
  private void updateTestTargetBuildPhases(
      PBXNativeTarget target, RuleEntry entry, PathFilter pathFilter) {
    List<BazelFileInfo> sources =
        entry.getSourceFiles().stream().filter(pathFilter::includes).collect(Collectors.toList());
    List<BazelFileInfo> nonArcSources =
        entry.getNonARCSourceFiles().stream()
            .filter(pathFilter::includes)
            .collect(Collectors.toList());

    // Must come before the sources phase.
    if (entry.getAttributes().isHasSwiftDependency()) {
      target
          .getBuildPhases()
          .add(createShellScriptPhase("Swift dummy file generation", SWIFT_DUMMY_FILES_SCRIPT));
    }
    if (sources.isEmpty() && nonArcSources.isEmpty()) {
      return;
    }

    List<String> nonSwiftFiles = new ArrayList<>();
    for (BazelFileInfo info : Iterables.concat(sources, nonArcSources)) {
      if (!info.getSubPath().endsWith(".swift")) {
        nonSwiftFiles.add(
            Escaper.escapeAsBashString(Files.getNameWithoutExtension(info.getSubPath())));
      }
    }
    if (!nonSwiftFiles.isEmpty()) {
      target
          .getBuildPhases()
          .add(
              createShellScriptPhase(
                  "Objective-C dummy file generation",
                  String.format(OBJC_DUMMY_FILES_SCRIPT, Joiner.on(' ').join(nonSwiftFiles))));
    }

    ImmutableList<PBXFileReference> nonArcReferences =
        fileReferences.createFileReferences(nonArcSources);
    List<PBXFileReference> references =
        new ArrayList<>(fileReferences.createFileReferences(sources));
    references.addAll(nonArcReferences);
    target
        .getBuildPhases()
        .add(
            ProjectFileReferences.createSourcesBuildPhase(
                references, ImmutableSet.copyOf(nonArcReferences)));
  }

  /**
   * Names each rule after its bundle name or, failing that, its target name, as long as the name is
   * unique. The remaining rules are named after their full label, without the longest prefix
   * common to all of them where that keeps names unique.
   */
  static ImmutableSortedMap<String, RuleEntry> generateUniqueNamesForRuleEntries(
      Collection<RuleEntry> entries) {
    Map<String, RuleEntry> named = new LinkedHashMap<>();
    List<RuleEntry> unnamed = uniqueNames(entries, named, RuleEntry::getBundleName);
    unnamed = uniqueNames(unnamed, named, entry -> entry.getLabel().getTargetName());
    if (unnamed.isEmpty()) {
      return ImmutableSortedMap.copyOf(named);
    }

    Set<String> fullNames = new TreeSet<>();
    for (RuleEntry entry : unnamed) {
      fullNames.add(entry.getLabel().asFullPBXTargetName());
    }
    String commonPrefix = longestCommonPrefix(fullNames, '-');
    for (RuleEntry entry : unnamed) {
      String fullName = entry.getLabel().asFullPBXTargetName();
      String shortenedName = fullName.substring(commonPrefix.length());
      if (shortenedName.isEmpty() || named.containsKey(shortenedName)) {
        named.put(fullName, entry);
      } else {
        named.put(shortenedName, entry);
      }
    }
    return ImmutableSortedMap.copyOf(named);
  }

  /** Adds the entries whose name is unique to {@code named} and returns the others. */
  private static List<RuleEntry> uniqueNames(
      Collection<RuleEntry> entries,
      Map<String, RuleEntry> named,
      Function<RuleEntry, Optional<String>> namer) {
    List<RuleEntry> unnamed = new ArrayList<>();
    ListMultimap<String, RuleEntry> entriesByName =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (RuleEntry entry : entries) {
      Optional<String> name = namer.apply(entry);
      if (name.isPresent()) {
        entriesByName.put(name.get(), entry);
      } else {
        unnamed.add(entry);
      }
    }
    for (String name : entriesByName.keySet()) {
      List<RuleEntry> candidates = entriesByName.get(name);
      if (candidates.size() == 1 && !named.containsKey(name)) {
        named.put(name, candidates.get(0));
      } else {
        unnamed.addAll(candidates);
      }
    }
    return unnamed;
  }

  /**
   * Returns the longest strict prefix ending in {@code separator} that all {@code strings} share,
   * or "" if there is none.
   */
  static String longestCommonPrefix(Set<String> strings, char separator) {
    if (strings.size() < 2) {
      return "";
    }
    String shortest = null;
    for (String string : strings) {
      if (shortest == null || string.length() < shortest.length()) {
        shortest = string;
      }
    }
    List<String> components =
        new ArrayList<>(Splitter.on(separator).omitEmptyStrings().splitToList(shortest));
    if (components.isEmpty()) {
      return "";
    }
    // Only strict prefixes.
    components.remove(components.size() - 1);
    for (String string : strings) {
      while (!components.isEmpty() && !string.startsWith(joinPrefix(components, separator))) {
        components.remove(components.size() - 1);
      }
    }
    return components.isEmpty() ? "" : joinPrefix(components, separator);
  }

  private static String joinPrefix(List<String> components, char separator) {
    return Joiner.on(separator).join(components) + separator;
  }

  /** The directory build scripts run in, as an Xcode path, or "" for the project directory. */
  static String workingDirectoryForPBXGroup(PBXGroup group) {
    switch (group.getSourceTree()) {
      case SOURCE_ROOT:
        String path = group.getPath();
        if (path != null && !path.isEmpty()) {
          return "${SRCROOT}/" + path;
        }
        return "";
      case ABSOLUTE:
        return Preconditions.checkNotNull(group.getPath());
      default:
        throw new IllegalArgumentException(
            "Unexpected source tree " + group.getSourceTree() + " for the main group");
    }
  }

  /**
   * Returns a main group that locates workspace files from a project written to {@code
   * outputFolder}. The group path is relative when one folder contains the other.
   */
  static PBXGroup mainGroupForOutputFolder(Path outputFolder, Path workspaceRoot) {
    Path output = outputFolder.toAbsolutePath().normalize();
    Path workspace = workspaceRoot.toAbsolutePath().normalize();
    if (output.equals(workspace)) {
      return new PBXGroup("mainGroup", null, SourceTree.SOURCE_ROOT, null);
    }
    if (workspace.startsWith(output)) {
      return new PBXGroup(
          "mainGroup", output.relativize(workspace).toString(), SourceTree.SOURCE_ROOT, null);
    }
    if (output.startsWith(workspace)) {
      int depth = workspace.relativize(output).getNameCount();
      return new PBXGroup(
          "mainGroup",
          Joiner.on('/').join(Collections.nCopies(depth, "..")),
          SourceTree.SOURCE_ROOT,
          null);
    }
    return new PBXGroup("mainGroup", workspace.toString(), SourceTree.ABSOLUTE, null);
  }

  private static class TestLinkage {
    private final PBXNativeTarget target;
    @Nullable private final BuildLabel hostLabel;
    private final RuleEntry entry;

    private TestLinkage(PBXNativeTarget target, @Nullable BuildLabel hostLabel, RuleEntry entry) {
      this.target = target;
      this.hostLabel = hostLabel;
      this.entry = entry;
    }
  }
}
