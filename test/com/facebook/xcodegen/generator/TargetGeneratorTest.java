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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXGroup;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXNativeTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXShellScriptBuildPhase;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXTarget;
import com.facebook.xcodegen.apple.xcode.xcodeproj.ProductType;
import com.facebook.xcodegen.apple.xcode.xcodeproj.SourceTree;
import com.facebook.xcodegen.apple.xcode.xcodeproj.XCBuildConfiguration;
import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.DottedVersion;
import com.facebook.xcodegen.model.PlatformType;
import com.facebook.xcodegen.model.RuleAttributes;
import com.facebook.xcodegen.model.RuleEntry;
import com.facebook.xcodegen.model.RuleEntryMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import java.nio.file.Paths;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

public class TargetGeneratorTest {

  private static final DeploymentTarget IOS_10 =
      DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("10.0"));

  private PBXProject project;
  private LocalizedMessageLogger logger;
  private IndexerSynthesizer indexerSynthesizer;
  private TargetGenerator generator;
  private RuleEntryMap ruleEntryMap;

  @Before
  public void setUp() {
    project = new PBXProject("P");
    logger = new LocalizedMessageLogger();
    OptionSet options = new OptionSet();
    ProjectFileReferences fileReferences =
        new ProjectFileReferences(project, Paths.get("/workspace"), logger);
    indexerSynthesizer = new IndexerSynthesizer(project, options, fileReferences, logger);
    generator =
        new TargetGenerator(
            project,
            options,
            indexerSynthesizer,
            fileReferences,
            logger,
            "/usr/bin/bazel",
            "bazel-bin",
            "/scripts/bazel_build.py",
            "1.0");
    ruleEntryMap = new RuleEntryMap(logger);
  }

  private RuleEntry insert(RuleEntry.Builder builder) {
    RuleEntry entry = builder.setDeploymentTarget(IOS_10).build();
    ruleEntryMap.insert(entry);
    return entry;
  }

  private static RuleEntry.Builder rule(String label, String type) {
    return RuleEntry.builder().setLabel(BuildLabel.of(label)).setType(type);
  }

  private static Map<String, String> debugSettings(PBXTarget target) {
    return BuildConfigurations.toMap(
        target.getBuildConfigurationList().getBuildConfiguration("Debug").get().getBuildSettings());
  }

  @Test
  public void namesPreferBundleNamesThenTargetNames() {
    RuleEntry app = rule("//app:main", "ios_application").setBundleName("Shop").build();
    RuleEntry lib = rule("//lib:util", "objc_library").build();

    ImmutableSortedMap<String, RuleEntry> names =
        TargetGenerator.generateUniqueNamesForRuleEntries(ImmutableList.of(app, lib));

    assertThat(names, equalTo(ImmutableSortedMap.of("Shop", app, "util", lib)));
  }

  @Test
  public void collidingNamesUseLabelsWithoutTheirCommonPrefix() {
    RuleEntry bar = rule("//foo/bar:lib", "objc_library").build();
    RuleEntry baz = rule("//foo/baz:lib", "objc_library").build();

    ImmutableSortedMap<String, RuleEntry> names =
        TargetGenerator.generateUniqueNamesForRuleEntries(ImmutableList.of(bar, baz));

    assertThat(names, equalTo(ImmutableSortedMap.of("bar-lib", bar, "baz-lib", baz)));
  }

  @Test
  public void commonPrefixEndsAtSeparatorAndIsStrict() {
    assertThat(
        TargetGenerator.longestCommonPrefix(ImmutableSet.of("a-b-c", "a-b-d"), '-'),
        equalTo("a-b-"));
    assertThat(
        TargetGenerator.longestCommonPrefix(ImmutableSet.of("a-bc", "a-bd"), '-'), equalTo("a-"));
    assertThat(
        TargetGenerator.longestCommonPrefix(ImmutableSet.of("a-b", "a-b-c"), '-'), equalTo("a-"));
    assertThat(TargetGenerator.longestCommonPrefix(ImmutableSet.of("x-y"), '-'), equalTo(""));
    assertThat(
        TargetGenerator.longestCommonPrefix(ImmutableSet.of("x-y", "z-y"), '-'), equalTo(""));
  }

  @Test
  public void mainGroupLocatesWorkspaceFromOutputFolder() {
    PBXGroup same = TargetGenerator.mainGroupForOutputFolder(Paths.get("/ws"), Paths.get("/ws"));
    assertThat(same.getSourceTree(), equalTo(SourceTree.SOURCE_ROOT));
    assertThat(TargetGenerator.workingDirectoryForPBXGroup(same), equalTo(""));

    PBXGroup nested =
        TargetGenerator.mainGroupForOutputFolder(Paths.get("/ws/out/xcode"), Paths.get("/ws"));
    assertThat(nested.getPath(), equalTo("../.."));
    assertThat(TargetGenerator.workingDirectoryForPBXGroup(nested), equalTo("${SRCROOT}/../.."));

    PBXGroup unrelated =
        TargetGenerator.mainGroupForOutputFolder(Paths.get("/tmp/out"), Paths.get("/ws"));
    assertThat(unrelated.getSourceTree(), equalTo(SourceTree.ABSOLUTE));
    assertThat(TargetGenerator.workingDirectoryForPBXGroup(unrelated), equalTo("/ws"));
  }

  @Test
  public void buildTargetRunsBuildScriptAndDependsOnCleanTargetFirst() throws Exception {
    RuleEntry lib = insert(rule("//lib:L", "objc_library"));
    RuleEntry app =
        insert(
            rule("//app:A", "ios_application")
                .setBundleId("com.example.app")
                .addDependencies(lib.getLabel()));
    generator.generateBazelCleanTarget("/scripts/bazel_clean.sh", "", ImmutableList.of());

    ImmutableMap<BuildLabel, PBXNativeTarget> targets =
        generator.generateBuildTargetsForRuleEntries(
            ImmutableList.of(app), ruleEntryMap, PathFilter.acceptAll());

    PBXNativeTarget target = targets.get(app.getLabel());
    assertThat(target.getName(), equalTo("A"));
    assertThat(target.getProductType(), equalTo(ProductType.APPLICATION));
    PBXShellScriptBuildPhase buildPhase =
        (PBXShellScriptBuildPhase) target.getBuildPhases().get(0);
    assertThat(buildPhase.getName(), equalTo("build //app:A"));
    assertThat(buildPhase.getShellScript(), startsWith("set -e\n\nexec "));
    assertThat(
        buildPhase.getShellScript(), containsString("\"/scripts/bazel_build.py\" //app:A "));
    assertThat(buildPhase.getInputPaths(), contains("$(TARGET_BUILD_DIR)/$(INFOPLIST_PATH)"));
    assertThat(
        target.getDependencies().get(0).getTargetProxy().getRemoteObject(),
        sameInstance(project.getTargetByName(TargetGenerator.BAZEL_CLEAN_TARGET_NAME).get()));

    Map<String, String> settings = debugSettings(target);
    assertThat(settings, hasEntry("BAZEL_TARGET", "//app:A"));
    assertThat(settings, hasEntry("PRODUCT_BUNDLE_IDENTIFIER", "com.example.app"));
    assertThat(settings, hasEntry("TULSI_BUILD_PATH", "app"));
    assertThat(settings, hasEntry("IPHONEOS_DEPLOYMENT_TARGET", "10.0"));
    assertThat(settings, hasEntry("DEBUG_INFORMATION_FORMAT", "dwarf"));
  }

  @Test
  public void swiftDependenciesRequestDsyms() throws Exception {
    RuleEntry swift = insert(rule("//lib:S", "swift_library"));
    RuleEntry lib = insert(rule("//lib:L", "objc_library").addDependencies(swift.getLabel()));
    RuleEntry app = insert(rule("//app:A", "ios_application").addDependencies(lib.getLabel()));

    PBXNativeTarget target =
        generator
            .generateBuildTargetsForRuleEntries(
                ImmutableList.of(app), ruleEntryMap, PathFilter.acceptAll())
            .get(app.getLabel());

    assertThat(debugSettings(target), hasEntry("DEBUG_INFORMATION_FORMAT", "dwarf-with-dsym"));
  }

  @Test
  public void cleanTargetIsAddedToExistingTargets() throws Exception {
    RuleEntry app = insert(rule("//app:A", "ios_application"));
    PBXNativeTarget target =
        generator
            .generateBuildTargetsForRuleEntries(
                ImmutableList.of(app), ruleEntryMap, PathFilter.acceptAll())
            .get(app.getLabel());

    generator.generateBazelCleanTarget(
        "/scripts/bazel_clean.sh", "${SRCROOT}/..", ImmutableList.of("--batch"));

    PBXTarget clean = project.getTargetByName(TargetGenerator.BAZEL_CLEAN_TARGET_NAME).get();
    assertThat(
        target.getDependencies().get(0).getTargetProxy().getRemoteObject(), sameInstance(clean));
  }

  @Test
  public void unitTestsAreLinkedToTheirHost() throws Exception {
    RuleEntry app = insert(rule("//app:App", "ios_application"));
    RuleEntry test =
        insert(
            rule("//app:Tests", "ios_unit_test")
                .setAttributes(RuleAttributes.builder().setTestHost(app.getLabel()).build())
                .addSourceFiles(BazelFileInfo.source("app/Tests.m")));

    ImmutableMap<BuildLabel, PBXNativeTarget> targets =
        generator.generateBuildTargetsForRuleEntries(
            ImmutableList.of(app, test), ruleEntryMap, PathFilter.acceptAll());

    PBXNativeTarget host = targets.get(app.getLabel());
    PBXNativeTarget testTarget = targets.get(test.getLabel());
    assertThat(project.getLinkedHostForTestTarget(testTarget).get(), sameInstance(host));
    Map<String, String> settings = debugSettings(testTarget);
    assertThat(settings, hasEntry("TEST_HOST", "$(BUILT_PRODUCTS_DIR)/App.app/App"));
    assertThat(settings, hasEntry("BUNDLE_LOADER", "$(TEST_HOST)"));
    assertThat(settings, hasEntry("TULSI_TEST_RUNNER_ONLY", "YES"));
    PBXShellScriptBuildPhase dummyFiles =
        (PBXShellScriptBuildPhase) testTarget.getBuildPhases().get(1);
    assertThat(dummyFiles.getName(), equalTo("Objective-C dummy file generation"));
    assertThat(dummyFiles.getShellScript(), containsString("Tests"));
  }

  @Test
  public void testTakesMissingSettingsFromItsIndexer() throws Exception {
    RuleEntry app = insert(rule("//app:App", "ios_application"));
    RuleEntry test =
        insert(
            rule("//app:UITests", "ios_test")
                .setAttributes(
                    RuleAttributes.builder()
                        .setXctest(false)
                        .setTestHost(app.getLabel())
                        .addCopts("-DKIF=1")
                        .build())
                .addSourceFiles(BazelFileInfo.source("app/UITests.m")));
    indexerSynthesizer.registerRuleEntryForIndexer(test, ruleEntryMap, PathFilter.acceptAll());
    indexerSynthesizer.generateIndexerTargets();
    PBXTarget indexer = indexerSynthesizer.getIndexerTargetForRuleEntry(test).get();
    for (XCBuildConfiguration config :
        indexer.getBuildConfigurationList().getBuildConfigurationsByName().values()) {
      Map<String, String> settings = BuildConfigurations.toMap(config.getBuildSettings());
      settings.put("ARCHS", "arm64");
      settings.put("VALID_ARCHS", "arm64");
      settings.put("HEADER_SEARCH_PATHS", "$(inherited) indexer/include");
      config.setBuildSettings(BuildConfigurations.toDictionary(settings));
    }

    PBXNativeTarget testTarget =
        generator
            .generateBuildTargetsForRuleEntries(
                ImmutableList.of(app, test), ruleEntryMap, PathFilter.acceptAll())
            .get(test.getLabel());

    Map<String, String> settings = debugSettings(testTarget);
    assertThat(settings, hasEntry("OTHER_CFLAGS", "-DKIF=1"));
    assertThat(settings, hasEntry("HEADER_SEARCH_PATHS", "$(inherited) indexer/include"));
    assertThat(settings, hasEntry("PRODUCT_NAME", "UITests"));
    assertThat(settings, not(hasKey("ARCHS")));
    assertThat(settings, not(hasKey("VALID_ARCHS")));
  }

  @Test
  public void testWithoutGeneratedHostIsReported() throws Exception {
    RuleEntry test =
        insert(
            rule("//app:Tests", "ios_unit_test")
                .setAttributes(
                    RuleAttributes.builder().setTestHost(BuildLabel.of("//app:App")).build()));

    ImmutableMap<BuildLabel, PBXNativeTarget> targets =
        generator.generateBuildTargetsForRuleEntries(
            ImmutableList.of(test), ruleEntryMap, PathFilter.acceptAll());

    assertThat(logger.getDiagnostics("MissingTestHost"), hasSize(1));
    assertFalse(project.getLinkedHostForTestTarget(targets.get(test.getLabel())).isPresent());
  }

  @Test
  public void watchApplicationWithoutExtensionGetsStub() throws Exception {
    RuleEntry watch =
        insert(rule("//watch:W", "watchos_application").setBundleId("com.example.watch"));

    PBXNativeTarget target =
        generator
            .generateBuildTargetsForRuleEntries(
                ImmutableList.of(watch), ruleEntryMap, PathFilter.acceptAll())
            .get(watch.getLabel());

    String stubName = TargetGenerator.WATCH_EXTENSION_TARGET_PREFIX + "W";
    PBXTarget stub = project.getTargetByName(stubName).get();
    assertTrue(target.getBuildActionDependencies().contains(stub));
    assertThat(
        debugSettings(stub),
        hasEntry("PRODUCT_BUNDLE_IDENTIFIER", "com.example.watch.watchkitextension"));
  }

  @Test
  public void watchExtensionStubDependsOnCleanTarget() throws Exception {
    RuleEntry watch = insert(rule("//watch:W", "watchos_application"));
    generator.generateBazelCleanTarget("/scripts/bazel_clean.sh", "", ImmutableList.of());

    generator.generateBuildTargetsForRuleEntries(
        ImmutableList.of(watch), ruleEntryMap, PathFilter.acceptAll());

    PBXTarget stub =
        project.getTargetByName(TargetGenerator.WATCH_EXTENSION_TARGET_PREFIX + "W").get();
    assertThat(
        stub.getDependencies().get(0).getTargetProxy().getRemoteObject(),
        sameInstance(project.getTargetByName(TargetGenerator.BAZEL_CLEAN_TARGET_NAME).get()));
  }

  @Test
  public void unresolvedWatchExtensionIsReported() throws Exception {
    RuleEntry watch =
        insert(rule("//watch:W", "watchos_application").addExtensions(BuildLabel.of("//gone:E")));

    generator.generateBuildTargetsForRuleEntries(
        ImmutableList.of(watch), ruleEntryMap, PathFilter.acceptAll());

    assertThat(logger.getDiagnostics("FindingWatchExtensionFailed"), hasSize(1));
    assertTrue(
        project.getTargetByName(TargetGenerator.WATCH_EXTENSION_TARGET_PREFIX + "W").isPresent());
  }

  @Test
  public void watchApplicationDependsOnGeneratedExtension() throws Exception {
    RuleEntry extension = insert(rule("//watch:Ext", "watchos_extension"));
    RuleEntry watch =
        insert(rule("//watch:W", "watchos_application").addExtensions(extension.getLabel()));

    ImmutableMap<BuildLabel, PBXNativeTarget> targets =
        generator.generateBuildTargetsForRuleEntries(
            ImmutableList.of(watch, extension), ruleEntryMap, PathFilter.acceptAll());

    PBXNativeTarget watchTarget = targets.get(watch.getLabel());
    assertThat(
        watchTarget.getDependencies().get(0).getTargetProxy().getRemoteObject(),
        sameInstance(targets.get(extension.getLabel())));
    assertThat(
        project.getTargetByName(TargetGenerator.WATCH_EXTENSION_TARGET_PREFIX + "W").isPresent(),
        equalTo(false));
  }

  @Test
  public void unsupportedRuleTypeFails() {
    RuleEntry genrule = insert(rule("//gen:g", "genrule"));

    try {
      generator.generateBuildTargetsForRuleEntries(
          ImmutableList.of(genrule), ruleEntryMap, PathFilter.acceptAll());
      fail("genrule has no Xcode product type");
    } catch (ProjectGenerationException e) {
      assertThat(e.getKind(), equalTo(ProjectGenerationException.Kind.UNSUPPORTED_TARGET_TYPE));
      assertThat(e.getMessage(), containsString("//gen:g"));
    }
  }

  @Test
  public void extraFilesHonorThePathFilter() {
    generator.generateFileReferencesForFilePaths(
        ImmutableList.of("app/README.md", "vendor/LICENSE"),
        PathFilter.of(ImmutableList.of("app/...")));

    assertFalse(project.getMainGroup().getChildren().isEmpty());
    assertTrue(
        project.getMainGroup().getChildren().stream()
            .noneMatch(child -> child.getName().equals("vendor")));
  }
}
