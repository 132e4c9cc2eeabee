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

import com.dd.plist.NSDictionary;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import com.dd.plist.PropertyListFormatException;
import com.dd.plist.PropertyListParser;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXBuildFile;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXFileReference;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXReference;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXSourcesBuildPhase;
import com.facebook.xcodegen.apple.xcode.xcodeproj.SourceTree;
import com.facebook.xcodegen.apple.xcode.xcodeproj.SourceTreePath;
import com.facebook.xcodegen.apple.xcode.xcodeproj.XCVersionGroup;
import com.facebook.xcodegen.log.LocalizedMessageLogger;
import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.model.BazelFileInfo;
import com.facebook.xcodegen.model.RuleEntry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.xml.parsers.ParserConfigurationException;
import org.xml.sax.SAXException;

/** Creates the file references and source build phases for the files of rules. */
class ProjectFileReferences {

  private static final Logger LOG = Logger.get(ProjectFileReferences.class);

  private static final String CURRENT_VERSION_FILE_NAME = ".xccurrentversion";
  private static final String CURRENT_VERSION_KEY = "_XCCurrentVersionName";

  private final PBXProject project;
  private final Path workspaceRoot;
  private final LocalizedMessageLogger localizedMessageLogger;

  ProjectFileReferences(
      PBXProject project, Path workspaceRoot, LocalizedMessageLogger localizedMessageLogger) {
    this.project = project;
    this.workspaceRoot = workspaceRoot;
    this.localizedMessageLogger = localizedMessageLogger;
  }

  PBXFileReference addFileReference(BazelFileInfo info) {
    PBXFileReference reference =
        project.getOrCreateGroupsAndFileReferencesForPaths(ImmutableList.of(info.getFullPath()))
            .get(0);
    reference.setInputFile(info.isSourceFile());
    return reference;
  }

  /** References a file that is neither compiled nor versioned, such as a storyboard. */
  void addNonSourceFileReference(BazelFileInfo info) {
    PBXFileReference reference =
        project.createGroupsAndFileReferenceForPath(info.getFullPath(), project.getMainGroup());
    reference.setInputFile(info.isSourceFile());
  }

  void addBuildFileReference(RuleEntry entry, PathFilter pathFilter) {
    Optional<String> buildFilePath = entry.getBuildFilePath();
    if (buildFilePath.isPresent() && pathFilter.includes(buildFilePath.get())) {
      project.getOrCreateGroupsAndFileReferencesForPaths(ImmutableList.of(buildFilePath.get()));
    }
  }

  /** Returns references for the sources among {@code infos} followed by the generated files. */
  ImmutableList<PBXFileReference> createFileReferences(List<BazelFileInfo> infos) {
    ImmutableList.Builder<String> sourcePaths = ImmutableList.builder();
    ImmutableList.Builder<String> generatedPaths = ImmutableList.builder();
    for (BazelFileInfo info : infos) {
      if (info.isSourceFile()) {
        sourcePaths.add(info.getFullPath());
      } else {
        generatedPaths.add(info.getFullPath());
      }
    }
    ImmutableList<PBXFileReference> generatedReferences =
        project.getOrCreateGroupsAndFileReferencesForPaths(generatedPaths.build());
    for (PBXFileReference reference : generatedReferences) {
      reference.setInputFile(false);
    }
    return ImmutableList.<PBXFileReference>builder()
        .addAll(project.getOrCreateGroupsAndFileReferencesForPaths(sourcePaths.build()))
        .addAll(generatedReferences)
        .build();
  }

  /**
   * Adds versioned files such as {@code Model.xcdatamodeld/Model.xcdatamodel} to version groups
   * named after their bundle, and selects the version named by the bundle's {@code
   * .xccurrentversion} file.
   */
  ImmutableList<XCVersionGroup> createVersionGroups(List<BazelFileInfo> infos) {
    Map<String, XCVersionGroup> groups = new LinkedHashMap<>();
    for (BazelFileInfo info : infos) {
      String groupPath = CompileSettings.parentPath(info.getFullPath());
      String versionGroupType = info.getUti().orElse("");
      XCVersionGroup group = project.getOrCreateVersionGroupForPath(groupPath, versionGroupType);
      groups.putIfAbsent(groupPath, group);
      String versionName = info.getFullPath().substring(groupPath.length() + 1);
      PBXFileReference reference =
          group.getOrCreateFileReferenceBySourceTreePath(
              new SourceTreePath(SourceTree.GROUP, versionName));
      reference.setInputFile(info.isSourceFile());
    }
    for (Map.Entry<String, XCVersionGroup> entry : groups.entrySet()) {
      setCurrentVersion(entry.getValue(), entry.getKey());
    }
    return ImmutableList.copyOf(groups.values());
  }

  private void setCurrentVersion(XCVersionGroup group, String groupPath) {
    Path versionFile = workspaceRoot.resolve(groupPath).resolve(CURRENT_VERSION_FILE_NAME);
    if (!Files.isRegularFile(versionFile)) {
      localizedMessageLogger.warning(
          "LoadingXCCurrentVersionFailed",
          group.getName(),
          String.format("Version file at '%s' could not be read", versionFile));
      return;
    }

    NSObject rootObject;
    try {
      rootObject = PropertyListParser.parse(versionFile.toFile());
    } catch (IOException
        | PropertyListFormatException
        | ParseException
        | ParserConfigurationException
        | SAXException e) {
      LOG.debug(e, "Failed to parse %s", versionFile);
      localizedMessageLogger.warning(
          "LoadingXCCurrentVersionFailed",
          group.getName(),
          String.format("Version file at '%s' is invalid: %s", versionFile, e.getMessage()));
      return;
    }

    if (!(rootObject instanceof NSDictionary)) {
      localizedMessageLogger.warning(
          "LoadingXCCurrentVersionFailed",
          group.getName(),
          String.format("Version file at '%s' is not a dictionary", versionFile));
      return;
    }
    NSObject currentVersionName = ((NSDictionary) rootObject).objectForKey(CURRENT_VERSION_KEY);
    if (!(currentVersionName instanceof NSString)) {
      return;
    }
    String versionName = ((NSString) currentVersionName).getContent();
    if (!group.setCurrentVersionByName(versionName)) {
      localizedMessageLogger.warning(
          "LoadingXCCurrentVersionFailed",
          group.getName(),
          String.format(
              "Version '%s' specified by file at '%s' was not found", versionName, versionFile));
    }
  }

  /**
   * Creates a sources phase for {@code references}. Only compilable files are added; headers are
   * skipped. Files in {@code nonArcReferences} are compiled with ARC disabled.
   */
  static PBXSourcesBuildPhase createSourcesBuildPhase(
      List<? extends PBXReference> references, Set<PBXFileReference> nonArcReferences) {
    PBXSourcesBuildPhase buildPhase = new PBXSourcesBuildPhase();
    for (PBXReference reference : references) {
      if (reference instanceof PBXFileReference) {
        PBXFileReference fileReference = (PBXFileReference) reference;
        Optional<String> fileType = fileReference.getFileType();
        if (!fileType.isPresent()
            || !fileType.get().startsWith("sourcecode.")
            || fileType.get().endsWith(".h")) {
          continue;
        }
        PBXBuildFile buildFile = new PBXBuildFile(fileReference);
        if (nonArcReferences.contains(fileReference)) {
          NSDictionary settings = new NSDictionary();
          settings.put("COMPILER_FLAGS", "-fno-objc-arc");
          buildFile.setSettings(Optional.of(settings));
        }
        buildPhase.getFiles().add(buildFile);
      } else {
        buildPhase.getFiles().add(new PBXBuildFile(reference));
      }
    }
    return buildPhase;
  }

  static PBXSourcesBuildPhase createSourcesBuildPhase(List<? extends PBXReference> references) {
    return createSourcesBuildPhase(references, ImmutableSet.of());
  }
}
