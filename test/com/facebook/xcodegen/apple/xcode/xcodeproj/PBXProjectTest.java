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

package com.facebook.xcodegen.apple.xcode.xcodeproj;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;

import com.facebook.xcodegen.model.DeploymentTarget;
import com.facebook.xcodegen.model.DottedVersion;
import com.facebook.xcodegen.model.PlatformType;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.Test;

public class PBXProjectTest {

  private static final DeploymentTarget IOS_10 =
      DeploymentTarget.of(PlatformType.IOS, DottedVersion.of("10.0"));

  @Test
  public void fileReferencesAreCreatedOnce() {
    PBXProject project = new PBXProject("P");

    PBXFileReference first =
        project.getOrCreateGroupsAndFileReferencesForPaths(ImmutableList.of("lib/a.m")).get(0);
    PBXFileReference second =
        project.getOrCreateGroupsAndFileReferencesForPaths(ImmutableList.of("lib/a.m")).get(0);

    assertThat(second, sameInstance(first));
    PBXGroup libGroup = project.getOrCreateGroupForPath("lib");
    assertThat(libGroup.getChildren(), hasSize(1));
    assertThat(first.getParent(), sameInstance(libGroup));
    assertThat(first.getFileType(), equalTo(Optional.of("sourcecode.c.objc")));
  }

  @Test
  public void bundleDirectoriesEndThePathWalk() {
    PBXProject project = new PBXProject("P");

    PBXFileReference reference =
        project
            .getOrCreateGroupsAndFileReferencesForPaths(
                ImmutableList.of("app/Images.xcassets/icon.png"))
            .get(0);

    assertThat(reference.getName(), equalTo("Images.xcassets"));
    assertThat(reference.getFileType(), equalTo(Optional.of("folder.assetcatalog")));
  }

  @Test
  public void localizedFilesShareAVariantGroup() {
    PBXProject project = new PBXProject("P");

    project.getOrCreateGroupsAndFileReferencesForPaths(
        ImmutableList.of("app/en.lproj/Main.strings", "app/fr.lproj/Main.strings"));

    PBXGroup appGroup = project.getOrCreateGroupForPath("app");
    assertThat(appGroup.getChildren(), hasSize(1));
    PBXReference variantGroup = appGroup.getChildren().get(0);
    assertThat(variantGroup, instanceOf(PBXVariantGroup.class));
    assertThat(((PBXGroup) variantGroup).getChildren(), hasSize(2));
  }

  @Test
  public void nativeTargetGetsProductReference() {
    PBXProject project = new PBXProject("P");

    PBXNativeTarget target = project.createNativeTarget("App", IOS_10, ProductType.APPLICATION);

    assertThat(target.getProductReference().getName(), equalTo("App.app"));
    assertThat(
        target.getProductReference().getSourceTree(), equalTo(SourceTree.BUILT_PRODUCTS_DIR));
    assertFalse(target.getProductReference().isInputFile());
    assertThat(project.getTargetByName("App"), equalTo(Optional.of(target)));
  }

  @Test
  public void targetNeverDependsOnItself() {
    PBXProject project = new PBXProject("P");
    PBXNativeTarget target = project.createNativeTarget("Lib", IOS_10, ProductType.STATIC_LIBRARY);

    target.createDependencyOn(target, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);

    assertThat(target.getDependencies(), hasSize(0));
  }

  @Test
  public void dependenciesAreSharedAndNotDuplicated() {
    PBXProject project = new PBXProject("P");
    PBXNativeTarget lib = project.createNativeTarget("Lib", IOS_10, ProductType.STATIC_LIBRARY);
    PBXNativeTarget app = project.createNativeTarget("App", IOS_10, ProductType.APPLICATION);
    PBXNativeTarget tests = project.createNativeTarget("Tests", IOS_10, ProductType.UNIT_TEST);

    app.createDependencyOn(lib, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);
    app.createDependencyOn(lib, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);
    tests.createDependencyOn(lib, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);

    assertThat(app.getDependencies(), hasSize(1));
    assertThat(tests.getDependencies().get(0), sameInstance(app.getDependencies().get(0)));
  }

  @Test
  public void firstDependencyIsInsertedAhead() {
    PBXProject project = new PBXProject("P");
    PBXNativeTarget lib = project.createNativeTarget("Lib", IOS_10, ProductType.STATIC_LIBRARY);
    PBXNativeTarget app = project.createNativeTarget("App", IOS_10, ProductType.APPLICATION);
    PBXLegacyTarget clean = project.createLegacyTarget("_clean_", "/bin/true", "", "");

    app.createDependencyOn(lib, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project);
    app.createDependencyOn(clean, PBXContainerItemProxy.ProxyType.TARGET_REFERENCE, project, true);

    assertThat(
        app.getDependencies().get(0).getTargetProxy().getRemoteObject(), sameInstance(clean));
  }

  @Test
  public void linkedTestTargetDependsOnHost() {
    PBXProject project = new PBXProject("P");
    PBXNativeTarget app = project.createNativeTarget("App", IOS_10, ProductType.APPLICATION);
    PBXNativeTarget tests = project.createNativeTarget("Tests", IOS_10, ProductType.UNIT_TEST);

    project.linkTestTarget(tests, app);

    assertThat(project.getLinkedTestTargetsForHost(app), contains((PBXTarget) tests));
    assertThat(project.getLinkedHostForTestTarget(tests), equalTo(Optional.of(app)));
    assertThat(tests.getDependencies(), hasSize(1));
  }
}
