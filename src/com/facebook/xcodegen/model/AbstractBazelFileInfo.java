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

import com.facebook.xcodegen.apple.FileTypes;
import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import java.util.Optional;
import org.immutables.value.Value;

/** A file Bazel reads or writes, as reported by the extractor. */
@Value.Immutable
@XcodegenStyleImmutable
abstract class AbstractBazelFileInfo {

  /** Path of the file relative to {@link #getRootPath()}. */
  public abstract String getSubPath();

  /** Root of generated files, such as {@code bazel-out/ios-fastbuild/genfiles}; "" for sources. */
  @Value.Default
  public String getRootPath() {
    return "";
  }

  /** True for checked-in sources, false for files produced by the build. */
  public abstract boolean isSourceFile();

  @Value.Default
  public boolean isDirectory() {
    return false;
  }

  @Value.Derived
  public String getFullPath() {
    if (getRootPath().isEmpty()) {
      return getSubPath();
    }
    if (getSubPath().isEmpty()) {
      return getRootPath();
    }
    return getRootPath() + "/" + getSubPath();
  }

  public Optional<String> getUti() {
    return FileTypes.getUniformTypeIdentifier(getSubPath());
  }

  public static BazelFileInfo source(String subPath) {
    return BazelFileInfo.builder().setSubPath(subPath).setSourceFile(true).build();
  }

  public static BazelFileInfo generated(String rootPath, String subPath) {
    return BazelFileInfo.builder()
        .setRootPath(rootPath)
        .setSubPath(subPath)
        .setSourceFile(false)
        .build();
  }
}
