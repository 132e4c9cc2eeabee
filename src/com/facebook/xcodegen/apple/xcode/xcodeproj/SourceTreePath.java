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

import com.google.common.base.Preconditions;
import java.util.Objects;

/** A path together with the {@link SourceTree} it is relative to. Used as a lookup key. */
public final class SourceTreePath {

  private final SourceTree sourceTree;
  private final String path;

  public SourceTreePath(SourceTree sourceTree, String path) {
    this.sourceTree = Preconditions.checkNotNull(sourceTree);
    this.path = Preconditions.checkNotNull(path);
  }

  public SourceTree getSourceTree() {
    return sourceTree;
  }

  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SourceTreePath)) {
      return false;
    }
    SourceTreePath that = (SourceTreePath) other;
    return sourceTree == that.sourceTree && path.equals(that.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceTree, path);
  }

  @Override
  public String toString() {
    return "$" + sourceTree + "/" + path;
  }
}
