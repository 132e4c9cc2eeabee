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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import java.util.Optional;

/**
 * The canonical name of a target in the Bazel build graph, e.g. {@code //foo/bar:baz}.
 *
 * <p>Labels are compared by value and are the key of every lookup table in the generator.
 */
public final class BuildLabel implements Comparable<BuildLabel> {

  private final String value;

  private BuildLabel(String value) {
    this.value = value;
  }

  @JsonCreator
  public static BuildLabel of(String value) {
    Preconditions.checkNotNull(value);
    return new BuildLabel(value);
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * The part after the colon, or the last path component for labels using the implicit target
   * shorthand ({@code //foo/bar} is {@code //foo/bar:bar}).
   */
  public Optional<String> getTargetName() {
    int colon = value.lastIndexOf(':');
    if (colon >= 0) {
      return Optional.of(value.substring(colon + 1));
    }
    int slash = value.lastIndexOf('/');
    String lastPackageComponent = slash < 0 ? value : value.substring(slash + 1);
    if (lastPackageComponent.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(lastPackageComponent);
  }

  /** The package path without the leading {@code //}. Root package labels return "". */
  public String getPackageName() {
    int colon = value.indexOf(':');
    String packageName = colon < 0 ? value : value.substring(0, colon);
    if (packageName.startsWith("//")) {
      packageName = packageName.substring(2);
    }
    if (packageName.isEmpty() || packageName.endsWith("/")) {
      return "";
    }
    return packageName;
  }

  /**
   * A name built from the whole label that is safe to use as an Xcode target name, e.g. {@code
   * foo-bar-baz} for {@code //foo/bar:baz}.
   */
  public String asFullPBXTargetName() {
    return (getPackageName() + "/" + getTargetName().orElse("")).replace('/', '-');
  }

  /** A hash of the label that is identical across runs, used to disambiguate generated names. */
  public int stableHash() {
    return value.hashCode();
  }

  @Override
  public int compareTo(BuildLabel other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof BuildLabel)) {
      return false;
    }
    return value.equals(((BuildLabel) other).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
