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

import com.facebook.xcodegen.util.HumanReadableException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.util.Optional;

/**
 * A version of the form {@code x.y.z}. Missing trailing components compare as zero, so {@code 9.0}
 * and {@code 9} are equal.
 */
public final class DottedVersion implements Comparable<DottedVersion> {

  private final ImmutableList<Integer> components;

  private DottedVersion(ImmutableList<Integer> components) {
    this.components = components;
  }

  /** Returns empty if any component is not a number. Empty components are read as zero. */
  public static Optional<DottedVersion> parse(String versionString) {
    ImmutableList.Builder<Integer> components = ImmutableList.builder();
    for (String component : Splitter.on('.').split(versionString)) {
      if (component.isEmpty()) {
        components.add(0);
        continue;
      }
      Integer value = Ints.tryParse(component);
      if (value == null) {
        return Optional.empty();
      }
      components.add(value);
    }
    return Optional.of(new DottedVersion(components.build()));
  }

  @JsonCreator
  public static DottedVersion of(String versionString) {
    return parse(versionString)
        .orElseThrow(
            () -> new HumanReadableException("'%s' is not a dotted version", versionString));
  }

  private int componentAt(int index) {
    return index < components.size() ? components.get(index) : 0;
  }

  @Override
  public int compareTo(DottedVersion other) {
    int length = Math.max(components.size(), other.components.size());
    for (int i = 0; i < length; i++) {
      int result = Integer.compare(componentAt(i), other.componentAt(i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DottedVersion && compareTo((DottedVersion) other) == 0;
  }

  @Override
  public int hashCode() {
    // Trailing zeros do not take part in equality.
    int last = components.size();
    while (last > 0 && components.get(last - 1) == 0) {
      last--;
    }
    return components.subList(0, last).hashCode();
  }

  @JsonValue
  @Override
  public String toString() {
    return Joiner.on('.').join(components);
  }
}
