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

import com.facebook.xcodegen.model.BuildLabel;
import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import org.immutables.value.Value;

/** The part of an indexer name contributed by one rule. */
@Value.Immutable(builder = false)
@XcodegenStyleImmutable
abstract class AbstractIndexerNameToken {

  @Value.Parameter
  public abstract String getTargetName();

  @Value.Parameter
  public abstract int getLabelHash();

  static IndexerNameToken forLabel(BuildLabel label) {
    return IndexerNameToken.of(
        label.getTargetName().orElse(label.asFullPBXTargetName()), label.stableHash());
  }
}
