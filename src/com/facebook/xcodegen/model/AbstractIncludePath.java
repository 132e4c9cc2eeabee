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

import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import org.immutables.value.Value;

/** A directory holding generated headers, optionally searched recursively. */
@Value.Immutable(builder = false)
@XcodegenStyleImmutable
abstract class AbstractIncludePath {

  @Value.Parameter
  public abstract String getPath();

  @Value.Parameter
  public abstract boolean isRecursive();
}
