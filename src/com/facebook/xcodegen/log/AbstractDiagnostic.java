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

package com.facebook.xcodegen.log;

import com.facebook.xcodegen.util.immutables.XcodegenStyleImmutable;
import com.google.common.collect.ImmutableList;
import org.immutables.value.Value;

/** A diagnostic raised while generating a project, identified by a stable message key. */
@Value.Immutable(builder = false, copy = false)
@XcodegenStyleImmutable
abstract class AbstractDiagnostic {

  @Value.Parameter
  public abstract Severity getSeverity();

  @Value.Parameter
  public abstract String getKey();

  /** Positional values substituted into the message, already converted to strings. */
  @Value.Parameter
  public abstract ImmutableList<String> getValues();

  /** The message rendered from the {@code Messages} bundle. */
  @Value.Parameter
  public abstract String getMessage();
}
