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

/** Thrown when a project can not be generated at all. */
public class ProjectGenerationException extends Exception {

  /** What went wrong. */
  public enum Kind {
    /** Labels selected for generation were not reported by the extractor. */
    LABEL_RESOLUTION_FAILED,
    /** A selected rule has no Xcode product type. */
    UNSUPPORTED_TARGET_TYPE,
    /** The project could not be written. */
    SERIALIZATION_FAILED,
  }

  private final Kind kind;

  public ProjectGenerationException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ProjectGenerationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
