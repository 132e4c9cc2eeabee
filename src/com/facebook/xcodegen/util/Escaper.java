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

package com.facebook.xcodegen.util;

import com.google.common.base.CharMatcher;

/** Quoting helpers for strings that end up in generated shell scripts. */
public final class Escaper {

  /** Characters that force quoting in bash. */
  private static final CharMatcher BASH_SPECIAL_CHARS =
      CharMatcher.anyOf("<>|!?*[]$\\(){}\"'`&;=").or(CharMatcher.whitespace());

  private Escaper() {}

  /**
   * Quotes a string for bash with single quotes, if it contains any character bash treats
   * specially.
   */
  public static String escapeAsBashString(String str) {
    if (str.isEmpty()) {
      return "''";
    }
    if (!BASH_SPECIAL_CHARS.matchesAnyOf(str)) {
      return str;
    }
    return "'" + str.replace("'", "'\\''") + "'";
  }
}
