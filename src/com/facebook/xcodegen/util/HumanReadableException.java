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

/**
 * Exception whose message is suitable for showing to the person running the generator. Messages are
 * built with {@link String#format(String, Object...)}.
 */
public class HumanReadableException extends RuntimeException {

  public HumanReadableException(String humanReadableFormatString, Object... args) {
    super(format(humanReadableFormatString, args));
  }

  public HumanReadableException(
      Throwable cause, String humanReadableFormatString, Object... args) {
    super(format(humanReadableFormatString, args), cause);
  }

  private static String format(String formatString, Object... args) {
    return args.length == 0 ? formatString : String.format(formatString, args);
  }

  public String getHumanReadableErrorMessage() {
    return getMessage();
  }
}
