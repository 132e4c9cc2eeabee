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

import com.facebook.xcodegen.apple.FileTypes;
import com.facebook.xcodegen.apple.xcode.XcodeprojSerializer;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Reference to a concrete file.
 *
 * <p>Inputs record the file's type as {@code lastKnownFileType}; build outputs record it as {@code
 * explicitFileType}.
 */
public class PBXFileReference extends PBXReference {

  @Nullable private String fileTypeOverride;
  private boolean inputFile;

  public PBXFileReference(
      String name, @Nullable String path, SourceTree sourceTree, @Nullable PBXGroup parent) {
    super(name, path, sourceTree, parent);
  }

  @Override
  public String isa() {
    return "PBXFileReference";
  }

  public boolean isInputFile() {
    return inputFile;
  }

  public void setInputFile(boolean inputFile) {
    this.inputFile = inputFile;
  }

  public void setFileTypeOverride(@Nullable String fileTypeOverride) {
    this.fileTypeOverride = fileTypeOverride;
  }

  /** The Xcode UTI of this file, from the override or the extension of its name. */
  public Optional<String> getFileType() {
    if (fileTypeOverride != null) {
      return Optional.of(fileTypeOverride);
    }
    return FileTypes.getUniformTypeIdentifier(getName());
  }

  @Override
  public void serializeInto(XcodeprojSerializer s) {
    super.serializeInto(s);
    if (inputFile) {
      s.addField("lastKnownFileType", getFileType().orElse("text"));
    } else {
      getFileType().ifPresent(type -> s.addField("explicitFileType", type));
    }
  }
}
