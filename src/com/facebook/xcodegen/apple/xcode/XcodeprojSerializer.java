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

package com.facebook.xcodegen.apple.xcode;

import com.dd.plist.NSArray;
import com.dd.plist.NSDictionary;
import com.dd.plist.NSNumber;
import com.dd.plist.NSObject;
import com.dd.plist.NSString;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXObject;
import com.facebook.xcodegen.apple.xcode.xcodeproj.PBXProject;
import com.facebook.xcodegen.log.Logger;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Writes a {@link PBXProject} and everything reachable from it in the OpenStep property list
 * dialect Xcode uses for {@code project.pbxproj}.
 *
 * <p>Objects call back into the {@code addField} methods from {@link
 * PBXObject#serializeInto(XcodeprojSerializer)}. Referencing an object serializes it on first use
 * and writes its global ID, so the output only holds objects reachable from the project.
 */
public class XcodeprojSerializer {

  private static final Logger LOG = Logger.get(XcodeprojSerializer.class);

  private static final String ARCHIVE_VERSION = "1";
  private static final String OBJECT_VERSION = "46";

  /** Types Xcode writes on a single line. */
  private static final ImmutableSet<String> COMPACT_TYPES =
      ImmutableSet.of("PBXBuildFile", "PBXFileReference");

  /** Sections in the order Xcode writes them. */
  private static final ImmutableList<String> SECTION_ORDER =
      ImmutableList.of(
          "PBXBuildFile",
          "PBXContainerItemProxy",
          "PBXFileReference",
          "PBXGroup",
          "PBXLegacyTarget",
          "PBXNativeTarget",
          "PBXProject",
          "PBXShellScriptBuildPhase",
          "PBXSourcesBuildPhase",
          "PBXVariantGroup",
          "PBXTargetDependency",
          "XCBuildConfiguration",
          "XCConfigurationList",
          "XCVersionGroup");

  private static final Pattern UNQUOTED_STRING = Pattern.compile("^[A-Za-z0-9._/]+$");

  private final GidGenerator gidGenerator;
  private final PBXProject rootObject;
  private final Map<String, TypedDict> objectsByGid = new HashMap<>();
  private final Map<String, List<String>> gidsByIsa = new HashMap<>();

  @Nullable private RawDict currentDict;

  public XcodeprojSerializer(GidGenerator gidGenerator, PBXProject rootObject) {
    this.gidGenerator = gidGenerator;
    this.rootObject = rootObject;
  }

  /** Serializes the project and returns the contents of a {@code project.pbxproj} file. */
  public String toOpenStepString() {
    String rootObjectId = serializeObject(rootObject, false);

    StringBuilder builder = new StringBuilder();
    builder.append("// !$*UTF8*$!\n{\n");
    String indent = "\t";
    builder.append(indent).append("archiveVersion = ").append(ARCHIVE_VERSION).append(";\n");
    builder.append(indent).append("classes = {\n").append(indent).append("};\n");
    builder.append(indent).append("objectVersion = ").append(OBJECT_VERSION).append(";\n");
    builder.append(indent).append("objects = {\n");
    for (String isa : SECTION_ORDER) {
      appendSection(builder, isa, indent + "\t");
    }
    if (!gidsByIsa.isEmpty()) {
      LOG.warn("Objects of types %s have no section and were not written", gidsByIsa.keySet());
    }
    builder.append(indent).append("};\n");
    builder.append(indent).append("rootObject = ").append(rootObjectId).append(";\n");
    builder.append("}");

    gidsByIsa.clear();
    objectsByGid.clear();
    return builder.toString();
  }

  /**
   * Serializes {@code object} unless it already was and returns its global ID. Unless {@code
   * rawId} is set the ID is followed by the object's comment.
   *
   * <p>The object is registered before its fields are visited, so cycles such as two targets
   * referring to each other end on the second visit.
   */
  public String serializeObject(PBXObject object, boolean rawId) {
    String existingGid = object.getGlobalID();
    if (existingGid != null) {
      TypedDict existing = objectsByGid.get(existingGid);
      if (existing != null) {
        return rawId ? existingGid : existingGid + existing.comment;
      }
    } else {
      object.setGlobalID(gidGenerator.generateGid(object));
    }

    String gid = Preconditions.checkNotNull(object.getGlobalID());
    TypedDict dict = new TypedDict(gid, object.isa(), object.getComment());
    objectsByGid.put(gid, dict);

    RawDict stack = currentDict;
    currentDict = dict;
    object.serializeInto(this);
    currentDict = stack;

    gidsByIsa.computeIfAbsent(object.isa(), isa -> new ArrayList<>()).add(gid);
    return rawId ? gid : gid + dict.comment;
  }

  public void addField(String name, @Nullable PBXObject object) {
    if (object == null) {
      return;
    }
    current().entries.put(name, serializeObject(object, false));
  }

  /** Writes a reference to {@code object} without its comment. */
  public void addRawIdField(String name, PBXObject object) {
    current().entries.put(name, serializeObject(object, true));
  }

  public void addField(String name, int value) {
    current().entries.put(name, Integer.toString(value));
  }

  public void addField(String name, boolean value) {
    current().entries.put(name, value ? "1" : "0");
  }

  public void addField(String name, @Nullable String value) {
    if (value == null) {
      return;
    }
    current().entries.put(name, escape(value));
  }

  public void addField(String name, List<? extends PBXObject> objects) {
    List<String> ids = new ArrayList<>(objects.size());
    for (PBXObject object : objects) {
      ids.add(serializeObject(object, false));
    }
    current().entries.put(name, ids);
  }

  public void addStringArrayField(String name, List<String> values) {
    List<String> escaped = new ArrayList<>(values.size());
    for (String value : values) {
      escaped.add(escape(value));
    }
    current().entries.put(name, escaped);
  }

  /**
   * Writes a property list value. Dictionaries nest, arrays hold strings and numbers are written as
   * integers, with booleans as {@code 0} or {@code 1}. Empty dictionaries are written too.
   */
  public void addField(String name, NSObject value) {
    RawDict target = current();
    target.entries.put(name, convert(value, target.compact));
  }

  private Object convert(NSObject value, boolean compact) {
    if (value instanceof NSDictionary) {
      RawDict nested = new RawDict(compact);
      for (Map.Entry<String, NSObject> entry : ((NSDictionary) value).entrySet()) {
        nested.entries.put(entry.getKey(), convert(entry.getValue(), compact));
      }
      return nested;
    } else if (value instanceof NSArray) {
      List<String> items = new ArrayList<>();
      for (NSObject item : ((NSArray) value).getArray()) {
        Object converted = convert(item, compact);
        Preconditions.checkArgument(
            converted instanceof String, "Unsupported nested array item %s", item);
        items.add((String) converted);
      }
      return items;
    } else if (value instanceof NSString) {
      return escape(((NSString) value).getContent());
    } else if (value instanceof NSNumber) {
      NSNumber number = (NSNumber) value;
      if (number.type() == NSNumber.BOOLEAN) {
        return number.boolValue() ? "1" : "0";
      }
      return number.type() == NSNumber.INTEGER
          ? Long.toString(number.longValue())
          : escape(number.toString());
    }
    throw new IllegalArgumentException(
        String.format("Unsupported property list value %s for project file", value));
  }

  private RawDict current() {
    return Preconditions.checkNotNull(currentDict, "Fields can only be added during serialization");
  }

  private void appendSection(StringBuilder builder, String isa, String indent) {
    List<String> gids = gidsByIsa.remove(isa);
    if (gids == null) {
      return;
    }
    builder.append("\n/* Begin ").append(isa).append(" section */\n");
    for (String gid : ImmutableList.sortedCopyOf(gids)) {
      Preconditions.checkNotNull(objectsByGid.get(gid)).appendTo(builder, indent);
    }
    builder.append("/* End ").append(isa).append(" section */\n");
  }

  /**
   * Quotes {@code value} unless it only holds letters, digits, dots, underscores and slashes.
   * Backslashes, quotes and newlines are escaped inside quotes.
   */
  public static String escape(String value) {
    if (UNQUOTED_STRING.matcher(value).matches()) {
      return value;
    }
    String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    return "\"" + escaped + "\"";
  }

  /** Fields of a dictionary waiting to be written; values are strings, string lists or dicts. */
  private static class RawDict {
    final Map<String, Object> entries = new TreeMap<>();
    final boolean compact;

    RawDict(boolean compact) {
      this.compact = compact;
    }

    String closingSpacer(String indent) {
      return compact ? " " : "\n" + indent;
    }

    String spacer(String indent) {
      return compact ? " " : "\n" + indent + "\t";
    }

    void appendTo(StringBuilder builder, String indent) {
      builder.append("{");
      if (!compact) {
        builder.append(spacer(indent));
      }
      appendContents(builder, indent);
      builder.append(closingSpacer(indent)).append("};");
    }

    @SuppressWarnings("unchecked")
    void appendContents(StringBuilder builder, String indent) {
      String spacer = spacer(indent);
      String leadingSpacer = "";
      for (Map.Entry<String, Object> entry : entries.entrySet()) {
        String key = escape(entry.getKey());
        Object value = entry.getValue();
        builder.append(leadingSpacer).append(key).append(" = ");
        if (value instanceof RawDict) {
          ((RawDict) value).appendTo(builder, indent + "\t");
        } else if (value instanceof List) {
          builder.append("(");
          String itemSpacer = compact ? spacer : spacer + "\t";
          for (String item : (List<String>) value) {
            builder.append(itemSpacer).append(item).append(",");
          }
          builder.append(spacer).append(");");
        } else {
          builder.append(value).append(";");
        }
        leadingSpacer = spacer;
      }
    }
  }

  /** A top level entry of the {@code objects} table. */
  private static class TypedDict extends RawDict {
    final String gid;
    final String isa;
    final String comment;

    TypedDict(String gid, String isa, @Nullable String comment) {
      super(COMPACT_TYPES.contains(isa));
      this.gid = gid;
      this.isa = isa;
      this.comment = comment == null ? "" : " /* " + comment + " */";
    }

    @Override
    void appendTo(StringBuilder builder, String indent) {
      builder.append(indent).append(gid).append(comment).append(" = {");
      String spacer = spacer(indent);
      if (!compact) {
        builder.append(spacer);
      }
      builder.append("isa = ").append(isa).append(";").append(spacer);
      appendContents(builder, indent);
      builder.append(closingSpacer(indent)).append("};\n");
    }
  }
}
