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

import com.facebook.xcodegen.log.Logger;
import com.facebook.xcodegen.util.json.ObjectMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Reads the rule records produced by the extraction aspect.
 *
 * <p>The input is either a JSON array of records or an object with a {@code rule_entries} array.
 * Both the record keys and the keys of the {@code attr} object form a closed set: an unknown key
 * means the aspect and the generator are out of sync and parsing fails.
 */
public class RuleEntryParser {

  private static final Logger LOG = Logger.get(RuleEntryParser.class);

  private static final String RULE_ENTRIES = "rule_entries";

  static final ImmutableSet<String> RECORD_KEYS =
      ImmutableSet.of(
          "label",
          "type",
          "attr",
          "srcs",
          "non_arc_srcs",
          "generated_files",
          "generated_non_arc_files",
          "includes",
          "deps",
          "weak_deps",
          "extensions",
          "framework_imports",
          "artifacts",
          "secondary_product_artifacts",
          "bundle_id",
          "bundle_name",
          "platform_type",
          "os_deployment_target",
          "swift_language_version",
          "swift_toolchain",
          "swift_transitive_modules",
          "objc_module_maps",
          "module_name",
          "build_file",
          "objc_defines",
          "swift_defines");

  public ImmutableList<RuleEntry> parse(Path path) throws IOException {
    LOG.debug("Reading rule entries from %s", path);
    return parse(ObjectMappers.readTree(path));
  }

  public ImmutableList<RuleEntry> parse(InputStream stream) throws IOException {
    return parse(ObjectMappers.readTree(stream));
  }

  public ImmutableList<RuleEntry> parse(String json) {
    try {
      return parse(ObjectMappers.readTree(json));
    } catch (JsonProcessingException e) {
      throw new RuleEntryParseException(e, "Rule entries are not valid JSON: %s", e.getMessage());
    } catch (IOException e) {
      throw new RuleEntryParseException(e, "Unable to read rule entries: %s", e.getMessage());
    }
  }

  public ImmutableList<RuleEntry> parse(JsonNode root) {
    JsonNode records = root;
    if (root.isObject()) {
      records = root.get(RULE_ENTRIES);
    }
    if (records == null || !records.isArray()) {
      throw new RuleEntryParseException(
          "Expected a list of rule entries or an object with a '%s' list", RULE_ENTRIES);
    }
    ImmutableList.Builder<RuleEntry> entries = ImmutableList.builder();
    for (JsonNode record : records) {
      entries.add(parseRuleEntry(record));
    }
    return entries.build();
  }

  public RuleEntry parseRuleEntry(JsonNode record) {
    if (!record.isObject()) {
      throw new RuleEntryParseException("Rule entry must be an object, got %s", record);
    }
    String label = requireText(record, "label", "<unknown>");
    Iterator<String> fieldNames = record.fieldNames();
    while (fieldNames.hasNext()) {
      String key = fieldNames.next();
      if (!RECORD_KEYS.contains(key)) {
        throw new RuleEntryParseException("Rule %s has unknown key '%s'", label, key);
      }
    }

    RuleEntry.Builder builder =
        RuleEntry.builder()
            .setLabel(BuildLabel.of(label))
            .setType(requireText(record, "type", label))
            .setAttributes(parseAttributes(label, record));

    builder.addAllSourceFiles(parseFiles(label, record, "srcs", true));
    builder.addAllSourceFiles(parseFiles(label, record, "generated_files", false));
    builder.addAllNonARCSourceFiles(parseFiles(label, record, "non_arc_srcs", true));
    builder.addAllNonARCSourceFiles(parseFiles(label, record, "generated_non_arc_files", false));
    builder.addAllFrameworkImports(parseFiles(label, record, "framework_imports", true));
    builder.addAllArtifacts(parseFiles(label, record, "artifacts", false));
    builder.addAllSecondaryArtifacts(
        parseFiles(label, record, "secondary_product_artifacts", false));
    builder.addAllSwiftTransitiveModules(
        parseFiles(label, record, "swift_transitive_modules", false));
    builder.addAllObjcModuleMaps(parseFiles(label, record, "objc_module_maps", false));

    builder.addAllDependencies(parseLabels(label, record, "deps"));
    builder.addAllWeakDependencies(parseLabels(label, record, "weak_deps"));
    builder.addAllExtensions(parseLabels(label, record, "extensions"));
    builder.addAllGeneratedIncludePaths(parseIncludePaths(label, record.get("includes")));
    builder.addAllObjcDefines(parseStrings(label, "objc_defines", record.get("objc_defines")));
    builder.addAllSwiftDefines(parseStrings(label, "swift_defines", record.get("swift_defines")));

    if (record.hasNonNull("bundle_id")) {
      builder.setBundleId(requireText(record, "bundle_id", label));
    }
    if (record.hasNonNull("bundle_name")) {
      builder.setBundleName(requireText(record, "bundle_name", label));
    }
    if (record.hasNonNull("module_name")) {
      builder.setModuleName(requireText(record, "module_name", label));
    }
    if (record.hasNonNull("build_file")) {
      builder.setBuildFilePath(requireText(record, "build_file", label));
    }
    if (record.hasNonNull("platform_type") && record.hasNonNull("os_deployment_target")) {
      builder.setDeploymentTarget(
          DeploymentTarget.of(
              PlatformType.fromIdentifier(requireText(record, "platform_type", label)),
              parseVersion(label, requireText(record, "os_deployment_target", label))));
    }
    return builder.build();
  }

  private RuleAttributes parseAttributes(String label, JsonNode record) {
    RuleAttributes.Builder builder = RuleAttributes.builder();
    // Older aspects report the Swift settings next to the attributes instead of inside them.
    if (record.hasNonNull("swift_language_version")) {
      builder.setSwiftLanguageVersion(requireText(record, "swift_language_version", label));
    }
    if (record.hasNonNull("swift_toolchain")) {
      builder.setSwiftToolchain(requireText(record, "swift_toolchain", label));
    }

    JsonNode attributes = record.get("attr");
    if (attributes == null || attributes.isNull()) {
      return builder.build();
    }
    if (!attributes.isObject()) {
      throw new RuleEntryParseException("Rule %s: 'attr' must be an object", label);
    }
    Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      RuleAttribute attribute =
          RuleAttribute.fromKey(field.getKey())
              .orElseThrow(
                  () ->
                      new RuleEntryParseException(
                          "Rule %s has unknown attribute '%s'", label, field.getKey()));
      JsonNode value = field.getValue();
      if (value.isNull()) {
        continue;
      }
      setAttribute(label, builder, attribute, value);
    }
    return builder.build();
  }

  private void setAttribute(
      String label, RuleAttributes.Builder builder, RuleAttribute attribute, JsonNode value) {
    String key = attribute.getKey();
    switch (attribute) {
      case BINARY:
        builder.setBinary(parseLabel(label, key, value));
        break;
      case BRIDGING_HEADER:
        builder.setBridgingHeader(parseFile(label, key, value, true));
        break;
      case COMPILER_DEFINES:
        builder.setCompilerDefines(parseStrings(label, key, value));
        break;
      case COPTS:
        builder.setCopts(parseStrings(label, key, value));
        break;
      case DATAMODELS:
        builder.setDatamodels(parseFileList(label, key, value, true));
        break;
      case DEFINES:
        builder.setDefines(parseStrings(label, key, value));
        break;
      case ENABLE_MODULES:
        builder.setEnableModules(parseBoolean(label, key, value));
        break;
      case HAS_SWIFT_DEPENDENCY:
        builder.setHasSwiftDependency(parseBoolean(label, key, value));
        break;
      case HAS_SWIFT_INFO:
        builder.setHasSwiftInfo(parseBoolean(label, key, value));
        break;
      case INCLUDES:
        builder.setIncludes(parseStrings(label, key, value));
        break;
      case LAUNCH_STORYBOARD:
        builder.setLaunchStoryboard(parseFile(label, key, value, true));
        break;
      case PCH:
        builder.setPch(parseFile(label, key, value, true));
        break;
      case SWIFT_LANGUAGE_VERSION:
        builder.setSwiftLanguageVersion(parseText(label, key, value));
        break;
      case SWIFT_TOOLCHAIN:
        builder.setSwiftToolchain(parseText(label, key, value));
        break;
      case SWIFTC_OPTS:
        builder.setSwiftcOpts(parseStrings(label, key, value));
        break;
      case SUPPORTING_FILES:
        builder.setSupportingFiles(parseFileList(label, key, value, true));
        break;
      case TEST_HOST:
        builder.setTestHost(parseLabel(label, key, value));
        break;
      case XCTEST:
        builder.setXctest(parseBoolean(label, key, value));
        break;
      case XCTEST_APP:
        builder.setXctestApp(parseLabel(label, key, value));
        break;
    }
  }

  private static String requireText(JsonNode record, String key, String label) {
    JsonNode value = record.get(key);
    if (value == null || value.isNull()) {
      throw new RuleEntryParseException("Rule %s is missing '%s'", label, key);
    }
    return parseText(label, key, value);
  }

  private static String parseText(String label, String key, JsonNode value) {
    if (!value.isTextual()) {
      throw new RuleEntryParseException("Rule %s: '%s' must be a string", label, key);
    }
    return value.asText();
  }

  private static boolean parseBoolean(String label, String key, JsonNode value) {
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    // The aspect writes some flags as 0/1.
    if (value.isIntegralNumber()) {
      return value.intValue() != 0;
    }
    throw new RuleEntryParseException("Rule %s: '%s' must be a boolean", label, key);
  }

  private static BuildLabel parseLabel(String label, String key, JsonNode value) {
    return BuildLabel.of(parseText(label, key, value));
  }

  private static ImmutableList<String> parseStrings(
      String label, String key, @Nullable JsonNode value) {
    if (value == null || value.isNull()) {
      return ImmutableList.of();
    }
    if (!value.isArray()) {
      throw new RuleEntryParseException("Rule %s: '%s' must be a list of strings", label, key);
    }
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (JsonNode item : value) {
      strings.add(parseText(label, key, item));
    }
    return strings.build();
  }

  private static ImmutableList<BuildLabel> parseLabels(String label, JsonNode record, String key) {
    ImmutableList.Builder<BuildLabel> labels = ImmutableList.builder();
    for (String value : parseStrings(label, key, record.get(key))) {
      labels.add(BuildLabel.of(value));
    }
    return labels.build();
  }

  private static ImmutableList<BazelFileInfo> parseFiles(
      String label, JsonNode record, String key, boolean defaultIsSource) {
    JsonNode value = record.get(key);
    if (value == null || value.isNull()) {
      return ImmutableList.of();
    }
    return parseFileList(label, key, value, defaultIsSource);
  }

  private static ImmutableList<BazelFileInfo> parseFileList(
      String label, String key, JsonNode value, boolean defaultIsSource) {
    if (!value.isArray()) {
      throw new RuleEntryParseException("Rule %s: '%s' must be a list of files", label, key);
    }
    ImmutableList.Builder<BazelFileInfo> files = ImmutableList.builder();
    for (JsonNode item : value) {
      files.add(parseFile(label, key, item, defaultIsSource));
    }
    return files.build();
  }

  /**
   * A file is either a plain path or an object with {@code path}, {@code src}, and the optional
   * {@code root} and {@code is_dir}.
   */
  private static BazelFileInfo parseFile(
      String label, String key, JsonNode value, boolean defaultIsSource) {
    if (value.isTextual()) {
      return BazelFileInfo.builder()
          .setSubPath(value.asText())
          .setSourceFile(defaultIsSource)
          .build();
    }
    if (!value.isObject() || !value.hasNonNull("path")) {
      throw new RuleEntryParseException("Rule %s: '%s' has a malformed file entry", label, key);
    }
    BazelFileInfo.Builder builder =
        BazelFileInfo.builder().setSubPath(parseText(label, key, value.get("path")));
    builder.setSourceFile(
        value.hasNonNull("src") ? parseBoolean(label, key, value.get("src")) : defaultIsSource);
    if (value.hasNonNull("root")) {
      builder.setRootPath(parseText(label, key, value.get("root")));
    }
    if (value.hasNonNull("is_dir")) {
      builder.setDirectory(parseBoolean(label, key, value.get("is_dir")));
    }
    return builder.build();
  }

  /** Include paths are {@code [path, recursive]} pairs, objects or plain paths. */
  private static ImmutableList<IncludePath> parseIncludePaths(
      String label, @Nullable JsonNode value) {
    if (value == null || value.isNull()) {
      return ImmutableList.of();
    }
    if (!value.isArray()) {
      throw new RuleEntryParseException("Rule %s: 'includes' must be a list", label);
    }
    ImmutableList.Builder<IncludePath> paths = ImmutableList.builder();
    for (JsonNode item : value) {
      if (item.isTextual()) {
        paths.add(IncludePath.of(item.asText(), false));
      } else if (item.isArray() && item.size() == 2) {
        paths.add(
            IncludePath.of(
                parseText(label, "includes", item.get(0)),
                parseBoolean(label, "includes", item.get(1))));
      } else if (item.isObject() && item.hasNonNull("path")) {
        boolean recursive =
            item.hasNonNull("recursive") && parseBoolean(label, "includes", item.get("recursive"));
        paths.add(IncludePath.of(parseText(label, "includes", item.get("path")), recursive));
      } else {
        throw new RuleEntryParseException("Rule %s has a malformed include path %s", label, item);
      }
    }
    return paths.build();
  }

  private static DottedVersion parseVersion(String label, String version) {
    return DottedVersion.parse(version)
        .orElseThrow(
            () ->
                new RuleEntryParseException(
                    "Rule %s has an invalid os_deployment_target '%s'", label, version));
  }
}
