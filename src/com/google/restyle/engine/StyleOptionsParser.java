/*
 * Copyright 2026 The Restyle Authors.
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

package com.google.restyle.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.restyle.tree.CommentAnchoring;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads {@link StyleOptions} from JSON, for example:
 *
 * <pre>
 * {
 *   "enabledPasses": ["foldConstants", {"name": "flattenBlocks", "ignorePrefixes": ["lib/"]}],
 *   "onError": "log",
 *   "lineLength": 122,
 *   "commentAnchoring": "line"
 * }
 * </pre>
 *
 * Every key is optional. Pass names are not checked here; {@link PassConfig#resolve} does that.
 */
public final class StyleOptionsParser {

  private static final String ENABLED_PASSES = "enabledPasses";
  private static final String ON_ERROR = "onError";
  private static final String LINE_LENGTH = "lineLength";
  private static final String COMMENT_ANCHORING = "commentAnchoring";
  private static final ImmutableSet<String> KEYS =
      ImmutableSet.of(ENABLED_PASSES, ON_ERROR, LINE_LENGTH, COMMENT_ANCHORING);

  private static final String NAME = "name";
  private static final String IGNORE_PREFIXES = "ignorePrefixes";
  private static final ImmutableSet<String> PASS_KEYS = ImmutableSet.of(NAME, IGNORE_PREFIXES);

  private StyleOptionsParser() {}

  /**
   * Parses options from a configuration file.
   *
   * @param configFile The file to read, in UTF-8.
   * @param workingDirectory The directory paths are resolved against during the run.
   * @throws ConfigError if the file content is not a valid configuration
   */
  public static StyleOptions parse(Path configFile, Path workingDirectory) throws IOException {
    String contents = new String(Files.readAllBytes(configFile), StandardCharsets.UTF_8);
    try {
      return parse(contents, workingDirectory);
    } catch (ConfigError e) {
      throw new ConfigError(configFile + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parses options from JSON text. Blank text yields the defaults.
   *
   * @throws ConfigError if {@code contents} is not a valid configuration
   */
  public static StyleOptions parse(String contents, Path workingDirectory) {
    StyleOptions.Builder builder = StyleOptions.builder().setWorkingDirectory(workingDirectory);

    JsonElement root;
    try {
      root = JsonParser.parseString(contents);
    } catch (JsonParseException e) {
      throw new ConfigError("JSON parse exception: " + e.getMessage(), e);
    }
    if (root.isJsonNull()) {
      return builder.build();
    }
    if (!root.isJsonObject()) {
      throw new ConfigError("Configuration must be a JSON object, found: " + root);
    }

    JsonObject object = root.getAsJsonObject();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      if (!KEYS.contains(entry.getKey())) {
        throw new ConfigError(
            "Unknown configuration key \"" + entry.getKey() + "\". Known keys: " + KEYS);
      }
    }

    if (object.has(ENABLED_PASSES)) {
      builder.setEnabledPasses(parsePassList(object.get(ENABLED_PASSES)));
    }
    if (object.has(ON_ERROR)) {
      String name = getString(object, ON_ERROR);
      FailurePolicy policy = FailurePolicy.forConfigName(name);
      if (policy == null) {
        throw new ConfigError(
            "\"" + ON_ERROR + "\" must be \"log\" or \"raise\", found \"" + name + "\"");
      }
      builder.setFailurePolicy(policy);
    }
    if (object.has(LINE_LENGTH)) {
      builder.setLineLength(getPositiveInt(object, LINE_LENGTH));
    }
    if (object.has(COMMENT_ANCHORING)) {
      String name = getString(object, COMMENT_ANCHORING);
      CommentAnchoring anchoring = CommentAnchoring.forConfigName(name);
      if (anchoring == null) {
        throw new ConfigError(
            "\""
                + COMMENT_ANCHORING
                + "\" must be \"line\", \"keep\" or \"drop\", found \""
                + name
                + "\"");
      }
      builder.setCommentAnchoring(anchoring);
    }
    return builder.build();
  }

  private static ImmutableList<PassSetting> parsePassList(JsonElement element) {
    if (!element.isJsonArray()) {
      throw new ConfigError("\"" + ENABLED_PASSES + "\" must be an array, found: " + element);
    }
    ImmutableList.Builder<PassSetting> passes = ImmutableList.builder();
    for (JsonElement each : element.getAsJsonArray()) {
      passes.add(parsePass(each));
    }
    return passes.build();
  }

  private static PassSetting parsePass(JsonElement element) {
    if (isString(element)) {
      return PassSetting.create(element.getAsString());
    }
    if (!element.isJsonObject()) {
      throw new ConfigError("A pass must be a name or an object, found: " + element);
    }
    JsonObject pass = element.getAsJsonObject();
    for (String key : pass.keySet()) {
      if (!PASS_KEYS.contains(key)) {
        throw new ConfigError("Unknown pass key \"" + key + "\". Known keys: " + PASS_KEYS);
      }
    }
    if (!pass.has(NAME)) {
      throw new ConfigError("A pass object must have a \"" + NAME + "\": " + element);
    }
    String name = getString(pass, NAME);
    if (!pass.has(IGNORE_PREFIXES)) {
      return PassSetting.create(name);
    }
    return PassSetting.create(name, getStringArray(pass, IGNORE_PREFIXES));
  }

  private static boolean isString(JsonElement element) {
    return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
  }

  private static String getString(JsonObject object, String key) {
    JsonElement element = object.get(key);
    if (!isString(element)) {
      throw new ConfigError("\"" + key + "\" must be a string, found: " + element);
    }
    return element.getAsString();
  }

  private static ImmutableList<String> getStringArray(JsonObject object, String key) {
    JsonElement element = object.get(key);
    if (!element.isJsonArray()) {
      throw new ConfigError("\"" + key + "\" must be an array of strings, found: " + element);
    }
    JsonArray array = element.getAsJsonArray();
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement each : array) {
      if (!isString(each)) {
        throw new ConfigError("\"" + key + "\" must be an array of strings, found: " + element);
      }
      result.add(each.getAsString());
    }
    return result.build();
  }

  private static int getPositiveInt(JsonObject object, String key) {
    JsonElement element = object.get(key);
    if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
      JsonPrimitive number = element.getAsJsonPrimitive();
      double value = number.getAsDouble();
      if (value >= 1 && value <= Integer.MAX_VALUE && value == Math.rint(value)) {
        return (int) value;
      }
    }
    throw new ConfigError("\"" + key + "\" must be a positive integer, found: " + element);
  }
}
