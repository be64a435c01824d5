/*
 * Copyright 2026 The Modlint Authors.
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

package com.modlint.engine;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The project manifest: what kind of project this is and which packages it declares as
 * dependencies.
 *
 * <p>An application lists exact versions under {@code dependencies.direct},
 * {@code dependencies.indirect}, {@code test-dependencies.direct} and
 * {@code test-dependencies.indirect}. A package lists version constraints under
 * {@code dependencies} and {@code test-dependencies}, and names its exposed modules.
 */
public final class ProjectManifest {

  /** Kinds of projects. */
  public enum Kind {
    APPLICATION,
    PACKAGE
  }

  private final String path;
  private final Kind kind;
  private final @Nullable String name;
  private final ImmutableMap<String, String> dependencies;
  private final ImmutableMap<String, String> testDependencies;
  private final ImmutableMap<String, String> indirectDependencies;
  private final ImmutableList<ModuleName> exposedModules;

  private ProjectManifest(Builder builder) {
    this.path = builder.path;
    this.kind = builder.kind;
    this.name = builder.name;
    this.dependencies = builder.dependencies.buildKeepingLast();
    this.testDependencies = builder.testDependencies.buildKeepingLast();
    this.indirectDependencies = builder.indirectDependencies.buildKeepingLast();
    this.exposedModules = builder.exposedModules.build();
  }

  public static Builder application(String path) {
    return new Builder(path, Kind.APPLICATION, null);
  }

  public static Builder forPackage(String path, String name) {
    return new Builder(path, Kind.PACKAGE, checkNotNull(name));
  }

  /**
   * Parses the JSON text of a manifest.
   *
   * @throws ParseException if the text is not a well-formed manifest
   */
  public static ProjectManifest parse(String path, String json) throws ParseException {
    JsonObject root;
    try {
      JsonElement element = JsonParser.parseString(json);
      if (!element.isJsonObject()) {
        throw new ParseException(path, "expected a JSON object at the top level");
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new ParseException(path, e.getMessage(), e);
    }

    String type = getString(path, root, "type");
    try {
      switch (type) {
        case "application":
          return parseApplication(path, root);
        case "package":
          return parsePackage(path, root);
        default:
          throw new ParseException(path, "unknown project type \"" + type + "\"");
      }
    } catch (IllegalStateException | ClassCastException e) {
      throw new ParseException(path, e.getMessage(), e);
    }
  }

  private static ProjectManifest parseApplication(String path, JsonObject root)
      throws ParseException {
    Builder builder = application(path);
    JsonObject dependencies = getObject(path, root, "dependencies");
    readVersions(path, getObject(path, dependencies, "direct"), builder.dependencies);
    readVersions(path, getObject(path, dependencies, "indirect"), builder.indirectDependencies);
    if (root.has("test-dependencies")) {
      JsonObject testDependencies = getObject(path, root, "test-dependencies");
      if (testDependencies.has("direct")) {
        readVersions(path, getObject(path, testDependencies, "direct"), builder.testDependencies);
      }
      if (testDependencies.has("indirect")) {
        readVersions(
            path, getObject(path, testDependencies, "indirect"), builder.indirectDependencies);
      }
    }
    return builder.build();
  }

  private static ProjectManifest parsePackage(String path, JsonObject root)
      throws ParseException {
    Builder builder = forPackage(path, getString(path, root, "name"));
    readVersions(path, getObject(path, root, "dependencies"), builder.dependencies);
    if (root.has("test-dependencies")) {
      readVersions(path, getObject(path, root, "test-dependencies"), builder.testDependencies);
    }
    JsonElement exposed = root.get("exposed-modules");
    if (exposed != null) {
      // Either a flat list, or lists grouped under documentation headings.
      if (exposed.isJsonArray()) {
        readModuleNames(path, exposed, builder);
      } else {
        for (Map.Entry<String, JsonElement> group : exposed.getAsJsonObject().entrySet()) {
          readModuleNames(path, group.getValue(), builder);
        }
      }
    }
    return builder.build();
  }

  private static void readModuleNames(String path, JsonElement array, Builder builder)
      throws ParseException {
    for (JsonElement element : array.getAsJsonArray()) {
      if (!isString(element)) {
        throw new ParseException(path, "exposed module names must be strings, got " + element);
      }
      try {
        builder.addExposedModule(ModuleName.fromString(element.getAsString()));
      } catch (IllegalArgumentException e) {
        throw new ParseException(path, e.getMessage(), e);
      }
    }
  }

  private static void readVersions(
      String path, JsonObject object, ImmutableMap.Builder<String, String> into)
      throws ParseException {
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      if (!isString(entry.getValue())) {
        throw new ParseException(path, "version of \"" + entry.getKey() + "\" must be a string");
      }
      into.put(entry.getKey(), entry.getValue().getAsString());
    }
  }

  private static boolean isString(JsonElement element) {
    return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
  }

  private static String getString(String path, JsonObject object, String key)
      throws ParseException {
    JsonElement element = object.get(key);
    if (element == null || !element.isJsonPrimitive()) {
      throw new ParseException(path, "missing string field \"" + key + "\"");
    }
    return element.getAsString();
  }

  private static JsonObject getObject(String path, JsonObject object, String key)
      throws ParseException {
    JsonElement element = object.get(key);
    if (element == null || !element.isJsonObject()) {
      throw new ParseException(path, "missing object field \"" + key + "\"");
    }
    return element.getAsJsonObject();
  }

  public String getPath() {
    return path;
  }

  public Kind getKind() {
    return kind;
  }

  /** The package name, or null for applications. */
  public @Nullable String getName() {
    return name;
  }

  /**
   * Direct dependencies of an application, or the dependencies of a package, mapped to their
   * version or version constraint.
   */
  public ImmutableMap<String, String> getDependencies() {
    return dependencies;
  }

  public ImmutableMap<String, String> getTestDependencies() {
    return testDependencies;
  }

  /** Indirect dependencies of an application. Always empty for packages. */
  public ImmutableMap<String, String> getIndirectDependencies() {
    return indirectDependencies;
  }

  public ImmutableList<ModuleName> getExposedModules() {
    return exposedModules;
  }

  /**
   * The names of the packages this project depends on directly: "direct" and "test direct" for an
   * application, "dependencies" and "test-dependencies" for a package.
   */
  public ImmutableSet<String> getDirectDependencyNames() {
    return ImmutableSet.<String>builder()
        .addAll(dependencies.keySet())
        .addAll(testDependencies.keySet())
        .build();
  }

  /** Builder for {@link ProjectManifest}. */
  public static final class Builder {
    private final String path;
    private final Kind kind;
    private final @Nullable String name;
    private final ImmutableMap.Builder<String, String> dependencies = ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> testDependencies = ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> indirectDependencies =
        ImmutableMap.builder();
    private final ImmutableList.Builder<ModuleName> exposedModules = ImmutableList.builder();

    private Builder(String path, Kind kind, @Nullable String name) {
      this.path = checkNotNull(path);
      this.kind = kind;
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder addDependency(String packageName, String version) {
      dependencies.put(packageName, version);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addTestDependency(String packageName, String version) {
      testDependencies.put(packageName, version);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addIndirectDependency(String packageName, String version) {
      indirectDependencies.put(packageName, version);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addExposedModule(ModuleName moduleName) {
      exposedModules.add(moduleName);
      return this;
    }

    public ProjectManifest build() {
      return new ProjectManifest(this);
    }
  }

  /** Thrown when the text of a manifest cannot be understood. */
  public static final class ParseException extends Exception {
    private static final long serialVersionUID = 1L;

    ParseException(String path, String message) {
      super(path + ": " + message);
    }

    ParseException(String path, String message, Throwable cause) {
      super(path + ": " + message, cause);
    }
  }
}
