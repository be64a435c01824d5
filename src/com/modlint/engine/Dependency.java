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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * A resolved library package and the API it exposes.
 *
 * @param name Package name, e.g. {@code "elm/core"}.
 * @param version Resolved version.
 * @param modules The modules the package exposes.
 */
public record Dependency(String name, String version, ImmutableList<LibraryModule> modules) {
  public Dependency {
    requireNonNull(name, "name");
    requireNonNull(version, "version");
    requireNonNull(modules, "modules");
  }

  /** Returns the exposed module with the given name, or null if the package has none. */
  public @Nullable LibraryModule getModule(ModuleName moduleName) {
    for (LibraryModule module : modules) {
      if (module.name().equals(moduleName)) {
        return module;
      }
    }
    return null;
  }

  /**
   * The API of one module of a package.
   *
   * @param name Name of the module.
   * @param types Exposed type names.
   * @param values Exposed function and constant names.
   * @param operators Exposed infix operators.
   */
  public record LibraryModule(
      ModuleName name,
      ImmutableSet<String> types,
      ImmutableSet<String> values,
      ImmutableSet<String> operators) {
    public LibraryModule {
      requireNonNull(name, "name");
      requireNonNull(types, "types");
      requireNonNull(values, "values");
      requireNonNull(operators, "operators");
    }

    /** Whether the module exposes a type, value or operator with this name. */
    public boolean exposes(String name) {
      return types.contains(name) || values.contains(name) || operators.contains(name);
    }
  }
}
