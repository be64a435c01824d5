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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.modlint.syntax.SourceRange;

/**
 * Thrown when a set of modules cannot be analyzed as a project. Each kind of problem is a
 * subclass, so callers can handle the ones they know how to fix.
 */
public abstract class InvalidProjectException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Rule name used when a structural problem is rendered as an error. */
  public static final String RULE_NAME = "Incorrect project";

  static final DiagnosticType INCORRECT_PROJECT =
      DiagnosticType.create("INCORRECT_PROJECT", "{0}");

  private InvalidProjectException(String message) {
    super(message);
  }

  /** Renders this problem as a single error that is not attached to any file. */
  public RuleError toError() {
    return RuleError.make(
        RULE_NAME, ErrorTarget.GLOBAL, SourceRange.EMPTY, INCORRECT_PROJECT, getMessage());
  }

  /** Some files had no syntax tree. */
  public static final class SomeModulesFailedToParse extends InvalidProjectException {
    private static final long serialVersionUID = 1L;

    private final ImmutableList<String> paths;

    SomeModulesFailedToParse(ImmutableList<String> paths) {
      super("Some modules could not be parsed: " + Joiner.on(", ").join(paths));
      this.paths = paths;
    }

    public ImmutableList<String> getPaths() {
      return paths;
    }
  }

  public static final class NoModules extends InvalidProjectException {
    private static final long serialVersionUID = 1L;

    NoModules() {
      super("The project does not contain any module");
    }
  }

  /** Several files declare the same module name. */
  public static final class DuplicateModuleNames extends InvalidProjectException {
    private static final long serialVersionUID = 1L;

    private final ModuleName moduleName;
    private final ImmutableList<String> paths;

    DuplicateModuleNames(ModuleName moduleName, ImmutableList<String> paths) {
      super(
          "Module "
              + moduleName
              + " is declared by several files: "
              + Joiner.on(", ").join(paths));
      this.moduleName = moduleName;
      this.paths = paths;
    }

    public ModuleName getModuleName() {
      return moduleName;
    }

    public ImmutableList<String> getPaths() {
      return paths;
    }
  }

  /**
   * The import graph has a cycle. Each module of {@link #getCycle()} imports the next one, and the
   * last one imports the first.
   */
  public static final class ImportCycle extends InvalidProjectException {
    private static final long serialVersionUID = 1L;

    private final ImmutableList<ModuleName> cycle;

    ImportCycle(ImmutableList<ModuleName> cycle) {
      super(
          "Import cycle: "
              + Joiner.on(" -> ").join(cycle)
              + " -> "
              + cycle.get(0));
      this.cycle = cycle;
    }

    public ImmutableList<ModuleName> getCycle() {
      return cycle;
    }
  }
}
