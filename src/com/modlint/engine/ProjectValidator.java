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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Checks that a set of parsed modules forms a project the rules can run on: every module parsed,
 * there is at least one module, module names are unique and imports do not form a cycle.
 */
public final class ProjectValidator {
  private static final Logger logger = Logger.getLogger(ProjectValidator.class.getName());

  private ProjectValidator() {}

  /**
   * Validates the given modules.
   *
   * @param modules the project's modules, in a stable order (for example sorted by path)
   * @param manifest the project manifest, if there is one
   * @param readme the project readme, if there is one
   * @param dependencies the resolved library dependencies, by package name
   * @throws InvalidProjectException describing the first problem found, checking parse failures,
   *     then emptiness, then duplicate names, then import cycles
   */
  public static ValidProject validate(
      List<SourceModule> modules,
      @Nullable ProjectManifest manifest,
      @Nullable Readme readme,
      Map<String, Dependency> dependencies)
      throws InvalidProjectException {
    ImmutableList.Builder<String> unparsed = ImmutableList.builder();
    for (SourceModule module : modules) {
      if (!module.isParsed()) {
        unparsed.add(module.getPath());
      }
    }
    ImmutableList<String> failures = unparsed.build();
    if (!failures.isEmpty()) {
      throw new InvalidProjectException.SomeModulesFailedToParse(failures);
    }

    if (modules.isEmpty()) {
      throw new InvalidProjectException.NoModules();
    }

    Map<ModuleName, List<String>> pathsByName = new LinkedHashMap<>();
    for (SourceModule module : modules) {
      pathsByName
          .computeIfAbsent(module.getModuleName(), n -> new ArrayList<>())
          .add(module.getPath());
    }
    for (Map.Entry<ModuleName, List<String>> entry : pathsByName.entrySet()) {
      if (entry.getValue().size() > 1) {
        throw new InvalidProjectException.DuplicateModuleNames(
            entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      }
    }

    ModuleGraph graph = ModuleGraph.build(modules);
    ImmutableList<ModuleName> order = graph.sortTopologically();
    logger.fine("Validated project of " + modules.size() + " modules");

    ImmutableMap.Builder<String, SourceModule> byPath = ImmutableMap.builder();
    for (SourceModule module : modules) {
      byPath.put(module.getPath(), module);
    }
    return new ValidProject(
        byPath.buildOrThrow(),
        manifest,
        readme,
        ImmutableMap.copyOf(dependencies),
        graph,
        order,
        AnalysisCache.EMPTY,
        false);
  }
}
