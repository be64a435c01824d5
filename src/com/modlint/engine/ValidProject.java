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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.modlint.syntax.Node;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A project that passed {@link ProjectValidator}: every module parsed, module names are unique and
 * the import graph is acyclic.
 *
 * <p>Instances are immutable. Updates such as {@link #patchModule} and {@link #withCache} return a
 * new project and leave this one usable.
 */
public final class ValidProject {
  private static final Logger logger = Logger.getLogger(ValidProject.class.getName());

  private final ImmutableMap<String, SourceModule> modulesByPath;
  private final ImmutableMap<ModuleName, SourceModule> modulesByName;
  private final @Nullable ProjectManifest manifest;
  private final @Nullable Readme readme;
  private final ImmutableMap<String, Dependency> dependencies;
  private final ModuleGraph graph;
  private final ImmutableList<ModuleName> topologicalOrder;
  private final AnalysisCache cache;

  /** Whether the import set of a module changed since the graph was built. */
  private final boolean graphStale;

  ValidProject(
      ImmutableMap<String, SourceModule> modulesByPath,
      @Nullable ProjectManifest manifest,
      @Nullable Readme readme,
      ImmutableMap<String, Dependency> dependencies,
      ModuleGraph graph,
      ImmutableList<ModuleName> topologicalOrder,
      AnalysisCache cache,
      boolean graphStale) {
    this.modulesByPath = modulesByPath;
    ImmutableMap.Builder<ModuleName, SourceModule> byName = ImmutableMap.builder();
    for (SourceModule module : modulesByPath.values()) {
      byName.put(module.getModuleName(), module);
    }
    this.modulesByName = byName.buildOrThrow();
    this.manifest = manifest;
    this.readme = readme;
    this.dependencies = dependencies;
    this.graph = graph;
    this.topologicalOrder = topologicalOrder;
    this.cache = checkNotNull(cache);
    this.graphStale = graphStale;
  }

  /** All modules, in the order they were given to the validator. */
  public ImmutableList<SourceModule> getModules() {
    return modulesByPath.values().asList();
  }

  public @Nullable SourceModule getModuleByPath(String path) {
    return modulesByPath.get(path);
  }

  public @Nullable SourceModule getModuleByName(ModuleName name) {
    return modulesByName.get(name);
  }

  public ModuleGraph getModuleGraph() {
    return graph;
  }

  /** Module names such that every module comes after the modules it imports. */
  public ImmutableList<ModuleName> getTopologicalOrder() {
    return topologicalOrder;
  }

  /** Modules in {@link #getTopologicalOrder() topological order}. */
  public ImmutableList<SourceModule> getModulesInImportOrder() {
    checkState(!graphStale, "The import graph must be recomputed first");
    ImmutableList.Builder<SourceModule> result = ImmutableList.builder();
    for (ModuleName name : topologicalOrder) {
      result.add(modulesByName.get(name));
    }
    return result.build();
  }

  /** Returns a new cursor over the modules, in topological order. */
  public ModuleCursor moduleCursor() {
    return new ModuleCursor(getModulesInImportOrder());
  }

  public @Nullable ProjectManifest getManifest() {
    return manifest;
  }

  public @Nullable Readme getReadme() {
    return readme;
  }

  /** All resolved dependencies, direct and indirect, by package name. */
  public ImmutableMap<String, Dependency> getDependencies() {
    return dependencies;
  }

  /**
   * The dependencies the manifest declares directly, including test dependencies. Without a
   * manifest, all dependencies.
   */
  public ImmutableMap<String, Dependency> getDirectDependencies() {
    if (manifest == null) {
      return dependencies;
    }
    ImmutableSet<String> declared = manifest.getDirectDependencyNames();
    ImmutableMap.Builder<String, Dependency> result = ImmutableMap.builder();
    for (Map.Entry<String, Dependency> entry : dependencies.entrySet()) {
      if (declared.contains(entry.getKey())) {
        result.put(entry);
      }
    }
    return result.buildOrThrow();
  }

  public AnalysisCache getCache() {
    return cache;
  }

  public ValidProject withCache(AnalysisCache newCache) {
    return new ValidProject(
        modulesByPath,
        manifest,
        readme,
        dependencies,
        graph,
        topologicalOrder,
        newCache,
        graphStale);
  }

  /**
   * Whether a patch changed a module's imports. A stale project must be refreshed with {@link
   * #recomputeGraph()} before rules run on it.
   */
  public boolean isGraphStale() {
    return graphStale;
  }

  /**
   * Replaces the contents of one module, typically after a fix was applied to it.
   *
   * <p>When the new tree imports the same modules as the old one, the graph and topological order
   * are kept. Otherwise the returned project is {@link #isGraphStale() stale}.
   *
   * @return the patched project, or null if the new source did not parse into a module with a
   *     header or declares another module name, in which case the caller must validate the whole
   *     project again
   * @throws IllegalArgumentException if the project has no module at {@code path}
   */
  public @Nullable ValidProject patchModule(String path, String newSource, @Nullable Node newAst) {
    SourceModule original = modulesByPath.get(path);
    checkArgument(original != null, "No module at %s", path);
    if (newAst == null) {
      return null;
    }
    if (!newAst.hasModuleDeclaration()) {
      logger.fine("Rejected patch of " + path + ": tree is not a module with a header");
      return null;
    }
    SourceModule patched = original.withContents(newSource, newAst);
    if (!patched.getModuleName().equals(original.getModuleName())) {
      logger.fine(
          "Rejected patch of " + path + ": module name changed to " + patched.getModuleName());
      return null;
    }

    ImmutableMap.Builder<String, SourceModule> newModules = ImmutableMap.builder();
    for (Map.Entry<String, SourceModule> entry : modulesByPath.entrySet()) {
      newModules.put(entry.getKey(), entry.getKey().equals(path) ? patched : entry.getValue());
    }
    boolean sameImports =
        ImmutableSet.copyOf(patched.getImports())
            .equals(ImmutableSet.copyOf(original.getImports()));
    return new ValidProject(
        newModules.buildOrThrow(),
        manifest,
        readme,
        dependencies,
        graph,
        topologicalOrder,
        cache,
        graphStale || !sameImports);
  }

  /**
   * Rebuilds the import graph and topological order from the current modules.
   *
   * @throws InvalidProjectException.ImportCycle if a patch introduced an import cycle
   */
  public ValidProject recomputeGraph() throws InvalidProjectException.ImportCycle {
    ModuleGraph newGraph = ModuleGraph.build(getModules());
    ImmutableList<ModuleName> newOrder = newGraph.sortTopologically();
    return new ValidProject(
        modulesByPath, manifest, readme, dependencies, newGraph, newOrder, cache, false);
  }

  @Override
  public String toString() {
    return "ValidProject" + topologicalOrder;
  }
}
