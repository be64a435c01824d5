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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.modlint.engine.ModuleRuleSchema.FinalEvaluation;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Describes a rule that looks at the project as a whole: its manifest, readme and dependencies,
 * and its modules through one or more module schemas whose results are folded into a project
 * context.
 *
 * <p>Module visitors need a {@link ContextBridge}, set with {@link #withModuleContext}. By default
 * modules are visited independently of each other; {@link #withContextFromImportedModules()} makes
 * each module start from what the modules it imports produced.
 *
 * @param <P> the project context
 * @param <M> the module context
 */
public final class ProjectRuleSchema<P, M> {

  /** Visits one project-level artifact, which may be absent. */
  @FunctionalInterface
  public interface ProjectVisitor<T, P> {
    P visit(RuleTraversal t, @Nullable T value, P context);
  }

  private final String name;
  private final P initialProjectContext;

  private final List<ProjectVisitor<ProjectManifest, P>> manifestVisitors = new ArrayList<>();
  private final List<ProjectVisitor<Readme, P>> readmeVisitors = new ArrayList<>();
  private final List<ProjectVisitor<ImmutableMap<String, Dependency>, P>> dependenciesVisitors =
      new ArrayList<>();
  private final List<ProjectVisitor<ImmutableMap<String, Dependency>, P>>
      directDependenciesVisitors = new ArrayList<>();
  private final List<FinalEvaluation<P>> finalEvaluations = new ArrayList<>();
  private ModuleVisitors<M> moduleVisitors = ModuleVisitors.empty();
  private @Nullable ContextBridge<P, M> contextBridge;
  private TraversalMode traversalMode = TraversalMode.UNORDERED;

  private ProjectRuleSchema(String name, P initialProjectContext) {
    this.name = checkNotNull(name);
    this.initialProjectContext = checkNotNull(initialProjectContext);
  }

  /**
   * Starts a project rule.
   *
   * @param initialProjectContext the context project visitors start from. It should have value
   *     semantics so that cached module results can be reused.
   */
  public static <P, M> ProjectRuleSchema<P, M> create(String name, P initialProjectContext) {
    return new ProjectRuleSchema<>(name, initialProjectContext);
  }

  public String getName() {
    return name;
  }

  /** Visits the project manifest, or null if the project has none. */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withManifestProjectVisitor(
      ProjectVisitor<ProjectManifest, P> visitor) {
    manifestVisitors.add(checkNotNull(visitor));
    return this;
  }

  /** Visits the project readme, or null if the project has none. */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withReadmeProjectVisitor(ProjectVisitor<Readme, P> visitor) {
    readmeVisitors.add(checkNotNull(visitor));
    return this;
  }

  /** Visits all resolved dependencies, direct and indirect. */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withDependenciesProjectVisitor(
      ProjectVisitor<ImmutableMap<String, Dependency>, P> visitor) {
    dependenciesVisitors.add(checkNotNull(visitor));
    return this;
  }

  /** Visits the dependencies the manifest declares directly. */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withDirectDependenciesProjectVisitor(
      ProjectVisitor<ImmutableMap<String, Dependency>, P> visitor) {
    directDependenciesVisitors.add(checkNotNull(visitor));
    return this;
  }

  /**
   * Adds module visitors. May be called several times; the visitors of later calls run after the
   * visitors of earlier calls of the same kind.
   *
   * @throws RuleConfigurationException if {@code configure} registers no visitor
   */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withModuleVisitor(Consumer<ModuleRuleSchema<M>> configure) {
    ModuleRuleSchema<M> schema = new ModuleRuleSchema<>(name, null);
    configure.accept(schema);
    if (!schema.hasAtLeastOneVisitor()) {
      throw new RuleConfigurationException(name, "a module visitor registered no visitor");
    }
    moduleVisitors = moduleVisitors.concat(schema.freeze());
    return this;
  }

  /** Sets how module contexts are derived from and folded into the project context. */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withModuleContext(ContextBridge<P, M> bridge) {
    this.contextBridge = checkNotNull(bridge);
    return this;
  }

  /**
   * Visits modules in import order, each starting from the initial project context folded with
   * the contexts of the modules it imports.
   */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withContextFromImportedModules() {
    this.traversalMode = TraversalMode.IMPORT_ORDERED;
    return this;
  }

  /** Called once with the folded project context, after all modules were visited. */
  @CanIgnoreReturnValue
  public ProjectRuleSchema<P, M> withFinalProjectEvaluation(FinalEvaluation<P> evaluation) {
    finalEvaluations.add(checkNotNull(evaluation));
    return this;
  }

  /**
   * Builds the rule.
   *
   * @throws RuleConfigurationException if no visitor was registered, or if module visitors were
   *     registered without a {@link ContextBridge}
   */
  public Rule toRule() {
    boolean hasProjectVisitor =
        !manifestVisitors.isEmpty()
            || !readmeVisitors.isEmpty()
            || !dependenciesVisitors.isEmpty()
            || !directDependenciesVisitors.isEmpty()
            || !finalEvaluations.isEmpty();
    if (!hasProjectVisitor && moduleVisitors.isEmpty()) {
      throw new RuleConfigurationException(name, "no visitor was registered");
    }
    if (!moduleVisitors.isEmpty() && contextBridge == null) {
      throw new RuleConfigurationException(
          name, "module visitors need a context bridge, see withModuleContext");
    }
    return new Rule(
        new Rule.Definition<P, M>(
            name,
            initialProjectContext,
            ImmutableList.copyOf(manifestVisitors),
            ImmutableList.copyOf(readmeVisitors),
            ImmutableList.copyOf(dependenciesVisitors),
            ImmutableList.copyOf(directDependenciesVisitors),
            moduleVisitors,
            contextBridge,
            traversalMode,
            ImmutableList.copyOf(finalEvaluations)));
  }
}
