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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.modlint.engine.ModuleRuleSchema.FinalEvaluation;
import com.modlint.engine.ProjectRuleSchema.ProjectVisitor;
import java.util.Collection;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * A rule ready to run, built with {@link ModuleRuleSchema#toRule()} or {@link
 * ProjectRuleSchema#toRule()}. Rules are immutable; the filter methods return new rules.
 */
public final class Rule {
  private final Definition<?, ?> definition;

  /** Accepts the paths of the modules the rule visits. */
  private final Predicate<String> fileFilter;

  /**
   * Identifies this configuration in the {@link AnalysisCache}. Every rule instance, filtered
   * copies included, gets its own.
   */
  private final Object configuration = new Object();

  Rule(Definition<?, ?> definition) {
    this(definition, path -> true);
  }

  private Rule(Definition<?, ?> definition, Predicate<String> fileFilter) {
    this.definition = checkNotNull(definition);
    this.fileFilter = checkNotNull(fileFilter);
  }

  public String getName() {
    return definition.name;
  }

  public TraversalMode getTraversalMode() {
    return definition.traversalMode;
  }

  /** Whether the rule visits the module at {@code path}. */
  public boolean appliesTo(String path) {
    return fileFilter.test(path);
  }

  /** Returns a copy of this rule that only visits the modules whose path {@code filter} accepts. */
  public Rule withFilter(Predicate<String> filter) {
    checkNotNull(filter);
    return new Rule(definition, fileFilter.and(filter));
  }

  /** Returns a copy of this rule that does not visit the given files. */
  public Rule ignoreErrorsForFiles(Collection<String> paths) {
    ImmutableSet<String> ignored = ImmutableSet.copyOf(paths);
    return withFilter(path -> !ignored.contains(path));
  }

  /** Returns a copy of this rule that does not visit files under the given directories. */
  public Rule ignoreErrorsForDirectories(Collection<String> directories) {
    ImmutableList.Builder<String> prefixes = ImmutableList.builder();
    for (String directory : directories) {
      checkArgument(!directory.isEmpty(), "Empty directory");
      prefixes.add(directory.endsWith("/") ? directory : directory + "/");
    }
    ImmutableList<String> ignored = prefixes.build();
    return withFilter(path -> ignored.stream().noneMatch(path::startsWith));
  }

  Object getConfiguration() {
    return configuration;
  }

  Definition<?, ?> getDefinition() {
    return definition;
  }

  @Override
  public String toString() {
    return "Rule(" + definition.name + ", " + definition.traversalMode + ")";
  }

  /** Everything a schema registered, frozen. */
  static final class Definition<P, M> {
    final String name;
    final P initialProjectContext;
    final ImmutableList<ProjectVisitor<ProjectManifest, P>> manifestVisitors;
    final ImmutableList<ProjectVisitor<Readme, P>> readmeVisitors;
    final ImmutableList<ProjectVisitor<ImmutableMap<String, Dependency>, P>> dependenciesVisitors;
    final ImmutableList<ProjectVisitor<ImmutableMap<String, Dependency>, P>>
        directDependenciesVisitors;
    final ModuleVisitors<M> moduleVisitors;

    /** Non-null when there are module visitors. */
    final @Nullable ContextBridge<P, M> contextBridge;

    final TraversalMode traversalMode;
    final ImmutableList<FinalEvaluation<P>> finalEvaluations;

    Definition(
        String name,
        P initialProjectContext,
        ImmutableList<ProjectVisitor<ProjectManifest, P>> manifestVisitors,
        ImmutableList<ProjectVisitor<Readme, P>> readmeVisitors,
        ImmutableList<ProjectVisitor<ImmutableMap<String, Dependency>, P>> dependenciesVisitors,
        ImmutableList<ProjectVisitor<ImmutableMap<String, Dependency>, P>>
            directDependenciesVisitors,
        ModuleVisitors<M> moduleVisitors,
        @Nullable ContextBridge<P, M> contextBridge,
        TraversalMode traversalMode,
        ImmutableList<FinalEvaluation<P>> finalEvaluations) {
      this.name = name;
      this.initialProjectContext = initialProjectContext;
      this.manifestVisitors = manifestVisitors;
      this.readmeVisitors = readmeVisitors;
      this.dependenciesVisitors = dependenciesVisitors;
      this.directDependenciesVisitors = directDependenciesVisitors;
      this.moduleVisitors = moduleVisitors;
      this.contextBridge = contextBridge;
      this.traversalMode = traversalMode;
      this.finalEvaluations = finalEvaluations;
    }
  }
}
