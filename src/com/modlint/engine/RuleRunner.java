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
import static com.google.common.base.Throwables.throwIfUnchecked;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.modlint.engine.ModuleRuleSchema.FinalEvaluation;
import com.modlint.engine.ProjectRuleSchema.ProjectVisitor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs rules over a {@link ValidProject}.
 *
 * <p>For each rule, in the order given: the project visitors run (manifest, readme, dependencies,
 * direct dependencies), then the module visitors over every module the rule applies to, then the
 * module contributions are folded into the project context and the final project evaluations run
 * on it.
 *
 * <p>Module results are looked up in, and stored into, the project's {@link AnalysisCache}. The
 * project returned in the {@link AnalysisResult} carries the cache of this run.
 */
public final class RuleRunner {
  private static final Logger logger = Logger.getLogger(RuleRunner.class.getName());

  private final AnalysisOptions options;

  private RuleRunner(AnalysisOptions options) {
    this.options = options;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RuleRunner}. */
  public static final class Builder {
    private AnalysisOptions options = new AnalysisOptions();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setOptions(AnalysisOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    public RuleRunner build() {
      return new RuleRunner(options);
    }
  }

  /**
   * Runs {@code rules} over {@code project}.
   *
   * @throws IllegalStateException if the project's import graph is stale
   * @throws IllegalArgumentException if two rules have the same name
   * @throws RuleException if a visitor throws
   */
  public AnalysisResult run(ValidProject project, List<Rule> rules) {
    checkState(
        !project.isGraphStale(), "The import graph changed; call ValidProject.recomputeGraph()");
    Set<String> names = new HashSet<>();
    for (Rule rule : rules) {
      checkArgument(names.add(rule.getName()), "Duplicate rule name %s", rule.getName());
    }

    boolean cacheEnabled = options.isCacheEnabled();
    int numThreads = options.getNumThreads();
    ImmutableList<SourceModule> modules = project.getModulesInImportOrder();
    AnalysisCache previousCache = cacheEnabled ? project.getCache() : AnalysisCache.EMPTY;
    AnalysisCache.Builder newCache = project.getCache().toBuilder();
    List<RuleError> errors = new ArrayList<>();
    Map<String, Object> projectContexts = new LinkedHashMap<>();

    @Nullable ListeningExecutorService executor = numThreads > 1 ? newExecutor(numThreads) : null;
    try {
      for (Rule rule : rules) {
        logger.fine("Running rule " + rule.getName());
        RuleRun<?, ?> run =
            new RuleRun<>(rule, rule.getDefinition(), project, modules, previousCache, executor);
        run.run();
        errors.addAll(run.errors);
        projectContexts.put(rule.getName(), run.finalContext);
        newCache.clearRule(rule.getName());
        if (cacheEnabled) {
          for (Map.Entry<ModuleKey, AnalysisCache.Entry> entry : run.cacheEntries.entrySet()) {
            newCache.put(
                rule.getName(), rule.getConfiguration(), entry.getKey(), entry.getValue());
          }
        }
      }
    } finally {
      if (executor != null) {
        executor.shutdown();
      }
    }

    ImmutableList<RuleError> sorted = RuleError.POSITION_ORDER.immutableSortedCopy(errors);
    logger.fine("Ran " + rules.size() + " rules, " + sorted.size() + " errors");
    return new AnalysisResult(
        sorted, project.withCache(newCache.build()), ImmutableMap.copyOf(projectContexts));
  }

  private static ListeningExecutorService newExecutor(int numThreads) {
    ThreadFactory threadFactory =
        r -> {
          Thread t = new Thread(r, "modlint-worker");
          t.setDaemon(true); // Do not prevent the JVM from exiting.
          return t;
        };
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            numThreads,
            numThreads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    return MoreExecutors.listeningDecorator(poolExecutor);
  }

  /** Phases of a rule run. Each phase only moves forward. */
  enum Phase {
    NOT_STARTED,
    VISITING_MODULE,
    FOLDING,
    FINAL_EVALUATION,
    DONE
  }

  /** What one module contributed, and the errors reported while visiting it. */
  private record ModuleResult<P>(P contribution, ImmutableList<RuleError> errors) {}

  /** The run of one rule. */
  private static final class RuleRun<P, M> {
    private final Rule rule;
    private final Rule.Definition<P, M> definition;
    private final ValidProject project;
    private final ImmutableList<SourceModule> modules;
    private final AnalysisCache previousCache;
    private final @Nullable ListeningExecutorService executor;

    private Phase phase = Phase.NOT_STARTED;
    private final List<RuleError> errors = new ArrayList<>();
    private final Map<ModuleKey, AnalysisCache.Entry> cacheEntries = new LinkedHashMap<>();
    private @Nullable P finalContext;

    RuleRun(
        Rule rule,
        Rule.Definition<P, M> definition,
        ValidProject project,
        ImmutableList<SourceModule> modules,
        AnalysisCache previousCache,
        @Nullable ListeningExecutorService executor) {
      this.rule = rule;
      this.definition = definition;
      this.project = project;
      this.modules = modules;
      this.previousCache = previousCache;
      this.executor = executor;
    }

    void run() {
      checkState(phase == Phase.NOT_STARTED, phase);
      RuleTraversal projectTraversal = RuleTraversal.forProject(definition.name, project);
      P seed = visitProject(projectTraversal);

      advance(Phase.NOT_STARTED, Phase.VISITING_MODULE);
      List<P> contributions = new ArrayList<>();
      if (!definition.moduleVisitors.isEmpty()) {
        ContextBridge<P, M> bridge = checkNotNull(definition.contextBridge);
        if (definition.traversalMode == TraversalMode.IMPORT_ORDERED) {
          visitInImportOrder(bridge, seed, contributions);
        } else {
          visitUnordered(bridge, seed, contributions);
        }
      }

      advance(Phase.VISITING_MODULE, Phase.FOLDING);
      P result = seed;
      if (definition.contextBridge != null) {
        for (P contribution : contributions) {
          result = definition.contextBridge.fold(result, contribution);
        }
      }
      finalContext = result;

      advance(Phase.FOLDING, Phase.FINAL_EVALUATION);
      for (FinalEvaluation<P> evaluation : definition.finalEvaluations) {
        try {
          evaluation.evaluate(projectTraversal, result);
        } catch (RuntimeException e) {
          throw new RuleException(definition.name, null, e);
        }
      }
      errors.addAll(projectTraversal.getErrors());
      advance(Phase.FINAL_EVALUATION, Phase.DONE);
    }

    private void advance(Phase from, Phase to) {
      checkState(
          phase == from, "Rule %s is in phase %s, expected %s", definition.name, phase, from);
      phase = to;
    }

    private P visitProject(RuleTraversal t) {
      P context = definition.initialProjectContext;
      context = visitAll(t, definition.manifestVisitors, project.getManifest(), context);
      context = visitAll(t, definition.readmeVisitors, project.getReadme(), context);
      context = visitAll(t, definition.dependenciesVisitors, project.getDependencies(), context);
      return visitAll(
          t, definition.directDependenciesVisitors, project.getDirectDependencies(), context);
    }

    private <T> P visitAll(
        RuleTraversal t,
        ImmutableList<ProjectVisitor<T, P>> visitors,
        @Nullable T value,
        P context) {
      for (ProjectVisitor<T, P> visitor : visitors) {
        try {
          context = checkNotNull(visitor.visit(t, value, context), "Visitor returned null");
        } catch (RuntimeException e) {
          throw new RuleException(definition.name, null, e);
        }
      }
      return context;
    }

    /**
     * Visits modules in topological order. A module starts from the seed folded with the outgoing
     * context of each module it imports, and its own outgoing context is that start folded with
     * its contribution.
     */
    private void visitInImportOrder(ContextBridge<P, M> bridge, P seed, List<P> contributions) {
      Map<ModuleName, P> outgoing = new HashMap<>();
      for (SourceModule module : modules) {
        if (!rule.appliesTo(module.getPath())) {
          continue;
        }
        P start = seed;
        for (ModuleName imported : module.getImports()) {
          P importedContext = outgoing.get(imported);
          if (importedContext != null) {
            start = bridge.fold(start, importedContext);
          }
        }
        P contribution = collect(module, start, visitModule(bridge, module, start));
        contributions.add(contribution);
        outgoing.put(module.getModuleName(), bridge.fold(start, contribution));
      }
    }

    /** Visits every module from the seed, on the executor if there is one. */
    private void visitUnordered(ContextBridge<P, M> bridge, P seed, List<P> contributions) {
      List<SourceModule> applicable = new ArrayList<>();
      for (SourceModule module : modules) {
        if (rule.appliesTo(module.getPath())) {
          applicable.add(module);
        }
      }

      List<ModuleResult<P>> results;
      if (executor == null || applicable.size() < 2) {
        results = new ArrayList<>();
        for (SourceModule module : applicable) {
          results.add(visitModule(bridge, module, seed));
        }
      } else {
        List<ListenableFuture<ModuleResult<P>>> futures = new ArrayList<>();
        for (SourceModule module : applicable) {
          futures.add(executor.submit(() -> visitModule(bridge, module, seed)));
        }
        try {
          results = Futures.allAsList(futures).get();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while running " + definition.name, e);
        } catch (ExecutionException e) {
          throwIfUnchecked(e.getCause());
          throw new RuleException(definition.name, null, e.getCause());
        }
      }

      for (int i = 0; i < applicable.size(); i++) {
        contributions.add(collect(applicable.get(i), seed, results.get(i)));
      }
    }

    /** Records the errors and cache entry of a module visit, on the calling thread. */
    private P collect(SourceModule module, P inputContext, ModuleResult<P> result) {
      errors.addAll(result.errors());
      cacheEntries.put(
          module.getKey(),
          new AnalysisCache.Entry(
              module.getFingerprint(), inputContext, result.contribution(), result.errors()));
      return result.contribution();
    }

    /** Visits one module, or reuses the cached result of a visit from the same inputs. */
    @SuppressWarnings("unchecked") // Entries of this rule only hold contributions of type P.
    private ModuleResult<P> visitModule(ContextBridge<P, M> bridge, SourceModule module, P input) {
      ModuleKey key = module.getKey();
      HashCode fingerprint = module.getFingerprint();
      AnalysisCache.Entry cached =
          previousCache.lookup(definition.name, rule.getConfiguration(), key, fingerprint, input);
      if (cached != null) {
        logger.fine("Cache hit for " + definition.name + " on " + module.getPath());
        return new ModuleResult<>((P) cached.contribution(), cached.errors());
      }
      logger.fine("Visiting " + module.getPath() + " with " + definition.name);

      RuleTraversal t = RuleTraversal.forModule(definition.name, project, module);
      P contribution;
      try {
        M context = bridge.toModuleContext(key, module.getModuleName(), input);
        context =
            ModuleTraversal.traverse(definition.moduleVisitors, t, module.getAst(), context);
        contribution =
            checkNotNull(
                bridge.toProjectContext(key, module.getModuleName(), context),
                "Null project context");
      } catch (RuntimeException e) {
        throw new RuleException(definition.name, module.getPath(), e);
      }
      return new ModuleResult<>(contribution, t.getErrors());
    }
  }
}
