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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.modlint.syntax.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Describes what a rule looks at inside each module, and the context it carries while doing so.
 *
 * <p>Visitors are grouped by the part of the module they observe. Within a module they run in
 * this order: module definition, comments, imports (once per import, in source order), the
 * declaration list, then for each top-level declaration the declaration enter visitors, the
 * expression visitors over its expressions (enter before the children, exit after) and the
 * declaration exit visitors, and finally the final module evaluations. Visitors of the same kind
 * run in registration order, enter and exit alike.
 *
 * <p>Each context visitor receives the module context and returns the context the next visitor
 * will see. Errors are reported through the {@link RuleTraversal}.
 *
 * <pre>{@code
 * Rule rule =
 *     ModuleRuleSchema.create("NoDebug", ImmutableSet.<String>of())
 *         .withSimpleExpressionVisitor(
 *             (t, n) -> {
 *               if (n.isName() && n.getString().equals("Debug.log")) {
 *                 t.report(n, NO_DEBUG);
 *               }
 *             })
 *         .toRule();
 * }</pre>
 *
 * @param <M> the module context
 */
public final class ModuleRuleSchema<M> {

  /** Visits one node. */
  @FunctionalInterface
  public interface NodeVisitor<M> {
    M visit(RuleTraversal t, Node n, M context);
  }

  /** Visits one node, once on the way in and once on the way out. */
  @FunctionalInterface
  public interface DirectedNodeVisitor<M> {
    M visit(RuleTraversal t, Node n, Direction direction, M context);
  }

  /** Visits a list of nodes at once. */
  @FunctionalInterface
  public interface ListVisitor<M> {
    M visit(RuleTraversal t, ImmutableList<Node> nodes, M context);
  }

  /** A node visitor for rules without context. */
  @FunctionalInterface
  public interface SimpleNodeVisitor {
    void visit(RuleTraversal t, Node n);
  }

  /** A list visitor for rules without context. */
  @FunctionalInterface
  public interface SimpleListVisitor {
    void visit(RuleTraversal t, ImmutableList<Node> nodes);
  }

  /** Called once the context is complete. */
  @FunctionalInterface
  public interface FinalEvaluation<C> {
    void evaluate(RuleTraversal t, C context);
  }

  private final String name;
  private final @Nullable M initialContext;

  private final List<NodeVisitor<M>> moduleDefinitionVisitors = new ArrayList<>();
  private final List<ListVisitor<M>> commentsVisitors = new ArrayList<>();
  private final List<NodeVisitor<M>> importVisitors = new ArrayList<>();
  private final List<ListVisitor<M>> declarationListVisitors = new ArrayList<>();
  private final List<NodeVisitor<M>> declarationEnterVisitors = new ArrayList<>();
  private final List<NodeVisitor<M>> declarationExitVisitors = new ArrayList<>();
  private final List<NodeVisitor<M>> expressionEnterVisitors = new ArrayList<>();
  private final List<NodeVisitor<M>> expressionExitVisitors = new ArrayList<>();
  private final List<FinalEvaluation<M>> finalEvaluations = new ArrayList<>();
  private boolean hasAtLeastOneVisitor = false;

  /**
   * @param initialContext null for schemas built inside {@link
   *     ProjectRuleSchema#withModuleVisitor}, whose context comes from the project's {@link
   *     ContextBridge}
   */
  ModuleRuleSchema(String name, @Nullable M initialContext) {
    this.name = checkNotNull(name);
    this.initialContext = initialContext;
  }

  /**
   * Starts a rule that only looks at modules one at a time.
   *
   * @param initialContext the context every module starts from. It should have value semantics
   *     (for example an immutable collection) so that cached results can be reused.
   */
  public static <M> ModuleRuleSchema<M> create(String name, M initialContext) {
    return new ModuleRuleSchema<>(name, checkNotNull(initialContext));
  }

  public String getName() {
    return name;
  }

  /** Visits the module header: the MODULE_DECLARATION node. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withModuleDefinitionVisitor(NodeVisitor<M> visitor) {
    return add(moduleDefinitionVisitors, visitor);
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withSimpleModuleDefinitionVisitor(SimpleNodeVisitor visitor) {
    return withModuleDefinitionVisitor(simple(visitor));
  }

  /** Visits all the comments of the module at once. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withCommentsVisitor(ListVisitor<M> visitor) {
    return add(commentsVisitors, visitor);
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withSimpleCommentsVisitor(SimpleListVisitor visitor) {
    return withCommentsVisitor(simple(visitor));
  }

  /** Visits each IMPORT node. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withImportVisitor(NodeVisitor<M> visitor) {
    return add(importVisitors, visitor);
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withSimpleImportVisitor(SimpleNodeVisitor visitor) {
    return withImportVisitor(simple(visitor));
  }

  /** Visits all top-level declarations at once, before any of them is visited individually. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withDeclarationListVisitor(ListVisitor<M> visitor) {
    return add(declarationListVisitors, visitor);
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withSimpleDeclarationListVisitor(SimpleListVisitor visitor) {
    return withDeclarationListVisitor(simple(visitor));
  }

  /** Visits each top-level declaration before and after its expressions. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withDeclarationVisitor(DirectedNodeVisitor<M> visitor) {
    checkNotNull(visitor);
    add(
        declarationEnterVisitors,
        (t, n, context) -> visitor.visit(t, n, Direction.ENTER, context));
    return add(
        declarationExitVisitors, (t, n, context) -> visitor.visit(t, n, Direction.EXIT, context));
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withDeclarationEnterVisitor(NodeVisitor<M> visitor) {
    return add(declarationEnterVisitors, visitor);
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withDeclarationExitVisitor(NodeVisitor<M> visitor) {
    return add(declarationExitVisitors, visitor);
  }

  /** Visits each top-level declaration, on the way in. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withSimpleDeclarationVisitor(SimpleNodeVisitor visitor) {
    return withDeclarationEnterVisitor(simple(visitor));
  }

  /** Visits each expression before and after its sub-expressions. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withExpressionVisitor(DirectedNodeVisitor<M> visitor) {
    checkNotNull(visitor);
    add(
        expressionEnterVisitors,
        (t, n, context) -> visitor.visit(t, n, Direction.ENTER, context));
    return add(
        expressionExitVisitors, (t, n, context) -> visitor.visit(t, n, Direction.EXIT, context));
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withExpressionEnterVisitor(NodeVisitor<M> visitor) {
    return add(expressionEnterVisitors, visitor);
  }

  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withExpressionExitVisitor(NodeVisitor<M> visitor) {
    return add(expressionExitVisitors, visitor);
  }

  /** Visits each expression, on the way in. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withSimpleExpressionVisitor(SimpleNodeVisitor visitor) {
    return withExpressionEnterVisitor(simple(visitor));
  }

  /** Called with the final context of each module, after all other visitors. */
  @CanIgnoreReturnValue
  public ModuleRuleSchema<M> withFinalModuleEvaluation(FinalEvaluation<M> evaluation) {
    return add(finalEvaluations, evaluation);
  }

  private <T> ModuleRuleSchema<M> add(List<T> list, T visitor) {
    list.add(checkNotNull(visitor));
    hasAtLeastOneVisitor = true;
    return this;
  }

  private NodeVisitor<M> simple(SimpleNodeVisitor visitor) {
    checkNotNull(visitor);
    return (t, n, context) -> {
      visitor.visit(t, n);
      return context;
    };
  }

  private ListVisitor<M> simple(SimpleListVisitor visitor) {
    checkNotNull(visitor);
    return (t, nodes, context) -> {
      visitor.visit(t, nodes);
      return context;
    };
  }

  boolean hasAtLeastOneVisitor() {
    return hasAtLeastOneVisitor;
  }

  ModuleVisitors<M> freeze() {
    return new ModuleVisitors<>(
        ImmutableList.copyOf(moduleDefinitionVisitors),
        ImmutableList.copyOf(commentsVisitors),
        ImmutableList.copyOf(importVisitors),
        ImmutableList.copyOf(declarationListVisitors),
        ImmutableList.copyOf(declarationEnterVisitors),
        ImmutableList.copyOf(declarationExitVisitors),
        ImmutableList.copyOf(expressionEnterVisitors),
        ImmutableList.copyOf(expressionExitVisitors),
        ImmutableList.copyOf(finalEvaluations));
  }

  /**
   * Builds the rule. Every module starts from the initial context; the rule has no project
   * context of its own.
   *
   * @throws RuleConfigurationException if no visitor was registered
   */
  public Rule toRule() {
    if (!hasAtLeastOneVisitor) {
      throw new RuleConfigurationException(name, "no visitor was registered");
    }
    if (initialContext == null) {
      throw new RuleConfigurationException(
          name, "a module schema built for a project rule cannot be a rule on its own");
    }
    M initial = initialContext;
    ContextBridge<M, M> bridge =
        ContextBridge.create(
            (key, moduleName, projectContext) -> initial,
            (key, moduleName, moduleContext) -> moduleContext,
            (first, second) -> second);
    return new Rule(
        new Rule.Definition<M, M>(
            name,
            initial,
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.of(),
            ImmutableList.of(),
            freeze(),
            bridge,
            TraversalMode.UNORDERED,
            ImmutableList.of()));
  }
}
