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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.modlint.engine.ModuleRuleSchema.FinalEvaluation;
import com.modlint.engine.ModuleRuleSchema.ListVisitor;
import com.modlint.engine.ModuleRuleSchema.NodeVisitor;
import com.modlint.syntax.Node;

/**
 * Runs the module visitors of one rule over the tree of one module, threading the module context
 * through them in a fixed order.
 */
final class ModuleTraversal<M> {
  private final ModuleVisitors<M> visitors;
  private final RuleTraversal t;
  private M context;

  private ModuleTraversal(ModuleVisitors<M> visitors, RuleTraversal t, M context) {
    this.visitors = visitors;
    this.t = t;
    this.context = checkNotNull(context);
  }

  /** Traverses {@code module}, a MODULE node, and returns the final module context. */
  static <M> M traverse(ModuleVisitors<M> visitors, RuleTraversal t, Node module, M context) {
    checkState(module.isModule(), "Not a module: %s", module);
    ModuleTraversal<M> traversal = new ModuleTraversal<>(visitors, t, context);
    traversal.traverseModule(module);
    return traversal.context;
  }

  private void traverseModule(Node module) {
    visitNode(visitors.moduleDefinition, module.getModuleDeclaration());

    if (!visitors.comments.isEmpty()) {
      visitList(visitors.comments, module.getComments());
    }

    if (!visitors.imports.isEmpty()) {
      for (Node importNode : module.getImports()) {
        visitNode(visitors.imports, importNode);
      }
    }

    ImmutableList<Node> declarations = module.getDeclarations();
    visitList(visitors.declarationList, declarations);
    for (Node declaration : declarations) {
      visitNode(visitors.declarationEnter, declaration);
      if (visitors.hasExpressionVisitors()) {
        for (Node child : declaration.children()) {
          traverseBranch(child);
        }
      }
      visitNode(visitors.declarationExit, declaration);
    }

    for (FinalEvaluation<M> evaluation : visitors.finalEvaluation) {
      evaluation.evaluate(t, context);
    }
  }

  /**
   * Visits the expressions of a subtree. Nodes that are not expressions, such as parameters and
   * let bindings, are walked through without calling any visitor.
   */
  private void traverseBranch(Node n) {
    boolean isExpression = n.isExpression();
    if (isExpression) {
      visitNode(visitors.expressionEnter, n);
    }
    for (Node child : n.children()) {
      traverseBranch(child);
    }
    if (isExpression) {
      visitNode(visitors.expressionExit, n);
    }
  }

  private void visitNode(ImmutableList<NodeVisitor<M>> list, Node n) {
    for (NodeVisitor<M> visitor : list) {
      context = checkNotNull(visitor.visit(t, n, context), "Visitor returned a null context");
    }
  }

  private void visitList(ImmutableList<ListVisitor<M>> list, ImmutableList<Node> nodes) {
    for (ListVisitor<M> visitor : list) {
      context = checkNotNull(visitor.visit(t, nodes, context), "Visitor returned a null context");
    }
  }
}
