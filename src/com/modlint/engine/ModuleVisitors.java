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
import com.modlint.engine.ModuleRuleSchema.FinalEvaluation;
import com.modlint.engine.ModuleRuleSchema.ListVisitor;
import com.modlint.engine.ModuleRuleSchema.NodeVisitor;

/** The frozen module visitors of a rule, each list in registration order. */
final class ModuleVisitors<M> {
  static final ModuleVisitors<Object> EMPTY =
      new ModuleVisitors<>(
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of());

  final ImmutableList<NodeVisitor<M>> moduleDefinition;
  final ImmutableList<ListVisitor<M>> comments;
  final ImmutableList<NodeVisitor<M>> imports;
  final ImmutableList<ListVisitor<M>> declarationList;
  final ImmutableList<NodeVisitor<M>> declarationEnter;
  final ImmutableList<NodeVisitor<M>> declarationExit;
  final ImmutableList<NodeVisitor<M>> expressionEnter;
  final ImmutableList<NodeVisitor<M>> expressionExit;
  final ImmutableList<FinalEvaluation<M>> finalEvaluation;

  ModuleVisitors(
      ImmutableList<NodeVisitor<M>> moduleDefinition,
      ImmutableList<ListVisitor<M>> comments,
      ImmutableList<NodeVisitor<M>> imports,
      ImmutableList<ListVisitor<M>> declarationList,
      ImmutableList<NodeVisitor<M>> declarationEnter,
      ImmutableList<NodeVisitor<M>> declarationExit,
      ImmutableList<NodeVisitor<M>> expressionEnter,
      ImmutableList<NodeVisitor<M>> expressionExit,
      ImmutableList<FinalEvaluation<M>> finalEvaluation) {
    this.moduleDefinition = moduleDefinition;
    this.comments = comments;
    this.imports = imports;
    this.declarationList = declarationList;
    this.declarationEnter = declarationEnter;
    this.declarationExit = declarationExit;
    this.expressionEnter = expressionEnter;
    this.expressionExit = expressionExit;
    this.finalEvaluation = finalEvaluation;
  }

  @SuppressWarnings("unchecked") // holds no M
  static <M> ModuleVisitors<M> empty() {
    return (ModuleVisitors<M>) EMPTY;
  }

  boolean isEmpty() {
    return moduleDefinition.isEmpty()
        && comments.isEmpty()
        && imports.isEmpty()
        && declarationList.isEmpty()
        && declarationEnter.isEmpty()
        && declarationExit.isEmpty()
        && expressionEnter.isEmpty()
        && expressionExit.isEmpty()
        && finalEvaluation.isEmpty();
  }

  boolean hasExpressionVisitors() {
    return !expressionEnter.isEmpty() || !expressionExit.isEmpty();
  }

  /** Returns the visitors of this followed by the visitors of {@code other}, list by list. */
  ModuleVisitors<M> concat(ModuleVisitors<M> other) {
    return new ModuleVisitors<>(
        concat(moduleDefinition, other.moduleDefinition),
        concat(comments, other.comments),
        concat(imports, other.imports),
        concat(declarationList, other.declarationList),
        concat(declarationEnter, other.declarationEnter),
        concat(declarationExit, other.declarationExit),
        concat(expressionEnter, other.expressionEnter),
        concat(expressionExit, other.expressionExit),
        concat(finalEvaluation, other.finalEvaluation));
  }

  private static <T> ImmutableList<T> concat(ImmutableList<T> first, ImmutableList<T> second) {
    return ImmutableList.<T>builder().addAll(first).addAll(second).build();
  }
}
